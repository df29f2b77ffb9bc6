/*
 * =============================================================================
 *  LvglBridge Display Configuration Toolkit
 *  File: DocNodes.java
 * -----------------------------------------------------------------------------
 *  Purpose:
 *      Key-level access and mutation helpers over SnakeYAML nodes:
 *        has / get / set / delete on mappings, ordered items on sequences,
 *        raw values on scalars, structural equivalence and key-level merge.
 *
 *  Rules for set/merge:
 *      - An existing key keeps its key node and position.
 *      - A replaced value inherits the comments of the value it replaces.
 *      - An equivalent value keeps the original node (quoting, tags, comments).
 * =============================================================================
 */
package com.lvglbridge.document;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.comments.CommentLine;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;

import java.util.*;

public final class DocNodes {

    private static final int MAX_COMPARE_DEPTH = 64;

    private DocNodes() {}

    // ---- reading ----

    public static boolean isMapping(Node node) {
        return node instanceof MappingNode;
    }

    public static boolean isSequence(Node node) {
        return node instanceof SequenceNode;
    }

    public static String keyOf(NodeTuple tuple) {
        return tuple.getKeyNode() instanceof ScalarNode s ? s.getValue() : null;
    }

    public static List<String> keys(Node node) {
        List<String> out = new ArrayList<>();
        if (node instanceof MappingNode m) {
            for (NodeTuple t : m.getValue()) {
                String k = keyOf(t);
                if (k != null) out.add(k);
            }
        }
        return out;
    }

    public static boolean has(Node node, String key) {
        return findTuple(node, key) >= 0;
    }

    public static Node get(Node node, String key) {
        int i = findTuple(node, key);
        return i < 0 ? null : ((MappingNode) node).getValue().get(i).getValueNode();
    }

    /** Raw scalar text, or null for non-scalars and explicit nulls ({@code key:}, {@code ~}). */
    public static String scalar(Node node) {
        if (!(node instanceof ScalarNode s)) return null;
        if (Tag.NULL.equals(s.getTag())) return null;
        return s.getValue();
    }

    public static String text(Node node, String key) {
        return scalar(get(node, key));
    }

    public static List<Node> items(Node node) {
        return node instanceof SequenceNode s ? s.getValue() : List.of();
    }

    // ---- writing ----

    public static void set(MappingNode map, String key, Node value) {
        List<NodeTuple> tuples = map.getValue();
        int i = findTuple(map, key);
        if (i < 0) {
            tuples.add(new NodeTuple(keyNode(key), value));
            return;
        }
        NodeTuple old = tuples.get(i);
        if (old.getValueNode() == value) return;
        carryComments(old.getValueNode(), value);
        tuples.set(i, new NodeTuple(old.getKeyNode(), value));
    }

    /** Renames the first tuple with {@code key}; comments on the old key node move to the new one. */
    public static boolean rename(MappingNode map, String key, String newKey) {
        List<NodeTuple> tuples = map.getValue();
        int i = findTuple(map, key);
        if (i < 0) return false;
        NodeTuple old = tuples.get(i);
        ScalarNode renamed = keyNode(newKey);
        carryComments(old.getKeyNode(), renamed);
        tuples.set(i, new NodeTuple(renamed, old.getValueNode()));
        return true;
    }

    /** Removes every tuple with this key. Returns true if anything was removed. */
    public static boolean delete(MappingNode map, String key) {
        return map.getValue().removeIf(t -> key.equals(keyOf(t)));
    }

    /** Replaces the items of a retained sequence in place (keeps its comments) and forces block style. */
    public static void replaceItems(SequenceNode seq, List<Node> items) {
        List<Node> copy = new ArrayList<>(items);
        seq.getValue().clear();
        seq.getValue().addAll(copy);
        seq.setFlowStyle(DumperOptions.FlowStyle.BLOCK);
    }

    public static ScalarNode keyNode(String key) {
        return new ScalarNode(Tag.STR, key, null, null, DumperOptions.ScalarStyle.PLAIN);
    }

    public static MappingNode newMapping(List<NodeTuple> tuples) {
        return new MappingNode(Tag.MAP, tuples, DumperOptions.FlowStyle.BLOCK);
    }

    public static SequenceNode newSequence(List<Node> items) {
        return new SequenceNode(Tag.SEQ, items, DumperOptions.FlowStyle.BLOCK);
    }

    public static MappingNode mappingOf(Map<String, Node> values) {
        List<NodeTuple> tuples = new ArrayList<>();
        values.forEach((k, v) -> tuples.add(new NodeTuple(keyNode(k), v)));
        return newMapping(tuples);
    }

    /**
     * Merges values into target in place.
     * Keys in {@code values} are set (equivalent values keep the old node); keys in
     * {@code managed} that are absent from {@code values} are deleted; all other keys are
     * left untouched. New keys are appended in the iteration order of {@code values}.
     *
     * @return the keys written
     */
    public static Set<String> merge(MappingNode target, Map<String, Node> values, Collection<String> managed) {
        Set<String> written = new LinkedHashSet<>();
        List<NodeTuple> out = new ArrayList<>(target.getValue().size() + values.size());
        for (NodeTuple t : target.getValue()) {
            String k = keyOf(t);
            if (k != null && values.containsKey(k)) {
                if (!written.add(k)) continue; // duplicate key, first one wins
                Node replacement = values.get(k);
                if (equivalent(t.getValueNode(), replacement)) {
                    out.add(t);
                } else {
                    carryComments(t.getValueNode(), replacement);
                    out.add(new NodeTuple(t.getKeyNode(), replacement));
                }
            } else if (k == null || !managed.contains(k)) {
                out.add(t);
            }
        }
        for (Map.Entry<String, Node> e : values.entrySet()) {
            if (written.add(e.getKey())) {
                out.add(new NodeTuple(keyNode(e.getKey()), e.getValue()));
            }
        }
        target.setValue(out);
        return written;
    }

    /**
     * Structural equality: scalars by text (tags ignored), mappings by ordered keys and
     * values, sequences item by item.
     */
    public static boolean equivalent(Node a, Node b) {
        return equivalent(a, b, 0, new HashSet<>());
    }

    private static boolean equivalent(Node a, Node b, int depth, Set<Node> seen) {
        if (a == b) return true;
        if (a == null || b == null || depth > MAX_COMPARE_DEPTH) return false;
        if (a instanceof ScalarNode sa && b instanceof ScalarNode sb) {
            return sa.getValue().equals(sb.getValue());
        }
        if (!seen.add(a)) return false;
        try {
            return containersEquivalent(a, b, depth, seen);
        } finally {
            seen.remove(a);
        }
    }

    private static boolean containersEquivalent(Node a, Node b, int depth, Set<Node> seen) {
        if (a instanceof SequenceNode qa && b instanceof SequenceNode qb) {
            List<Node> la = qa.getValue();
            List<Node> lb = qb.getValue();
            if (la.size() != lb.size()) return false;
            for (int i = 0; i < la.size(); i++) {
                if (!equivalent(la.get(i), lb.get(i), depth + 1, seen)) return false;
            }
            return true;
        }
        if (a instanceof MappingNode ma && b instanceof MappingNode mb) {
            List<NodeTuple> ta = ma.getValue();
            List<NodeTuple> tb = mb.getValue();
            if (ta.size() != tb.size()) return false;
            for (int i = 0; i < ta.size(); i++) {
                if (!equivalent(ta.get(i).getKeyNode(), tb.get(i).getKeyNode(), depth + 1, seen)) return false;
                if (!equivalent(ta.get(i).getValueNode(), tb.get(i).getValueNode(), depth + 1, seen)) return false;
            }
            return true;
        }
        return false;
    }

    // ---- internals ----

    private static int findTuple(Node node, String key) {
        if (!(node instanceof MappingNode m)) return -1;
        List<NodeTuple> tuples = m.getValue();
        for (int i = 0; i < tuples.size(); i++) {
            if (key.equals(keyOf(tuples.get(i)))) return i;
        }
        return -1;
    }

    private static void carryComments(Node from, Node to) {
        if (from == null || to == null) return;
        if (isEmpty(to.getInLineComments())) to.setInLineComments(from.getInLineComments());
        if (isEmpty(to.getBlockComments())) to.setBlockComments(from.getBlockComments());
        if (isEmpty(to.getEndComments())) to.setEndComments(from.getEndComments());
    }

    private static boolean isEmpty(List<CommentLine> comments) {
        return comments == null || comments.isEmpty();
    }
}
