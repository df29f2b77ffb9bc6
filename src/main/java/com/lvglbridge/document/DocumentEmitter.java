/*
 * =============================================================================
 *  LvglBridge Display Configuration Toolkit
 *  File: DocumentEmitter.java
 * -----------------------------------------------------------------------------
 *  Purpose:
 *      Walks a retained node graph and feeds SnakeYAML's Emitter, in the same
 *      event order as the stock Serializer (comments, anchors, aliases).
 *
 *  Notes:
 *      - The stock Serializer marks a scalar with a local tag (!secret, !lambda)
 *        as not implicit, and the Emitter then refuses plain style, so
 *        "!secret wifi_password" would come back single-quoted. Such scalars
 *        are emitted as a unique plain placeholder that is swapped for
 *        "!tag value" once the text is written.
 *      - Only values that are safe as plain text in any position get the
 *        placeholder; the rest keep the Emitter's own quoting.
 * =============================================================================
 */
package com.lvglbridge.document;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.comments.CommentLine;
import org.yaml.snakeyaml.emitter.Emitter;
import org.yaml.snakeyaml.events.AliasEvent;
import org.yaml.snakeyaml.events.CommentEvent;
import org.yaml.snakeyaml.events.DocumentEndEvent;
import org.yaml.snakeyaml.events.DocumentStartEvent;
import org.yaml.snakeyaml.events.ImplicitTuple;
import org.yaml.snakeyaml.events.MappingEndEvent;
import org.yaml.snakeyaml.events.MappingStartEvent;
import org.yaml.snakeyaml.events.ScalarEvent;
import org.yaml.snakeyaml.events.SequenceEndEvent;
import org.yaml.snakeyaml.events.SequenceStartEvent;
import org.yaml.snakeyaml.events.StreamEndEvent;
import org.yaml.snakeyaml.events.StreamStartEvent;
import org.yaml.snakeyaml.nodes.AnchorNode;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeId;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.resolver.Resolver;

import java.io.IOException;
import java.io.StringWriter;
import java.util.*;

final class DocumentEmitter {

    private static final String INDICATORS = "-?:,[]{}#&*!|>'\"%@`";
    private static final ImplicitTuple PLAIN_STR = new ImplicitTuple(true, true);

    private final DumperOptions options;
    private final Resolver resolver = new Resolver();

    // per emit() call
    private final Map<Node, String> anchors = new IdentityHashMap<>();
    private final Set<Node> emitted = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Map<String, String> placeholders = new LinkedHashMap<>();
    private String placeholderPrefix;
    private int anchorCount;
    private Emitter emitter;

    DocumentEmitter(DumperOptions options) {
        this.options = options;
    }

    synchronized String emit(Node root) throws IOException {
        anchors.clear();
        emitted.clear();
        placeholders.clear();
        anchorCount = 0;
        placeholderPrefix = "lvglbridgetag" + UUID.randomUUID().toString().replace("-", "") + "x";

        StringWriter out = new StringWriter();
        emitter = new Emitter(out, options);
        emitter.emit(new StreamStartEvent(null, null));
        emitter.emit(new DocumentStartEvent(null, null, options.isExplicitStart(), options.getVersion(), options.getTags()));
        assignAnchors(root);
        emitNode(root);
        emitter.emit(new DocumentEndEvent(null, null, options.isExplicitEnd()));
        emitter.emit(new StreamEndEvent(null, null));
        emitter = null;

        String text = out.toString();
        for (Map.Entry<String, String> e : placeholders.entrySet()) {
            text = text.replace(e.getKey(), e.getValue());
        }
        return text;
    }

    /** Nodes reached more than once get an anchor; the source name is kept when it had one. */
    private void assignAnchors(Node node) {
        node = real(node);
        if (anchors.containsKey(node)) {
            if (anchors.get(node) == null) {
                anchors.put(node, node.getAnchor() != null ? node.getAnchor() : "id" + String.format("%03d", ++anchorCount));
            }
            return;
        }
        anchors.put(node, null);
        if (node instanceof SequenceNode seq) {
            for (Node item : seq.getValue()) assignAnchors(item);
        } else if (node instanceof MappingNode map) {
            for (NodeTuple t : map.getValue()) {
                assignAnchors(t.getKeyNode());
                assignAnchors(t.getValueNode());
            }
        }
    }

    private void emitNode(Node node) throws IOException {
        node = real(node);
        String anchor = anchors.get(node);
        if (!emitted.add(node)) {
            emitter.emit(new AliasEvent(anchor, null, null));
            return;
        }
        if (node instanceof ScalarNode scalar) {
            emitComments(node.getBlockComments());
            emitScalar(scalar, anchor);
            emitComments(node.getInLineComments());
            emitComments(node.getEndComments());
        } else if (node instanceof SequenceNode seq) {
            emitComments(node.getBlockComments());
            boolean implicit = node.getTag().equals(resolver.resolve(NodeId.sequence, null, true));
            emitter.emit(new SequenceStartEvent(anchor, node.getTag().getValue(), implicit,
                    null, null, seq.getFlowStyle()));
            for (Node item : seq.getValue()) emitNode(item);
            emitter.emit(new SequenceEndEvent(null, null));
            emitComments(node.getInLineComments());
            emitComments(node.getEndComments());
        } else if (node instanceof MappingNode map) {
            emitComments(node.getBlockComments());
            boolean implicit = node.getTag().equals(resolver.resolve(NodeId.mapping, null, true));
            emitter.emit(new MappingStartEvent(anchor, node.getTag().getValue(), implicit,
                    null, null, map.getFlowStyle()));
            for (NodeTuple t : map.getValue()) {
                emitNode(t.getKeyNode());
                emitNode(t.getValueNode());
            }
            emitter.emit(new MappingEndEvent(null, null));
            emitComments(node.getInLineComments());
            emitComments(node.getEndComments());
        }
    }

    private void emitScalar(ScalarNode node, String anchor) throws IOException {
        Tag tag = node.getTag();
        String value = node.getValue();
        if (node.getScalarStyle() == DumperOptions.ScalarStyle.PLAIN && isLocal(tag) && plainSafe(value)) {
            String placeholder = placeholderPrefix + placeholders.size() + "z";
            placeholders.put(placeholder, tag.getValue() + " " + value);
            emitter.emit(new ScalarEvent(anchor, Tag.STR.getValue(), PLAIN_STR, placeholder,
                    null, null, DumperOptions.ScalarStyle.PLAIN));
            return;
        }
        Tag detected = resolver.resolve(NodeId.scalar, value, true);
        Tag byDefault = resolver.resolve(NodeId.scalar, value, false);
        ImplicitTuple implicit = new ImplicitTuple(tag.equals(detected), tag.equals(byDefault));
        emitter.emit(new ScalarEvent(anchor, tag.getValue(), implicit, value,
                null, null, node.getScalarStyle()));
    }

    private void emitComments(List<CommentLine> comments) throws IOException {
        if (comments == null) return;
        for (CommentLine line : comments) {
            emitter.emit(new CommentEvent(line.getCommentType(), line.getValue(), line.getStartMark(), line.getEndMark()));
        }
    }

    private static Node real(Node node) {
        return node instanceof AnchorNode a ? a.getRealNode() : node;
    }

    /** Application tags such as {@code !secret}; not {@code !!str} and friends. */
    private static boolean isLocal(Tag tag) {
        String t = tag.getValue();
        return t.startsWith("!") && !t.startsWith("!!") && t.length() > 1;
    }

    /** Text that reads back as the same plain scalar in block and flow context. */
    static boolean plainSafe(String value) {
        if (value == null || value.isEmpty()) return false;
        if (!value.equals(value.strip())) return false;
        if (INDICATORS.indexOf(value.charAt(0)) >= 0) return false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\n' || c == '\r' || c == '\t' || c == ',' || c == '[' || c == ']'
                    || c == '{' || c == '}' || Character.isISOControl(c)) {
                return false;
            }
        }
        return !value.contains(": ") && !value.contains(" #") && !value.endsWith(":");
    }
}
