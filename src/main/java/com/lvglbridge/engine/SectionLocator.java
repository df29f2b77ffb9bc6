// ============================================================================
// File: src/main/java/com/lvglbridge/engine/SectionLocator.java
// ============================================================================

package com.lvglbridge.engine;

import com.lvglbridge.document.DocNodes;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.SequenceNode;

import java.util.*;

/**
 * Depth-first search for the dialect section key ({@code lvgl} by default) anywhere in the
 * document. Checks a mapping's own keys before descending into its values; nodes reached
 * again through aliases are skipped.
 */
final class SectionLocator {

    /** Where the section was found: the owning mapping and the section value (may be a null scalar). */
    record Location(MappingNode owner, Node section) {}

    private final String key;
    private final int maxDepth;

    SectionLocator(String key, int maxDepth) {
        this.key = key;
        this.maxDepth = maxDepth;
    }

    Location locate(Node root) {
        return search(root, 0, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private Location search(Node node, int depth, Set<Node> visited) {
        if (node == null || depth > maxDepth || !visited.add(node)) return null;
        if (node instanceof MappingNode m) {
            if (DocNodes.has(m, key)) {
                return new Location(m, DocNodes.get(m, key));
            }
            for (NodeTuple t : m.getValue()) {
                Location found = search(t.getValueNode(), depth + 1, visited);
                if (found != null) return found;
            }
        } else if (node instanceof SequenceNode s) {
            for (Node item : s.getValue()) {
                Location found = search(item, depth + 1, visited);
                if (found != null) return found;
            }
        }
        return null;
    }
}
