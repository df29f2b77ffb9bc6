// ============================================================================
// File: src/main/java/com/lvglbridge/model/WidgetTree.java
// ============================================================================

package com.lvglbridge.model;

import java.util.*;
import java.util.function.Consumer;

/**
 * Editor-side mutations over a widget forest. Operates in place on the root list it wraps,
 * so the same list can be handed straight to {@code YamlEngine.generate}.
 * <p>
 * A {@code null} parent id means the forest root.
 */
public final class WidgetTree {

    private final List<WidgetNode> roots;

    public WidgetTree() {
        this(new ArrayList<>());
    }

    public WidgetTree(List<WidgetNode> roots) {
        this.roots = Objects.requireNonNull(roots, "roots");
    }

    public List<WidgetNode> roots() {
        return roots;
    }

    public Optional<WidgetNode> find(String id) {
        return Optional.ofNullable(find(roots, id));
    }

    /** First widget in pre-order whose dialect id ({@code name}) matches. */
    public Optional<WidgetNode> findByName(String name) {
        for (WidgetNode w : flatten()) {
            if (Objects.equals(w.getName(), name)) return Optional.of(w);
        }
        return Optional.empty();
    }

    /** @throws IllegalArgumentException for an unknown parent or an id already in the tree */
    public void add(String parentId, WidgetNode widget) {
        List<WidgetNode> siblings = childList(parentId);
        requireFreshIds(Objects.requireNonNull(widget, "widget"));
        siblings.add(widget);
    }

    /** Inserts at {@code index}, clamped to the valid range. Ids must be new to the tree. */
    public void insert(String parentId, WidgetNode widget, int index) {
        List<WidgetNode> siblings = childList(parentId);
        requireFreshIds(Objects.requireNonNull(widget, "widget"));
        siblings.add(clamp(index, siblings.size()), widget);
    }

    /** @return false when no widget has this id */
    public boolean update(String id, Consumer<WidgetNode> change) {
        WidgetNode w = find(roots, id);
        if (w == null) return false;
        change.accept(w);
        return true;
    }

    /** Detaches the widget with its subtree; null when not found. */
    public WidgetNode remove(String id) {
        return remove(roots, id);
    }

    /**
     * Moves a widget under a new parent at {@code index}, counted after the widget has been
     * detached from its old position.
     *
     * @throws IllegalArgumentException for an unknown id or parent, or when the new parent
     *                                  is the widget itself or one of its descendants
     */
    public void move(String id, String newParentId, int index) {
        WidgetNode w = find(roots, id);
        if (w == null) {
            throw new IllegalArgumentException("No widget with id " + id);
        }
        if (newParentId != null) {
            if (newParentId.equals(id) || find(w.getChildren(), newParentId) != null) {
                throw new IllegalArgumentException("Cannot move " + id + " into its own subtree");
            }
            if (find(roots, newParentId) == null) {
                throw new IllegalArgumentException("No parent widget with id " + newParentId);
            }
        }
        remove(roots, id);
        List<WidgetNode> siblings = childList(newParentId);
        siblings.add(clamp(index, siblings.size()), w);
    }

    /** All widgets in pre-order (parent before children, siblings in order). */
    public List<WidgetNode> flatten() {
        List<WidgetNode> out = new ArrayList<>();
        flatten(roots, out);
        return out;
    }

    public int size() {
        return flatten().size();
    }

    // ---- internals ----

    private List<WidgetNode> childList(String parentId) {
        if (parentId == null) return roots;
        WidgetNode parent = find(roots, parentId);
        if (parent == null) {
            throw new IllegalArgumentException("No parent widget with id " + parentId);
        }
        return parent.getChildren();
    }

    private void requireFreshIds(WidgetNode widget) {
        List<WidgetNode> subtree = new ArrayList<>();
        subtree.add(widget);
        flatten(widget.getChildren(), subtree);
        Set<String> seen = new HashSet<>();
        for (WidgetNode n : subtree) {
            if (!seen.add(n.getId()) || find(roots, n.getId()) != null) {
                throw new IllegalArgumentException("Duplicate widget id " + n.getId());
            }
        }
    }

    private static WidgetNode find(List<WidgetNode> nodes, String id) {
        for (WidgetNode n : nodes) {
            if (n.getId().equals(id)) return n;
            WidgetNode found = find(n.getChildren(), id);
            if (found != null) return found;
        }
        return null;
    }

    private static WidgetNode remove(List<WidgetNode> nodes, String id) {
        for (int i = 0; i < nodes.size(); i++) {
            WidgetNode n = nodes.get(i);
            if (n.getId().equals(id)) {
                return nodes.remove(i);
            }
            WidgetNode removed = remove(n.getChildren(), id);
            if (removed != null) return removed;
        }
        return null;
    }

    private static void flatten(List<WidgetNode> nodes, List<WidgetNode> out) {
        for (WidgetNode n : nodes) {
            out.add(n);
            flatten(n.getChildren(), out);
        }
    }

    private static int clamp(int index, int size) {
        return Math.max(0, Math.min(index, size));
    }
}
