// ============================================================================
// File: src/main/java/com/lvglbridge/model/StyleReference.java
// ============================================================================

package com.lvglbridge.model;

/**
 * A widget's pointer to a global style and/or an inline override, scoped to an
 * interaction state. Any component may be null; a null state means DEFAULT.
 */
public record StyleReference(String styleId, InteractionState state, StyleProperties styles) {

    public static StyleReference of(String styleId) {
        return new StyleReference(styleId, null, null);
    }

    public static StyleReference of(String styleId, InteractionState state) {
        return new StyleReference(styleId, state, null);
    }

    public InteractionState effectiveState() {
        return state == null ? InteractionState.DEFAULT : state;
    }

    public boolean isDefaultState() {
        return state == null || state == InteractionState.DEFAULT;
    }

    public boolean hasInlineStyles() {
        return styles != null && !styles.isEmpty();
    }

    /** Written as a bare style name: no state, no inline overrides. */
    public boolean isBare() {
        return styleId != null && isDefaultState() && !hasInlineStyles();
    }
}
