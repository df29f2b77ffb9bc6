// ============================================================================
// File: src/main/java/com/lvglbridge/model/InteractionState.java
// ============================================================================

package com.lvglbridge.model;

import java.util.*;

public enum InteractionState {
    DEFAULT,
    PRESSED,
    CHECKED,
    FOCUSED,
    DISABLED;

    /** Order in which simultaneously active states are layered; later entries win. */
    public static final List<InteractionState> OVERLAY_ORDER = List.of(CHECKED, FOCUSED, PRESSED, DISABLED);

    /** Case-insensitive lookup; null for blank or unknown names. */
    public static InteractionState fromDialect(String s) {
        if (s == null || s.isBlank()) return null;
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
