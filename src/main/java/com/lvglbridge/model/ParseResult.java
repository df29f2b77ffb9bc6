// ============================================================================
// File: src/main/java/com/lvglbridge/model/ParseResult.java
// ============================================================================

package com.lvglbridge.model;

import java.util.*;

/**
 * Output of a parse: widget roots plus the side tables. Maps keep document order.
 * Collections are the engine's own copies; the editor may mutate the widgets freely.
 */
public record ParseResult(
        List<WidgetNode> widgets,
        List<Asset> assets,
        Map<String, String> substitutions,
        Map<String, StyleProperties> globalStyles
) {

    public static ParseResult empty() {
        return new ParseResult(List.of(), List.of(), Collections.unmodifiableMap(new LinkedHashMap<>()),
                Collections.unmodifiableMap(new LinkedHashMap<>()));
    }

    public boolean hasWidgets() {
        return widgets != null && !widgets.isEmpty();
    }
}
