// ============================================================================
// File: src/main/java/com/lvglbridge/engine/WidgetSource.java
// ============================================================================

package com.lvglbridge.engine;

import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;

import java.util.*;

/**
 * Where a parsed widget came from, so the serializer can merge into the retained nodes
 * instead of rebuilding them.
 *
 * @param item            the list item ({@code - btn: {...}}), or the props mapping itself for plain pages
 * @param tag             dialect key used for the type, null for plain pages
 * @param props           the props value (mapping, null-scalar or label text scalar)
 * @param consumed        props keys the parser read; only these may be removed on write
 * @param itemActionKeys  {@code on_*} keys found next to the type key rather than inside props
 * @param plain           page written as a plain mapping under {@code pages:}
 */
record WidgetSource(
        MappingNode item,
        String tag,
        Node props,
        Set<String> consumed,
        Set<String> itemActionKeys,
        boolean plain
) {
}
