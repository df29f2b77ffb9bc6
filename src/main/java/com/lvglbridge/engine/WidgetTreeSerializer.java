/*
 * =============================================================================
 *  LvglBridge Display Configuration Toolkit
 *  File: WidgetTreeSerializer.java
 * -----------------------------------------------------------------------------
 *  Purpose:
 *      Writes the widget tree back into the retained document.
 *
 *  Rules:
 *      - A widget with a source binding is merged into its old props mapping:
 *        only keys the parser consumed can disappear, unknown keys stay, and
 *        a value that reads back unchanged keeps its original node.
 *      - The dialect tag is reused while the type is unchanged.
 *      - PAGE roots go under pages: as plain mappings, other roots under
 *        widgets:. List items that never became widgets keep their place.
 *      - Default geometry (x/y 0, size content) is only written when the key
 *        was already there.
 * =============================================================================
 */
package com.lvglbridge.engine;

import com.lvglbridge.codec.DimensionCodec;
import com.lvglbridge.codec.GridTrackCodec;
import com.lvglbridge.config.EngineConfig;
import com.lvglbridge.document.ConfigDocument;
import com.lvglbridge.document.DocNodes;
import com.lvglbridge.model.Dimension;
import com.lvglbridge.model.LayoutDescriptor;
import com.lvglbridge.model.LayoutDescriptor.LayoutType;
import com.lvglbridge.model.StyleProperties;
import com.lvglbridge.model.StyleProperty;
import com.lvglbridge.model.StyleReference;
import com.lvglbridge.model.WidgetNode;
import com.lvglbridge.model.WidgetType;
import com.lvglbridge.style.StyleResolver;
import com.lvglbridge.substitution.SubstitutionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;

import java.util.*;
import java.util.function.Function;

import static com.lvglbridge.engine.WidgetTreeParser.CHILD_KEYS;
import static com.lvglbridge.engine.WidgetTreeParser.GRID_COLUMN_KEYS;
import static com.lvglbridge.engine.WidgetTreeParser.GRID_ROW_KEYS;
import static com.lvglbridge.engine.WidgetTreeParser.PAGES;
import static com.lvglbridge.engine.WidgetTreeParser.WIDGETS;

final class WidgetTreeSerializer {

    private static final Logger log = LoggerFactory.getLogger(WidgetTreeSerializer.class);

    private static final List<String> SECTION_KEYS = List.of(PAGES, WIDGETS);
    private static final List<String> LAYOUT_KEYS = List.of("type", "flex_flow", "flex_align_main",
            "flex_align_cross", "flex_align_track", "flex_grow", "grid_columns", "grid_dsc_cols",
            "grid_rows", "grid_dsc_rows", "pad_row", "pad_column");
    private static final List<String> RANGE_KEYS = List.of("min", "max");

    private final EngineConfig config;
    private final ConfigDocument doc;
    private final SubstitutionTable subs;
    private final StyleResolver styles;
    private final Map<String, WidgetSource> previous;
    private final Set<Node> boundItems = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Map<String, WidgetSource> written = new LinkedHashMap<>();

    WidgetTreeSerializer(EngineConfig config, ConfigDocument doc, SubstitutionTable subs,
                         StyleResolver styles, Map<String, WidgetSource> previous) {
        this.config = config;
        this.doc = doc;
        this.subs = subs;
        this.styles = styles;
        this.previous = new LinkedHashMap<>(previous);
        for (WidgetSource s : previous.values()) boundItems.add(s.item());
    }

    /** Bindings for the widgets just written, keyed by widget id. */
    Map<String, WidgetSource> bindings() {
        return written;
    }

    /**
     * Writes style definitions and the root widgets into the dialect section, appending a new
     * section to {@code root} when the document has none.
     */
    void writeSection(MappingNode root, List<WidgetNode> roots, Map<String, StyleProperties> globalStyles) {
        String key = config.getSectionKey();
        SectionLocator.Location loc = new SectionLocator(key, config.getMaxDepth()).locate(root);
        Node section;
        if (loc == null) {
            log.debug("No '{}' section, appending one", key);
            section = DocNodes.newMapping(new ArrayList<>());
            DocNodes.set(root, key, section);
        } else {
            section = loc.section();
        }

        if (section instanceof SequenceNode seq) {
            if (globalStyles != null && !globalStyles.isEmpty()) {
                log.warn("'{}' is a plain widget list; style definitions not written", key);
            }
            List<Node> items = new ArrayList<>();
            for (WidgetNode w : roots) items.add(writeWidget(w, false));
            Node list = listNode(seq, items);
            if (list == null) DocNodes.replaceItems(seq, List.of());
            return;
        }
        if (!(section instanceof MappingNode)) {
            section = DocNodes.newMapping(new ArrayList<>());
            DocNodes.set(loc.owner(), key, section);
        }
        MappingNode m = (MappingNode) section;

        Node defs = styles.writeDefinitions(globalStyles, DocNodes.get(m, StyleResolver.DEFINITIONS_KEY), doc);
        if (defs == null) {
            DocNodes.delete(m, StyleResolver.DEFINITIONS_KEY);
        } else {
            DocNodes.set(m, StyleResolver.DEFINITIONS_KEY, defs);
        }

        if (writeSingleWidgetSection(m, roots)) return;

        boolean usePages = DocNodes.has(m, PAGES) || roots.stream().anyMatch(w -> w.getType() == WidgetType.PAGE);
        List<Node> pageItems = new ArrayList<>();
        List<Node> widgetItems = new ArrayList<>();
        for (WidgetNode w : roots) {
            if (usePages && w.getType() == WidgetType.PAGE) {
                pageItems.add(writeWidget(w, true));
            } else {
                widgetItems.add(writeWidget(w, false));
            }
        }
        Map<String, Node> values = new LinkedHashMap<>();
        putIfPresent(values, PAGES, listNode(DocNodes.get(m, PAGES), pageItems));
        putIfPresent(values, WIDGETS, listNode(DocNodes.get(m, WIDGETS), widgetItems));
        DocNodes.merge(m, values, SECTION_KEYS);
    }

    /**
     * {@code lvgl: {obj: {...}}}: merged in place while it still holds exactly that one root;
     * otherwise the old widget keys are removed and the roots are listed normally.
     */
    private boolean writeSingleWidgetSection(MappingNode section, List<WidgetNode> roots) {
        String boundId = null;
        for (Map.Entry<String, WidgetSource> e : previous.entrySet()) {
            if (e.getValue().item() == section && !e.getValue().plain()) boundId = e.getKey();
        }
        if (boundId == null) return false;
        if (roots.size() == 1 && roots.get(0).getId().equals(boundId)) {
            writeWidget(roots.get(0), false);
            return true;
        }
        WidgetSource old = previous.remove(boundId);
        DocNodes.delete(section, old.tag());
        for (String k : old.itemActionKeys()) DocNodes.delete(section, k);
        return false;
    }

    // ---- widgets ----

    private Node writeWidget(WidgetNode w, boolean plain) {
        WidgetSource src = previous.get(w.getId());
        MappingNode props = src != null && src.props() instanceof MappingNode pm ? pm : null;
        Set<String> consumed = src != null ? src.consumed() : Set.of();
        boolean keepItem = src != null && !src.plain() && !plain;
        Set<String> itemActionKeys = keepItem ? src.itemActionKeys() : Set.of();

        Map<String, Node> values = new LinkedHashMap<>();
        Map<String, Node> itemValues = new LinkedHashMap<>();
        writeProps(w, props, consumed, values);
        writeActions(w, props, keepItem ? src.item() : null, itemActionKeys, values, itemValues);
        writeChildren(w, props, consumed, values);

        MappingNode target = props != null ? props : DocNodes.newMapping(new ArrayList<>());
        Set<String> writtenKeys = DocNodes.merge(target, values, consumed);
        Set<String> nowConsumed = new LinkedHashSet<>(consumed);
        nowConsumed.addAll(writtenKeys);

        if (plain) {
            written.put(w.getId(), new WidgetSource(target, null, target, nowConsumed, Set.of(), true));
            return target;
        }

        String tag = src != null && w.getType().hasTag(src.tag()) ? src.tag() : w.getType().canonicalTag();
        MappingNode item;
        if (keepItem) {
            item = src.item();
            DocNodes.set(item, src.tag(), target);
            if (!tag.equals(src.tag())) DocNodes.rename(item, src.tag(), tag);
            DocNodes.merge(item, itemValues, itemActionKeys);
        } else {
            List<NodeTuple> tuples = new ArrayList<>();
            tuples.add(new NodeTuple(DocNodes.keyNode(tag), target));
            item = DocNodes.newMapping(tuples);
        }
        written.put(w.getId(), new WidgetSource(item, tag, target, nowConsumed,
                new LinkedHashSet<>(itemValues.keySet()), false));
        return item;
    }

    private void writeProps(WidgetNode w, Node old, Set<String> consumed, Map<String, Node> values) {
        put(values, old, "id", w.getName(), DialectValues::string, doc::createNode);

        putDimension(values, old, consumed, "x", w.getX(), Dimension.ZERO);
        putDimension(values, old, consumed, "y", w.getY(), Dimension.ZERO);
        putDimension(values, old, consumed, "width", w.getWidth(), Dimension.CONTENT);
        putDimension(values, old, consumed, "height", w.getHeight(), Dimension.CONTENT);
        put(values, old, "align", w.getAlign(), DialectValues::string, doc::createNode);
        put(values, old, "text", w.getText(), DialectValues::text, doc::createTextNode);

        List<StyleReference> refs = w.getStyleReferences();
        if (!refs.isEmpty()) {
            values.put("styles", styles.writeReferences(refs, DocNodes.get(old, "styles"), doc));
        }
        writeDirectStyles(w, old, consumed, values);
        writeLayout(w.getLayout(), old, consumed, values);

        put(values, old, "grid_cell_column_pos", w.getGridCellColumnPos(), this::integer, doc::createNode);
        put(values, old, "grid_cell_column_span", w.getGridCellColumnSpan(), this::integer, doc::createNode);
        put(values, old, "grid_cell_row_pos", w.getGridCellRowPos(), this::integer, doc::createNode);
        put(values, old, "grid_cell_row_span", w.getGridCellRowSpan(), this::integer, doc::createNode);
        put(values, old, "grid_cell_x_align", w.getGridCellXAlign(), DialectValues::keyword, doc::createNode);
        put(values, old, "grid_cell_y_align", w.getGridCellYAlign(), DialectValues::keyword, doc::createNode);

        put(values, old, "hidden", w.getHidden(), this::bool, doc::createNode);
        put(values, old, "clickable", w.getClickable(), this::bool, doc::createNode);
        put(values, old, "checkable", w.getCheckable(), this::bool, doc::createNode);
        put(values, old, "checked", w.getChecked(), this::bool, doc::createNode);

        writeOptions(w.getOptions(), old, values);
        put(values, old, "long_mode", w.getLongMode(), DialectValues::keyword, doc::createNode);
        put(values, old, "min_value", w.getMinValue(), this::integer, doc::createNode);
        put(values, old, "max_value", w.getMaxValue(), this::integer, doc::createNode);
        put(values, old, "value", w.getValue(), this::integer, doc::createNode);
        writeRange(w, old, values);
        put(values, old, "rotation", w.getRotation(), this::integer, doc::createNode);
        put(values, old, "start_angle", w.getStartAngle(), this::integer, doc::createNode);
        put(values, old, "end_angle", w.getEndAngle(), this::integer, doc::createNode);
        put(values, old, "src", w.getSrc(), DialectValues::string, doc::createNode);
    }

    /** Direct style keys, minus values that only came from a default-state inline override. */
    private void writeDirectStyles(WidgetNode w, Node old, Set<String> consumed, Map<String, Node> values) {
        StyleProperties inline = StyleResolver.defaultInline(w.getStyleReferences());
        StyleProperties direct = new StyleProperties();
        for (Map.Entry<StyleProperty, Object> e : w.getStyles().asMap().entrySet()) {
            StyleProperty p = e.getKey();
            boolean fromInline = inline.has(p) && Objects.equals(inline.get(p), e.getValue());
            if (fromInline && !consumed.contains(p.key())) continue;
            direct.set(p, e.getValue());
        }
        styles.codec().write(direct, old, doc, values);
    }

    private void writeLayout(LayoutDescriptor layout, Node old, Set<String> consumed, Map<String, Node> values) {
        if (layout == null) return;
        Node oldLayout = DocNodes.get(old, "layout");
        boolean growInBlock = oldLayout instanceof MappingNode
                && DocNodes.has(oldLayout, "flex_grow") && !consumed.contains("flex_grow");
        boolean block = consumed.contains("layout")
                || layout.getType() != LayoutType.ABSOLUTE
                || hasBlockFields(layout)
                || (growInBlock && layout.getFlexGrow() != null);
        if (block) {
            values.put("layout", layoutNode(layout, oldLayout, growInBlock));
        }
        if (!growInBlock) {
            put(values, old, "flex_grow", layout.getFlexGrow(), this::integer, doc::createNode);
        }
    }

    private static boolean hasBlockFields(LayoutDescriptor l) {
        return l.getFlexFlow() != null || l.getFlexAlignMain() != null || l.getFlexAlignCross() != null
                || l.getFlexAlignTrack() != null || l.getGridColumns() != null || l.getGridRows() != null
                || l.getPadRow() != null || l.getPadColumn() != null;
    }

    private Node layoutNode(LayoutDescriptor layout, Node old, boolean growInBlock) {
        boolean typeOnly = !hasBlockFields(layout) && !(growInBlock && layout.getFlexGrow() != null);
        if (old instanceof ScalarNode && typeOnly) {
            return layout.getType() == layoutType(old) ? old : doc.createNode(layout.getType().dialectName());
        }
        MappingNode target = old instanceof MappingNode m ? m : DocNodes.newMapping(new ArrayList<>());
        Map<String, Node> v = new LinkedHashMap<>();
        if (layout.getType() != LayoutType.ABSOLUTE || DocNodes.has(target, "type")) {
            put(v, target, "type", layout.getType(), this::layoutType, t -> doc.createNode(t.dialectName()));
        }
        put(v, target, "flex_flow", layout.getFlexFlow(), DialectValues::keyword, doc::createNode);
        put(v, target, "flex_align_main", layout.getFlexAlignMain(), DialectValues::keyword, doc::createNode);
        put(v, target, "flex_align_cross", layout.getFlexAlignCross(), DialectValues::keyword, doc::createNode);
        put(v, target, "flex_align_track", layout.getFlexAlignTrack(), DialectValues::keyword, doc::createNode);
        if (growInBlock) {
            put(v, target, "flex_grow", layout.getFlexGrow(), this::integer, doc::createNode);
        }
        put(v, target, aliasKey(target, GRID_COLUMN_KEYS), layout.getGridColumns(), DialectValues::tracks, this::tracksNode);
        put(v, target, aliasKey(target, GRID_ROW_KEYS), layout.getGridRows(), DialectValues::tracks, this::tracksNode);
        put(v, target, "pad_row", layout.getPadRow(), this::integer, doc::createNode);
        put(v, target, "pad_column", layout.getPadColumn(), this::integer, doc::createNode);
        DocNodes.merge(target, v, LAYOUT_KEYS);
        return target;
    }

    private LayoutType layoutType(Node node) {
        return LayoutType.fromDialect(subs.resolve(DocNodes.scalar(node)));
    }

    /** The alias already used in the source, else the first (preferred) key. */
    private static String aliasKey(Node map, List<String> aliases) {
        for (String k : aliases) {
            if (DocNodes.has(map, k)) return k;
        }
        return aliases.get(0);
    }

    private Node tracksNode(List<Object> tracks) {
        Node n = doc.createNode(GridTrackCodec.encodeAll(tracks));
        if (n instanceof SequenceNode seq) seq.setFlowStyle(DumperOptions.FlowStyle.FLOW);
        return n;
    }

    private void writeOptions(List<String> options, Node old, Map<String, Node> values) {
        if (options == null) return;
        Node oldNode = DocNodes.get(old, "options");
        if (oldNode != null && options.equals(DialectValues.options(oldNode))) {
            values.put("options", oldNode);
        } else if (oldNode instanceof ScalarNode) {
            values.put("options", doc.createTextNode(String.join("\n", options)));
        } else {
            List<Node> items = new ArrayList<>();
            for (String o : options) items.add(doc.createTextNode(o));
            values.put("options", DocNodes.newSequence(items));
        }
    }

    private void writeRange(WidgetNode w, Node old, Map<String, Node> values) {
        if (w.getRangeMin() == null && w.getRangeMax() == null) return;
        Node oldRange = DocNodes.get(old, "range");
        MappingNode target = oldRange instanceof MappingNode m ? m : DocNodes.newMapping(new ArrayList<>());
        Map<String, Node> v = new LinkedHashMap<>();
        put(v, target, "min", w.getRangeMin(), this::integer, doc::createNode);
        put(v, target, "max", w.getRangeMax(), this::integer, doc::createNode);
        DocNodes.merge(target, v, RANGE_KEYS);
        values.put("range", target);
    }

    /** Triggers go back to the level they were read from; new ones go into props. */
    private void writeActions(WidgetNode w, Node props, MappingNode item, Set<String> itemActionKeys,
                              Map<String, Node> values, Map<String, Node> itemValues) {
        for (Map.Entry<String, Object> e : w.getActions().entrySet()) {
            boolean atItem = itemActionKeys.contains(e.getKey());
            Node oldNode = DocNodes.get(atItem ? item : props, e.getKey());
            Node node = oldNode != null && Objects.equals(nativeOf(oldNode), e.getValue())
                    ? oldNode
                    : doc.createNode(e.getValue());
            (atItem ? itemValues : values).put(e.getKey(), node);
        }
    }

    private void writeChildren(WidgetNode w, Node old, Set<String> consumed, Map<String, Node> values) {
        String key = WIDGETS;
        for (String k : CHILD_KEYS) {
            if (consumed.contains(k)) {
                key = k;
                break;
            }
        }
        List<Node> items = new ArrayList<>();
        for (WidgetNode child : w.getChildren()) {
            items.add(writeWidget(child, key.equals(PAGES)));
        }
        putIfPresent(values, key, listNode(DocNodes.get(old, key), items));
    }

    // ---- lists ----

    /**
     * Items for a widget list. A retained sequence is updated in place; its items that never
     * became widgets (unknown types, stray scalars) stay at their old index. Null when the
     * result is empty.
     */
    private Node listNode(Node old, List<Node> items) {
        List<Node> result = new ArrayList<>(items);
        if (old instanceof SequenceNode seq) {
            List<Node> oldItems = seq.getValue();
            for (int i = 0; i < oldItems.size(); i++) {
                Node n = oldItems.get(i);
                if (!boundItems.contains(n) && !result.contains(n)) {
                    result.add(Math.min(i, result.size()), n);
                }
            }
            if (result.isEmpty()) return null;
            DocNodes.replaceItems(seq, result);
            return seq;
        }
        return result.isEmpty() ? null : DocNodes.newSequence(result);
    }

    // ---- value helpers ----

    /** Keeps the old node when it reads back to {@code value}; otherwise creates a new one. */
    private static <T> void put(Map<String, Node> values, Node old, String key, T value,
                                Function<Node, T> reader, Function<T, Node> creator) {
        if (value == null) return;
        Node oldNode = DocNodes.get(old, key);
        if (oldNode != null && value.equals(reader.apply(oldNode))) {
            values.put(key, oldNode);
        } else {
            values.put(key, creator.apply(value));
        }
    }

    private void putDimension(Map<String, Node> values, Node old, Set<String> consumed,
                              String key, Dimension value, Dimension absentDefault) {
        if (!consumed.contains(key) && value.equals(absentDefault)) return;
        put(values, old, key, value, DialectValues::dimension, d -> doc.createNode(DimensionCodec.encode(d)));
    }

    private static void putIfPresent(Map<String, Node> values, String key, Node node) {
        if (node != null) values.put(key, node);
    }

    private Object nativeOf(Node node) {
        try {
            return doc.toNative(node);
        } catch (YAMLException e) {
            log.debug("Cannot read retained action node: {}", e.getMessage());
            return null;
        }
    }

    private Integer integer(Node node) {
        return DialectValues.integer(node, subs);
    }

    private Boolean bool(Node node) {
        return DialectValues.bool(node, subs);
    }
}
