/*
 * =============================================================================
 *  LvglBridge Display Configuration Toolkit
 *  File: WidgetTreeParser.java
 * -----------------------------------------------------------------------------
 *  Purpose:
 *      Walks the lvgl section and builds the typed widget tree.
 *
 *  Section shapes:
 *      lvgl: {pages: [...], widgets: [...]}   pages first, then widgets
 *      lvgl: [ - obj: ..., - label: ... ]     items parsed directly
 *      lvgl: {obj: {...}}                     the section is one widget
 *
 *  Notes:
 *      - The type is the first key that is a widget tag; items without one
 *        (unknown widget types) are skipped and left in the document.
 *      - Pages are plain mappings; they are always PAGE.
 *      - Every widget gets a WidgetSource binding for the serializer.
 * =============================================================================
 */
package com.lvglbridge.engine;

import com.lvglbridge.config.EngineConfig;
import com.lvglbridge.document.ConfigDocument;
import com.lvglbridge.document.DocNodes;
import com.lvglbridge.model.Dimension;
import com.lvglbridge.model.LayoutDescriptor;
import com.lvglbridge.model.StyleProperties;
import com.lvglbridge.model.StyleProperty;
import com.lvglbridge.model.StyleReference;
import com.lvglbridge.model.WidgetNode;
import com.lvglbridge.model.WidgetType;
import com.lvglbridge.style.StyleResolver;
import com.lvglbridge.substitution.SubstitutionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;

import java.util.*;
import java.util.function.Function;

final class WidgetTreeParser {

    private static final Logger log = LoggerFactory.getLogger(WidgetTreeParser.class);

    static final String PAGES = "pages";
    static final String WIDGETS = "widgets";
    static final List<String> CHILD_KEYS = List.of(WIDGETS, "children", PAGES);
    static final String ACTION_PREFIX = "on_";
    static final List<String> GRID_COLUMN_KEYS = List.of("grid_columns", "grid_dsc_cols");
    static final List<String> GRID_ROW_KEYS = List.of("grid_rows", "grid_dsc_rows");

    private final EngineConfig config;
    private final ConfigDocument doc;
    private final SubstitutionTable subs;
    private final StyleResolver styles;
    private final Map<String, WidgetSource> bindings = new LinkedHashMap<>();

    WidgetTreeParser(EngineConfig config, ConfigDocument doc, SubstitutionTable subs, StyleResolver styles) {
        this.config = config;
        this.doc = doc;
        this.subs = subs;
        this.styles = styles;
    }

    Map<String, WidgetSource> bindings() {
        return bindings;
    }

    List<WidgetNode> parseSection(Node section) {
        List<WidgetNode> roots = new ArrayList<>();
        if (section instanceof SequenceNode) {
            parseItems(section, false, 0, roots);
        } else if (section instanceof MappingNode m) {
            boolean listed = DocNodes.has(m, PAGES) || DocNodes.has(m, WIDGETS);
            parseItems(DocNodes.get(m, PAGES), true, 0, roots);
            parseItems(DocNodes.get(m, WIDGETS), false, 0, roots);
            if (!listed) {
                WidgetNode single = parseItem(m, false, 0);
                if (single != null) roots.add(single);
            }
        }
        applyCanvasSize(roots);
        log.debug("Parsed {} root widgets, {} widgets in total", roots.size(), bindings.size());
        return roots;
    }

    /** Root pages and objects with placeholder sizes (100 or 0 on both axes) get the canvas size. */
    private void applyCanvasSize(List<WidgetNode> roots) {
        for (WidgetNode w : roots) {
            if (w.getType().isContainer() && isPlaceholder(w.getWidth()) && isPlaceholder(w.getHeight())) {
                w.setWidth(Dimension.px(config.getCanvasWidth()));
                w.setHeight(Dimension.px(config.getCanvasHeight()));
            }
        }
    }

    private static boolean isPlaceholder(Dimension d) {
        return d.isPixels(100) || d.isPixels(0);
    }

    private void parseItems(Node list, boolean pages, int depth, List<WidgetNode> out) {
        for (Node item : DocNodes.items(list)) {
            WidgetNode w = parseItem(item, pages, depth);
            if (w != null) out.add(w);
        }
    }

    private WidgetNode parseItem(Node itemNode, boolean page, int depth) {
        if (depth > config.getMaxDepth()) {
            log.warn("Widget nesting deeper than {} levels, not descending further", config.getMaxDepth());
            return null;
        }
        if (!(itemNode instanceof MappingNode item)) {
            log.debug("Skipping non-mapping widget item");
            return null;
        }

        WidgetType type = null;
        String tag = null;
        Node propsValue = null;
        Set<String> itemActionKeys = new LinkedHashSet<>();
        for (NodeTuple t : item.getValue()) {
            String key = DocNodes.keyOf(t);
            if (key == null) continue;
            if (type == null && WidgetType.fromTag(key) != null) {
                type = WidgetType.fromTag(key);
                tag = key;
                propsValue = t.getValueNode();
            } else if (key.startsWith(ACTION_PREFIX)) {
                itemActionKeys.add(key);
            }
        }

        boolean plain = false;
        if (page && (type == null || !(propsValue instanceof MappingNode))) {
            plain = true;
            type = WidgetType.PAGE;
            tag = null;
            propsValue = item;
            itemActionKeys.clear();
        } else if (page) {
            type = WidgetType.PAGE;
        }
        if (type == null) {
            log.debug("Skipping item without a known widget type: {}", DocNodes.keys(item));
            return null;
        }

        MappingNode props = propsValue instanceof MappingNode m ? m : null;
        WidgetNode w = new WidgetNode(type, null);
        Set<String> consumed = new LinkedHashSet<>();
        PropsReader in = new PropsReader(props, consumed);

        String name = in.read("id", DialectValues::string);
        w.setName(name != null ? name : generatedName(type));

        readGeometry(w, in);
        w.setAlign(in.read("align", DialectValues::string));
        w.setText(in.read("text", DialectValues::text));
        if (w.getText() == null && type == WidgetType.LABEL && propsValue instanceof ScalarNode) {
            w.setText(DialectValues.text(propsValue));
        }

        readStyles(w, props, consumed);
        readLayout(w, in);

        w.setGridCellColumnPos(in.read("grid_cell_column_pos", this::integer));
        w.setGridCellColumnSpan(in.read("grid_cell_column_span", this::integer));
        w.setGridCellRowPos(in.read("grid_cell_row_pos", this::integer));
        w.setGridCellRowSpan(in.read("grid_cell_row_span", this::integer));
        w.setGridCellXAlign(in.read("grid_cell_x_align", DialectValues::keyword));
        w.setGridCellYAlign(in.read("grid_cell_y_align", DialectValues::keyword));

        w.setHidden(in.read("hidden", this::bool));
        w.setClickable(in.read("clickable", this::bool));
        w.setCheckable(in.read("checkable", this::bool));
        w.setChecked(in.read("checked", this::bool));

        w.setOptions(in.read("options", DialectValues::options));
        w.setLongMode(in.read("long_mode", DialectValues::keyword));
        w.setMinValue(in.read("min_value", this::integer));
        w.setMaxValue(in.read("max_value", this::integer));
        w.setValue(in.read("value", this::integer));
        w.setRotation(in.read("rotation", this::integer));
        w.setStartAngle(in.read("start_angle", this::integer));
        w.setEndAngle(in.read("end_angle", this::integer));
        w.setSrc(in.read("src", DialectValues::string));

        Node range = DocNodes.get(props, "range");
        if (range instanceof MappingNode) {
            w.setRangeMin(integer(DocNodes.get(range, "min")));
            w.setRangeMax(integer(DocNodes.get(range, "max")));
            consumed.add("range");
        }

        for (String key : new ArrayList<>(itemActionKeys)) {
            if (!readAction(w, key, DocNodes.get(item, key))) itemActionKeys.remove(key);
        }
        for (String key : DocNodes.keys(props)) {
            if (key.startsWith(ACTION_PREFIX) && !w.getActions().containsKey(key)
                    && readAction(w, key, DocNodes.get(props, key))) {
                consumed.add(key);
            }
        }

        bindings.put(w.getId(), new WidgetSource(item, tag, propsValue, consumed, itemActionKeys, plain));

        for (String key : CHILD_KEYS) {
            Node children = DocNodes.get(props, key);
            if (!(children instanceof SequenceNode)) continue;
            if (depth + 1 > config.getMaxDepth()) {
                log.warn("Children of '{}' are nested deeper than {} levels; left as written", w.getName(), config.getMaxDepth());
                continue;
            }
            parseItems(children, key.equals(PAGES), depth + 1, w.getChildren());
            consumed.add(key);
        }
        return w;
    }

    private void readGeometry(WidgetNode w, PropsReader in) {
        Dimension x = in.read("x", DialectValues::dimension);
        Dimension y = in.read("y", DialectValues::dimension);
        Dimension width = in.read("width", DialectValues::dimension);
        Dimension height = in.read("height", DialectValues::dimension);
        if (x != null) w.setX(x);
        if (y != null) w.setY(y);
        if (width != null) w.setWidth(width);
        if (height != null) w.setHeight(height);
    }

    /**
     * {@code styles:} references first (default-state inline overrides flattened into the
     * widget styles), then direct style keys on top.
     */
    private void readStyles(WidgetNode w, MappingNode props, Set<String> consumed) {
        Node refsNode = DocNodes.get(props, "styles");
        if (refsNode != null) {
            List<StyleReference> refs = styles.readReferences(refsNode);
            if (!refs.isEmpty()) {
                w.getStyleReferences().addAll(refs);
                consumed.add("styles");
            }
        }
        StyleProperties effective = StyleResolver.defaultInline(w.getStyleReferences());
        StyleProperties direct = styles.codec().read(props);
        for (StyleProperty p : direct.asMap().keySet()) consumed.add(p.key());
        w.setStyles(effective.overlay(direct));
    }

    private void readLayout(WidgetNode w, PropsReader in) {
        Node node = in.get("layout");
        LayoutDescriptor layout = null;
        if (node instanceof MappingNode) {
            layout = new LayoutDescriptor(LayoutDescriptor.LayoutType.fromDialect(subs.resolve(DocNodes.text(node, "type"))));
            layout.setFlexFlow(DialectValues.keyword(DocNodes.get(node, "flex_flow")));
            layout.setFlexAlignMain(DialectValues.keyword(DocNodes.get(node, "flex_align_main")));
            layout.setFlexAlignCross(DialectValues.keyword(DocNodes.get(node, "flex_align_cross")));
            layout.setFlexAlignTrack(DialectValues.keyword(DocNodes.get(node, "flex_align_track")));
            layout.setFlexGrow(integer(DocNodes.get(node, "flex_grow")));
            layout.setGridColumns(DialectValues.tracks(firstPresent(node, GRID_COLUMN_KEYS)));
            layout.setGridRows(DialectValues.tracks(firstPresent(node, GRID_ROW_KEYS)));
            layout.setPadRow(integer(DocNodes.get(node, "pad_row")));
            layout.setPadColumn(integer(DocNodes.get(node, "pad_column")));
            in.consume("layout");
        } else if (node instanceof ScalarNode && DocNodes.scalar(node) != null) {
            layout = new LayoutDescriptor(LayoutDescriptor.LayoutType.fromDialect(subs.resolve(DocNodes.scalar(node))));
            in.consume("layout");
        }

        Integer grow = in.read("flex_grow", this::integer);
        if (grow != null) {
            if (layout == null) layout = new LayoutDescriptor();
            layout.setFlexGrow(grow);
        }
        w.setLayout(layout);
    }

    /** Actions stay opaque; one that cannot be constructed is left in the document untouched. */
    private boolean readAction(WidgetNode w, String key, Node node) {
        try {
            w.getActions().put(key, doc.toNative(node));
            return true;
        } catch (YAMLException e) {
            log.warn("Cannot read action '{}' of '{}': {}", key, w.getName(), e.getMessage());
            return false;
        }
    }

    private static Node firstPresent(Node map, List<String> keys) {
        for (String k : keys) {
            if (DocNodes.has(map, k)) return DocNodes.get(map, k);
        }
        return null;
    }

    private Integer integer(Node node) {
        return DialectValues.integer(node, subs);
    }

    private Boolean bool(Node node) {
        return DialectValues.bool(node, subs);
    }

    private static String generatedName(WidgetType type) {
        return type.canonicalTag() + "_" + UUID.randomUUID().toString().substring(0, 4);
    }

    /** Reads props keys and records the ones that produced a value. */
    private static final class PropsReader {
        private final MappingNode props;
        private final Set<String> consumed;

        PropsReader(MappingNode props, Set<String> consumed) {
            this.props = props;
            this.consumed = consumed;
        }

        Node get(String key) {
            return DocNodes.get(props, key);
        }

        void consume(String key) {
            consumed.add(key);
        }

        <T> T read(String key, Function<Node, T> reader) {
            if (!DocNodes.has(props, key)) return null;
            T value = reader.apply(DocNodes.get(props, key));
            if (value != null) consumed.add(key);
            return value;
        }
    }
}
