/*
 * =============================================================================
 *  LvglBridge Display Configuration Toolkit
 *  File: StyleResolver.java
 * -----------------------------------------------------------------------------
 *  Purpose:
 *      Global style definitions (lvgl.style_definitions), per-widget style
 *      references (styles:) and the effective style of a widget for a set of
 *      active interaction states.
 *
 *  Layering for effective(), later layers overwrite matching keys:
 *      1. base (class defaults supplied by the caller, may be empty)
 *      2. global styles referenced for the DEFAULT state
 *      3. the widget's own default styles
 *      4. for each active state in CHECKED, FOCUSED, PRESSED, DISABLED order:
 *         that state's global styles, then that state's inline overrides
 * =============================================================================
 */
package com.lvglbridge.style;

import com.lvglbridge.codec.ColorCodec;
import com.lvglbridge.document.ConfigDocument;
import com.lvglbridge.document.DocNodes;
import com.lvglbridge.model.InteractionState;
import com.lvglbridge.model.StyleProperties;
import com.lvglbridge.model.StyleProperty;
import com.lvglbridge.model.StyleReference;
import com.lvglbridge.model.WidgetNode;
import com.lvglbridge.substitution.SubstitutionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;

import java.util.*;

public final class StyleResolver {

    private static final Logger log = LoggerFactory.getLogger(StyleResolver.class);

    public static final String DEFINITIONS_KEY = "style_definitions";

    private static final List<String> REFERENCE_KEYS = List.of("id", "style_id", "state");

    private final SubstitutionTable substitutions;
    private final StylePropertyCodec codec;
    private final Map<String, StyleProperties> globals = new LinkedHashMap<>();

    public StyleResolver(SubstitutionTable substitutions) {
        this(substitutions, null);
    }

    public StyleResolver(SubstitutionTable substitutions, Map<String, StyleProperties> globals) {
        this.substitutions = substitutions == null ? new SubstitutionTable() : substitutions;
        this.codec = new StylePropertyCodec(this.substitutions);
        if (globals != null) this.globals.putAll(globals);
    }

    public StylePropertyCodec codec() {
        return codec;
    }

    public Map<String, StyleProperties> globals() {
        return Collections.unmodifiableMap(globals);
    }

    // ---- reading ----

    /** Loads {@code style_definitions} items that carry an id; returns the table (document order). */
    public Map<String, StyleProperties> readDefinitions(Node definitions) {
        for (Node item : DocNodes.items(definitions)) {
            String id = DocNodes.text(item, "id");
            if (id == null) {
                log.debug("Skipping style definition without id");
                continue;
            }
            globals.put(id, codec.read(item));
        }
        return globals();
    }

    /**
     * Normalizes a widget's {@code styles:} value: a single name, a list of names, or a list
     * of {@code {id|style_id, state, <properties>}} objects (a single object is accepted too).
     * References naming an unknown state are dropped.
     */
    public List<StyleReference> readReferences(Node styles) {
        List<StyleReference> out = new ArrayList<>();
        if (styles instanceof ScalarNode) {
            addBare(DocNodes.scalar(styles), out);
        } else if (styles instanceof SequenceNode) {
            for (Node item : DocNodes.items(styles)) {
                if (item instanceof MappingNode) {
                    addObject(item, out);
                } else {
                    addBare(DocNodes.scalar(item), out);
                }
            }
        } else if (styles instanceof MappingNode) {
            addObject(styles, out);
        }
        return out;
    }

    private static void addBare(String name, List<StyleReference> out) {
        if (name != null && !name.isBlank()) out.add(StyleReference.of(name));
    }

    private void addObject(Node item, List<StyleReference> out) {
        String id = DocNodes.text(item, "id");
        if (id == null) id = DocNodes.text(item, "style_id");

        InteractionState state = null;
        String rawState = DocNodes.text(item, "state");
        if (rawState != null) {
            state = InteractionState.fromDialect(substitutions.resolve(rawState));
            if (state == null) {
                log.debug("Dropping style reference {} with unknown state '{}'", id, rawState);
                return;
            }
        }
        StyleProperties inline = codec.read(item);
        if (id == null && inline.isEmpty()) return;
        out.add(new StyleReference(id, state, inline.isEmpty() ? null : inline));
    }

    /** Default-state inline overrides of the references, in order (later wins). */
    public static StyleProperties defaultInline(List<StyleReference> refs) {
        StyleProperties out = new StyleProperties();
        for (StyleReference r : refs) {
            if (r.isDefaultState() && r.hasInlineStyles()) out.overlay(r.styles());
        }
        return out;
    }

    // ---- writing ----

    /**
     * Node for a widget's {@code styles:} value. {@code old} is reused when it reads back to
     * the same references; a single bare reference stays a scalar when it was one.
     */
    public Node writeReferences(List<StyleReference> refs, Node old, ConfigDocument doc) {
        if (old != null && readReferences(old).equals(refs)) return old;
        if (refs.size() == 1 && refs.get(0).isBare() && (old == null || old instanceof ScalarNode)) {
            return doc.createNode(refs.get(0).styleId());
        }
        List<Node> oldItems = DocNodes.items(old);
        List<Node> items = new ArrayList<>();
        for (int i = 0; i < refs.size(); i++) {
            StyleReference r = refs.get(i);
            Node oldItem = i < oldItems.size() ? oldItems.get(i) : null;
            if (r.isBare() && !(oldItem instanceof MappingNode)) {
                items.add(doc.createNode(r.styleId()));
                continue;
            }
            MappingNode target = oldItem instanceof MappingNode m ? m : DocNodes.newMapping(new ArrayList<>());
            Map<String, Node> values = new LinkedHashMap<>();
            if (r.styleId() != null) {
                String idKey = DocNodes.has(target, "style_id") && !DocNodes.has(target, "id") ? "style_id" : "id";
                Node oldId = DocNodes.get(target, idKey);
                values.put(idKey, Objects.equals(DocNodes.scalar(oldId), r.styleId()) ? oldId : doc.createNode(r.styleId()));
            }
            if (r.state() != null) {
                Node oldState = DocNodes.get(target, "state");
                values.put("state", r.state() == InteractionState.fromDialect(DocNodes.scalar(oldState))
                        ? oldState
                        : doc.createNode(r.state().name()));
            }
            codec.write(r.styles(), target, doc, values);

            List<String> managed = new ArrayList<>(REFERENCE_KEYS);
            managed.addAll(StylePropertyCodec.KEYS);
            DocNodes.merge(target, values, managed);
            items.add(target);
        }
        return DocNodes.newSequence(items);
    }

    /**
     * Merges a global style table into {@code style_definitions} by id. Definitions no longer in
     * the table are removed, entries without an id are kept. Returns null for an empty result.
     */
    public Node writeDefinitions(Map<String, StyleProperties> table, Node old, ConfigDocument doc) {
        Map<String, MappingNode> retained = new LinkedHashMap<>();
        List<Node> unmodelled = new ArrayList<>();
        for (Node item : DocNodes.items(old)) {
            String id = DocNodes.text(item, "id");
            if (item instanceof MappingNode m && id != null) {
                retained.putIfAbsent(id, m);
            } else {
                unmodelled.add(item);
            }
        }

        List<Node> items = new ArrayList<>();
        if (table != null) {
            for (Map.Entry<String, StyleProperties> e : table.entrySet()) {
                MappingNode entry = retained.get(e.getKey());
                if (entry == null) entry = DocNodes.newMapping(new ArrayList<>());
                Map<String, Node> values = new LinkedHashMap<>();
                Node oldId = DocNodes.get(entry, "id");
                values.put("id", Objects.equals(DocNodes.scalar(oldId), e.getKey()) ? oldId : doc.createNode(e.getKey()));
                codec.write(e.getValue(), entry, doc, values);

                List<String> managed = new ArrayList<>(StylePropertyCodec.KEYS);
                managed.add("id");
                DocNodes.merge(entry, values, managed);
                items.add(entry);
            }
        }
        items.addAll(unmodelled);
        if (items.isEmpty()) return null;
        if (old instanceof SequenceNode seq) {
            DocNodes.replaceItems(seq, items);
            return seq;
        }
        return DocNodes.newSequence(items);
    }

    // ---- effective style ----

    public StyleProperties effective(WidgetNode widget, Set<InteractionState> activeStates) {
        return effective(widget, activeStates, null);
    }

    public StyleProperties effective(WidgetNode widget, Set<InteractionState> activeStates, StyleProperties base) {
        StyleProperties out = base == null ? new StyleProperties() : base.copy();
        List<StyleReference> refs = widget.getStyleReferences();

        for (StyleReference r : refs) {
            if (r.isDefaultState()) out.overlay(lookup(r.styleId()));
        }
        out.overlay(widget.getStyles());

        Set<InteractionState> active = activeStates == null ? Set.of() : activeStates;
        for (InteractionState state : InteractionState.OVERLAY_ORDER) {
            if (!active.contains(state)) continue;
            for (StyleReference r : refs) {
                if (r.state() == state) out.overlay(lookup(r.styleId()));
            }
            for (StyleReference r : refs) {
                if (r.state() == state && r.hasInlineStyles()) out.overlay(r.styles());
            }
        }
        return resolveSubstitutions(out);
    }

    private StyleProperties lookup(String styleId) {
        if (styleId == null) return null;
        StyleProperties s = globals.get(styleId);
        if (s == null && SubstitutionTable.hasReference(styleId)) {
            s = globals.get(substitutions.resolve(styleId));
        }
        if (s == null) log.debug("Unknown style id '{}'", styleId);
        return s;
    }

    private StyleProperties resolveSubstitutions(StyleProperties props) {
        for (Map.Entry<StyleProperty, Object> e : new ArrayList<>(props.asMap().entrySet())) {
            if (!(e.getValue() instanceof String text) || !SubstitutionTable.hasReference(text)) continue;
            String resolved = substitutions.resolve(text);
            switch (e.getKey().kind()) {
                case COLOR:
                    props.set(e.getKey(), ColorCodec.decode(resolved));
                    break;
                case KEYWORD:
                    props.set(e.getKey(), resolved.trim().toUpperCase(Locale.ROOT));
                    break;
                default:
                    props.set(e.getKey(), resolved);
            }
        }
        return props;
    }
}
