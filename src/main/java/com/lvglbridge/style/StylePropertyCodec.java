// ============================================================================
// File: src/main/java/com/lvglbridge/style/StylePropertyCodec.java
// ============================================================================

package com.lvglbridge.style;

import com.lvglbridge.codec.ColorCodec;
import com.lvglbridge.codec.OpacityCodec;
import com.lvglbridge.document.ConfigDocument;
import com.lvglbridge.document.DocNodes;
import com.lvglbridge.model.StyleProperties;
import com.lvglbridge.model.StyleProperty;
import com.lvglbridge.substitution.SubstitutionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;

import java.util.*;

/**
 * Reads and writes the style keys of one mapping (a widget's props, a style definition or an
 * inline style reference). Keys that are not {@link StyleProperty} keys are never touched.
 * <p>
 * Text values (colours, fonts, keywords) keep {@code ${var}} references as written; numeric
 * kinds fall back to the substituted value when the literal is not a number.
 */
public final class StylePropertyCodec {

    private static final Logger log = LoggerFactory.getLogger(StylePropertyCodec.class);

    public static final List<String> KEYS;

    static {
        List<String> keys = new ArrayList<>();
        for (StyleProperty p : StyleProperty.values()) keys.add(p.key());
        KEYS = Collections.unmodifiableList(keys);
    }

    private final SubstitutionTable substitutions;

    public StylePropertyCodec(SubstitutionTable substitutions) {
        this.substitutions = substitutions == null ? new SubstitutionTable() : substitutions;
    }

    public static boolean isStyleKey(String key) {
        return StyleProperty.fromKey(key) != null;
    }

    public StyleProperties read(Node map) {
        StyleProperties out = new StyleProperties();
        if (!(map instanceof MappingNode m)) return out;
        for (NodeTuple t : m.getValue()) {
            StyleProperty p = StyleProperty.fromKey(DocNodes.keyOf(t));
            if (p == null) continue;
            Object v = decode(p, t.getValueNode());
            if (v == null) {
                log.debug("Ignoring unreadable {} value", p.key());
                continue;
            }
            out.set(p, v);
        }
        return out;
    }

    /** Model value for one node, or null when the node holds nothing usable for this kind. */
    public Object decode(StyleProperty property, Node node) {
        String raw = DocNodes.scalar(node);
        switch (property.kind()) {
            case COLOR:
                return raw == null ? ColorCodec.TRANSPARENT : ColorCodec.decode(raw);
            case OPACITY: {
                if (raw == null) return null;
                Double d = OpacityCodec.decode(raw);
                return d != null ? d : OpacityCodec.decode(substituted(raw));
            }
            case INTEGER: {
                if (raw == null) return null;
                Integer n = parseInt(raw);
                return n != null ? n : parseInt(substituted(raw));
            }
            case KEYWORD:
                if (raw == null) return null;
                return SubstitutionTable.hasReference(raw) ? raw : raw.trim().toUpperCase(Locale.ROOT);
            case FONT:
            default:
                return raw;
        }
    }

    /** Dialect value: HexLiteral for colours, 0..255 for opacity, the value itself otherwise. */
    public static Object encode(StyleProperty property, Object value) {
        if (value == null) return null;
        switch (property.kind()) {
            case COLOR:
                return ColorCodec.encode((String) value);
            case OPACITY:
                return OpacityCodec.encode((Double) value);
            default:
                return value;
        }
    }

    /**
     * Adds a node for each set property to {@code out}. When {@code old} already holds a node
     * that decodes to the same value it is reused, so quoting and {@code ${var}} spelling
     * survive.
     */
    public void write(StyleProperties props, Node old, ConfigDocument doc, Map<String, Node> out) {
        if (props == null) return;
        for (Map.Entry<StyleProperty, Object> e : props.asMap().entrySet()) {
            StyleProperty p = e.getKey();
            Node oldNode = DocNodes.get(old, p.key());
            if (oldNode != null && Objects.equals(decode(p, oldNode), e.getValue())) {
                out.put(p.key(), oldNode);
            } else {
                out.put(p.key(), doc.createNode(encode(p, e.getValue())));
            }
        }
    }

    private String substituted(String raw) {
        return SubstitutionTable.hasReference(raw) ? substitutions.resolve(raw) : null;
    }

    /** Integer text, rounding decimals; null when not a finite number. */
    public static Integer parseInt(String s) {
        if (s == null) return null;
        String t = s.trim();
        try {
            return Integer.valueOf(t);
        } catch (NumberFormatException e) {
            try {
                double d = Double.parseDouble(t);
                return Double.isFinite(d) ? (int) Math.round(d) : null;
            } catch (NumberFormatException e2) {
                return null;
            }
        }
    }
}
