// ============================================================================
// File: src/main/java/com/lvglbridge/engine/DialectValues.java
// ============================================================================

package com.lvglbridge.engine;

import com.lvglbridge.codec.DimensionCodec;
import com.lvglbridge.codec.GridTrackCodec;
import com.lvglbridge.codec.TextEscapeCodec;
import com.lvglbridge.document.DocNodes;
import com.lvglbridge.model.Dimension;
import com.lvglbridge.style.StylePropertyCodec;
import com.lvglbridge.substitution.SubstitutionTable;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;

import java.util.*;

/**
 * Node-to-model readers shared by the parser and the serializer. The serializer decodes the
 * retained node with the same reader and keeps it when the model value is unchanged.
 * Every reader returns null when the node holds nothing it understands.
 */
final class DialectValues {

    private DialectValues() {}

    static String string(Node node) {
        return DocNodes.scalar(node);
    }

    /** Scalar text with glyph escapes decoded. */
    static String text(Node node) {
        return TextEscapeCodec.decode(DocNodes.scalar(node));
    }

    /** Upper-cased keyword; substitution references are kept as written. */
    static String keyword(Node node) {
        String raw = DocNodes.scalar(node);
        if (raw == null || SubstitutionTable.hasReference(raw)) return raw;
        return raw.trim().toUpperCase(Locale.ROOT);
    }

    /** Any scalar (a bare {@code key:} is 100 px); null for collections. */
    static Dimension dimension(Node node) {
        if (!(node instanceof ScalarNode)) return null;
        return DimensionCodec.decode(DocNodes.scalar(node));
    }

    static Integer integer(Node node, SubstitutionTable subs) {
        String raw = DocNodes.scalar(node);
        Integer n = StylePropertyCodec.parseInt(raw);
        if (n == null && SubstitutionTable.hasReference(raw)) {
            n = StylePropertyCodec.parseInt(subs.resolve(raw));
        }
        return n;
    }

    static Boolean bool(Node node, SubstitutionTable subs) {
        String raw = DocNodes.scalar(node);
        Boolean b = parseBool(raw);
        if (b == null && SubstitutionTable.hasReference(raw)) {
            b = parseBool(subs.resolve(raw));
        }
        return b;
    }

    /** A list of strings, or one scalar holding newline-separated options. */
    static List<String> options(Node node) {
        if (node instanceof SequenceNode) {
            List<String> out = new ArrayList<>();
            for (Node item : DocNodes.items(node)) {
                String s = text(item);
                if (s != null) out.add(s);
            }
            return out;
        }
        String s = text(node);
        if (s == null) return null;
        List<String> out = new ArrayList<>();
        for (String line : s.split("\n", -1)) out.add(line);
        return out;
    }

    static List<Object> tracks(Node node) {
        if (!(node instanceof SequenceNode)) return null;
        List<String> raws = new ArrayList<>();
        for (Node item : DocNodes.items(node)) {
            String s = DocNodes.scalar(item);
            if (s != null) raws.add(s);
        }
        return GridTrackCodec.decodeAll(raws);
    }

    static Boolean parseBool(String s) {
        if (s == null) return null;
        switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "true":
            case "yes":
            case "on":
                return Boolean.TRUE;
            case "false":
            case "no":
            case "off":
                return Boolean.FALSE;
            default:
                return null;
        }
    }
}
