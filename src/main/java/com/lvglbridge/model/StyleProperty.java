// ============================================================================
// File: src/main/java/com/lvglbridge/model/StyleProperty.java
// ============================================================================

package com.lvglbridge.model;

import java.util.*;

/** Style keys the engine understands, each with the kind of value it holds. */
public enum StyleProperty {
    BG_COLOR("bg_color", Kind.COLOR),
    BG_OPA("bg_opa", Kind.OPACITY),
    TEXT_COLOR("text_color", Kind.COLOR),
    TEXT_OPA("text_opa", Kind.OPACITY),
    TEXT_FONT("text_font", Kind.FONT),
    TEXT_ALIGN("text_align", Kind.KEYWORD),
    RADIUS("radius", Kind.INTEGER),
    BORDER_WIDTH("border_width", Kind.INTEGER),
    BORDER_COLOR("border_color", Kind.COLOR),
    BORDER_OPA("border_opa", Kind.OPACITY),
    PAD_ALL("pad_all", Kind.INTEGER),
    PAD_TOP("pad_top", Kind.INTEGER),
    PAD_BOTTOM("pad_bottom", Kind.INTEGER),
    PAD_LEFT("pad_left", Kind.INTEGER),
    PAD_RIGHT("pad_right", Kind.INTEGER),
    SHADOW_WIDTH("shadow_width", Kind.INTEGER),
    SHADOW_COLOR("shadow_color", Kind.COLOR),
    SHADOW_OFS_X("shadow_ofs_x", Kind.INTEGER),
    SHADOW_OFS_Y("shadow_ofs_y", Kind.INTEGER),
    LINE_WIDTH("line_width", Kind.INTEGER),
    LINE_COLOR("line_color", Kind.COLOR),
    ARC_WIDTH("arc_width", Kind.INTEGER),
    ARC_COLOR("arc_color", Kind.COLOR);

    public enum Kind {
        /** Normalized {@code #RRGGBB}, {@code transparent}, or pass-through text. */
        COLOR(String.class),
        /** Fraction 0.0 - 1.0. */
        OPACITY(Double.class),
        INTEGER(Integer.class),
        /** Font handle (font asset id or built-in font name). */
        FONT(String.class),
        /** Upper-cased enum-like keyword. */
        KEYWORD(String.class);

        private final Class<?> valueType;

        Kind(Class<?> valueType) {
            this.valueType = valueType;
        }

        public Class<?> valueType() {
            return valueType;
        }
    }

    private static final Map<String, StyleProperty> BY_KEY = new HashMap<>();

    static {
        for (StyleProperty p : values()) BY_KEY.put(p.key, p);
    }

    private final String key;
    private final Kind kind;

    StyleProperty(String key, Kind kind) {
        this.key = key;
        this.kind = kind;
    }

    public String key() { return key; }
    public Kind kind() { return kind; }

    public static StyleProperty fromKey(String key) {
        return key == null ? null : BY_KEY.get(key);
    }
}
