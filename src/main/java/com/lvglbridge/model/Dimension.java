// ============================================================================
// File: src/main/java/com/lvglbridge/model/Dimension.java
// ============================================================================

package com.lvglbridge.model;

import java.util.*;

/**
 * A geometry value: pixels, a percentage ({@code "50%"}), {@code content} (size to
 * contents) or a raw symbolic value kept verbatim, e.g. {@code ${panel_width}}.
 */
public record Dimension(Kind kind, int pixels, String text) {

    public enum Kind { PIXELS, PERCENT, CONTENT, RAW }

    public static final Dimension CONTENT = new Dimension(Kind.CONTENT, 0, "content");
    public static final Dimension ZERO = px(0);

    public Dimension {
        Objects.requireNonNull(kind, "kind");
    }

    public static Dimension px(int pixels) {
        return new Dimension(Kind.PIXELS, pixels, null);
    }

    public static Dimension percent(int value) {
        return new Dimension(Kind.PERCENT, 0, value + "%");
    }

    public static Dimension percent(String text) {
        return new Dimension(Kind.PERCENT, 0, text);
    }

    public static Dimension content() {
        return CONTENT;
    }

    public static Dimension raw(String text) {
        return new Dimension(Kind.RAW, 0, text);
    }

    public boolean isPixels() {
        return kind == Kind.PIXELS;
    }

    public boolean isPixels(int value) {
        return kind == Kind.PIXELS && pixels == value;
    }

    @Override
    public String toString() {
        return kind == Kind.PIXELS ? Integer.toString(pixels) : text;
    }
}
