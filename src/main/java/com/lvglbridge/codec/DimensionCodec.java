// ============================================================================
// File: src/main/java/com/lvglbridge/codec/DimensionCodec.java
// ============================================================================

package com.lvglbridge.codec;

import com.lvglbridge.model.Dimension;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Geometry values ({@code x, y, width, height}).
 * <pre>
 *   null (key present, no value)             -> 100 px
 *   size_content | SIZE_CONTENT | lv.SIZE.CONTENT -> content
 *   lv.pct(N) | N%                           -> percent
 *   signed integer                           -> pixels
 *   anything else                            -> raw, kept verbatim
 * </pre>
 */
public final class DimensionCodec {

    public static final int NULL_PIXELS = 100;
    public static final String CONTENT_KEYWORD = "SIZE_CONTENT";

    private static final Pattern PIXELS = Pattern.compile("[-+]?\\d+");
    private static final Pattern PERCENT = Pattern.compile("([-+]?\\d+)\\s*%");
    private static final Pattern LV_PCT = Pattern.compile("lv\\.pct\\(\\s*([-+]?\\d+)\\s*\\)");

    private DimensionCodec() {}

    public static Dimension decode(String raw) {
        if (raw == null) return Dimension.px(NULL_PIXELS);
        String s = raw.trim();
        if (s.equalsIgnoreCase("size_content") || s.equals("lv.SIZE.CONTENT")) {
            return Dimension.CONTENT;
        }
        try {
            Matcher m = LV_PCT.matcher(s);
            if (m.matches()) return Dimension.percent(Integer.parseInt(m.group(1)));
            m = PERCENT.matcher(s);
            if (m.matches()) return Dimension.percent(Integer.parseInt(m.group(1)));
            if (PIXELS.matcher(s).matches()) return Dimension.px(Integer.parseInt(s));
        } catch (NumberFormatException e) {
            // out of int range
            return Dimension.raw(raw);
        }
        return Dimension.raw(raw);
    }

    /** Integer for pixels, text for everything else. */
    public static Object encode(Dimension d) {
        if (d == null) return null;
        switch (d.kind()) {
            case PIXELS:
                return d.pixels();
            case CONTENT:
                return CONTENT_KEYWORD;
            default:
                return d.text();
        }
    }
}
