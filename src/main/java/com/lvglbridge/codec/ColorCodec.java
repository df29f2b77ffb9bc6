// ============================================================================
// File: src/main/java/com/lvglbridge/codec/ColorCodec.java
// ============================================================================

package com.lvglbridge.codec;

import com.lvglbridge.document.HexLiteral;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Colour values. The model normalizes to {@code #RRGGBB} (upper-case) or {@code transparent};
 * the dialect writes {@code 0xRRGGBB} hex literals. Text that is neither (named colours,
 * {@code ${var}} references) passes through both ways untouched.
 */
public final class ColorCodec {

    public static final String TRANSPARENT = "transparent";

    private static final Pattern HEX_DIGITS = Pattern.compile("[0-9A-Fa-f]+");
    private static final Pattern DECIMAL = Pattern.compile("\\d+");
    private static final Pattern MODEL_HEX = Pattern.compile("#[0-9A-Fa-f]{6}");

    private ColorCodec() {}

    public static String decode(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        if (s.equals("0")) return "#000000";

        // 0x literals that went through a numeric round trip show up as decimals
        if (DECIMAL.matcher(s).matches()) {
            try {
                s = "0x" + Long.toHexString(Long.parseLong(s));
            } catch (NumberFormatException e) {
                return raw;
            }
        }

        if (s.length() > 2 && (s.startsWith("0x") || s.startsWith("0X"))) {
            String hex = s.substring(2);
            if (!HEX_DIGITS.matcher(hex).matches()) return raw;
            switch (hex.length()) {
                case 8:
                    if (hex.startsWith("00")) return TRANSPARENT;
                    return "#" + hex.substring(2).toUpperCase(Locale.ROOT);
                case 6:
                    return "#" + hex.toUpperCase(Locale.ROOT);
                case 3:
                    StringBuilder sb = new StringBuilder("#");
                    for (char c : hex.toCharArray()) sb.append(c).append(c);
                    return sb.toString().toUpperCase(Locale.ROOT);
                default:
                    if (hex.length() < 6) {
                        return "#" + "0".repeat(6 - hex.length()) + hex.toUpperCase(Locale.ROOT);
                    }
                    return raw;
            }
        }
        return raw;
    }

    /**
     * Model colour to a dialect value: a {@link HexLiteral} for hex colours and
     * {@code transparent}, the text itself otherwise.
     */
    public static Object encode(String color) {
        if (color == null) return null;
        if (TRANSPARENT.equalsIgnoreCase(color)) return new HexLiteral("0x00000000");
        if (MODEL_HEX.matcher(color).matches()) return new HexLiteral("0x" + color.substring(1));
        if ((color.startsWith("0x") || color.startsWith("0X"))
                && color.length() > 2 && HEX_DIGITS.matcher(color.substring(2)).matches()) {
            return new HexLiteral(color);
        }
        return color;
    }
}
