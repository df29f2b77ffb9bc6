// ============================================================================
// File: src/main/java/com/lvglbridge/asset/FontNames.java
// ============================================================================

package com.lvglbridge.asset;

import java.util.*;

/**
 * Display hints for LVGL font names such as {@code montserrat_20} or
 * {@code lv.font_montserrat_14}.
 */
public final class FontNames {

    private static final String LV_PREFIX = "lv.font_";

    private static final Map<String, String> KNOWN_FAMILIES = Map.of(
            "montserrat", "Montserrat",
            "unscii", "monospace",
            "dejavu", "DejaVu Sans",
            "simsun", "SimSun",
            "roboto", "Roboto",
            "inter", "Inter");

    private FontNames() {}

    /** {@code montserrat_20 -> Montserrat}, {@code my_custom_font -> My Custom Font}; null for null. */
    public static String family(String fontName) {
        if (fontName == null || fontName.isBlank()) return null;
        String clean = stripPrefix(fontName.trim().toLowerCase(Locale.ROOT));
        String[] parts = clean.split("_");
        if (parts.length > 1 && isNumber(parts[parts.length - 1])) {
            clean = clean.substring(0, clean.lastIndexOf('_'));
        }
        String known = KNOWN_FAMILIES.get(clean);
        if (known != null) return known;

        StringBuilder sb = new StringBuilder();
        for (String word : clean.split("_")) {
            if (word.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }

    /** Trailing numeric part as point size, or null. */
    public static Integer size(String fontName) {
        if (fontName == null) return null;
        String[] parts = fontName.trim().split("_");
        String last = parts[parts.length - 1];
        return isNumber(last) ? Integer.valueOf(last) : null;
    }

    private static String stripPrefix(String s) {
        return s.startsWith(LV_PREFIX) ? s.substring(LV_PREFIX.length()) : s;
    }

    private static boolean isNumber(String s) {
        if (s.isEmpty() || s.length() > 9) return false;
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return false;
        }
        return true;
    }
}
