// ============================================================================
// File: src/main/java/com/lvglbridge/codec/GridTrackCodec.java
// ============================================================================

package com.lvglbridge.codec;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Grid track sizes for {@code grid_columns}/{@code grid_rows}. Model values are Integer pixels
 * or the strings {@code "content"}, {@code "Nfr"} and {@code "N%"}; anything else is kept as
 * written.
 */
public final class GridTrackCodec {

    public static final String CONTENT = "content";

    private static final Pattern FR = Pattern.compile("(?:lv\\.fr|fr|LV_GRID_FR)\\(\\s*(\\d+)\\s*\\)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern MODEL_FR = Pattern.compile("(\\d+)fr");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private GridTrackCodec() {}

    public static Object decode(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        if (s.equals("lv.SIZE.CONTENT") || s.equalsIgnoreCase("size_content")
                || s.equalsIgnoreCase("content") || s.equals("LV_GRID_CONTENT")) {
            return CONTENT;
        }
        Matcher m = FR.matcher(s);
        if (m.matches()) return m.group(1) + "fr";
        if (s.contains("%")) return s;
        if (DIGITS.matcher(s).matches()) {
            try {
                return Integer.parseInt(s);
            } catch (NumberFormatException e) {
                return s;
            }
        }
        return s;
    }

    public static Object encode(Object track) {
        if (track instanceof String s) {
            if (s.equals(CONTENT)) return "CONTENT";
            Matcher m = MODEL_FR.matcher(s);
            if (m.matches()) return "FR(" + m.group(1) + ")";
        }
        return track;
    }

    public static List<Object> decodeAll(List<String> raws) {
        List<Object> out = new ArrayList<>(raws.size());
        for (String r : raws) out.add(decode(r));
        return out;
    }

    public static List<Object> encodeAll(List<Object> tracks) {
        List<Object> out = new ArrayList<>(tracks.size());
        for (Object t : tracks) out.add(encode(t));
        return out;
    }
}
