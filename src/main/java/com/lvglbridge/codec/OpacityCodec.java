// ============================================================================
// File: src/main/java/com/lvglbridge/codec/OpacityCodec.java
// ============================================================================

package com.lvglbridge.codec;

import java.util.*;
import java.util.regex.Pattern;

/** Opacity: dialect 0..255 / {@code N%} / COVER / TRANSP, model fraction 0.0 .. 1.0. */
public final class OpacityCodec {

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern PERCENT = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*%");

    private OpacityCodec() {}

    /** Fraction, or null when the text is not an opacity (e.g. an unresolved substitution). */
    public static Double decode(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        String upper = s.toUpperCase(Locale.ROOT);
        if (upper.equals("COVER") || upper.equals("LV_OPA_COVER")) return 1.0;
        if (upper.equals("TRANSP") || upper.equals("LV_OPA_TRANSP")) return 0.0;

        var pct = PERCENT.matcher(s);
        if (pct.matches()) return clamp(Double.parseDouble(pct.group(1)) / 100.0);

        try {
            if (INTEGER.matcher(s).matches()) {
                return clamp(Integer.parseInt(s) / 255.0);
            }
            double d = Double.parseDouble(s);
            return clamp(d <= 1.0 ? d : d / 255.0);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Integer encode(Double fraction) {
        if (fraction == null) return null;
        return (int) Math.round(clamp(fraction) * 255);
    }

    private static double clamp(double d) {
        return Math.max(0.0, Math.min(1.0, d));
    }
}
