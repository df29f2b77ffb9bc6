/*
 * =============================================================================
 *  LvglBridge Display Configuration Toolkit
 *  File: TextEscapeCodec.java
 * -----------------------------------------------------------------------------
 *  Purpose:
 *      Unicode escapes for icon glyphs. ESPHome configs write icon-font glyphs
 *      as "\U000F0001"; the model holds the real code points.
 *      encode() only escapes private-use code points, so ordinary text
 *      such as accented or CJK text is emitted as-is.
 * =============================================================================
 */
package com.lvglbridge.codec;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class TextEscapeCodec {

    private static final Pattern ESCAPE = Pattern.compile("\\\\U([0-9A-Fa-f]{8})|\\\\u([0-9A-Fa-f]{4})");

    private TextEscapeCodec() {}

    /** Replaces long ({@code \UXXXXXXXX}) and short (backslash, u, four hex digits) escapes with their code points. */
    public static String decode(String text) {
        if (text == null || text.indexOf('\\') < 0) return text;
        Matcher m = ESCAPE.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (m.find()) {
            String hex = m.group(1) != null ? m.group(1) : m.group(2);
            int cp = (int) Long.parseLong(hex, 16);
            String replacement = Character.isValidCodePoint(cp) ? new String(Character.toChars(cp)) : m.group();
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return out.toString();
    }

    /** Escapes private-use code points as {@code \UXXXXXXXX} (upper-case hex). */
    public static String encode(String text) {
        if (text == null) return null;
        StringBuilder out = null;
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            int n = Character.charCount(cp);
            if (isPrivateUse(cp)) {
                if (out == null) {
                    out = new StringBuilder(text.length() + 16);
                    out.append(text, 0, i);
                }
                out.append(String.format("\\U%08X", cp));
            } else if (out != null) {
                out.appendCodePoint(cp);
            }
            i += n;
        }
        return out == null ? text : out.toString();
    }

    public static boolean isPrivateUse(int cp) {
        return (cp >= 0xE000 && cp <= 0xF8FF)
                || (cp >= 0xF0000 && cp <= 0xFFFFD)
                || (cp >= 0x100000 && cp <= 0x10FFFD);
    }
}
