// ============================================================================
// File: src/main/java/com/lvglbridge/document/HexLiteral.java
// ============================================================================

package com.lvglbridge.document;

/**
 * A hex integer literal such as {@code 0x007ACC}. Represented as a plain int-tagged
 * scalar so the emitter writes it unquoted, the way colours are written by hand.
 */
public record HexLiteral(String text) {
    @Override
    public String toString() {
        return text;
    }
}
