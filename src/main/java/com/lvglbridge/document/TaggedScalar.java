// ============================================================================
// File: src/main/java/com/lvglbridge/document/TaggedScalar.java
// ============================================================================

package com.lvglbridge.document;

/**
 * Scalar carrying a tag the safe constructor does not know, e.g. {@code !lambda} or
 * {@code !secret}. Kept as-is so action blocks survive a decode/encode cycle.
 */
public record TaggedScalar(String tag, String value) {
}
