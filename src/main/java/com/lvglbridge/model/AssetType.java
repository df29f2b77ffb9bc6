// ============================================================================
// File: src/main/java/com/lvglbridge/model/AssetType.java
// ============================================================================

package com.lvglbridge.model;

public enum AssetType {
    FONT,
    /** A glyph declared on a font, usually a private-use-area icon. */
    ICON,
    IMAGE
}
