// ============================================================================
// File: src/main/java/com/lvglbridge/model/Asset.java
// ============================================================================

package com.lvglbridge.model;

import java.util.*;

/**
 * Flat asset record. {@code value} is the handle other fields use to refer to the asset
 * (font id, glyph text, image id); {@code source} is the underlying resource locator.
 * Widgets never hold a reference to an Asset, only the raw handle string.
 */
public record Asset(
        String id,
        String name,
        AssetType type,
        String value,
        String family,
        Integer size,
        String source,
        Integer width,
        Integer height
) {

    public static Asset font(String fontId, String family, Integer size, String source) {
        return new Asset(newId(), fontId, AssetType.FONT, fontId, family, size, source, null, null);
    }

    /** Glyph declared on the font {@code fontId}; {@code rawName} is the glyph as written. */
    public static Asset icon(String rawName, String glyph, String fontId, String fontSource) {
        return new Asset(newId(), "Glyph " + rawName, AssetType.ICON, glyph, fontId, null, fontSource, null, null);
    }

    public static Asset image(String imageId, String source, Integer width, Integer height) {
        return new Asset(newId(), imageId, AssetType.IMAGE, imageId, null, null, source, width, height);
    }

    public boolean isFont() { return type == AssetType.FONT; }
    public boolean isIcon() { return type == AssetType.ICON; }
    public boolean isImage() { return type == AssetType.IMAGE; }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
