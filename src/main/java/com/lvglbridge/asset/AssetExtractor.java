/*
 * =============================================================================
 *  LvglBridge Display Configuration Toolkit
 *  File: AssetExtractor.java
 * -----------------------------------------------------------------------------
 *  Purpose:
 *      Reads the top-level font: and image: sections into flat Asset records.
 *
 *  Notes:
 *      - Font entries need both id and file; others are skipped.
 *      - Google fonts ({type: gfonts, family: X}) become "gfonts://X".
 *      - Every declared glyph becomes an ICON asset owned by its font.
 *      - Image sizes come from width/height or from "resize: WxH".
 * =============================================================================
 */
package com.lvglbridge.asset;

import com.lvglbridge.codec.TextEscapeCodec;
import com.lvglbridge.document.DocNodes;
import com.lvglbridge.model.Asset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class AssetExtractor {

    private static final Logger log = LoggerFactory.getLogger(AssetExtractor.class);

    public static final String FONT_SECTION = "font";
    public static final String IMAGE_SECTION = "image";
    public static final String GOOGLE_FONTS_SCHEME = "gfonts://";

    private static final Pattern RESIZE = Pattern.compile("(\\d+)\\s*[xX]\\s*(\\d+)");

    public List<Asset> extract(Node root) {
        List<Asset> assets = new ArrayList<>();
        readFonts(DocNodes.get(root, FONT_SECTION), assets);
        readImages(DocNodes.get(root, IMAGE_SECTION), assets);
        log.debug("Extracted {} assets", assets.size());
        return assets;
    }

    private void readFonts(Node section, List<Asset> out) {
        for (Node entry : entries(section)) {
            String id = DocNodes.text(entry, "id");
            String source = fontSource(DocNodes.get(entry, "file"));
            if (id == null || source == null) {
                log.debug("Skipping font entry without id/file: id={}", id);
                continue;
            }
            String family = source.startsWith(GOOGLE_FONTS_SCHEME)
                    ? source.substring(GOOGLE_FONTS_SCHEME.length())
                    : id;
            out.add(Asset.font(id, family, integer(DocNodes.text(entry, "size")), source));

            for (String raw : glyphs(DocNodes.get(entry, "glyphs"))) {
                String glyph = TextEscapeCodec.decode(raw);
                if (glyph != null && !glyph.isEmpty()) {
                    out.add(Asset.icon(raw, glyph, id, source));
                }
            }
        }
    }

    private void readImages(Node section, List<Asset> out) {
        for (Node entry : entries(section)) {
            String id = DocNodes.text(entry, "id");
            String source = imageSource(DocNodes.get(entry, "file"));
            if (id == null || source == null) {
                log.debug("Skipping image entry without id/file: id={}", id);
                continue;
            }
            Integer width = integer(DocNodes.text(entry, "width"));
            Integer height = integer(DocNodes.text(entry, "height"));
            if (width == null && height == null) {
                int[] size = parseResize(DocNodes.text(entry, "resize"));
                if (size != null) {
                    width = size[0];
                    height = size[1];
                }
            }
            out.add(Asset.image(id, source, width, height));
        }
    }

    /**
     * Locator for a font {@code file:} value: the path for plain files, {@code gfonts://Family}
     * for Google fonts, null when the value is not understood.
     */
    public static String fontSource(Node file) {
        if (file instanceof ScalarNode) return DocNodes.scalar(file);
        if (file instanceof MappingNode) {
            String type = DocNodes.text(file, "type");
            if (type != null && type.toLowerCase(Locale.ROOT).equals("gfonts")) {
                String family = DocNodes.text(file, "family");
                return family == null ? null : GOOGLE_FONTS_SCHEME + family;
            }
            return DocNodes.text(file, "path");
        }
        return null;
    }

    public static String imageSource(Node file) {
        if (file instanceof MappingNode) return DocNodes.text(file, "path");
        return DocNodes.scalar(file);
    }

    /** Raw glyph strings as written (escapes not decoded). */
    public static List<String> glyphs(Node glyphs) {
        List<String> out = new ArrayList<>();
        if (glyphs instanceof SequenceNode) {
            for (Node g : DocNodes.items(glyphs)) {
                String raw = DocNodes.scalar(g);
                if (raw != null) out.add(raw);
            }
        } else {
            String raw = DocNodes.scalar(glyphs);
            if (raw != null) out.add(raw);
        }
        return out;
    }

    /** {@code "320x240"} to {320, 240}; null when the text is not a size. */
    public static int[] parseResize(String text) {
        if (text == null) return null;
        Matcher m = RESIZE.matcher(text.trim());
        if (!m.find()) return null;
        try {
            return new int[]{Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2))};
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static List<Node> entries(Node section) {
        List<Node> out = new ArrayList<>();
        for (Node n : DocNodes.items(section)) {
            if (n instanceof MappingNode) out.add(n);
        }
        return out;
    }

    private static Integer integer(String s) {
        if (s == null) return null;
        try {
            return Integer.valueOf(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
