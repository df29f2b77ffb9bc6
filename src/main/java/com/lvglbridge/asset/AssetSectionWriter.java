/*
 * =============================================================================
 *  LvglBridge Display Configuration Toolkit
 *  File: AssetSectionWriter.java
 * -----------------------------------------------------------------------------
 *  Purpose:
 *      Rewrites the top-level font: and image: sections from an asset list.
 *
 *  Rules:
 *      - One entry per FONT / IMAGE asset, in list order.
 *      - ICON assets are written as glyphs of their owning font.
 *      - The retained entry with the same id is merged, so keys that are not
 *        modelled here (bpp, type, dither, ...) survive.
 *      - Entries without an id were never modelled and are kept as they are.
 *      - An emptied section is removed.
 * =============================================================================
 */
package com.lvglbridge.asset;

import com.lvglbridge.codec.TextEscapeCodec;
import com.lvglbridge.document.ConfigDocument;
import com.lvglbridge.document.DocNodes;
import com.lvglbridge.model.Asset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;

import java.util.*;
import java.util.function.Predicate;

public final class AssetSectionWriter {

    private static final Logger log = LoggerFactory.getLogger(AssetSectionWriter.class);

    private static final List<String> FONT_KEYS = List.of("id", "file", "size", "glyphs");
    private static final List<String> IMAGE_KEYS = List.of("id", "file", "width", "height", "resize");

    private final ConfigDocument doc;

    public AssetSectionWriter(ConfigDocument doc) {
        this.doc = doc;
    }

    public void write(MappingNode root, List<Asset> assets) {
        List<Asset> list = assets == null ? List.of() : assets;
        writeFonts(root, list);
        writeImages(root, list);
    }

    // ---- fonts ----

    private void writeFonts(MappingNode root, List<Asset> assets) {
        Node section = DocNodes.get(root, AssetExtractor.FONT_SECTION);
        Map<String, MappingNode> retained = retainedById(section);

        List<Node> items = new ArrayList<>();
        for (Asset font : assets) {
            if (!font.isFont() || font.value() == null) continue;
            MappingNode entry = retained.remove(font.value());
            if (entry == null) entry = DocNodes.newMapping(new ArrayList<>());

            Map<String, Node> values = new LinkedHashMap<>();
            values.put("id", reuseText(DocNodes.get(entry, "id"), font.value()));

            Node oldFile = DocNodes.get(entry, "file");
            values.put("file", Objects.equals(AssetExtractor.fontSource(oldFile), font.source())
                    ? oldFile
                    : fontFileNode(font.source()));

            if (font.size() != null) {
                Node oldSize = DocNodes.get(entry, "size");
                values.put("size", Objects.equals(DocNodes.scalar(oldSize), String.valueOf(font.size()))
                        ? oldSize
                        : doc.createNode(font.size()));
            }

            List<String> glyphs = new ArrayList<>();
            for (Asset icon : assets) {
                if (icon.isIcon() && font.value().equals(icon.family()) && icon.value() != null) {
                    glyphs.add(icon.value());
                }
            }
            if (!glyphs.isEmpty()) {
                values.put("glyphs", glyphsNode(DocNodes.get(entry, "glyphs"), glyphs));
            }

            DocNodes.merge(entry, values, FONT_KEYS);
            items.add(entry);
        }
        for (Asset icon : assets) {
            if (icon.isIcon() && assets.stream().noneMatch(a -> a.isFont() && Objects.equals(a.value(), icon.family()))) {
                log.debug("Dropping glyph {} of unknown font {}", icon.name(), icon.family());
            }
        }
        replaceSection(root, AssetExtractor.FONT_SECTION, section, items,
                n -> AssetExtractor.fontSource(DocNodes.get(n, "file")) == null);
    }

    private Node fontFileNode(String source) {
        if (source != null && source.startsWith(AssetExtractor.GOOGLE_FONTS_SCHEME)) {
            Map<String, Node> gfonts = new LinkedHashMap<>();
            gfonts.put("type", doc.createNode("gfonts"));
            gfonts.put("family", doc.createNode(source.substring(AssetExtractor.GOOGLE_FONTS_SCHEME.length())));
            return DocNodes.mappingOf(gfonts);
        }
        return doc.createNode(source);
    }

    /** Keeps glyph items that still decode to the same glyph. */
    private Node glyphsNode(Node old, List<String> glyphs) {
        List<String> oldRaw = AssetExtractor.glyphs(old);
        List<String> oldDecoded = new ArrayList<>();
        for (String raw : oldRaw) oldDecoded.add(TextEscapeCodec.decode(raw));
        if (oldDecoded.equals(glyphs) && old != null) return old;

        if (old instanceof ScalarNode && glyphs.size() == 1) {
            return glyphNode(glyphs.get(0));
        }
        List<Node> items = new ArrayList<>();
        List<Node> oldItems = DocNodes.items(old);
        for (String glyph : glyphs) {
            Node reused = null;
            for (Node o : oldItems) {
                if (glyph.equals(TextEscapeCodec.decode(DocNodes.scalar(o)))) {
                    reused = o;
                    break;
                }
            }
            items.add(reused != null ? reused : glyphNode(glyph));
        }
        return DocNodes.newSequence(items);
    }

    private static Node glyphNode(String glyph) {
        return new ScalarNode(Tag.STR, glyph, null, null, DumperOptions.ScalarStyle.DOUBLE_QUOTED);
    }

    // ---- images ----

    private void writeImages(MappingNode root, List<Asset> assets) {
        Node section = DocNodes.get(root, AssetExtractor.IMAGE_SECTION);
        Map<String, MappingNode> retained = retainedById(section);

        List<Node> items = new ArrayList<>();
        for (Asset image : assets) {
            if (!image.isImage() || image.value() == null) continue;
            MappingNode entry = retained.remove(image.value());
            if (entry == null) entry = DocNodes.newMapping(new ArrayList<>());

            Map<String, Node> values = new LinkedHashMap<>();
            values.put("id", reuseText(DocNodes.get(entry, "id"), image.value()));
            Node oldFile = DocNodes.get(entry, "file");
            values.put("file", Objects.equals(AssetExtractor.imageSource(oldFile), image.source())
                    ? oldFile
                    : doc.createNode(image.source()));

            boolean explicitSize = DocNodes.has(entry, "width") || DocNodes.has(entry, "height");
            if (explicitSize) {
                putInt(values, entry, "width", image.width());
                putInt(values, entry, "height", image.height());
            } else if (image.width() != null && image.height() != null) {
                Node oldResize = DocNodes.get(entry, "resize");
                int[] old = AssetExtractor.parseResize(DocNodes.scalar(oldResize));
                int[] now = {image.width(), image.height()};
                values.put("resize", Arrays.equals(old, now)
                        ? oldResize
                        : doc.createNode(image.width() + "x" + image.height()));
            }

            DocNodes.merge(entry, values, IMAGE_KEYS);
            items.add(entry);
        }
        replaceSection(root, AssetExtractor.IMAGE_SECTION, section, items,
                n -> AssetExtractor.imageSource(DocNodes.get(n, "file")) == null);
    }

    private void putInt(Map<String, Node> values, Node entry, String key, Integer value) {
        if (value == null) return;
        Node old = DocNodes.get(entry, key);
        values.put(key, String.valueOf(value).equals(DocNodes.scalar(old)) ? old : doc.createNode(value));
    }

    // ---- shared ----

    private Node reuseText(Node old, String text) {
        return Objects.equals(DocNodes.scalar(old), text) ? old : doc.createNode(text);
    }

    /** Retained entries by id, in document order. Entries without an id are not included. */
    private static Map<String, MappingNode> retainedById(Node section) {
        Map<String, MappingNode> out = new LinkedHashMap<>();
        for (Node n : DocNodes.items(section)) {
            String id = DocNodes.text(n, "id");
            if (n instanceof MappingNode m && id != null) out.putIfAbsent(id, m);
        }
        return out;
    }

    /** Entries the extractor never read (no id, or a file it cannot locate) are kept after the modelled ones. */
    private static void replaceSection(MappingNode root, String key, Node section, List<Node> modelled,
                                       Predicate<Node> unreadable) {
        List<Node> items = new ArrayList<>(modelled);
        for (Node n : DocNodes.items(section)) {
            if (items.contains(n)) continue;
            if (!(n instanceof MappingNode) || DocNodes.text(n, "id") == null || unreadable.test(n)) items.add(n);
        }
        if (items.isEmpty()) {
            if (DocNodes.delete(root, key)) log.debug("Removed empty {} section", key);
            return;
        }
        if (section instanceof SequenceNode seq) {
            DocNodes.replaceItems(seq, items);
        } else {
            DocNodes.set(root, key, DocNodes.newSequence(items));
        }
    }
}
