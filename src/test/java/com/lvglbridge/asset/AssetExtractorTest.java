package com.lvglbridge.asset;

import com.lvglbridge.config.EngineConfig;
import com.lvglbridge.document.ConfigDocument;
import com.lvglbridge.model.Asset;
import com.lvglbridge.model.AssetType;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

final class AssetExtractorTest {

    static final String ASSETS = String.join("\n",
            "font:",
            "  - file: \"fonts/Roboto-Regular.ttf\"",
            "    id: roboto_20",
            "    size: 20",
            "    bpp: 4",
            "  - file:",
            "      type: gfonts",
            "      family: Material Symbols Outlined",
            "    id: icons_32",
            "    size: 32",
            "    glyphs:",
            "      - \"\\U000F02DC\"",
            "      - \"\\U000F0493\"",
            "  - file: fonts/no-id.ttf",
            "image:",
            "  - file: images/logo.png",
            "    id: logo",
            "    resize: 64x48",
            "  - file: images/bg.png",
            "    id: background",
            "    width: 480",
            "    height: 320",
            "");

    private static List<Asset> extract(String yaml) throws Exception {
        return new AssetExtractor().extract(ConfigDocument.parse(yaml, EngineConfig.defaults()).getRoot());
    }

    @Test
    void readsFontsGlyphsAndImages() throws Exception {
        List<Asset> assets = extract(ASSETS);

        assertThat(assets).extracting(Asset::type, Asset::value, Asset::family, Asset::size, Asset::source)
                .containsExactly(
                        tuple(AssetType.FONT, "roboto_20", "roboto_20", 20, "fonts/Roboto-Regular.ttf"),
                        tuple(AssetType.FONT, "icons_32", "Material Symbols Outlined", 32, "gfonts://Material Symbols Outlined"),
                        tuple(AssetType.ICON, new String(Character.toChars(0xF02DC)), "icons_32", null, "gfonts://Material Symbols Outlined"),
                        tuple(AssetType.ICON, new String(Character.toChars(0xF0493)), "icons_32", null, "gfonts://Material Symbols Outlined"),
                        tuple(AssetType.IMAGE, "logo", null, null, "images/logo.png"),
                        tuple(AssetType.IMAGE, "background", null, null, "images/bg.png"));
    }

    @Test
    void imageSizeFromResizeOrExplicitKeys() throws Exception {
        List<Asset> images = extract(ASSETS).stream().filter(Asset::isImage).toList();

        assertThat(images).extracting(Asset::width, Asset::height)
                .containsExactly(tuple(64, 48), tuple(480, 320));
    }

    @Test
    void iconsAreNamedAfterTheGlyphAsWritten() throws Exception {
        Asset icon = extract(ASSETS).stream().filter(Asset::isIcon).findFirst().orElseThrow();
        assertThat(icon.name()).isEqualTo("Glyph " + new String(Character.toChars(0xF02DC)));
    }

    @Test
    void resizePattern() {
        assertThat(AssetExtractor.parseResize("320x240")).containsExactly(320, 240);
        assertThat(AssetExtractor.parseResize("32 X 32")).containsExactly(32, 32);
        assertThat(AssetExtractor.parseResize("big")).isNull();
    }

    @Test
    void documentWithoutAssetSections() throws Exception {
        assertThat(extract("esphome:\n  name: x\n")).isEmpty();
    }
}
