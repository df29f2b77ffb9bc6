package com.lvglbridge.engine;

import com.lvglbridge.model.Asset;
import com.lvglbridge.model.Dimension;
import com.lvglbridge.model.InteractionState;
import com.lvglbridge.model.LayoutDescriptor;
import com.lvglbridge.model.ParseResult;
import com.lvglbridge.model.StyleProperties;
import com.lvglbridge.model.StyleProperty;
import com.lvglbridge.model.StyleReference;
import com.lvglbridge.model.WidgetNode;
import com.lvglbridge.model.WidgetTree;
import com.lvglbridge.model.WidgetType;
import com.lvglbridge.style.StyleResolver;
import com.lvglbridge.substitution.SubstitutionTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

final class YamlEngineTest {

    static final String KITCHEN = String.join("\n",
            "# Kitchen panel",
            "substitutions:",
            "  accent: \"0xFF8800\"",
            "",
            "esphome:",
            "  name: kitchen",
            "",
            "font:",
            "  - file: \"fonts/Roboto-Regular.ttf\"",
            "    id: roboto_20",
            "    size: 20",
            "",
            "lvgl:",
            "  style_definitions:",
            "    - id: checked_style",
            "      bg_color: 0x00FF00",
            "  pages:",
            "    - id: main_page",
            "      bg_color: 0x000000",
            "      widgets:",
            "        - btn:",
            "            id: btn1",
            "            x: 10",
            "            y: 20",
            "            width: 120",
            "            height: 50",
            "            bg_color: 0x007ACC # brand blue",
            "            styles:",
            "              - style_id: checked_style",
            "                state: CHECKED",
            "            on_click:",
            "              - logger.log: \"clicked\"",
            "            widgets:",
            "              - label:",
            "                  id: btn1_label",
            "                  text: \"Press\"",
            "                  align: CENTER",
            "        - qrcode:",
            "            id: qr",
            "            text: \"https://example.com\"",
            "");

    private YamlEngine engine;

    @BeforeEach
    void setUp() {
        engine = new YamlEngine();
    }

    private String regenerate(ParseResult r) {
        return engine.generate(r.widgets(), r.assets(), r.globalStyles(), r.substitutions());
    }

    private static WidgetNode find(ParseResult r, String name) {
        return new WidgetTree(r.widgets()).findByName(name).orElseThrow();
    }

    @Test
    void unchangedModelReproducesTheDocument() {
        assertThat(regenerate(engine.parse(KITCHEN))).isEqualTo(KITCHEN);
    }

    @Test
    void applicationTagsOutsideLvglComeBackUnchanged() {
        String doc = String.join("\n",
                "wifi:",
                "  ssid: !secret wifi_ssid",
                "  password: !secret wifi_password",
                "esphome:",
                "  name: kitchen",
                "  on_boot:",
                "    - lambda: !lambda return id(boot_count) + 1;",
                "lvgl:",
                "  pages:",
                "    - id: main_page",
                "      widgets:",
                "        - label:",
                "            id: title",
                "            text: \"Hi\"",
                "");
        ParseResult r = engine.parse(doc);

        assertThat(regenerate(r)).isEqualTo(doc);

        find(r, "title").setX(Dimension.px(5));
        assertThat(regenerate(r))
                .contains("  ssid: !secret wifi_ssid\n  password: !secret wifi_password\n")
                .contains("    - lambda: !lambda return id(boot_count) + 1;\n");
    }

    @Test
    void oversizedNumbersDoNotAbortParsing() {
        String doc = String.join("\n",
                "lvgl:",
                "  pages:",
                "    - id: main_page",
                "      widgets:",
                "        - obj:",
                "            id: box",
                "            width: 99999999999%",
                "            x: lv.pct(99999999999)",
                "");

        assertThatCode(() -> engine.parse(doc)).doesNotThrowAnyException();
        ParseResult r = engine.parse(doc);
        assertThat(find(r, "box").getWidth()).isEqualTo(Dimension.raw("99999999999%"));
        assertThat(find(r, "box").getX()).isEqualTo(Dimension.raw("lv.pct(99999999999)"));
        assertThat(regenerate(r)).isEqualTo(doc);
    }

    @Test
    void regenerationIsIdempotent() {
        String first = regenerate(engine.parse(KITCHEN.replace("                  id: btn1_label\n", "")));
        String second = regenerate(engine.parse(first));
        assertThat(second).isEqualTo(first);
    }

    @Test
    void editedColourIsMergedInPlace() {
        ParseResult r = engine.parse(KITCHEN);
        find(r, "btn1").getStyles().set(StyleProperty.BG_COLOR, "#FF0000");

        String out = regenerate(r);

        assertThat(out).isEqualTo(KITCHEN.replace("bg_color: 0x007ACC", "bg_color: 0xFF0000"));
    }

    @Test
    void reparsedOutputMatchesTheEditedModel() {
        ParseResult r = engine.parse(KITCHEN);
        WidgetNode btn = find(r, "btn1");
        btn.setWidth(Dimension.percent(50));
        btn.setChecked(true);
        btn.getStyleReferences().add(new StyleReference(null, InteractionState.PRESSED,
                new StyleProperties().set(StyleProperty.BG_OPA, 1.0)));
        btn.getActions().put("on_long_press", List.of(Map.of("logger.log", "long")));

        ParseResult again = new YamlEngine().parse(regenerate(r));

        WidgetNode back = find(again, "btn1");
        assertThat(back.getWidth()).isEqualTo(Dimension.percent(50));
        assertThat(back.getChecked()).isTrue();
        assertThat(back.getStyles()).isEqualTo(btn.getStyles());
        assertThat(back.getStyleReferences()).isEqualTo(btn.getStyleReferences());
        assertThat(back.getActions()).isEqualTo(btn.getActions());
        assertThat(back.getChildren()).extracting(WidgetNode::getName).containsExactly("btn1_label");
        assertThat(again.globalStyles()).isEqualTo(r.globalStyles());
    }

    @Test
    void checkedStyleSurvivesTheRoundTrip() {
        ParseResult again = new YamlEngine().parse(regenerate(engine.parse(KITCHEN)));
        WidgetNode btn = find(again, "btn1");

        StyleProperties checked = new StyleResolver(new SubstitutionTable(again.substitutions()), again.globalStyles())
                .effective(btn, EnumSet.of(InteractionState.CHECKED));

        assertThat(btn.getStyles().get(StyleProperty.BG_COLOR)).isEqualTo("#007ACC");
        assertThat(checked.get(StyleProperty.BG_COLOR)).isEqualTo("#00FF00");
    }

    @Test
    void unknownContentAndCommentsArePreserved() {
        ParseResult r = engine.parse(KITCHEN);
        WidgetNode page = find(r, "main_page");
        WidgetNode added = new WidgetNode(WidgetType.LABEL, "status");
        added.setText("Ready");
        page.addChild(added);

        String out = regenerate(r);

        assertThat(out).startsWith("# Kitchen panel\n");
        assertThat(out).contains("# brand blue");
        assertThat(out).contains("esphome:\n  name: kitchen\n");
        assertThat(out).contains("        - qrcode:\n            id: qr\n");
        assertThat(out).contains("        - label:\n            id: status\n            text: Ready\n");
        assertThat(out.indexOf("qrcode")).isLessThan(out.indexOf("id: status"));
    }

    @Test
    void removedWidgetLeavesUnknownItems() {
        ParseResult r = engine.parse(KITCHEN);
        WidgetTree tree = new WidgetTree(r.widgets());
        tree.remove(find(r, "btn1").getId());

        String out = regenerate(r);

        assertThat(out).doesNotContain("btn1").doesNotContain("- btn:");
        assertThat(out).contains("- qrcode:");
    }

    @Test
    void typeChangeRenamesTheTagAndKeepsProps() {
        ParseResult r = engine.parse(KITCHEN);
        find(r, "btn1").setType(WidgetType.OBJECT);

        String out = regenerate(r);

        assertThat(out).contains("        - obj:\n            id: btn1\n");
        assertThat(out).doesNotContain("- btn:");
    }

    @Test
    void movedWidgetCarriesItsFormatting() {
        ParseResult r = engine.parse(KITCHEN);
        WidgetTree tree = new WidgetTree(r.widgets());
        tree.move(find(r, "btn1_label").getId(), find(r, "main_page").getId(), 0);

        String out = regenerate(r);

        assertThat(out).contains("      widgets:\n        - label:\n            id: btn1_label\n            text: \"Press\"\n");
        assertThat(new YamlEngine().parse(out).widgets().get(0).getChildren())
                .extracting(WidgetNode::getName).containsExactly("btn1_label", "btn1");
    }

    @Test
    void substitutionsAreRewrittenWholesale() {
        ParseResult r = engine.parse(KITCHEN);
        Map<String, String> subs = new LinkedHashMap<>(r.substitutions());
        subs.put("accent", "orange");
        subs.put("title", "Kitchen");

        String out = engine.generate(r.widgets(), r.assets(), r.globalStyles(), subs);

        assertThat(out).startsWith("# Kitchen panel\nsubstitutions:\n  accent: orange\n  title: Kitchen\n");

        String cleared = engine.generate(r.widgets(), r.assets(), r.globalStyles(), Map.of());
        assertThat(cleared).doesNotContain("substitutions:").contains("esphome:");
    }

    @Test
    void assetsAndStyleDefinitionsAreWrittenBack() {
        ParseResult r = engine.parse(KITCHEN);
        List<Asset> assets = new ArrayList<>(r.assets());
        assets.add(Asset.image("logo", "images/logo.png", 64, 64));
        Map<String, StyleProperties> styles = new LinkedHashMap<>(r.globalStyles());
        styles.put("danger", new StyleProperties().set(StyleProperty.BG_COLOR, "#FF0000"));

        String out = engine.generate(r.widgets(), assets, styles, r.substitutions());

        assertThat(out).contains("image:\n  - id: logo\n    file: images/logo.png\n    resize: 64x64\n");
        assertThat(out).contains("    - id: danger\n      bg_color: 0xFF0000\n");
        assertThat(new YamlEngine().parse(out).globalStyles()).containsOnlyKeys("checked_style", "danger");
    }

    @Test
    void glyphTextIsEscapedOnOutput() {
        ParseResult r = engine.parse(KITCHEN);
        find(r, "btn1_label").setText(new String(Character.toChars(0xF02DC)) + " Home");

        String out = regenerate(r);

        assertThat(out).contains("text: \"\\U000F02DC Home\"");
        assertThat(find(new YamlEngine().parse(out), "btn1_label").getText())
                .isEqualTo(new String(Character.toChars(0xF02DC)) + " Home");
    }

    @Test
    void generateWithoutParseUsesTheTemplate() {
        WidgetNode page = new WidgetNode(WidgetType.PAGE, "main_page");
        WidgetNode btn = new WidgetNode(WidgetType.BUTTON, "btn1");
        btn.getStyles().set(StyleProperty.BG_COLOR, "#007ACC");
        btn.getStyleReferences().add(StyleReference.of("checked_style", InteractionState.CHECKED));
        page.addChild(btn);
        Map<String, StyleProperties> styles = Map.of("checked_style",
                new StyleProperties().set(StyleProperty.BG_COLOR, "#00FF00"));

        String out = engine.generate(List.of(page), List.of(), styles, Map.of("name", "demo"));

        assertThat(out).contains("esphome:").contains("disp_bg_color: 0x000000");
        assertThat(out).contains(String.join("\n",
                "  pages:",
                "    - id: main_page",
                "      widgets:",
                "        - btn:",
                "            id: btn1",
                "            styles:",
                "              - id: checked_style",
                "                state: CHECKED",
                "            bg_color: 0x007ACC",
                ""));
        assertThat(out).doesNotContain("widgets: []");

        ParseResult back = new YamlEngine().parse(out);
        assertThat(find(back, "btn1").getStyleReferences()).isEqualTo(btn.getStyleReferences());
    }

    @Test
    void missingSectionIsAppended() {
        ParseResult r = engine.parse("esphome:\n  name: x\n");
        WidgetNode label = new WidgetNode(WidgetType.LABEL, "hello");
        label.setText("Hi");

        String out = engine.generate(List.of(label), r.assets(), r.globalStyles(), r.substitutions());

        assertThat(out).isEqualTo("esphome:\n  name: x\nlvgl:\n  widgets:\n    - label:\n        id: hello\n        text: Hi\n");
    }

    @Test
    void singleWidgetSectionIsEditedInPlace() {
        String doc = "lvgl:\n  obj:\n    id: root\n    width: 200\n    height: 120\n";
        ParseResult r = engine.parse(doc);
        r.widgets().get(0).setWidth(Dimension.px(300));

        assertThat(regenerate(r)).isEqualTo(doc.replace("width: 200", "width: 300"));
    }

    @Test
    void singleWidgetSectionBecomesAListWhenRootsAreAdded() {
        ParseResult r = engine.parse("lvgl:\n  obj:\n    id: root\n    width: 200\n    height: 120\n");
        r.widgets().add(new WidgetNode(WidgetType.LABEL, "second"));

        String out = regenerate(r);

        assertThat(out).doesNotContain("\n  obj:\n");
        assertThat(new YamlEngine().parse(out).widgets()).extracting(WidgetNode::getName)
                .containsExactly("root", "second");
    }

    @Test
    void sequenceSectionKeepsItsShape() {
        ParseResult r = engine.parse("lvgl:\n  - label:\n      id: a\n");
        r.widgets().add(new WidgetNode(WidgetType.LED, "b"));

        assertThat(regenerate(r)).isEqualTo("lvgl:\n  - label:\n      id: a\n  - led:\n      id: b\n");
    }

    @Test
    void layoutEditsStayInTheLayoutBlock() {
        String doc = String.join("\n",
                "lvgl:",
                "  widgets:",
                "    - obj:",
                "        id: row",
                "        layout:",
                "          type: flex",
                "          flex_flow: ROW_WRAP",
                "        flex_grow: 1",
                "");
        ParseResult r = engine.parse(doc);
        LayoutDescriptor layout = r.widgets().get(0).getLayout();
        layout.setFlexFlow("COLUMN");
        layout.setGridRows(null);

        assertThat(regenerate(r)).isEqualTo(doc.replace("ROW_WRAP", "COLUMN"));
    }

    @Test
    void parseAfterFailureStartsOver() {
        engine.parse("a: [");
        assertThat(engine.hasDocument()).isFalse();
        String out = engine.generate(List.of(), List.of(), Map.of(), Map.of());
        assertThat(out).contains("lvgl:");
    }
}
