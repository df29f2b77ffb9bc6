package com.lvglbridge.engine;

import com.lvglbridge.config.EngineConfig;
import com.lvglbridge.document.TaggedScalar;
import com.lvglbridge.model.Dimension;
import com.lvglbridge.model.InteractionState;
import com.lvglbridge.model.LayoutDescriptor;
import com.lvglbridge.model.ParseResult;
import com.lvglbridge.model.StyleProperty;
import com.lvglbridge.model.StyleReference;
import com.lvglbridge.model.WidgetNode;
import com.lvglbridge.model.WidgetTree;
import com.lvglbridge.model.WidgetType;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;

final class WidgetTreeParserTest {

    private final YamlEngine engine = new YamlEngine();

    private static String yaml(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    private WidgetNode only(ParseResult r, String name) {
        return new WidgetTree(r.widgets()).findByName(name).orElseThrow();
    }

    @Test
    void buttonWithCheckedStyleReference() {
        ParseResult r = engine.parse(yaml(
                "lvgl:",
                "  style_definitions:",
                "    - id: checked_style",
                "      bg_color: 0x00FF00",
                "  pages:",
                "    - id: main_page",
                "      widgets:",
                "        - btn:",
                "            id: btn1",
                "            bg_color: 0x007ACC",
                "            styles:",
                "              - style_id: checked_style",
                "                state: CHECKED"));

        assertThat(r.widgets()).hasSize(1);
        WidgetNode page = r.widgets().get(0);
        assertThat(page.getType()).isEqualTo(WidgetType.PAGE);
        assertThat(page.getName()).isEqualTo("main_page");

        WidgetNode btn = page.getChildren().get(0);
        assertThat(btn.getType()).isEqualTo(WidgetType.BUTTON);
        assertThat(btn.getName()).isEqualTo("btn1");
        assertThat(btn.getStyles().get(StyleProperty.BG_COLOR)).isEqualTo("#007ACC");
        assertThat(btn.getStyleReferences())
                .containsExactly(StyleReference.of("checked_style", InteractionState.CHECKED));
        assertThat(r.globalStyles()).containsOnlyKeys("checked_style");
        assertThat(r.globalStyles().get("checked_style").get(StyleProperty.BG_COLOR)).isEqualTo("#00FF00");
    }

    @Test
    void geometryDefaultsAndValues() {
        ParseResult r = engine.parse(yaml(
                "lvgl:",
                "  widgets:",
                "    - obj:",
                "        id: panel",
                "        width: 50%",
                "        height: lv.pct(25)",
                "        widgets:",
                "          - label:",
                "              id: t",
                "              x: -4",
                "              y: ${top}",
                "              width: size_content"));

        WidgetNode panel = only(r, "panel");
        assertThat(panel.getX()).isEqualTo(Dimension.ZERO);
        assertThat(panel.getWidth()).isEqualTo(Dimension.percent(50));
        assertThat(panel.getHeight()).isEqualTo(Dimension.percent(25));

        WidgetNode t = only(r, "t");
        assertThat(t.getX()).isEqualTo(Dimension.px(-4));
        assertThat(t.getY()).isEqualTo(Dimension.raw("${top}"));
        assertThat(t.getWidth()).isEqualTo(Dimension.CONTENT);
        assertThat(t.getHeight()).isEqualTo(Dimension.CONTENT);
    }

    @Test
    void aliasesFoldToOneType() {
        ParseResult r = engine.parse(yaml(
                "lvgl:",
                "  widgets:",
                "    - button: {id: a}",
                "    - object: {id: b}",
                "    - img: {id: c, src: logo}",
                "    - image: {id: d}"));

        assertThat(r.widgets()).extracting(WidgetNode::getType)
                .containsExactly(WidgetType.BUTTON, WidgetType.OBJECT, WidgetType.IMAGE, WidgetType.IMAGE);
        assertThat(only(r, "c").getSrc()).isEqualTo("logo");
    }

    @Test
    void unknownWidgetTypesAreSkipped() {
        ParseResult r = engine.parse(yaml(
                "lvgl:",
                "  widgets:",
                "    - qrcode: {id: q, text: hi}",
                "    - label: {id: l}",
                "    - just a string"));

        assertThat(r.widgets()).extracting(WidgetNode::getName).containsExactly("l");
    }

    @Test
    void actionsAtItemAndPropsLevel() {
        ParseResult r = engine.parse(yaml(
                "lvgl:",
                "  widgets:",
                "    - btn:",
                "        id: b",
                "        on_press:",
                "          - logger.log: pressed",
                "      on_click:",
                "        - lambda: !lambda \"id(light).toggle();\""));

        Map<String, Object> actions = only(r, "b").getActions();
        assertThat(actions).containsOnlyKeys("on_click", "on_press");
        assertThat(actions.get("on_press")).isEqualTo(List.of(Map.of("logger.log", "pressed")));
        assertThat(actions.get("on_click"))
                .isEqualTo(List.of(Map.of("lambda", new TaggedScalar("!lambda", "id(light).toggle();"))));
    }

    @Test
    void placeholderSizedRootsGetTheCanvas() {
        ParseResult r = engine.parse(yaml(
                "lvgl:",
                "  pages:",
                "    - id: p",
                "      width: 0",
                "      height: 0",
                "      widgets:",
                "        - obj: {id: inner, width: 100, height: 100}",
                "  widgets:",
                "    - obj: {id: root, width: 100, height: 100}",
                "    - obj: {id: sized, width: 100, height: 200}"));

        assertThat(only(r, "p").getWidth()).isEqualTo(Dimension.px(480));
        assertThat(only(r, "p").getHeight()).isEqualTo(Dimension.px(480));
        assertThat(only(r, "root").getWidth()).isEqualTo(Dimension.px(480));
        assertThat(only(r, "inner").getWidth()).isEqualTo(Dimension.px(100));
        assertThat(only(r, "sized").getWidth()).isEqualTo(Dimension.px(100));
    }

    @Test
    void sequenceShapedSection() {
        ParseResult r = engine.parse(yaml(
                "lvgl:",
                "  - label: {id: a}",
                "  - btn: {id: b}"));
        assertThat(r.widgets()).extracting(WidgetNode::getName).containsExactly("a", "b");
    }

    @Test
    void singleWidgetSection() {
        ParseResult r = engine.parse(yaml(
                "lvgl:",
                "  obj:",
                "    id: root",
                "    width: 200",
                "    height: 120"));
        assertThat(r.widgets()).extracting(WidgetNode::getName).containsExactly("root");
        assertThat(r.widgets().get(0).getWidth()).isEqualTo(Dimension.px(200));
    }

    @Test
    void nestedSectionIsFound() {
        ParseResult r = engine.parse(yaml(
                "packages:",
                "  ui:",
                "    lvgl:",
                "      widgets:",
                "        - label: {id: deep}"));
        assertThat(r.widgets()).extracting(WidgetNode::getName).containsExactly("deep");
    }

    @Test
    void missingSectionStillReturnsSideTables() {
        ParseResult r = engine.parse(yaml(
                "substitutions:",
                "  name: kitchen",
                "font:",
                "  - file: a.ttf",
                "    id: a"));
        assertThat(r.widgets()).isEmpty();
        assertThat(r.substitutions()).containsEntry("name", "kitchen");
        assertThat(r.assets()).hasSize(1);
        assertThat(engine.hasDocument()).isTrue();
    }

    @Test
    void unparsableTextGivesEmptyResult() {
        ParseResult r = engine.parse("lvgl: [unclosed\n  widgets: {");
        assertThat(r.widgets()).isEmpty();
        assertThat(r.assets()).isEmpty();
        assertThat(engine.hasDocument()).isFalse();
    }

    @Test
    void labelScalarFormAndGeneratedName() {
        ParseResult r = engine.parse(yaml(
                "lvgl:",
                "  widgets:",
                "    - label: \"Hello\""));
        WidgetNode label = r.widgets().get(0);
        assertThat(label.getText()).isEqualTo("Hello");
        assertThat(label.getName()).matches("label_[0-9a-f]{4}");
    }

    @Test
    void typedPropertiesAndSubstitutionFallback() {
        ParseResult r = engine.parse(yaml(
                "substitutions:",
                "  level: \"42\"",
                "lvgl:",
                "  widgets:",
                "    - slider:",
                "        id: s",
                "        min_value: 0",
                "        max_value: 100",
                "        value: $level",
                "        hidden: \"off\"",
                "    - dropdown:",
                "        id: d",
                "        options: [Low, High]",
                "    - roller:",
                "        id: r",
                "        options: \"One\\nTwo\"",
                "    - arc:",
                "        id: a",
                "        range: {min: 10, max: 90}",
                "        start_angle: 135",
                "        end_angle: 45",
                "    - label:",
                "        id: l",
                "        long_mode: scroll_circular",
                "        text: \"\\U000F02DC Home\"",
                "        text_align: center"));

        WidgetNode s = only(r, "s");
        assertThat(s.getMinValue()).isZero();
        assertThat(s.getMaxValue()).isEqualTo(100);
        assertThat(s.getValue()).isEqualTo(42);
        assertThat(s.getHidden()).isFalse();
        assertThat(only(r, "d").getOptions()).containsExactly("Low", "High");
        assertThat(only(r, "r").getOptions()).containsExactly("One", "Two");
        assertThat(only(r, "a").getRangeMin()).isEqualTo(10);
        assertThat(only(r, "a").getRangeMax()).isEqualTo(90);
        assertThat(only(r, "a").getStartAngle()).isEqualTo(135);

        WidgetNode l = only(r, "l");
        assertThat(l.getLongMode()).isEqualTo("SCROLL_CIRCULAR");
        assertThat(l.getText()).isEqualTo(new String(Character.toChars(0xF02DC)) + " Home");
        assertThat(l.getStyles().get(StyleProperty.TEXT_ALIGN)).isEqualTo("CENTER");
    }

    @Test
    void layoutBlockAndGridCells() {
        ParseResult r = engine.parse(yaml(
                "lvgl:",
                "  widgets:",
                "    - obj:",
                "        id: grid",
                "        layout:",
                "          type: grid",
                "          grid_rows: [FR(1), CONTENT]",
                "          grid_dsc_cols: [lv.fr(2), 100]",
                "          pad_row: 4",
                "        widgets:",
                "          - label:",
                "              id: cell",
                "              grid_cell_column_pos: 1",
                "              grid_cell_row_pos: 0",
                "              grid_cell_x_align: stretch",
                "    - obj:",
                "        id: row",
                "        layout: flex",
                "        flex_grow: 1"));

        LayoutDescriptor grid = only(r, "grid").getLayout();
        assertThat(grid.getType()).isEqualTo(LayoutDescriptor.LayoutType.GRID);
        assertThat(grid.getGridRows()).containsExactly("1fr", "content");
        assertThat(grid.getGridColumns()).containsExactly("2fr", 100);
        assertThat(grid.getPadRow()).isEqualTo(4);

        WidgetNode cell = only(r, "cell");
        assertThat(cell.getGridCellColumnPos()).isEqualTo(1);
        assertThat(cell.getGridCellXAlign()).isEqualTo("STRETCH");

        LayoutDescriptor row = only(r, "row").getLayout();
        assertThat(row.getType()).isEqualTo(LayoutDescriptor.LayoutType.FLEX);
        assertThat(row.getFlexGrow()).isEqualTo(1);
    }

    @Test
    void defaultStateInlineStylesFlattenUnderDirectOnes() {
        ParseResult r = engine.parse(yaml(
                "lvgl:",
                "  widgets:",
                "    - btn:",
                "        id: b",
                "        radius: 2",
                "        styles:",
                "          - bg_color: 0x111111",
                "            radius: 9",
                "          - state: PRESSED",
                "            bg_color: 0x222222"));

        WidgetNode b = only(r, "b");
        assertThat(b.getStyles().get(StyleProperty.BG_COLOR)).isEqualTo("#111111");
        assertThat(b.getStyles().get(StyleProperty.RADIUS)).isEqualTo(2);
        assertThat(b.getStyleReferences()).hasSize(2);
    }

    @Test
    void depthCeilingStopsDescent() {
        EngineConfig cfg = EngineConfig.defaults();
        cfg.setMaxDepth(1);
        ParseResult r = new YamlEngine(cfg).parse(yaml(
                "lvgl:",
                "  widgets:",
                "    - obj:",
                "        id: a",
                "        widgets:",
                "          - obj:",
                "              id: b",
                "              widgets:",
                "                - obj: {id: c}"));

        assertThat(new WidgetTree(r.widgets()).flatten()).extracting(WidgetNode::getName).containsExactly("a", "b");
    }
}
