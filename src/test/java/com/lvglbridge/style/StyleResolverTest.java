package com.lvglbridge.style;

import com.lvglbridge.config.EngineConfig;
import com.lvglbridge.document.ConfigDocument;
import com.lvglbridge.document.DocNodes;
import com.lvglbridge.model.InteractionState;
import com.lvglbridge.model.StyleProperties;
import com.lvglbridge.model.StyleProperty;
import com.lvglbridge.model.StyleReference;
import com.lvglbridge.model.WidgetNode;
import com.lvglbridge.model.WidgetType;
import com.lvglbridge.substitution.SubstitutionTable;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.ScalarNode;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;

final class StyleResolverTest {

    private static Node node(String yaml) throws Exception {
        return DocNodes.get(ConfigDocument.parse(yaml, EngineConfig.defaults()).getRoot(), "v");
    }

    private static StyleProperties bg(String color) {
        return new StyleProperties().set(StyleProperty.BG_COLOR, color);
    }

    @Test
    void readsDefinitionsWithIdInOrder() throws Exception {
        StyleResolver r = new StyleResolver(new SubstitutionTable());
        Map<String, StyleProperties> defs = r.readDefinitions(node(String.join("\n",
                "v:",
                "  - id: primary",
                "    bg_color: 0x007ACC",
                "    radius: 8",
                "    bg_opa: 50%",
                "  - bg_color: 0xFFFFFF",
                "  - id: accent",
                "    text_align: center",
                "")));

        assertThat(defs).containsOnlyKeys("primary", "accent");
        assertThat(defs.get("primary").asMap()).containsExactly(
                Map.entry(StyleProperty.BG_COLOR, "#007ACC"),
                Map.entry(StyleProperty.RADIUS, 8),
                Map.entry(StyleProperty.BG_OPA, 0.5));
        assertThat(defs.get("accent").getString(StyleProperty.TEXT_ALIGN)).isEqualTo("CENTER");
    }

    @Test
    void referenceForms() throws Exception {
        StyleResolver r = new StyleResolver(new SubstitutionTable());

        assertThat(r.readReferences(node("v: primary\n"))).containsExactly(StyleReference.of("primary"));
        assertThat(r.readReferences(node("v: [a, b]\n")))
                .containsExactly(StyleReference.of("a"), StyleReference.of("b"));

        List<StyleReference> objects = r.readReferences(node(String.join("\n",
                "v:",
                "  - style_id: checked_style",
                "    state: checked",
                "  - state: PRESSED",
                "    bg_color: 0xFF0000",
                "  - id: x",
                "    state: HOVERED",
                "")));
        assertThat(objects).containsExactly(
                StyleReference.of("checked_style", InteractionState.CHECKED),
                new StyleReference(null, InteractionState.PRESSED, bg("#FF0000")));
    }

    @Test
    void checkedStateOverridesDefaultLayers() {
        Map<String, StyleProperties> globals = new LinkedHashMap<>();
        globals.put("base", bg("#111111").set(StyleProperty.RADIUS, 4));
        globals.put("checked_style", bg("#00FF00"));
        StyleResolver r = new StyleResolver(new SubstitutionTable(), globals);

        WidgetNode btn = new WidgetNode(WidgetType.BUTTON, "btn1");
        btn.getStyleReferences().add(StyleReference.of("base"));
        btn.getStyleReferences().add(StyleReference.of("checked_style", InteractionState.CHECKED));
        btn.getStyleReferences().add(new StyleReference(null, InteractionState.CHECKED,
                new StyleProperties().set(StyleProperty.TEXT_COLOR, "#FFFFFF")));
        btn.setStyles(bg("#007ACC"));

        StyleProperties idle = r.effective(btn, Set.of());
        assertThat(idle.get(StyleProperty.BG_COLOR)).isEqualTo("#007ACC");
        assertThat(idle.get(StyleProperty.RADIUS)).isEqualTo(4);
        assertThat(idle.has(StyleProperty.TEXT_COLOR)).isFalse();

        StyleProperties checked = r.effective(btn, EnumSet.of(InteractionState.CHECKED));
        assertThat(checked.get(StyleProperty.BG_COLOR)).isEqualTo("#00FF00");
        assertThat(checked.get(StyleProperty.TEXT_COLOR)).isEqualTo("#FFFFFF");
        assertThat(checked.get(StyleProperty.RADIUS)).isEqualTo(4);
    }

    @Test
    void laterActiveStateWins() {
        Map<String, StyleProperties> globals = new LinkedHashMap<>();
        globals.put("on", bg("#00FF00"));
        globals.put("off", bg("#888888"));
        StyleResolver r = new StyleResolver(new SubstitutionTable(), globals);

        WidgetNode sw = new WidgetNode(WidgetType.SWITCH, "sw");
        sw.getStyleReferences().add(StyleReference.of("off", InteractionState.DISABLED));
        sw.getStyleReferences().add(StyleReference.of("on", InteractionState.CHECKED));

        StyleProperties both = r.effective(sw, EnumSet.of(InteractionState.CHECKED, InteractionState.DISABLED));
        assertThat(both.get(StyleProperty.BG_COLOR)).isEqualTo("#888888");
    }

    @Test
    void effectiveResolvesSubstitutions() {
        SubstitutionTable subs = new SubstitutionTable(Map.of("accent", "0xFF8800", "font", "roboto_20"));
        StyleResolver r = new StyleResolver(subs);
        WidgetNode label = new WidgetNode(WidgetType.LABEL, "l");
        label.setStyles(bg("${accent}").set(StyleProperty.TEXT_FONT, "$font"));

        StyleProperties out = r.effective(label, Set.of());

        assertThat(out.get(StyleProperty.BG_COLOR)).isEqualTo("#FF8800");
        assertThat(out.get(StyleProperty.TEXT_FONT)).isEqualTo("roboto_20");
        assertThat(label.getStyles().get(StyleProperty.BG_COLOR)).isEqualTo("${accent}");
    }

    @Test
    void singleBareReferenceStaysScalar() throws Exception {
        ConfigDocument doc = ConfigDocument.parse("v: primary\n", EngineConfig.defaults());
        StyleResolver r = new StyleResolver(new SubstitutionTable());
        Node old = DocNodes.get(doc.getRoot(), "v");

        Node same = r.writeReferences(List.of(StyleReference.of("primary")), old, doc);
        Node renamed = r.writeReferences(List.of(StyleReference.of("secondary")), old, doc);

        assertThat(same).isSameAs(old);
        assertThat(renamed).isInstanceOf(ScalarNode.class);
        assertThat(DocNodes.scalar(renamed)).isEqualTo("secondary");
    }

    @Test
    void definitionsWriteBackAndDropRemovedOnes() throws Exception {
        ConfigDocument doc = ConfigDocument.parse(String.join("\n",
                "v:",
                "  - id: primary",
                "    bg_color: 0x007ACC  # brand",
                "    bpp_hint: 1",
                "  - id: gone",
                "    radius: 2",
                ""), EngineConfig.defaults());
        StyleResolver r = new StyleResolver(new SubstitutionTable());
        Node old = DocNodes.get(doc.getRoot(), "v");
        Map<String, StyleProperties> table = new LinkedHashMap<>(r.readDefinitions(old));
        table.remove("gone");
        table.get("primary").set(StyleProperty.RADIUS, 6);

        Node written = r.writeDefinitions(table, old, doc);
        DocNodes.set(doc.rootMapping(), "v", written);

        String out = doc.serialize();
        assertThat(written).isSameAs(old);
        assertThat(out).contains("bg_color: 0x007ACC # brand").contains("bpp_hint: 1").contains("radius: 6");
        assertThat(out).doesNotContain("gone");
        assertThat(r.writeDefinitions(Map.of(), null, doc)).isNull();
    }

    @Test
    void newDefinitionKeepsThePropertyOrderItWasBuiltIn() throws Exception {
        ConfigDocument doc = ConfigDocument.parse("a: 1\n", EngineConfig.defaults());
        StyleResolver r = new StyleResolver(new SubstitutionTable());
        Map<String, StyleProperties> table = Map.of("card", new StyleProperties()
                .set(StyleProperty.RADIUS, 4)
                .set(StyleProperty.BG_COLOR, "#112233"));

        DocNodes.set(doc.rootMapping(), "v", r.writeDefinitions(table, null, doc));

        assertThat(doc.serialize()).isEqualTo("a: 1\nv:\n  - id: card\n    radius: 4\n    bg_color: 0x112233\n");
    }
}
