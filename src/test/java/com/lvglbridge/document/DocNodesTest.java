package com.lvglbridge.document;

import com.lvglbridge.config.EngineConfig;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;

final class DocNodesTest {

    private static ConfigDocument parse(String... lines) throws DocumentException {
        return ConfigDocument.parse(String.join("\n", lines) + "\n", EngineConfig.defaults());
    }

    @Test
    void mergeTouchesOnlyManagedKeys() throws Exception {
        ConfigDocument doc = parse(
                "w:",
                "  id: a",
                "  x: 10",
                "  custom: keep");
        MappingNode w = (MappingNode) DocNodes.get(doc.getRoot(), "w");

        Map<String, Node> values = new LinkedHashMap<>();
        values.put("id", doc.createNode("a"));
        values.put("y", doc.createNode(5));
        DocNodes.merge(w, values, List.of("id", "x", "y"));

        assertThat(DocNodes.keys(w)).containsExactly("id", "custom", "y");
        assertThat(DocNodes.text(w, "y")).isEqualTo("5");
    }

    @Test
    void equivalentValueKeepsOriginalNode() throws Exception {
        ConfigDocument doc = parse("w:", "  label: 'quoted'");
        MappingNode w = (MappingNode) DocNodes.get(doc.getRoot(), "w");
        Node original = DocNodes.get(w, "label");

        DocNodes.merge(w, Map.of("label", doc.createNode("quoted")), List.of("label"));

        assertThat(DocNodes.get(w, "label")).isSameAs(original);
        assertThat(doc.serialize()).contains("label: 'quoted'");
    }

    @Test
    void setKeepsPositionAndComments() throws Exception {
        ConfigDocument doc = parse(
                "first: 1",
                "second: 2  # important",
                "third: 3");
        MappingNode root = doc.rootMapping();

        DocNodes.set(root, "second", doc.createNode(22));

        assertThat(DocNodes.keys(root)).containsExactly("first", "second", "third");
        String out = doc.serialize();
        assertThat(out).contains("second: 22").contains("# important");
    }

    @Test
    void renameKeepsValueAndPosition() throws Exception {
        ConfigDocument doc = parse("a: 1", "btn: {id: b}", "c: 3");
        MappingNode root = doc.rootMapping();
        Node value = DocNodes.get(root, "btn");

        assertThat(DocNodes.rename(root, "btn", "button")).isTrue();

        assertThat(DocNodes.keys(root)).containsExactly("a", "button", "c");
        assertThat(DocNodes.get(root, "button")).isSameAs(value);
        assertThat(DocNodes.rename(root, "missing", "x")).isFalse();
    }

    @Test
    void equivalenceIgnoresStyleButNotOrder() throws Exception {
        ConfigDocument doc = parse(
                "a: {x: 1, y: [1, 2]}",
                "b:",
                "  x: '1'",
                "  y:",
                "    - 1",
                "    - 2",
                "c: {y: [1, 2], x: 1}");
        Node a = DocNodes.get(doc.getRoot(), "a");
        assertThat(DocNodes.equivalent(a, DocNodes.get(doc.getRoot(), "b"))).isTrue();
        assertThat(DocNodes.equivalent(a, DocNodes.get(doc.getRoot(), "c"))).isFalse();
    }

    @Test
    void explicitNullScalarReadsAsNull() throws Exception {
        ConfigDocument doc = parse("a:", "b: ~", "c: text");
        assertThat(DocNodes.text(doc.getRoot(), "a")).isNull();
        assertThat(DocNodes.text(doc.getRoot(), "b")).isNull();
        assertThat(DocNodes.text(doc.getRoot(), "c")).isEqualTo("text");
        assertThat(DocNodes.text(doc.getRoot(), "missing")).isNull();
    }
}
