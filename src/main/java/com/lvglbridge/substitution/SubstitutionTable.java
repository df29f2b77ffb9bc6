/*
 * =============================================================================
 *  LvglBridge Display Configuration Toolkit
 *  File: SubstitutionTable.java
 * -----------------------------------------------------------------------------
 *  Purpose:
 *      Top-level "substitutions:" bindings and textual expansion of
 *      ${name} / $name references.
 *
 *  Rules:
 *      - Bindings keep document order.
 *      - $name only matches when not followed by [A-Za-z0-9_].
 *      - One pass: text pulled in from a value is not expanded again.
 *      - Unknown names are left as written.
 * =============================================================================
 */
package com.lvglbridge.substitution;

import com.lvglbridge.document.DocNodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class SubstitutionTable {

    private static final Logger log = LoggerFactory.getLogger(SubstitutionTable.class);

    public static final String SECTION_KEY = "substitutions";

    private final Map<String, String> bindings = new LinkedHashMap<>();
    private Pattern references;

    public SubstitutionTable() {
    }

    public SubstitutionTable(Map<String, String> bindings) {
        if (bindings != null) bindings.forEach(this::put);
    }

    /** Reads the top-level {@code substitutions:} mapping; empty when absent or not a mapping. */
    public static SubstitutionTable fromDocument(Node root) {
        SubstitutionTable table = new SubstitutionTable();
        Node section = DocNodes.get(root, SECTION_KEY);
        if (!(section instanceof MappingNode m)) {
            return table;
        }
        for (NodeTuple t : m.getValue()) {
            String name = DocNodes.keyOf(t);
            if (name == null) continue;
            Node value = t.getValueNode();
            if (!(value instanceof ScalarNode)) {
                log.debug("Skipping non-scalar substitution '{}'", name);
                continue;
            }
            String text = DocNodes.scalar(value);
            table.put(name, text == null ? "" : text);
        }
        return table;
    }

    public static boolean hasReference(String text) {
        return text != null && text.indexOf('$') >= 0;
    }

    /** Expands known references; text without a {@code $} is returned as is. */
    public String resolve(String text) {
        if (!hasReference(text) || bindings.isEmpty()) return text;
        Matcher m = references().matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (m.find()) {
            String name = m.group(1) != null ? m.group(1) : m.group(2);
            m.appendReplacement(out, Matcher.quoteReplacement(bindings.get(name)));
        }
        m.appendTail(out);
        return out.toString();
    }

    public void put(String name, String value) {
        if (name == null || name.isBlank()) return;
        bindings.put(name, value == null ? "" : value);
        references = null;
    }

    public String get(String name) {
        return bindings.get(name);
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    public int size() {
        return bindings.size();
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(bindings);
    }

    // Longest names first so that $ab wins over $a.
    private Pattern references() {
        if (references == null) {
            StringJoiner names = new StringJoiner("|");
            bindings.keySet().stream()
                    .sorted(Comparator.comparingInt(String::length).reversed())
                    .forEach(n -> names.add(Pattern.quote(n)));
            references = Pattern.compile("\\$\\{(" + names + ")}|\\$(" + names + ")(?![A-Za-z0-9_])");
        }
        return references;
    }

    @Override
    public String toString() {
        return "SubstitutionTable" + bindings;
    }
}
