/*
 * =============================================================================
 *  LvglBridge Display Configuration Toolkit
 *  File: ConfigDocument.java
 * -----------------------------------------------------------------------------
 *  Purpose:
 *      Format-preserving YAML document. Wraps the SnakeYAML node graph produced
 *      by compose() with comment processing on, and re-emits it through
 *      serialize() so comments, key order and scalar quoting survive.
 *
 *  Notes:
 *      - Never decode to native maps and dump again; that drops comments.
 *      - One Yaml instance per document (SnakeYAML is not thread-safe).
 *      - Output indentation follows the source: the mapping step most used
 *        there, and whether block sequences sit under their key ("key:\n- a")
 *        or indented ("key:\n  - a"). Configured values apply otherwise.
 * =============================================================================
 */
package com.lvglbridge.document;

import com.lvglbridge.codec.TextEscapeCodec;
import com.lvglbridge.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.Tag;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.*;

public final class ConfigDocument {

    private static final Logger log = LoggerFactory.getLogger(ConfigDocument.class);

    private static final int MAX_INDENT = 8;

    private final Yaml yaml;
    private final DialectConstructor constructor;
    private final DocumentEmitter emitter;
    private Node root;

    private ConfigDocument(Yaml yaml, DialectConstructor constructor, DocumentEmitter emitter, Node root) {
        this.yaml = yaml;
        this.constructor = constructor;
        this.emitter = emitter;
        this.root = root;
    }

    public static ConfigDocument parse(String text, EngineConfig config) throws DocumentException {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setProcessComments(true);
        loaderOptions.setAllowDuplicateKeys(true);

        DumperOptions dumperOptions = new DumperOptions();
        dumperOptions.setProcessComments(true);
        dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        applyIndent(dumperOptions, IndentStyle.detect(text, config.getIndent()));
        dumperOptions.setWidth(config.getLineWidth());
        dumperOptions.setSplitLines(false);
        dumperOptions.setAllowUnicode(true);

        DialectConstructor constructor = new DialectConstructor(loaderOptions);
        Yaml yaml = new Yaml(constructor, new DialectRepresenter(dumperOptions), dumperOptions, loaderOptions);

        try {
            Node root = yaml.compose(new StringReader(text == null ? "" : text));
            return new ConfigDocument(yaml, constructor, new DocumentEmitter(dumperOptions), root);
        } catch (YAMLException e) {
            throw new DocumentException("Unparsable YAML: " + e.getMessage(), e);
        }
    }

    /** Root node, or null for an empty document. */
    public Node getRoot() {
        return root;
    }

    public boolean isEmpty() {
        return root == null;
    }

    /** Root as a mapping, creating an empty one if the document had no content. */
    public MappingNode rootMapping() {
        if (root == null) {
            root = DocNodes.newMapping(new ArrayList<>());
        }
        return root instanceof MappingNode m ? m : null;
    }

    /** Native value (maps, lists, scalars, HexLiteral, TaggedScalar) to a detached node. */
    public Node createNode(Object value) {
        return yaml.represent(value);
    }

    /**
     * String node. Text carrying private-use glyphs is double-quoted, so the {@code \U}
     * escapes written for them on output are read back as escapes.
     */
    public Node createTextNode(String text) {
        if (text != null && text.codePoints().anyMatch(TextEscapeCodec::isPrivateUse)) {
            return new ScalarNode(Tag.STR, text, null, null, DumperOptions.ScalarStyle.DOUBLE_QUOTED);
        }
        return yaml.represent(text);
    }

    /** Node to native value; unknown-tag scalars come back as TaggedScalar. */
    public Object toNative(Node node) {
        return node == null ? null : constructor.toNative(node);
    }

    public String serialize() {
        if (root == null) return "";
        try {
            return emitter.emit(root);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Indented sequences at step 2 put the dash under the key's children and the item
     * content two further in; at larger steps the dash sits two in and the content a full
     * step in. Unindented sequences put the dash in the key's column.
     */
    private static void applyIndent(DumperOptions options, IndentStyle style) {
        options.setIndent(style.indent());
        if (!style.indentedSequences()) {
            options.setIndicatorIndent(0);
            options.setIndentWithIndicator(false);
        } else if (style.indent() == 2) {
            options.setIndicatorIndent(2);
            options.setIndentWithIndicator(true);
        } else {
            options.setIndicatorIndent(2);
            options.setIndentWithIndicator(false);
        }
        log.debug("Output indentation: {}", style);
    }

    /** Indentation observed in the source text. */
    record IndentStyle(int indent, boolean indentedSequences) {

        static IndentStyle detect(String text, int fallbackIndent) {
            Map<Integer, Integer> steps = new HashMap<>();
            int indented = 0;
            int flush = 0;

            int openerColumn = -1; // content column of the last line ending in ':'
            for (String line : (text == null ? "" : text).split("\r?\n")) {
                String trimmed = line.strip();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;

                int column = leadingSpaces(line);
                if (openerColumn >= 0 && column >= openerColumn) {
                    boolean dash = trimmed.equals("-") || trimmed.startsWith("- ");
                    if (dash) {
                        if (column == openerColumn) flush++;
                        else indented++;
                    } else if (column > openerColumn && column - openerColumn <= MAX_INDENT) {
                        steps.merge(column - openerColumn, 1, Integer::sum);
                    }
                }
                openerColumn = trimmed.endsWith(":") ? contentColumn(line, column) : -1;
            }

            int indent = fallbackIndent;
            int best = 0;
            for (Map.Entry<Integer, Integer> e : steps.entrySet()) {
                if (e.getValue() > best || (e.getValue() == best && e.getKey() < indent)) {
                    best = e.getValue();
                    indent = e.getKey();
                }
            }
            if (indent < 2) indent = fallbackIndent;
            return new IndentStyle(indent, flush == 0 || indented >= flush);
        }

        private static int leadingSpaces(String line) {
            int n = 0;
            while (n < line.length() && line.charAt(n) == ' ') n++;
            return n;
        }

        /** Column of the key itself, past any "- " sequence indicators in front of it. */
        private static int contentColumn(String line, int column) {
            int c = column;
            while (c + 1 < line.length() && line.charAt(c) == '-' && line.charAt(c + 1) == ' ') {
                c += 2;
                while (c < line.length() && line.charAt(c) == ' ') c++;
            }
            return c;
        }
    }
}
