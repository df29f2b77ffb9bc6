/*
 * =============================================================================
 *  LvglBridge Display Configuration Toolkit
 *  File: YamlEngine.java
 * -----------------------------------------------------------------------------
 *  Purpose:
 *      Engine session. parse() reads a YAML config into the widget tree and
 *      side tables and keeps the document; generate() merges an edited tree
 *      back into that same document and re-emits it.
 *
 *  Notes:
 *      - One current document per engine, replaced by each parse and mutated
 *        in place by each generate.
 *      - Public methods are synchronized; the engine is a single-writer object.
 *      - parse() never throws for bad input; it logs and returns an empty result,
 *        also when reading a well-formed document fails unexpectedly.
 * =============================================================================
 */
package com.lvglbridge.engine;

import com.lvglbridge.asset.AssetExtractor;
import com.lvglbridge.asset.AssetSectionWriter;
import com.lvglbridge.codec.TextEscapeCodec;
import com.lvglbridge.config.EngineConfig;
import com.lvglbridge.document.ConfigDocument;
import com.lvglbridge.document.DocNodes;
import com.lvglbridge.document.DocumentException;
import com.lvglbridge.model.Asset;
import com.lvglbridge.model.ParseResult;
import com.lvglbridge.model.StyleProperties;
import com.lvglbridge.model.WidgetNode;
import com.lvglbridge.style.StyleResolver;
import com.lvglbridge.substitution.SubstitutionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.*;

public class YamlEngine {

    private static final Logger log = LoggerFactory.getLogger(YamlEngine.class);

    private final EngineConfig config;

    // current session
    private ConfigDocument current;
    private Map<String, WidgetSource> bindings = new LinkedHashMap<>();

    public YamlEngine() {
        this(EngineConfig.defaults());
    }

    public YamlEngine(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public EngineConfig getConfig() {
        return config;
    }

    /**
     * Parses a YAML config. The document becomes the engine's current document.
     *
     * @return widgets, assets, substitutions and global styles; empty when the text is not YAML
     */
    public synchronized ParseResult parse(String yamlText) {
        ConfigDocument doc;
        try {
            doc = ConfigDocument.parse(yamlText, config);
        } catch (DocumentException e) {
            log.error("Cannot parse configuration: {}", e.getMessage());
            reset();
            return ParseResult.empty();
        }
        current = doc;
        bindings = new LinkedHashMap<>();
        try {
            return read(doc);
        } catch (RuntimeException e) {
            log.error("Failed to read configuration", e);
            reset();
            return ParseResult.empty();
        }
    }

    private ParseResult read(ConfigDocument doc) {
        Node root = doc.getRoot();
        SubstitutionTable subs = SubstitutionTable.fromDocument(root);
        List<Asset> assets = new AssetExtractor().extract(root);

        SectionLocator.Location loc = new SectionLocator(config.getSectionKey(), config.getMaxDepth()).locate(root);
        if (loc == null) {
            log.warn("No '{}' section found; no widgets loaded", config.getSectionKey());
            return new ParseResult(new ArrayList<>(), new ArrayList<>(assets),
                    new LinkedHashMap<>(subs.asMap()), new LinkedHashMap<>());
        }

        StyleResolver styles = new StyleResolver(subs);
        Map<String, StyleProperties> globals =
                styles.readDefinitions(DocNodes.get(loc.section(), StyleResolver.DEFINITIONS_KEY));
        styles = new StyleResolver(subs, globals);

        WidgetTreeParser parser = new WidgetTreeParser(config, doc, subs, styles);
        List<WidgetNode> widgets = parser.parseSection(loc.section());
        bindings = new LinkedHashMap<>(parser.bindings());

        log.info("Parsed {} root widgets, {} assets, {} style definitions, {} substitutions",
                widgets.size(), assets.size(), globals.size(), subs.size());
        return new ParseResult(new ArrayList<>(widgets), new ArrayList<>(assets),
                new LinkedHashMap<>(subs.asMap()), new LinkedHashMap<>(globals));
    }

    /**
     * Writes the edited state into the current document (or the default template when nothing
     * was parsed) and returns the new text. Content the engine does not model is left as is.
     */
    public synchronized String generate(List<WidgetNode> widgets,
                                        List<Asset> assets,
                                        Map<String, StyleProperties> globalStyles,
                                        Map<String, String> substitutions) {
        if (current == null || current.rootMapping() == null) {
            if (current != null) {
                log.warn("Current document root is not a mapping; starting from the default template");
            }
            current = loadTemplate();
            bindings = new LinkedHashMap<>();
        }
        MappingNode root = current.rootMapping();

        SubstitutionTable subs = new SubstitutionTable(substitutions);
        writeSubstitutions(root, substitutions);
        new AssetSectionWriter(current).write(root, assets == null ? List.of() : assets);

        StyleResolver styles = new StyleResolver(subs, globalStyles == null ? Map.of() : globalStyles);
        WidgetTreeSerializer serializer = new WidgetTreeSerializer(config, current, subs, styles, bindings);
        serializer.writeSection(root, widgets == null ? List.of() : widgets, globalStyles);
        bindings = new LinkedHashMap<>(serializer.bindings());

        return TextEscapeCodec.encode(current.serialize());
    }

    /** Drops the current document; the next generate starts from the template. */
    public synchronized void reset() {
        current = null;
        bindings = new LinkedHashMap<>();
    }

    public synchronized boolean hasDocument() {
        return current != null;
    }

    // ---- internals ----

    /** Wholesale rewrite of the top-level substitutions mapping; new sections go first. */
    private void writeSubstitutions(MappingNode root, Map<String, String> substitutions) {
        Node old = DocNodes.get(root, SubstitutionTable.SECTION_KEY);
        if (substitutions == null || substitutions.isEmpty()) {
            DocNodes.delete(root, SubstitutionTable.SECTION_KEY);
            return;
        }
        MappingNode target = old instanceof MappingNode m ? m : DocNodes.newMapping(new ArrayList<>());

        Map<String, Node> values = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : substitutions.entrySet()) {
            Node oldValue = DocNodes.get(target, e.getKey());
            boolean same = oldValue instanceof ScalarNode
                    && Objects.equals(e.getValue(), Objects.toString(DocNodes.scalar(oldValue), ""));
            values.put(e.getKey(), same ? oldValue : current.createNode(e.getValue() == null ? "" : e.getValue()));
        }
        // non-scalar entries were never read, so they are not managed
        List<String> managed = new ArrayList<>();
        for (NodeTuple t : target.getValue()) {
            if (t.getValueNode() instanceof ScalarNode) managed.add(DocNodes.keyOf(t));
        }
        DocNodes.merge(target, values, managed);

        if (old == null) {
            root.getValue().add(0, new NodeTuple(DocNodes.keyNode(SubstitutionTable.SECTION_KEY), target));
        } else if (old != target) {
            DocNodes.set(root, SubstitutionTable.SECTION_KEY, target);
        }
    }

    private ConfigDocument loadTemplate() {
        String resource = config.getDefaultDocument();
        String text = "";
        try (InputStream in = YamlEngine.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.warn("Default document {} not on classpath; starting from an empty document", resource);
            } else {
                text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            log.error("Cannot read default document {}", resource, e);
        }
        try {
            return ConfigDocument.parse(text, config);
        } catch (DocumentException e) {
            log.error("Default document {} is not valid YAML: {}", resource, e.getMessage());
            try {
                return ConfigDocument.parse("", config);
            } catch (DocumentException impossible) {
                throw new IllegalStateException(impossible);
            }
        }
    }
}
