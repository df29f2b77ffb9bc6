/*
 * =============================================================================
 *  EngineConfigLoader
 * =============================================================================
 *  Loads engine settings from YAML. Schema (all keys optional):
 *      section-key: lvgl
 *      max-depth: 30
 *      canvas:
 *        width: 480
 *        height: 480
 *      indent: 2
 *      line-width: 120
 *      default-document: default-document.yaml
 * =============================================================================
 */
package com.lvglbridge.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.*;

public final class EngineConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(EngineConfigLoader.class);

    public static final String DEFAULTS_RESOURCE = "lvglbridge-defaults.yaml";

    /** Classpath defaults; falls back to built-in values when the resource is absent. */
    public EngineConfig loadDefaults() throws IOException {
        try (InputStream in = EngineConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                log.debug("No {} on classpath, using built-in defaults", DEFAULTS_RESOURCE);
                return EngineConfig.defaults();
            }
            return load(in, DEFAULTS_RESOURCE);
        }
    }

    public EngineConfig loadFile(Path yamlFile) throws IOException {
        if (!Files.isRegularFile(yamlFile)) {
            throw new IOException("Engine settings file not found: " + yamlFile);
        }
        try (InputStream in = Files.newInputStream(yamlFile)) {
            return load(in, yamlFile.toString());
        }
    }

    private EngineConfig load(InputStream in, String source) throws IOException {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root;
        try {
            root = yaml.load(in);
        } catch (YAMLException e) {
            throw new IOException("Invalid engine settings in " + source + ": " + e.getMessage(), e);
        }

        EngineConfig cfg = EngineConfig.defaults();
        if (root == null) {
            return cfg;
        }
        if (!(root instanceof Map<?, ?> m)) {
            throw new IOException("Unsupported YAML root in " + source + ": " + root.getClass().getSimpleName());
        }

        Map<String, Object> map = asMapStringObject(m);
        cfg.setSectionKey(str(map.get("section-key"), null));
        cfg.setMaxDepth(integer(map.get("max-depth"), -1, source));
        cfg.setIndent(integer(map.get("indent"), -1, source));
        cfg.setLineWidth(integer(map.get("line-width"), -1, source));
        cfg.setDefaultDocument(str(map.get("default-document"), null));

        if (map.get("canvas") instanceof Map<?, ?> canvas) {
            Map<String, Object> c = asMapStringObject(canvas);
            cfg.setCanvasWidth(integer(c.get("width"), -1, source));
            cfg.setCanvasHeight(integer(c.get("height"), -1, source));
        }

        log.debug("Loaded engine settings from {}: {}", source, cfg);
        return cfg;
    }

    private static Map<String, Object> asMapStringObject(Map<?, ?> in) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : in.entrySet()) {
            out.put(String.valueOf(e.getKey()), e.getValue());
        }
        return out;
    }

    private static String str(Object o, String def) {
        return (o == null) ? def : String.valueOf(o);
    }

    private static int integer(Object o, int def, String source) {
        if (o == null) return def;
        if (o instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(String.valueOf(o).trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric setting '{}' in {}", o, source);
            return def;
        }
    }
}
