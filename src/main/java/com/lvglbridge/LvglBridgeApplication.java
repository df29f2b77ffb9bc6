// ============================================================================
// Main Application Entry Point
// ============================================================================

package com.lvglbridge;

import com.lvglbridge.asset.FontNames;
import com.lvglbridge.config.EngineConfig;
import com.lvglbridge.config.EngineConfigLoader;
import com.lvglbridge.engine.YamlEngine;
import com.lvglbridge.model.Asset;
import com.lvglbridge.model.ParseResult;
import com.lvglbridge.model.WidgetNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;

public class LvglBridgeApplication {
    private static final Logger log = LoggerFactory.getLogger(LvglBridgeApplication.class);

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  lvglbridge summary <file>",
            "  lvglbridge normalize <in> [out]",
            "Options:",
            "  --config <settings.yaml>   engine settings (defaults from the classpath)");

    private final YamlEngine engine;
    private final PrintStream out;

    public LvglBridgeApplication(EngineConfig config, PrintStream out) {
        this.engine = new YamlEngine(config);
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Runs one command; returns the process exit code. */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        List<String> rest = new ArrayList<>(List.of(args));
        Path settings = null;
        int opt = rest.indexOf("--config");
        if (opt >= 0) {
            if (opt + 1 >= rest.size()) {
                err.println(USAGE);
                return 1;
            }
            settings = Paths.get(rest.get(opt + 1));
            rest.subList(opt, opt + 2).clear();
        }
        if (rest.isEmpty()) {
            err.println(USAGE);
            return 1;
        }

        try {
            EngineConfigLoader loader = new EngineConfigLoader();
            EngineConfig config = settings != null ? loader.loadFile(settings) : loader.loadDefaults();
            LvglBridgeApplication app = new LvglBridgeApplication(config, out);

            String command = rest.get(0);
            if ("summary".equals(command) && rest.size() == 2) {
                app.summary(Paths.get(rest.get(1)));
                return 0;
            }
            if ("normalize".equals(command) && (rest.size() == 2 || rest.size() == 3)) {
                app.normalize(Paths.get(rest.get(1)), rest.size() == 3 ? Paths.get(rest.get(2)) : null);
                return 0;
            }
            err.println(USAGE);
            return 1;
        } catch (IOException e) {
            log.error("Command failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    public void summary(Path file) throws IOException {
        ParseResult result = engine.parse(read(file));

        out.println("File: " + file.getFileName());
        out.println("Widgets: " + count(result.widgets()));
        out.println("Assets: " + result.assets().size());
        out.println("Style definitions: " + result.globalStyles().size());
        out.println("Substitutions: " + result.substitutions().size());

        for (Asset a : result.assets()) {
            if (a.isFont()) {
                Integer size = a.size() != null ? a.size() : FontNames.size(a.value());
                out.println("  font " + a.value() + " (" + FontNames.family(a.family())
                        + (size != null ? ", " + size + "px" : "") + ")");
            } else if (a.isImage()) {
                out.println("  image " + a.value() + " " + a.source()
                        + (a.width() != null ? " " + a.width() + "x" + a.height() : ""));
            }
        }
        for (WidgetNode w : result.widgets()) {
            outline(w, 0);
        }
    }

    public void normalize(Path in, Path target) throws IOException {
        ParseResult result = engine.parse(read(in));
        if (!engine.hasDocument()) {
            throw new IOException("Not a YAML document: " + in);
        }
        String text = engine.generate(result.widgets(), result.assets(),
                result.globalStyles(), result.substitutions());
        if (target == null) {
            out.print(text);
        } else {
            Files.writeString(target, text, StandardCharsets.UTF_8);
            log.info("Wrote {}", target);
        }
    }

    private void outline(WidgetNode w, int depth) {
        out.println("  ".repeat(depth + 1) + w.getType().canonicalTag() + " " + w.getName());
        for (WidgetNode child : w.getChildren()) {
            outline(child, depth + 1);
        }
    }

    private static int count(List<WidgetNode> nodes) {
        int n = 0;
        for (WidgetNode w : nodes) {
            n += 1 + count(w.getChildren());
        }
        return n;
    }

    private static String read(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("File not found: " + file);
        }
        return Files.readString(file, StandardCharsets.UTF_8);
    }
}
