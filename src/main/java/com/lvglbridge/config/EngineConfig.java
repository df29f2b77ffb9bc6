/*
 * =============================================================================
 *  LvglBridge Display Configuration Toolkit
 *  File: EngineConfig.java
 * -----------------------------------------------------------------------------
 *  Purpose:
 *      Engine settings DTO. Defaults apply when a key is missing from the
 *      settings YAML (see EngineConfigLoader).
 * =============================================================================
 */
package com.lvglbridge.config;

public final class EngineConfig {

    public static final String DEFAULT_SECTION_KEY = "lvgl";
    public static final String DEFAULT_DOCUMENT_RESOURCE = "default-document.yaml";

    // discovery
    private String sectionKey = DEFAULT_SECTION_KEY;
    private int maxDepth = 30;

    // canvas size given to placeholder-sized root pages
    private int canvasWidth = 480;
    private int canvasHeight = 480;

    // emitter
    private int indent = 2;
    private int lineWidth = 120;

    // template used by generate() when nothing was parsed
    private String defaultDocument = DEFAULT_DOCUMENT_RESOURCE;

    public EngineConfig() {
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    // ===== Getters =====
    public String getSectionKey() { return sectionKey; }
    public int getMaxDepth() { return maxDepth; }
    public int getCanvasWidth() { return canvasWidth; }
    public int getCanvasHeight() { return canvasHeight; }
    public int getIndent() { return indent; }
    public int getLineWidth() { return lineWidth; }
    public String getDefaultDocument() { return defaultDocument; }

    // ===== Setters =====
    public void setSectionKey(String s) { if (s != null && !s.isBlank()) this.sectionKey = s.trim(); }
    public void setMaxDepth(int n) { if (n > 0) this.maxDepth = n; }
    public void setCanvasWidth(int n) { if (n > 0) this.canvasWidth = n; }
    public void setCanvasHeight(int n) { if (n > 0) this.canvasHeight = n; }
    /** Emitter indentation; SnakeYAML accepts 2..9. */
    public void setIndent(int n) { if (n >= 2 && n <= 9) this.indent = n; }
    public void setLineWidth(int n) { if (n > 20) this.lineWidth = n; }
    public void setDefaultDocument(String s) { if (s != null && !s.isBlank()) this.defaultDocument = s.trim(); }

    @Override public String toString() {
        return "EngineConfig{" +
                "sectionKey='" + sectionKey + '\'' +
                ", maxDepth=" + maxDepth +
                ", canvas=" + canvasWidth + "x" + canvasHeight +
                ", indent=" + indent +
                ", lineWidth=" + lineWidth +
                ", defaultDocument='" + defaultDocument + '\'' +
                '}';
    }
}
