// ============================================================================
// File: src/main/java/com/lvglbridge/model/WidgetNode.java
// ============================================================================

package com.lvglbridge.model;

import java.util.*;

/**
 * One UI element of the widget tree.
 * <p>
 * {@code id} is engine-internal: generated on construction, never reused and never written
 * to the document. {@code name} is the dialect-visible {@code id:} value. Optional fields are
 * null when the document does not set them. The node exclusively owns its children.
 */
public final class WidgetNode {

    private final String id;
    private String name;
    private WidgetType type;

    // geometry
    private Dimension x = Dimension.ZERO;
    private Dimension y = Dimension.ZERO;
    private Dimension width = Dimension.CONTENT;
    private Dimension height = Dimension.CONTENT;
    private String align;

    // styling
    private StyleProperties styles = new StyleProperties();
    private final List<StyleReference> styleReferences = new ArrayList<>();
    private LayoutDescriptor layout;

    // grid cell placement
    private Integer gridCellColumnPos;
    private Integer gridCellColumnSpan;
    private Integer gridCellRowPos;
    private Integer gridCellRowSpan;
    private String gridCellXAlign;
    private String gridCellYAlign;

    // state flags
    private Boolean hidden;
    private Boolean clickable;
    private Boolean checkable;
    private Boolean checked;

    // type-specific
    private String text;
    private List<String> options;
    private String longMode;
    private Integer minValue;
    private Integer maxValue;
    private Integer value;
    private Integer rangeMin;
    private Integer rangeMax;
    private Integer rotation;
    private Integer startAngle;
    private Integer endAngle;
    private String src;

    private final Map<String, Object> actions = new LinkedHashMap<>();
    private final List<WidgetNode> children = new ArrayList<>();

    public WidgetNode(WidgetType type, String name) {
        this(UUID.randomUUID().toString(), type, name);
    }

    private WidgetNode(String id, WidgetType type, String name) {
        this.id = id;
        this.type = Objects.requireNonNull(type, "type");
        this.name = name;
    }

    /** Deep copy with fresh ids throughout (ids are never reused). */
    public WidgetNode duplicate() {
        WidgetNode c = new WidgetNode(type, name);
        c.x = x; c.y = y; c.width = width; c.height = height; c.align = align;
        c.styles = styles.copy();
        for (StyleReference r : styleReferences) {
            c.styleReferences.add(new StyleReference(r.styleId(), r.state(), r.styles() == null ? null : r.styles().copy()));
        }
        c.layout = layout == null ? null : layout.copy();
        c.gridCellColumnPos = gridCellColumnPos; c.gridCellColumnSpan = gridCellColumnSpan;
        c.gridCellRowPos = gridCellRowPos; c.gridCellRowSpan = gridCellRowSpan;
        c.gridCellXAlign = gridCellXAlign; c.gridCellYAlign = gridCellYAlign;
        c.hidden = hidden; c.clickable = clickable; c.checkable = checkable; c.checked = checked;
        c.text = text;
        c.options = options == null ? null : new ArrayList<>(options);
        c.longMode = longMode;
        c.minValue = minValue; c.maxValue = maxValue; c.value = value;
        c.rangeMin = rangeMin; c.rangeMax = rangeMax;
        c.rotation = rotation; c.startAngle = startAngle; c.endAngle = endAngle;
        c.src = src;
        c.actions.putAll(actions);
        for (WidgetNode child : children) c.children.add(child.duplicate());
        return c;
    }

    // ===== Getters =====
    public String getId() { return id; }
    public String getName() { return name; }
    public WidgetType getType() { return type; }

    public Dimension getX() { return x; }
    public Dimension getY() { return y; }
    public Dimension getWidth() { return width; }
    public Dimension getHeight() { return height; }
    public String getAlign() { return align; }

    public StyleProperties getStyles() { return styles; }
    public List<StyleReference> getStyleReferences() { return styleReferences; }
    public LayoutDescriptor getLayout() { return layout; }

    public Integer getGridCellColumnPos() { return gridCellColumnPos; }
    public Integer getGridCellColumnSpan() { return gridCellColumnSpan; }
    public Integer getGridCellRowPos() { return gridCellRowPos; }
    public Integer getGridCellRowSpan() { return gridCellRowSpan; }
    public String getGridCellXAlign() { return gridCellXAlign; }
    public String getGridCellYAlign() { return gridCellYAlign; }

    public Boolean getHidden() { return hidden; }
    public Boolean getClickable() { return clickable; }
    public Boolean getCheckable() { return checkable; }
    public Boolean getChecked() { return checked; }

    public String getText() { return text; }
    public List<String> getOptions() { return options; }
    public String getLongMode() { return longMode; }
    public Integer getMinValue() { return minValue; }
    public Integer getMaxValue() { return maxValue; }
    public Integer getValue() { return value; }
    public Integer getRangeMin() { return rangeMin; }
    public Integer getRangeMax() { return rangeMax; }
    public Integer getRotation() { return rotation; }
    public Integer getStartAngle() { return startAngle; }
    public Integer getEndAngle() { return endAngle; }
    public String getSrc() { return src; }

    /** Trigger name ({@code on_*}) to opaque action value, in document order. */
    public Map<String, Object> getActions() { return actions; }
    public List<WidgetNode> getChildren() { return children; }

    // ===== Setters =====
    public void setName(String name) { this.name = name; }
    public void setType(WidgetType type) { this.type = Objects.requireNonNull(type, "type"); }

    public void setX(Dimension d) { this.x = Objects.requireNonNull(d, "x"); }
    public void setY(Dimension d) { this.y = Objects.requireNonNull(d, "y"); }
    public void setWidth(Dimension d) { this.width = Objects.requireNonNull(d, "width"); }
    public void setHeight(Dimension d) { this.height = Objects.requireNonNull(d, "height"); }
    public void setAlign(String s) { this.align = s; }

    public void setStyles(StyleProperties s) { this.styles = s == null ? new StyleProperties() : s; }
    public void setLayout(LayoutDescriptor l) { this.layout = l; }

    public void setGridCellColumnPos(Integer n) { this.gridCellColumnPos = n; }
    public void setGridCellColumnSpan(Integer n) { this.gridCellColumnSpan = n; }
    public void setGridCellRowPos(Integer n) { this.gridCellRowPos = n; }
    public void setGridCellRowSpan(Integer n) { this.gridCellRowSpan = n; }
    public void setGridCellXAlign(String s) { this.gridCellXAlign = s; }
    public void setGridCellYAlign(String s) { this.gridCellYAlign = s; }

    public void setHidden(Boolean b) { this.hidden = b; }
    public void setClickable(Boolean b) { this.clickable = b; }
    public void setCheckable(Boolean b) { this.checkable = b; }
    public void setChecked(Boolean b) { this.checked = b; }

    public void setText(String s) { this.text = s; }
    public void setOptions(List<String> options) { this.options = options == null ? null : new ArrayList<>(options); }
    public void setLongMode(String s) { this.longMode = s; }
    public void setMinValue(Integer n) { this.minValue = n; }
    public void setMaxValue(Integer n) { this.maxValue = n; }
    public void setValue(Integer n) { this.value = n; }
    public void setRangeMin(Integer n) { this.rangeMin = n; }
    public void setRangeMax(Integer n) { this.rangeMax = n; }
    public void setRotation(Integer n) { this.rotation = n; }
    public void setStartAngle(Integer n) { this.startAngle = n; }
    public void setEndAngle(Integer n) { this.endAngle = n; }
    public void setSrc(String s) { this.src = s; }

    public WidgetNode addChild(WidgetNode child) {
        children.add(Objects.requireNonNull(child, "child"));
        return this;
    }

    @Override public String toString() {
        return "WidgetNode{" + type.canonicalTag() + " '" + name + "'"
                + (children.isEmpty() ? "" : ", children=" + children.size())
                + '}';
    }
}
