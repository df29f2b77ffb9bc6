// ============================================================================
// File: src/main/java/com/lvglbridge/model/LayoutDescriptor.java
// ============================================================================

package com.lvglbridge.model;

import java.util.*;

/**
 * {@code layout:} block of a container. Flex keywords are kept as written
 * (e.g. {@code ROW_WRAP}); grid tracks are decoded by GridTrackCodec into Integer pixels or
 * the strings {@code "content"}, {@code "Nfr"}, {@code "N%"}.
 */
public final class LayoutDescriptor {

    public enum LayoutType {
        ABSOLUTE, FLEX, GRID;

        public static LayoutType fromDialect(String s) {
            if (s == null || s.isBlank()) return ABSOLUTE;
            try {
                return valueOf(s.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return ABSOLUTE;
            }
        }

        public String dialectName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private LayoutType type = LayoutType.ABSOLUTE;
    private String flexFlow;
    private String flexAlignMain;
    private String flexAlignCross;
    private String flexAlignTrack;
    private Integer flexGrow;
    private List<Object> gridColumns;
    private List<Object> gridRows;
    private Integer padRow;
    private Integer padColumn;

    public LayoutDescriptor() {
    }

    public LayoutDescriptor(LayoutType type) {
        this.type = type == null ? LayoutType.ABSOLUTE : type;
    }

    public LayoutDescriptor copy() {
        LayoutDescriptor c = new LayoutDescriptor(type);
        c.flexFlow = flexFlow;
        c.flexAlignMain = flexAlignMain;
        c.flexAlignCross = flexAlignCross;
        c.flexAlignTrack = flexAlignTrack;
        c.flexGrow = flexGrow;
        c.gridColumns = gridColumns == null ? null : new ArrayList<>(gridColumns);
        c.gridRows = gridRows == null ? null : new ArrayList<>(gridRows);
        c.padRow = padRow;
        c.padColumn = padColumn;
        return c;
    }

    public LayoutType getType() { return type; }
    public String getFlexFlow() { return flexFlow; }
    public String getFlexAlignMain() { return flexAlignMain; }
    public String getFlexAlignCross() { return flexAlignCross; }
    public String getFlexAlignTrack() { return flexAlignTrack; }
    public Integer getFlexGrow() { return flexGrow; }
    public List<Object> getGridColumns() { return gridColumns; }
    public List<Object> getGridRows() { return gridRows; }
    public Integer getPadRow() { return padRow; }
    public Integer getPadColumn() { return padColumn; }

    public void setType(LayoutType type) { this.type = type == null ? LayoutType.ABSOLUTE : type; }
    public void setFlexFlow(String s) { this.flexFlow = s; }
    public void setFlexAlignMain(String s) { this.flexAlignMain = s; }
    public void setFlexAlignCross(String s) { this.flexAlignCross = s; }
    public void setFlexAlignTrack(String s) { this.flexAlignTrack = s; }
    public void setFlexGrow(Integer n) { this.flexGrow = n; }
    public void setGridColumns(List<Object> tracks) { this.gridColumns = tracks; }
    public void setGridRows(List<Object> tracks) { this.gridRows = tracks; }
    public void setPadRow(Integer n) { this.padRow = n; }
    public void setPadColumn(Integer n) { this.padColumn = n; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LayoutDescriptor that)) return false;
        return type == that.type
                && Objects.equals(flexFlow, that.flexFlow)
                && Objects.equals(flexAlignMain, that.flexAlignMain)
                && Objects.equals(flexAlignCross, that.flexAlignCross)
                && Objects.equals(flexAlignTrack, that.flexAlignTrack)
                && Objects.equals(flexGrow, that.flexGrow)
                && Objects.equals(gridColumns, that.gridColumns)
                && Objects.equals(gridRows, that.gridRows)
                && Objects.equals(padRow, that.padRow)
                && Objects.equals(padColumn, that.padColumn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, flexFlow, flexAlignMain, flexAlignCross, flexAlignTrack, flexGrow,
                gridColumns, gridRows, padRow, padColumn);
    }

    @Override
    public String toString() {
        return "Layout{" + type.dialectName()
                + (flexFlow != null ? ", flow=" + flexFlow : "")
                + (gridColumns != null ? ", cols=" + gridColumns : "")
                + (gridRows != null ? ", rows=" + gridRows : "")
                + '}';
    }
}
