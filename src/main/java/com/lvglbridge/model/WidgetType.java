// ============================================================================
// File: src/main/java/com/lvglbridge/model/WidgetType.java
// ============================================================================

package com.lvglbridge.model;

import java.util.*;

/**
 * Logical widget types. In the dialect the type is whichever key is present
 * ({@code - btn: {...}}), so each type carries its dialect tags; the first tag is the
 * canonical one used when writing a widget that has no source tag to reuse.
 */
public enum WidgetType {
    PAGE("page"),
    OBJECT("obj", "object"),
    BUTTON("btn", "button"),
    LABEL("label"),
    ARC("arc"),
    BAR("bar"),
    SLIDER("slider"),
    SWITCH("switch"),
    CHECKBOX("checkbox"),
    SPINBOX("spinbox"),
    DROPDOWN("dropdown"),
    ROLLER("roller"),
    TEXTAREA("textarea"),
    LED("led"),
    IMAGE("image", "img"),
    METER("meter");

    private static final Map<String, WidgetType> BY_TAG;

    static {
        Map<String, WidgetType> m = new HashMap<>();
        for (WidgetType t : values()) {
            for (String tag : t.tags) m.put(tag, t);
        }
        BY_TAG = Collections.unmodifiableMap(m);
    }

    private final List<String> tags;

    WidgetType(String... tags) {
        this.tags = List.of(tags);
    }

    public String canonicalTag() {
        return tags.get(0);
    }

    public List<String> tags() {
        return tags;
    }

    public boolean hasTag(String tag) {
        return tag != null && tags.contains(tag);
    }

    /** Pages and plain objects are the containers that get the canvas-size treatment. */
    public boolean isContainer() {
        return this == PAGE || this == OBJECT;
    }

    /** Type for a dialect key, or null when the key is not a widget tag. */
    public static WidgetType fromTag(String tag) {
        if (tag == null) return null;
        WidgetType t = BY_TAG.get(tag);
        return t != null ? t : BY_TAG.get(tag.toLowerCase(Locale.ROOT));
    }
}
