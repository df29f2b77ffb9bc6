// ============================================================================
// File: src/main/java/com/lvglbridge/model/StyleProperties.java
// ============================================================================

package com.lvglbridge.model;

import java.util.*;

/**
 * Flattened map of optional style values. An absent key means "not set here", which is
 * what layering relies on: {@link #overlay(StyleProperties)} only overwrites keys the other
 * map actually sets. Keys keep the order they were first set in, which is the order they
 * are written back in.
 */
public final class StyleProperties {

    private final Map<StyleProperty, Object> values = new LinkedHashMap<>();

    public StyleProperties() {
    }

    public StyleProperties(StyleProperties other) {
        if (other != null) values.putAll(other.values);
    }

    public static StyleProperties of(Map<StyleProperty, ?> in) {
        StyleProperties s = new StyleProperties();
        in.forEach(s::set);
        return s;
    }

    /**
     * Sets or clears (null) a value.
     *
     * @throws IllegalArgumentException when the value type does not match the property kind
     */
    public StyleProperties set(StyleProperty property, Object value) {
        Objects.requireNonNull(property, "property");
        if (value == null) {
            values.remove(property);
            return this;
        }
        Class<?> expected = property.kind().valueType();
        if (expected == Double.class && value instanceof Number n) {
            value = n.doubleValue();
        } else if (expected == Integer.class && value instanceof Number n && !(value instanceof Double)) {
            value = n.intValue();
        }
        if (!expected.isInstance(value)) {
            throw new IllegalArgumentException(property.key() + " expects " + expected.getSimpleName()
                    + " but got " + value.getClass().getSimpleName());
        }
        values.put(property, value);
        return this;
    }

    public Object get(StyleProperty property) {
        return values.get(property);
    }

    public String getString(StyleProperty property) {
        Object v = values.get(property);
        return v instanceof String s ? s : null;
    }

    public Integer getInt(StyleProperty property) {
        Object v = values.get(property);
        return v instanceof Integer i ? i : null;
    }

    public Double getDouble(StyleProperty property) {
        Object v = values.get(property);
        return v instanceof Double d ? d : null;
    }

    public boolean has(StyleProperty property) {
        return values.containsKey(property);
    }

    public StyleProperties remove(StyleProperty property) {
        values.remove(property);
        return this;
    }

    /** Copies every value set in {@code layer} over this map. */
    public StyleProperties overlay(StyleProperties layer) {
        if (layer != null) values.putAll(layer.values);
        return this;
    }

    public StyleProperties copy() {
        return new StyleProperties(this);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public Map<StyleProperty, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof StyleProperties other && values.equals(other.values));
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        values.forEach((k, v) -> {
            if (sb.length() > 1) sb.append(", ");
            sb.append(k.key()).append('=').append(v);
        });
        return sb.append('}').toString();
    }
}
