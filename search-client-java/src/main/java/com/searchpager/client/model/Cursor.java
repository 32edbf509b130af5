package com.searchpager.client.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.Objects;

/**
 * Opaque search_after token taken from the sort values of the last hit of a page.
 *
 * <p>An unset cursor means "start from the beginning". A set cursor may legitimately
 * hold {@code 0}, so callers must use {@link #isSet()} rather than comparing values.
 */
@EqualsAndHashCode
public final class Cursor {

    private static final Cursor UNSET = new Cursor(null);

    private final Object value;

    private Cursor(Object value) {
        this.value = value;
    }

    public static Cursor unset() {
        return UNSET;
    }

    /**
     * @param value a sort value as returned by the engine: {@link Long}, {@link Double}
     *              or {@link String}
     */
    public static Cursor of(Object value) {
        Objects.requireNonNull(value, "cursor value");
        if (!(value instanceof Number) && !(value instanceof String) && !(value instanceof Boolean)) {
            throw new IllegalArgumentException("Unsupported sort value type: " + value.getClass().getName());
        }
        return new Cursor(value);
    }

    public boolean isSet() {
        return value != null;
    }

    /**
     * @return the raw sort value
     * @throws IllegalStateException if the cursor is unset
     */
    public Object getValue() {
        if (value == null) {
            throw new IllegalStateException("Cursor is unset");
        }
        return value;
    }

    @JsonValue
    public Object toJson() {
        return value;
    }

    @Override
    public String toString() {
        return isSet() ? "Cursor[" + value + "]" : "Cursor[unset]";
    }
}
