package com.prism.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Logical data category of a column, as reported to discovery UIs.
 */
public enum ColumnCategory {

    NUMERIC("Numeric"),
    STRING("String"),
    DATE("Date"),
    JSON("JSON");

    private final String value;

    ColumnCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse a catalog value, accepting either the display value or the constant name
     */
    @JsonCreator
    public static ColumnCategory fromValue(String value) {
        for (ColumnCategory category : ColumnCategory.values()) {
            if (category.value.equalsIgnoreCase(value) || category.name().equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown ColumnCategory value: " + value);
    }
}
