package com.prism.lister;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.prism.catalog.ColumnCategory;

import java.util.Objects;

/**
 * Column metadata shown to discovery UIs
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExposedColumn {

    @JsonProperty("key")
    private final String name;

    @JsonProperty("category")
    private final ColumnCategory category;

    @JsonProperty("geo_type")
    private final String geoTag;

    public ExposedColumn(String name, ColumnCategory category, String geoTag) {
        this.name = name;
        this.category = category;
        this.geoTag = geoTag;
    }

    public String getName() {
        return name;
    }

    public ColumnCategory getCategory() {
        return category;
    }

    public String getGeoTag() {
        return geoTag;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExposedColumn that = (ExposedColumn) o;
        return name.equals(that.name) && category == that.category && Objects.equals(geoTag, that.geoTag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, category, geoTag);
    }

    @Override
    public String toString() {
        return name + ":" + category + (geoTag != null ? "(" + geoTag + ")" : "");
    }
}
