package com.prism.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, catalog-defined description of one column of a log type.
 *
 * A column is one of:
 * - stored: extracted from raw logs into cache tables, typed by {@code storageType}
 * - derived: computed at presentation time from the cache values of {@code dependsOn}
 * - alias: a synonym of another column; only {@code accessTier} is read from the alias,
 *   everything else comes from the {@code aliasFor} target
 *
 * Expressions are SQL fragments. {@code sourceExpression} runs against the raw log
 * table, {@code presentationExpression} runs against the planned source (aliased
 * {@code log}) and any joined dimension views.
 */
@JsonDeserialize(builder = ColumnSpec.Builder.class)
public class ColumnSpec {

    private final String name;
    private final ColumnCategory category;
    private final AccessTier accessTier;
    private final String storageType;
    private final String sourceExpression;
    private final String presentationExpression;
    private final List<String> dependsOn;
    private final String aliasFor;
    private final boolean aggregate;
    private final String crossJoinClause;
    private final List<JoinSpec> joinsRequired;
    private final List<String> fastViewCandidates;
    private final String geoTag;

    private ColumnSpec(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name");
        this.category = builder.category;
        this.accessTier = builder.accessTier;
        this.storageType = builder.storageType;
        this.sourceExpression = builder.sourceExpression;
        this.presentationExpression = builder.presentationExpression;
        this.dependsOn = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(builder.dependsOn)));
        this.aliasFor = builder.aliasFor;
        this.aggregate = builder.aggregate;
        this.crossJoinClause = builder.crossJoinClause;
        this.joinsRequired = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(builder.joinsRequired)));
        this.fastViewCandidates = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(builder.fastViewCandidates)));
        this.geoTag = builder.geoTag;
    }

    public static Builder builder(String name) {
        return new Builder().name(name);
    }

    public String getName() {
        return name;
    }

    public ColumnCategory getCategory() {
        return category;
    }

    /**
     * Declared tier, or null when the column declares none
     */
    public AccessTier getAccessTier() {
        return accessTier;
    }

    /**
     * Declared tier, {@link AccessTier#PUBLIC} when none is declared
     */
    public AccessTier getEffectiveAccessTier() {
        return accessTier == null ? AccessTier.PUBLIC : accessTier;
    }

    public String getStorageType() {
        return storageType;
    }

    public String getSourceExpression() {
        return sourceExpression;
    }

    public String getPresentationExpression() {
        return presentationExpression;
    }

    public List<String> getDependsOn() {
        return dependsOn;
    }

    public String getAliasFor() {
        return aliasFor;
    }

    public boolean isAlias() {
        return aliasFor != null;
    }

    public boolean isDerived() {
        return !dependsOn.isEmpty();
    }

    public boolean isAggregate() {
        return aggregate;
    }

    public String getCrossJoinClause() {
        return crossJoinClause;
    }

    public List<JoinSpec> getJoinsRequired() {
        return joinsRequired;
    }

    public List<String> getFastViewCandidates() {
        return fastViewCandidates;
    }

    public String getGeoTag() {
        return geoTag;
    }

    @Override
    public String toString() {
        return "ColumnSpec{name='" + name + "', category=" + category + ", accessTier=" + accessTier
            + (aliasFor != null ? ", aliasFor='" + aliasFor + "'" : "")
            + (aggregate ? ", aggregate" : "") + "}";
    }

    /**
     * Builder for ColumnSpec; also the JSON binding of a catalog column entry
     */
    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private String name;
        private ColumnCategory category;
        private AccessTier accessTier;
        private String storageType;
        private String sourceExpression;
        private String presentationExpression;
        private List<String> dependsOn = new ArrayList<>();
        private String aliasFor;
        private boolean aggregate;
        private String crossJoinClause;
        private List<JoinSpec> joinsRequired = new ArrayList<>();
        private List<String> fastViewCandidates = new ArrayList<>();
        private String geoTag;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder category(ColumnCategory category) {
            this.category = category;
            return this;
        }

        public Builder accessTier(AccessTier accessTier) {
            this.accessTier = accessTier;
            return this;
        }

        public Builder storageType(String storageType) {
            this.storageType = storageType;
            return this;
        }

        public Builder sourceExpression(String sourceExpression) {
            this.sourceExpression = sourceExpression;
            return this;
        }

        public Builder presentationExpression(String presentationExpression) {
            this.presentationExpression = presentationExpression;
            return this;
        }

        public Builder dependsOn(List<String> dependsOn) {
            this.dependsOn = dependsOn == null ? new ArrayList<>() : new ArrayList<>(dependsOn);
            return this;
        }

        public Builder aliasFor(String aliasFor) {
            this.aliasFor = aliasFor;
            return this;
        }

        @JsonProperty("isAggregate")
        public Builder aggregate(boolean aggregate) {
            this.aggregate = aggregate;
            return this;
        }

        public Builder crossJoinClause(String crossJoinClause) {
            this.crossJoinClause = crossJoinClause;
            return this;
        }

        public Builder joinsRequired(List<JoinSpec> joinsRequired) {
            this.joinsRequired = joinsRequired == null ? new ArrayList<>() : new ArrayList<>(joinsRequired);
            return this;
        }

        public Builder fastViewCandidates(List<String> fastViewCandidates) {
            this.fastViewCandidates = fastViewCandidates == null ? new ArrayList<>() : new ArrayList<>(fastViewCandidates);
            return this;
        }

        public Builder geoTag(String geoTag) {
            this.geoTag = geoTag;
            return this;
        }

        public ColumnSpec build() {
            return new ColumnSpec(this);
        }
    }
}
