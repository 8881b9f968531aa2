package com.prism.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.prism.tenant.TenantIdentity;

import java.util.Objects;

/**
 * A precomputed source the planner can read from: either a fast view (a
 * specialized pre-aggregated join already holding some raw columns) or a
 * dimension view joined in for presentation.
 *
 * The source template is a SQL select that may reference {@code :agencyId} and
 * {@code :advertiserId}; instantiating the definition for a tenant replaces them
 * with the tenant's numeric identifiers. When the template reads through a
 * foreign database link, {@code foreignConnection} names the connection that
 * has to be initialized before the plan executes.
 */
public class SourceViewDefinition {

    static final String AGENCY_PLACEHOLDER = ":agencyId";
    static final String ADVERTISER_PLACEHOLDER = ":advertiserId";

    private final String id;
    private final String alias;
    private final long cardinality;
    private final String sourceTemplate;
    private final String foreignConnection;

    @JsonCreator
    public SourceViewDefinition(
            @JsonProperty("id") String id,
            @JsonProperty("alias") String alias,
            @JsonProperty("cardinality") long cardinality,
            @JsonProperty("sourceTemplate") String sourceTemplate,
            @JsonProperty("foreignConnection") String foreignConnection) {
        this.id = Objects.requireNonNull(id, "id");
        this.alias = Objects.requireNonNull(alias, "alias");
        this.cardinality = cardinality;
        this.sourceTemplate = Objects.requireNonNull(sourceTemplate, "sourceTemplate");
        this.foreignConnection = foreignConnection;
    }

    public String getId() {
        return id;
    }

    public String getAlias() {
        return alias;
    }

    /**
     * Declared cardinality; lower-cardinality views are preferred
     */
    public long getCardinality() {
        return cardinality;
    }

    public String getSourceTemplate() {
        return sourceTemplate;
    }

    public String getForeignConnection() {
        return foreignConnection;
    }

    /**
     * Render this view for one tenant as {@code (<select>) AS <alias>}
     */
    public ResolvedSourceView instantiate(TenantIdentity identity) {
        String sql = sourceTemplate
            .replace(ADVERTISER_PLACEHOLDER, Long.toString(identity.getAdvertiserId()))
            .replace(AGENCY_PLACEHOLDER, Long.toString(identity.getAgencyId()));
        return new ResolvedSourceView(id, alias, "(" + sql.trim() + ") AS " + alias, foreignConnection);
    }

    @Override
    public String toString() {
        return "SourceViewDefinition{id='" + id + "', alias='" + alias + "', cardinality=" + cardinality + "}";
    }
}
