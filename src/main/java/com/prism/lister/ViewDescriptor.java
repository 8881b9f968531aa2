package com.prism.lister;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Description of one addressable view: one log type of one tenant.
 *
 * Columns are null when the listing was requested without column metadata.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ViewDescriptor {

    @JsonProperty("name")
    private final String label;

    @JsonProperty("view")
    private final ViewReference view;

    @JsonProperty("columns")
    private final List<ExposedColumn> columns;

    public ViewDescriptor(String label, ViewReference view, List<ExposedColumn> columns) {
        this.label = label;
        this.view = view;
        this.columns = columns == null ? null : List.copyOf(columns);
    }

    public String getLabel() {
        return label;
    }

    public ViewReference getView() {
        return view;
    }

    public List<ExposedColumn> getColumns() {
        return columns;
    }

    @Override
    public String toString() {
        return "ViewDescriptor{label='" + label + "', view=" + view.getId() + "}";
    }

    /**
     * Machine-readable part of a descriptor
     */
    public static class ViewReference {

        @JsonProperty("id")
        private final String id;

        @JsonProperty("type")
        private final String type;

        @JsonProperty("category")
        private final String category;

        @JsonProperty("logType")
        private final String logType;

        @JsonProperty("tenantId")
        private final long tenantId;

        public ViewReference(String logType, String category, long tenantId) {
            this.id = ViewIdentifier.format(logType, tenantId);
            this.type = ViewIdentifier.VIEW_TYPE;
            this.category = category;
            this.logType = logType;
            this.tenantId = tenantId;
        }

        public String getId() {
            return id;
        }

        public String getType() {
            return type;
        }

        public String getCategory() {
            return category;
        }

        public String getLogType() {
            return logType;
        }

        public long getTenantId() {
            return tenantId;
        }
    }
}
