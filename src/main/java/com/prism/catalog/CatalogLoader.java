package com.prism.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the catalog document into a {@link Catalog}.
 *
 * Document layout:
 * <pre>
 * {
 *   "sourceViews": [ {"id", "alias", "cardinality", "sourceTemplate", "foreignConnection"} ],
 *   "logTypes": [
 *     {"id", "displayName", "category", "sourceTable", "ownerKind",
 *      "columns": { "&lt;name&gt;": { ColumnSpec fields } } }
 *   ]
 * }
 * </pre>
 * A column's name is the key of its entry in {@code columns}. The loader does
 * not check cross references; that is {@link CatalogValidator}'s job.
 */
public class CatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

    private final ObjectMapper objectMapper;

    public CatalogLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Catalog load(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            Catalog catalog = load(in);
            log.info("Loaded catalog from {}: {} log types, {} source views",
                resource.getDescription(), catalog.getLogTypes().size(), catalog.getSourceViews().size());
            return catalog;
        } catch (IOException e) {
            throw new CatalogValidationException("Failed to read catalog from " + resource.getDescription(), e);
        }
    }

    public Catalog load(InputStream in) throws IOException {
        JsonNode root = objectMapper.readTree(in);
        if (root == null || !root.isObject()) {
            throw new CatalogValidationException(List.of("catalog document must be a JSON object"));
        }

        List<SourceViewDefinition> sourceViews = new ArrayList<>();
        for (JsonNode viewNode : root.path("sourceViews")) {
            sourceViews.add(objectMapper.treeToValue(viewNode, SourceViewDefinition.class));
        }

        List<LogTypeCatalog> logTypes = new ArrayList<>();
        for (JsonNode typeNode : root.path("logTypes")) {
            logTypes.add(readLogType(typeNode));
        }

        return new Catalog(logTypes, sourceViews);
    }

    private LogTypeCatalog readLogType(JsonNode node) throws JsonProcessingException {
        String id = node.path("id").asText(null);
        if (id == null || !node.hasNonNull("sourceTable")) {
            throw new CatalogValidationException(List.of("log type entries require 'id' and 'sourceTable': " + node));
        }
        Map<String, ColumnSpec> columns = new LinkedHashMap<>();

        Iterator<Map.Entry<String, JsonNode>> fields = node.path("columns").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isObject()) {
                throw new CatalogValidationException(List.of(
                    String.format("log type '%s': column '%s' must be an object", id, field.getKey())));
            }
            ObjectNode columnNode = ((ObjectNode) field.getValue()).deepCopy();
            columnNode.put("name", field.getKey());
            columns.put(field.getKey(), objectMapper.treeToValue(columnNode, ColumnSpec.class));
        }

        OwnerKind ownerKind = node.hasNonNull("ownerKind")
            ? OwnerKind.valueOf(node.get("ownerKind").asText())
            : OwnerKind.AGENCY;

        return new LogTypeCatalog(
            id,
            node.path("displayName").asText(null),
            node.path("category").asText(null),
            node.path("sourceTable").asText(null),
            ownerKind,
            columns);
    }
}
