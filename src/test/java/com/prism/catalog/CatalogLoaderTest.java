package com.prism.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CatalogLoader Tests")
class CatalogLoaderTest {

    private CatalogLoader loader;

    @BeforeEach
    void setUp() {
        loader = new CatalogLoader(new ObjectMapper());
    }

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should load the shipped catalog with both log types")
    void shouldLoadShippedCatalog() {
        Catalog catalog = TestCatalogs.shipped();

        assertThat(catalog.getLogTypes()).extracting(LogTypeCatalog::getId).containsExactly("imp", "bcn");
        assertThat(catalog.findSourceView("ATOM_CH_OS_ID")).isPresent();
        assertThat(catalog.findSourceView("LOCUS_CAMPS").orElseThrow().getForeignConnection()).isNull();
    }

    @Test
    @DisplayName("Shipped catalog should pass validation")
    void shippedCatalogShouldValidate() {
        assertThatCode(() -> new CatalogValidator().validate(TestCatalogs.shipped())).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should bind column fields from their catalog entries")
    void shouldBindColumnFields() {
        LogTypeCatalog impressions = TestCatalogs.impressions();

        assertThat(impressions.getOwnerKind()).isEqualTo(OwnerKind.ADVERTISER);
        assertThat(impressions.getDisplayName()).isEqualTo("ATOM Impressions");

        ColumnSpec revenue = impressions.findColumn("revenue").orElseThrow();
        assertThat(revenue.getAccessTier()).isEqualTo(AccessTier.INTERNAL);
        assertThat(revenue.isAggregate()).isTrue();
        assertThat(revenue.getStorageType()).isEqualTo("numeric");

        ColumnSpec spend = impressions.findColumn("spend").orElseThrow();
        assertThat(spend.isAlias()).isTrue();
        assertThat(impressions.effectiveSpec(spend)).isSameAs(revenue);

        ColumnSpec campName = impressions.findColumn("camp_name").orElseThrow();
        assertThat(campName.getDependsOn()).containsExactly("camp_code");
        assertThat(campName.getJoinsRequired()).containsExactly(JoinSpec.left("ATOM_CAMPS", "camp_code"));

        assertThat(impressions.findColumn("fsa").orElseThrow().getGeoTag()).isEqualTo("ca-fsa");
        assertThat(impressions.findColumn("date").orElseThrow().getCategory()).isEqualTo(ColumnCategory.DATE);
    }

    @Test
    @DisplayName("Owner kind should default to AGENCY")
    void ownerKindShouldDefaultToAgency() throws IOException {
        Catalog catalog = loader.load(json("""
            {"logTypes": [{"id": "x", "sourceTable": "raw.x", "columns": {"a": {"storageType": "int"}}}]}
            """));

        LogTypeCatalog logType = catalog.findLogType("x").orElseThrow();
        assertThat(logType.getOwnerKind()).isEqualTo(OwnerKind.AGENCY);
        assertThat(logType.getDisplayName()).isEqualTo("x");
        assertThat(logType.findColumn("a").orElseThrow().getName()).isEqualTo("a");
    }

    @Test
    @DisplayName("Should reject a log type without a source table")
    void shouldRejectLogTypeWithoutSourceTable() {
        assertThatThrownBy(() -> loader.load(json("""
            {"logTypes": [{"id": "x", "columns": {}}]}
            """)))
            .isInstanceOf(CatalogValidationException.class)
            .hasMessageContaining("sourceTable");
    }

    @Test
    @DisplayName("Should reject a column entry that is not an object")
    void shouldRejectNonObjectColumn() {
        assertThatThrownBy(() -> loader.load(json("""
            {"logTypes": [{"id": "x", "sourceTable": "raw.x", "columns": {"a": "int"}}]}
            """)))
            .isInstanceOf(CatalogValidationException.class)
            .hasMessageContaining("'a'");
    }

    @Test
    @DisplayName("Should reject duplicate log type ids")
    void shouldRejectDuplicateLogTypes() {
        assertThatThrownBy(() -> loader.load(json("""
            {"logTypes": [{"id": "x", "sourceTable": "raw.x"}, {"id": "x", "sourceTable": "raw.y"}]}
            """)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Duplicate log type");
    }

    @Test
    @DisplayName("Should wrap unreadable resources")
    void shouldWrapMalformedResource() {
        ByteArrayResource resource = new ByteArrayResource("{not json".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> loader.load(resource))
            .isInstanceOf(CatalogValidationException.class)
            .hasCauseInstanceOf(IOException.class);
    }
}
