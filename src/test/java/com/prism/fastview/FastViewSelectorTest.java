package com.prism.fastview;

import com.prism.catalog.ColumnSpec;
import com.prism.catalog.TestCatalogs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FastViewSelector Tests")
class FastViewSelectorTest {

    private FastViewSelector selector;
    private Map<String, ColumnSpec> columns;

    @BeforeEach
    void setUp() {
        selector = new FastViewSelector();
        columns = TestCatalogs.impressions().getColumns();
    }

    @Test
    @DisplayName("Should return every covering view in ascending cardinality")
    void shouldReturnAllCoveringViews() {
        List<String> views = selector.selectFastViews(columns, List.of("camp_code", "impressions", "date"));

        assertThat(views).containsExactly("ATOM_CH_OS_ID", "ATOM_CH_BROWSER_ID", "ATOM_CH_BANNER_CODE", "ATOM_CH_CITY");
    }

    @Test
    @DisplayName("Should narrow to the views holding every column")
    void shouldIntersectCandidates() {
        assertThat(selector.selectFastViews(columns, List.of("impressions", "city", "revenue")))
            .containsExactly("ATOM_CH_CITY");
        assertThat(selector.selectFastViews(columns, List.of("os_id", "clicks")))
            .containsExactly("ATOM_CH_OS_ID");
    }

    @Test
    @DisplayName("Should return nothing when no single view holds every column")
    void shouldReturnEmptyForDisjointCandidates() {
        assertThat(selector.selectFastViews(columns, List.of("os_id", "browser_id"))).isEmpty();
    }

    @Test
    @DisplayName("Should return nothing when a column has no candidates")
    void shouldReturnEmptyForUncoveredColumn() {
        assertThat(selector.selectFastViews(columns, List.of("camp_code", "fsa"))).isEmpty();
        assertThat(selector.selectFastViews(columns, List.of("unknown"))).isEmpty();
        assertThat(selector.selectFastViews(TestCatalogs.beacons().getColumns(), Set.of("camp_code"))).isEmpty();
    }

    @Test
    @DisplayName("Should return nothing for an empty column set")
    void shouldReturnEmptyForNoColumns() {
        assertThat(selector.selectFastViews(columns, List.of())).isEmpty();
    }
}
