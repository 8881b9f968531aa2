package com.prism.planner;

import com.prism.catalog.JoinKind;
import com.prism.catalog.JoinSpec;
import com.prism.catalog.ResolvedSourceView;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ViewQueryAssembler Tests")
class ViewQueryAssemblerTest {

    private static final ResolvedSourceView DIMENSION =
        new ResolvedSourceView("OS", "os", "(SELECT os_id, os_name FROM dim.os) AS os", null);

    @Test
    @DisplayName("Should group by position over the grouping projections")
    void shouldAssembleGroupedQuery() {
        CompiledView view = new ViewQueryAssembler()
            .from("(SELECT * FROM raw) AS log")
            .aggregate("SUM(log.\"impressions\") AS \"impressions\"")
            .groupBy("log.\"os_id\" AS \"os_id\"")
            .groupBy("os.os_name AS \"os_name\"")
            .join(JoinEmitter.emit(JoinSpec.left("OS", "os_id"), DIMENSION))
            .build();

        assertThat(view.getSql()).isEqualTo("SELECT log.\"os_id\" AS \"os_id\", os.os_name AS \"os_name\", "
            + "SUM(log.\"impressions\") AS \"impressions\" FROM (SELECT * FROM raw) AS log "
            + "LEFT JOIN (SELECT os_id, os_name FROM dim.os) AS os ON log.\"os_id\" = os.\"os_id\" GROUP BY 1, 2");
        assertThat(view.getBindings()).isEmpty();
    }

    @Test
    @DisplayName("Should omit GROUP BY when every projection aggregates")
    void shouldOmitGroupByForAggregatesOnly() {
        CompiledView view = new ViewQueryAssembler()
            .from(ViewQueryAssembler.cacheSource("ql", 3), "Europe/Paris")
            .aggregate("SUM(log.\"impressions\") AS \"impressions\"")
            .build();

        assertThat(view.getSql()).doesNotContain("GROUP BY").contains("FROM ql.log_view_3) AS log");
        assertThat(view.getBindings()).containsExactly("Europe/Paris");
    }

    @Test
    @DisplayName("Should render inner joins with distinct column names")
    void shouldRenderInnerJoin() {
        String join = JoinEmitter.emit(new JoinSpec(JoinKind.INNER, "OS", "os_id", "id"), DIMENSION);

        assertThat(join).isEqualTo("INNER JOIN (SELECT os_id, os_name FROM dim.os) AS os ON log.\"os_id\" = os.\"id\"");
    }

    @Test
    @DisplayName("Should require a source and a projection")
    void shouldRequireSourceAndProjection() {
        assertThatThrownBy(() -> new ViewQueryAssembler().groupBy("x").build()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new ViewQueryAssembler().from("t").build()).isInstanceOf(IllegalStateException.class);
    }
}
