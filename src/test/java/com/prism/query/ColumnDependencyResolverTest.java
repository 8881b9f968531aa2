package com.prism.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prism.catalog.AccessTier;
import com.prism.catalog.ColumnSpec;
import com.prism.catalog.TestCatalogs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ColumnDependencyResolver Tests")
class ColumnDependencyResolverTest {

    private static final String VIEW = "logs_imp_42";

    private ColumnDependencyResolver resolver;
    private Map<String, ColumnSpec> columns;

    @BeforeEach
    void setUp() {
        resolver = new ColumnDependencyResolver();
        columns = TestCatalogs.impressions().getColumns();
    }

    private static ExpressionNode refs(String... names) {
        ExpressionNode[] nodes = new ExpressionNode[names.length];
        for (int i = 0; i < names.length; i++) {
            nodes[i] = new ColumnRef(names[i], VIEW);
        }
        return RawNode.of(nodes);
    }

    @Test
    @DisplayName("Derived columns should contribute their dependencies")
    void shouldExpandDerivedColumns() {
        ColumnResolution resolution = resolver.resolve(VIEW, columns, refs("camp_name", "impressions"), AccessTier.PUBLIC);

        assertThat(resolution.getCacheColumns()).containsExactlyInAnyOrder("camp_code", "impressions");
        assertThat(resolution.getQueryColumns()).containsExactly("camp_name", "impressions");
        assertThat(resolution.getMinAccessTier()).isEqualTo(AccessTier.PUBLIC);
    }

    @Test
    @DisplayName("Shared dependencies should be counted once")
    void shouldDeduplicateDependencies() {
        ColumnResolution resolution = resolver.resolve(VIEW, columns,
            refs("camp_name", "flight_name", "camp_code"), AccessTier.PUBLIC);

        assertThat(resolution.getCacheColumns()).containsExactly("camp_code");
        assertThat(resolution.getQueryColumns()).containsExactly("camp_name", "flight_name", "camp_code");
    }

    @Test
    @DisplayName("Should ignore references to other views and unknown columns")
    void shouldIgnoreForeignReferences() {
        ExpressionNode tree = RawNode.of(
            new ColumnRef("fsa", "logs_bcn_42"),
            new ColumnRef("no_such_column", VIEW),
            new Wildcard("logs_imp_7"),
            new ColumnRef("fsa", VIEW));

        ColumnResolution resolution = resolver.resolve(VIEW, columns, tree, AccessTier.PUBLIC);

        assertThat(resolution.getCacheColumns()).containsExactly("fsa");
        assertThat(resolution.getQueryColumns()).containsExactly("fsa");
    }

    @Test
    @DisplayName("A pair naming another view should be walked as an operator and its operand")
    void shouldWalkPairsNamingOtherViews() {
        // Given ["sum", "impressions.<view>"]: a two-string array that is not a column of the view
        ExpressionNode tree = new ExpressionTreeParser(new ObjectMapper()).parse(
            "{\"columns\": [[\"sum\", \"impressions." + VIEW + "\"], \"fsa." + VIEW + "\"]}");

        // When
        ColumnResolution resolution = resolver.resolve(VIEW, columns, tree, AccessTier.PUBLIC);

        // Then
        assertThat(resolution.getQueryColumns()).containsExactlyInAnyOrder("fsa", "impressions");
        assertThat(resolution.getCacheColumns()).containsExactlyInAnyOrder("fsa", "impressions");
    }

    @Test
    @DisplayName("Should walk nested raw nodes")
    void shouldWalkNestedNodes() {
        ExpressionNode tree = RawNode.of(
            RawNode.leaf("and"),
            RawNode.of(RawNode.of(new ColumnRef("os_id", VIEW), RawNode.leaf("3"))),
            RawNode.of(new ColumnRef("clicks", VIEW)));

        ColumnResolution resolution = resolver.resolve(VIEW, columns, tree, AccessTier.PUBLIC);

        assertThat(resolution.getQueryColumns()).containsExactlyInAnyOrder("os_id", "clicks");
    }

    @Test
    @DisplayName("Columns above the caller's tier should be dropped silently")
    void shouldDropColumnsAboveCallerTier() {
        ColumnResolution resolution = resolver.resolve(VIEW, columns,
            refs("revenue", "impressions", "margin"), AccessTier.CUSTOMER);

        assertThat(resolution.getQueryColumns()).containsExactly("impressions");
        assertThat(resolution.getCacheColumns()).containsExactly("impressions");
        assertThat(resolution.getMinAccessTier()).isEqualTo(AccessTier.PUBLIC);
    }

    @Test
    @DisplayName("Internal callers should see internal columns and raise the minimum tier")
    void shouldRaiseMinimumTier() {
        ColumnResolution resolution = resolver.resolve(VIEW, columns, refs("revenue", "impressions"), AccessTier.INTERNAL);

        assertThat(resolution.getQueryColumns()).containsExactly("revenue", "impressions");
        assertThat(resolution.getMinAccessTier()).isEqualTo(AccessTier.INTERNAL);
    }

    @Test
    @DisplayName("Aliases should resolve to their target's stored column")
    void shouldResolveAliases() {
        ColumnResolution resolution = resolver.resolve(VIEW, columns, refs("spend"), AccessTier.CUSTOMER);

        assertThat(resolution.getQueryColumns()).containsExactly("spend");
        assertThat(resolution.getCacheColumns()).containsExactly("revenue");
        assertThat(resolution.getMinAccessTier()).isEqualTo(AccessTier.CUSTOMER);
    }

    @Test
    @DisplayName("Aliases should be gated by their own tier")
    void shouldGateAliasByOwnTier() {
        ColumnResolution resolution = resolver.resolve(VIEW, columns, refs("spend"), AccessTier.PUBLIC);

        assertThat(resolution.getQueryColumns()).isEmpty();
        assertThat(resolution.getCacheColumns()).isEmpty();
    }

    @Test
    @DisplayName("A wildcard should select every column visible at the caller's tier")
    void shouldExpandWildcard() {
        ColumnResolution resolution = resolver.resolve(VIEW, columns, new Wildcard(VIEW), AccessTier.PUBLIC);

        assertThat(resolution.getQueryColumns())
            .contains("camp_code", "camp_name", "date", "fsa", "impressions", "os_name")
            .doesNotContain("revenue", "spend", "margin");
        assertThat(resolution.getCacheColumns())
            .contains("camp_code", "date", "os_id", "banner_code", "app_platform_id")
            .doesNotContain("camp_name", "revenue", "cost");
    }

    @Test
    @DisplayName("A missing tree should resolve to nothing")
    void shouldHandleMissingTree() {
        ColumnResolution resolution = resolver.resolve(VIEW, columns, null, AccessTier.INTERNAL);

        assertThat(resolution.getCacheColumns()).isEmpty();
        assertThat(resolution.getQueryColumns()).isEmpty();
        assertThat(resolution.getMinAccessTier()).isEqualTo(AccessTier.PUBLIC);
    }
}
