package com.prism.tenant;

import com.prism.catalog.OwnerKind;
import com.prism.security.TenantScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("JdbcTenantDirectory Tests")
class JdbcTenantDirectoryTest {

    @Mock
    private NamedParameterJdbcTemplate jdbcTemplate;

    private JdbcTenantDirectory directory;

    @BeforeEach
    void setUp() {
        directory = new JdbcTenantDirectory(jdbcTemplate, 600, 100);
    }

    private void stubTenants(List<Tenant> tenants) {
        when(jdbcTemplate.query(anyString(), any(SqlParameterSource.class), ArgumentMatchers.<RowMapper<Tenant>>any()))
            .thenReturn(tenants);
    }

    @Test
    @DisplayName("Should query agencies by id within the partner scope")
    void shouldQueryAgencies() {
        stubTenants(List.of(new Tenant(10L, "Acme")));

        StepVerifier.create(directory.getTenants(TenantScope.of(3L), TenantScope.of(10L), OwnerKind.AGENCY))
            .assertNext(tenants -> assertThat(tenants).containsExactly(new Tenant(10L, "Acme")))
            .verifyComplete();

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<SqlParameterSource> parameters = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbcTemplate).query(sql.capture(), parameters.capture(), ArgumentMatchers.<RowMapper<Tenant>>any());
        assertThat(sql.getValue())
            .contains("FROM public.customers")
            .contains("isactive AND whitelabelid <> 0 AND agencyid = 0")
            .contains("customerid IN (:ids)")
            .contains("whitelabelid IN (:partners)");
        assertThat(parameters.getValue().hasValue("ids")).isTrue();
    }

    @Test
    @DisplayName("Should query advertisers by parent agency")
    void shouldQueryAdvertisers() {
        stubTenants(List.of(new Tenant(77L, "Brand")));

        StepVerifier.create(directory.getTenants(TenantScope.unrestricted(), TenantScope.of(10L), OwnerKind.ADVERTISER))
            .expectNextCount(1)
            .verifyComplete();

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(jdbcTemplate).query(sql.capture(), any(SqlParameterSource.class), ArgumentMatchers.<RowMapper<Tenant>>any());
        assertThat(sql.getValue())
            .contains("agencyid <> 0")
            .contains("agencyid IN (:ids)")
            .doesNotContain("whitelabelid IN");
    }

    @Test
    @DisplayName("Should serve repeated lookups from the cache")
    void shouldCacheLookups() {
        stubTenants(List.of(new Tenant(10L, "Acme")));

        directory.getTenants(TenantScope.unrestricted(), TenantScope.of(10L), OwnerKind.AGENCY).block();
        directory.getTenants(TenantScope.unrestricted(), TenantScope.of(10L), OwnerKind.AGENCY).block();

        verify(jdbcTemplate, times(1)).query(anyString(), any(SqlParameterSource.class),
            ArgumentMatchers.<RowMapper<Tenant>>any());
    }

    @Test
    @DisplayName("An empty restriction should match nothing without a query")
    void shouldShortCircuitEmptyScope() {
        StepVerifier.create(directory.getTenants(TenantScope.of(List.of()), TenantScope.unrestricted(), OwnerKind.AGENCY))
            .assertNext(tenants -> assertThat(tenants).isEmpty())
            .verifyComplete();
        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    @DisplayName("Should wrap storage failures")
    void shouldWrapFailures() {
        when(jdbcTemplate.query(anyString(), any(SqlParameterSource.class), ArgumentMatchers.<RowMapper<Tenant>>any()))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        StepVerifier.create(directory.getTenants(TenantScope.unrestricted(), TenantScope.of(10L), OwnerKind.AGENCY))
            .expectError(TenantDirectoryException.class)
            .verify();
    }

    @Test
    @DisplayName("Should return the configured time zone")
    void shouldReturnTimeZone() {
        when(jdbcTemplate.queryForList(anyString(), any(SqlParameterSource.class), eq(String.class)))
            .thenReturn(List.of("America/Toronto"));

        StepVerifier.create(directory.getTenantTimeZone(10L))
            .expectNext("America/Toronto")
            .verifyComplete();
    }

    @Test
    @DisplayName("Should complete empty when no time zone is configured")
    void shouldCompleteEmptyWithoutTimeZone() {
        when(jdbcTemplate.queryForList(anyString(), any(SqlParameterSource.class), eq(String.class)))
            .thenReturn(List.of());

        StepVerifier.create(directory.getTenantTimeZone(10L)).verifyComplete();
        StepVerifier.create(directory.getTenantTimeZone(10L)).verifyComplete();

        verify(jdbcTemplate, times(1)).queryForList(anyString(), any(SqlParameterSource.class), eq(String.class));
    }
}
