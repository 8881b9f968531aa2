package com.prism.tenant;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.prism.catalog.OwnerKind;
import com.prism.security.TenantScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Tenant directory over the {@code public.customers} table.
 *
 * Only active tenants attached to a white-label partner are visible. Agency
 * rows carry {@code agencyid = 0}; advertiser rows reference their agency.
 * Results are cached with Caffeine for {@code prism.tenant-directory.cache-ttl-seconds}.
 */
@Repository
public class JdbcTenantDirectory implements TenantDirectory {

    private static final Logger log = LoggerFactory.getLogger(JdbcTenantDirectory.class);

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final Cache<String, List<Tenant>> tenantCache;
    private final Cache<Long, Optional<String>> timeZoneCache;

    public JdbcTenantDirectory(
            @Qualifier("directoryJdbcTemplate") NamedParameterJdbcTemplate jdbcTemplate,
            @Value("${prism.tenant-directory.cache-ttl-seconds:600}") long cacheTtlSeconds,
            @Value("${prism.tenant-directory.cache-max-size:10000}") long cacheMaxSize) {
        this.jdbcTemplate = jdbcTemplate;
        this.tenantCache = Caffeine.newBuilder()
            .maximumSize(cacheMaxSize)
            .expireAfterWrite(cacheTtlSeconds, TimeUnit.SECONDS)
            .recordStats()
            .build();
        this.timeZoneCache = Caffeine.newBuilder()
            .maximumSize(cacheMaxSize)
            .expireAfterWrite(cacheTtlSeconds, TimeUnit.SECONDS)
            .recordStats()
            .build();

        log.info("JdbcTenantDirectory initialized with cache (TTL={}s, maxSize={})", cacheTtlSeconds, cacheMaxSize);
    }

    @Override
    public Mono<List<Tenant>> getTenants(TenantScope partnerScope, TenantScope idFilter, OwnerKind kind) {
        // An empty restriction matches nothing
        if ((!idFilter.isUnrestricted() && idFilter.getIds().isEmpty())
                || (!partnerScope.isUnrestricted() && partnerScope.getIds().isEmpty())) {
            return Mono.just(List.of());
        }
        String key = kind + "|" + partnerScope + "|" + idFilter;
        return Mono.fromCallable(() -> tenantCache.get(key, k -> loadTenants(partnerScope, idFilter, kind)))
            .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<String> getTenantTimeZone(long tenantId) {
        return Mono.fromCallable(() -> timeZoneCache.get(tenantId, this::loadTimeZone))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(zone -> zone.map(Mono::just).orElseGet(Mono::empty));
    }

    private List<Tenant> loadTenants(TenantScope partnerScope, TenantScope idFilter, OwnerKind kind) {
        List<String> filters = new ArrayList<>(List.of("isactive", "whitelabelid <> 0"));
        MapSqlParameterSource parameters = new MapSqlParameterSource();

        filters.add(kind == OwnerKind.AGENCY ? "agencyid = 0" : "agencyid <> 0");
        if (!idFilter.isUnrestricted()) {
            filters.add((kind == OwnerKind.AGENCY ? "customerid" : "agencyid") + " IN (:ids)");
            parameters.addValue("ids", idFilter.getIds());
        }
        if (!partnerScope.isUnrestricted()) {
            filters.add("whitelabelid IN (:partners)");
            parameters.addValue("partners", partnerScope.getIds());
        }

        String sql = """
            SELECT customerid, companyname
            FROM public.customers
            WHERE %s
            ORDER BY customerid
            """.formatted(String.join(" AND ", filters));

        try {
            List<Tenant> tenants = jdbcTemplate.query(sql, parameters,
                (rs, rowNum) -> new Tenant(rs.getLong("customerid"), rs.getString("companyname")));
            log.debug("Loaded {} {} tenants for partners={} ids={}", tenants.size(), kind, partnerScope, idFilter);
            return List.copyOf(tenants);
        } catch (DataAccessException e) {
            log.error("Failed to load {} tenants", kind, e);
            throw new TenantDirectoryException("Failed to load " + kind + " tenants", e);
        }
    }

    private Optional<String> loadTimeZone(long tenantId) {
        String sql = """
            SELECT timezone
            FROM public.customers
            WHERE customerid = :tenantId
            """;
        try {
            List<String> zones = jdbcTemplate.queryForList(sql,
                new MapSqlParameterSource("tenantId", tenantId), String.class);
            return zones.isEmpty() ? Optional.empty() : Optional.ofNullable(zones.get(0));
        } catch (DataAccessException e) {
            log.error("Failed to load time zone of tenant {}", tenantId, e);
            throw new TenantDirectoryException("Failed to load time zone of tenant " + tenantId, e);
        }
    }
}
