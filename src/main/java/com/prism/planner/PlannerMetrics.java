package com.prism.planner;

import com.prism.error.ErrorCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

/**
 * Metrics collector for view planning.
 * Tracks produced and rejected plans, the source each plan reads from, cache
 * table registrations, foreign connection initializations and planning latency.
 */
@Component
public class PlannerMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter plansProduced;
    private final Counter fastViewPlans;
    private final Counter cachePlans;
    private final Counter cacheTablesCreated;
    private final Counter cacheRegistryConflicts;
    private final Counter foreignConnectionsInitialized;
    private final Counter planFailures;
    private final Timer planLatency;

    public PlannerMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        plansProduced = Counter.builder("prism.planner.plans")
            .description("Total number of view plans produced")
            .register(meterRegistry);

        fastViewPlans = Counter.builder("prism.planner.source")
            .description("View plans by source")
            .tag("source", "fast_view")
            .register(meterRegistry);

        cachePlans = Counter.builder("prism.planner.source")
            .description("View plans by source")
            .tag("source", "cache")
            .register(meterRegistry);

        cacheTablesCreated = Counter.builder("prism.cache.tables.created")
            .description("Cache tables created by this instance")
            .register(meterRegistry);

        cacheRegistryConflicts = Counter.builder("prism.cache.registry.conflicts")
            .description("Cache registrations lost to a concurrent writer and re-read")
            .register(meterRegistry);

        foreignConnectionsInitialized = Counter.builder("prism.planner.foreign.connections")
            .description("Foreign connection initializations requested by plans")
            .register(meterRegistry);

        planFailures = Counter.builder("prism.planner.failures")
            .description("View plans that failed on infrastructure errors")
            .register(meterRegistry);

        planLatency = Timer.builder("prism.planner.latency")
            .description("Latency of view planning")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);
    }

    public Timer.Sample startPlan() {
        return Timer.start(meterRegistry);
    }

    public void stopPlan(Timer.Sample sample) {
        sample.stop(planLatency);
    }

    public void recordPlanProduced(PlanSource source) {
        plansProduced.increment();
        if (source.getKind() == PlanSource.Kind.FAST_VIEW) {
            fastViewPlans.increment();
        } else {
            cachePlans.increment();
        }
    }

    /**
     * Rejections are tagged by error code
     */
    public void recordPlanRejected(ErrorCode errorCode) {
        Counter.builder("prism.planner.rejected")
            .description("View plans rejected by request errors")
            .tag("code", errorCode.name())
            .register(meterRegistry)
            .increment();
    }

    public void recordPlanFailed() {
        planFailures.increment();
    }

    public void recordCacheTableCreated() {
        cacheTablesCreated.increment();
    }

    public void recordCacheRegistryConflicts(int conflicts) {
        cacheRegistryConflicts.increment(conflicts);
    }

    public void recordForeignConnectionInitialized() {
        foreignConnectionsInitialized.increment();
    }

    public Counter getPlansProduced() {
        return plansProduced;
    }

    public Counter getFastViewPlans() {
        return fastViewPlans;
    }

    public Counter getCachePlans() {
        return cachePlans;
    }

    public Counter getCacheTablesCreated() {
        return cacheTablesCreated;
    }

    public Counter getCacheRegistryConflicts() {
        return cacheRegistryConflicts;
    }

    public Counter getForeignConnectionsInitialized() {
        return foreignConnectionsInitialized;
    }

    public Counter getPlanFailures() {
        return planFailures;
    }

    public Timer getPlanLatency() {
        return planLatency;
    }
}
