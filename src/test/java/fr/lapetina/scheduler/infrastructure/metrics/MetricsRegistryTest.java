package fr.lapetina.scheduler.infrastructure.metrics;

import fr.lapetina.scheduler.domain.model.ErrorType;
import fr.lapetina.scheduler.domain.model.FairShareAllocation;
import fr.lapetina.scheduler.domain.model.RequestStatus;
import fr.lapetina.scheduler.domain.model.TenantTier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryTest {

    private final MetricsRegistry metrics = new MetricsRegistry("unit");

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    @Test
    @DisplayName("queue timeouts should be counted under the timed_out reason")
    void timeoutShouldUseTimedOutTag() {
        assertThat(MetricsRegistry.rejectionTag(ErrorType.QUEUE_TIMEOUT)).isEqualTo("timed_out");
        assertThat(MetricsRegistry.rejectionTag(ErrorType.RATE_LIMITED)).isEqualTo("rate_limited");

        metrics.incrementRejection(ErrorType.RATE_LIMITED);
        metrics.incrementRejection(ErrorType.RATE_LIMITED);

        assertThat(metrics.getRegistry().get("unit_rejections_total").tag("reason", "rate_limited")
                .counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("closed ticks should feed credit counters and utilization")
    void tickShouldFeedCreditMeters() {
        Instant now = Instant.parse("2026-03-01T10:00:00Z");
        metrics.recordTick(List.of(
                new FairShareAllocation(TenantTier.ENTERPRISE, 4, 3, now),
                new FairShareAllocation(TenantTier.FREE, 1, 0, now)));

        assertThat(metrics.getRegistry().get("unit_credits_granted_total").tag("tier", "enterprise")
                .counter().count()).isEqualTo(4.0);
        assertThat(metrics.getRegistry().get("unit_credits_consumed_total").tag("tier", "enterprise")
                .counter().count()).isEqualTo(3.0);
        assertThat(metrics.getRegistry().get("unit_credit_utilization").tag("tier", "enterprise")
                .gauge().value()).isEqualTo(0.75);
        assertThat(metrics.getRegistry().get("unit_credit_utilization").tag("tier", "free")
                .gauge().value()).isZero();
    }

    @Test
    @DisplayName("gauges should read their supplier on every scrape")
    void gaugesShouldFollowSuppliers() {
        AtomicInteger depth = new AtomicInteger(3);
        metrics.registerQueueDepth(TenantTier.STARTER, depth::get);

        depth.set(7);

        assertThat(metrics.getRegistry().get("unit_queue_depth").tag("tier", "starter")
                .gauge().value()).isEqualTo(7.0);
    }

    @Test
    @DisplayName("timers and outcomes should appear in the Prometheus scrape")
    void scrapeShouldExposeMeters() {
        metrics.recordQueueWait(TenantTier.PROFESSIONAL, Duration.ofMillis(120));
        metrics.recordDispatchLatency(TenantTier.PROFESSIONAL, RequestStatus.COMPLETED, Duration.ofMillis(800));
        metrics.incrementOutcome(TenantTier.PROFESSIONAL, RequestStatus.COMPLETED);

        String scrape = metrics.scrape();

        assertThat(scrape).contains("unit_queue_wait_seconds_count{tier=\"professional\"");
        assertThat(scrape).contains("unit_dispatch_latency_seconds_count");
        assertThat(scrape).contains("unit_outcomes_total{outcome=\"completed\",tier=\"professional\"");
    }
}
