package fr.lapetina.scheduler.integration;

import fr.lapetina.scheduler.domain.model.DepthSnapshot;
import fr.lapetina.scheduler.domain.model.ErrorType;
import fr.lapetina.scheduler.domain.model.RequestStatus;
import fr.lapetina.scheduler.domain.model.SchedulingOutcome;
import fr.lapetina.scheduler.domain.model.SchedulingTicket;
import fr.lapetina.scheduler.domain.model.TenantQuery;
import fr.lapetina.scheduler.domain.model.TenantTier;
import fr.lapetina.scheduler.exception.AdmissionRejectedException;
import fr.lapetina.scheduler.support.StubRagPipeline;
import fr.lapetina.scheduler.support.TestSchedulerFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for the running scheduling loop.
 * Configuration is externalized to test-config.yaml.
 */
class SchedulerPipelineIntegrationTest {

    private TestSchedulerFactory factory;

    @BeforeEach
    void setUp() {
        factory = TestSchedulerFactory.create();
        factory.start();
    }

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.rag().releaseAll();
            factory.close();
        }
    }

    private static TenantQuery query(String tenantId, TenantTier tier) {
        return TenantQuery.of(tenantId, tier, Map.of("query", "hello"));
    }

    @Test
    @DisplayName("should schedule a submitted query through to completion")
    void shouldCompleteSubmittedQuery() throws Exception {
        SchedulingTicket ticket = factory.getPipeline().submit(query("acme", TenantTier.ENTERPRISE));

        SchedulingOutcome outcome = ticket.outcome().get(5, TimeUnit.SECONDS);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.status()).isEqualTo(RequestStatus.COMPLETED);
        assertThat(outcome.requestId()).isEqualTo(ticket.requestId());
        assertThat(outcome.result().body()).containsEntry("tenantId", "acme");
    }

    @Test
    @DisplayName("should report a pipeline error as a dispatch failure")
    void shouldReportPipelineFailure() throws Exception {
        factory.rag().setMode(StubRagPipeline.Mode.FAIL);

        SchedulingTicket ticket = factory.getPipeline().submit(query("acme", TenantTier.PROFESSIONAL));
        SchedulingOutcome outcome = ticket.outcome().get(5, TimeUnit.SECONDS);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.errorType()).isEqualTo(ErrorType.DISPATCH_FAILURE);
    }

    @Test
    @DisplayName("should reject a Free tenant past its burst")
    void shouldRateLimitFreeTenant() {
        factory.getPipeline().submit(query("tiny", TenantTier.FREE));
        factory.getPipeline().submit(query("tiny", TenantTier.FREE));

        assertThatThrownBy(() -> factory.getPipeline().submit(query("tiny", TenantTier.FREE)))
                .isInstanceOf(AdmissionRejectedException.class)
                .extracting(e -> ((AdmissionRejectedException) e).getReason())
                .isEqualTo(ErrorType.RATE_LIMITED);
    }

    @Test
    @DisplayName("should complete many concurrent submissions across tiers")
    void shouldCompleteConcurrentSubmissions() throws Exception {
        List<CompletableFuture<SchedulingOutcome>> outcomes = new ArrayList<>();
        TenantTier[] tiers = {TenantTier.ENTERPRISE, TenantTier.PROFESSIONAL, TenantTier.STARTER};
        for (int i = 0; i < 60; i++) {
            TenantTier tier = tiers[i % tiers.length];
            outcomes.add(factory.getPipeline().submit(query("tenant-" + i % 6, tier)).outcome());
        }

        CompletableFuture.allOf(outcomes.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);

        assertThat(outcomes).allSatisfy(f -> assertThat(f.join().isSuccess()).isTrue());
        DepthSnapshot depths = factory.getPipeline().depthSnapshot();
        assertThat(depths.globalTotal()).isZero();
        assertThat(depths.dlq()).isZero();
    }

    @Test
    @DisplayName("close should wait for in-flight calls and refuse new submissions")
    void closeShouldDrainInFlight() throws Exception {
        factory.rag().setMode(StubRagPipeline.Mode.HOLD);
        SchedulingTicket ticket = factory.getPipeline().submit(query("acme", TenantTier.ENTERPRISE));
        long deadline = System.currentTimeMillis() + 5000;
        while (factory.rag().heldCount() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(factory.rag().heldCount()).isEqualTo(1);

        CompletableFuture<Void> closing = CompletableFuture.runAsync(() -> factory.getPipeline().close());
        Thread.sleep(100);
        factory.rag().releaseAll();
        closing.get(5, TimeUnit.SECONDS);

        assertThat(ticket.outcome().get(1, TimeUnit.SECONDS).status()).isEqualTo(RequestStatus.COMPLETED);
        assertThat(factory.getPipeline().isRunning()).isFalse();
        assertThatThrownBy(() -> factory.getPipeline().submit(query("acme", TenantTier.ENTERPRISE)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("close should resolve every request still waiting for a slot")
    void closeShouldResolveWaitingRequests() throws Exception {
        factory.rag().setMode(StubRagPipeline.Mode.HOLD);
        List<SchedulingTicket> tickets = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            tickets.add(factory.getPipeline().submit(query("acme", TenantTier.ENTERPRISE)));
        }
        long deadline = System.currentTimeMillis() + 5000;
        while (factory.rag().heldCount() < 4 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(factory.rag().heldCount()).isEqualTo(4);

        CompletableFuture<Void> closing = CompletableFuture.runAsync(() -> factory.getPipeline().close());
        Thread.sleep(100);
        factory.rag().releaseAll();
        closing.get(5, TimeUnit.SECONDS);

        List<SchedulingOutcome> outcomes = new ArrayList<>();
        for (SchedulingTicket ticket : tickets) {
            outcomes.add(ticket.outcome().get(1, TimeUnit.SECONDS));
        }
        assertThat(outcomes).filteredOn(o -> o.status() == RequestStatus.COMPLETED).hasSize(4);
        assertThat(outcomes).filteredOn(o -> o.status() == RequestStatus.CANCELLED)
                .hasSize(16)
                .allSatisfy(o -> assertThat(o.errorMessage()).isEqualTo("Replica shut down before dispatch"));
        assertThat(factory.getQueue().size()).isZero();
        assertThat(factory.getLocalBuffer().size()).isZero();
        assertThat(factory.getAdmissionController().pendingCount()).isZero();
    }
}
