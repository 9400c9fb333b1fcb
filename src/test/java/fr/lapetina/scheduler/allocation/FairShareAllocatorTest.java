package fr.lapetina.scheduler.allocation;

import fr.lapetina.scheduler.domain.model.TenantTier;
import fr.lapetina.scheduler.domain.model.TierPolicies;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static fr.lapetina.scheduler.domain.model.TenantTier.ENTERPRISE;
import static fr.lapetina.scheduler.domain.model.TenantTier.FREE;
import static fr.lapetina.scheduler.domain.model.TenantTier.PROFESSIONAL;
import static fr.lapetina.scheduler.domain.model.TenantTier.STARTER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FairShareAllocatorTest {

    private final FairShareAllocator capBounded =
            new FairShareAllocator(TierPolicies.defaults(), RedistributionPolicy.CAP_BOUNDED);
    private final FairShareAllocator workConserving =
            new FairShareAllocator(TierPolicies.defaults(), RedistributionPolicy.WORK_CONSERVING);

    private static Map<TenantTier, Integer> depths(int enterprise, int professional, int starter, int free) {
        Map<TenantTier, Integer> depths = new EnumMap<>(TenantTier.class);
        depths.put(ENTERPRISE, enterprise);
        depths.put(PROFESSIONAL, professional);
        depths.put(STARTER, starter);
        depths.put(FREE, free);
        return depths;
    }

    @Nested
    @DisplayName("cap bounded")
    class CapBounded {

        @Test
        @DisplayName("idle Starter share should be redistributed proportionally under the caps")
        void idleShareShouldBeRedistributed() {
            Map<TenantTier, Integer> grants = capBounded.computeAllocation(depths(100, 100, 0, 100), 100);

            assertThat(grants).containsEntry(ENTERPRISE, 59)
                    .containsEntry(PROFESSIONAL, 36)
                    .containsEntry(STARTER, 0)
                    .containsEntry(FREE, 5);
        }

        @Test
        @DisplayName("all tiers backlogged should receive exactly their fair shares")
        void allBackloggedShouldReceiveShares() {
            Map<TenantTier, Integer> grants = capBounded.computeAllocation(depths(500, 500, 500, 500), 100);

            assertThat(grants).containsEntry(ENTERPRISE, 50)
                    .containsEntry(PROFESSIONAL, 30)
                    .containsEntry(STARTER, 15)
                    .containsEntry(FREE, 5);
        }

        @Test
        @DisplayName("a backlogged Free tier should get at least one credit at small capacity")
        void freeTierShouldGetMinimumCredit() {
            Map<TenantTier, Integer> grants = capBounded.computeAllocation(depths(100, 100, 0, 100), 10);

            assertThat(grants).containsEntry(ENTERPRISE, 6)
                    .containsEntry(PROFESSIONAL, 3)
                    .containsEntry(FREE, 1);
        }

        @Test
        @DisplayName("a lone Enterprise tier should stop at its hard cap")
        void loneTierShouldStopAtCap() {
            Map<TenantTier, Integer> grants = capBounded.computeAllocation(depths(100, 0, 0, 0), 10);

            assertThat(grants).containsEntry(ENTERPRISE, 6);
            assertThat(grants.values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(6);
        }

        @Test
        @DisplayName("grants should never exceed depth")
        void grantsShouldNotExceedDepth() {
            Map<TenantTier, Integer> grants = capBounded.computeAllocation(depths(3, 0, 0, 2), 100);

            assertThat(grants).containsEntry(ENTERPRISE, 3).containsEntry(FREE, 2);
        }

        @Test
        @DisplayName("the one-credit floor should win over capacity when tiers outnumber credits")
        void floorShouldWinOverCapacity() {
            Map<TenantTier, Integer> grants = capBounded.computeAllocation(depths(10, 10, 10, 10), 2);

            assertThat(grants.values()).containsOnly(1);
        }

        @Test
        @DisplayName("overshoot from floors should be taken back from the largest grant")
        void overshootShouldBeTakenFromLargest() {
            Map<TenantTier, Integer> grants = capBounded.computeAllocation(depths(10, 10, 10, 10), 4);

            assertThat(grants).containsEntry(ENTERPRISE, 1)
                    .containsEntry(PROFESSIONAL, 1)
                    .containsEntry(STARTER, 1)
                    .containsEntry(FREE, 1);
        }
    }

    @Nested
    @DisplayName("work conserving")
    class WorkConserving {

        @Test
        @DisplayName("a lone tier may absorb the whole capacity")
        void loneTierShouldAbsorbCapacity() {
            Map<TenantTier, Integer> grants = workConserving.computeAllocation(depths(100, 0, 0, 0), 10);

            assertThat(grants).containsEntry(ENTERPRISE, 10);
        }

        @Test
        @DisplayName("total grants should equal capacity when backlog suffices")
        void totalShouldEqualCapacity() {
            Map<TenantTier, Integer> grants = workConserving.computeAllocation(depths(0, 100, 0, 100), 37);

            assertThat(grants.values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(37);
            assertThat(grants.get(PROFESSIONAL)).isGreaterThan(grants.get(FREE));
        }
    }

    @Test
    @DisplayName("no backlog or zero capacity should grant nothing")
    void emptyInputsShouldGrantNothing() {
        assertThat(capBounded.computeAllocation(depths(0, 0, 0, 0), 100).values()).containsOnly(0);
        assertThat(capBounded.computeAllocation(depths(5, 5, 5, 5), 0).values()).containsOnly(0);
        assertThat(capBounded.computeAllocation(Map.of(), 100)).hasSize(4);
    }

    @Test
    @DisplayName("negative capacity should be rejected")
    void negativeCapacityShouldBeRejected() {
        assertThatThrownBy(() -> capBounded.computeAllocation(depths(1, 0, 0, 0), -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("ceiling should follow the hard cap unless work conserving")
    void ceilingShouldFollowPolicy() {
        assertThat(capBounded.ceiling(ENTERPRISE, 100)).isEqualTo(60);
        assertThat(capBounded.ceiling(FREE, 5)).isEqualTo(1);
        assertThat(workConserving.ceiling(FREE, 100)).isEqualTo(100);
    }
}
