package fr.lapetina.scheduler.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TierPoliciesTest {

    @Test
    @DisplayName("defaults should cover every tier with shares summing to 100")
    void defaultsShouldCoverEveryTier() {
        TierPolicies policies = TierPolicies.defaults();

        assertThat(policies.all()).hasSize(TenantTier.values().length);
        assertThat(policies.all().stream().mapToInt(TierPolicy::fairSharePercent).sum()).isEqualTo(100);
        assertThat(policies.get(TenantTier.FREE).burstCapacity()).isEqualTo(10);
        assertThat(policies.get(TenantTier.FREE).sustainedRate()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("should reject shares not summing to 100")
    void shouldRejectSharesNotSummingTo100() {
        List<TierPolicy> policies = List.of(
                new TierPolicy(TenantTier.ENTERPRISE, 50, 60, 10, 10),
                new TierPolicy(TenantTier.PROFESSIONAL, 30, 40, 10, 10),
                new TierPolicy(TenantTier.STARTER, 10, 25, 10, 10),
                new TierPolicy(TenantTier.FREE, 5, 10, 10, 10)
        );

        assertThatThrownBy(() -> TierPolicies.of(policies))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sum to 95");
    }

    @Test
    @DisplayName("should reject a missing tier")
    void shouldRejectMissingTier() {
        List<TierPolicy> policies = List.of(
                new TierPolicy(TenantTier.ENTERPRISE, 60, 60, 10, 10),
                new TierPolicy(TenantTier.PROFESSIONAL, 30, 40, 10, 10),
                new TierPolicy(TenantTier.STARTER, 10, 25, 10, 10)
        );

        assertThatThrownBy(() -> TierPolicies.of(policies))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("FREE");
    }

    @Test
    @DisplayName("should reject a duplicated tier")
    void shouldRejectDuplicatedTier() {
        List<TierPolicy> policies = List.of(
                new TierPolicy(TenantTier.ENTERPRISE, 50, 60, 10, 10),
                new TierPolicy(TenantTier.ENTERPRISE, 50, 60, 10, 10)
        );

        assertThatThrownBy(() -> TierPolicies.of(policies))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    @DisplayName("should reject a hard cap below the fair share")
    void shouldRejectCapBelowShare() {
        assertThatThrownBy(() -> new TierPolicy(TenantTier.STARTER, 15, 10, 10, 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("hardCapPercent");
    }

    @Test
    @DisplayName("should reject a non-positive rate or burst")
    void shouldRejectNonPositiveRateOrBurst() {
        assertThatThrownBy(() -> new TierPolicy(TenantTier.FREE, 5, 10, 0, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TierPolicy(TenantTier.FREE, 5, 10, 5, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("tier names should parse case-insensitively")
    void tierNamesShouldParseCaseInsensitively() {
        assertThat(TenantTier.fromName(" professional ")).isEqualTo(TenantTier.PROFESSIONAL);
        assertThatThrownBy(() -> TenantTier.fromName("gold")).isInstanceOf(IllegalArgumentException.class);
    }
}
