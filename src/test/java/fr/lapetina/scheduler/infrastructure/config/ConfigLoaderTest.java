package fr.lapetina.scheduler.infrastructure.config;

import fr.lapetina.scheduler.allocation.RedistributionPolicy;
import fr.lapetina.scheduler.domain.model.TenantTier;
import fr.lapetina.scheduler.domain.model.TierPolicies;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static ByteArrayInputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("loading")
    class Loading {

        @Test
        @DisplayName("should load the test configuration from the classpath")
        void shouldLoadFromClasspath() {
            ConfigLoader loader = new ConfigLoader("test-config.yaml");

            SchedulerConfig config = loader.load();

            assertThat(config.resolveReplicaId()).isEqualTo("test-replica");
            assertThat(config.getWorkers().getPoolSize()).isEqualTo(4);
            assertThat(config.effectiveCreditsPerTick()).isEqualTo(4);
            assertThat(loader.getCurrentConfig()).isSameAs(config);

            SchedulingSettings settings = loader.getCurrentSettings();
            assertThat(settings.redistribution()).isEqualTo(RedistributionPolicy.WORK_CONSERVING);
            assertThat(settings.tierPolicies().get(TenantTier.FREE).burstCapacity()).isEqualTo(2);
            assertThat(settings.governor().throttleRateFactor()).isEqualTo(0.25);
            assertThat(settings.maxQueueSize()).isEqualTo(500);
            assertThat(settings.maxQueueWait()).isEqualTo(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("an empty tier list should fall back to the default policies")
        void emptyTiersShouldUseDefaults() {
            SchedulerConfig config = ConfigLoader.parse(yaml("workers:\n  poolSize: 3\n"));

            assertThat(config.validate().tierPolicies()).isEqualTo(TierPolicies.defaults());
            assertThat(config.validate().redistribution()).isEqualTo(RedistributionPolicy.CAP_BOUNDED);
            assertThat(config.resolveReplicaId()).startsWith("replica-");
        }

        @Test
        @DisplayName("fair shares not summing to 100 should be rejected")
        void invalidSharesShouldBeRejected() {
            String content = "tiers:\n"
                    + "  - {name: ENTERPRISE, fairSharePercent: 50, hardCapPercent: 60, sustainedRate: 10, burstCapacity: 10}\n"
                    + "  - {name: PROFESSIONAL, fairSharePercent: 30, hardCapPercent: 40, sustainedRate: 10, burstCapacity: 10}\n"
                    + "  - {name: STARTER, fairSharePercent: 5, hardCapPercent: 25, sustainedRate: 10, burstCapacity: 10}\n"
                    + "  - {name: FREE, fairSharePercent: 5, hardCapPercent: 10, sustainedRate: 10, burstCapacity: 10}\n";

            assertThatThrownBy(() -> ConfigLoader.parse(yaml(content)))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("sum to 100");
        }

        @Test
        @DisplayName("a hard cap below the fair share should be rejected")
        void capBelowShareShouldBeRejected() {
            String content = "tiers:\n"
                    + "  - {name: ENTERPRISE, fairSharePercent: 50, hardCapPercent: 40, sustainedRate: 10, burstCapacity: 10}\n"
                    + "  - {name: PROFESSIONAL, fairSharePercent: 30, hardCapPercent: 40, sustainedRate: 10, burstCapacity: 10}\n"
                    + "  - {name: STARTER, fairSharePercent: 15, hardCapPercent: 25, sustainedRate: 10, burstCapacity: 10}\n"
                    + "  - {name: FREE, fairSharePercent: 5, hardCapPercent: 10, sustainedRate: 10, burstCapacity: 10}\n";

            assertThatThrownBy(() -> ConfigLoader.parse(yaml(content)))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("hardCapPercent");
        }

        @Test
        @DisplayName("an unknown redistribution policy should be rejected")
        void unknownRedistributionShouldBeRejected() {
            assertThatThrownBy(() -> ConfigLoader.parse(yaml("scheduling:\n  redistribution: greedy\n")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("CAP_BOUNDED or WORK_CONSERVING");
        }

        @Test
        @DisplayName("a sustained period longer than the governor window should be rejected")
        void sustainedPeriodBeyondWindowShouldBeRejected() {
            String content = "governor:\n  windowSeconds: 5\n  sustainedPeriodMs: 6000\n";

            assertThatThrownBy(() -> ConfigLoader.parse(yaml(content)))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("sustainedPeriodMs");
        }

        @Test
        @DisplayName("queue limits and ring size should be checked")
        void queueLimitsShouldBeChecked() {
            assertThatThrownBy(() -> ConfigLoader.parse(yaml("scheduling:\n  maxQueueSize: 0\n")))
                    .hasMessageContaining("maxQueueSize");
            assertThatThrownBy(() -> ConfigLoader.parse(yaml("scheduling:\n  maxQueueWaitMs: 0\n")))
                    .hasMessageContaining("maxQueueWaitMs");
            assertThatThrownBy(() -> ConfigLoader.parse(yaml("scheduling:\n  ringBufferSize: 1000\n")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("power of 2");
        }

        @Test
        @DisplayName("malformed or empty documents should be rejected")
        void malformedDocumentsShouldBeRejected() {
            assertThatThrownBy(() -> ConfigLoader.parse(yaml("workers: [poolSize\n")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("Malformed");
            assertThatThrownBy(() -> ConfigLoader.parse(yaml("")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("empty");
        }

        @Test
        @DisplayName("a missing file should fail to load")
        void missingFileShouldFail() {
            assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml").load())
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("not found");
        }
    }

    @Nested
    @DisplayName("reload")
    class Reload {

        private Path file;
        private ConfigLoader loader;

        @BeforeEach
        void setUp(@TempDir Path dir) throws Exception {
            file = dir.resolve("scheduler.yaml");
            Files.writeString(file, "workers:\n  poolSize: 6\nscheduling:\n  maxQueueWaitMs: 30000\n");
            loader = new ConfigLoader(file.toString());
            loader.load();
        }

        @AfterEach
        void tearDown() {
            loader.close();
        }

        @Test
        @DisplayName("changed scheduling settings should be applied and reported to listeners")
        void changedSettingsShouldBeApplied() throws Exception {
            List<long[]> changes = new ArrayList<>();
            loader.addListener((previous, current) -> changes.add(new long[]{
                    previous.maxQueueWait().toMillis(), current.maxQueueWait().toMillis()}));

            Files.writeString(file, "workers:\n  poolSize: 6\nscheduling:\n  maxQueueWaitMs: 10000\n");
            ReloadResult result = loader.reload();

            assertThat(result.status()).isEqualTo(ReloadResult.Status.APPLIED);
            assertThat(result.changed()).containsExactly("maxQueueWait");
            assertThat(result.settings().maxQueueWait()).isEqualTo(Duration.ofSeconds(10));
            assertThat(loader.getCurrentSettings()).isSameAs(result.settings());
            assertThat(changes).hasSize(1);
            assertThat(changes.get(0)).containsExactly(30_000L, 10_000L);
        }

        @Test
        @DisplayName("a change to startup-only settings should not notify listeners")
        void startupOnlyChangeShouldNotNotify() throws Exception {
            List<SchedulingSettings> notified = new ArrayList<>();
            loader.addListener((previous, current) -> notified.add(current));

            Files.writeString(file, "workers:\n  poolSize: 12\nscheduling:\n  maxQueueWaitMs: 30000\n");
            ReloadResult result = loader.reload();

            assertThat(result.status()).isEqualTo(ReloadResult.Status.UNCHANGED);
            assertThat(result.changed()).isEmpty();
            assertThat(notified).isEmpty();
            assertThat(loader.getCurrentConfig().getWorkers().getPoolSize()).isEqualTo(12);
        }

        @Test
        @DisplayName("an invalid file should keep the current settings")
        void invalidFileShouldKeepCurrent() throws Exception {
            SchedulingSettings original = loader.getCurrentSettings();
            List<SchedulingSettings> notified = new ArrayList<>();
            loader.addListener((previous, current) -> notified.add(current));

            Files.writeString(file, "workers:\n  poolSize: 0\nscheduling:\n  maxQueueWaitMs: 1000\n");
            ReloadResult result = loader.reload();

            assertThat(result.status()).isEqualTo(ReloadResult.Status.REJECTED);
            assertThat(result.message()).contains("poolSize");
            assertThat(result.settings()).isSameAs(original);
            assertThat(loader.getCurrentSettings()).isSameAs(original);
            assertThat(loader.getCurrentConfig().getWorkers().getPoolSize()).isEqualTo(6);
            assertThat(notified).isEmpty();
        }

        @Test
        @DisplayName("a failing listener should not keep the others from being told")
        void failingListenerShouldBeIsolated() throws Exception {
            List<SchedulingSettings> notified = new ArrayList<>();
            loader.addListener((previous, current) -> {
                throw new IllegalStateException("boom");
            });
            loader.addListener((previous, current) -> notified.add(current));

            Files.writeString(file, "workers:\n  poolSize: 6\nscheduling:\n  maxQueueSize: 50\n  maxQueueWaitMs: 30000\n");

            assertThat(loader.reload().status()).isEqualTo(ReloadResult.Status.APPLIED);
            assertThat(notified).hasSize(1);
            assertThat(notified.get(0).maxQueueSize()).isEqualTo(50);
        }

        @Test
        @DisplayName("reload before a first load should be refused")
        void reloadBeforeLoadShouldFail() {
            assertThatThrownBy(() -> new ConfigLoader(file.toString()).reload())
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("watching should reload once the file is modified")
        void watchingShouldReloadModifiedFile() throws Exception {
            CountDownLatch applied = new CountDownLatch(1);
            loader.addListener((previous, current) -> {
                if (current.redistribution() == RedistributionPolicy.WORK_CONSERVING) {
                    applied.countDown();
                }
            });
            loader.startWatching(Duration.ofMillis(50));

            Files.writeString(file, "workers:\n  poolSize: 6\nscheduling:\n  maxQueueWaitMs: 30000\n"
                    + "  redistribution: WORK_CONSERVING\n");
            Files.setLastModifiedTime(file, FileTime.fromMillis(System.currentTimeMillis() + 60_000));

            assertThat(applied.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(loader.getCurrentSettings().redistribution()).isEqualTo(RedistributionPolicy.WORK_CONSERVING);
        }
    }
}
