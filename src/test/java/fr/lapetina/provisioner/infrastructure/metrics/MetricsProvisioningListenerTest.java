package fr.lapetina.provisioner.infrastructure.metrics;

import fr.lapetina.provisioner.domain.model.ErrorType;
import fr.lapetina.provisioner.domain.model.InventoryRecord;
import fr.lapetina.provisioner.domain.model.ParseDiagnostic;
import fr.lapetina.provisioner.domain.model.ProvisionOutcome;
import fr.lapetina.provisioner.domain.model.RunSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsProvisioningListenerTest {

    private static final InventoryRecord HOST = InventoryRecord.of("web1", "10.0.0.1");

    private MetricsRegistry metrics;
    private MetricsProvisioningListener listener;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry("test");
        listener = new MetricsProvisioningListener(metrics);
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    private double counter(String name, String tagKey, String tagValue) {
        MeterRegistry registry = metrics.getRegistry();
        return registry.get(name).tag(tagKey, tagValue).counter().count();
    }

    @Test
    @DisplayName("should count outcomes by status")
    void shouldCountOutcomes() {
        listener.onOutcome(ProvisionOutcome.completed(HOST, 1, Duration.ofMillis(40)));
        listener.onOutcome(ProvisionOutcome.completed(HOST, 2, Duration.ofMillis(60)));
        listener.onOutcome(ProvisionOutcome.failed(HOST, 4, ErrorType.TIMEOUT, "timed out", Duration.ofMillis(90)));

        assertThat(counter("test_outcomes_total", "status", "COMPLETED")).isEqualTo(2.0);
        assertThat(counter("test_outcomes_total", "status", "FAILED")).isEqualTo(1.0);
        assertThat(metrics.getRegistry().get("test_host_attempts").summary().totalAmount()).isEqualTo(7.0);
        assertThat(metrics.getRegistry().get("test_host_duration").timer().count()).isEqualTo(3);
    }

    @Test
    @DisplayName("should not record duration or attempts for dry-run outcomes")
    void shouldSkipDryRunTimings() {
        listener.onOutcome(ProvisionOutcome.dryRun(HOST));

        assertThat(counter("test_outcomes_total", "status", "DRY_RUN")).isEqualTo(1.0);
        assertThat(metrics.getRegistry().get("test_host_attempts").summary().count()).isZero();
        assertThat(metrics.getRegistry().get("test_host_duration").timer().count()).isZero();
    }

    @Test
    @DisplayName("should count attempt failures by type and diagnostics by reason")
    void shouldCountFailuresAndDiagnostics() {
        listener.onAttemptFailed(HOST, 1, 3, ErrorType.REMOTE_ERROR, "HTTP 503");
        listener.onAttemptFailed(HOST, 2, 3, ErrorType.REMOTE_ERROR, "HTTP 503");
        listener.onDiagnostic(ParseDiagnostic.invalidAddress(4, "db,999.1.1.1", "999.1.1.1"));

        assertThat(counter("test_attempt_failures_total", "type", "REMOTE_ERROR")).isEqualTo(2.0);
        assertThat(counter("test_parse_diagnostics_total", "reason", "INVALID_ADDRESS")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should track the worker count for the duration of a run")
    void shouldTrackWorkers() {
        listener.onRunStarted(10, 4, false);
        assertThat(metrics.getRegistry().get("test_workers").gauge().value()).isEqualTo(4.0);

        listener.onRunCompleted(RunSummary.empty(0));
        assertThat(metrics.getRegistry().get("test_workers").gauge().value()).isZero();
    }

    @Test
    @DisplayName("should expose counters in the Prometheus scrape")
    void shouldScrapePrometheusText() {
        listener.onOutcome(ProvisionOutcome.completed(HOST, 1, Duration.ofMillis(40)));

        assertThat(metrics.scrape())
                .containsPattern("test_outcomes_total\\{status=\"COMPLETED\",?}")
                .contains("test_host_duration_seconds");
    }
}
