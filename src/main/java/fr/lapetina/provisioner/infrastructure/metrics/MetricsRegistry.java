package fr.lapetina.provisioner.infrastructure.metrics;

import fr.lapetina.provisioner.domain.model.DiagnosticReason;
import fr.lapetina.provisioner.domain.model.ErrorType;
import fr.lapetina.provisioner.domain.model.OutcomeStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Outcome counters by status
 * - Attempt failure counters by error type
 * - Parse diagnostic counters by reason
 * - Per-host provisioning duration and attempt distribution
 * - Prometheus text exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for tagged meters
    private final ConcurrentHashMap<OutcomeStatus, Counter> outcomeCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ErrorType, Counter> attemptFailureCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<DiagnosticReason, Counter> diagnosticCounters = new ConcurrentHashMap<>();

    private final Timer hostDuration;
    private final DistributionSummary attempts;
    private final AtomicInteger activeWorkers = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        this.hostDuration = Timer.builder(prefix + "_host_duration")
                .description("Wall-clock time spent provisioning one host")
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(registry);

        this.attempts = DistributionSummary.builder(prefix + "_host_attempts")
                .description("Remote attempts made per host")
                .register(registry);

        Gauge.builder(prefix + "_workers", activeWorkers, AtomicInteger::get)
                .description("Worker threads of the current run")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("provisioner");
    }

    /**
     * Counts one terminal host outcome.
     */
    public void incrementOutcomeCount(OutcomeStatus status) {
        outcomeCounters.computeIfAbsent(status, s ->
                Counter.builder(prefix + "_outcomes_total")
                        .description("Hosts that reached a terminal outcome")
                        .tag("status", s.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Counts one failed remote attempt.
     */
    public void incrementAttemptFailure(ErrorType errorType) {
        attemptFailureCounters.computeIfAbsent(errorType, t ->
                Counter.builder(prefix + "_attempt_failures_total")
                        .description("Failed remote provisioning attempts")
                        .tag("type", t.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Counts one rejected inventory line.
     */
    public void incrementDiagnosticCount(DiagnosticReason reason) {
        diagnosticCounters.computeIfAbsent(reason, r ->
                Counter.builder(prefix + "_parse_diagnostics_total")
                        .description("Rejected inventory lines")
                        .tag("reason", r.name())
                        .register(registry)
        ).increment();
    }

    public void recordHostDuration(Duration duration) {
        hostDuration.record(duration);
    }

    public void recordAttempts(int count) {
        attempts.record(count);
    }

    public void setActiveWorkers(int value) {
        activeWorkers.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
