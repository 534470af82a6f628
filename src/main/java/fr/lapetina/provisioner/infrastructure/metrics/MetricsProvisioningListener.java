package fr.lapetina.provisioner.infrastructure.metrics;

import fr.lapetina.provisioner.domain.event.ProvisioningListener;
import fr.lapetina.provisioner.domain.model.ErrorType;
import fr.lapetina.provisioner.domain.model.InventoryRecord;
import fr.lapetina.provisioner.domain.model.OutcomeStatus;
import fr.lapetina.provisioner.domain.model.ParseDiagnostic;
import fr.lapetina.provisioner.domain.model.ProvisionOutcome;
import fr.lapetina.provisioner.domain.model.RunSummary;

/**
 * Feeds parse and provisioning events into the {@link MetricsRegistry}.
 */
public final class MetricsProvisioningListener implements ProvisioningListener {

    private final MetricsRegistry metrics;

    public MetricsProvisioningListener(MetricsRegistry metrics) {
        this.metrics = metrics;
    }

    @Override
    public void onDiagnostic(ParseDiagnostic diagnostic) {
        metrics.incrementDiagnosticCount(diagnostic.reason());
    }

    @Override
    public void onRunStarted(int records, int workers, boolean dryRun) {
        metrics.setActiveWorkers(workers);
    }

    @Override
    public void onAttemptFailed(InventoryRecord record, int attempt, int maxAttempts,
                                ErrorType errorType, String reason) {
        metrics.incrementAttemptFailure(errorType);
    }

    @Override
    public void onOutcome(ProvisionOutcome outcome) {
        metrics.incrementOutcomeCount(outcome.status());
        // dry-run hosts make no calls
        if (outcome.status() != OutcomeStatus.DRY_RUN) {
            metrics.recordHostDuration(outcome.duration());
            metrics.recordAttempts(outcome.attempts());
        }
    }

    @Override
    public void onRunCompleted(RunSummary summary) {
        metrics.setActiveWorkers(0);
    }
}
