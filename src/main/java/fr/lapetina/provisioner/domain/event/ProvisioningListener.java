package fr.lapetina.provisioner.domain.event;

import fr.lapetina.provisioner.domain.model.ErrorType;
import fr.lapetina.provisioner.domain.model.InventoryRecord;
import fr.lapetina.provisioner.domain.model.ParseDiagnostic;
import fr.lapetina.provisioner.domain.model.ParseResult;
import fr.lapetina.provisioner.domain.model.ProvisionOutcome;
import fr.lapetina.provisioner.domain.model.RunSummary;

/**
 * Observer for parse and provisioning events.
 *
 * <p>Injected into the parser, the worker and the dispatcher so callers decide where per-host
 * output goes (logs, metrics, a test recorder). All methods default to no-ops.
 *
 * <p>Threading: {@link #onAttemptFailed} and {@link #onDryRun} are called from worker threads,
 * concurrently for different hosts. {@link #onOutcome} and {@link #onRunCompleted} are called
 * from the dispatcher's single aggregation thread. Implementations must not throw; callers log
 * and discard anything they do throw.
 */
public interface ProvisioningListener {

    ProvisioningListener NOOP = new ProvisioningListener() {
    };

    /**
     * A line was rejected while parsing the inventory.
     */
    default void onDiagnostic(ParseDiagnostic diagnostic) {
    }

    /**
     * The whole inventory has been read.
     */
    default void onInventoryParsed(ParseResult result) {
    }

    /**
     * Dispatch is about to start.
     */
    default void onRunStarted(int records, int workers, boolean dryRun) {
    }

    /**
     * Dry-run fast path taken for a host; nothing was sent.
     */
    default void onDryRun(InventoryRecord record, String endpoint) {
    }

    /**
     * One remote attempt failed. Another attempt follows unless {@code attempt == maxAttempts}.
     */
    default void onAttemptFailed(InventoryRecord record, int attempt, int maxAttempts,
                                 ErrorType errorType, String reason) {
    }

    /**
     * A host reached its terminal outcome.
     */
    default void onOutcome(ProvisionOutcome outcome) {
    }

    /**
     * Every submitted host has an outcome.
     */
    default void onRunCompleted(RunSummary summary) {
    }
}
