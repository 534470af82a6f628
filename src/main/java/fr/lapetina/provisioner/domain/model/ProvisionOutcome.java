package fr.lapetina.provisioner.domain.model;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Terminal result of one host's provisioning attempt sequence.
 * Immutable and thread-safe.
 *
 * @param hostname     host name from the inventory
 * @param address      address from the inventory
 * @param status       terminal status
 * @param attempts     remote calls made (0 for dry-run and task failures)
 * @param errorType    failure category, null unless {@code FAILED}
 * @param errorMessage last failure reason, null unless {@code FAILED}
 * @param duration     wall-clock time spent on this host
 */
public record ProvisionOutcome(
        String hostname,
        String address,
        OutcomeStatus status,
        int attempts,
        ErrorType errorType,
        String errorMessage,
        Duration duration
) {
    public ProvisionOutcome {
        Objects.requireNonNull(hostname, "Hostname is required");
        Objects.requireNonNull(address, "Address is required");
        Objects.requireNonNull(status, "Status is required");
        if (attempts < 0) {
            throw new IllegalArgumentException("Attempts must be >= 0: " + attempts);
        }
        if (duration == null) {
            duration = Duration.ZERO;
        }
    }

    public boolean isFailed() {
        return status == OutcomeStatus.FAILED;
    }

    public Optional<String> error() {
        return Optional.ofNullable(errorMessage);
    }

    /**
     * Creates a dry-run outcome.
     */
    public static ProvisionOutcome dryRun(InventoryRecord record) {
        return new ProvisionOutcome(record.hostname(), record.address(),
                OutcomeStatus.DRY_RUN, 0, null, null, Duration.ZERO);
    }

    /**
     * Creates a successful outcome.
     */
    public static ProvisionOutcome completed(InventoryRecord record, int attempts, Duration duration) {
        return new ProvisionOutcome(record.hostname(), record.address(),
                OutcomeStatus.COMPLETED, attempts, null, null, duration);
    }

    /**
     * Creates a failed outcome after the given number of attempts.
     */
    public static ProvisionOutcome failed(
            InventoryRecord record,
            int attempts,
            ErrorType errorType,
            String errorMessage,
            Duration duration
    ) {
        return new ProvisionOutcome(record.hostname(), record.address(),
                OutcomeStatus.FAILED, attempts, errorType, errorMessage, duration);
    }

    /**
     * Creates the synthetic outcome used when a worker invocation fails to produce a result.
     */
    public static ProvisionOutcome taskFailure(InventoryRecord record, Throwable cause) {
        String message = cause.getMessage() != null
                ? cause.getClass().getSimpleName() + ": " + cause.getMessage()
                : cause.getClass().getSimpleName();
        return new ProvisionOutcome(record.hostname(), record.address(),
                OutcomeStatus.FAILED, 0, ErrorType.TASK_FAILURE, message, Duration.ZERO);
    }
}
