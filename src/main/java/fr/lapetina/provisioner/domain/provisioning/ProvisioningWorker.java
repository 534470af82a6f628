package fr.lapetina.provisioner.domain.provisioning;

import fr.lapetina.provisioner.domain.event.ProvisioningListener;
import fr.lapetina.provisioner.domain.model.ErrorType;
import fr.lapetina.provisioner.domain.model.InventoryRecord;
import fr.lapetina.provisioner.domain.model.ProvisionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Provisions one host: dry-run fast path, or up to {@code maxRetries + 1} remote attempts.
 *
 * <p>The loop returns on the first successful attempt. A failed attempt (failure response or
 * exception from the API) is reported to the listener and followed by the next attempt, after
 * the configured backoff if any. When every attempt fails the outcome carries the last failure.
 *
 * <p>Stateless apart from its collaborators, so a single instance serves all worker threads;
 * results travel only through the returned outcome.
 */
public class ProvisioningWorker {

    private static final Logger log = LoggerFactory.getLogger(ProvisioningWorker.class);

    static final String MDC_HOSTNAME = "hostname";

    private final ProvisioningApi api;
    private final ProvisioningListener listener;

    public ProvisioningWorker(ProvisioningApi api, ProvisioningListener listener) {
        this.api = Objects.requireNonNull(api, "Provisioning API is required");
        this.listener = listener != null ? listener : ProvisioningListener.NOOP;
    }

    /**
     * Provisions a single host.
     *
     * @return the host's terminal outcome, never null
     */
    public ProvisionOutcome provision(InventoryRecord record, ProvisioningSettings settings) {
        MDC.put(MDC_HOSTNAME, record.hostname());
        try {
            if (settings.dryRun()) {
                notifyDryRun(record, settings);
                return ProvisionOutcome.dryRun(record);
            }
            return attempt(record, settings);
        } finally {
            MDC.remove(MDC_HOSTNAME);
        }
    }

    private ProvisionOutcome attempt(InventoryRecord record, ProvisioningSettings settings) {
        Instant start = Instant.now();
        int maxAttempts = settings.maxAttempts();
        ErrorType lastErrorType = null;
        String lastFailure = null;

        for (int attempt = 1; ; attempt++) {
            if (attempt > 1 && !awaitBackoff(settings.backoff().delayBeforeRetry(attempt - 1))) {
                log.warn("Interrupted before retry: hostname={}, address={}, attemptsMade={}",
                        record.hostname(), record.address(), attempt - 1);
                return ProvisionOutcome.failed(record, attempt - 1, ErrorType.INTERRUPTED,
                        "interrupted before attempt " + attempt + ", last failure: " + lastFailure,
                        Duration.between(start, Instant.now()));
            }

            ProvisioningRequest request = ProvisioningRequest.of(settings, record, attempt);
            log.debug("Provisioning attempt: hostname={}, address={}, attempt={}/{}, requestId={}",
                    record.hostname(), record.address(), attempt, maxAttempts, request.requestId());

            try {
                ProvisioningResponse response = api.provision(request);
                if (response != null && response.isSuccess()) {
                    return ProvisionOutcome.completed(record, attempt, Duration.between(start, Instant.now()));
                }
                lastErrorType = response != null ? response.errorType() : ErrorType.INTERNAL_ERROR;
                lastFailure = response != null ? response.failureReason() : "no response from provisioning API";
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lastErrorType = ErrorType.INTERRUPTED;
                lastFailure = "interrupted during attempt " + attempt;
            } catch (Exception e) {
                lastErrorType = classify(e);
                lastFailure = describe(e);
                log.debug("Provisioning attempt threw: hostname={}, attempt={}",
                        record.hostname(), attempt, e);
            }

            notifyAttemptFailed(record, attempt, maxAttempts, lastErrorType, lastFailure);

            if (lastErrorType == ErrorType.INTERRUPTED || Thread.currentThread().isInterrupted()) {
                return ProvisionOutcome.failed(record, attempt, ErrorType.INTERRUPTED, lastFailure,
                        Duration.between(start, Instant.now()));
            }
            // attempt never increments past maxAttempts
            if (attempt == maxAttempts) {
                return ProvisionOutcome.failed(record, attempt, lastErrorType, lastFailure,
                        Duration.between(start, Instant.now()));
            }
        }
    }

    /**
     * Waits out the backoff delay.
     *
     * @return false if the thread was interrupted
     */
    protected boolean awaitBackoff(Duration delay) {
        if (delay.isZero()) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private ErrorType classify(Exception e) {
        if (e instanceof TimeoutException || e instanceof HttpTimeoutException) {
            return ErrorType.TIMEOUT;
        }
        if (e instanceof IOException) {
            return ErrorType.REMOTE_ERROR;
        }
        return ErrorType.INTERNAL_ERROR;
    }

    private String describe(Exception e) {
        return e.getMessage() != null
                ? e.getClass().getSimpleName() + ": " + e.getMessage()
                : e.getClass().getSimpleName();
    }

    private void notifyDryRun(InventoryRecord record, ProvisioningSettings settings) {
        try {
            listener.onDryRun(record, settings.endpoint().toString());
        } catch (Exception e) {
            log.error("Error notifying listener of dry run: hostname={}", record.hostname(), e);
        }
    }

    private void notifyAttemptFailed(InventoryRecord record, int attempt, int maxAttempts,
                                     ErrorType errorType, String reason) {
        try {
            listener.onAttemptFailed(record, attempt, maxAttempts, errorType, reason);
        } catch (Exception e) {
            log.error("Error notifying listener of failed attempt: hostname={}", record.hostname(), e);
        }
    }
}
