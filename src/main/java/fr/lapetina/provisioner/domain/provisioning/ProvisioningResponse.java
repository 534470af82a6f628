package fr.lapetina.provisioner.domain.provisioning;

import fr.lapetina.provisioner.domain.model.ErrorType;

import java.time.Duration;

/**
 * Result of one remote provisioning call.
 * Immutable and thread-safe.
 *
 * @param statusCode    HTTP-like status code, 0 when no response was received
 * @param body          response body, may be null
 * @param errorType     null on success
 * @param failureReason null on success
 * @param latency       time spent in the call
 */
public record ProvisioningResponse(
        int statusCode,
        String body,
        ErrorType errorType,
        String failureReason,
        Duration latency
) {
    public ProvisioningResponse {
        if (latency == null) {
            latency = Duration.ZERO;
        }
        if (errorType != null && failureReason == null) {
            failureReason = errorType.name();
        }
    }

    public boolean isSuccess() {
        return errorType == null;
    }

    public static ProvisioningResponse success(int statusCode, String body, Duration latency) {
        return new ProvisioningResponse(statusCode, body, null, null, latency);
    }

    public static ProvisioningResponse failure(
            int statusCode,
            ErrorType errorType,
            String failureReason,
            Duration latency
    ) {
        return new ProvisioningResponse(statusCode, null, errorType, failureReason, latency);
    }
}
