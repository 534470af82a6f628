package fr.lapetina.provisioner.domain.model;

/**
 * Error taxonomy for provisioning attempts.
 * Provides clear categorization for outcomes, logs and metrics.
 */
public enum ErrorType {
    /** Remote API rejected the request (4xx) */
    CLIENT_ERROR,

    /** Remote API failed or was unreachable (5xx, connection error) */
    REMOTE_ERROR,

    /** Attempt did not finish within the request timeout */
    TIMEOUT,

    /** Thread interrupted while waiting on the API or between attempts */
    INTERRUPTED,

    /** Unexpected error while performing an attempt */
    INTERNAL_ERROR,

    /** Worker invocation itself failed and produced no outcome */
    TASK_FAILURE
}
