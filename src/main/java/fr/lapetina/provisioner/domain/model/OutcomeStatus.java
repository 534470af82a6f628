package fr.lapetina.provisioner.domain.model;

/**
 * Terminal status of one host's provisioning.
 */
public enum OutcomeStatus {
    /** Dry-run mode, no remote call made */
    DRY_RUN,

    /** Remote call succeeded */
    COMPLETED,

    /** Retry budget exhausted, or the worker itself failed */
    FAILED
}
