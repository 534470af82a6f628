package fr.lapetina.provisioner.domain.model;

/**
 * Why an inventory line was rejected.
 */
public enum DiagnosticReason {
    /** Line could not be split into a hostname and an address */
    MALFORMED_LINE,

    /** Address field is not an IPv4 or IPv6 literal */
    INVALID_ADDRESS,

    /** Hostname or address empty after trimming (strict inventory mode only) */
    EMPTY_FIELD
}
