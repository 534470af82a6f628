package fr.lapetina.provisioner.domain.model;

import java.util.Objects;

/**
 * A rejected inventory line.
 *
 * @param lineNumber physical line number, starting at 1
 * @param rawLine    the line exactly as read
 * @param reason     rejection category
 * @param message    human-readable explanation
 */
public record ParseDiagnostic(
        int lineNumber,
        String rawLine,
        DiagnosticReason reason,
        String message
) {
    public ParseDiagnostic {
        if (lineNumber < 1) {
            throw new IllegalArgumentException("Line numbers start at 1: " + lineNumber);
        }
        Objects.requireNonNull(rawLine, "Raw line is required");
        Objects.requireNonNull(reason, "Reason is required");
        Objects.requireNonNull(message, "Message is required");
    }

    public static ParseDiagnostic malformedLine(int lineNumber, String rawLine) {
        return new ParseDiagnostic(lineNumber, rawLine, DiagnosticReason.MALFORMED_LINE,
                "expected 'hostname,address'");
    }

    public static ParseDiagnostic invalidAddress(int lineNumber, String rawLine, String address) {
        return new ParseDiagnostic(lineNumber, rawLine, DiagnosticReason.INVALID_ADDRESS,
                "invalid address: " + address);
    }

    public static ParseDiagnostic emptyField(int lineNumber, String rawLine) {
        return new ParseDiagnostic(lineNumber, rawLine, DiagnosticReason.EMPTY_FIELD,
                "empty hostname or address");
    }
}
