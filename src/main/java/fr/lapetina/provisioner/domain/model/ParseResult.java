package fr.lapetina.provisioner.domain.model;

import java.util.List;

/**
 * Output of one inventory parse: valid records in input order, diagnostics in input order,
 * and line accounting.
 *
 * <p>For every parse, {@code records().size() + diagnostics().size() + droppedLines()}
 * equals {@link #contentLines()}.
 */
public record ParseResult(
        List<InventoryRecord> records,
        List<ParseDiagnostic> diagnostics,
        int totalLines,
        int blankLines,
        int commentLines,
        int droppedLines
) {
    public ParseResult {
        records = records != null ? List.copyOf(records) : List.of();
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public static ParseResult empty() {
        return new ParseResult(List.of(), List.of(), 0, 0, 0, 0);
    }

    /**
     * Lines that were neither blank nor comments.
     */
    public int contentLines() {
        return totalLines - blankLines - commentLines;
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
