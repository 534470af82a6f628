package fr.lapetina.provisioner.infrastructure.logging;

import fr.lapetina.provisioner.domain.event.ProvisioningListener;
import fr.lapetina.provisioner.domain.model.ErrorType;
import fr.lapetina.provisioner.domain.model.InventoryRecord;
import fr.lapetina.provisioner.domain.model.ParseDiagnostic;
import fr.lapetina.provisioner.domain.model.ParseResult;
import fr.lapetina.provisioner.domain.model.ProvisionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one structured log line per parse diagnostic, failed attempt and host outcome,
 * plus the parse summary. Run start and end are logged by the dispatcher.
 */
public final class LoggingProvisioningListener implements ProvisioningListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingProvisioningListener.class);

    @Override
    public void onDiagnostic(ParseDiagnostic diagnostic) {
        log.warn("Parse error: line={}, reason={}, raw=\"{}\", message={}",
                diagnostic.lineNumber(), diagnostic.reason(), diagnostic.rawLine(), diagnostic.message());
    }

    @Override
    public void onInventoryParsed(ParseResult result) {
        log.info("Parsed inventory: valid={}, parseErrors={}, lines={}, blank={}, comments={}, dropped={}",
                result.records().size(), result.diagnostics().size(), result.totalLines(),
                result.blankLines(), result.commentLines(), result.droppedLines());
    }

    @Override
    public void onDryRun(InventoryRecord record, String endpoint) {
        log.info("DRY-RUN: hostname={}, address={}, endpoint={}", record.hostname(), record.address(), endpoint);
    }

    @Override
    public void onAttemptFailed(InventoryRecord record, int attempt, int maxAttempts,
                                ErrorType errorType, String reason) {
        log.warn("Attempt failed: hostname={}, address={}, attempt={}/{}, errorType={}, error={}",
                record.hostname(), record.address(), attempt, maxAttempts, errorType, reason);
    }

    @Override
    public void onOutcome(ProvisionOutcome outcome) {
        if (outcome.isFailed()) {
            log.warn("Host outcome: hostname={}, address={}, status={}, attempts={}, errorType={}, error={}",
                    outcome.hostname(), outcome.address(), outcome.status(), outcome.attempts(),
                    outcome.errorType(), outcome.errorMessage());
        } else {
            log.info("Host outcome: hostname={}, address={}, status={}, attempts={}, durationMs={}",
                    outcome.hostname(), outcome.address(), outcome.status(), outcome.attempts(),
                    outcome.duration().toMillis());
        }
    }
}
