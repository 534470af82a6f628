package fr.lapetina.provisioner.domain.event;

import fr.lapetina.provisioner.domain.model.ErrorType;
import fr.lapetina.provisioner.domain.model.InventoryRecord;
import fr.lapetina.provisioner.domain.model.ParseDiagnostic;
import fr.lapetina.provisioner.domain.model.ParseResult;
import fr.lapetina.provisioner.domain.model.ProvisionOutcome;
import fr.lapetina.provisioner.domain.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Fans every event out to a fixed list of listeners.
 * A listener that throws is logged and skipped; the others still see the event.
 */
public final class CompositeProvisioningListener implements ProvisioningListener {

    private static final Logger log = LoggerFactory.getLogger(CompositeProvisioningListener.class);

    private final List<ProvisioningListener> listeners;

    public CompositeProvisioningListener(List<ProvisioningListener> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    public static ProvisioningListener of(ProvisioningListener... listeners) {
        if (listeners.length == 1) {
            return listeners[0];
        }
        return new CompositeProvisioningListener(List.of(listeners));
    }

    @Override
    public void onDiagnostic(ParseDiagnostic diagnostic) {
        forEach("onDiagnostic", l -> l.onDiagnostic(diagnostic));
    }

    @Override
    public void onInventoryParsed(ParseResult result) {
        forEach("onInventoryParsed", l -> l.onInventoryParsed(result));
    }

    @Override
    public void onRunStarted(int records, int workers, boolean dryRun) {
        forEach("onRunStarted", l -> l.onRunStarted(records, workers, dryRun));
    }

    @Override
    public void onDryRun(InventoryRecord record, String endpoint) {
        forEach("onDryRun", l -> l.onDryRun(record, endpoint));
    }

    @Override
    public void onAttemptFailed(InventoryRecord record, int attempt, int maxAttempts,
                                ErrorType errorType, String reason) {
        forEach("onAttemptFailed", l -> l.onAttemptFailed(record, attempt, maxAttempts, errorType, reason));
    }

    @Override
    public void onOutcome(ProvisionOutcome outcome) {
        forEach("onOutcome", l -> l.onOutcome(outcome));
    }

    @Override
    public void onRunCompleted(RunSummary summary) {
        forEach("onRunCompleted", l -> l.onRunCompleted(summary));
    }

    private void forEach(String event, Consumer<ProvisioningListener> action) {
        for (ProvisioningListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (Exception e) {
                log.error("Error notifying provisioning listener: event={}, listener={}",
                        event, listener.getClass().getSimpleName(), e);
            }
        }
    }
}
