package fr.lapetina.provisioner.dispatch;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.provisioner.domain.event.OutcomeEvent;
import fr.lapetina.provisioner.domain.event.ProvisioningListener;
import fr.lapetina.provisioner.domain.model.ProvisionOutcome;
import fr.lapetina.provisioner.domain.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Sole consumer of the outcome ring buffer: the dispatcher's collection point.
 *
 * Responsibilities:
 * - Folds each outcome into the run's accumulator (only writer, so no locking)
 * - Reports the outcome to the listener
 * - Counts down the run's completion latch, one count per outcome
 * - Clears the slot for reuse
 */
final class OutcomeAggregationHandler implements EventHandler<OutcomeEvent> {

    private static final Logger log = LoggerFactory.getLogger(OutcomeAggregationHandler.class);

    private final RunSummary.Accumulator accumulator;
    private final CountDownLatch remaining;
    private final ProvisioningListener listener;

    OutcomeAggregationHandler(
            RunSummary.Accumulator accumulator,
            CountDownLatch remaining,
            ProvisioningListener listener
    ) {
        this.accumulator = accumulator;
        this.remaining = remaining;
        this.listener = listener;
    }

    @Override
    public void onEvent(OutcomeEvent event, long sequence, boolean endOfBatch) {
        try {
            ProvisionOutcome outcome = event.getOutcome();
            if (outcome == null) {
                log.error("Outcome slot published without an outcome: sequence={}", sequence);
                return;
            }

            accumulator.add(outcome);

            if (event.isSynthetic()) {
                log.debug("Recorded synthetic outcome: hostname={}, error={}",
                        outcome.hostname(), outcome.errorMessage());
            }

            try {
                listener.onOutcome(outcome);
            } catch (Exception e) {
                log.error("Error notifying listener of outcome: hostname={}", outcome.hostname(), e);
            }
        } finally {
            event.clear();
            remaining.countDown();
        }
    }
}
