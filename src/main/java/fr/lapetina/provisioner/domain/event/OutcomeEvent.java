package fr.lapetina.provisioner.domain.event;

import fr.lapetina.provisioner.domain.model.ProvisionOutcome;

/**
 * Mutable ring buffer slot carrying one outcome from a worker thread to the aggregator.
 *
 * <p>Pre-allocated by the Disruptor and reused: a producer sets the outcome, the single
 * consumer reads it and clears the slot.
 */
public final class OutcomeEvent {

    private ProvisionOutcome outcome;
    private boolean synthetic;

    public void set(ProvisionOutcome outcome, boolean synthetic) {
        this.outcome = outcome;
        this.synthetic = synthetic;
    }

    public ProvisionOutcome getOutcome() {
        return outcome;
    }

    /**
     * True when the outcome was made up by the dispatcher because the worker
     * invocation failed to produce one.
     */
    public boolean isSynthetic() {
        return synthetic;
    }

    public void clear() {
        outcome = null;
        synthetic = false;
    }

    @Override
    public String toString() {
        return "OutcomeEvent{outcome=" + outcome + ", synthetic=" + synthetic + '}';
    }
}
