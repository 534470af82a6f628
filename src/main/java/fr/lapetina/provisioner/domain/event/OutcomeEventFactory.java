package fr.lapetina.provisioner.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for creating OutcomeEvent instances in the Disruptor ring buffer.
 */
public final class OutcomeEventFactory implements EventFactory<OutcomeEvent> {

    @Override
    public OutcomeEvent newInstance() {
        return new OutcomeEvent();
    }
}
