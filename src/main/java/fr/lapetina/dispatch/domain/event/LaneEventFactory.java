package fr.lapetina.dispatch.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates lane event slots for the multiplexer ring buffers.
 */
public final class LaneEventFactory implements EventFactory<LaneEvent> {

    @Override
    public LaneEvent newInstance() {
        return new LaneEvent();
    }
}
