package fr.lapetina.airouter.infrastructure.events;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates the ring buffer's RoutingEvent instances.
 */
public final class RoutingEventFactory implements EventFactory<RoutingEvent> {

    @Override
    public RoutingEvent newInstance() {
        return new RoutingEvent();
    }
}
