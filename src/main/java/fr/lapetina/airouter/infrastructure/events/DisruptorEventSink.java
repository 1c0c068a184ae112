package fr.lapetina.airouter.infrastructure.events;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.airouter.domain.exception.RoutingException;
import fr.lapetina.airouter.domain.model.ErrorKind;
import fr.lapetina.airouter.domain.model.RoutingAttempt;
import fr.lapetina.airouter.domain.model.Usage;
import fr.lapetina.airouter.infrastructure.config.RouterConfig;
import fr.lapetina.airouter.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.airouter.routing.RoutingEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Routing event sink backed by an LMAX Disruptor ring buffer.
 *
 * Routing threads only claim a slot and publish; metrics and audit logging run on the
 * Disruptor's consumer threads, in parallel. Publishing never blocks: when the ring buffer is
 * full the event is dropped and counted.
 *
 * PRODUCER TYPE CHOICE: MULTI, since every routing thread and HTTP callback thread publishes.
 */
public final class DisruptorEventSink implements RoutingEventSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DisruptorEventSink.class);

    private final Disruptor<RoutingEvent> disruptor;
    private final RingBuffer<RoutingEvent> ringBuffer;
    private final MetricsRegistry metricsRegistry;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong droppedEvents = new AtomicLong();

    private DisruptorEventSink(Builder builder) {
        this.metricsRegistry = builder.metricsRegistry;

        this.disruptor = new Disruptor<>(
                new RoutingEventFactory(),
                builder.ringBufferSize,
                new DisruptorThreadFactory("routing-events"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        List<EventHandler<RoutingEvent>> handlers = new ArrayList<>(builder.extraHandlers);
        if (metricsRegistry != null) {
            handlers.add(new MetricsEventHandler(metricsRegistry));
        }
        handlers.add(new LoggingEventHandler());

        // Consumers are independent of each other, so they run in parallel
        @SuppressWarnings("unchecked")
        EventHandler<RoutingEvent>[] consumers = handlers.toArray(new EventHandler[0]);
        disruptor.handleEventsWith(consumers);
        disruptor.setDefaultExceptionHandler(new DisruptorExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("DisruptorEventSink created: ringBufferSize={}, waitStrategy={}, consumers={}",
                builder.ringBufferSize, builder.waitStrategy, handlers.size());
    }

    /**
     * Starts the consumer threads.
     */
    public DisruptorEventSink start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("DisruptorEventSink started");
        }
        return this;
    }

    @Override
    public void requestStarted(String requestId, String model, boolean streaming) {
        publish(event -> event.asRequestStarted(requestId, model, streaming));
    }

    @Override
    public void attemptFinished(String requestId, String model, RoutingAttempt attempt) {
        publish(event -> event.asAttemptFinished(requestId, model, attempt));
    }

    @Override
    public void failover(String requestId, String fromProvider, String toProvider, ErrorKind cause) {
        publish(event -> event.asFailover(requestId, fromProvider, toProvider, cause));
    }

    @Override
    public void requestSucceeded(String requestId, String providerId, String model, Usage usage,
                                 BigDecimal cost, int attempts, long elapsedMs) {
        publish(event -> event.asRequestSucceeded(requestId, providerId, model, usage, cost, attempts, elapsedMs));
    }

    @Override
    public void requestFailed(String requestId, String model, RoutingException error, long elapsedMs) {
        publish(event -> event.asRequestFailed(requestId, model, error, elapsedMs));
    }

    private void publish(Consumer<RoutingEvent> initializer) {
        if (!running.get()) {
            drop("sink not running");
            return;
        }

        // Try to claim a slot in the ring buffer
        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            drop("ring buffer full");
            return;
        }

        try {
            initializer.accept(ringBuffer.get(sequence));
        } finally {
            ringBuffer.publish(sequence);
        }

        if (metricsRegistry != null) {
            metricsRegistry.setRingBufferRemaining((int) ringBuffer.remainingCapacity());
        }
    }

    private void drop(String reason) {
        long dropped = droppedEvents.incrementAndGet();
        if (metricsRegistry != null) {
            metricsRegistry.incrementDroppedEvents();
        }
        // one line per power of two keeps a saturated buffer from flooding the log
        if (Long.bitCount(dropped) == 1) {
            log.warn("Routing event dropped: reason={}, droppedTotal={}", reason, dropped);
        }
    }

    public long getDroppedEvents() {
        return droppedEvents.get();
    }

    /**
     * Returns current ring buffer remaining capacity.
     */
    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    /**
     * Drains pending events and stops the consumers.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down DisruptorEventSink...");
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
                log.info("DisruptorEventSink shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("DisruptorEventSink shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for Disruptor consumer threads.
     */
    private static class DisruptorThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        DisruptorThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Exception handler for Disruptor. A failing consumer must not stop the others.
     */
    private static class DisruptorExceptionHandler
            implements com.lmax.disruptor.ExceptionHandler<RoutingEvent> {

        private static final Logger log = LoggerFactory.getLogger(DisruptorExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, RoutingEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    /**
     * Builder for DisruptorEventSink.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private MetricsRegistry metricsRegistry;
        private final List<EventHandler<RoutingEvent>> extraHandlers = new ArrayList<>();

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        /**
         * Optional; without it only audit logging runs.
         */
        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        /**
         * Adds a consumer running in parallel with the built-in ones.
         */
        public Builder handler(EventHandler<RoutingEvent> handler) {
            this.extraHandlers.add(handler);
            return this;
        }

        public Builder fromConfig(RouterConfig config) {
            ringBufferSize(config.getEvents().getRingBufferSize());
            this.waitStrategy = config.getEvents().getWaitStrategy();
            return this;
        }

        public DisruptorEventSink build() {
            return new DisruptorEventSink(this);
        }
    }
}
