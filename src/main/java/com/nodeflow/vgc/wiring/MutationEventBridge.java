package com.nodeflow.vgc.wiring;

import java.util.Objects;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.nodeflow.vgc.engine.VisualGraph;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Moves graph mutation events off the editing thread through an LMAX
 * Disruptor, for consumers such as an audit ledger.
 *
 * <p>
 * Lifecycle: construct, {@link #start()} (or {@link #attach}) once, then
 * {@link #stop()}. The consumer runs on a single daemon thread; an exception
 * thrown by the handler is logged and the event skipped so the thread stays
 * alive.
 */
public final class MutationEventBridge implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(MutationEventBridge.class);

    public static final int DEFAULT_BUFFER_SIZE = 1024;

    private final Disruptor<MutationEvent> disruptor;
    private RingBufferMutationListener publisher;

    public MutationEventBridge(MutationEventHandler handler) {
        this(DEFAULT_BUFFER_SIZE, handler);
    }

    /** @param bufferSize ring size, a power of two */
    public MutationEventBridge(int bufferSize, MutationEventHandler handler) {
        Objects.requireNonNull(handler, "handler");
        this.disruptor = new Disruptor<>(
                MutationEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.SINGLE,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(new Consumer(handler));
    }

    /** Starts the consumer thread and returns the listener that feeds it. */
    public synchronized RingBufferMutationListener start() {
        if (publisher != null)
            throw new IllegalStateException("Bridge already started");
        RingBuffer<MutationEvent> ringBuffer = disruptor.start();
        publisher = new RingBufferMutationListener(ringBuffer);
        log.info("Mutation event bridge started (buffer size {})", ringBuffer.getBufferSize());
        return publisher;
    }

    /** Starts the bridge and subscribes it to {@code graph}. */
    public RingBufferMutationListener attach(VisualGraph graph) {
        RingBufferMutationListener listener = start();
        graph.addListener(listener);
        return listener;
    }

    /** Waits for published events to be consumed, then stops the consumer. */
    public synchronized void stop() {
        if (publisher == null)
            return;
        disruptor.shutdown();
        log.info("Mutation event bridge stopped after {} events", publisher.publishedCount());
        publisher = null;
    }

    @Override
    public void close() {
        stop();
    }

    private static final class Consumer implements EventHandler<MutationEvent> {
        private final MutationEventHandler handler;

        Consumer(MutationEventHandler handler) {
            this.handler = handler;
        }

        @Override
        public void onEvent(MutationEvent event, long sequence, boolean endOfBatch) {
            try {
                handler.onMutation(event, endOfBatch);
            } catch (RuntimeException e) {
                log.error("Error handling mutation event {}: {}", event, e.getMessage(), e);
            }
        }
    }
}
