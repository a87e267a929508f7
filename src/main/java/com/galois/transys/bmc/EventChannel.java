package com.galois.transys.bmc;

import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;

/**
 * The link between an engine and its supervisor.
 *
 * Events flow out to the registered consumers; control messages flow in
 * through a queue the engine drains between steps without blocking.
 */
public final class EventChannel {
    private final List<EventConsumer> consumers = new LinkedList<EventConsumer>();

    private final BlockingDeque<ControlMessage> inbound =
        new LinkedBlockingDeque<ControlMessage>();

    private volatile boolean closed = false;

    public void addEventConsumer(EventConsumer c) {
        synchronized (consumers) {
            consumers.add(c);
        }
    }

    public void removeEventConsumer(EventConsumer c) {
        synchronized (consumers) {
            consumers.remove(c);
        }
    }

    /** Deliver an event to every consumer. */
    public void emit(BmcEvent event) {
        synchronized (consumers) {
            for (EventConsumer c : consumers) {
                c.acceptEvent(event);
            }
        }
    }

    /**
     * Queue a control message for the engine.
     * @throws IllegalStateException if the channel is closed
     */
    public void send(ControlMessage msg) {
        if (closed) throw new IllegalStateException("control channel closed");
        inbound.offerLast(msg);
    }

    /** Return the next pending control message, or {@code null} if none is pending. */
    public ControlMessage recv() {
        return inbound.pollFirst();
    }

    /** Signal that the supervisor went away. Pending messages can still be received. */
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }
}
