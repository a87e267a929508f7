package com.galois.transys.bmc;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;

/**
 * Writes events to a stream as length-delimited protocol buffer messages.
 */
public final class ProtoEventWriter implements EventConsumer {
    private final OutputStream out;

    public ProtoEventWriter(OutputStream out) {
        if (out == null) throw new NullPointerException("out");
        this.out = out;
    }

    /**
     * @throws UncheckedIOException if the stream cannot be written
     */
    public void acceptEvent(BmcEvent event) {
        synchronized (out) {
            try {
                event.getRep().writeDelimitedTo(out);
                out.flush();
            } catch (IOException e) {
                throw new UncheckedIOException("writing event " + event, e);
            }
        }
    }
}
