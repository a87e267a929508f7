package com.galois.transys.bmc;

import java.io.IOException;
import java.io.InputStream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.galois.transys.proto.Protos;

/**
 * A dedicated thread reading length-delimited control messages from a stream
 * and queueing them on a channel. The channel is closed when the stream ends.
 */
public final class ControlListener extends Thread {
    private static final Logger log = LogManager.getFormatterLogger();

    private final InputStream in;
    private final EventChannel channel;

    public ControlListener(InputStream in, EventChannel channel) {
        super("control-listener");
        if (in == null) throw new NullPointerException("in");
        if (channel == null) throw new NullPointerException("channel");
        this.in = in;
        this.channel = channel;
        setDaemon(true);
    }

    public void run() {
        try {
            while (true) {
                Protos.Control msg = Protos.Control.parseDelimitedFrom(in);
                // null indicates the input stream was closed
                if (msg == null) break;
                ControlMessage m = ControlMessage.fromRep(msg);
                log.debug("received %s", m);
                channel.send(m);
            }
        } catch (IOException e) {
            log.error("reading control messages: %s", e.getMessage());
        }
        log.debug("control stream closed");
        channel.close();
    }
}
