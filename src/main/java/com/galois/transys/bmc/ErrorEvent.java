package com.galois.transys.bmc;

import com.galois.transys.proto.Protos;

/** The run failed; always followed by a {@link DoneEvent} with status error. */
public final class ErrorEvent extends BmcEvent {
    private final String message;

    public ErrorEvent(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    public Protos.Event getRep() {
        return Protos.Event.newBuilder()
            .setCode(Protos.EventCode.ErrorEvent)
            .setMessage(message)
            .build();
    }

    public String toString() {
        return "error: " + message;
    }
}
