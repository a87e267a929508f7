package com.galois.transys.bmc;

import com.galois.transys.proto.Protos;

/** Free-form information for the supervisor. */
public final class LogEvent extends BmcEvent {
    private final String message;

    public LogEvent(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    public Protos.Event getRep() {
        return Protos.Event.newBuilder()
            .setCode(Protos.EventCode.LogEvent)
            .setMessage(message)
            .build();
    }

    public String toString() {
        return "log: " + message;
    }
}
