package com.galois.transys.bmc;

import com.galois.transys.proto.Protos;

/** The run stopped with the given status. */
public final class DoneEvent extends BmcEvent {
    private final BmcStatus status;

    public DoneEvent(BmcStatus status) {
        if (status == null) throw new NullPointerException("status");
        this.status = status;
    }

    public BmcStatus getStatus() {
        return status;
    }

    public Protos.Event getRep() {
        return Protos.Event.newBuilder()
            .setCode(Protos.EventCode.DoneEvent)
            .setStatus(status.getRep())
            .build();
    }

    public String toString() {
        return "done: " + status;
    }
}
