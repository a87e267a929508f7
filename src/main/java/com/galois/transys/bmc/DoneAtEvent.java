package com.galois.transys.bmc;

import com.galois.transys.offset.Offset;
import com.galois.transys.proto.Protos;

/** The run stopped after checking the given depth. */
public final class DoneAtEvent extends BmcEvent {
    private final Offset depth;

    public DoneAtEvent(Offset depth) {
        if (depth == null) throw new NullPointerException("depth");
        this.depth = depth;
    }

    public Offset getDepth() {
        return depth;
    }

    public Protos.Event getRep() {
        return Protos.Event.newBuilder()
            .setCode(Protos.EventCode.DoneAtEvent)
            .setDepth(depth.value())
            .build();
    }

    public String toString() {
        return "done at " + depth;
    }
}
