package com.galois.transys.bmc;

import com.galois.transys.proto.Protos;

/** A control message the engine does not understand. It is logged and ignored. */
public final class UnrecognizedControlMessage extends ControlMessage {
    private final Protos.Control rep;

    public UnrecognizedControlMessage(Protos.Control rep) {
        this.rep = rep;
    }

    public Protos.Control getRep() {
        return rep;
    }

    public String toString() {
        return "unrecognized control message " + rep.toString().trim();
    }
}
