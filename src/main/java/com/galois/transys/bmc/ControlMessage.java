package com.galois.transys.bmc;

import com.galois.transys.proto.Protos;

/**
 * A message from the supervisor to a running engine.
 */
public abstract class ControlMessage {
    ControlMessage() {}

    public abstract Protos.Control getRep();

    /**
     * Decode a control message. Messages with a code this version does not
     * know become {@link UnrecognizedControlMessage}s.
     */
    public static ControlMessage fromRep(Protos.Control msg) {
        if (!msg.hasCode()) {
            return new UnrecognizedControlMessage(msg);
        }
        switch (msg.getCode()) {
        case ForgetControl:
            return new ForgetMessage(BmcEvent.syms(msg.getPropertyList()));
        case InvariantsControl:
            return new InvariantsMessage(msg.getInvariantList());
        default:
            return new UnrecognizedControlMessage(msg);
        }
    }
}
