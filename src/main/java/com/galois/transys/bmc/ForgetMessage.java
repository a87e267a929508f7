package com.galois.transys.bmc;

import java.util.List;

import com.google.common.collect.ImmutableList;

import com.galois.transys.proto.Protos;
import com.galois.transys.term.Sym;

/** Stop checking the given properties. */
public final class ForgetMessage extends ControlMessage {
    private final ImmutableList<Sym> properties;

    public ForgetMessage(List<Sym> properties) {
        this.properties = ImmutableList.copyOf(properties);
    }

    public List<Sym> getProperties() {
        return properties;
    }

    public Protos.Control getRep() {
        return Protos.Control.newBuilder()
            .setCode(Protos.ControlCode.ForgetControl)
            .addAllProperty(BmcEvent.names(properties))
            .build();
    }

    public String toString() {
        return "forget " + properties;
    }
}
