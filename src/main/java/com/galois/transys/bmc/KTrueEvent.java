package com.galois.transys.bmc;

import java.util.List;

import com.google.common.collect.ImmutableList;

import com.galois.transys.offset.Offset;
import com.galois.transys.proto.Protos;
import com.galois.transys.term.Sym;

/** The given properties hold on every trace up to the given depth. */
public final class KTrueEvent extends BmcEvent {
    private final ImmutableList<Sym> properties;
    private final Offset depth;

    public KTrueEvent(List<Sym> properties, Offset depth) {
        if (depth == null) throw new NullPointerException("depth");
        this.properties = ImmutableList.copyOf(properties);
        this.depth = depth;
    }

    public List<Sym> getProperties() {
        return properties;
    }

    public Offset getDepth() {
        return depth;
    }

    public Protos.Event getRep() {
        return Protos.Event.newBuilder()
            .setCode(Protos.EventCode.KTrueEvent)
            .setDepth(depth.value())
            .addAllProperty(names(properties))
            .build();
    }

    public String toString() {
        return depth + "-true: " + properties;
    }
}
