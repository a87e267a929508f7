package com.galois.transys.bmc;

import java.util.List;

import com.google.common.collect.ImmutableList;

import com.galois.transys.offset.Offset;
import com.galois.transys.proto.Protos;
import com.galois.transys.term.Model;
import com.galois.transys.term.Sym;

/**
 * Some properties are false at the given depth; the model is a
 * counterexample trace.
 */
public final class DisprovedEvent extends BmcEvent {
    private final Model model;
    private final ImmutableList<Sym> properties;
    private final Offset depth;

    public DisprovedEvent(Model model, List<Sym> properties, Offset depth) {
        if (model == null) throw new NullPointerException("model");
        if (depth == null) throw new NullPointerException("depth");
        this.model = model;
        this.properties = ImmutableList.copyOf(properties);
        this.depth = depth;
    }

    public Model getModel() {
        return model;
    }

    public List<Sym> getProperties() {
        return properties;
    }

    public Offset getDepth() {
        return depth;
    }

    public Protos.Event getRep() {
        Protos.Event.Builder b = Protos.Event.newBuilder()
            .setCode(Protos.EventCode.DisprovedAtEvent)
            .setDepth(depth.value())
            .addAllProperty(names(properties));
        for (Model.Entry e : model) {
            b.addModel(e.getRep());
        }
        return b.build();
    }

    public String toString() {
        return "disproved at " + depth + ": " + properties + " " + model;
    }
}
