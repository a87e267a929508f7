package com.galois.transys.bmc;

import java.util.List;

import com.google.common.collect.ImmutableList;

import com.galois.transys.proto.Protos;

/**
 * Invariants discovered by another technique. Bounded model checking does not
 * use them.
 */
public final class InvariantsMessage extends ControlMessage {
    private final ImmutableList<String> invariants;

    public InvariantsMessage(List<String> invariants) {
        this.invariants = ImmutableList.copyOf(invariants);
    }

    public List<String> getInvariants() {
        return invariants;
    }

    public Protos.Control getRep() {
        return Protos.Control.newBuilder()
            .setCode(Protos.ControlCode.InvariantsControl)
            .addAllInvariant(invariants)
            .build();
    }

    public String toString() {
        return invariants.size() + " invariants";
    }
}
