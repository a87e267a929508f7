package com.galois.transys.bmc;

import com.galois.transys.proto.Protos;

/** Final outcome of a run. */
public enum BmcStatus {
    /** Every property held up to the depth reached. This is not a proof. */
    SAFE(Protos.Status.Safe),
    /** At least one property was disproved. */
    UNSAFE(Protos.Status.Unsafe),
    /** The run failed. */
    ERROR(Protos.Status.Error);

    private final Protos.Status rep;

    BmcStatus(Protos.Status rep) {
        this.rep = rep;
    }

    public Protos.Status getRep() {
        return rep;
    }

    public static BmcStatus fromRep(Protos.Status s) {
        for (BmcStatus v : values()) {
            if (v.rep == s) return v;
        }
        throw new IllegalArgumentException("Unknown status " + s);
    }
}
