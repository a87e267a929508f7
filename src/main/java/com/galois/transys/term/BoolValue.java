package com.galois.transys.term;

import com.galois.transys.proto.Protos;

/** A Boolean constant. */
public final class BoolValue implements Cst {
    private final boolean bool;

    public static final BoolValue TRUE = new BoolValue(true);
    public static final BoolValue FALSE = new BoolValue(false);

    private BoolValue(boolean bool) {
        this.bool = bool;
    }

    /** Return the constant for {@code b}. */
    public static BoolValue of(boolean b) {
        return b ? TRUE : FALSE;
    }

    /**
     * Return the type associated with this value.
     * @return the type of the Boolean value.
     */
    public Type type() {
        return Type.BOOL;
    }

    /**
     * Return the protocol buffer representation of this value.
     *
     * @return the protocol buffer representation.
     */
    public Protos.Value getValueRep() {
        return
            Protos.Value.newBuilder()
            .setCode(bool ? Protos.ValueCode.TrueValue : Protos.ValueCode.FalseValue)
            .build();
    }

    public String toSmt() {
        return bool ? "true" : "false";
    }

    /**
     * Return Boolean value.
     *
     * @return the value
     */
    public boolean getValue() {
        return bool;
    }

    public String toString() {
        return toSmt();
    }

    public boolean equals(Object o) {
        if (!(o instanceof BoolValue)) return false;
        return bool == ((BoolValue) o).bool;
    }

    public int hashCode() {
        return bool ? 1231 : 1237;
    }
}
