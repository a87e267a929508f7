package com.galois.transys.term;

import java.math.BigInteger;
import com.galois.transys.proto.Protos;

/**
 * A fully reduced constant value.
 *
 * Constants are immutable and compare by value.
 */
public interface Cst extends Typed {
    /**
     * Return the protocol buffer representation of this value.
     */
    Protos.Value getValueRep();

    /**
     * Return the SMT-LIB 2 literal for this value.
     */
    String toSmt();

    /**
     * Decode a constant from its protocol buffer representation.
     *
     * @throws IllegalArgumentException if the value is malformed.
     */
    static Cst fromValueRep(Protos.Value v) {
        if (!v.hasCode()) {
            throw new IllegalArgumentException("Value has no recognized code.");
        }
        switch (v.getCode()) {
        case TrueValue:
            return BoolValue.TRUE;
        case FalseValue:
            return BoolValue.FALSE;
        case IntegerValue:
            return new IntegerValue(new BigInteger(v.getData().toByteArray()));
        case RationalValue:
            return new RationalValue(v.getData().toByteArray());
        default:
            throw new IllegalArgumentException("Unknown value code " + v.getCode());
        }
    }
}
