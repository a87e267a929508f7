package com.galois.transys.term;

import java.math.BigInteger;
import com.google.protobuf.ByteString;
import com.galois.transys.proto.Protos;

/**
 * An integer constant.
 */
public final class IntegerValue implements Cst, Comparable<IntegerValue> {
    public static final IntegerValue ZERO = new IntegerValue(BigInteger.ZERO);

    private final BigInteger v;

    public IntegerValue(long i) {
        this.v = BigInteger.valueOf(i);
    }

    public IntegerValue(BigInteger i) {
        if (i == null) throw new NullPointerException("i");
        this.v = i;
    }

    public Type type() {
        return Type.INT;
    }

    public BigInteger getValue() {
        return v;
    }

    public IntegerValue add(IntegerValue o) {
        return new IntegerValue(v.add(o.v));
    }

    public IntegerValue sub(IntegerValue o) {
        return new IntegerValue(v.subtract(o.v));
    }

    public IntegerValue mul(IntegerValue o) {
        return new IntegerValue(v.multiply(o.v));
    }

    public IntegerValue negate() {
        return new IntegerValue(v.negate());
    }

    /**
     * Integer division as SMT-LIB {@code div}: the remainder is always
     * non-negative.
     *
     * @throws ArithmeticException if {@code o} is zero.
     */
    public IntegerValue div(IntegerValue o) {
        BigInteger[] qr = v.divideAndRemainder(o.v);
        BigInteger q = qr[0];
        if (qr[1].signum() < 0) {
            q = o.v.signum() > 0 ? q.subtract(BigInteger.ONE) : q.add(BigInteger.ONE);
        }
        return new IntegerValue(q);
    }

    public int compareTo(IntegerValue o) {
        return v.compareTo(o.v);
    }

    private ByteString getDataRep() {
        return ByteString.copyFrom(v.toByteArray());
    }

    public Protos.Value getValueRep() {
        return
            Protos.Value.newBuilder()
            .setCode(Protos.ValueCode.IntegerValue)
            .setData(getDataRep())
            .build();
    }

    public String toSmt() {
        if (v.signum() < 0) {
            return "(- " + v.negate() + ")";
        }
        return v.toString();
    }

    public boolean equals(Object o) {
        if (!(o instanceof IntegerValue)) return false;
        return v.equals(((IntegerValue) o).v);
    }

    /**
     * Returns hash code of integer.
     */
    public int hashCode() {
        return v.hashCode();
    }

    /**
     * Returns decimal representation of integer.
     */
    public String toString() {
        return v.toString();
    }
}
