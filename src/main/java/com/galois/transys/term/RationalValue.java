package com.galois.transys.term;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import com.google.protobuf.ByteString;
import com.galois.transys.proto.Protos;

/** A rational constant, kept in reduced form. */
public final class RationalValue implements Cst, Comparable<RationalValue> {
    public static final RationalValue ZERO = new RationalValue(BigInteger.ZERO);

    private final BigInteger numerator;
    private final BigInteger denominator;

    /**
     * Create a value from an integer.
     * @param n the numerator
     */
    public RationalValue(BigInteger n) {
        if (n == null) throw new NullPointerException("n");
        this.numerator = n;
        this.denominator = BigInteger.ONE;
    }

    /**
     * Create a value from a rational.
     * @param n the numerator
     * @param d the denominator
     */
    public RationalValue(BigInteger n, BigInteger d) {
        if (n == null) throw new NullPointerException("n");
        if (d == null) throw new NullPointerException("d");
        if (d.signum() == 0)
            throw new IllegalArgumentException("d must be non-zero.");
        // Keep the sign on the numerator.
        if (d.signum() == -1) {
            n = n.negate();
            d = d.negate();
        }

        BigInteger g = n.gcd(d);
        if (g.signum() == 0) g = BigInteger.ONE;
        this.numerator = n.divide(g);
        this.denominator = d.divide(g);
    }

    public RationalValue(long n, long d) {
        this(BigInteger.valueOf(n), BigInteger.valueOf(d));
    }

    /**
     * Decode the wire representation: an unsigned varint denominator followed
     * by the numerator bytes.
     */
    public RationalValue(byte[] bytes) {
        ByteArrayInputStream s = new ByteArrayInputStream(bytes);

        BigInteger d = readUVarint(s);

        byte[] remaining = new byte[s.available()];
        s.read(remaining, 0, remaining.length);
        if (remaining.length == 0) {
            throw new IllegalArgumentException("Rational value has no numerator.");
        }
        BigInteger n = new BigInteger(remaining);

        if (d.signum() == 0) {
            throw new IllegalArgumentException("Rational value has zero denominator.");
        }
        BigInteger g = n.gcd(d);
        if (!g.equals(BigInteger.ONE) && n.signum() != 0) {
            throw new IllegalArgumentException(
              "Rational value expected in reduced form.");
        }
        this.numerator = n;
        this.denominator = n.signum() == 0 ? BigInteger.ONE : d;
    }

    public Type type() {
        return Type.RAT;
    }

    /** Return numerator of rational. */
    public BigInteger numerator() {
        return numerator;
    }

    /** Return denominator of rational. */
    public BigInteger denominator() {
        return denominator;
    }

    public RationalValue add(RationalValue o) {
        return new RationalValue(
            numerator.multiply(o.denominator).add(o.numerator.multiply(denominator)),
            denominator.multiply(o.denominator));
    }

    public RationalValue sub(RationalValue o) {
        return add(o.negate());
    }

    public RationalValue mul(RationalValue o) {
        return new RationalValue(
            numerator.multiply(o.numerator),
            denominator.multiply(o.denominator));
    }

    /**
     * Divide by {@code o}.
     * @throws ArithmeticException if {@code o} is zero.
     */
    public RationalValue div(RationalValue o) {
        if (o.numerator.signum() == 0) {
            throw new ArithmeticException("Division by zero.");
        }
        return new RationalValue(
            numerator.multiply(o.denominator),
            denominator.multiply(o.numerator));
    }

    public RationalValue negate() {
        return new RationalValue(numerator.negate(), denominator);
    }

    public int compareTo(RationalValue o) {
        return numerator.multiply(o.denominator)
            .compareTo(o.numerator.multiply(denominator));
    }

    private static BigInteger readUVarint(ByteArrayInputStream s) {
        BigInteger r = BigInteger.ZERO;
        int shift = 0;

        while (true) {
            int next = s.read();
            if (next == -1) {
                throw new IllegalArgumentException("Truncated varint.");
            }
            r = r.or(BigInteger.valueOf(next & 0x7f).shiftLeft(shift));
            shift += 7;
            if ((next & 0x80) == 0) break;
        }

        return r;
    }

    private static void writeUVarint(ByteArrayOutputStream s, BigInteger r) {
        if (r.signum() == -1) {
            throw new IllegalArgumentException("writeUVarint given negative number.");
        }
        if (r.signum() == 0) {
            s.write(0);
            return;
        }
        // Most significant group is written last.
        BigInteger mask = BigInteger.valueOf(0x7f);
        while (true) {
            int val = r.and(mask).intValue();
            r = r.shiftRight(7);
            if (r.signum() == 0) {
                s.write(val);
                return;
            }
            s.write(val | 0x80);
        }
    }

    private ByteString getDataRep() {
        ByteArrayOutputStream s = new ByteArrayOutputStream();
        writeUVarint(s, denominator);
        byte[] bytes = numerator.toByteArray();
        s.write(bytes, 0, bytes.length);
        return ByteString.copyFrom(s.toByteArray());
    }

    public Protos.Value getValueRep() {
        return Protos.Value.newBuilder()
            .setCode(Protos.ValueCode.RationalValue)
            .setData(getDataRep())
            .build();
    }

    /** Print as {@code n.0} or {@code (/ n.0 d.0)}, negating as needed. */
    public String toSmt() {
        String num = numerator.abs() + ".0";
        String r = denominator.equals(BigInteger.ONE)
            ? num
            : "(/ " + num + " " + denominator + ".0)";
        return numerator.signum() < 0 ? "(- " + r + ")" : r;
    }

    /** Check if two rationals are equal. */
    public boolean equals(Object o) {
        if (!(o instanceof RationalValue)) return false;
        RationalValue r = (RationalValue) o;
        // Rationals are stored in reduced form, so equality is quick.
        return numerator.equals(r.numerator)
            && denominator.equals(r.denominator);
    }

    public int hashCode() {
        return numerator.hashCode() ^ denominator.hashCode();
    }

    /** Print rational as a numerator over divisor. */
    public String toString() {
        if (denominator.equals(BigInteger.ONE)) {
            return numerator.toString();
        } else {
            return numerator.toString() + "/" + denominator.toString();
        }
    }
}
