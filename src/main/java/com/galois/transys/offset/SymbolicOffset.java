package com.galois.transys.offset;

/**
 * Records which offsets an instantiated formula refers to.
 *
 * A formula is either unanchored ({@link #NONE}), anchored at a single offset,
 * or spans two offsets {@code lo < hi}.
 */
public final class SymbolicOffset {
    public enum Kind { NONE, ONE, TWO }

    /** The offset of a formula mentioning no state variable. */
    public static final SymbolicOffset NONE = new SymbolicOffset(Kind.NONE, null, null);

    private final Kind kind;
    private final Offset lo;
    private final Offset hi;

    private SymbolicOffset(Kind kind, Offset lo, Offset hi) {
        this.kind = kind;
        this.lo = lo;
        this.hi = hi;
    }

    public static SymbolicOffset one(Offset o) {
        if (o == null) throw new NullPointerException("o");
        return new SymbolicOffset(Kind.ONE, o, o);
    }

    /**
     * Create an offset spanning two steps.
     * @throws IllegalArgumentException unless {@code lo < hi}
     */
    public static SymbolicOffset two(Offset lo, Offset hi) {
        if (lo == null) throw new NullPointerException("lo");
        if (hi == null) throw new NullPointerException("hi");
        if (lo.compareTo(hi) >= 0) {
            throw new IllegalArgumentException(
                "Two offsets must be increasing, got " + lo + " and " + hi);
        }
        return new SymbolicOffset(Kind.TWO, lo, hi);
    }

    public Kind kind() {
        return kind;
    }

    /** Lowest offset, or {@code null} when unanchored. */
    public Offset lo() {
        return lo;
    }

    /** Highest offset, or {@code null} when unanchored. */
    public Offset hi() {
        return hi;
    }

    /**
     * Merge the offsets of two sub-formulas.
     *
     * @throws OffsetMergeException if the offsets cannot appear in one formula
     */
    public SymbolicOffset merge(SymbolicOffset other) {
        if (this.equals(other)) return this;
        if (kind == Kind.NONE) return other;
        if (other.kind == Kind.NONE) return this;

        if (kind == Kind.ONE && other.kind == Kind.ONE) {
            if (lo.compareTo(other.lo) < 0) {
                return two(lo, other.lo);
            } else {
                return two(other.lo, lo);
            }
        }
        if (kind == Kind.TWO && other.kind == Kind.ONE) {
            if (other.lo.equals(lo) || other.lo.equals(hi)) return this;
        }
        if (kind == Kind.ONE && other.kind == Kind.TWO) {
            if (lo.equals(other.lo) || lo.equals(other.hi)) return other;
        }
        throw new OffsetMergeException(this, other);
    }

    /**
     * True if this offset is the step directly following {@code other}.
     * Only single offsets are related this way.
     */
    public boolean isNextOf(SymbolicOffset other) {
        if (kind != Kind.ONE || other.kind != Kind.ONE) return false;
        return lo.value() == other.lo.value() + 1;
    }

    public boolean equals(Object o) {
        if (!(o instanceof SymbolicOffset)) return false;
        SymbolicOffset r = (SymbolicOffset) o;
        if (kind != r.kind) return false;
        if (kind == Kind.NONE) return true;
        return lo.equals(r.lo) && hi.equals(r.hi);
    }

    public int hashCode() {
        if (kind == Kind.NONE) return 0;
        return 31 * lo.hashCode() + hi.hashCode() + kind.ordinal();
    }

    public String toString() {
        switch (kind) {
        case NONE:
            return "none";
        case ONE:
            return "one(" + lo + ")";
        case TWO:
            return "two(" + lo + "," + hi + ")";
        default:
            throw new IllegalStateException("Unknown offset kind " + kind);
        }
    }
}
