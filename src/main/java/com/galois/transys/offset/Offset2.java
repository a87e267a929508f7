package com.galois.transys.offset;

/**
 * A pair of consecutive offsets: the current step and the one after it.
 */
public final class Offset2 {
    private final Offset curr;
    private final Offset next;

    private Offset2(Offset curr) {
        this.curr = curr;
        this.next = curr.next();
    }

    /** The initial pair {@code (0,1)}. */
    public static Offset2 init() {
        return new Offset2(Offset.of(0));
    }

    /** The pair whose current offset is {@code curr}. */
    public static Offset2 at(Offset curr) {
        return new Offset2(curr);
    }

    /** Advance by one step: {@code (n,n+1)} becomes {@code (n+1,n+2)}. */
    public Offset2 next() {
        return new Offset2(next);
    }

    public Offset curr() {
        return curr;
    }

    public Offset nextOffset() {
        return next;
    }

    public boolean equals(Object o) {
        if (!(o instanceof Offset2)) return false;
        return curr.equals(((Offset2) o).curr);
    }

    public int hashCode() {
        return curr.hashCode();
    }

    public String toString() {
        return "(" + curr + "," + next + ")";
    }
}
