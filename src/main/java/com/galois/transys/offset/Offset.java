package com.galois.transys.offset;

/**
 * A discrete unrolling depth.
 *
 * Offsets are bounded to the range of an unsigned 16-bit counter.
 */
public final class Offset implements Comparable<Offset> {
    /** Largest representable offset. */
    public static final int MAX = 0xffff;

    private static final Offset[] SMALL = new Offset[64];
    static {
        for (int i = 0; i != SMALL.length; ++i) {
            SMALL[i] = new Offset(i);
        }
    }

    private final int value;

    private Offset(int value) {
        this.value = value;
    }

    /**
     * Return the offset with the given depth.
     * @param value the depth, between 0 and {@link #MAX}
     * @return the offset
     */
    public static Offset of(int value) {
        if (value < 0 || value > MAX) {
            throw new IllegalArgumentException("Offset out of range: " + value);
        }
        if (value < SMALL.length) return SMALL[value];
        return new Offset(value);
    }

    public int value() {
        return value;
    }

    /**
     * Return the following offset.
     * @throws IllegalStateException if the counter would overflow
     */
    public Offset next() {
        if (value == MAX) {
            throw new IllegalStateException("Offset overflow past " + MAX);
        }
        return of(value + 1);
    }

    public int compareTo(Offset o) {
        return Integer.compare(value, o.value);
    }

    public boolean equals(Object o) {
        if (!(o instanceof Offset)) return false;
        return value == ((Offset) o).value;
    }

    public int hashCode() {
        return value;
    }

    public String toString() {
        return Integer.toString(value);
    }
}
