package com.galois.transys.term;

/**
 * Types of terms.
 */
public enum Type {
    /** Booleans. */
    BOOL("Bool"),
    /** Mathematical integers. */
    INT("Int"),
    /** Rationals, printed as the SMT-LIB real sort. */
    RAT("Real");

    private final String smtName;

    Type(String smtName) {
        this.smtName = smtName;
    }

    /** Return the SMT-LIB sort name of this type. */
    public String smtName() {
        return smtName;
    }

    /** Return true for {@link #INT} and {@link #RAT}. */
    public boolean isArith() {
        return this == INT || this == RAT;
    }

    /**
     * Return the value a free variable of this type takes when a valuation
     * does not mention it.
     */
    public Cst defaultValue() {
        switch (this) {
        case BOOL:
            return BoolValue.FALSE;
        case INT:
            return IntegerValue.ZERO;
        case RAT:
            return RationalValue.ZERO;
        default:
            throw new IllegalStateException("Unknown type " + this);
        }
    }
}
