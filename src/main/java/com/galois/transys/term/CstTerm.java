package com.galois.transys.term;

import com.google.common.collect.ImmutableList;

/** A constant leaf. */
public final class CstTerm extends Term implements Typed {
    private final Cst value;

    CstTerm(int id, Cst value) {
        super(id);
        this.value = value;
    }

    public Kind kind() {
        return Kind.CST;
    }

    public ImmutableList<Term> children() {
        return ImmutableList.of();
    }

    public Cst value() {
        return value;
    }

    public Type type() {
        return value.type();
    }

    boolean sameShape(Term o) {
        if (!(o instanceof CstTerm)) return false;
        return value.equals(((CstTerm) o).value);
    }

    int shapeHash() {
        return value.hashCode();
    }
}
