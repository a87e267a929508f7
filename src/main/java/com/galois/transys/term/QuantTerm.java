package com.galois.transys.term;

import com.google.common.collect.ImmutableList;

/** A universal or existential quantifier. */
public final class QuantTerm extends Term {
    private final boolean universal;
    private final ImmutableList<TypedSym> bound;
    private final Term body;

    QuantTerm(int id, boolean universal, ImmutableList<TypedSym> bound, Term body) {
        super(id);
        this.universal = universal;
        this.bound = bound;
        this.body = body;
    }

    public Kind kind() {
        return universal ? Kind.FORALL : Kind.EXISTS;
    }

    public ImmutableList<Term> children() {
        return ImmutableList.of(body);
    }

    public boolean isUniversal() {
        return universal;
    }

    public ImmutableList<TypedSym> bound() {
        return bound;
    }

    public Term body() {
        return body;
    }

    boolean sameShape(Term o) {
        if (!(o instanceof QuantTerm)) return false;
        QuantTerm r = (QuantTerm) o;
        return universal == r.universal && body == r.body && bound.equals(r.bound);
    }

    int shapeHash() {
        return (bound.hashCode() * 31 + body.hashCode()) * 2 + (universal ? 1 : 0);
    }
}
