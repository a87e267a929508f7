package com.galois.transys.term;

import com.google.common.collect.ImmutableList;

/**
 * A node in a hash-consed expression graph.
 *
 * Terms are created only by a {@link TermStore}, which guarantees that two
 * terms with the same shape are the same object. Equality is therefore
 * identity and the hash code is the identifier the store assigned.
 */
public abstract class Term {
    /** The closed set of term shapes. */
    public enum Kind { VAR, CST, OP, APP, FORALL, EXISTS, LET }

    private final int id;

    Term(int id) {
        this.id = id;
    }

    /** Identifier unique within the owning store. */
    public final int id() {
        return id;
    }

    public abstract Kind kind();

    /**
     * Return the direct subterms in traversal order.
     */
    public abstract ImmutableList<Term> children();

    /**
     * Structural comparison of this node with another candidate, comparing
     * children by identity.
     */
    abstract boolean sameShape(Term o);

    /** Hash of the shape of this node, hashing children by identity. */
    abstract int shapeHash();

    public final boolean equals(Object o) {
        return this == o;
    }

    public final int hashCode() {
        return id;
    }

    /** Print the term in SMT-LIB 2 syntax with unanchored state variables. */
    public String toString() {
        return SmtWriter.unanchored().write(this);
    }
}
