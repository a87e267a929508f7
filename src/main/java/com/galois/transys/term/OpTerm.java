package com.galois.transys.term;

import com.google.common.collect.ImmutableList;

/** A built-in operator applied to arguments. */
public final class OpTerm extends Term {
    private final Operator op;
    private final ImmutableList<Term> args;

    OpTerm(int id, Operator op, ImmutableList<Term> args) {
        super(id);
        this.op = op;
        this.args = args;
    }

    public Kind kind() {
        return Kind.OP;
    }

    public ImmutableList<Term> children() {
        return args;
    }

    public Operator op() {
        return op;
    }

    public ImmutableList<Term> args() {
        return args;
    }

    boolean sameShape(Term o) {
        if (!(o instanceof OpTerm)) return false;
        OpTerm r = (OpTerm) o;
        return op == r.op && Terms.sameElements(args, r.args);
    }

    int shapeHash() {
        return op.hashCode() * 31 + Terms.identityHash(args);
    }
}
