package com.galois.transys.term;

import com.google.common.collect.ImmutableList;

/** A function symbol applied to arguments. */
public final class AppTerm extends Term {
    private final Sym fun;
    private final ImmutableList<Term> args;

    AppTerm(int id, Sym fun, ImmutableList<Term> args) {
        super(id);
        this.fun = fun;
        this.args = args;
    }

    public Kind kind() {
        return Kind.APP;
    }

    public ImmutableList<Term> children() {
        return args;
    }

    public Sym fun() {
        return fun;
    }

    public ImmutableList<Term> args() {
        return args;
    }

    boolean sameShape(Term o) {
        if (!(o instanceof AppTerm)) return false;
        AppTerm r = (AppTerm) o;
        return fun == r.fun && Terms.sameElements(args, r.args);
    }

    int shapeHash() {
        return fun.hashCode() * 31 + Terms.identityHash(args);
    }
}
