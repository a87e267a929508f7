package com.galois.transys.term;

import com.google.common.collect.ImmutableList;

/**
 * A variable reference.
 *
 * State variables carry the copy ({@link State#CURR} or {@link State#NEXT})
 * they refer to; other variables have no state.
 */
public final class VarTerm extends Term implements Typed {
    private final Sym sym;
    private final Type type;
    private final State state;

    VarTerm(int id, Sym sym, Type type, State state) {
        super(id);
        this.sym = sym;
        this.type = type;
        this.state = state;
    }

    public Kind kind() {
        return Kind.VAR;
    }

    public ImmutableList<Term> children() {
        return ImmutableList.of();
    }

    public Sym sym() {
        return sym;
    }

    public Type type() {
        return type;
    }

    /** The state copy, or {@code null} for a variable that is not a state variable. */
    public State state() {
        return state;
    }

    public boolean isStateVar() {
        return state != null;
    }

    boolean sameShape(Term o) {
        if (!(o instanceof VarTerm)) return false;
        VarTerm r = (VarTerm) o;
        return sym == r.sym && type == r.type && state == r.state;
    }

    int shapeHash() {
        int h = sym.hashCode() * 31 + type.hashCode();
        return h * 31 + (state == null ? 0 : state.hashCode() + 1);
    }
}
