package com.galois.transys.sys;

import java.util.Map;

import com.google.common.collect.ImmutableMap;

import com.galois.transys.term.FunSig;
import com.galois.transys.term.Sym;
import com.galois.transys.term.Term;
import com.galois.transys.term.TermException;
import com.galois.transys.term.TypeChecker;

/**
 * A named Boolean predicate over the current state of a system.
 */
public final class Property {
    private final Sym id;
    private final Term body;

    /**
     * @throws TermException if {@code body} is not Boolean or mentions the
     *   next state
     */
    public Property(Sym id, Term body, Map<Sym, FunSig> functions) throws TermException {
        if (id == null) throw new NullPointerException("id");
        if (body == null) throw new NullPointerException("body");
        this.id = id;
        this.body = body;
        String what = "property " + id;
        TransitionSystem.checkBool(new TypeChecker(functions), body, what);
        TransitionSystem.checkOneState(body, what);
    }

    public Property(Sym id, Term body) throws TermException {
        this(id, body, ImmutableMap.<Sym, FunSig>of());
    }

    public Sym id() {
        return id;
    }

    public Term body() {
        return body;
    }

    public String toString() {
        return id + ": " + body;
    }
}
