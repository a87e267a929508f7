package com.galois.transys.term;

import com.google.common.collect.ImmutableList;

/**
 * A parallel let: the bound values are evaluated in the enclosing scope and
 * are visible only in the body.
 */
public final class LetTerm extends Term {
    private final ImmutableList<LetBinding> bindings;
    private final Term body;
    private final ImmutableList<Term> children;

    LetTerm(int id, ImmutableList<LetBinding> bindings, Term body) {
        super(id);
        this.bindings = bindings;
        this.body = body;
        ImmutableList.Builder<Term> b = ImmutableList.builder();
        for (LetBinding binding : bindings) {
            b.add(binding.value());
        }
        this.children = b.add(body).build();
    }

    public Kind kind() {
        return Kind.LET;
    }

    /** The bound values in order, followed by the body. */
    public ImmutableList<Term> children() {
        return children;
    }

    public ImmutableList<LetBinding> bindings() {
        return bindings;
    }

    public Term body() {
        return body;
    }

    boolean sameShape(Term o) {
        if (!(o instanceof LetTerm)) return false;
        LetTerm r = (LetTerm) o;
        return body == r.body && bindings.equals(r.bindings);
    }

    int shapeHash() {
        return bindings.hashCode() * 31 + body.hashCode();
    }
}
