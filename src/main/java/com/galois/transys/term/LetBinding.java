package com.galois.transys.term;

/** One {@code (symbol value)} pair of a let. */
public final class LetBinding {
    private final Sym sym;
    private final Term value;

    public LetBinding(Sym sym, Term value) {
        if (sym == null) throw new NullPointerException("sym");
        if (value == null) throw new NullPointerException("value");
        this.sym = sym;
        this.value = value;
    }

    public Sym sym() {
        return sym;
    }

    public Term value() {
        return value;
    }

    /** Bindings are equal when they bind the same symbol to the same term. */
    public boolean equals(Object o) {
        if (!(o instanceof LetBinding)) return false;
        LetBinding r = (LetBinding) o;
        return sym == r.sym && value == r.value;
    }

    public int hashCode() {
        return 31 * sym.hashCode() + value.hashCode();
    }
}
