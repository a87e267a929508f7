package com.galois.transys.term;

/** A symbol with a declared type, as bound by a quantifier. */
public final class TypedSym implements Typed {
    private final Sym sym;
    private final Type type;

    public TypedSym(Sym sym, Type type) {
        if (sym == null) throw new NullPointerException("sym");
        if (type == null) throw new NullPointerException("type");
        this.sym = sym;
        this.type = type;
    }

    public Sym sym() {
        return sym;
    }

    public Type type() {
        return type;
    }

    public boolean equals(Object o) {
        if (!(o instanceof TypedSym)) return false;
        TypedSym r = (TypedSym) o;
        return sym == r.sym && type == r.type;
    }

    public int hashCode() {
        return 31 * sym.hashCode() + type.hashCode();
    }

    public String toString() {
        return "(|" + sym + "| " + type.smtName() + ")";
    }
}
