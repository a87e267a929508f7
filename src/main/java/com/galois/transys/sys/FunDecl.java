package com.galois.transys.sys;

import static com.google.common.base.Preconditions.checkArgument;

import com.galois.transys.term.FunSig;
import com.galois.transys.term.Sym;

/**
 * An uninterpreted function of a system. Functions take at least one
 * argument, since applications always have arguments.
 */
public final class FunDecl {
    private final Sym name;
    private final FunSig sig;

    public FunDecl(Sym name, FunSig sig) {
        if (name == null) throw new NullPointerException("name");
        if (sig == null) throw new NullPointerException("sig");
        checkArgument(!sig.argTypes().isEmpty(), "function %s declared without arguments", name);
        this.name = name;
        this.sig = sig;
    }

    public Sym name() {
        return name;
    }

    public FunSig sig() {
        return sig;
    }
}
