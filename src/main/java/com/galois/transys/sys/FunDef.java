package com.galois.transys.sys;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.galois.transys.term.FunSig;
import com.galois.transys.term.Sym;
import com.galois.transys.term.Term;
import com.galois.transys.term.Type;
import com.galois.transys.term.TypedSym;

/**
 * A defined function of a system.
 *
 * The body refers to the formal arguments as non-state variables and may
 * call the function itself. There is at least one formal.
 */
public final class FunDef {
    private final Sym name;
    private final ImmutableList<TypedSym> formals;
    private final Type resultType;
    private final Term body;

    public FunDef(Sym name, List<TypedSym> formals, Type resultType, Term body) {
        if (name == null) throw new NullPointerException("name");
        if (resultType == null) throw new NullPointerException("resultType");
        if (body == null) throw new NullPointerException("body");
        this.name = name;
        this.formals = ImmutableList.copyOf(formals);
        checkArgument(!this.formals.isEmpty(), "function %s defined without arguments", name);
        this.resultType = resultType;
        this.body = body;
    }

    public Sym name() {
        return name;
    }

    public ImmutableList<TypedSym> formals() {
        return formals;
    }

    public Type resultType() {
        return resultType;
    }

    public Term body() {
        return body;
    }

    public FunSig sig() {
        ImmutableList.Builder<Type> b = ImmutableList.builder();
        for (TypedSym f : formals) {
            b.add(f.type());
        }
        return new FunSig(b.build(), resultType);
    }
}
