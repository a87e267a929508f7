package com.galois.transys.term;

import com.google.common.collect.ImmutableList;

/** The signature of a function symbol. */
public final class FunSig {
    private final ImmutableList<Type> argTypes;
    private final Type resultType;

    public FunSig(Iterable<Type> argTypes, Type resultType) {
        if (resultType == null) throw new NullPointerException("resultType");
        this.argTypes = ImmutableList.copyOf(argTypes);
        this.resultType = resultType;
    }

    public ImmutableList<Type> argTypes() {
        return argTypes;
    }

    public Type resultType() {
        return resultType;
    }

    public boolean equals(Object o) {
        if (!(o instanceof FunSig)) return false;
        FunSig r = (FunSig) o;
        return argTypes.equals(r.argTypes) && resultType == r.resultType;
    }

    public int hashCode() {
        return 31 * argTypes.hashCode() + resultType.hashCode();
    }
}
