package com.galois.transys.term;

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.galois.transys.offset.Offset;
import com.galois.transys.offset.Offset2;
import com.galois.transys.offset.SymbolicOffset;

public class TestTermOffsets {
    TermStore store;
    Sym x = Sym.of("x");
    Term xc, xn;

    @Before
    public void setUp() {
        store = new TermStore();
        xc = store.svar(x, Type.INT, State.CURR);
        xn = store.svar(x, Type.INT, State.NEXT);
    }

    @Test
    public void constantsAndFormalsAreUnanchored() {
        Term t = store.add(store.var(Sym.of("n"), Type.INT), store.integer(1));
        Assert.assertEquals(SymbolicOffset.NONE, TermOffsets.of(t, Offset2.init()));
    }

    @Test
    public void stateVariablesFollowTheirPair() {
        Offset2 o = Offset2.at(Offset.of(4));
        Assert.assertEquals(SymbolicOffset.one(Offset.of(4)),
                            TermOffsets.of(store.lt(xc, store.integer(3)), o));
        Assert.assertEquals(SymbolicOffset.one(Offset.of(5)), TermOffsets.of(xn, o));
        Assert.assertEquals(SymbolicOffset.two(Offset.of(4), Offset.of(5)),
                            TermOffsets.of(store.eq(xn, store.app(Sym.of("f"), xc)), o));
    }

    @Test
    public void bindersMergeTheirParts() {
        Sym a = Sym.of("a");
        Term t = store.let(Arrays.asList(new LetBinding(a, xn)),
                           store.eq(store.var(a, Type.INT), xc));
        Assert.assertEquals(SymbolicOffset.two(Offset.of(0), Offset.of(1)),
                            TermOffsets.of(t, Offset2.init()));
    }
}
