package com.galois.transys.sys;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.galois.transys.term.FunSig;
import com.galois.transys.term.State;
import com.galois.transys.term.Sym;
import com.galois.transys.term.Term;
import com.galois.transys.term.TermException;
import com.galois.transys.term.TermStore;
import com.galois.transys.term.Type;
import com.galois.transys.term.TypeCheckException;
import com.galois.transys.term.TypedSym;

public class TestTransitionSystem {
    TermStore store;
    Sym x = Sym.of("x");
    List<TypedSym> vars = Arrays.asList(new TypedSym(x, Type.INT));
    Term xc;
    Term xn;

    @Before
    public void setUp() {
        store = new TermStore();
        xc = store.svar(x, Type.INT, State.CURR);
        xn = store.svar(x, Type.INT, State.NEXT);
    }

    @Test
    public void counter() throws Exception {
        TransitionSystem sys = new TransitionSystem(
            "counter", vars, store.eq(xc, store.integer(0)),
            store.eq(xn, store.add(xc, store.integer(1))));
        Assert.assertEquals("counter", sys.name());
        Assert.assertEquals(vars, sys.stateVars());
        Assert.assertTrue(sys.signatures().isEmpty());
    }

    @Test(expected = TermException.class)
    public void initMustNotMentionNextState() throws Exception {
        new TransitionSystem("bad", vars, store.eq(xn, store.integer(0)),
                             store.eq(xn, xc));
    }

    @Test(expected = TypeCheckException.class)
    public void transMustBeBool() throws Exception {
        new TransitionSystem("bad", vars, store.eq(xc, store.integer(0)), xn);
    }

    @Test
    public void functionsAreVisibleToPredicates() throws Exception {
        Sym f = Sym.of("f");
        Sym n = Sym.of("n");
        Term nv = store.var(n, Type.INT);
        FunDef inc = new FunDef(f, Arrays.asList(new TypedSym(n, Type.INT)), Type.INT,
                                store.add(nv, store.integer(1)));
        TransitionSystem sys = new TransitionSystem(
            "calls", vars, store.eq(xc, store.integer(0)),
            store.eq(xn, store.app(f, xc)),
            Collections.<FunDecl>emptyList(), Arrays.asList(inc));
        Assert.assertEquals(new FunSig(Arrays.asList(Type.INT), Type.INT),
                            sys.signatures().get(f));
    }

    @Test(expected = TypeCheckException.class)
    public void functionBodyMustMatchResultType() throws Exception {
        Sym f = Sym.of("f");
        new TransitionSystem(
            "calls", vars, store.bool(true), store.bool(true),
            Collections.<FunDecl>emptyList(),
            Arrays.asList(new FunDef(f, Arrays.asList(new TypedSym(Sym.of("n"), Type.INT)),
                                     Type.BOOL, store.integer(3))));
    }

    @Test(expected = IllegalArgumentException.class)
    public void declaredFunctionsTakeArguments() {
        new FunDecl(Sym.of("c"), new FunSig(Collections.<Type>emptyList(), Type.INT));
    }

    @Test(expected = IllegalArgumentException.class)
    public void definedFunctionsTakeArguments() {
        new FunDef(Sym.of("c"), Collections.<TypedSym>emptyList(), Type.INT, store.integer(3));
    }

    @Test
    public void properties() throws Exception {
        Property p = new Property(Sym.of("p"), store.ge(xc, store.integer(0)));
        Assert.assertEquals(Sym.of("p"), p.id());
        try {
            new Property(Sym.of("q"), xc);
            Assert.fail("a property must be Boolean");
        } catch (TypeCheckException e) {
            // expected
        }
        try {
            new Property(Sym.of("r"), store.ge(xn, store.integer(0)));
            Assert.fail("a property must not mention the next state");
        } catch (TermException e) {
            // expected
        }
    }
}
