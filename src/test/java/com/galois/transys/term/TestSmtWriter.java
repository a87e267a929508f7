package com.galois.transys.term;

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.galois.transys.offset.Offset;
import com.galois.transys.offset.Offset2;

public class TestSmtWriter {
    TermStore store;
    Sym x = Sym.of("x");

    @Before
    public void setUp() {
        store = new TermStore();
    }

    @Test
    public void stateVariablesCarryTheirOffset() {
        Term t = store.eq(store.svar(x, Type.INT, State.NEXT),
                          store.add(store.svar(x, Type.INT, State.CURR), store.integer(1)));
        Assert.assertEquals("(= |x@8| (+ |x@7| 1))",
                            SmtWriter.at(Offset2.at(Offset.of(7))).write(t));
        Assert.assertEquals("(= (next |x|) (+ (state |x|) 1))",
                            SmtWriter.unanchored().write(t));
    }

    @Test
    public void literals() {
        SmtWriter w = SmtWriter.unanchored();
        Assert.assertEquals("(- 3)", w.write(store.integer(-3)));
        Assert.assertEquals("(/ 1.0 2.0)", w.write(store.rational(1, 2)));
        Assert.assertEquals("(- (/ 1.0 2.0))", w.write(store.rational(-1, 2)));
        Assert.assertEquals("4.0", w.write(store.rational(4, 1)));
        Assert.assertEquals("true", w.write(store.bool(true)));
    }

    @Test
    public void integerDivisionIsDiv() {
        SmtWriter w = SmtWriter.unanchored();
        Term vi = store.var(Sym.of("i"), Type.INT);
        Term vr = store.var(Sym.of("r"), Type.RAT);
        Assert.assertEquals("(div |i| 2)", w.write(store.op(Operator.DIV, vi, store.integer(2))));
        Assert.assertEquals("(/ |r| 2.0)",
                            w.write(store.op(Operator.DIV, vr, store.rational(2, 1))));
    }

    @Test
    public void bindersAndApplications() {
        Sym q = Sym.of("q");
        Sym a = Sym.of("a");
        Sym c = Sym.of("c");
        Term body = store.app(Sym.of("f"), store.var(q, Type.INT), store.var(a, Type.INT));
        Term t = store.let(Arrays.asList(new LetBinding(a, store.integer(1)),
                                         new LetBinding(c, store.bool(false))),
                           store.exists(Arrays.asList(new TypedSym(q, Type.INT),
                                                      new TypedSym(Sym.of("r"), Type.RAT)),
                                        store.or(store.var(c, Type.BOOL),
                                                 store.eq(body, store.integer(0)))));
        Assert.assertEquals(
            "(let ((|a| 1) (|c| false)) (exists ((|q| Int) (|r| Real)) "
            + "(or |c| (= (|f| |q| |a|) 0))))",
            t.toString());
    }

    @Test
    public void distinctIsTheNegatedEqualityChain() {
        SmtWriter w = SmtWriter.unanchored();
        Term vx = store.var(x, Type.INT);
        Term one = store.integer(1);
        Assert.assertEquals("(not (= |x| 1 |x|))",
                            w.write(store.op(Operator.DISTINCT, vx, one, vx)));
        Assert.assertEquals("(not (= |x| |x|))", w.write(store.op(Operator.DISTINCT, vx)));
        Assert.assertEquals("(= |x| |x|)", w.write(store.op(Operator.EQ, vx)));
        Assert.assertEquals("(= |x| 1 |x|)", w.write(store.op(Operator.EQ, vx, one, vx)));
    }
}
