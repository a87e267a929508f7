package com.galois.transys.solver;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Assert;
import org.junit.Assume;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExternalResource;

import com.galois.transys.offset.Offset;
import com.galois.transys.offset.Offset2;
import com.galois.transys.term.BoolValue;
import com.galois.transys.term.Cst;
import com.galois.transys.term.FunSig;
import com.galois.transys.term.IntegerValue;
import com.galois.transys.term.LetBinding;
import com.galois.transys.term.Model;
import com.galois.transys.term.Operator;
import com.galois.transys.term.RationalValue;
import com.galois.transys.term.State;
import com.galois.transys.term.Sym;
import com.galois.transys.term.Term;
import com.galois.transys.term.TermStore;
import com.galois.transys.term.Type;
import com.galois.transys.term.TypedSym;
import com.galois.transys.term.VarTerm;

public class TestZ3Solver {
    TermStore store = new TermStore();
    Solver solver;

    Sym x = Sym.of("x");
    Sym r = Sym.of("r");
    Sym b = Sym.of("b");
    List<TypedSym> vars = Arrays.asList(new TypedSym(x, Type.INT),
                                        new TypedSym(r, Type.RAT),
                                        new TypedSym(b, Type.BOOL));

    @Rule
    public ExternalResource solverResource = new ExternalResource() {
        @Override
        protected void before() throws Throwable {
            try {
                solver = new Z3Solver();
            } catch (SolverException e) {
                Assume.assumeNoException("z3 is not available", e);
            }
        }

        @Override
        protected void after() {
            try {
                solver.close();
            } catch (SolverException e) {
                throw new RuntimeException(e);
            }
        }
    };

    Term xc() {
        return store.svar(x, Type.INT, State.CURR);
    }

    Term xn() {
        return store.svar(x, Type.INT, State.NEXT);
    }

    @Test
    public void modelsCoverEveryDeclaredCopy() throws Exception {
        Offset2 o = Offset2.init();
        solver.declareStateVars(vars, o.curr());
        solver.declareStateVars(vars, o.nextOffset());
        solver.assertTerm(store.eq(xc(), store.integer(-4)), o);
        solver.assertTerm(store.eq(xn(), store.add(xc(), store.integer(1))), o);
        solver.assertTerm(store.eq(store.svar(r, Type.RAT, State.CURR),
                                   store.rational(3, 4)), o);
        solver.assertTerm(store.svar(b, Type.BOOL, State.NEXT), o);
        Assert.assertTrue(solver.checkSatAssuming(Collections.<Term>emptyList(), o));

        Model m = solver.getModel();
        Assert.assertEquals(6, m.size());
        Assert.assertEquals(new IntegerValue(-4), m.get(x, Offset.of(0)));
        Assert.assertEquals(new IntegerValue(-3), m.get(x, Offset.of(1)));
        Assert.assertEquals(new RationalValue(3, 4), m.get(r, Offset.of(0)));
        Assert.assertEquals(BoolValue.TRUE, m.get(b, Offset.of(1)));
    }

    @Test
    public void assumptionsDoNotPersist() throws Exception {
        Offset2 o = Offset2.init();
        solver.declareStateVars(vars, o.curr());
        ActlitFactory actlits = new ActlitFactory(store);
        VarTerm lit = actlits.fresh(solver);
        solver.assertTerm(store.eq(xc(), store.integer(1)), o);
        solver.assertTerm(actlits.guard(lit, store.eq(xc(), store.integer(2))), o);

        Assert.assertFalse(solver.checkSatAssuming(Arrays.<Term>asList(lit), o));
        Assert.assertTrue(solver.checkSatAssuming(Collections.<Term>emptyList(), o));
        Assert.assertTrue(solver.checkSatAssuming(
                              Arrays.<Term>asList(store.not(lit)), o));
    }

    @Test
    public void termsAreInstantiatedAtTheirOffset() throws Exception {
        Offset2 o = Offset2.init();
        Offset2 o1 = o.next();
        solver.declareStateVars(vars, o.curr());
        solver.declareStateVars(vars, o1.curr());
        solver.declareStateVars(vars, o1.nextOffset());
        Term step = store.eq(xn(), store.add(xc(), store.integer(1)));
        solver.assertTerm(store.eq(xc(), store.integer(0)), o);
        solver.assertTerm(step, o);
        solver.assertTerm(step, o1);
        Assert.assertFalse(solver.checkSatAssuming(
                               Arrays.asList(store.eq(xn(), store.integer(3))), o1));
        Assert.assertTrue(solver.checkSatAssuming(
                              Arrays.asList(store.eq(xn(), store.integer(2))), o1));
        Assert.assertEquals(new IntegerValue(2), solver.getModel().get(x, Offset.of(2)));
    }

    @Test(expected = SolverException.class)
    public void undeclaredCopiesAreRejected() throws Exception {
        Offset2 o = Offset2.init();
        solver.declareStateVars(vars, o.curr());
        solver.assertTerm(store.eq(xn(), store.integer(0)), o);
    }

    @Test
    public void recursiveFunctions() throws Exception {
        // sum(n) = if n <= 0 then 0 else n + sum(n - 1)
        Sym sum = Sym.of("sum");
        Sym n = Sym.of("n");
        Term nv = store.var(n, Type.INT);
        Term body = store.ite(store.le(nv, store.integer(0)), store.integer(0),
                              store.add(nv, store.app(sum, store.sub(nv, store.integer(1)))));
        solver.defineFun(sum, Arrays.asList(new TypedSym(n, Type.INT)), Type.INT, body);

        Offset2 o = Offset2.init();
        solver.declareStateVars(vars, o.curr());
        solver.assertTerm(store.eq(xc(), store.app(sum, store.integer(4))), o);
        Assert.assertTrue(solver.checkSatAssuming(Collections.<Term>emptyList(), o));
        Assert.assertEquals(new IntegerValue(10), solver.getModel().get(x, Offset.of(0)));
    }

    @Test
    public void uninterpretedFunctionsAndQuantifiers() throws Exception {
        Sym f = Sym.of("f");
        Sym q = Sym.of("q");
        solver.declareFun(f, new FunSig(Arrays.asList(Type.INT), Type.INT));
        Term qv = store.var(q, Type.INT);
        Offset2 o = Offset2.init();
        solver.declareStateVars(vars, o.curr());
        solver.assertTerm(store.forall(Arrays.asList(new TypedSym(q, Type.INT)),
                                       store.gt(store.app(f, qv), qv)), o);
        Assert.assertFalse(solver.checkSatAssuming(
                               Arrays.asList(store.eq(store.app(f, xc()), xc())), o));
    }

    @Test
    public void letBindings() throws Exception {
        Sym a = Sym.of("a");
        Offset2 o = Offset2.init();
        solver.declareStateVars(vars, o.curr());
        Term t = store.let(
            Arrays.asList(new LetBinding(
                              a, store.mul(xc(), store.integer(2)))),
            store.eq(store.var(a, Type.INT), store.integer(14)));
        solver.assertTerm(t, o);
        Assert.assertTrue(solver.checkSatAssuming(Collections.<Term>emptyList(), o));
        Assert.assertEquals(new IntegerValue(7), solver.getModel().get(x, Offset.of(0)));
    }

    @Test
    public void valuesOfTermsApplyingFunctions() throws Exception {
        Sym inc = Sym.of("inc");
        Sym n = Sym.of("n");
        solver.defineFun(inc, Arrays.asList(new TypedSym(n, Type.INT)), Type.INT,
                         store.add(store.var(n, Type.INT), store.integer(1)));
        Offset2 o = Offset2.init();
        solver.declareStateVars(vars, o.curr());
        solver.assertTerm(store.eq(xc(), store.integer(2)), o);
        solver.assertTerm(store.eq(store.svar(r, Type.RAT, State.CURR),
                                   store.rational(1, 2)), o);
        Assert.assertTrue(solver.checkSatAssuming(Collections.<Term>emptyList(), o));
        Term incx = store.app(inc, xc());
        Assert.assertEquals(
            Arrays.<Cst>asList(new IntegerValue(3), BoolValue.FALSE, new RationalValue(1, 2)),
            solver.getValues(Arrays.asList(incx, store.lt(incx, store.integer(3)),
                                           store.svar(r, Type.RAT, State.CURR)),
                             o));
    }

    @Test
    public void distinctNegatesTheEqualityChain() throws Exception {
        Offset2 o = Offset2.init();
        solver.declareStateVars(vars, o.curr());
        // Pairwise distinctness would make this unsatisfiable.
        Term d = store.op(Operator.DISTINCT, xc(), store.integer(1), xc());
        solver.assertTerm(store.eq(xc(), store.integer(0)), o);
        Assert.assertTrue(solver.checkSatAssuming(Arrays.asList(d), o));
        Assert.assertFalse(solver.checkSatAssuming(
                               Arrays.asList(store.op(Operator.DISTINCT, xc())), o));
    }
}
