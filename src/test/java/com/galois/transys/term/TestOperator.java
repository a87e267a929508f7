package com.galois.transys.term;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

public class TestOperator {
    static final BoolValue T = BoolValue.TRUE;
    static final BoolValue F = BoolValue.FALSE;

    static IntegerValue i(long v) {
        return new IntegerValue(v);
    }

    static RationalValue r(long n, long d) {
        return new RationalValue(n, d);
    }

    static Cst eval(Operator op, Cst... args) throws TermException {
        return op.eval(Arrays.asList(args));
    }

    static Type check(Operator op, Type... args) throws TermException {
        return op.typeCheck(Arrays.asList(args));
    }

    static List<Integer> evalErrorPositions(Operator op, Cst... args) throws TermException {
        try {
            eval(op, args);
        } catch (TypeCheckException e) {
            return e.getPositions();
        }
        Assert.fail("expected a type error");
        return null;
    }

    static List<Integer> checkErrorPositions(Operator op, Type... args) throws TermException {
        try {
            check(op, args);
        } catch (TypeCheckException e) {
            return e.getPositions();
        }
        Assert.fail("expected a type error");
        return null;
    }

    @Test
    public void typeCheckResults() throws Exception {
        Assert.assertEquals(Type.BOOL, check(Operator.EQ, Type.INT, Type.INT, Type.INT));
        Assert.assertEquals(Type.RAT, check(Operator.ITE, Type.BOOL, Type.RAT, Type.RAT));
        Assert.assertEquals(Type.BOOL, check(Operator.NOT, Type.BOOL));
        Assert.assertEquals(Type.BOOL, check(Operator.XOR, Type.BOOL, Type.BOOL, Type.BOOL));
        Assert.assertEquals(Type.INT, check(Operator.SUB, Type.INT));
        Assert.assertEquals(Type.RAT, check(Operator.DIV, Type.RAT, Type.RAT));
        Assert.assertEquals(Type.BOOL, check(Operator.LT, Type.INT, Type.INT));
    }

    @Test
    public void typeCheckErrors() throws Exception {
        Assert.assertEquals(Arrays.asList(2),
                            checkErrorPositions(Operator.EQ, Type.INT, Type.INT, Type.RAT));
        Assert.assertEquals(Arrays.asList(0),
                            checkErrorPositions(Operator.ITE, Type.INT, Type.INT, Type.INT));
        Assert.assertEquals(Arrays.asList(2),
                            checkErrorPositions(Operator.ITE, Type.BOOL, Type.INT, Type.BOOL));
        Assert.assertEquals(Arrays.asList(1),
                            checkErrorPositions(Operator.AND, Type.BOOL, Type.INT, Type.RAT));
        Assert.assertEquals(Arrays.asList(0),
                            checkErrorPositions(Operator.ADD, Type.BOOL, Type.INT));
        Assert.assertEquals(Arrays.asList(1),
                            checkErrorPositions(Operator.MUL, Type.INT, Type.RAT));
        Assert.assertEquals(Arrays.asList(1),
                            checkErrorPositions(Operator.LE, Type.INT, Type.RAT));
    }

    @Test(expected = ArityException.class)
    public void arithmeticNeedsArguments() throws Exception {
        check(Operator.ADD);
    }

    @Test(expected = ArityException.class)
    public void notIsUnary() throws Exception {
        check(Operator.NOT, Type.BOOL, Type.BOOL);
    }

    @Test(expected = ArityException.class)
    public void comparisonIsBinary() throws Exception {
        eval(Operator.GT, i(1), i(2), i(3));
    }

    @Test
    public void connectivesScanEveryArgument() throws Exception {
        // The first argument decides the result, the error is still reported.
        Assert.assertEquals(Arrays.asList(1), evalErrorPositions(Operator.AND, F, i(1), T));
        Assert.assertEquals(Arrays.asList(2), evalErrorPositions(Operator.OR, T, F, i(1)));
        Assert.assertEquals(Arrays.asList(1), evalErrorPositions(Operator.IMPL, F, r(1, 2)));
        Assert.assertEquals(Arrays.asList(1),
                            evalErrorPositions(Operator.XOR, T, i(0), i(1)));
    }

    @Test
    public void connectives() throws Exception {
        Assert.assertEquals(F, eval(Operator.AND, T, F, T));
        Assert.assertEquals(T, eval(Operator.AND, T, T));
        Assert.assertEquals(T, eval(Operator.OR, F, F, T));
        Assert.assertEquals(F, eval(Operator.OR, F, F));
        Assert.assertEquals(F, eval(Operator.NOT, T));
        // a => (b => c)
        Assert.assertEquals(T, eval(Operator.IMPL, F, T, F));
        Assert.assertEquals(F, eval(Operator.IMPL, T, T, F));
        Assert.assertEquals(T, eval(Operator.IMPL, T, F, F));
        Assert.assertEquals(T, eval(Operator.XOR, T, T, T));
        Assert.assertEquals(F, eval(Operator.XOR, T, T));
    }

    @Test
    public void equality() throws Exception {
        Assert.assertEquals(T, eval(Operator.EQ, i(2), i(2), i(2)));
        Assert.assertEquals(F, eval(Operator.EQ, i(2), i(2), i(3)));
        Assert.assertEquals(T, eval(Operator.EQ, r(1, 2), r(2, 4)));
        Assert.assertEquals(T, eval(Operator.DISTINCT, i(1), i(2)));
        Assert.assertEquals(F, eval(Operator.DISTINCT, T, T));
    }

    @Test
    public void iteSelectsBranch() throws Exception {
        Assert.assertEquals(i(1), eval(Operator.ITE, T, i(1), i(2)));
        Assert.assertEquals(i(2), eval(Operator.ITE, F, i(1), i(2)));
    }

    @Test
    public void arithmetic() throws Exception {
        Assert.assertEquals(i(6), eval(Operator.ADD, i(1), i(2), i(3)));
        Assert.assertEquals(i(-4), eval(Operator.SUB, i(1), i(2), i(3)));
        Assert.assertEquals(i(-5), eval(Operator.SUB, i(5)));
        Assert.assertEquals(r(-1, 3), eval(Operator.SUB, r(1, 3)));
        Assert.assertEquals(i(24), eval(Operator.MUL, i(2), i(3), i(4)));
        Assert.assertEquals(r(5, 6), eval(Operator.ADD, r(1, 2), r(1, 3)));
        Assert.assertEquals(r(3, 4), eval(Operator.DIV, r(3, 2), r(2, 1)));
    }

    @Test
    public void integerDivisionKeepsRemainderNonNegative() throws Exception {
        Assert.assertEquals(i(3), eval(Operator.DIV, i(7), i(2)));
        Assert.assertEquals(i(-4), eval(Operator.DIV, i(-7), i(2)));
        Assert.assertEquals(i(-3), eval(Operator.DIV, i(7), i(-2)));
        Assert.assertEquals(i(4), eval(Operator.DIV, i(-7), i(-2)));
    }

    @Test(expected = EvalException.class)
    public void divisionByZero() throws Exception {
        eval(Operator.DIV, i(1), i(0));
    }

    @Test(expected = EvalException.class)
    public void rationalDivisionByZero() throws Exception {
        eval(Operator.DIV, r(1, 2), r(0, 1));
    }

    @Test
    public void comparisons() throws Exception {
        Assert.assertEquals(T, eval(Operator.LE, i(1), i(1)));
        Assert.assertEquals(F, eval(Operator.LT, i(1), i(1)));
        Assert.assertEquals(T, eval(Operator.GT, r(1, 2), r(1, 3)));
        Assert.assertEquals(F, eval(Operator.GE, r(1, 3), r(1, 2)));
        Assert.assertEquals(Arrays.asList(1), evalErrorPositions(Operator.LE, i(1), r(1, 1)));
    }

    @Test
    public void wellTypedConstantTermsEvaluateToTheirType() throws Exception {
        TermStore store = new TermStore();
        Term[] terms = {
            store.ite(store.lt(store.integer(1), store.integer(2)),
                      store.rational(1, 2), store.rational(3, 4)),
            store.or(store.not(store.bool(true)), store.eq(store.integer(3), store.integer(3))),
            store.mul(store.sub(store.integer(4)), store.add(store.integer(1), store.integer(2))),
            store.op(Operator.DIV, store.rational(1, 3), store.rational(2, 5)),
        };
        TypeChecker checker = new TypeChecker();
        Evaluator evaluator = new Evaluator(Collections.<VarTerm, Cst>emptyMap());
        for (Term t : terms) {
            Type type = checker.typeOf(t);
            Assert.assertEquals(type, evaluator.evaluate(t).type());
        }
    }
}
