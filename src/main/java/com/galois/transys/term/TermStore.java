package com.galois.transys.term;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A canonicalizing factory for terms.
 *
 * Every builder returns the unique term of the requested shape, creating it
 * on first use. Insertion is guarded by a single lock; the returned terms are
 * immutable and may be read from any thread without locking.
 *
 * Builders do not type-check their arguments. Use {@link TypeChecker} for
 * that.
 */
public final class TermStore {
    private static final Logger log = LogManager.getFormatterLogger();

    /** Wraps a term so that map lookups compare shapes. */
    private static final class Shape {
        final Term term;
        final int hash;

        Shape(Term term) {
            this.term = term;
            this.hash = term.shapeHash();
        }

        public boolean equals(Object o) {
            if (!(o instanceof Shape)) return false;
            return term.sameShape(((Shape) o).term);
        }

        public int hashCode() {
            return hash;
        }
    }

    private final Map<Shape, Term> table = new HashMap<Shape, Term>();
    private int nextId = 0;

    /**
     * Return the canonical term with the shape of {@code candidate}, which
     * was built with {@link #nextId} as its identifier. Callers hold the
     * table lock.
     */
    private Term intern(Term candidate) {
        synchronized (table) {
            Shape key = new Shape(candidate);
            Term r = table.get(key);
            if (r == null) {
                table.put(key, candidate);
                ++nextId;
                r = candidate;
                if (log.isTraceEnabled()) {
                    log.trace("new term #%d: %s", r.id(), r.kind());
                }
            }
            return r;
        }
    }

    /** Number of distinct terms created so far. */
    public int size() {
        synchronized (table) {
            return table.size();
        }
    }

    /** A variable that is not a state variable. */
    public VarTerm var(Sym sym, Type type) {
        if (sym == null) throw new NullPointerException("sym");
        if (type == null) throw new NullPointerException("type");
        synchronized (table) {
            return (VarTerm) intern(new VarTerm(nextId, sym, type, null));
        }
    }

    /** A state variable at the given copy. */
    public VarTerm svar(Sym sym, Type type, State state) {
        if (sym == null) throw new NullPointerException("sym");
        if (type == null) throw new NullPointerException("type");
        if (state == null) throw new NullPointerException("state");
        synchronized (table) {
            return (VarTerm) intern(new VarTerm(nextId, sym, type, state));
        }
    }

    public CstTerm cst(Cst value) {
        if (value == null) throw new NullPointerException("value");
        synchronized (table) {
            return (CstTerm) intern(new CstTerm(nextId, value));
        }
    }

    public CstTerm bool(boolean b) {
        return cst(BoolValue.of(b));
    }

    public CstTerm integer(long i) {
        return cst(new IntegerValue(i));
    }

    public CstTerm integer(BigInteger i) {
        return cst(new IntegerValue(i));
    }

    public CstTerm rational(long n, long d) {
        return cst(new RationalValue(n, d));
    }

    /**
     * An operator application.
     * @throws IllegalArgumentException if {@code args} is empty
     */
    public Term op(Operator op, List<? extends Term> args) {
        if (op == null) throw new NullPointerException("op");
        ImmutableList<Term> l = ImmutableList.copyOf(args);
        checkArgument(!l.isEmpty(), "operator %s applied to no arguments", op.token());
        synchronized (table) {
            return intern(new OpTerm(nextId, op, l));
        }
    }

    public Term op(Operator op, Term... args) {
        return op(op, Arrays.asList(args));
    }

    /**
     * A function application.
     * @throws IllegalArgumentException if {@code args} is empty
     */
    public Term app(Sym fun, List<? extends Term> args) {
        if (fun == null) throw new NullPointerException("fun");
        ImmutableList<Term> l = ImmutableList.copyOf(args);
        checkArgument(!l.isEmpty(), "function %s applied to no arguments", fun);
        synchronized (table) {
            return intern(new AppTerm(nextId, fun, l));
        }
    }

    public Term app(Sym fun, Term... args) {
        return app(fun, Arrays.asList(args));
    }

    /** Universal quantification; no bound symbols yields {@code body}. */
    public Term forall(List<TypedSym> bound, Term body) {
        return quant(true, bound, body);
    }

    /** Existential quantification; no bound symbols yields {@code body}. */
    public Term exists(List<TypedSym> bound, Term body) {
        return quant(false, bound, body);
    }

    private Term quant(boolean universal, List<TypedSym> bound, Term body) {
        if (body == null) throw new NullPointerException("body");
        if (bound.isEmpty()) return body;
        ImmutableList<TypedSym> l = ImmutableList.copyOf(bound);
        synchronized (table) {
            return intern(new QuantTerm(nextId, universal, l, body));
        }
    }

    /** A let; no bindings yields {@code body}. */
    public Term let(List<LetBinding> bindings, Term body) {
        if (body == null) throw new NullPointerException("body");
        if (bindings.isEmpty()) return body;
        ImmutableList<LetBinding> l = ImmutableList.copyOf(bindings);
        synchronized (table) {
            return intern(new LetTerm(nextId, l, body));
        }
    }

    public Term not(Term t) {
        return op(Operator.NOT, t);
    }

    public Term and(Term... args) {
        return op(Operator.AND, args);
    }

    public Term and(List<? extends Term> args) {
        return op(Operator.AND, args);
    }

    public Term or(Term... args) {
        return op(Operator.OR, args);
    }

    public Term or(List<? extends Term> args) {
        return op(Operator.OR, args);
    }

    public Term implies(Term lhs, Term rhs) {
        return op(Operator.IMPL, lhs, rhs);
    }

    public Term eq(Term lhs, Term rhs) {
        return op(Operator.EQ, lhs, rhs);
    }

    public Term ite(Term c, Term t, Term e) {
        return op(Operator.ITE, c, t, e);
    }

    public Term add(Term... args) {
        return op(Operator.ADD, args);
    }

    public Term sub(Term... args) {
        return op(Operator.SUB, args);
    }

    public Term mul(Term... args) {
        return op(Operator.MUL, args);
    }

    public Term le(Term lhs, Term rhs) {
        return op(Operator.LE, lhs, rhs);
    }

    public Term ge(Term lhs, Term rhs) {
        return op(Operator.GE, lhs, rhs);
    }

    public Term lt(Term lhs, Term rhs) {
        return op(Operator.LT, lhs, rhs);
    }

    public Term gt(Term lhs, Term rhs) {
        return op(Operator.GT, lhs, rhs);
    }
}
