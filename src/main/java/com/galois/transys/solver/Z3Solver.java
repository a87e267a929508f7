package com.galois.transys.solver;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.ArithSort;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.RatNum;
import com.microsoft.z3.RealExpr;
import com.microsoft.z3.Sort;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.galois.transys.offset.Offset;
import com.galois.transys.offset.Offset2;
import com.galois.transys.term.AbstractTermFold;
import com.galois.transys.term.AppTerm;
import com.galois.transys.term.BoolValue;
import com.galois.transys.term.Cst;
import com.galois.transys.term.CstTerm;
import com.galois.transys.term.FunSig;
import com.galois.transys.term.IntegerValue;
import com.galois.transys.term.LetTerm;
import com.galois.transys.term.Model;
import com.galois.transys.term.OpTerm;
import com.galois.transys.term.Operator;
import com.galois.transys.term.QuantTerm;
import com.galois.transys.term.RationalValue;
import com.galois.transys.term.State;
import com.galois.transys.term.Sym;
import com.galois.transys.term.Term;
import com.galois.transys.term.TermException;
import com.galois.transys.term.Type;
import com.galois.transys.term.TypedSym;
import com.galois.transys.term.VarTerm;

/**
 * A solver session backed by the Z3 Java API.
 *
 * Terms are translated to Z3 expressions directly; when an SMT log is
 * requested the equivalent SMT-LIB 2 script is written to it as well.
 */
public final class Z3Solver implements Solver {
    private static final Logger log = LogManager.getFormatterLogger();

    /** A declared copy of a state variable. */
    private static final class Declared {
        final Sym sym;
        final Offset offset;
        final Type type;
        final Expr<?> expr;

        Declared(Sym sym, Offset offset, Type type, Expr<?> expr) {
            this.sym = sym;
            this.offset = offset;
            this.type = type;
            this.expr = expr;
        }
    }

    private final Context ctx;
    private final com.microsoft.z3.Solver solver;
    private final PrintWriter trace;

    private final Map<Sym, FuncDecl<?>> functions = new HashMap<Sym, FuncDecl<?>>();
    private final Map<String, Declared> stateVars = new LinkedHashMap<String, Declared>();
    private final Map<Sym, BoolExpr> actlits = new HashMap<Sym, BoolExpr>();

    public Z3Solver() throws SolverException {
        this(null);
    }

    /**
     * Start a session.
     *
     * @param smtLog file receiving the SMT-LIB 2 script of the session, or
     *   {@code null}
     * @throws SolverException if Z3 cannot be loaded or the log not opened
     */
    public Z3Solver(Path smtLog) throws SolverException {
        Context c;
        try {
            c = new Context();
        } catch (Z3Exception e) {
            throw new SolverException("could not start z3: " + e.getMessage(), e);
        } catch (LinkageError e) {
            throw new SolverException("could not load z3: " + e.getMessage(), e);
        }
        PrintWriter w = null;
        if (smtLog != null) {
            try {
                w = new PrintWriter(Files.newBufferedWriter(smtLog, StandardCharsets.UTF_8));
            } catch (IOException e) {
                c.close();
                throw new SolverException("could not open SMT log " + smtLog, e);
            }
        }
        this.ctx = c;
        this.solver = c.mkSolver();
        this.trace = w;
        log.debug("z3 session started");
    }

    private static String key(Sym sym, Offset offset) {
        return sym.name() + "@" + offset;
    }

    private void trace(String command) {
        log.trace("z3 < %s", command);
        if (trace != null) {
            trace.println(command);
            trace.flush();
        }
    }

    private Sort sort(Type type) {
        switch (type) {
        case BOOL:
            return ctx.mkBoolSort();
        case INT:
            return ctx.mkIntSort();
        case RAT:
            return ctx.mkRealSort();
        default:
            throw new IllegalStateException("Unknown type " + type);
        }
    }

    private Sort[] sorts(List<Type> types) {
        Sort[] r = new Sort[types.size()];
        for (int i = 0; i != r.length; ++i) {
            r[i] = sort(types.get(i));
        }
        return r;
    }

    public void declareFun(Sym name, FunSig sig) throws SolverException {
        trace(SmtCommands.declareFun(name, sig));
        try {
            functions.put(name, ctx.mkFuncDecl(name.name(), sorts(sig.argTypes()),
                                               sort(sig.resultType())));
        } catch (Z3Exception e) {
            throw new SolverException("declare-fun " + name + ": " + e.getMessage(), e);
        }
    }

    public void defineFun(Sym name, List<TypedSym> formals, Type resultType, Term body)
        throws SolverException {
        trace(SmtCommands.defineFun(name, formals, resultType, body));
        try {
            List<Type> types = new ArrayList<Type>();
            Map<Sym, Expr<?>> locals = new HashMap<Sym, Expr<?>>();
            Expr<?>[] args = new Expr<?>[formals.size()];
            for (int i = 0; i != args.length; ++i) {
                TypedSym f = formals.get(i);
                types.add(f.type());
                args[i] = ctx.mkConst(f.sym().name(), sort(f.type()));
                locals.put(f.sym(), args[i]);
            }
            Sort[] domain = sorts(types);
            switch (resultType) {
            case BOOL:
                defineRec(name, domain, ctx.mkBoolSort(), BoolExpr.class, args, locals, body);
                break;
            case INT:
                defineRec(name, domain, ctx.mkIntSort(), IntExpr.class, args, locals, body);
                break;
            case RAT:
                defineRec(name, domain, ctx.mkRealSort(), RealExpr.class, args, locals, body);
                break;
            default:
                throw new IllegalStateException("Unknown type " + resultType);
            }
        } catch (TermException e) {
            throw new SolverException("define-fun " + name + ": " + e.getMessage(), e);
        } catch (Z3Exception e) {
            throw new SolverException("define-fun " + name + ": " + e.getMessage(), e);
        }
    }

    /**
     * Declare a recursive function with range {@code range}, then translate
     * its body (which may call it) and attach the definition.
     */
    private <R extends Sort> void defineRec(Sym name, Sort[] domain, R range,
                                            Class<? extends Expr<R>> kind,
                                            Expr<?>[] args, Map<Sym, Expr<?>> locals,
                                            Term body) throws TermException {
        FuncDecl<R> decl = ctx.mkRecFuncDecl(ctx.mkSymbol(name.name()), domain, range);
        functions.put(name, decl);
        Expr<?> def = new Translator(null, locals).fold(body);
        if (!kind.isInstance(def)) {
            throw new TermException("body of |" + name + "| has sort " + def.getSort());
        }
        ctx.AddRecDef(decl, args, kind.cast(def));
    }

    public void declareStateVars(List<TypedSym> vars, Offset offset)
        throws SolverException {
        try {
            for (TypedSym v : vars) {
                trace(SmtCommands.declareStateVar(v.sym(), v.type(), offset));
                String name = key(v.sym(), offset);
                Expr<?> e = ctx.mkConst(name, sort(v.type()));
                stateVars.put(name, new Declared(v.sym(), offset, v.type(), e));
            }
        } catch (Z3Exception e) {
            throw new SolverException("declare state at " + offset + ": "
                                      + e.getMessage(), e);
        }
    }

    public void declareActlit(Sym lit) throws SolverException {
        trace(SmtCommands.declareActlit(lit));
        try {
            actlits.put(lit, ctx.mkBoolConst(lit.name()));
        } catch (Z3Exception e) {
            throw new SolverException("declare actlit " + lit + ": " + e.getMessage(), e);
        }
    }

    /** Translate {@code term} instantiated at {@code offset}. */
    private Expr<?> translate(Term term, Offset2 offset) throws SolverException {
        try {
            return new Translator(offset, null).fold(term);
        } catch (TermException e) {
            throw new SolverException(e.getMessage(), e);
        } catch (Z3Exception e) {
            throw new SolverException(e.getMessage(), e);
        }
    }

    private BoolExpr translateBool(Term term, Offset2 offset) throws SolverException {
        Expr<?> e = translate(term, offset);
        if (!(e instanceof BoolExpr)) {
            throw new SolverException("expected a Bool term, got sort " + e.getSort());
        }
        return (BoolExpr) e;
    }

    public void assertTerm(Term term, Offset2 offset) throws SolverException {
        trace(SmtCommands.assertTerm(term, offset));
        BoolExpr e = translateBool(term, offset);
        try {
            solver.add(e);
        } catch (Z3Exception ex) {
            throw new SolverException("assert: " + ex.getMessage(), ex);
        }
    }

    public boolean checkSatAssuming(List<Term> assumptions, Offset2 offset)
        throws SolverException {
        trace(SmtCommands.checkSatAssuming(assumptions, offset));
        BoolExpr[] lits = new BoolExpr[assumptions.size()];
        for (int i = 0; i != lits.length; ++i) {
            lits[i] = translateBool(assumptions.get(i), offset);
        }
        Status status;
        try {
            status = solver.check(lits);
        } catch (Z3Exception e) {
            throw new SolverException("check-sat-assuming: " + e.getMessage(), e);
        }
        log.debug("check-sat-assuming at %s: %s", offset, status);
        switch (status) {
        case SATISFIABLE:
            return true;
        case UNSATISFIABLE:
            return false;
        default:
            throw new SolverException("solver returned unknown: "
                                      + solver.getReasonUnknown());
        }
    }

    public Model getModel() throws SolverException {
        trace("(get-model)");
        List<Model.Entry> entries = new ArrayList<Model.Entry>();
        try {
            com.microsoft.z3.Model m = solver.getModel();
            for (Declared d : stateVars.values()) {
                Expr<?> v = m.eval(d.expr, true);
                entries.add(new Model.Entry(d.sym, d.offset, toCst(v, d.type)));
            }
        } catch (Z3Exception e) {
            throw new SolverException("get-model: " + e.getMessage(), e);
        }
        return new Model(entries);
    }

    public List<Cst> getValues(List<Term> terms, Offset2 offset) throws SolverException {
        trace(SmtCommands.getValue(terms, offset));
        List<Expr<?>> exprs = new ArrayList<Expr<?>>(terms.size());
        for (Term t : terms) {
            exprs.add(translate(t, offset));
        }
        List<Cst> values = new ArrayList<Cst>(terms.size());
        try {
            com.microsoft.z3.Model m = solver.getModel();
            for (Expr<?> e : exprs) {
                values.add(toCst(m.eval(e, true)));
            }
        } catch (Z3Exception e) {
            throw new SolverException("get-value: " + e.getMessage(), e);
        }
        return values;
    }

    private static Cst toCst(Expr<?> v, Type type) throws SolverException {
        switch (type) {
        case BOOL:
            if (v.isTrue()) return BoolValue.TRUE;
            if (v.isFalse()) return BoolValue.FALSE;
            break;
        case INT:
            if (v instanceof IntNum) return new IntegerValue(((IntNum) v).getBigInteger());
            break;
        case RAT:
            if (v instanceof RatNum) {
                RatNum r = (RatNum) v;
                return new RationalValue(r.getBigIntNumerator(), r.getBigIntDenominator());
            }
            if (v instanceof IntNum) return new RationalValue(((IntNum) v).getBigInteger());
            break;
        default:
            throw new IllegalStateException("Unknown type " + type);
        }
        throw new SolverException("unexpected " + type.smtName() + " model value " + v);
    }

    /** Convert a value whose type is given by its Z3 class. */
    private static Cst toCst(Expr<?> v) throws SolverException {
        if (v.isTrue()) return BoolValue.TRUE;
        if (v.isFalse()) return BoolValue.FALSE;
        if (v instanceof IntNum) return toCst(v, Type.INT);
        if (v instanceof RatNum) return toCst(v, Type.RAT);
        throw new SolverException("unexpected value " + v);
    }

    public void close() throws SolverException {
        if (trace != null) trace.close();
        try {
            ctx.close();
        } catch (Z3Exception e) {
            throw new SolverException("close: " + e.getMessage(), e);
        }
        log.debug("z3 session closed");
    }

    private static BoolExpr bool(Expr<?> e) {
        if (!(e instanceof BoolExpr)) {
            throw new IllegalStateException("expected a Bool expression, got " + e);
        }
        return (BoolExpr) e;
    }

    private static ArithExpr<?> arith(Expr<?> e) {
        if (!(e instanceof ArithExpr)) {
            throw new IllegalStateException("expected an arithmetic expression, got " + e);
        }
        return (ArithExpr<?>) e;
    }

    private static ArithExpr<?>[] ariths(List<Expr<?>> args) {
        ArithExpr<?>[] a = new ArithExpr<?>[args.size()];
        for (int i = 0; i != a.length; ++i) {
            a[i] = arith(args.get(i));
        }
        return a;
    }

    /**
     * Translates terms to Z3 expressions. State variables are resolved at
     * {@code offset}; formals of a function being defined through
     * {@code locals}.
     */
    private final class Translator extends AbstractTermFold<Expr<?>> {
        private final Offset2 offset;
        private final Map<Sym, Expr<?>> locals;

        Translator(Offset2 offset, Map<Sym, Expr<?>> locals) {
            this.offset = offset;
            this.locals = locals;
        }

        protected Expr<?> constructVariable(VarTerm var) throws TermException {
            if (var.isStateVar()) {
                if (offset == null) {
                    throw new TermException(
                        "state variable |" + var.sym() + "| in function definition");
                }
                Offset o = var.state() == State.CURR ? offset.curr() : offset.nextOffset();
                Declared d = stateVars.get(key(var.sym(), o));
                if (d == null) {
                    throw new TermException(
                        "undeclared state variable |" + key(var.sym(), o) + "|");
                }
                return d.expr;
            }
            Expr<?> e = lookupLet(var.sym());
            if (e != null) return e;
            if (lookupQuantified(var.sym()) != null) {
                return ctx.mkConst(var.sym().name(), sort(var.type()));
            }
            if (locals != null && locals.containsKey(var.sym())) {
                return locals.get(var.sym());
            }
            e = actlits.get(var.sym());
            if (e != null) return e;
            throw new TermException("undeclared variable |" + var.sym() + "|");
        }

        protected Expr<?> constructConstant(CstTerm cst) {
            Cst v = cst.value();
            if (v instanceof BoolValue) {
                return ctx.mkBool(((BoolValue) v).getValue());
            } else if (v instanceof IntegerValue) {
                return ctx.mkInt(v.toString());
            } else if (v instanceof RationalValue) {
                RationalValue r = (RationalValue) v;
                return ctx.mkReal(r.numerator() + "/" + r.denominator());
            }
            throw new IllegalStateException("Unknown constant " + v);
        }

        /** All arguments are equal; true for a single argument. */
        private BoolExpr allEqual(List<Expr<?>> args) {
            int n = args.size();
            if (n == 1) return ctx.mkTrue();
            BoolExpr[] eqs = new BoolExpr[n - 1];
            for (int i = 1; i < n; ++i) {
                eqs[i - 1] = ctx.mkEq(args.get(0), args.get(i));
            }
            return n == 2 ? eqs[0] : ctx.mkAnd(eqs);
        }

        protected Expr<?> constructOperator(OpTerm term, List<Expr<?>> args) {
            int n = args.size();
            switch (term.op()) {
            case EQ:
                return allEqual(args);
            case DISTINCT:
                return ctx.mkNot(allEqual(args));
            case ITE:
                return ctx.<Sort>mkITE(bool(args.get(0)), args.get(1), args.get(2));
            case NOT:
                return ctx.mkNot(bool(args.get(0)));
            case AND:
            case OR: {
                BoolExpr[] a = new BoolExpr[n];
                for (int i = 0; i != n; ++i) {
                    a[i] = bool(args.get(i));
                }
                return term.op() == Operator.AND
                    ? ctx.mkAnd(a) : ctx.mkOr(a);
            }
            case IMPL: {
                BoolExpr r = bool(args.get(n - 1));
                for (int i = n - 2; i >= 0; --i) {
                    r = ctx.mkImplies(bool(args.get(i)), r);
                }
                return r;
            }
            case XOR: {
                BoolExpr r = bool(args.get(0));
                for (int i = 1; i < n; ++i) {
                    r = ctx.mkXor(r, bool(args.get(i)));
                }
                return r;
            }
            case ADD:
                return ctx.<ArithSort>mkAdd(ariths(args));
            case MUL:
                return ctx.<ArithSort>mkMul(ariths(args));
            case SUB:
                if (n == 1) return ctx.mkUnaryMinus(arith(args.get(0)));
                return ctx.<ArithSort>mkSub(ariths(args));
            case DIV: {
                Expr<?> r = arith(args.get(0));
                for (int i = 1; i < n; ++i) {
                    r = ctx.<ArithSort>mkDiv(arith(r), arith(args.get(i)));
                }
                return r;
            }
            case LE:
                return ctx.mkLe(arith(args.get(0)), arith(args.get(1)));
            case GE:
                return ctx.mkGe(arith(args.get(0)), arith(args.get(1)));
            case LT:
                return ctx.mkLt(arith(args.get(0)), arith(args.get(1)));
            case GT:
                return ctx.mkGt(arith(args.get(0)), arith(args.get(1)));
            default:
                throw new IllegalStateException("Unknown operator " + term.op());
            }
        }

        protected Expr<?> constructApplication(AppTerm term, List<Expr<?>> args)
            throws TermException {
            FuncDecl<?> f = functions.get(term.fun());
            if (f == null) {
                throw new TermException("undeclared function |" + term.fun() + "|");
            }
            return ctx.mkApp(f, args.toArray(new Expr<?>[args.size()]));
        }

        protected Expr<?> constructQuantifier(QuantTerm term, Expr<?> body) {
            Expr<?>[] bound = new Expr<?>[term.bound().size()];
            for (int i = 0; i != bound.length; ++i) {
                TypedSym s = term.bound().get(i);
                bound[i] = ctx.mkConst(s.sym().name(), sort(s.type()));
            }
            if (term.isUniversal()) {
                return ctx.mkForall(bound, bool(body), 1, null, null, null, null);
            } else {
                return ctx.mkExists(bound, bool(body), 1, null, null, null, null);
            }
        }

        protected Expr<?> constructLet(LetTerm term, List<Expr<?>> values, Expr<?> body) {
            // Bound values were substituted while translating the body.
            return body;
        }
    }
}
