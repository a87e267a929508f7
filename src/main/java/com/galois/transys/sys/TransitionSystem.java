package com.galois.transys.sys;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.galois.transys.offset.Offset;
import com.galois.transys.offset.Offset2;
import com.galois.transys.offset.SymbolicOffset;
import com.galois.transys.solver.Solver;
import com.galois.transys.solver.SolverException;
import com.galois.transys.term.FunSig;
import com.galois.transys.term.Sym;
import com.galois.transys.term.Term;
import com.galois.transys.term.TermException;
import com.galois.transys.term.TermOffsets;
import com.galois.transys.term.Type;
import com.galois.transys.term.TypeCheckException;
import com.galois.transys.term.TypeChecker;
import com.galois.transys.term.TypedSym;

/**
 * A transition system: state variables, an initial predicate over the
 * current state and a transition relation between the current and next
 * state, plus the functions both may call.
 */
public final class TransitionSystem {
    private static final Logger log = LogManager.getFormatterLogger();

    private final String name;
    private final ImmutableList<TypedSym> stateVars;
    private final Term init;
    private final Term trans;
    private final ImmutableList<FunDecl> declared;
    private final ImmutableList<FunDef> defined;
    private final ImmutableMap<Sym, FunSig> signatures;

    /**
     * Create a system, checking that {@code init} and {@code trans} are
     * Boolean and that {@code init} does not mention the next state.
     *
     * @throws TermException if a predicate is ill-typed or {@code init}
     *   mentions the next state
     */
    public TransitionSystem(String name, List<TypedSym> stateVars, Term init, Term trans,
                            List<FunDecl> declared, List<FunDef> defined)
        throws TermException {
        if (name == null) throw new NullPointerException("name");
        if (init == null) throw new NullPointerException("init");
        if (trans == null) throw new NullPointerException("trans");
        this.name = name;
        this.stateVars = ImmutableList.copyOf(stateVars);
        this.init = init;
        this.trans = trans;
        this.declared = ImmutableList.copyOf(declared);
        this.defined = ImmutableList.copyOf(defined);

        Map<Sym, FunSig> sigs = new HashMap<Sym, FunSig>();
        for (FunDecl d : this.declared) {
            sigs.put(d.name(), d.sig());
        }
        for (FunDef d : this.defined) {
            sigs.put(d.name(), d.sig());
        }
        this.signatures = ImmutableMap.copyOf(sigs);

        TypeChecker checker = new TypeChecker(signatures);
        checkBool(checker, init, "initial predicate");
        checkBool(checker, trans, "transition relation");
        for (FunDef d : this.defined) {
            Type t = checker.typeOf(d.body());
            if (t != d.resultType()) {
                throw new TypeCheckException(
                    String.format("function |%s| returns %s but its body has type %s",
                                  d.name(), d.resultType().smtName(), t.smtName()));
            }
        }
        checkOneState(init, "initial predicate");
    }

    /** A system without functions. */
    public TransitionSystem(String name, List<TypedSym> stateVars, Term init, Term trans)
        throws TermException {
        this(name, stateVars, init, trans,
             ImmutableList.<FunDecl>of(), ImmutableList.<FunDef>of());
    }

    static void checkBool(TypeChecker checker, Term t, String what) throws TermException {
        Type type = checker.typeOf(t);
        if (type != Type.BOOL) {
            throw new TypeCheckException(what + " must be Bool, got " + type.smtName());
        }
    }

    /** Fails if {@code t} mentions a next-state variable. */
    static void checkOneState(Term t, String what) throws TermException {
        Offset2 o = Offset2.init();
        SymbolicOffset so = TermOffsets.of(t, o);
        if (so.hi() != null && so.hi().equals(o.nextOffset())) {
            throw new TermException(what + " mentions next-state variables");
        }
    }

    public String name() {
        return name;
    }

    public ImmutableList<TypedSym> stateVars() {
        return stateVars;
    }

    public Term init() {
        return init;
    }

    public Term trans() {
        return trans;
    }

    /** Signatures of every declared and defined function. */
    public ImmutableMap<Sym, FunSig> signatures() {
        return signatures;
    }

    /** Declare and define the functions of this system. */
    public void declareAndDefineFunctions(Solver solver) throws SolverException {
        for (FunDecl d : declared) {
            solver.declareFun(d.name(), d.sig());
        }
        for (FunDef d : defined) {
            solver.defineFun(d.name(), d.formals(), d.resultType(), d.body());
        }
    }

    /**
     * Declare the state at {@code offset} and assert the initial predicate
     * there.
     */
    public void assertInit(Solver solver, Offset offset) throws SolverException {
        log.debug("%s: init at %s", name, offset);
        solver.declareStateVars(stateVars, offset);
        solver.assertTerm(init, Offset2.at(offset));
    }

    /**
     * Declare the state at the next offset of {@code offset} and assert the
     * transition relation between the two.
     */
    public void unroll(Solver solver, Offset2 offset) throws SolverException {
        log.debug("%s: unrolling %s", name, offset);
        solver.declareStateVars(stateVars, offset.nextOffset());
        solver.assertTerm(trans, offset);
    }
}
