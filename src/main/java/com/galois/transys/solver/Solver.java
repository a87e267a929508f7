package com.galois.transys.solver;

import java.util.List;

import com.galois.transys.offset.Offset;
import com.galois.transys.offset.Offset2;
import com.galois.transys.term.Cst;
import com.galois.transys.term.FunSig;
import com.galois.transys.term.Model;
import com.galois.transys.term.Sym;
import com.galois.transys.term.Term;
import com.galois.transys.term.Type;
import com.galois.transys.term.TypedSym;

/**
 * An incremental solver session.
 *
 * State variables exist once per offset: {@link #declareStateVars} declares
 * their copies at one offset, and terms are instantiated at an
 * {@link Offset2} when asserted. Queries are assumption based, so nothing is
 * ever popped from a session.
 */
public interface Solver extends AutoCloseable {
    /** Declare an uninterpreted function. */
    void declareFun(Sym name, FunSig sig) throws SolverException;

    /**
     * Define a (possibly recursive) function. The body refers to the formals
     * as non-state variables.
     */
    void defineFun(Sym name, List<TypedSym> formals, Type resultType, Term body)
        throws SolverException;

    /** Declare the copies of the given state variables at {@code offset}. */
    void declareStateVars(List<TypedSym> vars, Offset offset) throws SolverException;

    /** Declare a Boolean activation literal. Literals never appear in models. */
    void declareActlit(Sym lit) throws SolverException;

    /** Assert a Boolean term instantiated at {@code offset}. */
    void assertTerm(Term term, Offset2 offset) throws SolverException;

    /**
     * Check satisfiability of the assertions under the given Boolean
     * assumptions.
     *
     * @return true if satisfiable, false if unsatisfiable
     * @throws SolverException if the solver fails or cannot decide
     */
    boolean checkSatAssuming(List<Term> assumptions, Offset2 offset)
        throws SolverException;

    /**
     * Return the values of every declared state variable copy after a
     * satisfiable query.
     */
    Model getModel() throws SolverException;

    /**
     * Return the values of {@code terms}, instantiated at {@code offset}, in
     * the model of the last satisfiable query. Terms may apply declared and
     * defined functions.
     */
    List<Cst> getValues(List<Term> terms, Offset2 offset) throws SolverException;

    void close() throws SolverException;
}
