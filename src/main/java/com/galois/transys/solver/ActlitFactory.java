package com.galois.transys.solver;

import com.galois.transys.term.Sym;
import com.galois.transys.term.Term;
import com.galois.transys.term.TermStore;
import com.galois.transys.term.Type;
import com.galois.transys.term.VarTerm;

/**
 * Creates fresh activation literals.
 *
 * A literal is a Boolean variable guarding an assertion {@code lit => f}: the
 * assertion only has an effect in queries assuming {@code lit}.
 */
public final class ActlitFactory {
    private final TermStore store;
    private int count = 0;

    public ActlitFactory(TermStore store) {
        this.store = store;
    }

    /** Declare and return a literal that was never used before. */
    public VarTerm fresh(Solver solver) throws SolverException {
        Sym sym = Sym.of("actlit_" + count++);
        solver.declareActlit(sym);
        return store.var(sym, Type.BOOL);
    }

    /** The implication {@code lit => formula}. */
    public Term guard(VarTerm lit, Term formula) {
        return store.implies(lit, formula);
    }
}
