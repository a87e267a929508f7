package com.galois.transys.solver;

/** The available decision procedures. */
public enum SolverKind {
    /** Z3 through its Java API, in process. */
    Z3,
    /** An SMT-LIB 2 solver process, {@code z3 -in -smt2} by default. */
    Z3_PROCESS
}
