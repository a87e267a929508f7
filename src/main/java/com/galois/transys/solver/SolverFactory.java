package com.galois.transys.solver;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Creates solver sessions.
 */
public interface SolverFactory {
    /** Start a fresh session. */
    Solver create() throws SolverException;

    /**
     * Return a factory for the given kind of solver.
     *
     * @param kind the decision procedure
     * @param command command line of the solver process, split on blanks
     *   (ignored for {@link SolverKind#Z3})
     * @param smtLog file receiving the SMT-LIB 2 script, or {@code null}
     */
    static SolverFactory of(SolverKind kind, String command, final Path smtLog) {
        switch (kind) {
        case Z3:
            return new SolverFactory() {
                public Solver create() throws SolverException {
                    return new Z3Solver(smtLog);
                }
            };
        case Z3_PROCESS: {
            final List<String> commandLine = Arrays.asList(command.trim().split("\\s+"));
            return new SolverFactory() {
                public Solver create() throws SolverException {
                    return ProcessSolver.launch(commandLine, smtLog);
                }
            };
        }
        default:
            throw new IllegalStateException("Unknown solver kind " + kind);
        }
    }
}
