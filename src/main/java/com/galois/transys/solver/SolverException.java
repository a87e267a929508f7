package com.galois.transys.solver;

/**
 * SolverException is raised when the decision procedure cannot be created or
 * fails to answer a command.
 */
public class SolverException extends Exception {
    public SolverException(String message) {
        super(message);
    }

    public SolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
