package com.galois.transys.term;

/**
 * TermException is raised when a term cannot be checked, evaluated or
 * rewritten.
 */
public class TermException extends Exception {
    public TermException(String message) {
        super(message);
    }
}
