package com.galois.transys.term;

/** An operator or function was given the wrong number of arguments. */
public class ArityException extends TermException {
    public ArityException(String message) {
        super(message);
    }
}
