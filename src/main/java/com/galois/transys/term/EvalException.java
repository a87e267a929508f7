package com.galois.transys.term;

/** A term could not be evaluated to a constant. */
public class EvalException extends TermException {
    public EvalException(String message) {
        super(message);
    }
}
