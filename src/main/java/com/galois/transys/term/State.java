package com.galois.transys.term;

/** Which copy of a state variable a variable term refers to. */
public enum State {
    /** The state variable at the current step. */
    CURR,
    /** The state variable at the following step. */
    NEXT
}
