package com.galois.transys.term;

/**
 * An object with a term type associated.
 */
public interface Typed {
    /**
     * Return type of object.
     * @return the type
     */
    Type type();
}
