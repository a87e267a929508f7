package com.galois.transys.term;

/**
 * Rewrites variable leaves during {@link Zipper#mapVars}.
 */
public interface VarMapper {
    /**
     * Return the replacement for {@code var}, or {@code null} to keep it.
     *
     * @throws TermException if the variable cannot be rewritten
     */
    Term map(VarTerm var) throws TermException;
}
