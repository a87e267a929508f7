/**
 * Hash-consed terms over booleans, integers and rationals.
 *
 * <p>
 * Terms are built through a {@link com.galois.transys.term.TermStore}, which
 * returns one shared object per term shape. Traversals never recurse on the
 * Java stack: see {@link com.galois.transys.term.AbstractTermFold} and
 * {@link com.galois.transys.term.Zipper}.
 */
package com.galois.transys.term;
