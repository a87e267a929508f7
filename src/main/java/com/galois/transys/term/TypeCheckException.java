package com.galois.transys.term;

import java.util.List;
import com.google.common.collect.ImmutableList;

/**
 * An argument had the wrong type.
 *
 * The exception carries the positions of the offending arguments, which may
 * be empty when no single argument is to blame.
 */
public class TypeCheckException extends TermException {
    private final ImmutableList<Integer> positions;

    public TypeCheckException(String message, List<Integer> positions) {
        super(message);
        this.positions = ImmutableList.copyOf(positions);
    }

    public TypeCheckException(String message, int position) {
        this(message, ImmutableList.of(position));
    }

    public TypeCheckException(String message) {
        this(message, ImmutableList.<Integer>of());
    }

    public List<Integer> getPositions() {
        return positions;
    }
}
