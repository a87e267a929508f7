package com.galois.transys.offset;

/**
 * Raised when sub-formulas anchored at inconsistent offsets are combined.
 *
 * This always indicates a bug in the code that built the formula.
 */
public class OffsetMergeException extends IllegalStateException {
    private final SymbolicOffset left;
    private final SymbolicOffset right;

    OffsetMergeException(SymbolicOffset left, SymbolicOffset right) {
        super("Cannot merge offsets " + left + " and " + right);
        this.left = left;
        this.right = right;
    }

    public SymbolicOffset getLeft() {
        return left;
    }

    public SymbolicOffset getRight() {
        return right;
    }
}
