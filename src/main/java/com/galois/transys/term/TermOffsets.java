package com.galois.transys.term;

import java.util.List;

import com.galois.transys.offset.Offset2;
import com.galois.transys.offset.SymbolicOffset;

/**
 * Computes the offsets an instantiated term refers to.
 */
public final class TermOffsets extends AbstractTermFold<SymbolicOffset> {
    private final Offset2 offset;

    private TermOffsets(Offset2 offset) {
        this.offset = offset;
    }

    /**
     * Return the offsets {@code term} refers to when instantiated at
     * {@code offset}.
     *
     * @throws com.galois.transys.offset.OffsetMergeException if the result
     *   would not be a valid symbolic offset
     */
    public static SymbolicOffset of(Term term, Offset2 offset) {
        try {
            return new TermOffsets(offset).fold(term);
        } catch (TermException e) {
            throw new IllegalStateException("offset computation cannot fail", e);
        }
    }

    private static SymbolicOffset mergeAll(List<SymbolicOffset> l) {
        SymbolicOffset r = SymbolicOffset.NONE;
        for (SymbolicOffset o : l) {
            r = r.merge(o);
        }
        return r;
    }

    protected SymbolicOffset constructVariable(VarTerm var) {
        if (var.state() == null) return SymbolicOffset.NONE;
        switch (var.state()) {
        case CURR:
            return SymbolicOffset.one(offset.curr());
        case NEXT:
            return SymbolicOffset.one(offset.nextOffset());
        default:
            throw new IllegalStateException("Unknown state " + var.state());
        }
    }

    protected SymbolicOffset constructConstant(CstTerm cst) {
        return SymbolicOffset.NONE;
    }

    protected SymbolicOffset constructOperator(OpTerm term, List<SymbolicOffset> args) {
        return mergeAll(args);
    }

    protected SymbolicOffset constructApplication(AppTerm term,
                                                  List<SymbolicOffset> args) {
        return mergeAll(args);
    }

    protected SymbolicOffset constructQuantifier(QuantTerm term, SymbolicOffset body) {
        return body;
    }

    protected SymbolicOffset constructLet(LetTerm term, List<SymbolicOffset> values,
                                          SymbolicOffset body) {
        return mergeAll(values).merge(body);
    }
}
