package com.galois.transys.term;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import com.galois.transys.offset.Offset2;

/**
 * Evaluates a term to a constant under a valuation of its variables.
 *
 * A variable is resolved, in order, from the valuation, then from the
 * enclosing lets. A variable bound by an enclosing quantifier cannot be
 * evaluated. Any other variable takes the default value of its type.
 */
public final class Evaluator extends AbstractTermFold<Cst> {
    private final Map<VarTerm, Cst> valuation;

    public Evaluator(Map<VarTerm, Cst> valuation) {
        this.valuation = ImmutableMap.copyOf(valuation);
    }

    /**
     * Evaluate {@code term}.
     *
     * @throws EvalException on quantifiers, function applications and
     *   division by zero
     * @throws TypeCheckException on badly typed operator arguments
     */
    public Cst evaluate(Term term) throws TermException {
        return fold(term);
    }

    /**
     * Evaluate a two-state term at {@code offset} under a solver model.
     *
     * Model entries at the current offset give the current-state variables,
     * entries at the next offset the next-state variables, and entries
     * without an offset the other variables.
     */
    public static Cst eval(TermStore store, Term term, Offset2 offset, Model model)
        throws TermException {
        Map<VarTerm, Cst> valuation = new HashMap<VarTerm, Cst>();
        for (Model.Entry e : model) {
            Type type = e.value().type();
            if (e.offset() == null) {
                valuation.put(store.var(e.sym(), type), e.value());
            } else if (e.offset().equals(offset.curr())) {
                valuation.put(store.svar(e.sym(), type, State.CURR), e.value());
            } else if (e.offset().equals(offset.nextOffset())) {
                valuation.put(store.svar(e.sym(), type, State.NEXT), e.value());
            }
        }
        return new Evaluator(valuation).evaluate(term);
    }

    protected Cst constructVariable(VarTerm var) throws TermException {
        Cst v = valuation.get(var);
        if (v != null) return v;
        if (!var.isStateVar()) {
            v = lookupLet(var.sym());
            if (v != null) return v;
            if (lookupQuantified(var.sym()) != null) {
                throw new EvalException(
                    "cannot evaluate quantified variable |" + var.sym() + "|");
            }
        }
        return var.type().defaultValue();
    }

    protected Cst constructConstant(CstTerm cst) {
        return cst.value();
    }

    protected Cst constructOperator(OpTerm term, List<Cst> args)
        throws TermException {
        return term.op().eval(args);
    }

    protected Cst constructApplication(AppTerm term, List<Cst> args)
        throws TermException {
        throw new EvalException(
            "cannot evaluate application of function |" + term.fun() + "|");
    }

    protected Cst constructQuantifier(QuantTerm term, Cst body)
        throws TermException {
        throw new EvalException("cannot evaluate quantified term");
    }

    protected Cst constructLet(LetTerm term, List<Cst> values, Cst body) {
        return body;
    }
}
