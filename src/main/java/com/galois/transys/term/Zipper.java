package com.galois.transys.term;

import java.util.Arrays;
import java.util.List;

/**
 * Non-recursive rewriting of terms.
 */
public final class Zipper {
    private Zipper() {}

    /**
     * Rewrite every variable leaf of {@code term} with {@code mapper},
     * rebuilding the enclosing nodes through {@code store}.
     *
     * Nodes whose children are unchanged are returned as is, so a mapper
     * that changes nothing returns {@code term} itself.
     */
    public static Term mapVars(TermStore store, Term term, VarMapper mapper)
        throws TermException {
        return new Rewrite(store, mapper).fold(term);
    }

    private static final class Rewrite extends AbstractTermFold<Term> {
        private final TermStore store;
        private final VarMapper mapper;

        Rewrite(TermStore store, VarMapper mapper) {
            this.store = store;
            this.mapper = mapper;
        }

        private static boolean unchanged(List<Term> before, List<Term> after) {
            return Terms.sameElements(before, after);
        }

        protected Term constructVariable(VarTerm var) throws TermException {
            Term r = mapper.map(var);
            return r == null ? var : r;
        }

        protected Term constructConstant(CstTerm cst) {
            return cst;
        }

        protected Term constructOperator(OpTerm term, List<Term> args) {
            if (unchanged(term.args(), args)) return term;
            return store.op(term.op(), args);
        }

        protected Term constructApplication(AppTerm term, List<Term> args) {
            if (unchanged(term.args(), args)) return term;
            return store.app(term.fun(), args);
        }

        protected Term constructQuantifier(QuantTerm term, Term body) {
            if (body == term.body()) return term;
            if (term.isUniversal()) {
                return store.forall(term.bound(), body);
            } else {
                return store.exists(term.bound(), body);
            }
        }

        protected Term constructLet(LetTerm term, List<Term> values, Term body) {
            List<LetBinding> bindings = term.bindings();
            boolean same = body == term.body();
            for (int i = 0; same && i != values.size(); ++i) {
                same = values.get(i) == bindings.get(i).value();
            }
            if (same) return term;
            LetBinding[] rebuilt = new LetBinding[values.size()];
            for (int i = 0; i != rebuilt.length; ++i) {
                rebuilt[i] = new LetBinding(bindings.get(i).sym(), values.get(i));
            }
            return store.let(Arrays.asList(rebuilt), body);
        }
    }
}
