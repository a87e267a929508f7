package com.galois.transys.term;

/**
 * Moving terms between the current and next state.
 */
public final class TermOps {
    private TermOps() {}

    /** Moves state variables from one copy to the other. */
    private static final class StateShift implements VarMapper {
        private final TermStore store;
        private final State from;
        private final State to;

        StateShift(TermStore store, State from, State to) {
            this.store = store;
            this.from = from;
            this.to = to;
        }

        public Term map(VarTerm var) throws TermException {
            if (var.state() == null) return null;
            if (var.state() != from) {
                throw new TermException(
                    String.format("cannot move %s-state variable %s to the %s state",
                                  var.state().name().toLowerCase(), var.sym(),
                                  to.name().toLowerCase()));
            }
            return store.svar(var.sym(), var.type(), to);
        }
    }

    /**
     * Replace every current-state variable by its next-state copy.
     *
     * @throws TermException if {@code term} mentions a next-state variable
     */
    public static Term bump(TermStore store, Term term) throws TermException {
        return Zipper.mapVars(store, term, new StateShift(store, State.CURR, State.NEXT));
    }

    /**
     * Replace every next-state variable by its current-state copy.
     *
     * @throws TermException if {@code term} mentions a current-state variable
     */
    public static Term debump(TermStore store, Term term) throws TermException {
        return Zipper.mapVars(store, term, new StateShift(store, State.NEXT, State.CURR));
    }
}
