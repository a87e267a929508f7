package com.galois.transys.bmc;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.galois.transys.offset.Offset2;
import com.galois.transys.solver.ActlitFactory;
import com.galois.transys.solver.Solver;
import com.galois.transys.solver.SolverException;
import com.galois.transys.sys.Property;
import com.galois.transys.term.BoolValue;
import com.galois.transys.term.Cst;
import com.galois.transys.term.Sym;
import com.galois.transys.term.Term;
import com.galois.transys.term.TermStore;
import com.galois.transys.term.TypeCheckException;
import com.galois.transys.term.VarTerm;

/**
 * The set of live properties of a run.
 *
 * Every property owns an activation literal for the whole run. Lemmas about
 * a property are asserted under its literal, and queries assume the literals
 * of live properties only, so forgetting a property disables its lemmas
 * without retracting anything from the solver.
 */
public final class PropertyTracker {
    private static final Logger log = LogManager.getFormatterLogger();

    private static final class Tracked {
        final Property property;
        final VarTerm actlit;

        Tracked(Property property, VarTerm actlit) {
            this.property = property;
            this.actlit = actlit;
        }
    }

    private final TermStore store;
    private final ActlitFactory actlits;
    private final Map<Sym, Tracked> live = new LinkedHashMap<Sym, Tracked>();

    /**
     * Track {@code properties}, declaring one activation literal for each.
     */
    public PropertyTracker(TermStore store, List<Property> properties, Solver solver,
                           ActlitFactory actlits) throws SolverException {
        this.store = store;
        this.actlits = actlits;
        for (Property p : properties) {
            if (live.containsKey(p.id())) {
                throw new IllegalArgumentException("duplicate property " + p.id());
            }
            live.put(p.id(), new Tracked(p, actlits.fresh(solver)));
        }
    }

    /**
     * Stop tracking the given properties. Unknown or already removed
     * properties are ignored.
     *
     * @return the properties that were live and are now forgotten
     */
    public List<Sym> forget(Solver solver, Collection<Sym> ids) {
        List<Sym> removed = new ArrayList<Sym>();
        for (Sym id : ids) {
            if (live.remove(id) != null) {
                removed.add(id);
            } else {
                log.debug("forget: %s is not live", id);
            }
        }
        return removed;
    }

    public boolean noneLeft() {
        return live.isEmpty();
    }

    /**
     * The disjunction of the negations of the live properties.
     * @throws IllegalStateException if no property is live
     */
    public Term oneFalse() {
        if (live.isEmpty()) {
            throw new IllegalStateException("no live property");
        }
        List<Term> negs = new ArrayList<Term>(live.size());
        for (Tracked t : live.values()) {
            negs.add(store.not(t.property.body()));
        }
        return negs.size() == 1 ? negs.get(0) : store.or(negs);
    }

    /** Activation literals of the live properties. */
    public List<Term> activationLiterals() {
        List<Term> r = new ArrayList<Term>(live.size());
        for (Tracked t : live.values()) {
            r.add(t.actlit);
        }
        return r;
    }

    /**
     * The live properties that are false at {@code offset} in the model of
     * the last satisfiable query of {@code solver}. Values come from the
     * solver, so properties may apply declared and defined functions.
     *
     * @throws SolverException if the solver cannot report the values
     * @throws TypeCheckException if a property does not have a Boolean value
     */
    public List<Sym> getFalsified(Solver solver, Offset2 offset)
        throws SolverException, TypeCheckException {
        List<Tracked> tracked = new ArrayList<Tracked>(live.values());
        if (tracked.isEmpty()) return new ArrayList<Sym>();
        List<Term> bodies = new ArrayList<Term>(tracked.size());
        for (Tracked t : tracked) {
            bodies.add(t.property.body());
        }
        List<Cst> values = solver.getValues(bodies, offset);
        List<Sym> r = new ArrayList<Sym>();
        for (int i = 0; i != tracked.size(); ++i) {
            Cst v = values.get(i);
            Property p = tracked.get(i).property;
            if (!(v instanceof BoolValue)) {
                throw new TypeCheckException("property " + p.id() + " evaluated to " + v);
            }
            if (!((BoolValue) v).getValue()) {
                r.add(p.id());
            }
        }
        return r;
    }

    /** Identifiers of the live properties. */
    public List<Sym> stillTracked() {
        return new ArrayList<Sym>(live.keySet());
    }

    /**
     * Record that every live property holds at {@code offset}: asserts
     * {@code actlit_p => p} for each of them.
     */
    public void strengthen(Solver solver, Offset2 offset) throws SolverException {
        for (Tracked t : live.values()) {
            solver.assertTerm(actlits.guard(t.actlit, t.property.body()), offset);
        }
    }
}
