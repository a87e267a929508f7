package com.galois.transys.bmc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.galois.transys.offset.Offset;
import com.galois.transys.term.Model;
import com.galois.transys.term.Sym;

/**
 * Collects the events of a run.
 */
public final class BmcResult implements EventConsumer {
    private final List<BmcEvent> events = new ArrayList<BmcEvent>();
    private final List<Integer> kTrueDepths = new ArrayList<Integer>();
    private final Map<Sym, Offset> disprovedAt = new LinkedHashMap<Sym, Offset>();
    private final Map<Sym, Model> counterexamples = new LinkedHashMap<Sym, Model>();
    private final List<String> errors = new ArrayList<String>();
    private Offset doneAt = null;
    private boolean failed = false;

    public synchronized void acceptEvent(BmcEvent event) {
        events.add(event);
        if (event instanceof KTrueEvent) {
            kTrueDepths.add(((KTrueEvent) event).getDepth().value());
        } else if (event instanceof DisprovedEvent) {
            DisprovedEvent d = (DisprovedEvent) event;
            for (Sym p : d.getProperties()) {
                disprovedAt.put(p, d.getDepth());
                counterexamples.put(p, d.getModel());
            }
        } else if (event instanceof ErrorEvent) {
            errors.add(((ErrorEvent) event).getMessage());
        } else if (event instanceof DoneEvent) {
            failed |= ((DoneEvent) event).getStatus() == BmcStatus.ERROR;
        } else if (event instanceof DoneAtEvent) {
            doneAt = ((DoneAtEvent) event).getDepth();
        }
    }

    /** Every event received, in order. */
    public synchronized List<BmcEvent> getEvents() {
        return new ArrayList<BmcEvent>(events);
    }

    /** Depths of the k-true events, in order. */
    public synchronized List<Integer> getKTrueDepths() {
        return new ArrayList<Integer>(kTrueDepths);
    }

    /** Depth at which each disproved property was found false. */
    public synchronized Map<Sym, Offset> getDisprovedAt() {
        return Collections.unmodifiableMap(new LinkedHashMap<Sym, Offset>(disprovedAt));
    }

    /** The counterexample of a disproved property, or {@code null}. */
    public synchronized Model getCounterexample(Sym property) {
        return counterexamples.get(property);
    }

    public synchronized List<String> getErrors() {
        return new ArrayList<String>(errors);
    }

    /** Depth of the final {@link DoneAtEvent}, or {@code null}. */
    public synchronized Offset getDoneAt() {
        return doneAt;
    }

    /**
     * The outcome: error if the run failed, unsafe if a property was
     * disproved, safe (up to the depth reached) otherwise.
     */
    public synchronized BmcStatus getStatus() {
        if (failed || !errors.isEmpty()) return BmcStatus.ERROR;
        if (!disprovedAt.isEmpty()) return BmcStatus.UNSAFE;
        return BmcStatus.SAFE;
    }
}
