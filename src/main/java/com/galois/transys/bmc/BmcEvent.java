package com.galois.transys.bmc;

import java.util.ArrayList;
import java.util.List;

import com.galois.transys.offset.Offset;
import com.galois.transys.proto.Protos;
import com.galois.transys.term.Model;
import com.galois.transys.term.Sym;

/**
 * An event reported by the engine to its supervisor.
 */
public abstract class BmcEvent {
    BmcEvent() {}

    /** Return the protocol buffer representation of this event. */
    public abstract Protos.Event getRep();

    /**
     * Decode an event.
     * @throws IllegalArgumentException if the message is malformed
     */
    public static BmcEvent fromRep(Protos.Event e) {
        if (!e.hasCode()) {
            throw new IllegalArgumentException("Event has no recognized code.");
        }
        switch (e.getCode()) {
        case LogEvent:
            return new LogEvent(e.getMessage());
        case ErrorEvent:
            return new ErrorEvent(e.getMessage());
        case DoneEvent:
            return new DoneEvent(BmcStatus.fromRep(e.getStatus()));
        case DoneAtEvent:
            return new DoneAtEvent(Offset.of(e.getDepth()));
        case DisprovedAtEvent: {
            List<Model.Entry> entries = new ArrayList<Model.Entry>();
            for (Protos.ModelEntry m : e.getModelList()) {
                entries.add(Model.Entry.fromRep(m));
            }
            return new DisprovedEvent(new Model(entries), syms(e.getPropertyList()),
                                      Offset.of(e.getDepth()));
        }
        case KTrueEvent:
            return new KTrueEvent(syms(e.getPropertyList()), Offset.of(e.getDepth()));
        default:
            throw new IllegalArgumentException("Unknown event code " + e.getCode());
        }
    }

    static List<Sym> syms(List<String> names) {
        List<Sym> r = new ArrayList<Sym>(names.size());
        for (String n : names) {
            r.add(Sym.of(n));
        }
        return r;
    }

    static List<String> names(List<Sym> syms) {
        List<String> r = new ArrayList<String>(syms.size());
        for (Sym s : syms) {
            r.add(s.name());
        }
        return r;
    }
}
