package com.galois.transys.term;

import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.galois.transys.offset.Offset;
import com.galois.transys.proto.Protos;

/**
 * A valuation of variables returned by a solver.
 *
 * Entries for state variables carry the offset they were declared at;
 * other variables have no offset.
 */
public final class Model implements Iterable<Model.Entry> {
    /** The value of one variable. */
    public static final class Entry {
        private final Sym sym;
        private final Offset offset;
        private final Cst value;

        public Entry(Sym sym, Offset offset, Cst value) {
            if (sym == null) throw new NullPointerException("sym");
            if (value == null) throw new NullPointerException("value");
            this.sym = sym;
            this.offset = offset;
            this.value = value;
        }

        public Sym sym() {
            return sym;
        }

        /** The offset of a state variable, or {@code null}. */
        public Offset offset() {
            return offset;
        }

        public Cst value() {
            return value;
        }

        public Protos.ModelEntry getRep() {
            Protos.ModelEntry.Builder b = Protos.ModelEntry.newBuilder()
                .setSymbol(sym.name())
                .setValue(value.getValueRep());
            if (offset != null) b.setOffset(offset.value());
            return b.build();
        }

        public static Entry fromRep(Protos.ModelEntry e) {
            Offset o = e.hasOffset() ? Offset.of(e.getOffset()) : null;
            return new Entry(Sym.of(e.getSymbol()), o,
                             Cst.fromValueRep(e.getValue()));
        }

        public String toString() {
            String name = offset == null ? sym.name() : sym.name() + "@" + offset;
            return name + " = " + value;
        }
    }

    private final ImmutableList<Entry> entries;

    public Model(List<Entry> entries) {
        this.entries = ImmutableList.copyOf(entries);
    }

    public static Model empty() {
        return new Model(ImmutableList.<Entry>of());
    }

    public List<Entry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public Iterator<Entry> iterator() {
        return entries.iterator();
    }

    /**
     * Return the value of {@code sym} at {@code offset} (which is
     * {@code null} for a variable that is not a state variable).
     */
    public Cst get(Sym sym, Offset offset) {
        for (Entry e : entries) {
            if (e.sym == sym
                && (offset == null ? e.offset == null : offset.equals(e.offset))) {
                return e.value;
            }
        }
        return null;
    }

    public String toString() {
        return entries.toString();
    }
}
