package com.galois.transys.term;

import java.util.HashMap;
import java.util.Map;

/**
 * An interned symbol.
 *
 * Two symbols with the same name are the same object.
 */
public final class Sym implements Comparable<Sym> {
    private static final Map<String, Sym> table = new HashMap<String, Sym>();

    private final String name;

    private Sym(String name) {
        this.name = name;
    }

    /** Return the symbol named {@code name}. */
    public static Sym of(String name) {
        if (name == null) throw new NullPointerException("name");
        synchronized (table) {
            Sym s = table.get(name);
            if (s == null) {
                s = new Sym(name);
                table.put(name, s);
            }
            return s;
        }
    }

    public String name() {
        return name;
    }

    public int compareTo(Sym o) {
        return name.compareTo(o.name);
    }

    public String toString() {
        return name;
    }
}
