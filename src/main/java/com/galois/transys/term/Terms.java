package com.galois.transys.term;

import java.util.List;

/** Helpers for comparing canonical child lists. */
final class Terms {
    private Terms() {}

    static boolean sameElements(List<Term> a, List<Term> b) {
        if (a.size() != b.size()) return false;
        for (int i = 0; i != a.size(); ++i) {
            if (a.get(i) != b.get(i)) return false;
        }
        return true;
    }

    static int identityHash(List<Term> l) {
        int h = 1;
        for (Term t : l) {
            h = 31 * h + t.id();
        }
        return h;
    }
}
