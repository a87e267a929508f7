package com.galois.transys.solver;

import java.util.List;

import com.galois.transys.offset.Offset;
import com.galois.transys.offset.Offset2;
import com.galois.transys.term.FunSig;
import com.galois.transys.term.SmtWriter;
import com.galois.transys.term.Sym;
import com.galois.transys.term.Term;
import com.galois.transys.term.Type;
import com.galois.transys.term.TypedSym;

/**
 * Renders solver commands as SMT-LIB 2 text.
 */
final class SmtCommands {
    private SmtCommands() {}

    static String declareFun(Sym name, FunSig sig) {
        StringBuilder b = new StringBuilder("(declare-fun ");
        b.append(SmtWriter.quote(name)).append(" (");
        String sep = "";
        for (Type t : sig.argTypes()) {
            b.append(sep).append(t.smtName());
            sep = " ";
        }
        return b.append(") ").append(sig.resultType().smtName()).append(')').toString();
    }

    static String defineFun(Sym name, List<TypedSym> formals, Type resultType,
                            Term body) {
        StringBuilder b = new StringBuilder("(define-fun-rec ");
        b.append(SmtWriter.quote(name)).append(" (");
        String sep = "";
        for (TypedSym f : formals) {
            b.append(sep).append(f);
            sep = " ";
        }
        b.append(") ").append(resultType.smtName()).append(' ');
        // Bodies only mention formals, which are not state variables.
        SmtWriter.unanchored().write(body, b);
        return b.append(')').toString();
    }

    static String declareStateVar(Sym sym, Type type, Offset offset) {
        return "(declare-fun " + SmtWriter.stateVarName(sym, offset)
            + " () " + type.smtName() + ")";
    }

    static String declareActlit(Sym lit) {
        return "(declare-fun " + SmtWriter.quote(lit) + " () Bool)";
    }

    static String assertTerm(Term term, Offset2 offset) {
        StringBuilder b = new StringBuilder("(assert ");
        SmtWriter.at(offset).write(term, b);
        return b.append(')').toString();
    }

    static String checkSatAssuming(List<Term> assumptions, Offset2 offset) {
        StringBuilder b = new StringBuilder("(check-sat-assuming (");
        SmtWriter w = SmtWriter.at(offset);
        String sep = "";
        for (Term a : assumptions) {
            b.append(sep);
            w.write(a, b);
            sep = " ";
        }
        return b.append("))").toString();
    }

    static String getValue(List<Term> terms, Offset2 offset) {
        StringBuilder b = new StringBuilder("(get-value (");
        SmtWriter w = SmtWriter.at(offset);
        String sep = "";
        for (Term t : terms) {
            b.append(sep);
            w.write(t, b);
            sep = " ";
        }
        return b.append("))").toString();
    }
}
