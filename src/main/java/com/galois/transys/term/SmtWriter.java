package com.galois.transys.term;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

import com.galois.transys.offset.Offset;
import com.galois.transys.offset.Offset2;

/**
 * Prints terms in SMT-LIB 2 syntax without recursion.
 *
 * A writer anchored at an {@link Offset2} prints the state variable
 * {@code x} as {@code |x@k|} where {@code k} is the current or next offset.
 * An unanchored writer prints {@code (state |x|)} and {@code (next |x|)}.
 * Other symbols are printed quoted, as {@code |x|}.
 */
public final class SmtWriter {
    private final Offset2 offset;

    private SmtWriter(Offset2 offset) {
        this.offset = offset;
    }

    public static SmtWriter at(Offset2 offset) {
        if (offset == null) throw new NullPointerException("offset");
        return new SmtWriter(offset);
    }

    public static SmtWriter unanchored() {
        return new SmtWriter(null);
    }

    /** Quote a symbol. */
    public static String quote(Sym sym) {
        return "|" + sym.name() + "|";
    }

    /** The solver-level name of state variable {@code sym} at {@code offset}. */
    public static String stateVarName(Sym sym, Offset offset) {
        return "|" + sym.name() + "@" + offset + "|";
    }

    public String write(Term term) {
        StringBuilder b = new StringBuilder();
        write(term, b);
        return b.toString();
    }

    /** Append the text of {@code term} to {@code out}. */
    public void write(Term term, StringBuilder out) {
        // Holds terms still to print and literal text, in output order.
        Deque<Object> todo = new ArrayDeque<Object>();
        todo.push(term);
        while (!todo.isEmpty()) {
            Object next = todo.pop();
            if (next instanceof String) {
                out.append((String) next);
                continue;
            }
            Term t = (Term) next;
            switch (t.kind()) {
            case VAR:
                out.append(variable((VarTerm) t));
                break;
            case CST:
                out.append(((CstTerm) t).value().toSmt());
                break;
            case OP: {
                OpTerm o = (OpTerm) t;
                List<Term> args = o.args();
                if (o.op() == Operator.EQ || o.op() == Operator.DISTINCT) {
                    // distinct is the negated equality chain, and a single
                    // argument is compared with itself.
                    if (o.op() == Operator.DISTINCT) {
                        out.append("(not ");
                        todo.push(")");
                    }
                    out.append("(=");
                    if (args.size() == 1) {
                        args = Arrays.asList(args.get(0), args.get(0));
                    }
                } else {
                    out.append('(').append(token(o));
                }
                pushArgs(todo, args);
                break;
            }
            case APP: {
                AppTerm a = (AppTerm) t;
                out.append('(').append(quote(a.fun()));
                pushArgs(todo, a.args());
                break;
            }
            case FORALL:
            case EXISTS: {
                QuantTerm q = (QuantTerm) t;
                out.append(q.isUniversal() ? "(forall (" : "(exists (");
                String sep = "";
                for (TypedSym s : q.bound()) {
                    out.append(sep).append('(').append(quote(s.sym()))
                        .append(' ').append(s.type().smtName()).append(')');
                    sep = " ";
                }
                out.append(") ");
                todo.push(")");
                todo.push(q.body());
                break;
            }
            case LET: {
                LetTerm l = (LetTerm) t;
                out.append("(let (");
                todo.push(")");
                todo.push(l.body());
                todo.push(") ");
                List<LetBinding> bindings = l.bindings();
                for (int i = bindings.size() - 1; i >= 0; --i) {
                    LetBinding binding = bindings.get(i);
                    todo.push(")");
                    todo.push(binding.value());
                    todo.push((i > 0 ? " (" : "(") + quote(binding.sym()) + " ");
                }
                break;
            }
            default:
                throw new IllegalStateException("Unknown term kind " + t.kind());
            }
        }
    }

    private static void pushArgs(Deque<Object> todo, List<Term> args) {
        todo.push(")");
        for (int i = args.size() - 1; i >= 0; --i) {
            todo.push(args.get(i));
            todo.push(" ");
        }
    }

    private static String token(OpTerm o) {
        if (o.op() == Operator.DIV
            && TypeChecker.shallowType(o.args().get(0)) == Type.INT) {
            return "div";
        }
        return o.op().token();
    }

    private String variable(VarTerm v) {
        if (v.state() == null) return quote(v.sym());
        if (offset == null) {
            return (v.state() == State.CURR ? "(state " : "(next ")
                + quote(v.sym()) + ")";
        }
        Offset o = v.state() == State.CURR ? offset.curr() : offset.nextOffset();
        return stateVarName(v.sym(), o);
    }
}
