package com.galois.transys.term;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;

/**
 * A bottom-up, left-to-right fold over a term that uses an explicit stack
 * instead of recursion.
 *
 * Subclasses compute one value per visited node from the values of its
 * children. While a node is visited the fold maintains two scope stacks:
 * <ul>
 * <li>let scopes, mapping the symbols bound by an enclosing let to the values
 *     computed for their bound terms (active in the let body only);</li>
 * <li>quantifier scopes, mapping the symbols bound by an enclosing quantifier
 *     to their declared types.</li>
 * </ul>
 * Lookups search the innermost scope first.
 *
 * A subterm shared by several parents is visited once per path from the
 * root; results are not memoized.
 *
 * @param <T> the value computed for each node; values must not be {@code null}
 */
public abstract class AbstractTermFold<T> {
    private static final class Frame<T> {
        final Term term;
        final ImmutableList<Term> children;
        final List<T> results;
        int next = 0;
        boolean letScopePushed = false;
        boolean quantScopePushed = false;

        Frame(Term term) {
            this.term = term;
            this.children = term.children();
            this.results = new ArrayList<T>(children.size());
        }
    }

    private final Deque<Map<Sym, T>> letScopes = new ArrayDeque<Map<Sym, T>>();
    private final Deque<Map<Sym, Type>> quantScopes = new ArrayDeque<Map<Sym, Type>>();

    /**
     * Fold the given term.
     *
     * @param root the term to fold
     * @return the value computed for {@code root}
     * @throws TermException if a construct method fails
     */
    public T fold(Term root) throws TermException {
        letScopes.clear();
        quantScopes.clear();

        Deque<Frame<T>> stack = new ArrayDeque<Frame<T>>();
        stack.push(enter(root));
        while (true) {
            Frame<T> f = stack.peek();
            if (f.next < f.children.size()) {
                if (f.term.kind() == Term.Kind.LET && f.next == f.children.size() - 1) {
                    pushLetScope((LetTerm) f.term, f.results);
                    f.letScopePushed = true;
                }
                Term child = f.children.get(f.next++);
                stack.push(enter(child));
                continue;
            }

            stack.pop();
            T value = construct(f);
            if (f.letScopePushed) letScopes.pop();
            if (f.quantScopePushed) quantScopes.pop();

            if (stack.isEmpty()) return value;
            stack.peek().results.add(value);
        }
    }

    private Frame<T> enter(Term t) {
        Frame<T> f = new Frame<T>(t);
        if (t instanceof QuantTerm) {
            Map<Sym, Type> scope = new HashMap<Sym, Type>();
            for (TypedSym s : ((QuantTerm) t).bound()) {
                scope.put(s.sym(), s.type());
            }
            quantScopes.push(scope);
            f.quantScopePushed = true;
        }
        return f;
    }

    private void pushLetScope(LetTerm let, List<T> values) {
        Map<Sym, T> scope = new HashMap<Sym, T>();
        List<LetBinding> bindings = let.bindings();
        for (int i = 0; i != bindings.size(); ++i) {
            scope.put(bindings.get(i).sym(), values.get(i));
        }
        letScopes.push(scope);
    }

    private T construct(Frame<T> f) throws TermException {
        Term t = f.term;
        switch (t.kind()) {
        case VAR:
            return constructVariable((VarTerm) t);
        case CST:
            return constructConstant((CstTerm) t);
        case OP:
            return constructOperator((OpTerm) t, f.results);
        case APP:
            return constructApplication((AppTerm) t, f.results);
        case FORALL:
        case EXISTS:
            return constructQuantifier((QuantTerm) t, f.results.get(0));
        case LET: {
            int n = f.results.size();
            return constructLet((LetTerm) t, f.results.subList(0, n - 1),
                                f.results.get(n - 1));
        }
        default:
            throw new IllegalStateException("Unknown term kind " + t.kind());
        }
    }

    /**
     * Return the value bound to {@code sym} by the innermost enclosing let,
     * or {@code null} if no enclosing let binds it.
     */
    protected T lookupLet(Sym sym) {
        Iterator<Map<Sym, T>> i = letScopes.iterator();
        while (i.hasNext()) {
            T v = i.next().get(sym);
            if (v != null) return v;
        }
        return null;
    }

    /**
     * Return the type of {@code sym} in the innermost enclosing quantifier
     * binding it, or {@code null}.
     */
    protected Type lookupQuantified(Sym sym) {
        Iterator<Map<Sym, Type>> i = quantScopes.iterator();
        while (i.hasNext()) {
            Type v = i.next().get(sym);
            if (v != null) return v;
        }
        return null;
    }

    protected abstract T constructVariable(VarTerm var) throws TermException;

    protected abstract T constructConstant(CstTerm cst) throws TermException;

    protected abstract T constructOperator(OpTerm term, List<T> args)
        throws TermException;

    protected abstract T constructApplication(AppTerm term, List<T> args)
        throws TermException;

    protected abstract T constructQuantifier(QuantTerm term, T body)
        throws TermException;

    /**
     * @param values the values of the bound terms, in binding order
     * @param body the value of the body, computed with the bindings in scope
     */
    protected abstract T constructLet(LetTerm term, List<T> values, T body)
        throws TermException;
}
