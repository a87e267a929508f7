package com.galois.transys.term;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * Computes the type of a term, raising the error of the first ill-typed node
 * in traversal order.
 *
 * Function applications are checked against the signatures given at
 * construction.
 */
public final class TypeChecker extends AbstractTermFold<Type> {
    private final Map<Sym, FunSig> functions;

    public TypeChecker() {
        this(Collections.<Sym, FunSig>emptyMap());
    }

    public TypeChecker(Map<Sym, FunSig> functions) {
        this.functions = ImmutableMap.copyOf(functions);
    }

    /**
     * Return the type of {@code term}.
     *
     * @throws ArityException on an application with a wrong argument count
     * @throws TypeCheckException on a badly typed node
     */
    public Type typeOf(Term term) throws TermException {
        return fold(term);
    }

    /**
     * Return the type of {@code term} by following its leftmost
     * type-determining child, without checking anything.
     *
     * @return the type, or {@code null} if it depends on a function signature
     */
    public static Type shallowType(Term term) {
        Term t = term;
        while (true) {
            switch (t.kind()) {
            case VAR:
                return ((VarTerm) t).type();
            case CST:
                return ((CstTerm) t).type();
            case FORALL:
            case EXISTS:
                return Type.BOOL;
            case APP:
                return null;
            case LET:
                t = ((LetTerm) t).body();
                break;
            case OP: {
                OpTerm o = (OpTerm) t;
                Operator op = o.op();
                if (op == Operator.ITE) {
                    t = o.args().get(1);
                } else if (op == Operator.ADD || op == Operator.SUB
                           || op == Operator.MUL || op == Operator.DIV) {
                    t = o.args().get(0);
                } else {
                    return Type.BOOL;
                }
                break;
            }
            default:
                throw new IllegalStateException("Unknown term kind " + t.kind());
            }
        }
    }

    protected Type constructVariable(VarTerm var) throws TermException {
        if (!var.isStateVar()) {
            Type bound = lookupLet(var.sym());
            if (bound != null) return bound;
            Type quantified = lookupQuantified(var.sym());
            if (quantified != null && quantified != var.type()) {
                throw new TypeCheckException(
                    String.format("variable |%s| used as %s but bound as %s",
                                  var.sym(), var.type().smtName(),
                                  quantified.smtName()));
            }
        }
        return var.type();
    }

    protected Type constructConstant(CstTerm cst) {
        return cst.type();
    }

    protected Type constructOperator(OpTerm term, List<Type> args)
        throws TermException {
        return term.op().typeCheck(args);
    }

    protected Type constructApplication(AppTerm term, List<Type> args)
        throws TermException {
        FunSig sig = functions.get(term.fun());
        if (sig == null) {
            throw new TypeCheckException("unknown function |" + term.fun() + "|");
        }
        if (sig.argTypes().size() != args.size()) {
            throw new ArityException(
                String.format("function |%s| expects %d arguments, got %d",
                              term.fun(), sig.argTypes().size(), args.size()));
        }
        for (int i = 0; i != args.size(); ++i) {
            if (args.get(i) != sig.argTypes().get(i)) {
                throw new TypeCheckException(
                    String.format("expected %s, got %s",
                                  sig.argTypes().get(i).smtName(),
                                  args.get(i).smtName()), i);
            }
        }
        return sig.resultType();
    }

    protected Type constructQuantifier(QuantTerm term, Type body)
        throws TermException {
        if (body != Type.BOOL) {
            throw new TypeCheckException(
                "quantifier body must be Bool, got " + body.smtName());
        }
        return Type.BOOL;
    }

    protected Type constructLet(LetTerm term, List<Type> values, Type body) {
        return body;
    }
}
