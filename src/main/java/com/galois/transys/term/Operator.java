package com.galois.transys.term;

import java.util.List;

/**
 * The built-in operators.
 *
 * Each operator knows its SMT-LIB token, its arity, how to type-check a list
 * of argument types and how to evaluate a list of constants.
 */
public enum Operator {
    EQ("=", -1),
    ITE("ite", 3),
    NOT("not", 1),
    AND("and", -1),
    OR("or", -1),
    IMPL("=>", -1),
    XOR("xor", -1),
    DISTINCT("distinct", -1),
    ADD("+", -1),
    SUB("-", -1),
    MUL("*", -1),
    DIV("/", -1),
    LE("<=", 2),
    GE(">=", 2),
    LT("<", 2),
    GT(">", 2);

    private final String token;
    private final int arity;

    Operator(String token, int arity) {
        this.token = token;
        this.arity = arity;
    }

    /** The SMT-LIB token of this operator. */
    public String token() {
        return token;
    }

    /** The fixed number of arguments, or {@code -1} for variadic operators. */
    public int arity() {
        return arity;
    }

    private void checkArity(int n) throws ArityException {
        if (arity >= 0 && n != arity) {
            throw new ArityException(
                String.format("%s expects %d arguments, got %d", token, arity, n));
        }
    }

    /**
     * Compute the result type of this operator applied to arguments of the
     * given types.
     *
     * @throws ArityException on a wrong number of arguments
     * @throws TypeCheckException on a badly typed argument
     */
    public Type typeCheck(List<Type> args) throws TermException {
        checkArity(args.size());
        switch (this) {
        case EQ:
        case DISTINCT: {
            if (args.isEmpty()) {
                throw new ArityException(token + " expects at least one argument");
            }
            Type first = args.get(0);
            for (int i = 1; i < args.size(); ++i) {
                if (args.get(i) != first) {
                    throw new TypeCheckException(
                        String.format("expected %s, got %s", first.smtName(),
                                      args.get(i).smtName()), i);
                }
            }
            return Type.BOOL;
        }
        case ITE:
            if (args.get(0) != Type.BOOL) {
                throw new TypeCheckException(
                    "expected Bool condition, got " + args.get(0).smtName(), 0);
            }
            if (args.get(1) != args.get(2)) {
                throw new TypeCheckException(
                    String.format("branches have types %s and %s",
                                  args.get(1).smtName(), args.get(2).smtName()), 2);
            }
            return args.get(1);
        case NOT:
        case AND:
        case OR:
        case IMPL:
        case XOR:
            for (int i = 0; i < args.size(); ++i) {
                if (args.get(i) != Type.BOOL) {
                    throw new TypeCheckException(
                        "expected Bool, got " + args.get(i).smtName(), i);
                }
            }
            return Type.BOOL;
        case ADD:
        case SUB:
        case MUL:
        case DIV:
            return checkArith(args);
        case LE:
        case GE:
        case LT:
        case GT:
            checkArith(args);
            return Type.BOOL;
        default:
            throw new IllegalStateException("Unknown operator " + this);
        }
    }

    private Type checkArith(List<Type> args) throws TermException {
        if (args.isEmpty()) {
            throw new ArityException(token + " expects at least one argument");
        }
        Type first = args.get(0);
        if (!first.isArith()) {
            throw new TypeCheckException(
                "expected Int or Real, got " + first.smtName(), 0);
        }
        for (int i = 1; i < args.size(); ++i) {
            if (args.get(i) != first) {
                throw new TypeCheckException(
                    String.format("expected %s, got %s", first.smtName(),
                                  args.get(i).smtName()), i);
            }
        }
        return first;
    }

    /**
     * Evaluate this operator on constants.
     *
     * Boolean connectives look at every argument before producing a result,
     * so a badly typed argument is reported even when an earlier argument
     * already determines the value.
     *
     * @throws ArityException on a wrong number of arguments
     * @throws TypeCheckException on a badly typed argument
     * @throws EvalException on division by zero
     */
    public Cst eval(List<Cst> args) throws TermException {
        checkArity(args.size());
        switch (this) {
        case EQ:
            return BoolValue.of(allEqual(args));
        case DISTINCT:
            return BoolValue.of(!allEqual(args));
        case ITE:
            return bool(args, 0) ? args.get(1) : args.get(2);
        case NOT:
            return BoolValue.of(!bool(args, 0));
        case AND: {
            boolean res = true;
            for (int i = 0; i < args.size(); ++i) {
                res = bool(args, i) && res;
            }
            return BoolValue.of(res);
        }
        case OR: {
            boolean res = false;
            for (int i = 0; i < args.size(); ++i) {
                res = bool(args, i) || res;
            }
            return BoolValue.of(res);
        }
        case IMPL: {
            boolean[] vals = new boolean[args.size()];
            for (int i = 0; i < args.size(); ++i) {
                vals[i] = bool(args, i);
            }
            // a => b => c reads a => (b => c).
            boolean res = vals.length == 0 || vals[vals.length - 1];
            for (int i = vals.length - 2; i >= 0; --i) {
                res = !vals[i] || res;
            }
            return BoolValue.of(res);
        }
        case XOR: {
            boolean res = false;
            for (int i = 0; i < args.size(); ++i) {
                res = bool(args, i) ^ res;
            }
            return BoolValue.of(res);
        }
        case ADD:
        case SUB:
        case MUL:
        case DIV:
            return arith(args);
        case LE:
        case GE:
        case LT:
        case GT:
            return BoolValue.of(compare(args));
        default:
            throw new IllegalStateException("Unknown operator " + this);
        }
    }

    private static boolean allEqual(List<Cst> args) throws ArityException {
        if (args.isEmpty()) {
            throw new ArityException("expected at least one argument");
        }
        Cst first = args.get(0);
        for (int i = 1; i < args.size(); ++i) {
            if (!first.equals(args.get(i))) return false;
        }
        return true;
    }

    private static boolean bool(List<Cst> args, int i) throws TypeCheckException {
        Cst c = args.get(i);
        if (!(c instanceof BoolValue)) {
            throw new TypeCheckException("expected Bool, got " + c.type().smtName(), i);
        }
        return ((BoolValue) c).getValue();
    }

    private Cst arith(List<Cst> args) throws TermException {
        if (args.isEmpty()) {
            throw new ArityException(token + " expects at least one argument");
        }
        Cst first = args.get(0);
        if (first instanceof IntegerValue) {
            IntegerValue acc = (IntegerValue) first;
            if (this == SUB && args.size() == 1) return acc.negate();
            for (int i = 1; i < args.size(); ++i) {
                if (!(args.get(i) instanceof IntegerValue)) {
                    throw new TypeCheckException(
                        "expected Int, got " + args.get(i).type().smtName(), i);
                }
                IntegerValue v = (IntegerValue) args.get(i);
                switch (this) {
                case ADD: acc = acc.add(v); break;
                case SUB: acc = acc.sub(v); break;
                case MUL: acc = acc.mul(v); break;
                case DIV:
                    if (v.getValue().signum() == 0) {
                        throw new EvalException("division by zero");
                    }
                    acc = acc.div(v);
                    break;
                default:
                    throw new IllegalStateException("Not arithmetic " + this);
                }
            }
            return acc;
        } else if (first instanceof RationalValue) {
            RationalValue acc = (RationalValue) first;
            if (this == SUB && args.size() == 1) return acc.negate();
            for (int i = 1; i < args.size(); ++i) {
                if (!(args.get(i) instanceof RationalValue)) {
                    throw new TypeCheckException(
                        "expected Real, got " + args.get(i).type().smtName(), i);
                }
                RationalValue v = (RationalValue) args.get(i);
                switch (this) {
                case ADD: acc = acc.add(v); break;
                case SUB: acc = acc.sub(v); break;
                case MUL: acc = acc.mul(v); break;
                case DIV:
                    if (v.numerator().signum() == 0) {
                        throw new EvalException("division by zero");
                    }
                    acc = acc.div(v);
                    break;
                default:
                    throw new IllegalStateException("Not arithmetic " + this);
                }
            }
            return acc;
        } else {
            throw new TypeCheckException(
                "expected Int or Real, got " + first.type().smtName(), 0);
        }
    }

    private boolean compare(List<Cst> args) throws TermException {
        Cst lhs = args.get(0);
        Cst rhs = args.get(1);
        int c;
        if (lhs instanceof IntegerValue) {
            if (!(rhs instanceof IntegerValue)) {
                throw new TypeCheckException(
                    "expected Int, got " + rhs.type().smtName(), 1);
            }
            c = ((IntegerValue) lhs).compareTo((IntegerValue) rhs);
        } else if (lhs instanceof RationalValue) {
            if (!(rhs instanceof RationalValue)) {
                throw new TypeCheckException(
                    "expected Real, got " + rhs.type().smtName(), 1);
            }
            c = ((RationalValue) lhs).compareTo((RationalValue) rhs);
        } else {
            throw new TypeCheckException(
                "expected Int or Real, got " + lhs.type().smtName(), 0);
        }
        switch (this) {
        case LE: return c <= 0;
        case GE: return c >= 0;
        case LT: return c < 0;
        case GT: return c > 0;
        default:
            throw new IllegalStateException("Not a comparison " + this);
        }
    }
}
