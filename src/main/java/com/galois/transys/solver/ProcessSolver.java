package com.galois.transys.solver;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.galois.transys.offset.Offset;
import com.galois.transys.offset.Offset2;
import com.galois.transys.term.BoolValue;
import com.galois.transys.term.Cst;
import com.galois.transys.term.FunSig;
import com.galois.transys.term.IntegerValue;
import com.galois.transys.term.Model;
import com.galois.transys.term.RationalValue;
import com.galois.transys.term.Sym;
import com.galois.transys.term.Term;
import com.galois.transys.term.Type;
import com.galois.transys.term.TypedSym;

/**
 * A solver session talking SMT-LIB 2 to an external process such as
 * {@code z3 -in -smt2}.
 *
 * <p>
 * Implementation note: the process's standard error is forwarded to the log
 * by one thread, and its standard output is parsed into s-expressions by a
 * dedicated listener thread that queues them. Commands are sent with
 * {@code :print-success} enabled, so every command is answered.
 */
public final class ProcessSolver implements Solver {
    private static final Logger log = LogManager.getFormatterLogger();

    /** Queued when the solver output stream ends. */
    private static final Object END_OF_OUTPUT = new Object();

    private static final class Declared {
        final Sym sym;
        final Offset offset;
        final Type type;

        Declared(Sym sym, Offset offset, Type type) {
            this.sym = sym;
            this.offset = offset;
            this.type = type;
        }
    }

    private final Process process;
    private final Writer request;
    private final PrintWriter trace;

    /** Responses queued up by the listener thread. */
    private final BlockingDeque<Object> queuedResponses = new LinkedBlockingDeque<Object>();

    /** Are we in the process of shutting down the solver? */
    private volatile boolean closing = false;

    /** State variable copies by their unquoted solver name. */
    private final Map<String, Declared> stateVars = new LinkedHashMap<String, Declared>();

    private ProcessSolver(Process process, PrintWriter trace) {
        this.process = process;
        this.request = new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8);
        this.trace = trace;
    }

    /**
     * Launch a solver process.
     *
     * @param command the command line, for instance {@code [z3, -in, -smt2]}
     * @param smtLog file receiving the commands sent, or {@code null}
     * @throws SolverException if the process cannot be started or rejects the
     *   initial options
     */
    public static ProcessSolver launch(List<String> command, Path smtLog)
        throws SolverException {
        if (command == null) throw new NullPointerException("command");
        if (command.isEmpty()) throw new IllegalArgumentException("command");

        final Process p;
        try {
            p = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new SolverException("could not launch " + command + ": " + e.getMessage(), e);
        }

        PrintWriter w = null;
        if (smtLog != null) {
            try {
                w = new PrintWriter(Files.newBufferedWriter(smtLog, StandardCharsets.UTF_8));
            } catch (IOException e) {
                p.destroy();
                throw new SolverException("could not open SMT log " + smtLog, e);
            }
        }

        final String name = command.get(0);
        Runnable errTask = new Runnable() {
                public void run() {
                    try {
                        BufferedReader r = new BufferedReader(
                            new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8));
                        while (true) {
                            String s = r.readLine();
                            if (s == null) {
                                log.debug("%s terminated", name);
                                return;
                            }
                            log.warn("%s: %s", name, s);
                        }
                    } catch (IOException e) {
                        log.error("%s error: %s", name, e.getMessage());
                    }
                }
            };
        Thread errThread = new Thread(errTask, name + "-stderr");
        errThread.setDaemon(true);
        errThread.start();

        ProcessSolver s = new ProcessSolver(p, w);
        s.startResponseListenerThread(name);
        try {
            s.command("(set-option :print-success true)");
            s.command("(set-option :produce-models true)");
        } catch (SolverException e) {
            s.closing = true;
            p.destroyForcibly();
            throw e;
        }
        log.debug("started %s", command);
        return s;
    }

    /**
     * Start a dedicated thread parsing solver output into the response queue.
     * The thread exits when the output stream is closed.
     */
    private void startResponseListenerThread(final String solverName) {
        Thread t = new Thread(solverName + "-responses") {
                public void run() {
                    SExprReader reader = new SExprReader(
                        new BufferedReader(new InputStreamReader(process.getInputStream(),
                                                                 StandardCharsets.UTF_8)));
                    try {
                        while (true) {
                            Object r = reader.next();
                            if (r == null) break;
                            log.trace("%s > %s", solverName, r);
                            queuedResponses.putLast(r);
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } catch (IOException e) {
                        log.error("reading %s output: %s", solverName, e.getMessage());
                    }
                    if (!closing) {
                        log.error("%s output closed unexpectedly", solverName);
                    }
                    queuedResponses.offerLast(END_OF_OUTPUT);
                }
            };
        t.setDaemon(true);
        t.start();
    }

    private void send(String command) throws SolverException {
        log.trace("solver < %s", command);
        if (trace != null) {
            trace.println(command);
            trace.flush();
        }
        try {
            request.write(command);
            request.write('\n');
            request.flush();
        } catch (IOException e) {
            throw new SolverException("writing to solver: " + e.getMessage(), e);
        }
    }

    /** Get the next queued response. Blocks until one is available. */
    private Object getNextResponse() throws SolverException {
        Object r;
        try {
            r = queuedResponses.takeFirst();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SolverException("interrupted while waiting for the solver", e);
        }
        if (r == END_OF_OUTPUT) {
            queuedResponses.offerFirst(END_OF_OUTPUT);
            throw new SolverException("solver terminated");
        }
        if (r instanceof List) {
            List<?> l = (List<?>) r;
            if (!l.isEmpty() && "error".equals(l.get(0))) {
                throw new SolverException("solver error: "
                                          + (l.size() > 1 ? unquote(l.get(1)) : ""));
            }
        }
        return r;
    }

    /** Send a command answered by {@code success}. */
    private void command(String command) throws SolverException {
        send(command);
        Object r = getNextResponse();
        if (!"success".equals(r)) {
            throw new SolverException("expected success for " + command + ", got " + r);
        }
    }

    public void declareFun(Sym name, FunSig sig) throws SolverException {
        command(SmtCommands.declareFun(name, sig));
    }

    public void defineFun(Sym name, List<TypedSym> formals, Type resultType, Term body)
        throws SolverException {
        command(SmtCommands.defineFun(name, formals, resultType, body));
    }

    public void declareStateVars(List<TypedSym> vars, Offset offset)
        throws SolverException {
        for (TypedSym v : vars) {
            command(SmtCommands.declareStateVar(v.sym(), v.type(), offset));
            stateVars.put(v.sym().name() + "@" + offset,
                          new Declared(v.sym(), offset, v.type()));
        }
    }

    public void declareActlit(Sym lit) throws SolverException {
        command(SmtCommands.declareActlit(lit));
    }

    public void assertTerm(Term term, Offset2 offset) throws SolverException {
        command(SmtCommands.assertTerm(term, offset));
    }

    public boolean checkSatAssuming(List<Term> assumptions, Offset2 offset)
        throws SolverException {
        send(SmtCommands.checkSatAssuming(assumptions, offset));
        Object r = getNextResponse();
        log.debug("check-sat-assuming at %s: %s", offset, r);
        if ("sat".equals(r)) return true;
        if ("unsat".equals(r)) return false;
        if ("unknown".equals(r)) {
            throw new SolverException("solver returned unknown");
        }
        throw new SolverException("unexpected check-sat answer " + r);
    }

    public Model getModel() throws SolverException {
        send("(get-model)");
        Object r = getNextResponse();
        if (!(r instanceof List)) {
            throw new SolverException("unexpected get-model answer " + r);
        }
        Map<String, Cst> values = new HashMap<String, Cst>();
        for (Object def : (List<?>) r) {
            // Older solvers prefix the definitions with the atom "model".
            if ("model".equals(def)) continue;
            if (!(def instanceof List)) {
                throw new SolverException("unexpected model entry " + def);
            }
            List<?> d = (List<?>) def;
            if (d.size() != 5 || !"define-fun".equals(d.get(0))) {
                throw new SolverException("unexpected model entry " + def);
            }
            String name = unquote(d.get(1));
            Declared decl = stateVars.get(name);
            if (decl == null) continue;
            values.put(name, parseValue(d.get(4), decl.type));
        }

        List<Model.Entry> entries = new ArrayList<Model.Entry>();
        for (Map.Entry<String, Declared> e : stateVars.entrySet()) {
            Declared decl = e.getValue();
            Cst v = values.get(e.getKey());
            // Unconstrained variables can be omitted by the solver.
            if (v == null) v = decl.type.defaultValue();
            entries.add(new Model.Entry(decl.sym, decl.offset, v));
        }
        return new Model(entries);
    }

    public List<Cst> getValues(List<Term> terms, Offset2 offset) throws SolverException {
        send(SmtCommands.getValue(terms, offset));
        Object r = getNextResponse();
        if (!(r instanceof List) || ((List<?>) r).size() != terms.size()) {
            throw new SolverException("unexpected get-value answer " + r);
        }
        List<Cst> values = new ArrayList<Cst>(terms.size());
        for (Object pair : (List<?>) r) {
            if (!(pair instanceof List) || ((List<?>) pair).size() != 2) {
                throw new SolverException("unexpected get-value entry " + pair);
            }
            values.add(parseValue(((List<?>) pair).get(1)));
        }
        return values;
    }

    private static String unquote(Object atom) {
        String s = String.valueOf(atom);
        if (s.length() >= 2
            && ((s.startsWith("|") && s.endsWith("|"))
                || (s.startsWith("\"") && s.endsWith("\"")))) {
            return s.substring(1, s.length() - 1);
        }
        return s;
    }

    /** Parse a model value: a literal, {@code (- v)} or {@code (/ n d)}. */
    private static Cst parseValue(Object v, Type type) throws SolverException {
        switch (type) {
        case BOOL:
            if ("true".equals(v)) return BoolValue.TRUE;
            if ("false".equals(v)) return BoolValue.FALSE;
            break;
        case INT: {
            RationalValue r = parseNumber(v);
            if (r != null && r.denominator().equals(BigInteger.ONE)) {
                return new IntegerValue(r.numerator());
            }
            break;
        }
        case RAT: {
            RationalValue r = parseNumber(v);
            if (r != null) return r;
            break;
        }
        default:
            throw new IllegalStateException("Unknown type " + type);
        }
        throw new SolverException("unexpected " + type.smtName() + " model value " + v);
    }

    /**
     * Parse a value of unknown type. Numerals without a decimal point or a
     * division are integers.
     */
    private static Cst parseValue(Object v) throws SolverException {
        if ("true".equals(v)) return BoolValue.TRUE;
        if ("false".equals(v)) return BoolValue.FALSE;
        RationalValue r = parseNumber(v);
        if (r == null) {
            throw new SolverException("unexpected value " + v);
        }
        return isIntegerLiteral(v) ? new IntegerValue(r.numerator()) : r;
    }

    private static boolean isIntegerLiteral(Object v) {
        if (v instanceof String) {
            return ((String) v).indexOf('.') < 0;
        }
        List<?> l = (List<?>) v;
        return l.size() == 2 && "-".equals(l.get(0)) && isIntegerLiteral(l.get(1));
    }

    private static RationalValue parseNumber(Object v) {
        if (v instanceof String) {
            try {
                BigDecimal d = new BigDecimal((String) v);
                BigInteger unscaled = d.unscaledValue();
                int scale = d.scale();
                if (scale <= 0) {
                    return new RationalValue(unscaled.multiply(BigInteger.TEN.pow(-scale)));
                }
                return new RationalValue(unscaled, BigInteger.TEN.pow(scale));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (!(v instanceof List)) return null;
        List<?> l = (List<?>) v;
        if (l.size() == 2 && "-".equals(l.get(0))) {
            RationalValue r = parseNumber(l.get(1));
            return r == null ? null : r.negate();
        }
        if (l.size() == 3 && "/".equals(l.get(0))) {
            RationalValue n = parseNumber(l.get(1));
            RationalValue d = parseNumber(l.get(2));
            if (n == null || d == null || d.numerator().signum() == 0) return null;
            return n.div(d);
        }
        return null;
    }

    /**
     * Ask the solver to exit and release the process. The process is
     * destroyed if it does not exit in time or if the exit request fails.
     */
    public void close() throws SolverException {
        synchronized (this) {
            if (closing) return;
            closing = true;
        }
        boolean exited = false;
        try {
            send("(exit)");
            request.close();
            exited = process.waitFor(5, TimeUnit.SECONDS);
            if (!exited) {
                log.warn("solver did not exit, destroying it");
            }
        } catch (IOException e) {
            throw new SolverException("closing solver: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SolverException("interrupted while closing solver", e);
        } finally {
            if (trace != null) trace.close();
            try {
                request.close();
            } catch (IOException e) {
                log.debug("closing solver input: %s", e.getMessage());
            }
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }
}
