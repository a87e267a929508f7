package com.galois.transys.bmc;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.galois.transys.offset.Offset;
import com.galois.transys.offset.Offset2;
import com.galois.transys.solver.ActlitFactory;
import com.galois.transys.solver.Solver;
import com.galois.transys.solver.SolverException;
import com.galois.transys.solver.SolverFactory;
import com.galois.transys.sys.Property;
import com.galois.transys.sys.TransitionSystem;
import com.galois.transys.term.Model;
import com.galois.transys.term.Sym;
import com.galois.transys.term.Term;
import com.galois.transys.term.TermException;
import com.galois.transys.term.TermStore;
import com.galois.transys.term.VarTerm;

/**
 * Bounded model checking.
 *
 * <p>
 * A run unrolls the transition relation one step at a time. At depth
 * {@code k} it asks the solver whether some live property can be false at
 * {@code k}, through a fresh activation literal guarding the disjunction of
 * the negated live properties. A satisfiable answer disproves the properties
 * false in the model; an unsatisfiable one shows every live property holds
 * up to {@code k}.
 *
 * <p>
 * A run is sequential: one query at a time, and control messages are only
 * read between steps.
 */
public final class Bmc {
    private static final Logger log = LogManager.getFormatterLogger();

    private final TermStore store;
    private final BmcOptions options;
    private final SolverFactory solvers;

    public Bmc(TermStore store, BmcOptions options) {
        this(store, options, options.solverFactory());
    }

    public Bmc(TermStore store, BmcOptions options, SolverFactory solvers) {
        if (store == null) throw new NullPointerException("store");
        if (options == null) throw new NullPointerException("options");
        if (solvers == null) throw new NullPointerException("solvers");
        this.store = store;
        this.options = options;
        this.solvers = solvers;
    }

    /**
     * Check {@code properties} on {@code sys}, reporting on {@code channel}.
     *
     * The run ends with exactly one of: a {@link DoneAtEvent} (every property
     * was disproved or the maximum depth was reached), an {@link ErrorEvent}
     * followed by a {@link DoneEvent} with status {@link BmcStatus#ERROR},
     * or nothing if the channel was closed by the supervisor.
     */
    public void run(TransitionSystem sys, List<Property> properties, EventChannel channel) {
        Solver solver;
        try {
            solver = solvers.create();
        } catch (SolverException e) {
            fatal(channel, "could not create solver: " + e.getMessage(), e);
            return;
        }
        try {
            new Run(sys, solver, channel).go(properties);
        } catch (SolverException e) {
            fatal(channel, e.getMessage(), e);
        } catch (TermException e) {
            fatal(channel, e.getMessage(), e);
        } catch (RuntimeException e) {
            fatal(channel, e.getMessage(), e);
        } finally {
            try {
                solver.close();
            } catch (SolverException e) {
                log.warn("closing solver: %s", e.getMessage());
            }
        }
    }

    private static void fatal(EventChannel channel, String message, Exception e) {
        log.error("bmc failed: %s", message, e);
        channel.emit(new ErrorEvent(String.valueOf(message)));
        channel.emit(new DoneEvent(BmcStatus.ERROR));
    }

    /** The state of one run. */
    private final class Run {
        private final TransitionSystem sys;
        private final Solver solver;
        private final EventChannel channel;
        private final ActlitFactory actlits;
        private PropertyTracker props;

        Run(TransitionSystem sys, Solver solver, EventChannel channel) {
            this.sys = sys;
            this.solver = solver;
            this.channel = channel;
            this.actlits = new ActlitFactory(store);
        }

        private void log(String message) {
            log.info("%s", message);
            channel.emit(new LogEvent(message));
        }

        /**
         * Handle pending control messages.
         * @return false if the supervisor closed the channel
         */
        private boolean drainControl() {
            ControlMessage msg;
            while ((msg = channel.recv()) != null) {
                if (msg instanceof ForgetMessage) {
                    List<Sym> removed =
                        props.forget(solver, ((ForgetMessage) msg).getProperties());
                    log.info("forgot %s", removed);
                } else if (msg instanceof InvariantsMessage) {
                    log("received invariants, skipping");
                } else {
                    log.warn("%s", msg);
                    log("ignoring " + msg);
                }
            }
            return !channel.isClosed();
        }

        void go(List<Property> properties) throws SolverException, TermException {
            sys.declareAndDefineFunctions(solver);
            Offset2 k = Offset2.init();
            sys.assertInit(solver, k.curr());
            props = new PropertyTracker(store, properties, solver, actlits);
            log.info("bmc on %s: %d properties", sys.name(), properties.size());

            Integer max = options.getMax();
            while (true) {
                if (!drainControl()) {
                    log.info("control channel closed, stopping at %s", k.curr());
                    return;
                }
                if (props.noneLeft()) {
                    channel.emit(new DoneAtEvent(k.curr()));
                    return;
                }

                step(k);

                if (props.noneLeft()) {
                    channel.emit(new DoneAtEvent(k.curr()));
                    return;
                }
                if (max != null && k.curr().value() >= max) {
                    log.info("reached maximum depth %d", max);
                    channel.emit(new DoneAtEvent(k.curr()));
                    return;
                }

                sys.unroll(solver, k);
                k = k.next();
            }
        }

        private void step(Offset2 k) throws SolverException, TermException {
            Offset depth = k.curr();
            VarTerm lit = actlits.fresh(solver);
            solver.assertTerm(actlits.guard(lit, props.oneFalse()), k);

            List<Term> assumptions = new ArrayList<Term>(props.activationLiterals());
            assumptions.add(lit);

            if (solver.checkSatAssuming(assumptions, k)) {
                Model model = solver.getModel();
                List<Sym> falsified = props.getFalsified(solver, k);
                if (falsified.isEmpty()) {
                    throw new TermException(
                        "satisfiable at depth " + depth + " but no property is false");
                }
                props.forget(solver, falsified);
                log.info("disproved at %s: %s", depth, falsified);
                channel.emit(new DisprovedEvent(model, falsified, depth));
            } else {
                props.strengthen(solver, k);
                log.info("%s-true: %s", depth, props.stillTracked());
                channel.emit(new KTrueEvent(props.stillTracked(), depth));
            }
        }
    }
}
