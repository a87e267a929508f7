package com.galois.transys.bmc;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Properties;

import com.galois.transys.solver.SolverFactory;
import com.galois.transys.solver.SolverKind;

/**
 * Options of a bounded model checking run.
 */
public class BmcOptions {
    /** Resource read by {@link #load()}. */
    public static final String RESOURCE = "transys.properties";

    public static final String MAX_KEY = "bmc.max";
    public static final String SOLVER_KEY = "bmc.solver";
    public static final String SOLVER_COMMAND_KEY = "bmc.solver_command";
    public static final String SMT_LOG_KEY = "bmc.smt_log";

    private Integer max = null;
    private SolverKind solver = SolverKind.Z3;
    private String solverCommand = "z3 -in -smt2";
    private Path smtLog = null;

    /**
     * Set the maximum depth checked. The run stops after checking this depth.
     * {@code null} means unbounded.
     */
    public void setMax(Integer max) {
        if (max != null && max < 0) {
            throw new IllegalArgumentException("max must be non-negative: " + max);
        }
        this.max = max;
    }

    public Integer getMax() {
        return max;
    }

    /** Set the decision procedure used. */
    public void setSolver(SolverKind solver) {
        if (solver == null) throw new NullPointerException("solver");
        this.solver = solver;
    }

    public SolverKind getSolver() {
        return solver;
    }

    /**
     * Set the command line of the solver process, used with
     * {@link SolverKind#Z3_PROCESS}.
     */
    public void setSolverCommand(String solverCommand) {
        if (solverCommand == null || solverCommand.trim().isEmpty()) {
            throw new IllegalArgumentException("solver command must not be empty");
        }
        this.solverCommand = solverCommand;
    }

    public String getSolverCommand() {
        return solverCommand;
    }

    /**
     * Set the file receiving the SMT-LIB 2 script of the run, or
     * {@code null} for none.
     */
    public void setSmtLog(Path smtLog) {
        this.smtLog = smtLog;
    }

    public Path getSmtLog() {
        return smtLog;
    }

    /** A factory for the configured solver. */
    public SolverFactory solverFactory() {
        return SolverFactory.of(solver, solverCommand, smtLog);
    }

    /**
     * Overwrite the options present in {@code props}.
     * @throws IllegalArgumentException naming the key of a bad value
     */
    public void apply(Properties props) {
        String v = props.getProperty(MAX_KEY);
        if (v != null) {
            v = v.trim();
            if (v.isEmpty() || v.equalsIgnoreCase("none")) {
                setMax(null);
            } else {
                try {
                    setMax(Integer.valueOf(v));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException(
                        "bad value for " + MAX_KEY + ": " + v, e);
                }
            }
        }
        v = props.getProperty(SOLVER_KEY);
        if (v != null) {
            try {
                setSolver(SolverKind.valueOf(v.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                    "bad value for " + SOLVER_KEY + ": " + v, e);
            }
        }
        v = props.getProperty(SOLVER_COMMAND_KEY);
        if (v != null) {
            try {
                setSolverCommand(v);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                    "bad value for " + SOLVER_COMMAND_KEY + ": " + v, e);
            }
        }
        v = props.getProperty(SMT_LOG_KEY);
        if (v != null) {
            setSmtLog(v.trim().isEmpty() ? null : Paths.get(v.trim()));
        }
    }

    /** Options from {@code props}, defaults elsewhere. */
    public static BmcOptions fromProperties(Properties props) {
        BmcOptions o = new BmcOptions();
        o.apply(props);
        return o;
    }

    /**
     * Options from the {@value #RESOURCE} classpath resource, if present,
     * overridden by JVM system properties with the same keys.
     *
     * @throws IOException if the resource cannot be read
     */
    public static BmcOptions load() throws IOException {
        BmcOptions o = new BmcOptions();
        InputStream in = BmcOptions.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in != null) {
            try (InputStream s = in) {
                Properties props = new Properties();
                props.load(s);
                o.apply(props);
            }
        }
        o.apply(System.getProperties());
        return o;
    }
}
