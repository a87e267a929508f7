package com.galois.transys.bmc;

import java.nio.file.Paths;
import java.util.Properties;

import org.junit.Assert;
import org.junit.Test;

import com.galois.transys.solver.SolverKind;

public class TestBmcOptions {
    @Test
    public void defaults() throws Exception {
        BmcOptions o = BmcOptions.load();
        Assert.assertNull(o.getMax());
        Assert.assertEquals(SolverKind.Z3, o.getSolver());
        Assert.assertEquals("z3 -in -smt2", o.getSolverCommand());
        Assert.assertNull(o.getSmtLog());
    }

    @Test
    public void fromProperties() {
        Properties props = new Properties();
        props.setProperty(BmcOptions.MAX_KEY, " 12 ");
        props.setProperty(BmcOptions.SOLVER_KEY, "z3_process");
        props.setProperty(BmcOptions.SOLVER_COMMAND_KEY, "cvc5 --lang smt2");
        props.setProperty(BmcOptions.SMT_LOG_KEY, "/tmp/run.smt2");
        BmcOptions o = BmcOptions.fromProperties(props);
        Assert.assertEquals(Integer.valueOf(12), o.getMax());
        Assert.assertEquals(SolverKind.Z3_PROCESS, o.getSolver());
        Assert.assertEquals("cvc5 --lang smt2", o.getSolverCommand());
        Assert.assertEquals(Paths.get("/tmp/run.smt2"), o.getSmtLog());

        props.setProperty(BmcOptions.MAX_KEY, "none");
        o.apply(props);
        Assert.assertNull(o.getMax());
    }

    @Test
    public void badValuesNameTheirKey() {
        String[][] bad = {
            { BmcOptions.MAX_KEY, "many" },
            { BmcOptions.MAX_KEY, "-1" },
            { BmcOptions.SOLVER_KEY, "minisat" },
            { BmcOptions.SOLVER_COMMAND_KEY, " " },
        };
        for (String[] kv : bad) {
            Properties props = new Properties();
            props.setProperty(kv[0], kv[1]);
            try {
                BmcOptions.fromProperties(props);
                Assert.fail("accepted " + kv[0] + "=" + kv[1]);
            } catch (IllegalArgumentException e) {
                Assert.assertTrue(e.getMessage(), e.getMessage().contains(kv[0]));
            }
        }
    }
}
