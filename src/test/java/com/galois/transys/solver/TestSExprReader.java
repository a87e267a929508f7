package com.galois.transys.solver;

import java.io.IOException;
import java.io.StringReader;
import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

public class TestSExprReader {
    @Test
    public void responses() throws Exception {
        SExprReader r = new SExprReader(new StringReader(
            "success\nsat ; a comment\n"
            + "((define-fun |x@1| () Int (- 3))\n (define-fun |s| () String \"a\"\"b\"))"));
        Assert.assertEquals("success", r.next());
        Assert.assertEquals("sat", r.next());
        Object model = r.next();
        Assert.assertEquals(
            Arrays.asList(
                Arrays.asList("define-fun", "|x@1|", Arrays.asList(), "Int",
                              Arrays.asList("-", "3")),
                Arrays.asList("define-fun", "|s|", Arrays.asList(), "String",
                              "\"a\"\"b\"")),
            model);
        Assert.assertNull(r.next());
    }

    @Test
    public void deepNesting() throws Exception {
        StringBuilder b = new StringBuilder();
        int depth = 50000;
        for (int i = 0; i != depth; ++i) b.append('(');
        b.append("a");
        for (int i = 0; i != depth; ++i) b.append(')');
        Object e = new SExprReader(new StringReader(b.toString())).next();
        for (int i = 0; i != depth; ++i) {
            e = ((List<?>) e).get(0);
        }
        Assert.assertEquals("a", e);
    }

    @Test(expected = IOException.class)
    public void truncated() throws Exception {
        new SExprReader(new StringReader("(error \"boom")).next();
    }

    @Test(expected = IOException.class)
    public void unbalanced() throws Exception {
        new SExprReader(new StringReader(")")).next();
    }
}
