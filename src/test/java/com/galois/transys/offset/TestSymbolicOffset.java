package com.galois.transys.offset;

import org.junit.Assert;
import org.junit.Test;

public class TestSymbolicOffset {
    private static SymbolicOffset one(int o) {
        return SymbolicOffset.one(Offset.of(o));
    }

    private static SymbolicOffset two(int lo, int hi) {
        return SymbolicOffset.two(Offset.of(lo), Offset.of(hi));
    }

    @Test
    public void noneIsNeutral() {
        Assert.assertEquals(one(3), SymbolicOffset.NONE.merge(one(3)));
        Assert.assertEquals(one(3), one(3).merge(SymbolicOffset.NONE));
        Assert.assertEquals(two(1, 2), SymbolicOffset.NONE.merge(two(1, 2)));
        Assert.assertEquals(SymbolicOffset.NONE,
                            SymbolicOffset.NONE.merge(SymbolicOffset.NONE));
    }

    @Test
    public void mergeSingleOffsets() {
        Assert.assertEquals(one(1), one(1).merge(one(1)));
        Assert.assertEquals(two(1, 2), one(1).merge(one(2)));
        Assert.assertEquals(two(1, 2), one(2).merge(one(1)));
    }

    @Test
    public void mergeTwoWithOne() {
        Assert.assertEquals(two(1, 2), two(1, 2).merge(one(1)));
        Assert.assertEquals(two(1, 2), two(1, 2).merge(one(2)));
        Assert.assertEquals(two(1, 2), one(2).merge(two(1, 2)));
        Assert.assertEquals(two(1, 2), two(1, 2).merge(two(1, 2)));
    }

    @Test(expected = OffsetMergeException.class)
    public void mergeTwoWithUnrelatedOne() {
        two(1, 2).merge(one(3));
    }

    @Test(expected = OffsetMergeException.class)
    public void mergeOneWithUnrelatedTwo() {
        one(0).merge(two(1, 2));
    }

    @Test(expected = OffsetMergeException.class)
    public void mergeDistinctTwos() {
        two(1, 2).merge(two(3, 4));
    }

    @Test(expected = IllegalArgumentException.class)
    public void twoMustBeIncreasing() {
        two(2, 2);
    }

    @Test
    public void isNextOf() {
        Assert.assertTrue(one(4).isNextOf(one(3)));
        Assert.assertFalse(one(3).isNextOf(one(4)));
        Assert.assertFalse(one(5).isNextOf(one(3)));
        Assert.assertFalse(two(3, 4).isNextOf(one(3)));
    }

    @Test
    public void offsetPairs() {
        Offset2 o = Offset2.init();
        Assert.assertEquals(0, o.curr().value());
        Assert.assertEquals(1, o.nextOffset().value());
        o = o.next().next();
        Assert.assertEquals(2, o.curr().value());
        Assert.assertEquals(3, o.nextOffset().value());
        Assert.assertEquals(Offset2.at(Offset.of(2)), o);
    }

    @Test(expected = IllegalStateException.class)
    public void offsetOverflow() {
        Offset.of(Offset.MAX).next();
    }
}
