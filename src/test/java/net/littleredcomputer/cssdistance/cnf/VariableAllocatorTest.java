package net.littleredcomputer.cssdistance.cnf;

import org.junit.Test;

import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class VariableAllocatorTest {
    @Test
    public void blocksAreContiguousAndIncreasing() {
        VariableAllocator a = new VariableAllocator(7);
        assertThat(a.watermark(), is(7));
        assertThat(a.next(), is(8));
        assertThat(a.allocate(3), is(8));
        assertThat(a.watermark(), is(10));
        assertThat(a.fresh(), is(11));
        assertThat(a.allocate(2), is(12));
        assertThat(a.watermark(), is(13));
    }

    @Test
    public void emptyBlockLeavesWatermarkAlone() {
        VariableAllocator a = new VariableAllocator(4);
        assertThat(a.allocate(0), is(5));
        assertThat(a.watermark(), is(4));
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeCountThrows() {
        int ignored = new VariableAllocator(4).allocate(-1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeReservationThrows() {
        new VariableAllocator(-1);
    }
}
