package net.littleredcomputer.cssdistance.gf2;

import org.junit.Test;

import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class BinaryMatrixTest {
    private static final BinaryMatrix m = BinaryMatrix.of(
            new int[]{1, 0, 1},
            new int[]{0, 1, 1});

    @Test
    public void parseAcceptsRunTogetherAndSeparatedBits() {
        assertThat(BinaryMatrix.parse("101\n011\n"), is(m));
        assertThat(BinaryMatrix.parse("c a comment\n1 0 1\n0,1,1"), is(m));
        assertThat(BinaryMatrix.parse("[1, 0, 1]\n[0, 1, 1]"), is(m));
    }

    @Test(expected = IllegalArgumentException.class)
    public void raggedRowsThrow() {
        BinaryMatrix.parse("101\n01\n");
    }

    @Test(expected = IllegalArgumentException.class)
    public void nonBitsThrow() {
        BinaryMatrix.parse("102\n");
    }

    @Test(expected = IllegalArgumentException.class)
    public void nonBitIntegersThrow() {
        BinaryMatrix.of(new int[]{0, 2});
    }

    @Test
    public void toStringParsesBack() {
        assertThat(BinaryMatrix.parse(m.toString()), is(m));
    }

    @Test
    public void transposeAndMultiply() {
        assertThat(m.transpose().rows(), is(3));
        assertThat(m.multiplyTranspose(m), is(BinaryMatrix.of(new int[]{0, 1}, new int[]{1, 0})));
        assertThat(m.times(m.transpose()), is(m.multiplyTranspose(m)));
        assertThat(m.times(new boolean[]{true, true, true}), is(new boolean[]{false, false}));
    }

    @Test
    public void permuteColumnsTakesColumnsInTheGivenOrder() {
        BinaryMatrix p = m.permuteColumns(new int[]{2, 0, 1});
        assertThat(p, is(BinaryMatrix.of(new int[]{1, 1, 0}, new int[]{1, 0, 1})));
    }

    @Test
    public void kronHasProductShape() {
        BinaryMatrix k = m.kron(BinaryMatrix.identity(2));
        assertThat(k.rows(), is(4));
        assertThat(k.cols(), is(6));
        assertThat(k.get(1, 1), is(true));
        assertThat(k.get(1, 0), is(false));
        assertThat(k.get(3, 5), is(true));
    }

    @Test
    public void cyclicShiftCyclesAround() {
        BinaryMatrix s = BinaryMatrix.cyclicShift(4);
        BinaryMatrix s4 = s.times(s).times(s).times(s);
        assertThat(s4, is(BinaryMatrix.identity(4)));
        assertThat(s.plus(s).isZero(), is(true));
    }

    @Test
    public void stacking() {
        assertThat(m.hstack(m).cols(), is(6));
        assertThat(m.appendRow(new boolean[]{true, true, true}).rows(), is(3));
        assertThat(m.selectColumns(1, 3), is(BinaryMatrix.of(new int[]{0, 1}, new int[]{1, 1})));
        assertThat(m.selectRows(1, 2), is(BinaryMatrix.of(new int[]{0, 1, 1})));
        assertThat(m.rowWeight(0), is(2));
    }
}
