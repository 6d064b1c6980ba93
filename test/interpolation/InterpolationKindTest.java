package interpolation;

import edu.umich.andykong.spikeshepherd.interpolation.Interpolant;
import edu.umich.andykong.spikeshepherd.interpolation.InterpolationKind;
import org.junit.jupiter.api.Test;

import java.util.function.DoubleUnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

class InterpolationKindTest {

    private static double[] sample(double[] x, DoubleUnaryOperator f) {
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++)
            y[i] = f.applyAsDouble(x[i]);
        return y;
    }

    @Test
    void minSupport() {
        assertEquals(2, InterpolationKind.LINEAR.getMinSupport());
        assertEquals(3, InterpolationKind.QUADRATIC.getMinSupport());
        assertEquals(4, InterpolationKind.CUBIC.getMinSupport());
    }

    @Test
    void linear() {
        Interpolant f = InterpolationKind.LINEAR.fit(new double[]{0, 1, 4}, new double[]{0, 2, 8});
        assertEquals(1.0, f.value(0.5), 1e-12);
        assertEquals(6.0, f.value(3), 1e-12);
        assertEquals(8.0, f.value(4), 1e-12);
        assertEquals(0.0, f.getLowerBound());
        assertEquals(4.0, f.getUpperBound());
    }

    @Test
    void quadraticReproducesQuadratics() {
        DoubleUnaryOperator p = t -> 2 * t * t - 3 * t + 1;
        double[] x = {0, 1, 2, 4, 5, 7};
        Interpolant f = InterpolationKind.QUADRATIC.fit(x, sample(x, p));
        assertEquals(p.applyAsDouble(3), f.value(3), 1e-9);
        assertEquals(p.applyAsDouble(6), f.value(6), 1e-9);
        assertEquals(p.applyAsDouble(0.25), f.value(0.25), 1e-9);

        // Minimum support
        double[] x3 = {0, 2, 3};
        assertEquals(p.applyAsDouble(1), InterpolationKind.QUADRATIC.fit(x3, sample(x3, p)).value(1), 1e-9);
    }

    @Test
    void cubicReproducesCubics() {
        DoubleUnaryOperator p = t -> t * t * t - t + 2;
        double[] x = {0, 1, 2, 3, 5, 6, 8};
        Interpolant f = InterpolationKind.CUBIC.fit(x, sample(x, p));
        assertEquals(p.applyAsDouble(4), f.value(4), 1e-9);
        assertEquals(p.applyAsDouble(7), f.value(7), 1e-9);

        double[] x4 = {0, 1, 3, 4};
        assertEquals(p.applyAsDouble(2), InterpolationKind.CUBIC.fit(x4, sample(x4, p)).value(2), 1e-9);
    }

    @Test
    void passesThroughData() {
        double[] x = {0, 1, 2, 3, 6, 7, 8, 9};
        double[] y = {0.3, -1.2, 4.0, 2.2, 0.1, 0.0, 5.5, -3.0};
        for (InterpolationKind kind : InterpolationKind.values()) {
            Interpolant f = kind.fit(x, y);
            for (int i = 0; i < x.length; i++)
                assertEquals(y[i], f.value(x[i]), 1e-9, kind + " at " + x[i]);
        }
    }

    @Test
    void tooFewPoints() {
        assertThrows(IllegalArgumentException.class, () -> InterpolationKind.LINEAR.fit(new double[]{1}, new double[]{1}));
        assertThrows(IllegalArgumentException.class, () -> InterpolationKind.QUADRATIC.fit(new double[]{1, 2}, new double[]{1, 1}));
        assertThrows(IllegalArgumentException.class, () -> InterpolationKind.CUBIC.fit(new double[]{1, 2, 3}, new double[]{1, 1, 1}));
        assertThrows(IllegalArgumentException.class, () -> InterpolationKind.LINEAR.fit(new double[]{1, 2}, new double[]{1}));
    }

    @Test
    void noExtrapolation() {
        for (InterpolationKind kind : InterpolationKind.values()) {
            Interpolant f = kind.fit(new double[]{1, 2, 3, 4}, new double[]{1, 4, 9, 16});
            assertFalse(f.isInRange(0.999));
            assertFalse(f.isInRange(4.001));
            assertTrue(f.isInRange(1));
            assertThrows(IllegalArgumentException.class, () -> f.value(0));
            assertThrows(IllegalArgumentException.class, () -> f.value(5));
        }
    }
}
