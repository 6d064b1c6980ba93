package interpolation;

import edu.umich.andykong.spikeshepherd.interpolation.BSplineInterpolant;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BSplineInterpolantTest {

    @Test
    void cubicKnotsSkipSecondAndSecondToLastSite() {
        BSplineInterpolant s = BSplineInterpolant.fit(new double[]{0, 1, 2, 3, 4, 5}, new double[]{0, 1, 0, 1, 0, 1}, 3);
        assertArrayEquals(new double[]{0, 0, 0, 0, 2, 3, 5, 5, 5, 5}, s.getKnots(), 1e-12);
        assertEquals(3, s.getDegree());
    }

    @Test
    void quadraticKnotsAtInteriorMidpoints() {
        BSplineInterpolant s = BSplineInterpolant.fit(new double[]{0, 1, 2, 3, 4}, new double[]{0, 1, 0, 1, 0}, 2);
        assertArrayEquals(new double[]{0, 0, 0, 1.5, 2.5, 4, 4, 4}, s.getKnots(), 1e-12);
    }

    @Test
    void notAKnotCubicIsSmoothAcrossGap() {
        // Samples of a cubic with a gap, as left by a masked spike
        double[] x = {0, 1, 2, 3, 7, 8, 9, 10};
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++)
            y[i] = 0.01 * x[i] * x[i] * x[i] - 0.2 * x[i] * x[i] + x[i];
        BSplineInterpolant s = BSplineInterpolant.fit(x, y, 3);
        for (double t = 3; t <= 7; t += 0.5)
            assertEquals(0.01 * t * t * t - 0.2 * t * t + t, s.value(t), 1e-9);
    }

    @Test
    void rejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> BSplineInterpolant.fit(new double[]{0, 1, 2}, new double[]{0, 1, 2}, 1));
        assertThrows(IllegalArgumentException.class, () -> BSplineInterpolant.fit(new double[]{0, 1, 1, 2}, new double[]{0, 1, 1, 2}, 3));
        assertThrows(IllegalArgumentException.class, () -> BSplineInterpolant.fit(new double[]{0, 1, 2}, new double[]{0, 1, 2}, 3));
    }
}
