package peakpicker;

import edu.umich.andykong.spikeshepherd.peakpicker.PeakFeature;
import edu.umich.andykong.spikeshepherd.peakpicker.Prominence;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class ProminenceTest {

    @Test
    void computeProminence() {
        double[] v = {1, 3, 2, 5, 2, 4, 1};
        PeakFeature[] peaks = Prominence.computeProminence(v, new int[]{1, 3, 5});

        assertEquals(1.0, peaks[0].getProminence(), 1e-12);
        assertEquals(0, peaks[0].getLeftBase());
        assertEquals(2, peaks[0].getRightBase());

        assertEquals(4.0, peaks[1].getProminence(), 1e-12);
        assertEquals(0, peaks[1].getLeftBase());
        assertEquals(6, peaks[1].getRightBase());

        // Left walk stops at the higher peak at index 3
        assertEquals(2.0, peaks[2].getProminence(), 1e-12);
        assertEquals(4, peaks[2].getLeftBase());
        assertEquals(6, peaks[2].getRightBase());
        assertEquals(4.0, peaks[2].getHeight(), 1e-12);
    }

    @Test
    void nearestMinimumIsTheBase() {
        PeakFeature[] peaks = Prominence.computeProminence(new double[]{0, 5, 1, 1, 3}, new int[]{1});
        assertEquals(4.0, peaks[0].getProminence(), 1e-12);
        assertEquals(2, peaks[0].getRightBase());
    }

    @Test
    void equalNeighbourDoesNotBoundTheWalk() {
        PeakFeature[] peaks = Prominence.computeProminence(new double[]{0, 5, 0, 5, 0}, new int[]{1, 3});
        assertEquals(5.0, peaks[0].getProminence(), 1e-12);
        assertEquals(5.0, peaks[1].getProminence(), 1e-12);
        assertEquals(2, peaks[0].getRightBase());
        assertEquals(2, peaks[1].getLeftBase());
    }

    @Test
    void rejectsEdgeIndices() {
        assertThrows(IllegalArgumentException.class,
                () -> Prominence.computeProminence(new double[]{3, 1, 0}, new int[]{0}));
        assertThrows(IllegalArgumentException.class,
                () -> Prominence.computeProminence(new double[]{0, 1, 3}, new int[]{2}));
    }
}
