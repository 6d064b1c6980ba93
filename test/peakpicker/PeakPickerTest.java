package peakpicker;

import edu.umich.andykong.spikeshepherd.peakpicker.PeakFeature;
import edu.umich.andykong.spikeshepherd.peakpicker.PeakPicker;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PeakPickerTest {

    @Test
    void pickPeaks() {
        double[] v = {1, 3, 2, 5, 2, 4, 1};

        // Threshold is inclusive
        List<PeakFeature> peaks = new PeakPicker(2.0).pickPeaks(v);
        assertEquals(2, peaks.size());
        assertEquals(3, peaks.get(0).getIndex());
        assertEquals(5, peaks.get(1).getIndex());

        peaks = new PeakPicker(2.0001).pickPeaks(v);
        assertEquals(1, peaks.size());
        assertEquals(3, peaks.get(0).getIndex());

        assertEquals(3, new PeakPicker(0.5).pickPeaks(v).size());
    }

    @Test
    void noPeaks() {
        assertTrue(new PeakPicker(1).pickPeaks(new double[]{}).isEmpty());
        assertTrue(new PeakPicker(1).pickPeaks(new double[]{2, 2, 2, 2}).isEmpty());
        assertTrue(new PeakPicker(1).pickPeaks(new double[]{0, 1, 2, 3}).isEmpty());
    }

    @Test
    void rejectsNonPositiveThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new PeakPicker(0));
        assertThrows(IllegalArgumentException.class, () -> new PeakPicker(-1));
        assertThrows(IllegalArgumentException.class, () -> new PeakPicker(Double.NaN));
    }
}
