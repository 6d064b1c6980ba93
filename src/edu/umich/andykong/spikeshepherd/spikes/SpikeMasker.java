/*
 *    Copyright 2022 University of Michigan
 *
 *    Licensed under the Apache License, Version 2.0 (the "License");
 *    you may not use this file except in compliance with the License.
 *    You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 *    Unless required by applicable law or agreed to in writing, software
 *    distributed under the License is distributed on an "AS IS" BASIS,
 *    WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *    See the License for the specific language governing permissions and
 *    limitations under the License.
 */

package edu.umich.andykong.spikeshepherd.spikes;

import edu.umich.andykong.spikeshepherd.peakpicker.PeakFeature;
import edu.umich.andykong.spikeshepherd.peakpicker.PeakWidths;

import java.util.List;

/**
 * Marks the samples covered by each spike, measured at {@code widthParamRel} of its prominence and
 * widened by {@code leftPad} / {@code rightPad} samples. Regions of different spikes are unioned.
 */
public class SpikeMasker {

    public static final int DEFAULT_LEFT_PAD = 1;
    public static final int DEFAULT_RIGHT_PAD = 1;

    private final double widthParamRel;
    private final int leftPad;
    private final int rightPad;

    public SpikeMasker(double widthParamRel) {
        this(widthParamRel, DEFAULT_LEFT_PAD, DEFAULT_RIGHT_PAD);
    }

    public SpikeMasker(double widthParamRel, int leftPad, int rightPad) {
        if (!(widthParamRel > 0 && widthParamRel <= 1))
            throw new IllegalArgumentException("widthParamRel must be in (0, 1], got " + widthParamRel);
        if (leftPad < 0 || rightPad < 0)
            throw new IllegalArgumentException(String.format("Pads must be >= 0, got %d and %d", leftPad, rightPad));
        this.widthParamRel = widthParamRel;
        this.leftPad = leftPad;
        this.rightPad = rightPad;
    }

    public SpikeMask mask(double[] signal, List<PeakFeature> spikes) {
        boolean[] flags = new boolean[signal.length];
        for (PeakFeature spike : spikes) {
            int[] range = maskedRange(signal, spike);
            for (int i = range[0]; i < range[1]; i++)
                flags[i] = true;
        }
        return new SpikeMask(flags);
    }

    /**
     * @return half-open range {start, end} covered by one spike, clamped to the signal
     */
    public int[] maskedRange(double[] signal, PeakFeature spike) {
        PeakWidths.Width ext = PeakWidths.computeWidth(signal, spike, widthParamRel);
        long start = (long) Math.floor(ext.getLeftIp()) - leftPad;
        long end = (long) Math.floor(ext.getRightIp()) + 1 + rightPad;
        return new int[]{(int) Math.max(0, start), (int) Math.min(signal.length, end)};
    }

    public double getWidthParamRel() {
        return widthParamRel;
    }
}
