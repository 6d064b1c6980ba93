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

import com.google.common.collect.ImmutableList;
import edu.umich.andykong.spikeshepherd.peakpicker.PeakFeature;
import edu.umich.andykong.spikeshepherd.peakpicker.PeakWidths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Flags peaks whose width at half prominence is below a threshold.
 */
public class WidthClassifier {
    private static final Logger log = LoggerFactory.getLogger(WidthClassifier.class);

    private final double widthThreshold;

    public WidthClassifier(double widthThreshold) {
        if (!(widthThreshold > 0))
            throw new IllegalArgumentException("Width threshold must be positive, got " + widthThreshold);
        this.widthThreshold = widthThreshold;
    }

    public boolean isSpike(double[] signal, PeakFeature peak) {
        double width = PeakWidths.computeWidth(signal, peak, PeakWidths.HALF_PROMINENCE).getWidth();
        boolean spike = width < widthThreshold;
        if (spike && log.isTraceEnabled())
            log.trace("Spike at {}: half-prominence width {} < {}", peak.getIndex(), width, widthThreshold);
        return spike;
    }

    public ImmutableList<PeakFeature> classify(double[] signal, List<PeakFeature> peaks) {
        ImmutableList.Builder<PeakFeature> spikes = ImmutableList.builder();
        for (PeakFeature peak : peaks) {
            if (isSpike(signal, peak))
                spikes.add(peak);
        }
        return spikes.build();
    }

    public double getWidthThreshold() {
        return widthThreshold;
    }
}
