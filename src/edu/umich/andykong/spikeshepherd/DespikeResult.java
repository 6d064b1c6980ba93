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

package edu.umich.andykong.spikeshepherd;

import com.google.common.collect.ImmutableList;
import edu.umich.andykong.spikeshepherd.peakpicker.PeakFeature;
import edu.umich.andykong.spikeshepherd.spikes.SpikeMask;

/**
 * De-spiked signal plus the intermediate results that produced it.
 */
public class DespikeResult {
	private final double [] signal;
	private final ImmutableList<PeakFeature> peaks;
	private final ImmutableList<PeakFeature> spikes;
	private final SpikeMask mask;

	DespikeResult(double [] signal, ImmutableList<PeakFeature> peaks, ImmutableList<PeakFeature> spikes, SpikeMask mask) {
		this.signal = signal;
		this.peaks = peaks;
		this.spikes = spikes;
		this.mask = mask;
	}

	/** @return a copy of the output signal */
	public double [] getSignal() {
		return signal.clone();
	}

	public ImmutableList<PeakFeature> getPeaks() {
		return peaks;
	}

	public ImmutableList<PeakFeature> getSpikes() {
		return spikes;
	}

	public SpikeMask getMask() {
		return mask;
	}
}
