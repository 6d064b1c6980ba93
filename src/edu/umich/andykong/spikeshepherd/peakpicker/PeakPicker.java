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

package edu.umich.andykong.spikeshepherd.peakpicker;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;

public class PeakPicker {

	private final double promThreshold;

	public PeakPicker(double promThreshold) {
		if(!(promThreshold > 0))
			throw new IllegalArgumentException("Prominence threshold must be positive, got " + promThreshold);
		this.promThreshold = promThreshold;
	}

	/**
	 * @return local maxima with prominence >= the threshold, in ascending index order
	 */
	public ImmutableList<PeakFeature> pickPeaks(@NotNull double [] sum) {
		int [] maxima = LocalMaxima.findLocalMaxima(sum);
		//calculates prominence of every candidate
		PeakFeature [] prom = Prominence.computeProminence(sum, maxima);
		ImmutableList.Builder<PeakFeature> peaks = ImmutableList.builder();
		for(PeakFeature pf : prom) {
			if(pf.prominence >= promThreshold)
				peaks.add(pf);
		}
		return peaks.build();
	}

	public double getPromThreshold() {
		return promThreshold;
	}
}
