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

public class Prominence {

	/**
	 * Computes prominence and bases for the given peak indices.
	 * <p>
	 * From each peak the signal is walked outward on both sides while samples stay at or below the
	 * peak height. The lowest sample met on each side is that side's base (nearest occurrence wins on ties),
	 * and the prominence is the peak height minus the higher of the two base values.
	 */
	public static PeakFeature [] computeProminence(double [] v, int [] peaks) {
		int [] leftBound = nearestHigherLeft(v);
		int [] rightBound = nearestHigherRight(v);
		PeakFeature [] res = new PeakFeature[peaks.length];
		for(int p = 0; p < peaks.length; p++) {
			int peak = peaks[p];
			if(peak <= 0 || peak >= v.length - 1)
				throw new IllegalArgumentException(String.format("Peak index %d is not inside the signal", peak));

			int leftBase = peak;
			double leftMin = v[peak];
			for(int i = peak - 1; i > leftBound[peak]; i--) {
				if(v[i] < leftMin) {
					leftMin = v[i];
					leftBase = i;
				}
			}
			int rightBase = peak;
			double rightMin = v[peak];
			for(int i = peak + 1; i < rightBound[peak]; i++) {
				if(v[i] < rightMin) {
					rightMin = v[i];
					rightBase = i;
				}
			}
			res[p] = new PeakFeature(peak, v[peak], v[peak] - Math.max(leftMin, rightMin), leftBase, rightBase);
		}
		return res;
	}

	//index of the closest strictly higher sample to the left, -1 if none
	static int [] nearestHigherLeft(double [] v) {
		int [] qPos = new int[v.length];
		int [] res = new int[v.length];
		int pos = 0;
		for(int i = 0; i < v.length; i++) {
			while(pos > 0 && v[qPos[pos-1]] <= v[i])
				pos--;
			res[i] = pos == 0 ? -1 : qPos[pos-1];
			qPos[pos++] = i;
		}
		return res;
	}

	//index of the closest strictly higher sample to the right, v.length if none
	static int [] nearestHigherRight(double [] v) {
		int [] qPos = new int[v.length];
		int [] res = new int[v.length];
		int pos = 0;
		for(int i = v.length - 1; i >= 0; i--) {
			while(pos > 0 && v[qPos[pos-1]] <= v[i])
				pos--;
			res[i] = pos == 0 ? v.length : qPos[pos-1];
			qPos[pos++] = i;
		}
		return res;
	}
}
