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

public class PeakWidths {

	public static final double HALF_PROMINENCE = 0.5;

	/**
	 * Width of a peak measured at {@code height - relHeight * prominence}.
	 */
	public static class Width {
		final double width, evalHeight, leftIp, rightIp;

		Width(double width, double evalHeight, double leftIp, double rightIp) {
			this.width = width;
			this.evalHeight = evalHeight;
			this.leftIp = leftIp;
			this.rightIp = rightIp;
		}

		public double getWidth() {
			return width;
		}

		public double getEvalHeight() {
			return evalHeight;
		}

		/** fractional position of the left intersection */
		public double getLeftIp() {
			return leftIp;
		}

		/** fractional position of the right intersection */
		public double getRightIp() {
			return rightIp;
		}
	}

	/**
	 * Walks outward from the peak until the signal drops to the evaluation height or the peak's base is
	 * reached, then interpolates linearly between the stop sample and its inner neighbour.
	 */
	public static Width computeWidth(double [] v, PeakFeature peak, double relHeight) {
		if(relHeight < 0)
			throw new IllegalArgumentException("relHeight must be >= 0, got " + relHeight);
		double height = peak.height - peak.prominence * relHeight;

		int i = peak.index;
		while(peak.leftBase < i && height < v[i])
			i--;
		double leftIp = i;
		if(v[i] < height)
			leftIp += (height - v[i]) / (v[i+1] - v[i]);

		i = peak.index;
		while(i < peak.rightBase && height < v[i])
			i++;
		double rightIp = i;
		if(v[i] < height)
			rightIp -= (height - v[i]) / (v[i-1] - v[i]);

		return new Width(rightIp - leftIp, height, leftIp, rightIp);
	}

	public static Width [] computeWidths(double [] v, PeakFeature [] peaks, double relHeight) {
		Width [] res = new Width[peaks.length];
		for(int i = 0; i < peaks.length; i++)
			res[i] = computeWidth(v, peaks[i], relHeight);
		return res;
	}
}
