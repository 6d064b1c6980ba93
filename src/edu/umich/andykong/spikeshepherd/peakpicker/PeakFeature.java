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

/**
 * A local maximum together with its prominence and the bases that bound it.
 */
public class PeakFeature implements Comparable<PeakFeature> {

	final int index;
	final double height, prominence;
	final int leftBase, rightBase;

	public PeakFeature(int index, double height, double prominence, int leftBase, int rightBase) {
		this.index = index;
		this.height = height;
		this.prominence = prominence;
		this.leftBase = leftBase;
		this.rightBase = rightBase;
	}

	public int getIndex() {
		return index;
	}

	public double getHeight() {
		return height;
	}

	public double getProminence() {
		return prominence;
	}

	public int getLeftBase() {
		return leftBase;
	}

	public int getRightBase() {
		return rightBase;
	}

	public int compareTo(PeakFeature o) {
		return Integer.compare(index, o.index);
	}

	@Override
	public String toString() {
		return String.format("peak@%d[height=%.4f, prominence=%.4f, bases=%d..%d]", index, height, prominence, leftBase, rightBase);
	}
}
