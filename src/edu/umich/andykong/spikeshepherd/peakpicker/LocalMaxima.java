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

import com.google.common.primitives.Ints;

import java.util.ArrayList;

public class LocalMaxima {

	/**
	 * Finds discrete local maxima. A sample qualifies when its left neighbour is strictly lower and the
	 * run of equal samples it starts is followed by a strictly lower sample. Flat tops resolve to the
	 * middle index of the run, rounded down. The first and last samples are never maxima.
	 *
	 * @return ascending indices
	 */
	public static int [] findLocalMaxima(double [] v) {
		ArrayList<Integer> maxima = new ArrayList<>();
		int iMax = v.length - 1;
		int i = 1;
		while(i < iMax) {
			if(v[i-1] < v[i]) {
				int iAhead = i + 1;
				while(iAhead < iMax && v[iAhead] == v[i]) //walk over plateau
					iAhead++;
				if(v[iAhead] < v[i]) {
					int leftEdge = i;
					int rightEdge = iAhead - 1;
					maxima.add((leftEdge + rightEdge) / 2);
					i = iAhead; //skip samples that cannot be maxima
				}
			}
			i++;
		}
		return Ints.toArray(maxima);
	}
}
