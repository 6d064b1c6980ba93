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

package edu.umich.andykong.spikeshepherd.interpolation;

import java.util.Locale;

/**
 * Interpolant families available for reconstructing masked samples. Each kind needs at least
 * {@code degree + 1} support points.
 */
public enum InterpolationKind {
    LINEAR(1),
    QUADRATIC(2),
    CUBIC(3);

    private final int degree;

    InterpolationKind(int degree) {
        this.degree = degree;
    }

    public int getDegree() {
        return degree;
    }

    public int getMinSupport() {
        return degree + 1;
    }

    /**
     * Fits an interpolant of this kind through the given points.
     *
     * @param x strictly increasing abscissae, at least {@link #getMinSupport()} of them
     * @param y ordinates, same length as x
     */
    public Interpolant fit(double[] x, double[] y) {
        if (x.length != y.length)
            throw new IllegalArgumentException(String.format("x and y lengths differ: %d vs %d", x.length, y.length));
        if (x.length < getMinSupport())
            throw new IllegalArgumentException(String.format("%s interpolation needs at least %d points, got %d",
                    name().toLowerCase(Locale.ROOT), getMinSupport(), x.length));
        switch (this) {
            case LINEAR:
                return new LinearInterpolant(x, y);
            default:
                return BSplineInterpolant.fit(x, y, degree);
        }
    }
}
