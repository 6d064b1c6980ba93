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

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

class LinearInterpolant implements Interpolant {
    private final PolynomialSplineFunction function;

    LinearInterpolant(double[] x, double[] y) {
        this.function = new LinearInterpolator().interpolate(x, y);
    }

    @Override
    public double value(double x) {
        if (!isInRange(x))
            throw new IllegalArgumentException(String.format("%f outside [%f, %f]", x, getLowerBound(), getUpperBound()));
        return function.value(x);
    }

    @Override
    public double getLowerBound() {
        double[] knots = function.getKnots();
        return knots[0];
    }

    @Override
    public double getUpperBound() {
        double[] knots = function.getKnots();
        return knots[knots.length - 1];
    }
}
