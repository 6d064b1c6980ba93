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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Interpolating B-spline of degree 2 or 3.
 * <p>
 * Knot placement: for odd degrees the interior knots are the data sites with the first and last
 * {@code (k + 1) / 2} removed (not-a-knot). For degree 2 the interior knots are the midpoints between
 * consecutive sites with the first and last midpoint dropped. Boundary knots are repeated
 * {@code k + 1} times, so there are exactly as many coefficients as data points and the collocation
 * system is square.
 */
public class BSplineInterpolant implements Interpolant {

    private final int degree;
    private final double[] knots;
    private final double[] coefficients;

    private BSplineInterpolant(int degree, double[] knots, double[] coefficients) {
        this.degree = degree;
        this.knots = knots;
        this.coefficients = coefficients;
    }

    public static BSplineInterpolant fit(double[] x, double[] y, int degree) {
        if (degree < 2 || degree > 3)
            throw new IllegalArgumentException("Unsupported spline degree " + degree);
        int n = x.length;
        if (n < degree + 1)
            throw new IllegalArgumentException(String.format("Need at least %d points for degree %d, got %d", degree + 1, degree, n));
        for (int i = 1; i < n; i++) {
            if (!(x[i] > x[i - 1]))
                throw new IllegalArgumentException("Abscissae must be strictly increasing");
        }

        double[] knots = computeKnots(x, degree);

        /* Collocation matrix, banded with at most degree + 1 nonzeros per row */
        RealMatrix a = new Array2DRowRealMatrix(n, n);
        for (int i = 0; i < n; i++) {
            int span = findSpan(knots, degree, n, x[i]);
            double[] basis = basisFunctions(knots, degree, span, x[i]);
            for (int j = 0; j <= degree; j++)
                a.setEntry(i, span - degree + j, basis[j]);
        }
        double[] coefficients = new LUDecomposition(a).getSolver().solve(new ArrayRealVector(y, true)).toArray();
        return new BSplineInterpolant(degree, knots, coefficients);
    }

    static double[] computeKnots(double[] x, int degree) {
        int n = x.length;
        double[] interior;
        if (degree == 2) {
            // midpoints 1 .. n-3
            interior = new double[Math.max(0, n - 3)];
            for (int i = 0; i < interior.length; i++)
                interior[i] = (x[i + 1] + x[i + 2]) / 2.0;
        } else {
            int m = (degree - 1) / 2;
            interior = new double[n - 2 * (m + 1)];
            System.arraycopy(x, m + 1, interior, 0, interior.length);
        }
        double[] knots = new double[interior.length + 2 * (degree + 1)];
        for (int i = 0; i <= degree; i++) {
            knots[i] = x[0];
            knots[knots.length - 1 - i] = x[n - 1];
        }
        System.arraycopy(interior, 0, knots, degree + 1, interior.length);
        return knots;
    }

    /* Index l with knots[l] <= t < knots[l+1], clamped to [degree, n-1] */
    static int findSpan(double[] knots, int degree, int nCoefficients, double t) {
        if (t >= knots[nCoefficients])
            return nCoefficients - 1;
        int l = degree;
        while (l < nCoefficients - 1 && knots[l + 1] <= t)
            l++;
        return l;
    }

    /* Cox-de Boor; returns the degree + 1 nonvanishing basis values B_{span-degree..span}(t) */
    static double[] basisFunctions(double[] knots, int degree, int span, double t) {
        double[] n = new double[degree + 1];
        double[] left = new double[degree + 1];
        double[] right = new double[degree + 1];
        n[0] = 1.0;
        for (int j = 1; j <= degree; j++) {
            left[j] = t - knots[span + 1 - j];
            right[j] = knots[span + j] - t;
            double saved = 0.0;
            for (int r = 0; r < j; r++) {
                double temp = n[r] / (right[r + 1] + left[j - r]);
                n[r] = saved + right[r + 1] * temp;
                saved = left[j - r] * temp;
            }
            n[j] = saved;
        }
        return n;
    }

    @Override
    public double value(double t) {
        if (!isInRange(t))
            throw new IllegalArgumentException(String.format("%f outside [%f, %f]", t, getLowerBound(), getUpperBound()));
        int span = findSpan(knots, degree, coefficients.length, t);
        double[] basis = basisFunctions(knots, degree, span, t);
        double v = 0;
        for (int j = 0; j <= degree; j++)
            v += basis[j] * coefficients[span - degree + j];
        return v;
    }

    @Override
    public double getLowerBound() {
        return knots[0];
    }

    @Override
    public double getUpperBound() {
        return knots[knots.length - 1];
    }

    public int getDegree() {
        return degree;
    }

    public double[] getKnots() {
        return knots.clone();
    }
}
