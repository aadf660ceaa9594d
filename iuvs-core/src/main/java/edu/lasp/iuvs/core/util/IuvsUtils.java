/*
 * Copyright (c) 2023.  Brockmann Consult GmbH (info@brockmann-consult.de)
 *
 * This program is free software; you can redistribute it and/or modify it
 * under the terms of the GNU General Public License as published by the Free
 * Software Foundation; either version 3 of the License, or (at your option)
 * any later version.
 * This program is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU General Public License for
 * more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, see http://www.gnu.org/licenses/
 *
 */

package edu.lasp.iuvs.core.util;

import edu.lasp.iuvs.core.IuvsProcessingException;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.util.MathArrays;

import java.util.Arrays;
import java.util.logging.Logger;

/**
 * Utility class for IUVS processing
 */
public class IuvsUtils {

    public static final Logger LOG = Logger.getLogger("iuvs");

    private IuvsUtils() {
    }

    /**
     * Creates a piecewise-linear interpolant over the given knots. Outside the knot domain the edge values
     * are returned (flat extrapolation).
     *
     * @param x - strictly increasing abscissae
     * @param y - ordinates
     * @return the interpolant
     */
    public static UnivariateFunction createClampedLinearFunction(double[] x, double[] y) {
        if (ArrayUtils.isEmpty(x) || x.length != y.length) {
            throw new IuvsProcessingException("Cannot interpolate: " + ArrayUtils.getLength(x) +
                                                      " abscissae, " + ArrayUtils.getLength(y) + " ordinates");
        }
        if (x.length == 1) {
            final double constant = y[0];
            return value -> constant;
        }
        final PolynomialSplineFunction spline = new LinearInterpolator().interpolate(x, y);
        final double xMin = x[0];
        final double xMax = x[x.length - 1];
        final double yMin = y[0];
        final double yMax = y[y.length - 1];
        return value -> {
            if (Double.isNaN(value)) {
                return Double.NaN;
            }
            if (value <= xMin) {
                return yMin;
            }
            if (value >= xMax) {
                return yMax;
            }
            return spline.value(value);
        };
    }

    /**
     * One-shot clamped linear interpolation of several points.
     *
     * @param values - where to evaluate
     * @param x      - strictly increasing abscissae
     * @param y      - ordinates
     * @return the interpolated values
     */
    public static double[] interpolateClamped(double[] values, double[] x, double[] y) {
        final UnivariateFunction f = createClampedLinearFunction(x, y);
        final double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = f.value(values[i]);
        }
        return result;
    }

    public static boolean isStrictlyIncreasing(double[] values) {
        return values.length < 2 || MathArrays.isMonotonic(values, MathArrays.OrderDirection.INCREASING, true);
    }

    public static double median(double[] values) {
        return new Median().evaluate(values);
    }

    public static int median(int[] values) {
        final double[] asDouble = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            asDouble[i] = values[i];
        }
        return (int) median(asDouble);
    }

    /**
     * Sums groups of {@code width} adjacent samples. A trailing incomplete group is dropped.
     */
    public static double[] rebinBySum(double[] values, int width) {
        final double[] rebinned = new double[values.length / width];
        for (int i = 0; i < rebinned.length; i++) {
            double sum = 0.0;
            for (int k = 0; k < width; k++) {
                sum += values[i * width + k];
            }
            rebinned[i] = sum;
        }
        return rebinned;
    }

    /**
     * Averages groups of {@code width} adjacent samples. A trailing incomplete group is dropped.
     */
    public static double[] rebinByMean(double[] values, int width) {
        final double[] rebinned = rebinBySum(values, width);
        for (int i = 0; i < rebinned.length; i++) {
            rebinned[i] /= width;
        }
        return rebinned;
    }

    public static double[][][] createNanArray(int nx, int ny, int nz) {
        final double[][][] array = new double[nx][ny][nz];
        for (double[][] plane : array) {
            for (double[] row : plane) {
                Arrays.fill(row, Double.NaN);
            }
        }
        return array;
    }

    public static double[][] createNanArray(int nx, int ny) {
        final double[][] array = new double[nx][ny];
        for (double[] row : array) {
            Arrays.fill(row, Double.NaN);
        }
        return array;
    }
}
