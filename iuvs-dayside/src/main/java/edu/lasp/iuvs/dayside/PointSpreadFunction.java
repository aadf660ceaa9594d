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

package edu.lasp.iuvs.dayside;

import edu.lasp.iuvs.core.IuvsProcessingException;
import edu.lasp.iuvs.core.util.IuvsAuxdata;
import edu.lasp.iuvs.core.util.IuvsUtils;
import org.apache.commons.lang3.ArrayUtils;

/**
 * Spectral point-spread function of the instrument, as convolution weights indexed by detector-pixel offset.
 * The weights are normalized to unit sum.
 */
public final class PointSpreadFunction {

    private static final double NORMALIZATION_TOLERANCE = 1.0e-6;

    private final double[] weights;

    public PointSpreadFunction(double[] weights) {
        if (ArrayUtils.isEmpty(weights)) {
            throw new IuvsProcessingException("Point spread function has no weights");
        }
        double sum = 0.0;
        for (double w : weights) {
            if (Double.isNaN(w)) {
                throw new IuvsProcessingException("Point spread function contains NaN");
            }
            sum += w;
        }
        if (!(sum > 0.0)) {
            throw new IuvsProcessingException("Point spread function weights sum to " + sum);
        }
        if (Math.abs(sum - 1.0) > NORMALIZATION_TOLERANCE) {
            IuvsUtils.LOG.warning("Point spread function weights sum to " + sum + ", normalizing");
        }
        this.weights = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            this.weights[i] = weights[i] / sum;
        }
    }

    /**
     * A PSF which leaves spectra unchanged.
     */
    public static PointSpreadFunction delta() {
        return new PointSpreadFunction(new double[]{1.0});
    }

    public static PointSpreadFunction read(Class<?> anchor, String resourceName) {
        return new PointSpreadFunction(IuvsAuxdata.readVector(anchor, resourceName));
    }

    /**
     * Discrete convolution with zero padding, trimmed to the length of the input and centered on the PSF.
     *
     * @param values - spectrum on the native detector grid
     * @return convolved spectrum of the same length
     */
    public double[] convolveSame(double[] values) {
        final int n = values.length;
        final int offset = (weights.length - 1) / 2;
        final double[] convolved = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = 0.0;
            for (int j = 0; j < weights.length; j++) {
                final int k = i + offset - j;
                if (k >= 0 && k < n) {
                    sum += values[k] * weights[j];
                }
            }
            convolved[i] = sum;
        }
        return convolved;
    }

    public int getSize() {
        return weights.length;
    }

    public double[] getWeights() {
        return weights.clone();
    }
}
