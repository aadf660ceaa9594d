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
import edu.lasp.iuvs.core.binning.BinningScheme;
import org.apache.commons.math3.fitting.PolynomialCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;

/**
 * Linear dispersion relation between detector pixel and wavelength, fitted to the bin center wavelengths of
 * one spatial position.
 */
public final class WavelengthDispersion {

    private final double offset;
    private final double slope;

    WavelengthDispersion(double offset, double slope) {
        this.offset = offset;
        this.slope = slope;
    }

    /**
     * @param binning           - binning scheme of the observation
     * @param wavelengthCenters - center wavelength of each spectral bin [nm]
     * @return the fitted dispersion
     */
    public static WavelengthDispersion fit(BinningScheme binning, double[] wavelengthCenters) {
        final int[] low = binning.getSpectralPixelLow();
        final int[] high = binning.getSpectralPixelHigh();
        if (wavelengthCenters.length != low.length) {
            throw new IuvsProcessingException("Got " + wavelengthCenters.length + " wavelength centers for " +
                                                      low.length + " spectral bins");
        }
        if (low.length < 2) {
            throw new IuvsProcessingException("Need at least two spectral bins to fit the dispersion");
        }
        final WeightedObservedPoints points = new WeightedObservedPoints();
        for (int i = 0; i < low.length; i++) {
            points.add((low[i] + high[i] + 1) / 2.0, wavelengthCenters[i]);
        }
        final double[] coefficients = PolynomialCurveFitter.create(1).fit(points.toList());
        return new WavelengthDispersion(coefficients[0], coefficients[1]);
    }

    /**
     * @param pixel - detector pixel coordinate; pixel {@code i} spans {@code [i, i + 1)}
     * @return wavelength [nm]
     */
    public double wavelengthAt(double pixel) {
        return offset + slope * pixel;
    }

    /**
     * @param numPixels - number of detector pixels
     * @return wavelength edges of all detector pixels [nm], {@code numPixels + 1} values
     */
    public double[] getPixelEdges(int numPixels) {
        final double[] edges = new double[numPixels + 1];
        for (int i = 0; i < edges.length; i++) {
            edges[i] = wavelengthAt(i);
        }
        return edges;
    }

    public double getOffset() {
        return offset;
    }

    public double getSlope() {
        return slope;
    }
}
