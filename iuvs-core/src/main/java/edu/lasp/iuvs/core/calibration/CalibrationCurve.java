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

package edu.lasp.iuvs.core.calibration;

/**
 * Conversion factors from detector counts to brightness [DN/kR], one per spectral bin. All spatial bins of a
 * file share the same spatial bin width, so the curve broadcasts over the spatial axis.
 * Created once per file and read-only afterwards.
 */
public final class CalibrationCurve {

    private final double[] values;
    private final int numSpatialBins;

    CalibrationCurve(double[] values, int numSpatialBins) {
        this.values = values;
        this.numSpatialBins = numSpatialBins;
    }

    public double getValue(int spectralBin) {
        return values[spectralBin];
    }

    public double getValue(int spatialBin, int spectralBin) {
        if (spatialBin < 0 || spatialBin >= numSpatialBins) {
            throw new IndexOutOfBoundsException("spatial bin " + spatialBin + " of " + numSpatialBins);
        }
        return values[spectralBin];
    }

    public int getNumSpectralBins() {
        return values.length;
    }

    public int getNumSpatialBins() {
        return numSpatialBins;
    }

    public double[] getValues() {
        return values.clone();
    }

    /**
     * @return the curve broadcast to shape (spatial bins, spectral bins)
     */
    public double[][] toSpatialSpectralArray() {
        final double[][] array = new double[numSpatialBins][];
        for (int i = 0; i < numSpatialBins; i++) {
            array[i] = values.clone();
        }
        return array;
    }

    /**
     * Converts a spectrum in DN into brightness [kR] per bin.
     */
    public double[] toBrightness(double[] spectrumDn) {
        if (spectrumDn.length != values.length) {
            throw new IllegalArgumentException("spectrum has " + spectrumDn.length + " bins, calibration curve " +
                                                       values.length);
        }
        final double[] brightness = new double[spectrumDn.length];
        for (int i = 0; i < brightness.length; i++) {
            brightness[i] = spectrumDn[i] / values[i];
        }
        return brightness;
    }
}
