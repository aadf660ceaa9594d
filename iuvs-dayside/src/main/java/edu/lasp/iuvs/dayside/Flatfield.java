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

import java.io.File;

/**
 * Detector flatfield tabulated over spatial positions and wavelengths. Radiances are divided by it.
 */
public final class Flatfield {

    private final double[][] values;
    private final double[] wavelengths;

    /**
     * @param values      - flatfield, shape (positions, wavelengths)
     * @param wavelengths - wavelength of each column [nm], strictly increasing
     */
    public Flatfield(double[][] values, double[] wavelengths) {
        if (values.length == 0) {
            throw new IuvsProcessingException("Flatfield has no positions");
        }
        for (int i = 0; i < values.length; i++) {
            if (values[i].length != wavelengths.length) {
                throw new IuvsProcessingException("Flatfield position " + i + " has " + values[i].length +
                                                          " values for " + wavelengths.length + " wavelengths");
            }
        }
        if (!IuvsUtils.isStrictlyIncreasing(wavelengths)) {
            throw new IuvsProcessingException("Flatfield wavelengths must be strictly increasing");
        }
        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            this.values[i] = values[i].clone();
        }
        this.wavelengths = wavelengths.clone();
    }

    /**
     * Reads a flatfield grid and its wavelengths from two ASCII files.
     */
    public static Flatfield read(File gridFile, File wavelengthFile) {
        return new Flatfield(IuvsAuxdata.readGrid(gridFile), IuvsAuxdata.readVector(wavelengthFile));
    }

    public static Flatfield read(Class<?> anchor, String gridResource, String wavelengthResource) {
        return new Flatfield(IuvsAuxdata.readGrid(anchor, gridResource),
                             IuvsAuxdata.readVector(anchor, wavelengthResource));
    }

    /**
     * Interpolates the flatfield to another number of positions and other wavelengths, first along wavelength,
     * then along the slit. Both position grids span the same slit length.
     *
     * @param numPositions   - new number of spatial positions
     * @param newWavelengths - new wavelengths [nm], strictly increasing
     * @return the interpolated flatfield
     */
    public Flatfield interpolateTo(int numPositions, double[] newWavelengths) {
        if (numPositions < 1) {
            throw new IllegalArgumentException("numPositions must be positive: " + numPositions);
        }
        final double[][] byWavelength = new double[values.length][];
        for (int p = 0; p < values.length; p++) {
            byWavelength[p] = IuvsUtils.interpolateClamped(newWavelengths, wavelengths, values[p]);
        }

        final int n = values.length;
        final double[] originalPositions = new double[n];
        for (int p = 0; p < n; p++) {
            originalPositions[p] = p;
        }
        final double[][] interpolated = new double[numPositions][newWavelengths.length];
        final double[] column = new double[n];
        final double[] newPositions = new double[numPositions];
        for (int q = 0; q < numPositions; q++) {
            newPositions[q] = numPositions == 1 ? 0.0 : q * (n - 1.0) / (numPositions - 1.0);
        }
        for (int w = 0; w < newWavelengths.length; w++) {
            for (int p = 0; p < n; p++) {
                column[p] = byWavelength[p][w];
            }
            final double[] resampled = IuvsUtils.interpolateClamped(newPositions, originalPositions, column);
            for (int q = 0; q < numPositions; q++) {
                interpolated[q][w] = resampled[q];
            }
        }
        return new Flatfield(interpolated, newWavelengths);
    }

    public double getValue(int position, int wavelengthIndex) {
        return values[position][wavelengthIndex];
    }

    public double[] getPosition(int position) {
        return values[position].clone();
    }

    public int getNumPositions() {
        return values.length;
    }

    public int getNumWavelengths() {
        return wavelengths.length;
    }

    public double[] getWavelengths() {
        return wavelengths.clone();
    }
}
