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

package edu.lasp.iuvs.core.binning;

import edu.lasp.iuvs.core.util.IuvsUtils;
import org.apache.commons.lang3.ArrayUtils;

import java.util.Arrays;

/**
 * Describes how the detector pixels of one file are grouped into spatial and spectral bins.
 * Pixel ranges are inclusive on both ends, as in the binning tables of the L1b files.
 * <p>
 * All conversions between detector pixels, bins and padded full-width spectra go through this class.
 */
public final class BinningScheme {

    private final int[] spatialPixelLow;
    private final int[] spatialPixelHigh;
    private final int[] spectralPixelLow;
    private final int[] spectralPixelHigh;
    private final int detectorSpectralPixels;

    private final int spatialBinWidth;
    private final int spectralBinWidth;

    /**
     * @param spatialPixelLow        - first detector pixel of each spatial bin
     * @param spatialPixelHigh       - last detector pixel of each spatial bin
     * @param spectralPixelLow       - first detector pixel of each spectral bin
     * @param spectralPixelHigh      - last detector pixel of each spectral bin
     * @param detectorSpectralPixels - number of native spectral pixels of the detector
     * @throws InvalidBinningException if the table is structurally broken
     */
    public BinningScheme(int[] spatialPixelLow, int[] spatialPixelHigh,
                         int[] spectralPixelLow, int[] spectralPixelHigh, int detectorSpectralPixels) {
        checkPairs("spatial", spatialPixelLow, spatialPixelHigh);
        checkPairs("spectral", spectralPixelLow, spectralPixelHigh);
        this.spatialPixelLow = spatialPixelLow.clone();
        this.spatialPixelHigh = spatialPixelHigh.clone();
        this.spectralPixelLow = spectralPixelLow.clone();
        this.spectralPixelHigh = spectralPixelHigh.clone();
        this.detectorSpectralPixels = detectorSpectralPixels;
        this.spatialBinWidth = IuvsUtils.median(widths(spatialPixelLow, spatialPixelHigh));
        this.spectralBinWidth = IuvsUtils.median(widths(spectralPixelLow, spectralPixelHigh));
        validateSpectralBins();
    }

    /**
     * Creates a scheme of equally wide, contiguous bins.
     */
    public static BinningScheme createUniform(int spatialOffset, int spatialBinWidth, int numSpatialBins,
                                              int spectralOffset, int spectralBinWidth, int numSpectralBins,
                                              int detectorSpectralPixels) {
        final int[] spaLow = new int[numSpatialBins];
        final int[] spaHigh = new int[numSpatialBins];
        for (int i = 0; i < numSpatialBins; i++) {
            spaLow[i] = spatialOffset + i * spatialBinWidth;
            spaHigh[i] = spaLow[i] + spatialBinWidth - 1;
        }
        final int[] speLow = new int[numSpectralBins];
        final int[] speHigh = new int[numSpectralBins];
        for (int i = 0; i < numSpectralBins; i++) {
            speLow[i] = spectralOffset + i * spectralBinWidth;
            speHigh[i] = speLow[i] + spectralBinWidth - 1;
        }
        return new BinningScheme(spaLow, spaHigh, speLow, speHigh, detectorSpectralPixels);
    }

    public int getNumSpatialBins() {
        return spatialPixelLow.length;
    }

    public int getNumSpectralBins() {
        return spectralPixelLow.length;
    }

    public int getSpatialBinWidth() {
        return spatialBinWidth;
    }

    public int getSpectralBinWidth() {
        return spectralBinWidth;
    }

    public int getDetectorSpectralPixels() {
        return detectorSpectralPixels;
    }

    /**
     * First detector pixel of the transmitted spectral window.
     */
    public int getSpectralBinOffset() {
        return spectralPixelLow[0];
    }

    /**
     * Index of the first transmitted bin within a spectrum binned over the whole detector.
     */
    public int getStartingSpectralIndex() {
        return spectralPixelLow[0] / spectralBinWidth;
    }

    /**
     * Number of bins a spectrum would have if the whole detector had been transmitted with this bin width.
     */
    public int getNumNativeSpectralBins() {
        return detectorSpectralPixels / spectralBinWidth;
    }

    public int[] getSpectralPixelLow() {
        return spectralPixelLow.clone();
    }

    public int[] getSpectralPixelHigh() {
        return spectralPixelHigh.clone();
    }

    public int[] getSpatialPixelLow() {
        return spatialPixelLow.clone();
    }

    public int[] getSpatialPixelHigh() {
        return spatialPixelHigh.clone();
    }

    /**
     * Detector-pixel edges of the spectral bins: bin {@code i} covers pixels
     * {@code [edges[i], edges[i + 1])}.
     *
     * @return array of length {@code numSpectralBins + 1}
     */
    public int[] getSpectralBinEdgesInPixels() {
        final int n = spectralPixelLow.length;
        final int[] edges = Arrays.copyOf(spectralPixelLow, n + 1);
        edges[n] = spectralPixelHigh[n - 1] + 1;
        return edges;
    }

    /**
     * @param pixel - a native detector spectral pixel
     * @return the spectral bin containing the pixel, or -1 if the pixel was not transmitted
     */
    public int spectralPixelToBin(int pixel) {
        for (int i = 0; i < spectralPixelLow.length; i++) {
            if (pixel >= spectralPixelLow[i] && pixel <= spectralPixelHigh[i]) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @param pixel - a native detector spatial pixel
     * @return the spatial bin containing the pixel, or -1 if the pixel was not transmitted
     */
    public int spatialPixelToBin(int pixel) {
        for (int i = 0; i < spatialPixelLow.length; i++) {
            if (pixel >= spatialPixelLow[i] && pixel <= spatialPixelHigh[i]) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Places a transmitted spectrum at its position within the full-width binned spectrum.
     * Samples which were not transmitted are NaN.
     *
     * @param spectrum - spectrum with {@link #getNumSpectralBins()} samples
     * @return spectrum with {@link #getNumNativeSpectralBins()} samples
     */
    public double[] padSpectrum(double[] spectrum) {
        validateAlignment();
        if (spectrum.length != getNumSpectralBins()) {
            throw new IllegalArgumentException("Spectrum has " + spectrum.length + " samples, binning scheme has " +
                                                       getNumSpectralBins() + " spectral bins");
        }
        final double[] padded = new double[getNumNativeSpectralBins()];
        Arrays.fill(padded, Double.NaN);
        for (int i = 0; i < spectrum.length; i++) {
            padded[spectralPixelLow[i] / spectralBinWidth] = spectrum[i];
        }
        return padded;
    }

    /**
     * Checks that the spectral bins line up with a regular grid of {@link #getSpectralBinWidth()} pixels starting
     * at detector pixel 0, which is required to relate the transmitted bins to full-detector curves.
     *
     * @throws InvalidBinningException if the bins are not aligned
     */
    public void validateAlignment() {
        if (detectorSpectralPixels % spectralBinWidth != 0) {
            throw new InvalidBinningException("spectral bin width " + spectralBinWidth +
                                                      " does not divide the " + detectorSpectralPixels +
                                                      " detector pixels");
        }
        for (int i = 0; i < spectralPixelLow.length; i++) {
            if (spectralPixelLow[i] % spectralBinWidth != 0) {
                throw new InvalidBinningException("spectral bin " + i + " starts at pixel " + spectralPixelLow[i] +
                                                          ", which is not a multiple of the bin width " +
                                                          spectralBinWidth);
            }
            if (spectralPixelHigh[i] - spectralPixelLow[i] + 1 != spectralBinWidth) {
                throw new InvalidBinningException("spectral bin " + i + " is " +
                                                          (spectralPixelHigh[i] - spectralPixelLow[i] + 1) +
                                                          " pixels wide, expected " + spectralBinWidth);
            }
        }
    }

    private void validateSpectralBins() {
        if (spectralBinWidth <= 0 || spatialBinWidth <= 0) {
            throw new InvalidBinningException("bin widths must be positive (spatial " + spatialBinWidth +
                                                      ", spectral " + spectralBinWidth + ")");
        }
        for (int i = 0; i < spectralPixelLow.length; i++) {
            if (spectralPixelLow[i] < 0 || spectralPixelHigh[i] >= detectorSpectralPixels) {
                throw new InvalidBinningException("spectral bin " + i + " lies outside the detector");
            }
            if (i > 0 && spectralPixelLow[i] <= spectralPixelHigh[i - 1]) {
                throw new InvalidBinningException("spectral bins " + (i - 1) + " and " + i + " overlap");
            }
        }
    }

    private static void checkPairs(String axis, int[] low, int[] high) {
        if (ArrayUtils.isEmpty(low) || ArrayUtils.isEmpty(high)) {
            throw new InvalidBinningException("no " + axis + " bins");
        }
        if (low.length != high.length) {
            throw new InvalidBinningException(axis + " low/high tables differ in length (" + low.length +
                                                      " vs. " + high.length + ")");
        }
        for (int i = 0; i < low.length; i++) {
            if (high[i] < low[i]) {
                throw new InvalidBinningException(axis + " bin " + i + " ends before it starts");
            }
        }
    }

    private static int[] widths(int[] low, int[] high) {
        final int[] widths = new int[low.length];
        for (int i = 0; i < low.length; i++) {
            widths[i] = high[i] - low[i] + 1;
        }
        return widths;
    }
}
