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

import org.junit.Test;

import static org.junit.Assert.*;

public class BinningSchemeTest {

    private static BinningScheme createNightsideBinning() {
        // 50 bins of 4 pixels, starting at detector pixel 172
        return BinningScheme.createUniform(89, 4, 133, 172, 4, 50, 1024);
    }

    @Test
    public void testBinWidthsAndCounts() {
        final BinningScheme binning = createNightsideBinning();
        assertEquals(133, binning.getNumSpatialBins());
        assertEquals(50, binning.getNumSpectralBins());
        assertEquals(4, binning.getSpatialBinWidth());
        assertEquals(4, binning.getSpectralBinWidth());
        assertEquals(172, binning.getSpectralBinOffset());
        assertEquals(43, binning.getStartingSpectralIndex());
        assertEquals(256, binning.getNumNativeSpectralBins());
    }

    @Test
    public void testSpectralBinEdgesInPixels() {
        final int[] edges = createNightsideBinning().getSpectralBinEdgesInPixels();
        assertEquals(51, edges.length);
        assertEquals(172, edges[0]);
        assertEquals(176, edges[1]);
        assertEquals(372, edges[50]);
    }

    @Test
    public void testPixelToBin() {
        final BinningScheme binning = createNightsideBinning();
        assertEquals(0, binning.spectralPixelToBin(172));
        assertEquals(0, binning.spectralPixelToBin(175));
        assertEquals(1, binning.spectralPixelToBin(176));
        assertEquals(49, binning.spectralPixelToBin(371));
        assertEquals(-1, binning.spectralPixelToBin(171));
        assertEquals(-1, binning.spectralPixelToBin(372));

        assertEquals(0, binning.spatialPixelToBin(89));
        assertEquals(132, binning.spatialPixelToBin(89 + 133 * 4 - 1));
        assertEquals(-1, binning.spatialPixelToBin(88));
    }

    @Test
    public void testPadSpectrum() {
        final BinningScheme binning = createNightsideBinning();
        final double[] spectrum = new double[50];
        for (int i = 0; i < spectrum.length; i++) {
            spectrum[i] = i + 1;
        }
        final double[] padded = binning.padSpectrum(spectrum);
        assertEquals(256, padded.length);
        assertTrue(Double.isNaN(padded[0]));
        assertTrue(Double.isNaN(padded[42]));
        assertEquals(1.0, padded[43], 0.0);
        assertEquals(50.0, padded[92], 0.0);
        assertTrue(Double.isNaN(padded[93]));
        assertTrue(Double.isNaN(padded[255]));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPadSpectrumOfWrongLength() {
        createNightsideBinning().padSpectrum(new double[49]);
    }

    @Test
    public void testValidateAlignment() {
        createNightsideBinning().validateAlignment();

        // offset 174 is no multiple of the bin width 4
        final BinningScheme shifted = BinningScheme.createUniform(0, 1, 10, 174, 4, 10, 1024);
        try {
            shifted.validateAlignment();
            fail("InvalidBinningException expected");
        } catch (InvalidBinningException expected) {
            assertTrue(expected.getMessage().contains("not a multiple of the bin width"));
        }

        // bin width 3 does not divide the 1024 detector pixels
        final BinningScheme odd = BinningScheme.createUniform(0, 1, 10, 0, 3, 10, 1024);
        try {
            odd.validateAlignment();
            fail("InvalidBinningException expected");
        } catch (InvalidBinningException expected) {
            assertTrue(expected.getMessage().startsWith("Invalid binning table"));
        }
    }

    @Test(expected = InvalidBinningException.class)
    public void testLowHighTablesOfDifferentLength() {
        new BinningScheme(new int[]{0}, new int[]{0}, new int[]{0, 4}, new int[]{3}, 1024);
    }

    @Test(expected = InvalidBinningException.class)
    public void testOverlappingSpectralBins() {
        new BinningScheme(new int[]{0}, new int[]{0}, new int[]{0, 2}, new int[]{3, 5}, 1024);
    }

    @Test(expected = InvalidBinningException.class)
    public void testSpectralBinsOutsideDetector() {
        BinningScheme.createUniform(0, 1, 1, 1020, 4, 2, 1024);
    }

    @Test(expected = InvalidBinningException.class)
    public void testEmptySpatialTable() {
        new BinningScheme(new int[0], new int[0], new int[]{0}, new int[]{3}, 1024);
    }
}
