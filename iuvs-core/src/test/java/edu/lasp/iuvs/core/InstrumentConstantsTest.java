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

package edu.lasp.iuvs.core;

import org.junit.Test;

import java.io.File;
import java.io.StringReader;

import static org.junit.Assert.*;

public class InstrumentConstantsTest {

    @Test
    public void testDefaults() {
        final InstrumentConstants constants = InstrumentConstants.getDefault();
        assertEquals(IuvsConstants.PIXEL_SIZE, constants.getPixelSize(), 0.0);
        assertEquals(IuvsConstants.TELESCOPE_FOCAL_LENGTH, constants.getFocalLength(), 0.0);
        assertEquals(3400, constants.getPixelWellDepth());
        assertEquals(1024, constants.getDetectorSpectralPixels());
        assertEquals(790.0, constants.getDayNightVoltageBoundary(), 0.0);
        assertEquals(30.2508544921875, constants.getMinimumMirrorAngle(), 0.0);
        assertEquals(59.6502685546875, constants.getMaximumMirrorAngle(), 0.0);
        assertEquals(IuvsConstants.KILORAYLEIGH, constants.getKiloRayleigh(), 1.E-6);
        assertArrayEquals(IuvsConstants.VOLTAGE_CORRECTION_COEFFS, constants.getVoltageCorrectionCoefficients(), 0.0);
        assertSame(constants, InstrumentConstants.getDefault());
    }

    @Test
    public void testDerivedQuantities() {
        final InstrumentConstants constants = InstrumentConstants.getDefault();
        final double pixelOmega = 0.023438 * 0.023438 / (100.0 * 100.0);
        assertEquals(pixelOmega, constants.getPixelOmega(), 1.E-20);
        assertEquals(4 * pixelOmega, constants.getBinOmega(4), 1.E-20);
        assertEquals(3400.0 * 4 * 8, constants.getSaturationThreshold(4, 8), 0.0);
    }

    @Test
    public void testOverrideFallsBackToDefaults() {
        final InstrumentConstants constants =
                InstrumentConstants.load(new StringReader("{\"pixel_size_mm\": 0.05, \"cmos_pixel_well_depth_dn\": 4000}"),
                                         "override.json");
        assertEquals(0.05, constants.getPixelSize(), 0.0);
        assertEquals(4000, constants.getPixelWellDepth());
        assertEquals(IuvsConstants.TELESCOPE_FOCAL_LENGTH, constants.getFocalLength(), 0.0);
        assertEquals(IuvsConstants.REFERENCE_MCP_GAIN, constants.getReferenceMcpGain(), 0.0);
    }

    @Test
    public void testMalformedOverrides() {
        try {
            InstrumentConstants.load(new StringReader("[1, 2]"), "array.json");
            fail("IuvsProcessingException expected");
        } catch (IuvsProcessingException expected) {
            assertTrue(expected.getMessage().contains("array.json"));
        }
        try {
            InstrumentConstants.load(new StringReader("{\"pixel_size_mm\": \"large\"}"), "string.json");
            fail("IuvsProcessingException expected");
        } catch (IuvsProcessingException expected) {
            assertTrue(expected.getMessage().contains("pixel_size_mm"));
        }
        try {
            InstrumentConstants.load(new StringReader("{\"telescope_focal_length_mm\": 0}"), "zero.json");
            fail("IuvsProcessingException expected");
        } catch (IuvsProcessingException expected) {
            assertTrue(expected.getMessage().contains("positive"));
        }
    }

    @Test(expected = IuvsProcessingException.class)
    public void testMissingOverrideFile() {
        InstrumentConstants.load(new File("does-not-exist-iuvs.json"));
    }

    @Test
    public void testChannelKeywords() {
        assertEquals(Channel.MUV, Channel.fromKeyword("muv"));
        assertEquals(Channel.FUV, Channel.fromKeyword(" FUV "));
        try {
            Channel.fromKeyword("echelle");
            fail("IuvsProcessingException expected");
        } catch (IuvsProcessingException expected) {
            assertTrue(expected.getMessage().contains("echelle"));
        }
    }
}
