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

/**
 * IUVS constants
 */
public class IuvsConstants {

    public static final String INSTRUMENT_CONFIG_FILE = "iuvs-instrument.json";

    public static final int DETECTOR_SPECTRAL_PIXELS = 1024;
    public static final int DETECTOR_SPATIAL_PIXELS = 1024;

    /**
     * Size of an IUVS detector pixel [mm].
     */
    public static final double PIXEL_SIZE = 0.023438;
    /**
     * Focal length of the IUVS telescope mirror [mm].
     */
    public static final double TELESCOPE_FOCAL_LENGTH = 100.0;
    /**
     * Width of the slit [mm].
     */
    public static final double SPATIAL_SLIT_WIDTH = 0.1;
    /**
     * Width of the slit [degrees].
     */
    public static final double ANGULAR_SLIT_WIDTH = 10.64;
    /**
     * Saturation level of an IUVS CMOS detector pixel [DN].
     */
    public static final int CMOS_PIXEL_WELL_DEPTH = 3400;

    /**
     * Files taken with an MCP voltage below this value use dayside settings [V].
     */
    public static final double DAY_NIGHT_VOLTAGE_BOUNDARY = 790.0;

    public static final double MINIMUM_MIRROR_ANGLE = 30.2508544921875;
    public static final double MAXIMUM_MIRROR_ANGLE = 59.6502685546875;

    public static final double REFERENCE_MCP_GAIN = 50.909455;

    // volt_correction = c0 + c1 * V + c2 * V^2, fitted to calibration lamp data
    public static final double[] VOLTAGE_CORRECTION_COEFFS = {2.925, -0.0045167, 2.7333e-6};

    public static final double PLANCK_CONSTANT = 6.62607015e-34;
    public static final double SPEED_OF_LIGHT = 299792458.0;

    /**
     * Definition of the kilorayleigh [photons/steradian].
     */
    public static final double KILORAYLEIGH = 1.0e9 / (4.0 * Math.PI);

    public static final String INPUT_INCONSISTENCY_ERROR_MESSAGE =
            "Selected input file(s) are not consistent with the requested processing.";

    private IuvsConstants() {
    }
}
