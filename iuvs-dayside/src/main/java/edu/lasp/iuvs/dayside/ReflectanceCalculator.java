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

import edu.lasp.iuvs.core.InstrumentConstants;
import edu.lasp.iuvs.core.calibration.CalibrationCurve;

import java.util.Arrays;

/**
 * Converts dayside counts into radiance and reflectance (I/F). The corrections are applied in a fixed order:
 * DN to kR, flatfield division, voltage correction, then
 * <pre>
 *     I/F = radiance * pi / cos(sza) / solar_flux
 * </pre>
 * Pixels without direct illumination ({@code sza >= 90}) or off the disk are NaN.
 */
public class ReflectanceCalculator {

    private static final double MAX_SOLAR_ZENITH_ANGLE = 90.0;

    private final VoltageCorrection voltageCorrection;

    public ReflectanceCalculator(InstrumentConstants constants) {
        this.voltageCorrection = new VoltageCorrection(constants);
    }

    /**
     * A pixel is on the disk when its line of sight intersects the surface, i.e. its tangent altitude is 0 km.
     */
    public static boolean isOnDisk(double tangentAltitude) {
        return tangentAltitude == 0.0;
    }

    /**
     * @param spectrumDn       - dark subtracted spectrum of one pixel [DN]
     * @param calibrationCurve - calibration curve of the file [DN/kR]
     * @param flatfield        - flatfield of the pixel's spatial position, or null for none
     * @param voltage          - MCP voltage [V]
     * @return corrected radiance [kR]
     */
    public double[] calibrateRadiance(double[] spectrumDn, CalibrationCurve calibrationCurve, double[] flatfield,
                                      double voltage) {
        final double[] radiance = calibrationCurve.toBrightness(spectrumDn);
        if (flatfield != null) {
            if (flatfield.length != radiance.length) {
                throw new IllegalArgumentException("Flatfield has " + flatfield.length + " values for " +
                                                           radiance.length + " spectral bins");
            }
            for (int i = 0; i < radiance.length; i++) {
                radiance[i] /= flatfield[i];
            }
        }
        final double correction = voltageCorrection.getCorrection(voltage);
        for (int i = 0; i < radiance.length; i++) {
            radiance[i] *= correction;
        }
        return radiance;
    }

    /**
     * @param radiance         - corrected radiance of one pixel [kR]
     * @param solarFlux        - solar flux rebinned to the same spectral bins [kR]
     * @param solarZenithAngle - [deg]
     * @return reflectance per spectral bin, all NaN for unlit pixels
     */
    public double[] toReflectance(double[] radiance, double[] solarFlux, double solarZenithAngle) {
        if (radiance.length != solarFlux.length) {
            throw new IllegalArgumentException("Solar flux has " + solarFlux.length + " values for " +
                                                       radiance.length + " spectral bins");
        }
        final double[] reflectance = new double[radiance.length];
        if (!(solarZenithAngle < MAX_SOLAR_ZENITH_ANGLE)) {
            Arrays.fill(reflectance, Double.NaN);
            return reflectance;
        }
        final double cosSza = Math.cos(Math.toRadians(solarZenithAngle));
        for (int i = 0; i < reflectance.length; i++) {
            reflectance[i] = solarFlux[i] > 0.0 ? radiance[i] * Math.PI / cosSza / solarFlux[i] : Double.NaN;
        }
        return reflectance;
    }

    /**
     * Full chain for one pixel.
     *
     * @param tangentAltitude - [km]; off-disk pixels are NaN
     */
    public double[] toReflectance(double[] spectrumDn, CalibrationCurve calibrationCurve, double[] flatfield,
                                  double voltage, double[] solarFlux, double solarZenithAngle,
                                  double tangentAltitude) {
        if (!isOnDisk(tangentAltitude)) {
            final double[] offDisk = new double[spectrumDn.length];
            Arrays.fill(offDisk, Double.NaN);
            return offDisk;
        }
        final double[] radiance = calibrateRadiance(spectrumDn, calibrationCurve, flatfield, voltage);
        return toReflectance(radiance, solarFlux, solarZenithAngle);
    }
}
