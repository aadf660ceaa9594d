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

import edu.lasp.iuvs.core.InstrumentConstants;
import edu.lasp.iuvs.core.InstrumentSettings;
import edu.lasp.iuvs.core.IuvsProcessingException;
import edu.lasp.iuvs.core.util.IuvsUtils;
import org.apache.commons.math3.stat.descriptive.moment.Mean;

import java.util.logging.Level;

/**
 * Builds the DN-to-kR conversion of one file:
 * <pre>
 *     wavelength_width * voltage_gain * integration_time * kR * sensitivity(lambda) * pixel_omega * spatial_bin_width
 * </pre>
 */
public class CalibrationCurveBuilder {

    private final InstrumentConstants constants;

    public CalibrationCurveBuilder(InstrumentConstants constants) {
        this.constants = constants;
    }

    /**
     * @param sensitivityCurve - detector sensitivity
     * @param settings         - instrument settings of the file
     * @return the calibration curve, one value per wavelength center of the settings
     * @throws edu.lasp.iuvs.core.binning.InvalidBinningException if the spectral bins do not line up with the
     *                                                              bin width
     * @throws IuvsProcessingException if the sensitivity curve does not overlap the observed wavelengths
     */
    public CalibrationCurve build(SensitivityCurve sensitivityCurve, InstrumentSettings settings) {
        settings.getBinning().validateAlignment();

        final double[] centers = settings.getWavelengthCenters();
        checkCoverage(sensitivityCurve, centers);

        final double factor = settings.getWavelengthWidth() * settings.getVoltageGain() *
                settings.getIntegrationTime() * constants.getKiloRayleigh() *
                constants.getBinOmega(settings.getSpatialBinWidth());
        final double[] sensitivity = sensitivityCurve.valuesAt(centers);
        final double[] values = new double[centers.length];
        for (int i = 0; i < values.length; i++) {
            values[i] = factor * sensitivity[i];
        }

        if (IuvsUtils.LOG.isLoggable(Level.INFO)) {
            IuvsUtils.LOG.info("Calibration curve built: " + values.length + " spectral bins, mean " +
                                       new Mean().evaluate(values) + " DN/kR");
        }
        return new CalibrationCurve(values, settings.getBinning().getNumSpatialBins());
    }

    private static void checkCoverage(SensitivityCurve curve, double[] centers) {
        if (centers.length == 0) {
            throw new IuvsProcessingException("No wavelength centers to calibrate");
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double c : centers) {
            min = Math.min(min, c);
            max = Math.max(max, c);
        }
        if (Double.isNaN(min) || Double.isNaN(max)) {
            throw new IuvsProcessingException("Wavelength centers contain NaN");
        }
        if (max < curve.getMinWavelength() || min > curve.getMaxWavelength()) {
            throw new IuvsProcessingException("Sensitivity curve [" + curve.getMinWavelength() + ", " +
                                                      curve.getMaxWavelength() + "] nm does not cover the observed " +
                                                      "wavelengths [" + min + ", " + max + "] nm");
        }
        if (!curve.covers(min, max)) {
            IuvsUtils.LOG.warning("Sensitivity curve [" + curve.getMinWavelength() + ", " + curve.getMaxWavelength() +
                                          "] nm only partly covers [" + min + ", " + max +
                                          "] nm, using edge values outside");
        }
    }
}
