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
import edu.lasp.iuvs.core.InstrumentSettings;
import edu.lasp.iuvs.core.IuvsConstants;
import edu.lasp.iuvs.core.IuvsProcessingException;
import edu.lasp.iuvs.core.binning.BinningScheme;
import edu.lasp.iuvs.core.calibration.CalibrationCurve;
import edu.lasp.iuvs.core.calibration.CalibrationCurveBuilder;
import edu.lasp.iuvs.core.calibration.SensitivityCurve;
import edu.lasp.iuvs.core.util.IuvsUtils;

import java.util.Arrays;

/**
 * Dayside processing of one file: calibration curve, solar flux, radiance and reflectance.
 * The auxiliary data (sensitivity, solar spectrum, PSF, flatfield) are shared read-only between files.
 */
public class DaysideProcessor {

    private final InstrumentConstants constants;
    private final SensitivityCurve sensitivityCurve;
    private final SolarFluxModel solarFluxModel;
    private final PointSpreadFunction psf;
    private final Flatfield flatfield;
    private final CalibrationCurveBuilder calibrationCurveBuilder;
    private final ReflectanceCalculator reflectanceCalculator;

    /**
     * @param constants        - instrument constants
     * @param sensitivityCurve - detector sensitivity
     * @param solarFluxModel   - solar flux model built from the solar spectrum of the observation period
     * @param psf              - spectral point-spread function
     * @param flatfield        - flatfield, or null to skip the flatfield correction
     */
    public DaysideProcessor(InstrumentConstants constants, SensitivityCurve sensitivityCurve,
                            SolarFluxModel solarFluxModel, PointSpreadFunction psf, Flatfield flatfield) {
        this.constants = constants;
        this.sensitivityCurve = sensitivityCurve;
        this.solarFluxModel = solarFluxModel;
        this.psf = psf;
        this.flatfield = flatfield;
        this.calibrationCurveBuilder = new CalibrationCurveBuilder(constants);
        this.reflectanceCalculator = new ReflectanceCalculator(constants);
    }

    public DaysideProduct process(DaysideObservation observation) {
        final InstrumentSettings settings = observation.getSettings();
        if (!settings.isDayside(constants)) {
            throw new IuvsProcessingException(IuvsConstants.INPUT_INCONSISTENCY_ERROR_MESSAGE +
                                                      " MCP voltage " + settings.getVoltage() +
                                                      " V is a nightside setting.");
        }
        final BinningScheme binning = settings.getBinning();

        final CalibrationCurve calibrationCurve = calibrationCurveBuilder.build(sensitivityCurve, settings);

        double[] edges = observation.getDetectorWavelengthEdges();
        if (edges == null) {
            edges = WavelengthDispersion.fit(binning, settings.getWavelengthCenters())
                    .getPixelEdges(binning.getDetectorSpectralPixels());
        }
        final double[] solarFlux = solarFluxModel.rebinToInstrument(edges, binning, psf,
                                                                    observation.getSunDistanceRatio());
        final Flatfield fileFlatfield = getFlatfieldFor(settings);

        final int numIntegrations = observation.getNumIntegrations();
        final int numSpatial = binning.getNumSpatialBins();
        final double[][][] radiance = new double[numIntegrations][numSpatial][];
        final double[][][] reflectance = new double[numIntegrations][numSpatial][];
        int numValidPixels = 0;
        for (int i = 0; i < numIntegrations; i++) {
            for (int s = 0; s < numSpatial; s++) {
                final double[] ffRow = fileFlatfield == null ? null : fileFlatfield.getPosition(s);
                radiance[i][s] = reflectanceCalculator.calibrateRadiance(observation.getSpectrum(i, s),
                                                                         calibrationCurve, ffRow,
                                                                         settings.getVoltage());
                if (ReflectanceCalculator.isOnDisk(observation.getTangentAltitude(i, s))) {
                    reflectance[i][s] = reflectanceCalculator.toReflectance(radiance[i][s], solarFlux,
                                                                            observation.getSolarZenithAngle(i, s));
                    if (!Double.isNaN(reflectance[i][s][0])) {
                        numValidPixels++;
                    }
                } else {
                    reflectance[i][s] = new double[radiance[i][s].length];
                    Arrays.fill(reflectance[i][s], Double.NaN);
                }
            }
        }
        IuvsUtils.LOG.info("Dayside processing done: " + numIntegrations + " integrations, " + numValidPixels +
                                   " of " + numIntegrations * numSpatial + " pixels lit and on disk");
        return new DaysideProduct(calibrationCurve, solarFlux, radiance, reflectance);
    }

    private Flatfield getFlatfieldFor(InstrumentSettings settings) {
        if (flatfield == null) {
            return null;
        }
        final int numSpatial = settings.getBinning().getNumSpatialBins();
        if (flatfield.getNumPositions() == numSpatial && flatfield.getNumWavelengths() == settings.getNumWavelengths()) {
            return flatfield;
        }
        return flatfield.interpolateTo(numSpatial, settings.getWavelengthCenters());
    }
}
