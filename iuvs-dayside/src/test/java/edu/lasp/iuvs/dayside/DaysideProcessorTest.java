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

import edu.lasp.iuvs.core.Channel;
import edu.lasp.iuvs.core.InstrumentConstants;
import edu.lasp.iuvs.core.InstrumentSettings;
import edu.lasp.iuvs.core.IuvsConstants;
import edu.lasp.iuvs.core.IuvsProcessingException;
import edu.lasp.iuvs.core.binning.BinningScheme;
import edu.lasp.iuvs.core.calibration.SensitivityCurve;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

public class DaysideProcessorTest {

    private static final double KR_PER_W = 1.0e-9 / (IuvsConstants.PLANCK_CONSTANT * IuvsConstants.SPEED_OF_LIGHT) *
            4.0 * Math.PI * 1.0e-10 / 1000.0;

    private InstrumentConstants constants;
    private SensitivityCurve sensitivity;
    private SolarFluxModel solarFluxModel;
    private BinningScheme binning;
    private double[] detectorEdges;

    @Before
    public void setUp() {
        constants = InstrumentConstants.getDefault();
        sensitivity = new SensitivityCurve(new double[]{100.0, 400.0}, new double[]{1.0, 1.0});

        // 1 kR/nm everywhere
        final double[] wavelengths = new double[31];
        final double[] irradiance = new double[31];
        for (int i = 0; i < wavelengths.length; i++) {
            wavelengths[i] = 100.0 + 10.0 * i;
            irradiance[i] = 1.0 / (wavelengths[i] * KR_PER_W);
        }
        solarFluxModel = new SolarFluxModel(new SolarReferenceSpectrum(wavelengths, irradiance));

        binning = BinningScheme.createUniform(0, 1, 2, 172, 4, 5, 1024);
        detectorEdges = new double[1025];
        for (int i = 0; i < detectorEdges.length; i++) {
            detectorEdges[i] = 150.0 + 0.1 * i;
        }
    }

    private InstrumentSettings createSettings(double voltage) {
        final double[] centers = new double[5];
        for (int i = 0; i < centers.length; i++) {
            centers[i] = 150.0 + 0.1 * (174 + 4 * i);
        }
        return new InstrumentSettings(Channel.MUV, binning, voltage, 1.0, 1.0, centers, 0.4);
    }

    private static DaysideObservation createObservation(InstrumentSettings settings, double dnPerBin,
                                                        double[] detectorEdges) {
        final double[][][] dn = new double[2][2][5];
        for (double[][] integration : dn) {
            for (double[] spectrum : integration) {
                Arrays.fill(spectrum, dnPerBin);
            }
        }
        final double[][] sza = {{0.0, 95.0}, {60.0, 0.0}};
        final double[][] tangentAltitude = {{0.0, 0.0}, {0.0, 20.0}};
        return new DaysideObservation(settings, dn, sza, tangentAltitude, 1.0, detectorEdges);
    }

    @Test
    public void testProcess() {
        final InstrumentSettings settings = createSettings(700.0);
        final DaysideProcessor processor = new DaysideProcessor(constants, sensitivity, solarFluxModel,
                                                                PointSpreadFunction.delta(), null);
        final double calibration = 0.4 * IuvsConstants.KILORAYLEIGH * constants.getPixelOmega();
        final DaysideProduct product = processor.process(createObservation(settings, calibration, detectorEdges));

        assertEquals(5, product.getCalibrationCurve().getNumSpectralBins());
        assertArrayEquals(new double[]{0.4, 0.4, 0.4, 0.4, 0.4}, product.getSolarFlux(), 1.E-9);

        final double correction = new VoltageCorrection(constants).getCorrection(700.0);
        final double[][][] radiance = product.getRadiance();
        assertEquals(correction, radiance[0][0][0], 1.E-9);
        assertEquals(correction, radiance[1][1][4], 1.E-9);

        final double[][][] reflectance = product.getReflectance();
        assertEquals(correction * Math.PI / 0.4, reflectance[0][0][2], 1.E-8);
        assertEquals(2.0 * correction * Math.PI / 0.4, reflectance[1][0][2], 1.E-8);
        // unlit and off-disk
        assertTrue(Double.isNaN(reflectance[0][1][2]));
        assertTrue(Double.isNaN(reflectance[1][1][0]));
    }

    @Test
    public void testProcessDerivesDetectorEdgesFromBinCenters() {
        final InstrumentSettings settings = createSettings(700.0);
        final DaysideProcessor processor = new DaysideProcessor(constants, sensitivity, solarFluxModel,
                                                                PointSpreadFunction.delta(), null);
        final DaysideProduct product = processor.process(createObservation(settings, 1000.0, null));
        assertArrayEquals(new double[]{0.4, 0.4, 0.4, 0.4, 0.4}, product.getSolarFlux(), 1.E-6);
    }

    @Test
    public void testProcessWithFlatfield() {
        final InstrumentSettings settings = createSettings(700.0);
        final double[][] ones = new double[2][5];
        final double[][] twos = new double[2][5];
        for (int i = 0; i < 2; i++) {
            Arrays.fill(ones[i], 1.0);
            Arrays.fill(twos[i], 2.0);
        }
        final double[] ffWavelengths = settings.getWavelengthCenters();

        final DaysideProduct plain = new DaysideProcessor(constants, sensitivity, solarFluxModel,
                                                          PointSpreadFunction.delta(), new Flatfield(ones, ffWavelengths))
                .process(createObservation(settings, 1000.0, detectorEdges));
        final DaysideProduct halved = new DaysideProcessor(constants, sensitivity, solarFluxModel,
                                                           PointSpreadFunction.delta(), new Flatfield(twos, ffWavelengths))
                .process(createObservation(settings, 1000.0, detectorEdges));
        assertEquals(0.5 * plain.getReflectance()[0][0][3], halved.getReflectance()[0][0][3], 1.E-9);

        // a flatfield of another binning is interpolated to the file
        final Flatfield coarse = new Flatfield(new double[][]{{2.0, 2.0}, {2.0, 2.0}, {2.0, 2.0}},
                                               new double[]{100.0, 300.0});
        final DaysideProduct interpolated = new DaysideProcessor(constants, sensitivity, solarFluxModel,
                                                                 PointSpreadFunction.delta(), coarse)
                .process(createObservation(settings, 1000.0, detectorEdges));
        assertEquals(halved.getReflectance()[0][0][3], interpolated.getReflectance()[0][0][3], 1.E-9);
    }

    @Test(expected = IuvsProcessingException.class)
    public void testNightsideFileIsRejected() {
        final DaysideProcessor processor = new DaysideProcessor(constants, sensitivity, solarFluxModel,
                                                                PointSpreadFunction.delta(), null);
        processor.process(createObservation(createSettings(900.0), 1000.0, detectorEdges));
    }
}
