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

package edu.lasp.iuvs.nightside;

import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class NightsideTemplateFitterTest {

    private static final int N = 20;
    private static final List<String> NAMES = Arrays.asList("a", "b");

    private double[] templateA;
    private double[] templateB;
    private double[] ones;

    @Before
    public void setUp() {
        templateA = new double[N];
        templateB = new double[N];
        ones = new double[N];
        for (int k = 0; k < N; k++) {
            templateA[k] = k;
            templateB[k] = (k - 10.0) * (k - 10.0);
            ones[k] = 1.0;
        }
    }

    private NightsideTemplateFitter createFitter() {
        return new NightsideTemplateFitter(NAMES, new double[][]{templateA, templateB}, ones, 1.0);
    }

    private double[] createSpectrum(double constant, double a, double b) {
        final double[] spectrum = new double[N];
        for (int k = 0; k < N; k++) {
            spectrum[k] = constant + a * templateA[k] + b * templateB[k];
        }
        return spectrum;
    }

    @Test
    public void testExactCombinationIsRecovered() {
        final FitResult result = createFitter().fit(createSpectrum(2.0, 3.0, -0.5), ones);
        assertTrue(result.isFitted());
        assertNull(result.getFailureReason());
        assertEquals(3.0, result.getCoefficient("a"), 1.E-9);
        assertEquals(-0.5, result.getCoefficient("b"), 1.E-9);
        assertEquals(2.0, result.getConstant(), 1.E-8);
        assertEquals(1.0, result.getRSquared(), 1.E-12);
        for (double residual : result.getResiduals()) {
            assertEquals(0.0, residual, 1.E-8);
        }
    }

    @Test
    public void testBrightnessIsIntegratedOverTheCalibratedTemplate() {
        final double[] calibrationCurve = new double[N];
        Arrays.fill(calibrationCurve, 4.0);
        final NightsideTemplateFitter fitter = new NightsideTemplateFitter(NAMES, new double[][]{templateA, templateB},
                                                                           calibrationCurve, 0.5);
        final FitResult result = fitter.fit(createSpectrum(0.0, 3.0, 1.0), ones);

        double sumA = 0.0;
        double sumB = 0.0;
        for (int k = 0; k < N; k++) {
            sumA += templateA[k];
            sumB += templateB[k];
        }
        assertEquals(3.0 * sumA * 0.5 / 4.0, result.getBrightness("a"), 1.E-7);
        assertEquals(sumB * 0.5 / 4.0, result.getBrightness("b"), 1.E-7);
        assertEquals(result.getBrightness("a") + result.getBrightness("b"),
                     result.getBrightnessSum(Arrays.asList("a", "b", "not-fitted")), 1.E-9);
    }

    @Test
    public void testNaNSamplesAreExcluded() {
        final double[] spectrum = createSpectrum(1.0, 2.0, 0.25);
        spectrum[3] = Double.NaN;
        spectrum[7] = Double.NaN;
        final double[] uncertainty = ones.clone();
        uncertainty[11] = Double.NaN;

        final FitResult result = createFitter().fit(spectrum, uncertainty);
        assertTrue(result.isFitted());
        assertEquals(2.0, result.getCoefficient("a"), 1.E-9);
        assertEquals(0.25, result.getCoefficient("b"), 1.E-9);
        final double[] residuals = result.getResiduals();
        assertTrue(Double.isNaN(residuals[3]));
        assertTrue(Double.isNaN(residuals[7]));
        assertTrue(Double.isNaN(residuals[11]));
        assertEquals(0.0, residuals[4], 1.E-8);
    }

    @Test
    public void testSamplesAreWeightedByInverseVariance() {
        final double[] spectrum = createSpectrum(1.0, 2.0, 0.25);
        final double[] uncertainty = ones.clone();
        spectrum[5] += 1000.0;
        uncertainty[5] = 1.0e8;

        final FitResult result = createFitter().fit(spectrum, uncertainty);
        assertEquals(2.0, result.getCoefficient("a"), 1.E-6);
        assertEquals(0.25, result.getCoefficient("b"), 1.E-6);
    }

    @Test
    public void testUncertaintyGrowsWithNoise() {
        final double[] spectrum = createSpectrum(1.0, 2.0, 0.25);
        for (int k = 0; k < N; k++) {
            spectrum[k] += (k % 2 == 0) ? 0.3 : -0.3;
        }
        final FitResult result = createFitter().fit(spectrum, ones);
        assertTrue(result.isFitted());
        assertTrue(result.getBrightnessUncertainty("a") > 0.0);
        assertTrue(result.getConstantError() > 0.0);
        assertTrue(result.getRSquared() < 1.0);
    }

    @Test
    public void testAllNaNUncertaintyFails() {
        final double[] uncertainty = new double[N];
        Arrays.fill(uncertainty, Double.NaN);
        final FitResult result = createFitter().fit(createSpectrum(1.0, 1.0, 1.0), uncertainty);
        assertFalse(result.isFitted());
        assertEquals(FitResult.Status.FIT_FAILED, result.getStatus());
        assertNotNull(result.getFailureReason());
        assertTrue(Double.isNaN(result.getBrightness("a")));
        assertTrue(Double.isNaN(result.getBrightnessUncertainty("b")));
        assertTrue(Double.isNaN(result.getConstant()));
        assertTrue(Double.isNaN(result.getBrightnessSum(NAMES)));
    }

    @Test
    public void testSingularDesignMatrixFails() {
        final double[] doubled = new double[N];
        for (int k = 0; k < N; k++) {
            doubled[k] = 2.0 * templateA[k];
        }
        final NightsideTemplateFitter duplicate = new NightsideTemplateFitter(NAMES, new double[][]{templateA, doubled},
                                                                              ones, 1.0);
        final FitResult result = duplicate.fit(createSpectrum(1.0, 1.0, 0.0), ones);
        assertEquals(FitResult.Status.FIT_FAILED, result.getStatus());
        assertEquals("singular design matrix", result.getFailureReason());

        // a flat template is indistinguishable from the constant term
        final NightsideTemplateFitter flat = new NightsideTemplateFitter(NAMES, new double[][]{templateA, ones},
                                                                         ones, 1.0);
        assertFalse(flat.fit(createSpectrum(1.0, 1.0, 0.0), ones).isFitted());
    }

    @Test
    public void testTooFewSamplesFails() {
        final double[] spectrum = new double[N];
        Arrays.fill(spectrum, Double.NaN);
        spectrum[0] = 1.0;
        spectrum[1] = 2.0;
        spectrum[2] = 3.0;
        final FitResult result = createFitter().fit(spectrum, ones);
        assertFalse(result.isFitted());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSpectrumLengthMustMatch() {
        createFitter().fit(new double[N - 1], new double[N - 1]);
    }
}
