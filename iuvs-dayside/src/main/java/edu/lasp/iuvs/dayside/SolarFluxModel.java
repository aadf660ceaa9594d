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

import edu.lasp.iuvs.core.IuvsConstants;
import edu.lasp.iuvs.core.IuvsProcessingException;
import edu.lasp.iuvs.core.binning.BinningScheme;
import edu.lasp.iuvs.core.util.IuvsUtils;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.integration.IterativeLegendreGaussIntegrator;
import org.apache.commons.math3.analysis.integration.UnivariateIntegrator;
import org.apache.commons.math3.exception.MathIllegalStateException;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.stream.IntStream;

/**
 * Solar flux as seen by the instrument. The reference spectrum is converted once from W/m^2/nm into kR/nm,
 * integrated over the native detector pixels, convolved with the point-spread function, scaled to the
 * Mars-Sun distance and finally summed into the spectral bins of an observation.
 * <p>
 * Instances are immutable and may be shared between threads.
 */
public class SolarFluxModel {

    private static final int LEGENDRE_POINTS = 5;
    private static final double RELATIVE_ACCURACY = 1.0e-8;
    private static final double ABSOLUTE_ACCURACY = 1.0e-14;
    private static final int MIN_ITERATIONS = 1;
    private static final int MAX_ITERATIONS = 32;
    private static final int MAX_EVALUATIONS = 100000;

    // [nm]
    private static final double MIN_INTERVAL_WIDTH = 1.0e-12;

    private final double[] wavelengths;
    private final double[] kiloRayleighFlux;
    private final UnivariateFunction irradiance;

    public SolarFluxModel(SolarReferenceSpectrum spectrum) {
        this.wavelengths = spectrum.getWavelengths();
        this.kiloRayleighFlux = toKiloRayleighPerNm(wavelengths, spectrum.getIrradiance());
        this.irradiance = IuvsUtils.createClampedLinearFunction(wavelengths, kiloRayleighFlux);
    }

    /**
     * Converts an irradiance from W/m^2/nm into kR/nm.
     */
    static double[] toKiloRayleighPerNm(double[] wavelengths, double[] wattsPerSquareMeterPerNm) {
        final double[] converted = new double[wavelengths.length];
        for (int i = 0; i < converted.length; i++) {
            converted[i] = wattsPerSquareMeterPerNm[i] * wavelengths[i] * 1.0e-9 /
                    (IuvsConstants.PLANCK_CONSTANT * IuvsConstants.SPEED_OF_LIGHT) * 4.0 * Math.PI * 1.0e-10 / 1000.0;
        }
        return converted;
    }

    /**
     * @param wavelength - [nm]
     * @return solar flux [kR/nm], edge values outside the tabulated range
     */
    public double irradianceAt(double wavelength) {
        return irradiance.value(wavelength);
    }

    /**
     * Integrates the solar flux over a wavelength interval.
     *
     * @param low  - lower bound [nm]
     * @param high - upper bound [nm]
     * @return integrated flux [kR]
     */
    public double integrate(double low, double high) {
        if (Double.isNaN(low) || Double.isNaN(high)) {
            return Double.NaN;
        }
        if (high < low) {
            return -integrate(high, low);
        }
        if (high - low < MIN_INTERVAL_WIDTH) {
            return irradianceAt(0.5 * (low + high)) * (high - low);
        }
        final UnivariateIntegrator integrator =
                new IterativeLegendreGaussIntegrator(LEGENDRE_POINTS, RELATIVE_ACCURACY, ABSOLUTE_ACCURACY,
                                                     MIN_ITERATIONS, MAX_ITERATIONS);
        try {
            return integrator.integrate(MAX_EVALUATIONS, irradiance, low, high);
        } catch (MathIllegalStateException e) {
            if (IuvsUtils.LOG.isLoggable(Level.FINE)) {
                IuvsUtils.LOG.fine("Quadrature over [" + low + ", " + high + "] nm did not converge (" +
                                           e.getMessage() + "), integrating piecewise");
            }
            return integratePiecewise(low, high);
        }
    }

    /**
     * Exact integral of the piecewise-linear flux, for {@code low <= high}.
     */
    double integratePiecewise(double low, double high) {
        int k = Arrays.binarySearch(wavelengths, low);
        k = k >= 0 ? k + 1 : -k - 1;
        double x0 = low;
        double y0 = irradianceAt(low);
        double sum = 0.0;
        for (; k < wavelengths.length && wavelengths[k] < high; k++) {
            sum += 0.5 * (y0 + kiloRayleighFlux[k]) * (wavelengths[k] - x0);
            x0 = wavelengths[k];
            y0 = kiloRayleighFlux[k];
        }
        sum += 0.5 * (y0 + irradianceAt(high)) * (high - x0);
        return sum;
    }

    /**
     * Integrates the solar flux over each detector pixel.
     *
     * @param wavelengthEdges - pixel edges [nm], one more than pixels
     * @return integrated flux per pixel [kR]
     */
    public double[] integratePerPixel(double[] wavelengthEdges) {
        if (wavelengthEdges.length < 2) {
            throw new IuvsProcessingException("Need at least two wavelength edges, got " + wavelengthEdges.length);
        }
        final double min = Math.min(wavelengthEdges[0], wavelengthEdges[wavelengthEdges.length - 1]);
        final double max = Math.max(wavelengthEdges[0], wavelengthEdges[wavelengthEdges.length - 1]);
        if (min < wavelengths[0] || max > wavelengths[wavelengths.length - 1]) {
            IuvsUtils.LOG.fine("Wavelength edges [" + min + ", " + max + "] nm exceed the solar spectrum [" +
                                       wavelengths[0] + ", " + wavelengths[wavelengths.length - 1] +
                                       "] nm, using edge values outside");
        }
        return IntStream.range(0, wavelengthEdges.length - 1).parallel()
                .mapToDouble(i -> integrate(wavelengthEdges[i], wavelengthEdges[i + 1]))
                .toArray();
    }

    /**
     * Solar flux per spectral bin of an observation: integrated at native detector resolution, scaled by
     * 1 / r^2, convolved with the PSF and summed over the detector pixels of each bin.
     *
     * @param detectorWavelengthEdges - wavelength edges of all native detector pixels [nm]
     * @param binning                 - binning scheme of the observation
     * @param psf                     - spectral point-spread function
     * @param sunDistanceRatio        - Mars-Sun distance over Earth-Sun distance
     * @return flux per spectral bin [kR]
     */
    public double[] rebinToInstrument(double[] detectorWavelengthEdges, BinningScheme binning,
                                      PointSpreadFunction psf, double sunDistanceRatio) {
        if (detectorWavelengthEdges.length != binning.getDetectorSpectralPixels() + 1) {
            throw new IuvsProcessingException("Expected " + (binning.getDetectorSpectralPixels() + 1) +
                                                      " detector wavelength edges, got " +
                                                      detectorWavelengthEdges.length);
        }
        if (!(sunDistanceRatio > 0.0)) {
            throw new IuvsProcessingException("Invalid Mars-Sun distance ratio: " + sunDistanceRatio);
        }
        final double[] perPixel = integratePerPixel(detectorWavelengthEdges);
        final double scale = 1.0 / (sunDistanceRatio * sunDistanceRatio);
        for (int i = 0; i < perPixel.length; i++) {
            perPixel[i] *= scale;
        }
        final double[] convolved = psf.convolveSame(perPixel);

        final int[] low = binning.getSpectralPixelLow();
        final int[] high = binning.getSpectralPixelHigh();
        final double[] rebinned = new double[low.length];
        for (int i = 0; i < low.length; i++) {
            double sum = 0.0;
            for (int p = low[i]; p <= high[i]; p++) {
                sum += convolved[p];
            }
            rebinned[i] = sum;
        }
        IuvsUtils.LOG.info("Solar flux rebinned to " + rebinned.length + " spectral bins (r = " +
                                   sunDistanceRatio + ")");
        return rebinned;
    }
}
