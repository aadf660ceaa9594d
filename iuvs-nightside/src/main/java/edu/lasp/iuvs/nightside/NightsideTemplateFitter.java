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

import edu.lasp.iuvs.core.IuvsProcessingException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

import java.util.ArrayList;
import java.util.List;

/**
 * Weighted least-squares unmixing of a nightside spectrum into emission templates plus a constant offset.
 * <p>
 * All arrays live on the full-width spectral grid of the file ({@code 1024 / spectral_bin_width} samples): the
 * observed spectrum is NaN outside the transmitted window, templates and calibration curve are defined everywhere.
 * Samples with a NaN spectrum value or a non-finite or non-positive uncertainty do not enter the fit.
 * <p>
 * Instances are immutable and may be shared between threads.
 */
public class NightsideTemplateFitter {

    private final List<String> templateNames;
    private final double[][] templates;
    private final double[] brightnessFactors;
    private final int numSamples;

    /**
     * @param templateNames    - names of the fitted templates, in the order of {@code templates}
     * @param templates        - binned and full-width templates, {@code [template][sample]}
     * @param calibrationCurve - DN-to-kR curve of the full-width grid [DN/kR]
     * @param wavelengthWidth  - wavelength width of one spectral bin [nm]
     */
    public NightsideTemplateFitter(List<String> templateNames, double[][] templates, double[] calibrationCurve,
                                   double wavelengthWidth) {
        if (templateNames.isEmpty() || templateNames.size() != templates.length) {
            throw new IuvsProcessingException("Need one name per template, got " + templateNames.size() +
                                                      " names for " + templates.length + " templates");
        }
        this.numSamples = calibrationCurve.length;
        this.templateNames = new ArrayList<>(templateNames);
        this.templates = new double[templates.length][];
        this.brightnessFactors = new double[templates.length];
        for (int t = 0; t < templates.length; t++) {
            if (templates[t].length != numSamples) {
                throw new IuvsProcessingException("Template '" + templateNames.get(t) + "' has " +
                                                          templates[t].length + " samples, calibration curve has " +
                                                          numSamples);
            }
            this.templates[t] = templates[t].clone();
            double factor = 0.0;
            for (int k = 0; k < numSamples; k++) {
                factor += templates[t][k] * wavelengthWidth / calibrationCurve[k];
            }
            brightnessFactors[t] = factor;
        }
    }

    public List<String> getTemplateNames() {
        return new ArrayList<>(templateNames);
    }

    public int getNumSamples() {
        return numSamples;
    }

    /**
     * Fits one pixel. Never throws for numerical reasons: a degenerate pixel yields a failed result.
     *
     * @param spectrum    - dark-subtracted spectrum [DN], NaN where not observed
     * @param uncertainty - 1-sigma uncertainty of the spectrum [DN]
     * @return the fit result
     */
    public FitResult fit(double[] spectrum, double[] uncertainty) {
        if (spectrum.length != numSamples || uncertainty.length != numSamples) {
            throw new IllegalArgumentException("Spectrum and uncertainty need " + numSamples + " samples, got " +
                                                       spectrum.length + " and " + uncertainty.length);
        }
        final int numParameters = templates.length + 1;

        final boolean[] used = new boolean[numSamples];
        int numUsed = 0;
        boolean anyUncertainty = false;
        for (int k = 0; k < numSamples; k++) {
            anyUncertainty |= !Double.isNaN(uncertainty[k]);
            used[k] = !Double.isNaN(spectrum[k]) && !Double.isInfinite(spectrum[k]) &&
                    !Double.isNaN(uncertainty[k]) && !Double.isInfinite(uncertainty[k]) && uncertainty[k] > 0.0;
            if (used[k]) {
                numUsed++;
            }
        }
        if (!anyUncertainty) {
            return FitResult.failed("uncertainty is all NaN", templateNames, numSamples);
        }
        if (numUsed < numParameters + 1) {
            return FitResult.failed("only " + numUsed + " valid samples for " + numParameters + " parameters",
                                    templateNames, numSamples);
        }

        // rows scaled by the square root of the weight 1/sigma^2
        final double[][] x = new double[numUsed][numParameters];
        final double[] y = new double[numUsed];
        int row = 0;
        for (int k = 0; k < numSamples; k++) {
            if (!used[k]) {
                continue;
            }
            final double scale = 1.0 / uncertainty[k];
            x[row][0] = scale;
            for (int t = 0; t < templates.length; t++) {
                x[row][t + 1] = templates[t][k] * scale;
            }
            y[row] = spectrum[k] * scale;
            row++;
        }

        final double[] beta;
        final double[] standardErrors;
        try {
            if (new SingularValueDecomposition(MatrixUtils.createRealMatrix(x)).getRank() < numParameters) {
                return FitResult.failed("singular design matrix", templateNames, numSamples);
            }
            final OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression();
            regression.setNoIntercept(true);
            regression.newSampleData(y, x);
            beta = regression.estimateRegressionParameters();
            standardErrors = regression.estimateRegressionParametersStandardErrors();
        } catch (SingularMatrixException e) {
            return FitResult.failed("singular design matrix", templateNames, numSamples);
        } catch (MathIllegalArgumentException e) {
            return FitResult.failed(e.getMessage(), templateNames, numSamples);
        }

        final double[] residuals = new double[numSamples];
        double sumW = 0.0;
        double sumWy = 0.0;
        double ssr = 0.0;
        for (int k = 0; k < numSamples; k++) {
            if (!used[k]) {
                residuals[k] = Double.NaN;
                continue;
            }
            double model = beta[0];
            for (int t = 0; t < templates.length; t++) {
                model += beta[t + 1] * templates[t][k];
            }
            residuals[k] = spectrum[k] - model;
            final double w = 1.0 / (uncertainty[k] * uncertainty[k]);
            sumW += w;
            sumWy += w * spectrum[k];
            ssr += w * residuals[k] * residuals[k];
        }
        final double weightedMean = sumWy / sumW;
        double tss = 0.0;
        for (int k = 0; k < numSamples; k++) {
            if (used[k]) {
                final double d = spectrum[k] - weightedMean;
                tss += d * d / (uncertainty[k] * uncertainty[k]);
            }
        }
        final double rSquared = tss > 0.0 ? 1.0 - ssr / tss : Double.NaN;

        final double[] coefficients = new double[templates.length];
        final double[] brightness = new double[templates.length];
        final double[] brightnessUncertainty = new double[templates.length];
        for (int t = 0; t < templates.length; t++) {
            coefficients[t] = beta[t + 1];
            brightness[t] = beta[t + 1] * brightnessFactors[t];
            brightnessUncertainty[t] = standardErrors[t + 1] * Math.abs(brightnessFactors[t]);
        }
        return FitResult.fitted(templateNames, coefficients, brightness, brightnessUncertainty,
                                beta[0], standardErrors[0], rSquared, residuals);
    }
}
