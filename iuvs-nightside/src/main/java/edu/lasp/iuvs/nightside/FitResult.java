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

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of fitting one pixel. A failed fit carries the reason and reports NaN for every quantity.
 */
public final class FitResult {

    public enum Status {
        FITTED,
        FIT_FAILED
    }

    private final Status status;
    private final String failureReason;
    private final List<String> templateNames;
    private final Map<String, Double> coefficients;
    private final Map<String, Double> brightness;
    private final Map<String, Double> brightnessUncertainty;
    private final double constant;
    private final double constantError;
    private final double rSquared;
    private final double[] residuals;

    private FitResult(Status status, String failureReason, List<String> templateNames,
                      Map<String, Double> coefficients, Map<String, Double> brightness,
                      Map<String, Double> brightnessUncertainty, double constant, double constantError,
                      double rSquared, double[] residuals) {
        this.status = status;
        this.failureReason = failureReason;
        this.templateNames = Collections.unmodifiableList(templateNames);
        this.coefficients = Collections.unmodifiableMap(coefficients);
        this.brightness = Collections.unmodifiableMap(brightness);
        this.brightnessUncertainty = Collections.unmodifiableMap(brightnessUncertainty);
        this.constant = constant;
        this.constantError = constantError;
        this.rSquared = rSquared;
        this.residuals = residuals;
    }

    static FitResult fitted(List<String> templateNames, double[] coefficients, double[] brightness,
                            double[] brightnessUncertainty, double constant, double constantError,
                            double rSquared, double[] residuals) {
        return new FitResult(Status.FITTED, null, templateNames,
                             toMap(templateNames, coefficients),
                             toMap(templateNames, brightness),
                             toMap(templateNames, brightnessUncertainty),
                             constant, constantError, rSquared, residuals);
    }

    static FitResult failed(String reason, List<String> templateNames, int numSamples) {
        final double[] nan = new double[templateNames.size()];
        Arrays.fill(nan, Double.NaN);
        final double[] residuals = new double[numSamples];
        Arrays.fill(residuals, Double.NaN);
        return new FitResult(Status.FIT_FAILED, reason, templateNames,
                             toMap(templateNames, nan), toMap(templateNames, nan), toMap(templateNames, nan),
                             Double.NaN, Double.NaN, Double.NaN, residuals);
    }

    private static Map<String, Double> toMap(List<String> names, double[] values) {
        final Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(names.get(i), values[i]);
        }
        return map;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isFitted() {
        return status == Status.FITTED;
    }

    /**
     * @return why the fit failed, or null if it did not
     */
    public String getFailureReason() {
        return failureReason;
    }

    public List<String> getTemplateNames() {
        return templateNames;
    }

    public double getCoefficient(String template) {
        return get(coefficients, template);
    }

    /**
     * @return integrated brightness of the template [kR]
     */
    public double getBrightness(String template) {
        return get(brightness, template);
    }

    public double getBrightnessUncertainty(String template) {
        return get(brightnessUncertainty, template);
    }

    public Map<String, Double> getBrightness() {
        return brightness;
    }

    /**
     * Sums the brightness of the given templates; templates not part of the fit are skipped.
     *
     * @return the sum, NaN if the fit failed or none of the templates was fitted
     */
    public double getBrightnessSum(Collection<String> templates) {
        double sum = 0.0;
        boolean any = false;
        for (String template : templates) {
            if (brightness.containsKey(template)) {
                sum += brightness.get(template);
                any = true;
            }
        }
        return any ? sum : Double.NaN;
    }

    /**
     * Fitted DC offset [DN].
     */
    public double getConstant() {
        return constant;
    }

    public double getConstantError() {
        return constantError;
    }

    public double getRSquared() {
        return rSquared;
    }

    /**
     * Observed minus fitted spectrum over the full-width grid, NaN where a sample was not used.
     */
    public double[] getResiduals() {
        return residuals.clone();
    }

    private static double get(Map<String, Double> map, String template) {
        final Double value = map.get(template);
        if (value == null) {
            throw new IllegalArgumentException("Template '" + template + "' was not part of the fit");
        }
        return value;
    }
}
