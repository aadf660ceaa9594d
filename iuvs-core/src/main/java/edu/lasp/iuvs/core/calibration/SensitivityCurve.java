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

import edu.lasp.iuvs.core.IuvsProcessingException;
import edu.lasp.iuvs.core.util.IuvsUtils;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.math3.analysis.UnivariateFunction;

/**
 * Detector sensitivity [DN / (photons / cm^2) at gain 1] tabulated over wavelength.
 * Outside the tabulated range the edge values are used.
 */
public final class SensitivityCurve {

    private final double[] wavelengths;
    private final double[] responsivity;
    private final UnivariateFunction interpolant;

    public SensitivityCurve(double[] wavelengths, double[] responsivity) {
        if (ArrayUtils.isEmpty(wavelengths) || ArrayUtils.getLength(wavelengths) != ArrayUtils.getLength(responsivity)) {
            throw new IuvsProcessingException("Sensitivity curve needs matching, non-empty wavelength and " +
                                                      "responsivity tables");
        }
        if (!IuvsUtils.isStrictlyIncreasing(wavelengths)) {
            throw new IuvsProcessingException("Sensitivity curve wavelengths must be strictly increasing");
        }
        this.wavelengths = wavelengths.clone();
        this.responsivity = responsivity.clone();
        this.interpolant = IuvsUtils.createClampedLinearFunction(this.wavelengths, this.responsivity);
    }

    /**
     * Creates a curve from a two-column table (wavelength [nm], responsivity).
     */
    public static SensitivityCurve fromTable(double[][] table) {
        final double[] w = new double[table.length];
        final double[] r = new double[table.length];
        for (int i = 0; i < table.length; i++) {
            if (table[i].length < 2) {
                throw new IuvsProcessingException("Sensitivity table row " + i + " has less than two columns");
            }
            w[i] = table[i][0];
            r[i] = table[i][1];
        }
        return new SensitivityCurve(w, r);
    }

    public double valueAt(double wavelength) {
        return interpolant.value(wavelength);
    }

    public double[] valuesAt(double[] wavelengthCenters) {
        final double[] values = new double[wavelengthCenters.length];
        for (int i = 0; i < values.length; i++) {
            values[i] = interpolant.value(wavelengthCenters[i]);
        }
        return values;
    }

    public boolean covers(double minWavelength, double maxWavelength) {
        return minWavelength >= getMinWavelength() && maxWavelength <= getMaxWavelength();
    }

    public double getMinWavelength() {
        return wavelengths[0];
    }

    public double getMaxWavelength() {
        return wavelengths[wavelengths.length - 1];
    }

    public double[] getWavelengths() {
        return wavelengths.clone();
    }

    public double[] getResponsivity() {
        return responsivity.clone();
    }
}
