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
import edu.lasp.iuvs.core.IuvsProcessingException;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;

/**
 * Empirical MCP voltage non-linearity correction, a polynomial in the MCP voltage fitted to calibration lamp
 * data. Radiances are multiplied by it.
 */
public class VoltageCorrection {

    private final PolynomialFunction polynomial;

    public VoltageCorrection(InstrumentConstants constants) {
        final double[] coefficients = constants.getVoltageCorrectionCoefficients();
        if (coefficients.length == 0) {
            throw new IuvsProcessingException("No voltage correction coefficients configured");
        }
        this.polynomial = new PolynomialFunction(coefficients);
    }

    /**
     * @param voltage - MCP voltage [V]
     * @return the correction factor
     */
    public double getCorrection(double voltage) {
        return polynomial.value(voltage);
    }
}
