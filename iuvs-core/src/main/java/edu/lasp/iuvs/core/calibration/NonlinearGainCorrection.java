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

/**
 * Empirical correction of the MCP gain non-linearity. For a count rate {@code n} per detector pixel the
 * correction factor is
 * <pre>
 *     exp(a + b * ln(n)) / n * gain / reference_gain
 * </pre>
 * with {@code a, b} interpolated linearly in MCP voltage from a lab table.
 */
public class NonlinearGainCorrection {

    private final double[] voltages;
    private final double[] aCoefficients;
    private final double[] bCoefficients;
    private final double referenceGain;

    /**
     * @param voltages  - MCP voltages of the table, strictly increasing
     * @param abTable   - one (a, b) row per voltage
     * @param constants - instrument constants providing the reference MCP gain
     */
    public NonlinearGainCorrection(double[] voltages, double[][] abTable, InstrumentConstants constants) {
        if (voltages.length == 0 || voltages.length != abTable.length) {
            throw new IuvsProcessingException("Gain correction table needs one (a, b) row per voltage");
        }
        if (!IuvsUtils.isStrictlyIncreasing(voltages)) {
            throw new IuvsProcessingException("Gain correction voltages must be strictly increasing");
        }
        this.voltages = voltages.clone();
        this.aCoefficients = new double[voltages.length];
        this.bCoefficients = new double[voltages.length];
        for (int i = 0; i < voltages.length; i++) {
            if (abTable[i].length < 2) {
                throw new IuvsProcessingException("Gain correction row " + i + " has less than two columns");
            }
            aCoefficients[i] = abTable[i][0];
            bCoefficients[i] = abTable[i][1];
        }
        this.referenceGain = constants.getReferenceMcpGain();
    }

    /**
     * @param dn       - dark subtracted counts of one bin
     * @param settings - instrument settings of the file
     * @return the multiplicative correction, NaN for non-positive counts
     */
    public double getCorrectionFactor(double dn, InstrumentSettings settings) {
        final double[] ab = interpolateCoefficients(settings.getVoltage());
        return correction(dn, ab[0], ab[1], settings);
    }

    /**
     * Applies the correction to every sample of an image of any spatial layout, flattened.
     */
    public double[] getCorrectionFactors(double[] dn, InstrumentSettings settings) {
        final double[] ab = interpolateCoefficients(settings.getVoltage());
        final double[] factors = new double[dn.length];
        for (int i = 0; i < dn.length; i++) {
            factors[i] = correction(dn[i], ab[0], ab[1], settings);
        }
        return factors;
    }

    double[] interpolateCoefficients(double voltage) {
        final double[] v = {voltage};
        return new double[]{IuvsUtils.interpolateClamped(v, voltages, aCoefficients)[0],
                IuvsUtils.interpolateClamped(v, voltages, bCoefficients)[0]};
    }

    private double correction(double dn, double a, double b, InstrumentSettings settings) {
        final double n = dn / settings.getIntegrationTime() / settings.getSpatialBinWidth() /
                settings.getSpectralBinWidth();
        if (!(n > 0.0)) {
            return Double.NaN;
        }
        return Math.exp(a + b * Math.log(n)) / n * settings.getVoltageGain() / referenceGain;
    }
}
