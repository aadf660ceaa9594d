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

import edu.lasp.iuvs.core.calibration.CalibrationCurve;

/**
 * Results of the dayside processing of one file.
 */
public final class DaysideProduct {

    private final CalibrationCurve calibrationCurve;
    private final double[] solarFlux;
    private final double[][][] radiance;
    private final double[][][] reflectance;

    DaysideProduct(CalibrationCurve calibrationCurve, double[] solarFlux, double[][][] radiance,
                   double[][][] reflectance) {
        this.calibrationCurve = calibrationCurve;
        this.solarFlux = solarFlux;
        this.radiance = radiance;
        this.reflectance = reflectance;
    }

    public CalibrationCurve getCalibrationCurve() {
        return calibrationCurve;
    }

    /**
     * @return solar flux per spectral bin [kR]
     */
    public double[] getSolarFlux() {
        return solarFlux.clone();
    }

    /**
     * @return radiance, shape (integrations, spatial bins, spectral bins) [kR]
     */
    public double[][][] getRadiance() {
        return radiance;
    }

    /**
     * @return reflectance, shape (integrations, spatial bins, spectral bins), NaN where undefined
     */
    public double[][][] getReflectance() {
        return reflectance;
    }
}
