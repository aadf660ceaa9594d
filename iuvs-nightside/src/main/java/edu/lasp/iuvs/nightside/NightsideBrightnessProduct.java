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

import edu.lasp.iuvs.core.calibration.CalibrationCurve;
import edu.lasp.iuvs.core.util.IuvsUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Brightness maps of one nightside file, {@code [integration][spatial]} in kR. Failed pixels are NaN.
 */
public final class NightsideBrightnessProduct {

    private final CalibrationCurve calibrationCurve;
    private final FitResult[][] fitResults;
    private final List<String> templateNames;
    private final Set<String> auroraGroup;
    private final int numFailedPixels;

    NightsideBrightnessProduct(CalibrationCurve calibrationCurve, FitResult[][] fitResults,
                               List<String> templateNames, Set<String> auroraGroup) {
        this.calibrationCurve = calibrationCurve;
        this.fitResults = fitResults;
        this.templateNames = Collections.unmodifiableList(templateNames);
        this.auroraGroup = auroraGroup;
        int failed = 0;
        for (FitResult[] row : fitResults) {
            for (FitResult result : row) {
                if (!result.isFitted()) {
                    failed++;
                }
            }
        }
        this.numFailedPixels = failed;
    }

    /**
     * Calibration curve of the full-width spectral grid the fit was done on.
     */
    public CalibrationCurve getCalibrationCurve() {
        return calibrationCurve;
    }

    public List<String> getTemplateNames() {
        return templateNames;
    }

    public FitResult getFitResult(int integration, int spatialBin) {
        return fitResults[integration][spatialBin];
    }

    public int getNumFailedPixels() {
        return numFailedPixels;
    }

    public double[][] getBrightness(String template) {
        final double[][] map = IuvsUtils.createNanArray(fitResults.length, getNumSpatialBins());
        for (int i = 0; i < fitResults.length; i++) {
            for (int s = 0; s < fitResults[i].length; s++) {
                map[i][s] = fitResults[i][s].getBrightness(template);
            }
        }
        return map;
    }

    public double[][] getBrightnessUncertainty(String template) {
        final double[][] map = IuvsUtils.createNanArray(fitResults.length, getNumSpatialBins());
        for (int i = 0; i < fitResults.length; i++) {
            for (int s = 0; s < fitResults[i].length; s++) {
                map[i][s] = fitResults[i][s].getBrightnessUncertainty(template);
            }
        }
        return map;
    }

    public Map<String, double[][]> getBrightnessMaps() {
        final Map<String, double[][]> maps = new LinkedHashMap<>();
        for (String name : templateNames) {
            maps.put(name, getBrightness(name));
        }
        return maps;
    }

    /**
     * Sum of the brightness of all fitted auroral templates; NaN where the fit failed or if no auroral
     * template was fitted.
     */
    public double[][] getAuroraBrightness() {
        final double[][] map = IuvsUtils.createNanArray(fitResults.length, getNumSpatialBins());
        for (int i = 0; i < fitResults.length; i++) {
            for (int s = 0; s < fitResults[i].length; s++) {
                map[i][s] = fitResults[i][s].getBrightnessSum(auroraGroup);
            }
        }
        return map;
    }

    /**
     * NO nightglow brightness, all NaN if the template was not fitted.
     */
    public double[][] getNoNightglowBrightness() {
        if (!templateNames.contains(TemplateLibrary.NO_NIGHTGLOW)) {
            return IuvsUtils.createNanArray(fitResults.length, getNumSpatialBins());
        }
        return getBrightness(TemplateLibrary.NO_NIGHTGLOW);
    }

    private int getNumSpatialBins() {
        return fitResults.length == 0 ? 0 : fitResults[0].length;
    }
}
