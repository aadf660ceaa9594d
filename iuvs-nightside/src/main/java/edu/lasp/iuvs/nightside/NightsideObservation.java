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

import edu.lasp.iuvs.core.InstrumentSettings;
import edu.lasp.iuvs.core.IuvsProcessingException;

/**
 * The inputs of one nightside file.
 */
public final class NightsideObservation {

    private final InstrumentSettings settings;
    private final double[][][] dn;
    private final double[][][] uncertainty;
    private final double[] detectorWavelengthCenters;

    /**
     * @param settings                  - instrument settings of the file
     * @param dn                        - dark-subtracted detector image [DN], {@code [integration][spatial][spectral]}
     * @param uncertainty               - 1-sigma random uncertainty [DN], same shape
     * @param detectorWavelengthCenters - wavelength center of every native detector spectral pixel [nm]
     */
    public NightsideObservation(InstrumentSettings settings, double[][][] dn, double[][][] uncertainty,
                                double[] detectorWavelengthCenters) {
        final int numSpatial = settings.getBinning().getNumSpatialBins();
        final int numSpectral = settings.getBinning().getNumSpectralBins();
        if (dn.length != uncertainty.length) {
            throw new IuvsProcessingException("Detector image has " + dn.length + " integrations, uncertainty has " +
                                                      uncertainty.length);
        }
        for (int i = 0; i < dn.length; i++) {
            if (dn[i].length != numSpatial || uncertainty[i].length != numSpatial) {
                throw new IuvsProcessingException("Integration " + i + " does not have " + numSpatial +
                                                          " spatial bins");
            }
            for (int s = 0; s < numSpatial; s++) {
                if (dn[i][s].length != numSpectral || uncertainty[i][s].length != numSpectral) {
                    throw new IuvsProcessingException("Integration " + i + ", spatial bin " + s +
                                                              " does not have " + numSpectral + " spectral bins");
                }
            }
        }
        if (detectorWavelengthCenters.length != settings.getBinning().getDetectorSpectralPixels()) {
            throw new IuvsProcessingException("Expected " + settings.getBinning().getDetectorSpectralPixels() +
                                                      " detector wavelength centers, got " +
                                                      detectorWavelengthCenters.length);
        }
        this.settings = settings;
        this.dn = dn;
        this.uncertainty = uncertainty;
        this.detectorWavelengthCenters = detectorWavelengthCenters.clone();
    }

    public InstrumentSettings getSettings() {
        return settings;
    }

    public int getNumIntegrations() {
        return dn.length;
    }

    public double[] getSpectrum(int integration, int spatialBin) {
        return dn[integration][spatialBin];
    }

    public double[] getUncertainty(int integration, int spatialBin) {
        return uncertainty[integration][spatialBin];
    }

    public double[] getDetectorWavelengthCenters() {
        return detectorWavelengthCenters.clone();
    }
}
