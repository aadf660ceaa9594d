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

import edu.lasp.iuvs.core.InstrumentSettings;
import edu.lasp.iuvs.core.IuvsProcessingException;

/**
 * The per-file inputs of the dayside processing, as read from an L1b file.
 */
public final class DaysideObservation {

    private final InstrumentSettings settings;
    private final double[][][] detectorDarkSubtracted;
    private final double[][] solarZenithAngle;
    private final double[][] tangentAltitude;
    private final double sunDistanceRatio;
    private final double[] detectorWavelengthEdges;

    /**
     * @param settings                - instrument settings of the file
     * @param detectorDarkSubtracted  - counts, shape (integrations, spatial bins, spectral bins) [DN]
     * @param solarZenithAngle        - shape (integrations, spatial bins) [deg]
     * @param tangentAltitude         - shape (integrations, spatial bins) [km]
     * @param sunDistanceRatio        - Mars-Sun distance over Earth-Sun distance
     * @param detectorWavelengthEdges - wavelength edges of the native detector pixels [nm], or null to derive
     *                                them from the bin center wavelengths
     */
    public DaysideObservation(InstrumentSettings settings, double[][][] detectorDarkSubtracted,
                              double[][] solarZenithAngle, double[][] tangentAltitude, double sunDistanceRatio,
                              double[] detectorWavelengthEdges) {
        final int numIntegrations = detectorDarkSubtracted.length;
        if (solarZenithAngle.length != numIntegrations || tangentAltitude.length != numIntegrations) {
            throw new IuvsProcessingException("Geometry covers " + solarZenithAngle.length + "/" +
                                                      tangentAltitude.length + " integrations, image " +
                                                      numIntegrations);
        }
        final int numSpatial = settings.getBinning().getNumSpatialBins();
        final int numSpectral = settings.getBinning().getNumSpectralBins();
        for (int i = 0; i < numIntegrations; i++) {
            if (detectorDarkSubtracted[i].length != numSpatial || solarZenithAngle[i].length != numSpatial ||
                    tangentAltitude[i].length != numSpatial) {
                throw new IuvsProcessingException("Integration " + i + " does not have " + numSpatial +
                                                          " spatial bins");
            }
            for (double[] spectrum : detectorDarkSubtracted[i]) {
                if (spectrum.length != numSpectral) {
                    throw new IuvsProcessingException("Integration " + i + " does not have " + numSpectral +
                                                              " spectral bins");
                }
            }
        }
        this.settings = settings;
        this.detectorDarkSubtracted = detectorDarkSubtracted;
        this.solarZenithAngle = solarZenithAngle;
        this.tangentAltitude = tangentAltitude;
        this.sunDistanceRatio = sunDistanceRatio;
        this.detectorWavelengthEdges = detectorWavelengthEdges == null ? null : detectorWavelengthEdges.clone();
    }

    public InstrumentSettings getSettings() {
        return settings;
    }

    public int getNumIntegrations() {
        return detectorDarkSubtracted.length;
    }

    public double[] getSpectrum(int integration, int spatialBin) {
        return detectorDarkSubtracted[integration][spatialBin];
    }

    public double getSolarZenithAngle(int integration, int spatialBin) {
        return solarZenithAngle[integration][spatialBin];
    }

    public double getTangentAltitude(int integration, int spatialBin) {
        return tangentAltitude[integration][spatialBin];
    }

    public double getSunDistanceRatio() {
        return sunDistanceRatio;
    }

    public double[] getDetectorWavelengthEdges() {
        return detectorWavelengthEdges == null ? null : detectorWavelengthEdges.clone();
    }
}
