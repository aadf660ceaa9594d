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

package edu.lasp.iuvs.core;

import edu.lasp.iuvs.core.binning.BinningScheme;

/**
 * Instrument settings of one L1b file, derived once from its metadata and immutable afterwards.
 */
public final class InstrumentSettings {

    private final Channel channel;
    private final BinningScheme binning;
    private final double voltage;
    private final double voltageGain;
    private final double integrationTime;
    private final double[] wavelengthCenters;
    private final double wavelengthWidth;

    /**
     * @param channel           - the detector channel
     * @param binning           - the binning scheme of the file
     * @param voltage           - MCP voltage [V]
     * @param voltageGain       - MCP voltage gain
     * @param integrationTime   - integration time [s]
     * @param wavelengthCenters - center wavelength of each spectral bin [nm]
     * @param wavelengthWidth   - (median) wavelength width of a spectral bin [nm]
     */
    public InstrumentSettings(Channel channel, BinningScheme binning, double voltage, double voltageGain,
                              double integrationTime, double[] wavelengthCenters, double wavelengthWidth) {
        if (binning == null || wavelengthCenters == null) {
            throw new IuvsProcessingException("Instrument settings need a binning scheme and wavelength centers");
        }
        this.channel = channel;
        this.binning = binning;
        this.voltage = voltage;
        this.voltageGain = voltageGain;
        this.integrationTime = integrationTime;
        this.wavelengthCenters = wavelengthCenters.clone();
        this.wavelengthWidth = wavelengthWidth;
    }

    /**
     * Copy of these settings describing a spectrum with other wavelength centers, e.g. the full-width spectrum
     * a transmitted window is padded into.
     */
    public InstrumentSettings withWavelengthCenters(double[] newWavelengthCenters) {
        return new InstrumentSettings(channel, binning, voltage, voltageGain, integrationTime,
                                      newWavelengthCenters, wavelengthWidth);
    }

    /**
     * Copy of these settings with another integration time.
     */
    public InstrumentSettings withIntegrationTime(double newIntegrationTime) {
        return new InstrumentSettings(channel, binning, voltage, voltageGain, newIntegrationTime,
                                      wavelengthCenters, wavelengthWidth);
    }

    public boolean isDayside(InstrumentConstants constants) {
        return voltage < constants.getDayNightVoltageBoundary();
    }

    public Channel getChannel() {
        return channel;
    }

    public BinningScheme getBinning() {
        return binning;
    }

    public int getSpatialBinWidth() {
        return binning.getSpatialBinWidth();
    }

    public int getSpectralBinWidth() {
        return binning.getSpectralBinWidth();
    }

    public double getVoltage() {
        return voltage;
    }

    public double getVoltageGain() {
        return voltageGain;
    }

    public double getIntegrationTime() {
        return integrationTime;
    }

    public double[] getWavelengthCenters() {
        return wavelengthCenters.clone();
    }

    public int getNumWavelengths() {
        return wavelengthCenters.length;
    }

    public double getWavelengthWidth() {
        return wavelengthWidth;
    }
}
