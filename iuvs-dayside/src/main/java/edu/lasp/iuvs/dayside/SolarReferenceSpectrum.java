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

import edu.lasp.iuvs.core.IuvsProcessingException;
import edu.lasp.iuvs.core.util.IuvsAuxdata;
import edu.lasp.iuvs.core.util.IuvsUtils;

import java.io.File;

/**
 * Solar irradiance at 1 AU [W/m^2/nm] tabulated over wavelength [nm], e.g. a monthly SOLSTICE spectrum.
 */
public final class SolarReferenceSpectrum {

    private final double[] wavelengths;
    private final double[] irradiance;

    public SolarReferenceSpectrum(double[] wavelengths, double[] irradiance) {
        if (wavelengths.length < 2 || wavelengths.length != irradiance.length) {
            throw new IuvsProcessingException("Solar spectrum needs at least two samples and matching tables");
        }
        if (!IuvsUtils.isStrictlyIncreasing(wavelengths)) {
            throw new IuvsProcessingException("Solar spectrum wavelengths must be strictly increasing");
        }
        this.wavelengths = wavelengths.clone();
        this.irradiance = irradiance.clone();
    }

    /**
     * Reads a two-column ASCII table (wavelength [nm], irradiance [W/m^2/nm]).
     */
    public static SolarReferenceSpectrum read(File file) {
        final double[][] table = IuvsAuxdata.readGrid(file);
        return new SolarReferenceSpectrum(IuvsAuxdata.getColumn(table, 0), IuvsAuxdata.getColumn(table, 1));
    }

    public static SolarReferenceSpectrum read(Class<?> anchor, String resourceName) {
        final double[][] table = IuvsAuxdata.readGrid(anchor, resourceName);
        return new SolarReferenceSpectrum(IuvsAuxdata.getColumn(table, 0), IuvsAuxdata.getColumn(table, 1));
    }

    public double[] getWavelengths() {
        return wavelengths.clone();
    }

    public double[] getIrradiance() {
        return irradiance.clone();
    }

    public double getMinWavelength() {
        return wavelengths[0];
    }

    public double getMaxWavelength() {
        return wavelengths[wavelengths.length - 1];
    }
}
