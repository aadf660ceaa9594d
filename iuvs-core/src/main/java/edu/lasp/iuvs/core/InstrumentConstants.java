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

import edu.lasp.iuvs.core.util.IuvsUtils;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.JSONValue;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;

/**
 * Immutable set of optical and physical constants of the IUVS instrument. One instance is handed to every
 * processing component, so unit conversions are visible at the call site.
 * <p>
 * The defaults are read from {@value IuvsConstants#INSTRUMENT_CONFIG_FILE}; an alternative JSON file may override
 * any subset of the keys.
 */
public final class InstrumentConstants {

    static final String PIXEL_SIZE_KEY = "pixel_size_mm";
    static final String FOCAL_LENGTH_KEY = "telescope_focal_length_mm";
    static final String SLIT_WIDTH_KEY = "spatial_slit_width_mm";
    static final String ANGULAR_SLIT_WIDTH_KEY = "angular_slit_width_deg";
    static final String WELL_DEPTH_KEY = "cmos_pixel_well_depth_dn";
    static final String KR_KEY = "kilorayleigh";
    static final String VOLTAGE_BOUNDARY_KEY = "day_night_voltage_boundary_v";
    static final String MIN_MIRROR_ANGLE_KEY = "minimum_mirror_angle_deg";
    static final String MAX_MIRROR_ANGLE_KEY = "maximum_mirror_angle_deg";
    static final String SPECTRAL_PIXELS_KEY = "detector_spectral_pixels";
    static final String REFERENCE_GAIN_KEY = "reference_mcp_gain";
    static final String VOLTAGE_CORRECTION_KEY = "voltage_correction_coefficients";

    private static InstrumentConstants defaultInstance;

    private final double pixelSize;
    private final double focalLength;
    private final double spatialSlitWidth;
    private final double angularSlitWidth;
    private final int pixelWellDepth;
    private final double kiloRayleigh;
    private final double dayNightVoltageBoundary;
    private final double minimumMirrorAngle;
    private final double maximumMirrorAngle;
    private final int detectorSpectralPixels;
    private final double referenceMcpGain;
    private final double[] voltageCorrectionCoefficients;

    private InstrumentConstants(Map<?, ?> values, InstrumentConstants fallback) {
        pixelSize = getDouble(values, PIXEL_SIZE_KEY, fallback == null ? IuvsConstants.PIXEL_SIZE : fallback.pixelSize);
        focalLength = getDouble(values, FOCAL_LENGTH_KEY,
                                fallback == null ? IuvsConstants.TELESCOPE_FOCAL_LENGTH : fallback.focalLength);
        spatialSlitWidth = getDouble(values, SLIT_WIDTH_KEY,
                                     fallback == null ? IuvsConstants.SPATIAL_SLIT_WIDTH : fallback.spatialSlitWidth);
        angularSlitWidth = getDouble(values, ANGULAR_SLIT_WIDTH_KEY,
                                     fallback == null ? IuvsConstants.ANGULAR_SLIT_WIDTH : fallback.angularSlitWidth);
        pixelWellDepth = (int) getDouble(values, WELL_DEPTH_KEY,
                                         fallback == null ? IuvsConstants.CMOS_PIXEL_WELL_DEPTH : fallback.pixelWellDepth);
        kiloRayleigh = getDouble(values, KR_KEY, fallback == null ? IuvsConstants.KILORAYLEIGH : fallback.kiloRayleigh);
        dayNightVoltageBoundary = getDouble(values, VOLTAGE_BOUNDARY_KEY,
                                            fallback == null ? IuvsConstants.DAY_NIGHT_VOLTAGE_BOUNDARY
                                                    : fallback.dayNightVoltageBoundary);
        minimumMirrorAngle = getDouble(values, MIN_MIRROR_ANGLE_KEY,
                                       fallback == null ? IuvsConstants.MINIMUM_MIRROR_ANGLE : fallback.minimumMirrorAngle);
        maximumMirrorAngle = getDouble(values, MAX_MIRROR_ANGLE_KEY,
                                       fallback == null ? IuvsConstants.MAXIMUM_MIRROR_ANGLE : fallback.maximumMirrorAngle);
        detectorSpectralPixels = (int) getDouble(values, SPECTRAL_PIXELS_KEY,
                                                 fallback == null ? IuvsConstants.DETECTOR_SPECTRAL_PIXELS
                                                         : fallback.detectorSpectralPixels);
        referenceMcpGain = getDouble(values, REFERENCE_GAIN_KEY,
                                     fallback == null ? IuvsConstants.REFERENCE_MCP_GAIN : fallback.referenceMcpGain);
        voltageCorrectionCoefficients = getDoubleArray(values, VOLTAGE_CORRECTION_KEY,
                                                       fallback == null ? IuvsConstants.VOLTAGE_CORRECTION_COEFFS
                                                               : fallback.voltageCorrectionCoefficients);
        if (pixelSize <= 0.0 || focalLength <= 0.0 || detectorSpectralPixels <= 0) {
            throw new IuvsProcessingException("Instrument constants must be positive: pixel size " + pixelSize +
                                                      ", focal length " + focalLength +
                                                      ", spectral pixels " + detectorSpectralPixels);
        }
    }

    /**
     * Provides the constants shipped with this module.
     *
     * @return the default constants
     */
    public static synchronized InstrumentConstants getDefault() {
        if (defaultInstance == null) {
            final InputStream inputStream = InstrumentConstants.class.getResourceAsStream(IuvsConstants.INSTRUMENT_CONFIG_FILE);
            if (inputStream == null) {
                IuvsUtils.LOG.warning("Resource " + IuvsConstants.INSTRUMENT_CONFIG_FILE +
                                                    " not found, using compiled-in instrument constants");
                defaultInstance = new InstrumentConstants(Collections.emptyMap(), null);
            } else {
                try (Reader r = new InputStreamReader(inputStream, StandardCharsets.UTF_8)) {
                    defaultInstance = new InstrumentConstants(parse(r, IuvsConstants.INSTRUMENT_CONFIG_FILE), null);
                } catch (IuvsProcessingException e) {
                    throw e;
                } catch (Exception e) {
                    throw new IuvsProcessingException("error reading instrument constants " +
                                                              IuvsConstants.INSTRUMENT_CONFIG_FILE, e);
                }
            }
        }
        return defaultInstance;
    }

    /**
     * Reads constants from an alternative JSON file. Keys not present in the file keep their default values.
     *
     * @param alternativeConfigFile - the JSON file
     * @return the constants
     */
    public static InstrumentConstants load(File alternativeConfigFile) {
        try (Reader r = new FileReader(alternativeConfigFile)) {
            return load(r, alternativeConfigFile.getName());
        } catch (FileNotFoundException e) {
            throw new IuvsProcessingException("cannot find instrument constants file " + alternativeConfigFile, e);
        } catch (IuvsProcessingException e) {
            throw e;
        } catch (Exception e) {
            throw new IuvsProcessingException("error reading instrument constants file " + alternativeConfigFile, e);
        }
    }

    public static InstrumentConstants load(Reader reader, String sourceName) {
        return new InstrumentConstants(parse(reader, sourceName), getDefault());
    }

    private static Map<?, ?> parse(Reader r, String sourceName) {
        final Object parsed = JSONValue.parse(r);
        if (!(parsed instanceof JSONObject)) {
            throw new IuvsProcessingException("instrument constants in " + sourceName + " are not a JSON object");
        }
        return (JSONObject) parsed;
    }

    private static double getDouble(Map<?, ?> m, String key, double defaultValue) {
        if (!m.containsKey(key)) {
            return defaultValue;
        }
        final Object value = m.get(key);
        if (!(value instanceof Number)) {
            throw new IuvsProcessingException("instrument constant '" + key + "' is not a number: " + value);
        }
        return ((Number) value).doubleValue();
    }

    private static double[] getDoubleArray(Map<?, ?> m, String key, double[] defaultValue) {
        if (!m.containsKey(key)) {
            return defaultValue.clone();
        }
        final Object value = m.get(key);
        if (!(value instanceof JSONArray)) {
            throw new IuvsProcessingException("instrument constant '" + key + "' is not an array: " + value);
        }
        final JSONArray array = (JSONArray) value;
        final double[] result = new double[array.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = ((Number) array.get(i)).doubleValue();
        }
        return result;
    }

    /**
     * Solid angle seen by one detector pixel [sr].
     */
    public double getPixelOmega() {
        return pixelSize * pixelSize / (focalLength * focalLength);
    }

    /**
     * Solid angle seen by one spatial bin of the given width [sr].
     */
    public double getBinOmega(int spatialBinWidth) {
        return getPixelOmega() * spatialBinWidth;
    }

    /**
     * Saturation level of one bin [DN].
     */
    public double getSaturationThreshold(int spatialBinWidth, int spectralBinWidth) {
        return (double) pixelWellDepth * spatialBinWidth * spectralBinWidth;
    }

    public double getPixelSize() {
        return pixelSize;
    }

    public double getFocalLength() {
        return focalLength;
    }

    public double getSpatialSlitWidth() {
        return spatialSlitWidth;
    }

    public double getAngularSlitWidth() {
        return angularSlitWidth;
    }

    public int getPixelWellDepth() {
        return pixelWellDepth;
    }

    public double getKiloRayleigh() {
        return kiloRayleigh;
    }

    public double getDayNightVoltageBoundary() {
        return dayNightVoltageBoundary;
    }

    public double getMinimumMirrorAngle() {
        return minimumMirrorAngle;
    }

    public double getMaximumMirrorAngle() {
        return maximumMirrorAngle;
    }

    public int getDetectorSpectralPixels() {
        return detectorSpectralPixels;
    }

    public double getReferenceMcpGain() {
        return referenceMcpGain;
    }

    public double[] getVoltageCorrectionCoefficients() {
        return voltageCorrectionCoefficients.clone();
    }
}
