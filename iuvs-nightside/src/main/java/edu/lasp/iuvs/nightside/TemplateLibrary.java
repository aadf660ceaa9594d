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

import edu.lasp.iuvs.core.IuvsProcessingException;
import edu.lasp.iuvs.core.util.IuvsAuxdata;
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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Named MUV emission templates, one value per native detector spectral pixel.
 * <p>
 * A library is described by a JSON manifest:
 * <pre>
 * {
 *   "templates": [ {"name": "no_nightglow", "file": "no_nightglow.dat"}, ... ],
 *   "aurora": [ "co_cameron_bands", "co2p_uvd", "o2972", "co2p_fdb" ]
 * }
 * </pre>
 * Template files are one-column ASCII tables located relative to the manifest.
 */
public class TemplateLibrary {

    public static final String NO_NIGHTGLOW = "no_nightglow";
    public static final String CO_CAMERON_BANDS = "co_cameron_bands";
    public static final String CO2P_UVD = "co2p_uvd";
    public static final String O2972 = "o2972";
    public static final String CO2P_FDB = "co2p_fdb";
    public static final String COP_1NG = "cop_1ng";
    public static final String N2_VK = "n2_vk";
    public static final String SOLAR_CONTINUUM = "solar_continuum";

    public static final Set<String> DEFAULT_AURORA_GROUP = Collections.unmodifiableSet(
            new LinkedHashSet<>(Arrays.asList(CO_CAMERON_BANDS, CO2P_UVD, O2972, CO2P_FDB)));

    private final Map<String, double[]> templates;
    private final Set<String> auroraGroup;
    private final int numPixels;

    /**
     * @param templates   - templates in fit order, all of the same length
     * @param auroraGroup - names of the templates whose brightness sums to the aurora brightness
     */
    public TemplateLibrary(Map<String, double[]> templates, Set<String> auroraGroup) {
        if (templates.isEmpty()) {
            throw new IuvsProcessingException("Template library is empty");
        }
        this.templates = new LinkedHashMap<>();
        int length = -1;
        for (Map.Entry<String, double[]> entry : templates.entrySet()) {
            final double[] template = entry.getValue();
            if (length < 0) {
                length = template.length;
            } else if (template.length != length) {
                throw new IuvsProcessingException("Template '" + entry.getKey() + "' has " + template.length +
                                                          " samples, expected " + length);
            }
            this.templates.put(entry.getKey(), template.clone());
        }
        this.numPixels = length;
        this.auroraGroup = Collections.unmodifiableSet(new LinkedHashSet<>(auroraGroup));
    }

    public static TemplateLibrary load(File manifestFile) {
        final Map<?, ?> manifest;
        try (Reader r = new FileReader(manifestFile)) {
            manifest = parse(r, manifestFile.getName());
        } catch (FileNotFoundException e) {
            throw new IuvsProcessingException("cannot find template manifest file " + manifestFile, e);
        } catch (IuvsProcessingException e) {
            throw e;
        } catch (Exception e) {
            throw new IuvsProcessingException("error reading template manifest file " + manifestFile, e);
        }
        final File dir = manifestFile.getAbsoluteFile().getParentFile();
        final Map<String, double[]> templates = new LinkedHashMap<>();
        for (String[] entry : getTemplateEntries(manifest, manifestFile.getName())) {
            templates.put(entry[0], IuvsAuxdata.readVector(new File(dir, entry[1])));
        }
        return new TemplateLibrary(templates, getAuroraGroup(manifest));
    }

    /**
     * Loads a library shipped as classpath resources.
     *
     * @param anchor           - class the resource names are resolved against
     * @param manifestResource - the manifest; template files are resolved relative to its directory
     * @return the library
     */
    public static TemplateLibrary load(Class<?> anchor, String manifestResource) {
        final InputStream inputStream = anchor.getResourceAsStream(manifestResource);
        if (inputStream == null) {
            throw new IuvsProcessingException("cannot find template manifest " + manifestResource);
        }
        final Map<?, ?> manifest;
        try (Reader r = new InputStreamReader(inputStream, StandardCharsets.UTF_8)) {
            manifest = parse(r, manifestResource);
        } catch (IuvsProcessingException e) {
            throw e;
        } catch (Exception e) {
            throw new IuvsProcessingException("error reading template manifest " + manifestResource, e);
        }
        final int slash = manifestResource.lastIndexOf('/');
        final String dir = slash < 0 ? "" : manifestResource.substring(0, slash + 1);
        final Map<String, double[]> templates = new LinkedHashMap<>();
        for (String[] entry : getTemplateEntries(manifest, manifestResource)) {
            templates.put(entry[0], IuvsAuxdata.readVector(anchor, dir + entry[1]));
        }
        return new TemplateLibrary(templates, getAuroraGroup(manifest));
    }

    private static Map<?, ?> parse(Reader r, String sourceName) {
        final Object parsed = JSONValue.parse(r);
        if (!(parsed instanceof JSONObject)) {
            throw new IuvsProcessingException("template manifest " + sourceName + " is not a JSON object");
        }
        return (JSONObject) parsed;
    }

    private static List<String[]> getTemplateEntries(Map<?, ?> manifest, String sourceName) {
        final Object templates = manifest.get("templates");
        if (!(templates instanceof JSONArray)) {
            throw new IuvsProcessingException("template manifest " + sourceName + " has no 'templates' array");
        }
        final List<String[]> entries = new ArrayList<>();
        for (Object item : (JSONArray) templates) {
            if (!(item instanceof JSONObject)) {
                throw new IuvsProcessingException("template manifest " + sourceName + ": entry is not an object: " + item);
            }
            final Object name = ((JSONObject) item).get("name");
            final Object file = ((JSONObject) item).get("file");
            if (!(name instanceof String) || !(file instanceof String)) {
                throw new IuvsProcessingException("template manifest " + sourceName +
                                                          ": entry needs a 'name' and a 'file': " + item);
            }
            entries.add(new String[]{(String) name, (String) file});
        }
        return entries;
    }

    private static Set<String> getAuroraGroup(Map<?, ?> manifest) {
        final Object aurora = manifest.get("aurora");
        if (aurora == null) {
            return DEFAULT_AURORA_GROUP;
        }
        if (!(aurora instanceof JSONArray)) {
            throw new IuvsProcessingException("template manifest: 'aurora' is not an array: " + aurora);
        }
        final Set<String> group = new LinkedHashSet<>();
        for (Object name : (JSONArray) aurora) {
            group.add(String.valueOf(name));
        }
        return group;
    }

    public List<String> getNames() {
        return new ArrayList<>(templates.keySet());
    }

    public boolean contains(String name) {
        return templates.containsKey(name);
    }

    public double[] getTemplate(String name) {
        final double[] template = templates.get(name);
        if (template == null) {
            throw new IuvsProcessingException("Unknown template '" + name + "', available: " + templates.keySet());
        }
        return template.clone();
    }

    public Set<String> getAuroraGroup() {
        return auroraGroup;
    }

    public int getNumPixels() {
        return numPixels;
    }

    /**
     * Sums adjacent detector pixels of a template into bins of the given width.
     *
     * @param name             - template name
     * @param spectralBinWidth - bin width in detector pixels
     * @return the binned template, {@code numPixels / spectralBinWidth} samples
     */
    public double[] rebin(String name, int spectralBinWidth) {
        return IuvsUtils.rebinBySum(getTemplate(name), spectralBinWidth);
    }
}
