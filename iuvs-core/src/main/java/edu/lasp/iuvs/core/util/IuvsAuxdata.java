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

package edu.lasp.iuvs.core.util;

import edu.lasp.iuvs.core.IuvsProcessingException;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.StringTokenizer;

/**
 * IUVS auxiliary data utility class. Reads whitespace separated ASCII tables (sensitivity curves, solar spectra,
 * point-spread functions, templates, flatfields). Lines starting with '#' and empty lines are skipped.
 */
public class IuvsAuxdata {

    private static final String COMMENT_PREFIX = "#";

    private IuvsAuxdata() {
    }

    /**
     * Reads a table shipped as a classpath resource next to the given class.
     *
     * @param anchor       - class the resource name is resolved against
     * @param resourceName - name of the resource
     * @return the rows of the table
     */
    public static double[][] readTable(Class<?> anchor, String resourceName) {
        final InputStream inputStream = anchor.getResourceAsStream(resourceName);
        if (inputStream == null) {
            throw new IuvsProcessingException("Failed to load " + resourceName + ": \nresource not found");
        }
        return readTable(inputStream, resourceName);
    }

    public static double[][] readTable(File file) {
        final InputStream inputStream;
        try {
            inputStream = new FileInputStream(file);
        } catch (IOException e) {
            throw new IuvsProcessingException("Failed to load " + file + ": \n" + e.getMessage(), e);
        }
        return readTable(inputStream, file.getPath());
    }

    /**
     * Reads a table and closes the stream.
     *
     * @param inputStream - the table
     * @param sourceName  - used in error messages
     * @return the rows of the table; rows may differ in length
     */
    public static double[][] readTable(InputStream inputStream, String sourceName) {
        final List<double[]> rows = new ArrayList<>();
        try (BufferedReader bufferedReader =
                     new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = bufferedReader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith(COMMENT_PREFIX)) {
                    continue;
                }
                final StringTokenizer st = new StringTokenizer(line, " \t,;", false);
                final double[] row = new double[st.countTokens()];
                int i = 0;
                while (st.hasMoreTokens()) {
                    row[i++] = Double.parseDouble(st.nextToken());
                }
                rows.add(row);
            }
        } catch (IOException | NumberFormatException e) {
            throw new IuvsProcessingException("Failed to load " + sourceName + ": \n" + e.getMessage(), e);
        }
        return rows.toArray(new double[0][]);
    }

    /**
     * Reads a one-column table, or all values of a table row by row.
     */
    public static double[] readVector(Class<?> anchor, String resourceName) {
        return flatten(readTable(anchor, resourceName));
    }

    public static double[] readVector(File file) {
        return flatten(readTable(file));
    }

    /**
     * Reads a table which must be rectangular.
     */
    public static double[][] readGrid(Class<?> anchor, String resourceName) {
        return checkRectangular(readTable(anchor, resourceName), resourceName);
    }

    public static double[][] readGrid(File file) {
        return checkRectangular(readTable(file), file.getPath());
    }

    /**
     * @param table  - a table
     * @param column - column index
     * @return the given column of all rows
     */
    public static double[] getColumn(double[][] table, int column) {
        final double[] values = new double[table.length];
        for (int i = 0; i < table.length; i++) {
            if (column >= table[i].length) {
                throw new IuvsProcessingException("Table row " + i + " has no column " + column);
            }
            values[i] = table[i][column];
        }
        return values;
    }

    private static double[] flatten(double[][] table) {
        int n = 0;
        for (double[] row : table) {
            n += row.length;
        }
        final double[] values = new double[n];
        int k = 0;
        for (double[] row : table) {
            System.arraycopy(row, 0, values, k, row.length);
            k += row.length;
        }
        return values;
    }

    private static double[][] checkRectangular(double[][] table, String sourceName) {
        for (int i = 1; i < table.length; i++) {
            if (table[i].length != table[0].length) {
                throw new IuvsProcessingException("Failed to load " + sourceName + ": \nrow " + i + " has " +
                                                          table[i].length + " columns, expected " + table[0].length);
            }
        }
        return table;
    }
}
