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

package edu.lasp.iuvs.core.swath;

import edu.lasp.iuvs.core.InstrumentConstants;
import edu.lasp.iuvs.core.IuvsProcessingException;
import org.apache.commons.lang3.ArrayUtils;

/**
 * Groups the integrations of an orbit segment into swaths, i.e. contiguous sweeps of the scan mirror.
 * <p>
 * A new swath starts where the mirror angle jumps by more than twice the first angular step (fly-back), or
 * where the mirror reverses its direction of motion. The step immediately after a jump defines the direction
 * of the new swath and is never counted as a reversal.
 */
public class SwathSegmenter {

    private final InstrumentConstants constants;

    public SwathSegmenter(InstrumentConstants constants) {
        this.constants = constants;
    }

    /**
     * @param mirrorAngles - mirror angle of each integration [deg]
     * @return swath number of each integration; non-decreasing and starting at 0
     */
    public int[] segment(double[] mirrorAngles) {
        final int n = ArrayUtils.getLength(mirrorAngles);
        final int[] swathNumbers = new int[n];
        if (n < 2) {
            return swathNumbers;
        }

        final double threshold = 2.0 * Math.abs(mirrorAngles[1] - mirrorAngles[0]);
        int swath = 0;
        int direction = 0;
        for (int i = 0; i < n - 1; i++) {
            final double step = mirrorAngles[i + 1] - mirrorAngles[i];
            boolean discontinuity = false;
            if (Math.abs(step) > threshold) {
                discontinuity = true;
                direction = 0;
            } else {
                final int sign = step > 0.0 ? 1 : (step < 0.0 ? -1 : 0);
                if (sign != 0) {
                    discontinuity = direction != 0 && sign != direction;
                    direction = sign;
                }
            }
            if (discontinuity) {
                swath++;
            }
            swathNumbers[i + 1] = swath;
        }
        return swathNumbers;
    }

    /**
     * Counts the selected integrations of each swath.
     *
     * @param swathNumbers - swath number of each integration, as returned by {@link #segment(double[])}
     * @param mask         - true for the integrations of interest
     * @return number of selected integrations per swath, indexed by swath number
     */
    public static int[] countIntegrationsInSwath(int[] swathNumbers, boolean[] mask) {
        if (swathNumbers.length != mask.length) {
            throw new IuvsProcessingException("Swath numbers (" + swathNumbers.length + ") and mask (" +
                                                      mask.length + ") differ in length");
        }
        if (swathNumbers.length == 0) {
            return new int[0];
        }
        final int[] counts = new int[getNumberOfSwaths(swathNumbers)];
        for (int i = 0; i < swathNumbers.length; i++) {
            if (mask[i]) {
                counts[swathNumbers[i]]++;
            }
        }
        return counts;
    }

    /**
     * Index range of one swath within the sequence of selected integrations.
     *
     * @param swathNumber  - the swath to select
     * @param swathNumbers - swath number of each integration
     * @param mask         - true for the integrations of interest
     * @return {@code {start, end}}, end exclusive, into the masked integration sequence
     */
    public static int[] selectIntegrationsInSwath(int swathNumber, int[] swathNumbers, boolean[] mask) {
        final int[] counts = countIntegrationsInSwath(swathNumbers, mask);
        if (swathNumber < 0 || swathNumber >= counts.length) {
            throw new IllegalArgumentException("Swath " + swathNumber + " does not exist, there are " +
                                                       counts.length + " swaths");
        }
        int start = 0;
        for (int i = 0; i < swathNumber; i++) {
            start += counts[i];
        }
        return new int[]{start, start + counts[swathNumber]};
    }

    public static int getNumberOfSwaths(int[] swathNumbers) {
        int max = -1;
        for (int swathNumber : swathNumbers) {
            if (swathNumber < 0) {
                throw new IuvsProcessingException("Negative swath number " + swathNumber);
            }
            max = Math.max(max, swathNumber);
        }
        return max + 1;
    }

    /**
     * @return true if the mirror swept between its two extreme angles
     */
    public boolean isFullRangeScan(double[] mirrorAngles) {
        if (ArrayUtils.isEmpty(mirrorAngles)) {
            return false;
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double angle : mirrorAngles) {
            min = Math.min(min, angle);
            max = Math.max(max, angle);
        }
        return min == constants.getMinimumMirrorAngle() && max == constants.getMaximumMirrorAngle();
    }
}
