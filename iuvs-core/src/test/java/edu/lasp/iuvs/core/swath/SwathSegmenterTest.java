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
import edu.lasp.iuvs.core.IuvsConstants;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class SwathSegmenterTest {

    private SwathSegmenter segmenter;

    @Before
    public void setUp() {
        segmenter = new SwathSegmenter(InstrumentConstants.getDefault());
    }

    @Test
    public void testSegmentSingleReversal() {
        final int[] swaths = segmenter.segment(new double[]{70, 80, 90, 100, 90, 80, 70});
        assertArrayEquals(new int[]{0, 0, 0, 0, 1, 1, 1}, swaths);
    }

    @Test
    public void testSegmentSixIncreasingSwaths() {
        final double[] mirrorAngles = sawtooth(70.0, 110.0, 50, 6);
        final int[] swaths = segmenter.segment(mirrorAngles);
        assertEquals(300, swaths.length);
        for (int i = 0; i < swaths.length; i++) {
            assertEquals("integration " + i, i / 50, swaths[i]);
        }
    }

    @Test
    public void testSegmentSixDecreasingSwaths() {
        final double[] mirrorAngles = sawtooth(110.0, 70.0, 50, 6);
        final int[] swaths = segmenter.segment(mirrorAngles);
        for (int i = 0; i < swaths.length; i++) {
            assertEquals("integration " + i, i / 50, swaths[i]);
        }
    }

    @Test
    public void testSegmentMonotonicScan() {
        final int[] swaths = segmenter.segment(sawtooth(70.0, 110.0, 50, 1));
        assertArrayEquals(new int[50], swaths);
    }

    @Test
    public void testSegmentSingleIntegration() {
        assertArrayEquals(new int[]{0}, segmenter.segment(new double[]{100.0}));
        assertEquals(0, segmenter.segment(new double[0]).length);
    }

    @Test
    public void testSegmentIsNonDecreasingAndStartsAtZero() {
        final double[] mirrorAngles = {40.0, 40.5, 41.0, 41.5, 41.5, 42.0, 30.0, 30.5, 31.0, 30.5, 30.0, 29.5,
                45.0, 45.5, 45.5, 46.0};
        final int[] swaths = segmenter.segment(mirrorAngles);
        assertEquals(0, swaths[0]);
        for (int i = 1; i < swaths.length; i++) {
            assertTrue(swaths[i] >= swaths[i - 1]);
        }
        // fly-back at 6, reversal at 9, fly-back at 12; the mirror standing still is not a reversal
        assertArrayEquals(new int[]{0, 0, 0, 0, 0, 0, 1, 1, 1, 2, 2, 2, 3, 3, 3, 3}, swaths);
    }

    @Test
    public void testCountIntegrationsInSwath() {
        final int[] swathNumbers = {0, 0, 0, 1, 1, 1};
        final boolean[] daysideMask = {true, true, false, true, false, false};
        assertArrayEquals(new int[]{2, 1}, SwathSegmenter.countIntegrationsInSwath(swathNumbers, daysideMask));
    }

    @Test
    public void testSelectIntegrationsInSwath() {
        final int[] swathNumbers = {0, 0, 0, 1, 1, 1, 2, 2};
        final boolean[] mask = {true, true, false, true, false, false, true, true};
        assertArrayEquals(new int[]{0, 2}, SwathSegmenter.selectIntegrationsInSwath(0, swathNumbers, mask));
        assertArrayEquals(new int[]{2, 3}, SwathSegmenter.selectIntegrationsInSwath(1, swathNumbers, mask));
        assertArrayEquals(new int[]{3, 5}, SwathSegmenter.selectIntegrationsInSwath(2, swathNumbers, mask));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSelectIntegrationsInUnknownSwath() {
        SwathSegmenter.selectIntegrationsInSwath(3, new int[]{0, 1, 2}, new boolean[]{true, true, true});
    }

    @Test
    public void testIsFullRangeScan() {
        final double[] full = {IuvsConstants.MINIMUM_MIRROR_ANGLE, 45.0, IuvsConstants.MAXIMUM_MIRROR_ANGLE};
        assertTrue(segmenter.isFullRangeScan(full));
        assertFalse(segmenter.isFullRangeScan(new double[]{35.0, 45.0, IuvsConstants.MAXIMUM_MIRROR_ANGLE}));
        assertFalse(segmenter.isFullRangeScan(new double[0]));
    }

    private static double[] sawtooth(double start, double end, int numPerSwath, int numSwaths) {
        final double[] angles = new double[numPerSwath * numSwaths];
        final double step = (end - start) / (numPerSwath - 1);
        for (int s = 0; s < numSwaths; s++) {
            for (int i = 0; i < numPerSwath; i++) {
                angles[s * numPerSwath + i] = start + i * step;
            }
        }
        return angles;
    }
}
