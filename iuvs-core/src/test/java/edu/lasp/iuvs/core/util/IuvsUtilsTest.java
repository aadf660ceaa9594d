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
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.junit.Test;

import static org.junit.Assert.*;

public class IuvsUtilsTest {

    @Test
    public void testClampedLinearFunction() {
        final UnivariateFunction f = IuvsUtils.createClampedLinearFunction(new double[]{0.0, 1.0, 3.0},
                                                                           new double[]{0.0, 2.0, 0.0});
        assertEquals(1.0, f.value(0.5), 1.E-12);
        assertEquals(1.0, f.value(2.0), 1.E-12);
        assertEquals(0.0, f.value(-5.0), 0.0);
        assertEquals(0.0, f.value(7.0), 0.0);
        assertTrue(Double.isNaN(f.value(Double.NaN)));

        final UnivariateFunction constant = IuvsUtils.createClampedLinearFunction(new double[]{3.0},
                                                                                  new double[]{4.0});
        assertEquals(4.0, constant.value(-100.0), 0.0);
    }

    @Test(expected = IuvsProcessingException.class)
    public void testClampedLinearFunctionNeedsKnots() {
        IuvsUtils.createClampedLinearFunction(new double[0], new double[0]);
    }

    @Test
    public void testRebin() {
        final double[] values = {1.0, 2.0, 3.0, 4.0, 5.0};
        assertArrayEquals(new double[]{3.0, 7.0}, IuvsUtils.rebinBySum(values, 2), 0.0);
        assertArrayEquals(new double[]{1.5, 3.5}, IuvsUtils.rebinByMean(values, 2), 0.0);
        assertArrayEquals(values, IuvsUtils.rebinBySum(values, 1), 0.0);
    }

    @Test
    public void testMedian() {
        assertEquals(4, IuvsUtils.median(new int[]{4, 4, 4, 3}));
        assertEquals(2.0, IuvsUtils.median(new double[]{3.0, 1.0, 2.0}), 0.0);
    }

    @Test
    public void testIsStrictlyIncreasing() {
        assertTrue(IuvsUtils.isStrictlyIncreasing(new double[]{1.0, 2.0, 3.0}));
        assertTrue(IuvsUtils.isStrictlyIncreasing(new double[]{1.0}));
        assertFalse(IuvsUtils.isStrictlyIncreasing(new double[]{1.0, 1.0, 3.0}));
        assertFalse(IuvsUtils.isStrictlyIncreasing(new double[]{3.0, 2.0}));
    }

    @Test
    public void testCreateNanArray() {
        final double[][][] cube = IuvsUtils.createNanArray(2, 3, 4);
        assertEquals(2, cube.length);
        assertEquals(4, cube[1][2].length);
        assertTrue(Double.isNaN(cube[1][2][3]));
        assertTrue(Double.isNaN(IuvsUtils.createNanArray(2, 2)[0][1]));
    }
}
