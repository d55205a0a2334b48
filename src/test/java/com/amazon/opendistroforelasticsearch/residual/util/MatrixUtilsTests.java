/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.opendistroforelasticsearch.residual.util;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.junit.Test;

public class MatrixUtilsTests {

    private final double[][] matrix = new double[][] { { 1, -2, 3 }, { -4, 5, -6 } };

    @Test
    public void numColumns() {
        assertEquals(3, MatrixUtils.numColumns(matrix));
        assertEquals(0, MatrixUtils.numColumns(new double[0][]));
    }

    @Test(expected = IllegalArgumentException.class)
    public void numColumns_rejectsRaggedRows() {
        MatrixUtils.numColumns(new double[][] { { 1, 2 }, { 3 } });
    }

    @Test
    public void column() {
        assertArrayEquals(new double[] { -2, 5 }, MatrixUtils.column(matrix, 1), 0);
    }

    @Test
    public void selectColumns_keepsGivenOrder() {
        assertArrayEquals(new double[][] { { 3, 1 }, { -6, -4 } }, MatrixUtils.selectColumns(matrix, new int[] { 2, 0 }));
    }

    @Test
    public void abs_leavesInputUntouched() {
        assertArrayEquals(new double[][] { { 1, 2, 3 }, { 4, 5, 6 } }, MatrixUtils.abs(matrix));
        assertEquals(-2, matrix[0][1], 0);
    }

    @Test
    public void rowMeans() {
        assertArrayEquals(new double[] { 2. / 3, -5. / 3 }, MatrixUtils.rowMeans(matrix), 1e-12);
    }

    @Test
    public void topIndices_breaksTiesByIndex() {
        double[] values = new double[] { 1, 3, 2, 3, 0 };

        assertEquals(Arrays.asList(1, 3, 2), MatrixUtils.topIndices(values, Arrays.asList(0, 1, 2, 3, 4), 3));
        assertEquals(Arrays.asList(3, 0), MatrixUtils.topIndices(values, Arrays.asList(0, 3, 4), 2));
        assertEquals(3, MatrixUtils.topIndices(values, Arrays.asList(4, 2, 1), 10).size());
    }

    @Test
    public void sorted() {
        assertEquals(Arrays.asList(1, 4, 9), MatrixUtils.sorted(Arrays.asList(9, 1, 4)));
    }
}
