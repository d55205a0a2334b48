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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import com.amazon.opendistroforelasticsearch.residual.constant.CommonErrorMessages;
import com.google.common.base.Preconditions;

/**
 * Helpers for `numSamples x numFeatures` matrices stored as row-major
 * {@code double[][]}.
 */
public final class MatrixUtils {

    private MatrixUtils() {}

    /**
     * Returns the number of feature columns of a matrix, checking that every
     * row has the same length.
     *
     * @param matrix  a `numSamples x numFeatures` matrix
     * @return        numFeatures, or 0 for a matrix without rows
     * @throws IllegalArgumentException if the rows have different lengths
     */
    public static int numColumns(double[][] matrix) {
        if (matrix.length == 0) {
            return 0;
        }
        int numColumns = matrix[0].length;
        for (double[] row : matrix) {
            Preconditions.checkArgument(row.length == numColumns, CommonErrorMessages.RAGGED_MATRIX_MSG);
        }
        return numColumns;
    }

    public static double[] column(double[][] matrix, int columnIndex) {
        double[] column = new double[matrix.length];
        for (int i = 0; i < matrix.length; i++) {
            column[i] = matrix[i][columnIndex];
        }
        return column;
    }

    /**
     * Returns a new matrix made of the given columns, in the given order.
     *
     * @param matrix         a `numSamples x numFeatures` matrix
     * @param columnIndices  column indices to keep
     * @return               a `numSamples x columnIndices.length` matrix
     */
    public static double[][] selectColumns(double[][] matrix, int[] columnIndices) {
        double[][] selected = new double[matrix.length][columnIndices.length];
        for (int i = 0; i < matrix.length; i++) {
            for (int j = 0; j < columnIndices.length; j++) {
                selected[i][j] = matrix[i][columnIndices[j]];
            }
        }
        return selected;
    }

    public static double[][] abs(double[][] matrix) {
        double[][] result = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            result[i] = new double[matrix[i].length];
            for (int j = 0; j < matrix[i].length; j++) {
                result[i][j] = Math.abs(matrix[i][j]);
            }
        }
        return result;
    }

    /**
     * Averages each row of a matrix.
     *
     * @param matrix  a `numSamples x numFeatures` matrix with numFeatures &gt; 0
     * @return        a `numSamples` array of row means
     */
    public static double[] rowMeans(double[][] matrix) {
        double[] means = new double[matrix.length];
        for (int i = 0; i < matrix.length; i++) {
            double sum = 0;
            for (double value : matrix[i]) {
                sum += value;
            }
            means[i] = sum / matrix[i].length;
        }
        return means;
    }

    /**
     * Returns the indices of the {@code k} largest values, largest first. Equal
     * values keep their index order, so the earlier index wins a tie.
     *
     * @param values      candidate values
     * @param candidates  indices into {@code values} to rank
     * @param k           maximum number of indices to return
     * @return            at most {@code k} indices
     */
    public static List<Integer> topIndices(double[] values, List<Integer> candidates, int k) {
        List<Integer> ranked = new ArrayList<>(candidates);
        ranked.sort(Comparator.<Integer>comparingDouble(i -> values[i]).reversed().thenComparing(Comparator.naturalOrder()));
        return ranked.size() > k ? new ArrayList<>(ranked.subList(0, k)) : ranked;
    }

    public static List<Integer> sorted(List<Integer> indices) {
        List<Integer> result = new ArrayList<>(indices);
        Collections.sort(result);
        return result;
    }
}
