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

package com.amazon.opendistroforelasticsearch.residual.dataprocessor;

import org.apache.commons.lang3.tuple.Pair;

import com.amazon.opendistroforelasticsearch.residual.constant.CommonErrorMessages;
import com.amazon.opendistroforelasticsearch.residual.settings.AnomalyScoringSettings;
import com.amazon.opendistroforelasticsearch.residual.util.MatrixUtils;
import com.google.common.base.Preconditions;

/*
 * A per-feature min-max rescaler.
 *
 * Every column of a `numSamples x numFeatures` matrix is mapped to
 * (x - min) / (max - min + eps). The ranges are recomputed from the input on
 * every call; nothing is fitted, so two calls on different matrices use
 * different ranges. The epsilon keeps a constant column at zero instead of
 * dividing by zero.
 */
public class MinMaxNormalizer {

    private final double epsilon;

    public MinMaxNormalizer() {
        this(AnomalyScoringSettings.EPSILON);
    }

    public MinMaxNormalizer(double epsilon) {
        Preconditions.checkArgument(epsilon > 0, "epsilon must be positive.");
        this.epsilon = epsilon;
    }

    /*
     * Rescales each column of the matrix with its own minimum and maximum.
     *
     * @param matrix  A `numSamples x numFeatures` matrix.
     * @return        A new `numSamples x numFeatures` matrix with values in [0, 1).
     */
    public double[][] normalize(double[][] matrix) {
        double[][] ranges = columnRanges(matrix);
        return rescale(matrix, ranges[0], ranges[1]);
    }

    /*
     * Rescales a prediction and its target with the target's column ranges so
     * both land on the same scale.
     *
     * @param prediction  A `numSamples x numFeatures` prediction matrix.
     * @param target      A matrix with the same feature count as the prediction.
     * @return            The rescaled prediction (left) and target (right).
     */
    public Pair<double[][], double[][]> normalizePaired(double[][] prediction, double[][] target) {
        int targetColumns = MatrixUtils.numColumns(target);
        int predictionColumns = MatrixUtils.numColumns(prediction);
        Preconditions
            .checkArgument(
                prediction.length == 0 || predictionColumns == targetColumns,
                CommonErrorMessages.FORECAST_SHAPE_MISMATCH_MSG
            );
        double[][] ranges = columnRanges(target);
        return Pair.of(rescale(prediction, ranges[0], ranges[1]), rescale(target, ranges[0], ranges[1]));
    }

    /*
     * Returns the per-column minimum (row 0) and maximum (row 1).
     */
    private double[][] columnRanges(double[][] matrix) {
        int numColumns = MatrixUtils.numColumns(matrix);
        double[] min = new double[numColumns];
        double[] max = new double[numColumns];
        for (int j = 0; j < numColumns; j++) {
            min[j] = Double.POSITIVE_INFINITY;
            max[j] = Double.NEGATIVE_INFINITY;
        }
        for (double[] row : matrix) {
            for (int j = 0; j < numColumns; j++) {
                min[j] = Math.min(min[j], row[j]);
                max[j] = Math.max(max[j], row[j]);
            }
        }
        return new double[][] { min, max };
    }

    private double[][] rescale(double[][] matrix, double[] min, double[] max) {
        double[][] rescaled = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            rescaled[i] = new double[matrix[i].length];
            for (int j = 0; j < matrix[i].length; j++) {
                rescaled[i][j] = (matrix[i][j] - min[j]) / (max[j] - min[j] + epsilon);
            }
        }
        return rescaled;
    }
}
