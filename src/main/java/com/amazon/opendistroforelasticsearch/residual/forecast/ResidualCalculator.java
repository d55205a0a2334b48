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

package com.amazon.opendistroforelasticsearch.residual.forecast;

import org.apache.commons.lang3.tuple.Pair;

import com.amazon.opendistroforelasticsearch.residual.common.exception.ShapeMismatchException;
import com.amazon.opendistroforelasticsearch.residual.constant.CommonErrorMessages;
import com.amazon.opendistroforelasticsearch.residual.dataprocessor.MinMaxNormalizer;
import com.amazon.opendistroforelasticsearch.residual.util.MatrixUtils;
import com.google.common.base.Preconditions;

/**
 * Turns predictions and targets into prediction errors.
 */
public class ResidualCalculator {

    private final MinMaxNormalizer normalizer;

    public ResidualCalculator(MinMaxNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public double[][] residuals(double[][] prediction, double[][] target) {
        return residuals(prediction, target, 0);
    }

    /**
     * Computes prediction - target over the common time range.
     *
     * The first {@code shift} target rows are dropped so that each prediction
     * lines up with the target it forecasts, then both matrices are truncated
     * to the shorter length.
     *
     * @param prediction a `numPredictions x numFeatures` matrix
     * @param target a `numTargets x numFeatures` matrix
     * @param shift prediction horizon in time steps
     * @return a `min(numPredictions, numTargets - shift) x numFeatures` error matrix
     * @throws ShapeMismatchException if the feature counts differ
     */
    public double[][] residuals(double[][] prediction, double[][] target, int shift) {
        Preconditions.checkArgument(shift >= 0, "shift must be non-negative.");
        checkSameFeatures(prediction, target);
        int length = Math.max(0, Math.min(prediction.length, target.length - shift));
        double[][] errors = new double[length][];
        for (int i = 0; i < length; i++) {
            double[] predicted = prediction[i];
            double[] actual = target[i + shift];
            errors[i] = new double[predicted.length];
            for (int j = 0; j < predicted.length; j++) {
                errors[i][j] = predicted[j] - actual[j];
            }
        }
        return errors;
    }

    public double[][] residuals(Forecast forecast, int shift) {
        return residuals(forecast.getPrediction(), forecast.getTarget(), shift);
    }

    /**
     * Returns the mean absolute error of one feature once prediction and
     * target are rescaled to the target's range.
     *
     * @param prediction a `numSamples x numFeatures` matrix
     * @param target a matrix with the same shape
     * @param feature feature column
     * @return mean absolute normalized error, NaN without samples
     */
    public double signalMeanError(double[][] prediction, double[][] target, int feature) {
        checkSameFeatures(prediction, target);
        int length = Math.min(prediction.length, target.length);
        double[][] predictionColumn = new double[length][1];
        double[][] targetColumn = new double[length][1];
        for (int i = 0; i < length; i++) {
            predictionColumn[i][0] = prediction[i][feature];
            targetColumn[i][0] = target[i][feature];
        }

        Pair<double[][], double[][]> normalized = normalizer.normalizePaired(predictionColumn, targetColumn);
        double sum = 0;
        for (int i = 0; i < length; i++) {
            sum += Math.abs(normalized.getRight()[i][0] - normalized.getLeft()[i][0]);
        }
        return sum / length;
    }

    private void checkSameFeatures(double[][] prediction, double[][] target) {
        if (prediction.length == 0 || target.length == 0) {
            return;
        }
        int expected = MatrixUtils.numColumns(target);
        int actual = MatrixUtils.numColumns(prediction);
        if (expected != actual) {
            throw new ShapeMismatchException(CommonErrorMessages.FORECAST_SHAPE_MISMATCH_MSG, expected, actual);
        }
    }
}
