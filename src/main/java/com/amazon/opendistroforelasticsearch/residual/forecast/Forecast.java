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

import java.util.Arrays;

import com.amazon.opendistroforelasticsearch.residual.util.MatrixUtils;

/**
 * Data object for a model's predictions on a data file and the targets they
 * are compared to. Both are `numSamples x numFeatures` matrices; their
 * numbers of samples may differ.
 */
public class Forecast {

    private final double[][] prediction;
    private final double[][] target;

    public Forecast(double[][] prediction, double[][] target) {
        this.prediction = prediction;
        this.target = target;
    }

    public double[][] getPrediction() {
        return prediction;
    }

    public double[][] getTarget() {
        return target;
    }

    public int getNumFeatures() {
        return MatrixUtils.numColumns(target);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        Forecast that = (Forecast) o;
        return Arrays.deepEquals(this.prediction, that.prediction) && Arrays.deepEquals(this.target, that.target);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.deepHashCode(prediction) + Arrays.deepHashCode(target);
    }
}
