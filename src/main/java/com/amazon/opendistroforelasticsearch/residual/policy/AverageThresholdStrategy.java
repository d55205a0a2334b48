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

package com.amazon.opendistroforelasticsearch.residual.policy;

import java.util.ArrayList;
import java.util.List;

import com.amazon.opendistroforelasticsearch.residual.dataprocessor.Smoother;
import com.amazon.opendistroforelasticsearch.residual.model.AnomalySignal;
import com.amazon.opendistroforelasticsearch.residual.util.MatrixUtils;

/**
 * Averages the smoothed normalized errors of all features and flags every time
 * step above a fixed threshold. There is no cap on the number of anomalies.
 */
public class AverageThresholdStrategy implements AnomalyDetectionStrategy {

    private final double threshold;
    private final Smoother smoother;

    public AverageThresholdStrategy(double threshold, Smoother smoother) {
        this.threshold = threshold;
        this.smoother = smoother;
    }

    @Override
    public AnomalySignal detect(double[][] errors) {
        double[] meanError = MatrixUtils.rowMeans(smoother.smoothColumns(errors));
        List<Integer> anomalies = new ArrayList<>();
        for (int i = 0; i < meanError.length; i++) {
            if (meanError[i] > threshold) {
                anomalies.add(i);
            }
        }
        return new AnomalySignal(anomalies, meanError, null);
    }
}
