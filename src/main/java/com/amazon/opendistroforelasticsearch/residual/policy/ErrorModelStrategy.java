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

import com.amazon.opendistroforelasticsearch.residual.dataprocessor.Smoother;
import com.amazon.opendistroforelasticsearch.residual.ml.ErrorNormalizationModel;
import com.amazon.opendistroforelasticsearch.residual.model.AnomalySignal;

/**
 * Flags the time steps whose error model score exceeds a threshold. Backs
 * both threshold_norm and gaussian; the model's scoring mode makes the difference.
 */
public class ErrorModelStrategy implements AnomalyDetectionStrategy {

    private final ErrorNormalizationModel errorModel;
    private final double threshold;
    private final Smoother smoother;

    public ErrorModelStrategy(ErrorNormalizationModel errorModel, double threshold, Smoother smoother) {
        this.errorModel = errorModel;
        this.threshold = threshold;
        this.smoother = smoother;
    }

    /**
     * Scores raw errors against the fitted baseline. The model works on error
     * magnitudes itself, so the errors are not min-max normalized first.
     */
    @Override
    public AnomalySignal detect(double[][] errors) {
        return errorModel.anomalyDates(errors, threshold, smoother);
    }
}
