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

import com.amazon.opendistroforelasticsearch.residual.model.AnomalySignal;

/**
 * One way of selecting anomalous time steps from an error matrix whose
 * columns are the scored features.
 */
public interface AnomalyDetectionStrategy {

    /**
     * Selects anomalous time steps.
     *
     * @param errors  a `numSamples x numFeatures` matrix of scored feature errors
     * @return        the anomalous time steps with the method's score signal and peaks, if any
     */
    AnomalySignal detect(double[][] errors);
}
