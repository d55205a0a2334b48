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

/**
 * A forecasting model whose prediction errors are scored.
 *
 * Implementations load the data and run the model; scoring only consumes the
 * matrices they return.
 */
public interface ForecastProvider {

    /**
     * Returns the name the model's errors and scores are keyed by.
     *
     * @return model name
     */
    String getModelName();

    /**
     * Returns how many time steps ahead the model predicts. The first
     * {@code shift} target rows have no matching prediction.
     *
     * @return prediction horizon in time steps, 0 or more
     */
    int getShift();

    /**
     * Predicts a data file.
     *
     * @param dataFile data file identifier
     * @return predictions and targets with the same feature count
     */
    Forecast forecast(String dataFile);
}
