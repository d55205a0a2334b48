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

package com.amazon.opendistroforelasticsearch.residual.constant;

public class CommonErrorMessages {
    public static final String UNKNOWN_METHOD_MSG = "Unknown anomaly method: %s. Available methods are %s";
    public static final String LABELS_MISSING_MSG = "Feature labels must be set before fitting or computing anomalies";
    public static final String DUPLICATE_LABEL_MSG = "Feature label is not unique: ";
    public static final String LABEL_NOT_FOUND_MSG = "Feature label not found: ";
    public static final String NO_FEATURE_SELECTED_MSG = "All features are ignored, nothing to score";
    public static final String MODEL_SHAPE_MISMATCH_MSG = "Feature count differs from the fitted model.";
    public static final String LABEL_SHAPE_MISMATCH_MSG = "Error matrix column count differs from the feature labels.";
    public static final String CONCAT_SHAPE_MISMATCH_MSG = "Cannot concatenate errors with a different feature count.";
    public static final String FORECAST_SHAPE_MISMATCH_MSG = "Prediction and target feature counts differ.";
    public static final String RAGGED_MATRIX_MSG = "Matrix rows must all have the same length";
    public static final String MODEL_MODE_MISMATCH_MSG = "Error model was fitted in %s mode but method %s scores in %s mode";
    public static final String MODEL_NOT_FITTED_MSG = "Error normalization model has not been fitted";
    public static final String EMPTY_TRAINING_ERRORS_MSG = "Cannot fit an error model on an empty error matrix";
    public static final String NO_ERRORS_FOR_FILE_MSG = "No errors computed for data file: ";
    public static final String NO_FORECAST_PROVIDER_MSG = "No forecast provider for model: ";
}
