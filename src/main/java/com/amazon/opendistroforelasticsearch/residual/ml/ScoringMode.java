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

package com.amazon.opendistroforelasticsearch.residual.ml;

/**
 * How an {@link ErrorNormalizationModel} turns a smoothed error into a score.
 */
public enum ScoringMode {
    /** Distance from the fitted mean in fitted standard deviations. */
    Z_SCORE,
    /** Surprise of the upper tail of a fitted normal distribution, in decades of probability. */
    GAUSSIAN
}
