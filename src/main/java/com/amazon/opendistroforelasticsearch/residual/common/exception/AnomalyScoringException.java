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

package com.amazon.opendistroforelasticsearch.residual.common.exception;

/**
 * Base exception for exceptions thrown from residual anomaly scoring.
 */
public class AnomalyScoringException extends RuntimeException {

    public AnomalyScoringException(String message) {
        super(message);
    }

    public AnomalyScoringException(String message, Throwable cause) {
        super(message, cause);
    }

    public AnomalyScoringException(Throwable cause) {
        super(cause);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Anomaly Scoring ");
        sb.append(super.toString());
        return sb.toString();
    }
}
