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
 * Thrown when a feature label does not resolve to a column of a label list.
 */
public class LabelNotFoundException extends AnomalyScoringException {

    private final String label;

    public LabelNotFoundException(String label, String message) {
        super(message);
        this.label = label;
    }

    /**
     * Returns the label that failed to resolve.
     *
     * @return the missing label
     */
    public String getLabel() {
        return label;
    }
}
