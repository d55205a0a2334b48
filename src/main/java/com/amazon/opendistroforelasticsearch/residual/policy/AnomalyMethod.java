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

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import com.amazon.opendistroforelasticsearch.residual.common.exception.InvalidConfigurationException;
import com.amazon.opendistroforelasticsearch.residual.constant.CommonErrorMessages;
import com.amazon.opendistroforelasticsearch.residual.ml.ScoringMode;
import com.google.common.collect.ImmutableList;

/**
 * The anomaly selection methods an {@link AnomalyPolicy} can run.
 */
public enum AnomalyMethod {
    THRESHOLD_NORM("threshold_norm", ScoringMode.Z_SCORE),
    THRESHOLD("threshold", null),
    PEAKS("peaks", null),
    VOTES("votes", null),
    GAUSSIAN("gaussian", ScoringMode.GAUSSIAN);

    private final String name;
    private final ScoringMode scoringMode;

    AnomalyMethod(String name, ScoringMode scoringMode) {
        this.name = name;
        this.scoringMode = scoringMode;
    }

    public String getName() {
        return name;
    }

    /**
     * Returns the scoring mode of the error model this method relies on.
     *
     * @return the scoring mode, null for methods that work on min-max normalized errors only
     */
    public ScoringMode getScoringMode() {
        return scoringMode;
    }

    public boolean usesErrorModel() {
        return scoringMode != null;
    }

    /**
     * Returns the supported method names.
     *
     * @return method names in declaration order
     */
    public static List<String> availableMethods() {
        return Arrays.stream(values()).map(AnomalyMethod::getName).collect(ImmutableList.toImmutableList());
    }

    /**
     * Resolves a method by its name.
     *
     * @param name method name such as "threshold_norm"
     * @return the method
     * @throws InvalidConfigurationException if no method has this name
     */
    public static AnomalyMethod fromName(String name) {
        for (AnomalyMethod method : values()) {
            if (method.name.equals(name)) {
                return method;
            }
        }
        throw new InvalidConfigurationException(
            String.format(Locale.ROOT, CommonErrorMessages.UNKNOWN_METHOD_MSG, name, availableMethods())
        );
    }

    @Override
    public String toString() {
        return name;
    }
}
