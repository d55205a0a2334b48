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

package com.amazon.opendistroforelasticsearch.residual.settings;

import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import org.elasticsearch.common.settings.Setting;

import com.google.common.collect.ImmutableList;

/**
 * Anomaly scoring settings.
 */
public final class AnomalyScoringSettings {

    private AnomalyScoringSettings() {}

    public static final String DEFAULT_METHOD = "threshold_norm";
    public static final int DEFAULT_SMOOTH_FACTOR = 20;
    public static final double DEFAULT_THRESHOLD = 3.0;
    public static final int DEFAULT_N_ANOMALIES = 40;
    public static final int DEFAULT_PEAK_WIDTH = 10;

    // Method names are validated when the parameters are built, so an unknown
    // name surfaces as a configuration error rather than a setting parse error.
    public static final Setting<String> METHOD = Setting
        .simpleString("residual.anomaly.method", DEFAULT_METHOD, Setting.Property.NodeScope);

    public static final Setting<Integer> SMOOTH_FACTOR = Setting
        .intSetting("residual.anomaly.smooth_factor", DEFAULT_SMOOTH_FACTOR, 0, Setting.Property.NodeScope);

    public static final Setting<Double> THRESHOLD = Setting
        .doubleSetting("residual.anomaly.threshold", DEFAULT_THRESHOLD, -Double.MAX_VALUE, Setting.Property.NodeScope);

    public static final Setting<Integer> N_ANOMALIES = Setting
        .intSetting("residual.anomaly.n_anomalies", DEFAULT_N_ANOMALIES, 1, Setting.Property.NodeScope);

    public static final Setting<Integer> PEAK_WIDTH = Setting
        .intSetting("residual.anomaly.peak_width", DEFAULT_PEAK_WIDTH, 1, Setting.Property.NodeScope);

    public static final Setting<List<String>> IGNORED_FEATURES = Setting
        .listSetting("residual.anomaly.ignore", Collections.emptyList(), Function.identity(), Setting.Property.NodeScope);

    public static final List<Setting<?>> ALL_SETTINGS = ImmutableList
        .of(METHOD, SMOOTH_FACTOR, THRESHOLD, N_ANOMALIES, PEAK_WIDTH, IGNORED_FEATURES);

    // Numerical stability constant shared by min-max normalization and the error model.
    public static final double EPSILON = 1e-5;

    // Lower bound on upper-tail probabilities before taking their logarithm.
    public static final double MIN_TAIL_PROBABILITY = 1e-300;
}
