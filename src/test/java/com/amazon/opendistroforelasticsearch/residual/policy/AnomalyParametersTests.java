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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.elasticsearch.common.settings.Settings;
import org.junit.Test;

import com.amazon.opendistroforelasticsearch.residual.common.exception.InvalidConfigurationException;
import com.amazon.opendistroforelasticsearch.residual.dataprocessor.MovingAverageSmoother;

public class AnomalyParametersTests {

    @Test
    public void builder_usesDefaults() {
        AnomalyParameters parameters = AnomalyParameters.builder().build();

        assertEquals(AnomalyMethod.THRESHOLD_NORM, parameters.getMethod());
        assertEquals(20, parameters.getSmoothFactor());
        assertEquals(3.0, parameters.getThreshold(), 0);
        assertEquals(40, parameters.getNumAnomalies());
        assertEquals(10, parameters.getPeakWidth());
        assertTrue(parameters.getIgnore().isEmpty());
        assertFalse(parameters.hasLabels());
    }

    @Test
    public void fromSettings_readsEveryKey() {
        Settings settings = Settings
            .builder()
            .put("residual.anomaly.method", "peaks")
            .put("residual.anomaly.smooth_factor", 4)
            .put("residual.anomaly.threshold", 0.25)
            .put("residual.anomaly.n_anomalies", 7)
            .put("residual.anomaly.peak_width", 3)
            .putList("residual.anomaly.ignore", "disk", "network")
            .build();

        AnomalyParameters parameters = AnomalyParameters.fromSettings(settings);

        assertEquals(AnomalyMethod.PEAKS, parameters.getMethod());
        assertEquals(4, parameters.getSmoothFactor());
        assertEquals(0.25, parameters.getThreshold(), 0);
        assertEquals(7, parameters.getNumAnomalies());
        assertEquals(3, parameters.getPeakWidth());
        assertEquals(Arrays.asList("disk", "network"), parameters.getIgnore());
    }

    @Test
    public void fromSettings_emptySettingsMatchDefaults() {
        assertEquals(AnomalyParameters.builder().build(), AnomalyParameters.fromSettings(Settings.EMPTY));
    }

    @Test(expected = InvalidConfigurationException.class)
    public void fromSettings_rejectsUnknownMethod() {
        AnomalyParameters.fromSettings(Settings.builder().put("residual.anomaly.method", "median").build());
    }

    @Test(expected = IllegalArgumentException.class)
    public void fromSettings_rejectsNegativeSmoothFactor() {
        AnomalyParameters.fromSettings(Settings.builder().put("residual.anomaly.smooth_factor", -1).build());
    }

    @Test(expected = IllegalArgumentException.class)
    public void builder_rejectsZeroAnomalyBudget() {
        AnomalyParameters.builder().numAnomalies(0).build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void builder_rejectsNaNThreshold() {
        AnomalyParameters.builder().threshold(Double.NaN).build();
    }

    @Test
    public void withLabels_keepsOtherValues() {
        AnomalyParameters parameters = AnomalyParameters.builder().method("votes").numAnomalies(5).build();

        AnomalyParameters labeled = parameters.withLabels(Arrays.asList("cpu", "memory"));

        assertTrue(labeled.hasLabels());
        assertEquals(Arrays.asList("cpu", "memory"), labeled.getLabels());
        assertEquals(AnomalyMethod.VOTES, labeled.getMethod());
        assertEquals(5, labeled.getNumAnomalies());
        assertNotEquals(parameters, labeled);
        assertFalse(parameters.hasLabels());
    }

    @Test
    public void getSmoother_windowIsSmoothFactorPlusOne() {
        MovingAverageSmoother smoother = (MovingAverageSmoother) AnomalyParameters.builder().smoothFactor(0).build().getSmoother();

        assertEquals(1, smoother.getWindowSize());
    }
}
