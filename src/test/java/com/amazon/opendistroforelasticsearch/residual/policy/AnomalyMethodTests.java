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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;

import org.junit.Test;
import org.junit.runner.RunWith;

import com.amazon.opendistroforelasticsearch.residual.common.exception.InvalidConfigurationException;
import com.amazon.opendistroforelasticsearch.residual.ml.ScoringMode;

@RunWith(JUnitParamsRunner.class)
public class AnomalyMethodTests {

    private Object[] nameData() {
        return new Object[] {
            new Object[] { "threshold_norm", AnomalyMethod.THRESHOLD_NORM },
            new Object[] { "threshold", AnomalyMethod.THRESHOLD },
            new Object[] { "peaks", AnomalyMethod.PEAKS },
            new Object[] { "votes", AnomalyMethod.VOTES },
            new Object[] { "gaussian", AnomalyMethod.GAUSSIAN } };
    }

    @Test
    @Parameters(method = "nameData")
    public void fromName_resolvesEveryMethod(String name, AnomalyMethod expected) {
        AnomalyMethod method = AnomalyMethod.fromName(name);

        assertEquals(expected, method);
        assertEquals(name, method.toString());
    }

    @Test
    public void availableMethods_listsNamesInOrder() {
        assertEquals(
            Arrays.asList("threshold_norm", "threshold", "peaks", "votes", "gaussian"),
            AnomalyMethod.availableMethods()
        );
    }

    @Test
    public void fromName_rejectsUnknownNameAndListsAlternatives() {
        try {
            AnomalyMethod.fromName("median");
            fail("Expected InvalidConfigurationException");
        } catch (InvalidConfigurationException e) {
            assertThat(e.getMessage(), containsString("median"));
            assertThat(e.getMessage(), containsString("threshold_norm"));
        }
    }

    @Test(expected = InvalidConfigurationException.class)
    public void fromName_isCaseSensitive() {
        AnomalyMethod.fromName("PEAKS");
    }

    @Test
    public void scoringModes() {
        assertEquals(ScoringMode.Z_SCORE, AnomalyMethod.THRESHOLD_NORM.getScoringMode());
        assertEquals(ScoringMode.GAUSSIAN, AnomalyMethod.GAUSSIAN.getScoringMode());
        assertNull(AnomalyMethod.VOTES.getScoringMode());
        assertTrue(AnomalyMethod.GAUSSIAN.usesErrorModel());
        assertFalse(AnomalyMethod.THRESHOLD.usesErrorModel());
        assertFalse(AnomalyMethod.PEAKS.usesErrorModel());
    }
}
