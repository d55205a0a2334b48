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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import com.amazon.opendistroforelasticsearch.residual.common.exception.ShapeMismatchException;
import com.amazon.opendistroforelasticsearch.residual.dataprocessor.MovingAverageSmoother;
import com.google.common.collect.ImmutableMap;

public class ErrorAggregatorTests {

    private ErrorAggregator aggregator;
    private Map<String, Map<String, double[][]>> perFileErrors;

    @Before
    public void setup() {
        aggregator = new ErrorAggregator();
        perFileErrors = new HashMap<>();
        perFileErrors.put("f1", modelErrors(new double[][] { { 1, 1 }, { 2, 2 } }, new double[][] { { 10 } }));
        perFileErrors.put("f2", modelErrors(new double[][] { { 3, 3 } }, new double[][] { { 20 }, { 30 } }));
    }

    private static Map<String, double[][]> modelErrors(double[][] lstm, double[][] arima) {
        Map<String, double[][]> errors = new LinkedHashMap<>();
        errors.put("lstm", lstm);
        errors.put("arima", arima);
        return errors;
    }

    @Test
    public void concatErrors_stacksFilesInGivenOrder() {
        Map<String, double[][]> pooled = aggregator.concatErrors(perFileErrors, Arrays.asList("f2", "f1"));

        assertEquals(Arrays.asList("lstm", "arima"), Arrays.asList(pooled.keySet().toArray()));
        assertArrayEquals(new double[][] { { 3, 3 }, { 1, 1 }, { 2, 2 } }, pooled.get("lstm"));
        assertArrayEquals(new double[][] { { 20 }, { 30 }, { 10 } }, pooled.get("arima"));
    }

    @Test
    public void concatErrors_keepsDuplicateFiles() {
        Map<String, double[][]> pooled = aggregator.concatErrors(perFileErrors, Arrays.asList("f1", "f1"));

        assertEquals(4, pooled.get("lstm").length);
    }

    @Test
    public void concatErrors_singleFile() {
        Map<String, double[][]> pooled = aggregator.concatErrors(perFileErrors, Arrays.asList("f1"));

        assertArrayEquals(new double[][] { { 1, 1 }, { 2, 2 } }, pooled.get("lstm"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void concatErrors_rejectsUnknownFile() {
        aggregator.concatErrors(perFileErrors, Arrays.asList("f1", "missing"));
    }

    @Test(expected = ShapeMismatchException.class)
    public void concatErrors_rejectsDifferentFeatureCounts() {
        perFileErrors.put("f3", ImmutableMap.of("lstm", new double[][] { { 1, 2, 3 } }));

        aggregator.concatErrors(perFileErrors, Arrays.asList("f1", "f3"));
    }

    @Test
    public void pooledFit_isIndependentOfFileOrderWithoutSmoothing() {
        MovingAverageSmoother noSmoothing = new MovingAverageSmoother(1);
        ErrorNormalizationModel forward = new ErrorNormalizationModel();
        ErrorNormalizationModel backward = new ErrorNormalizationModel();

        forward.fit(aggregator.concatErrors(perFileErrors, Arrays.asList("f1", "f2")).get("lstm"), noSmoothing);
        backward.fit(aggregator.concatErrors(perFileErrors, Arrays.asList("f2", "f1")).get("lstm"), noSmoothing);

        assertArrayEquals(forward.getMeans(), backward.getMeans(), 1e-12);
        assertArrayEquals(forward.getStandardDeviations(), backward.getStandardDeviations(), 1e-12);
    }
}
