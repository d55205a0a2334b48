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

package com.amazon.opendistroforelasticsearch.residual.dataprocessor;

import static org.junit.Assert.assertArrayEquals;

import java.util.Arrays;
import java.util.Collection;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

@RunWith(Parameterized.class)
public class MovingAverageSmootherTests {

    @Parameters
    public static Collection<Object[]> data() {
        double[] ramp = { 1.0, 2.0, 3.0, 4.0 };
        double oneThird = 1.0 / 3.0;

        return Arrays
            .asList(
                new Object[][] {
                    { ramp, 1, ramp },
                    { ramp, 2, new double[] { 0.5, 1.5, 2.5, 3.5 } },
                    { ramp, 3, new double[] { 1.0, 2.0, 3.0, 7 * oneThird } },
                    { ramp, 4, new double[] { 0.75, 1.5, 2.5, 2.25 } },
                    { new double[] { 1.0, 2.0, 3.0 }, 10, new double[] { 0.6, 0.6, 0.6 } },
                    { new double[] { 5.0 }, 4, new double[] { 1.25 } },
                    { new double[0], 3, new double[0] }, }
            );
    }

    private final double[] input;
    private final int windowSize;
    private final double[] expected;

    public MovingAverageSmootherTests(double[] input, int windowSize, double[] expected) {
        this.input = input;
        this.windowSize = windowSize;
        this.expected = expected;
    }

    @Test
    public void testSmooth() {
        double[] actual = new MovingAverageSmoother(windowSize).smooth(input);
        assertArrayEquals(expected, actual, 1e-8);
    }

    @Test
    public void testSmoothColumnsMatchesSingleSignal() {
        double[][] matrix = new double[input.length][2];
        for (int i = 0; i < input.length; i++) {
            matrix[i][0] = input[i];
            matrix[i][1] = -input[i];
        }

        double[][] actual = new MovingAverageSmoother(windowSize).smoothColumns(matrix);

        for (int i = 0; i < input.length; i++) {
            assertArrayEquals(new double[] { expected[i], -expected[i] }, actual[i], 1e-8);
        }
    }
}
