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

import static org.junit.Assert.assertEquals;

import java.util.Random;

import org.junit.Test;

public class MovingAverageSmootherWindowTests {

    @Test
    public void smooth_preservesLength_forAnyWindowAndLength() {
        Random random = new Random(42);
        for (int length = 1; length <= 30; length++) {
            double[] signal = random.doubles(length).toArray();
            for (int windowSize = 1; windowSize <= 40; windowSize++) {
                assertEquals(length, new MovingAverageSmoother(windowSize).smooth(signal).length);
            }
        }
    }

    @Test
    public void fromSmoothFactor_addsOneSample() {
        assertEquals(1, MovingAverageSmoother.fromSmoothFactor(0).getWindowSize());
        assertEquals(21, MovingAverageSmoother.fromSmoothFactor(20).getWindowSize());
    }

    @Test(expected = IllegalArgumentException.class)
    public void constructor_rejectsEmptyWindow() {
        new MovingAverageSmoother(0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void fromSmoothFactor_rejectsNegativeFactor() {
        MovingAverageSmoother.fromSmoothFactor(-1);
    }

    @Test
    public void smooth_spreadsIsolatedSpike() {
        double[] smoothed = new MovingAverageSmoother(5).smooth(new double[] { 0, 0, 0, 0, 10, 0, 0, 0, 0 });

        for (int i = 2; i <= 6; i++) {
            assertEquals(2.0, smoothed[i], 1e-12);
        }
        assertEquals(0.0, smoothed[1], 1e-12);
        assertEquals(0.0, smoothed[7], 1e-12);
    }
}
