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

import com.amazon.opendistroforelasticsearch.residual.util.MatrixUtils;
import com.google.common.base.Preconditions;

/*
 * A centered moving average with a uniform kernel.
 *
 * The signal is convolved with `windowSize` weights of 1 / windowSize and the
 * output is aligned like a "same" mode convolution: sample i averages the
 * inputs from i - windowSize / 2 to i + (windowSize - 1) / 2. Near the edges
 * the missing inputs count as zero, so the sum is still divided by the full
 * window size. The output always has the length of the input, including when
 * the window is longer than the signal.
 */
public class MovingAverageSmoother implements Smoother {

    private final int windowSize;

    public MovingAverageSmoother(int windowSize) {
        Preconditions.checkArgument(windowSize >= 1, "windowSize must be at least 1.");
        this.windowSize = windowSize;
    }

    /*
     * Creates a smoother whose window is one sample longer than the smooth factor.
     *
     * @param smoothFactor  A non-negative smooth factor; 0 disables smoothing.
     * @return              A smoother with a window of smoothFactor + 1 samples.
     */
    public static MovingAverageSmoother fromSmoothFactor(int smoothFactor) {
        Preconditions.checkArgument(smoothFactor >= 0, "smoothFactor must be non-negative.");
        return new MovingAverageSmoother(smoothFactor + 1);
    }

    public int getWindowSize() {
        return windowSize;
    }

    @Override
    public double[] smooth(double[] signal) {
        int numSamples = signal.length;
        double[] prefixSums = new double[numSamples + 1];
        for (int i = 0; i < numSamples; i++) {
            prefixSums[i + 1] = prefixSums[i] + signal[i];
        }

        int before = windowSize / 2;
        int after = (windowSize - 1) / 2;
        double[] smoothed = new double[numSamples];
        for (int i = 0; i < numSamples; i++) {
            int first = Math.max(0, i - before);
            int last = Math.min(numSamples - 1, i + after);
            smoothed[i] = (prefixSums[last + 1] - prefixSums[first]) / windowSize;
        }
        return smoothed;
    }

    @Override
    public double[][] smoothColumns(double[][] matrix) {
        int numColumns = MatrixUtils.numColumns(matrix);
        double[][] smoothed = new double[matrix.length][numColumns];
        for (int j = 0; j < numColumns; j++) {
            double[] column = smooth(MatrixUtils.column(matrix, j));
            for (int i = 0; i < matrix.length; i++) {
                smoothed[i][j] = column[i];
            }
        }
        return smoothed;
    }
}
