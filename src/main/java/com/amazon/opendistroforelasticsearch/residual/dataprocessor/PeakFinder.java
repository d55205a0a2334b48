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

import java.util.ArrayList;
import java.util.List;

import com.amazon.opendistroforelasticsearch.residual.util.MatrixUtils;
import com.google.common.base.Preconditions;

/**
 * Finds local maxima in a score signal.
 *
 * A flagged region of a score signal usually spans many consecutive time
 * steps; its peak is the most representative one.
 */
public class PeakFinder {

    /**
     * Returns the local maxima of the signal in ascending order.
     *
     * A local maximum is an interior sample strictly larger than its left
     * neighbour and larger than its right neighbour. A flat top of equal
     * samples counts once, at its middle index (the lower one for an even
     * width). The first and last samples are never peaks.
     *
     * @param signal  a score signal
     * @return        ascending indices of the local maxima
     */
    public List<Integer> findPeaks(double[] signal) {
        List<Integer> peaks = new ArrayList<>();
        int last = signal.length - 1;
        int i = 1;
        while (i < last) {
            if (signal[i - 1] < signal[i]) {
                int ahead = i + 1;
                while (ahead < last && signal[ahead] == signal[i]) {
                    ahead++;
                }
                if (signal[ahead] < signal[i]) {
                    peaks.add((i + ahead - 1) / 2);
                    i = ahead;
                }
            }
            i++;
        }
        return peaks;
    }

    /**
     * Drops peaks that are too close to a higher one.
     *
     * Peaks are visited from the highest to the lowest, the earlier index
     * first among equal heights. A peak is kept unless a kept peak lies
     * less than {@code minDistance} samples away.
     *
     * @param signal       the score signal the peaks come from
     * @param peaks        candidate peak indices
     * @param minDistance  minimum spacing between kept peaks, at least 1
     * @return             kept peaks ranked by height, highest first
     */
    public List<Integer> selectByDistance(double[] signal, List<Integer> peaks, int minDistance) {
        Preconditions.checkArgument(minDistance >= 1, "minDistance must be at least 1.");
        List<Integer> kept = new ArrayList<>();
        for (int peak : MatrixUtils.topIndices(signal, peaks, peaks.size())) {
            boolean isolated = true;
            for (int keptPeak : kept) {
                if (Math.abs(keptPeak - peak) < minDistance) {
                    isolated = false;
                    break;
                }
            }
            if (isolated) {
                kept.add(peak);
            }
        }
        return kept;
    }
}
