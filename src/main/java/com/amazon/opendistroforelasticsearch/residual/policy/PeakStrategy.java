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

import java.util.List;

import com.amazon.opendistroforelasticsearch.residual.dataprocessor.PeakFinder;
import com.amazon.opendistroforelasticsearch.residual.dataprocessor.Smoother;
import com.amazon.opendistroforelasticsearch.residual.model.AnomalySignal;
import com.amazon.opendistroforelasticsearch.residual.util.MatrixUtils;

/**
 * Reports the highest peaks of the averaged smoothed error.
 *
 * Features are weighted equally. Peaks closer than the peak width to a
 * higher peak are discarded, then the {@code numAnomalies} highest remaining
 * peaks are the anomalies. All remaining peaks are reported as candidates.
 */
public class PeakStrategy implements AnomalyDetectionStrategy {

    private final int numAnomalies;
    private final int peakWidth;
    private final Smoother smoother;
    private final PeakFinder peakFinder;

    public PeakStrategy(int numAnomalies, int peakWidth, Smoother smoother, PeakFinder peakFinder) {
        this.numAnomalies = numAnomalies;
        this.peakWidth = peakWidth;
        this.smoother = smoother;
        this.peakFinder = peakFinder;
    }

    @Override
    public AnomalySignal detect(double[][] errors) {
        double[] meanError = MatrixUtils.rowMeans(smoother.smoothColumns(errors));
        List<Integer> ranked = peakFinder.selectByDistance(meanError, peakFinder.findPeaks(meanError), peakWidth);
        List<Integer> anomalies = ranked.size() > numAnomalies ? ranked.subList(0, numAnomalies) : ranked;
        return new AnomalySignal(anomalies, meanError, MatrixUtils.sorted(ranked));
    }
}
