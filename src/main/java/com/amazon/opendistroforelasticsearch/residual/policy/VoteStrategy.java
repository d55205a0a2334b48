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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.amazon.opendistroforelasticsearch.residual.dataprocessor.Smoother;
import com.amazon.opendistroforelasticsearch.residual.model.AnomalySignal;
import com.amazon.opendistroforelasticsearch.residual.util.MatrixUtils;

/**
 * Lets every feature vote for its own most anomalous time steps and keeps
 * the time steps with the most votes.
 *
 * A feature votes for a time step when its smoothed normalized error reaches
 * the feature's {@code numAnomalies}-th largest value. The
 * {@code numAnomalies} time steps with the highest vote count are anomalous,
 * the earlier one first among equal counts. A time step without votes is never
 * anomalous. A feature that is constant over the trace does not vote. The
 * score signal is the vote count; there are no peaks.
 */
public class VoteStrategy implements AnomalyDetectionStrategy {

    private final int numAnomalies;
    private final Smoother smoother;

    public VoteStrategy(int numAnomalies, Smoother smoother) {
        this.numAnomalies = numAnomalies;
        this.smoother = smoother;
    }

    @Override
    public AnomalySignal detect(double[][] errors) {
        double[][] smoothed = smoother.smoothColumns(errors);
        int numSamples = smoothed.length;
        double[] votes = new double[numSamples];
        if (numSamples == 0) {
            return new AnomalySignal(new ArrayList<>(), votes, null);
        }

        int numFeatures = MatrixUtils.numColumns(smoothed);
        int rank = Math.min(numAnomalies, numSamples);
        for (int j = 0; j < numFeatures; j++) {
            double[] column = MatrixUtils.column(smoothed, j);
            double[] ordered = column.clone();
            Arrays.sort(ordered);
            if (ordered[0] == ordered[numSamples - 1]) {
                // a flat feature has no most anomalous step
                continue;
            }
            double featureThreshold = ordered[numSamples - rank];
            for (int i = 0; i < numSamples; i++) {
                if (column[i] >= featureThreshold) {
                    votes[i]++;
                }
            }
        }

        List<Integer> voted = new ArrayList<>();
        for (int i = 0; i < numSamples; i++) {
            if (votes[i] > 0) {
                voted.add(i);
            }
        }
        return new AnomalySignal(MatrixUtils.topIndices(votes, voted, numAnomalies), votes, null);
    }
}
