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

package com.amazon.opendistroforelasticsearch.residual.evaluation;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.opendistroforelasticsearch.residual.model.DetectionScore;
import com.amazon.opendistroforelasticsearch.residual.model.GroundTruthInterval;

/**
 * Scores flagged time steps against ground-truth anomaly intervals.
 *
 * Each flagged time step is matched to the first interval containing it. An
 * interval is found when at least one time step matches it. A time step that
 * matches no interval is a false positive. A time step that matches an
 * interval already found is neither a new true positive nor a false positive.
 */
public class DetectionEvaluator {

    private static final Logger logger = LogManager.getLogger(DetectionEvaluator.class);

    public DetectionScore score(List<Integer> predicted, List<GroundTruthInterval> intervals) {
        return score(predicted, intervals, 0);
    }

    /**
     * Scores flagged time steps expressed relative to a shifted time axis.
     *
     * @param predicted flagged time steps
     * @param intervals ground-truth intervals with inclusive bounds
     * @param shift offset added to every flagged time step before matching
     * @return true positive, false negative and false positive counts
     */
    public DetectionScore score(List<Integer> predicted, List<GroundTruthInterval> intervals, int shift) {
        boolean[] found = new boolean[intervals.size()];
        int falsePositive = 0;

        for (int timeStep : predicted) {
            int shifted = timeStep + shift;
            boolean match = false;
            for (int i = 0; i < intervals.size(); i++) {
                if (intervals.get(i).contains(shifted)) {
                    found[i] = true;
                    match = true;
                    break;
                }
            }
            if (!match) {
                falsePositive++;
            }
        }

        int truePositive = 0;
        for (boolean intervalFound : found) {
            if (intervalFound) {
                truePositive++;
            }
        }
        DetectionScore score = new DetectionScore(truePositive, intervals.size() - truePositive, falsePositive);
        logger.debug("Detection score: {}", score);
        return score;
    }
}
