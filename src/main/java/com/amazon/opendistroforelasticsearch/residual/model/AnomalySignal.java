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

package com.amazon.opendistroforelasticsearch.residual.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

import org.apache.commons.lang.builder.EqualsBuilder;
import org.apache.commons.lang.builder.HashCodeBuilder;
import org.apache.commons.lang.builder.ToStringBuilder;

import com.google.common.collect.ImmutableList;

/**
 * Result of an anomaly computation on one error matrix.
 *
 * The score signal and the peak indices are optional: an absent value means
 * the method does not produce one, not that it is zero.
 */
public class AnomalySignal {

    private final List<Integer> anomalyIndices;
    private final double[] scoreSignal;
    private final List<Integer> peakIndices;

    /**
     * Constructor with all arguments.
     *
     * @param anomalyIndices flagged time steps; sorted and deduplicated on construction
     * @param scoreSignal continuous anomaly score aligned with the time axis, or null
     * @param peakIndices local maxima of the score signal, or null
     */
    public AnomalySignal(List<Integer> anomalyIndices, double[] scoreSignal, List<Integer> peakIndices) {
        this.anomalyIndices = ImmutableList.copyOf(new TreeSet<>(anomalyIndices));
        this.scoreSignal = scoreSignal == null ? null : Arrays.copyOf(scoreSignal, scoreSignal.length);
        this.peakIndices = peakIndices == null ? null : ImmutableList.copyOf(peakIndices);
    }

    /**
     * Returns the flagged time steps.
     *
     * @return ascending, deduplicated 0-based time steps
     */
    public List<Integer> getAnomalyIndices() {
        return anomalyIndices;
    }

    public Optional<double[]> getScoreSignal() {
        return Optional.ofNullable(scoreSignal).map(signal -> Arrays.copyOf(signal, signal.length));
    }

    public Optional<List<Integer>> getPeakIndices() {
        return Optional.ofNullable(peakIndices);
    }

    public int getAnomalyCount() {
        return anomalyIndices.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        AnomalySignal that = (AnomalySignal) o;
        return new EqualsBuilder()
            .append(anomalyIndices, that.anomalyIndices)
            .append(scoreSignal, that.scoreSignal)
            .append(peakIndices, that.peakIndices)
            .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder().append(anomalyIndices).append(scoreSignal).append(peakIndices).toHashCode();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
            .append("anomalyIndices", anomalyIndices)
            .append("scoreSignal", scoreSignal == null ? null : Arrays.toString(scoreSignal))
            .append("peakIndices", peakIndices)
            .toString();
    }
}
