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

import java.util.Collection;
import java.util.List;

import org.apache.commons.lang.builder.EqualsBuilder;
import org.apache.commons.lang.builder.HashCodeBuilder;
import org.apache.commons.lang.builder.ToStringBuilder;
import org.elasticsearch.common.settings.Settings;

import com.amazon.opendistroforelasticsearch.residual.dataprocessor.MovingAverageSmoother;
import com.amazon.opendistroforelasticsearch.residual.dataprocessor.Smoother;
import com.amazon.opendistroforelasticsearch.residual.settings.AnomalyScoringSettings;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Immutable configuration of an anomaly policy.
 *
 * The threshold is compared to the error model score for threshold_norm and
 * gaussian, and to the averaged normalized error for threshold. The anomaly
 * budget and the peak width only matter to peaks and votes.
 */
public class AnomalyParameters {

    private final AnomalyMethod method;
    private final int smoothFactor;
    private final double threshold;
    private final int numAnomalies;
    private final int peakWidth;
    private final List<String> ignore;
    private final List<String> labels;

    private AnomalyParameters(Builder builder) {
        Preconditions.checkArgument(builder.smoothFactor >= 0, "smoothFactor must be non-negative.");
        Preconditions.checkArgument(builder.numAnomalies >= 1, "numAnomalies must be at least 1.");
        Preconditions.checkArgument(builder.peakWidth >= 1, "peakWidth must be at least 1.");
        Preconditions.checkArgument(!Double.isNaN(builder.threshold), "threshold must be a number.");
        this.method = Preconditions.checkNotNull(builder.method, "method is missing");
        this.smoothFactor = builder.smoothFactor;
        this.threshold = builder.threshold;
        this.numAnomalies = builder.numAnomalies;
        this.peakWidth = builder.peakWidth;
        this.ignore = ImmutableList.copyOf(builder.ignore);
        this.labels = ImmutableList.copyOf(builder.labels);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the parameters from settings, using defaults for missing keys.
     *
     * @param settings settings holding the residual.anomaly.* keys
     * @return parameters without labels
     * @see AnomalyScoringSettings
     */
    public static AnomalyParameters fromSettings(Settings settings) {
        return builder()
            .method(AnomalyMethod.fromName(AnomalyScoringSettings.METHOD.get(settings)))
            .smoothFactor(AnomalyScoringSettings.SMOOTH_FACTOR.get(settings))
            .threshold(AnomalyScoringSettings.THRESHOLD.get(settings))
            .numAnomalies(AnomalyScoringSettings.N_ANOMALIES.get(settings))
            .peakWidth(AnomalyScoringSettings.PEAK_WIDTH.get(settings))
            .ignore(AnomalyScoringSettings.IGNORED_FEATURES.get(settings))
            .build();
    }

    /**
     * Returns a copy of these parameters bound to the full feature label list
     * of the errors they will score.
     *
     * @param labels one label per error matrix column
     * @return parameters ready for an {@link AnomalyPolicy}
     */
    public AnomalyParameters withLabels(List<String> labels) {
        return toBuilder().labels(labels).build();
    }

    public Builder toBuilder() {
        return builder()
            .method(method)
            .smoothFactor(smoothFactor)
            .threshold(threshold)
            .numAnomalies(numAnomalies)
            .peakWidth(peakWidth)
            .ignore(ignore)
            .labels(labels);
    }

    public AnomalyMethod getMethod() {
        return method;
    }

    public int getSmoothFactor() {
        return smoothFactor;
    }

    /**
     * Returns the moving average smoother of this configuration.
     *
     * @return a smoother with a window of smoothFactor + 1 samples
     */
    public Smoother getSmoother() {
        return MovingAverageSmoother.fromSmoothFactor(smoothFactor);
    }

    public double getThreshold() {
        return threshold;
    }

    public int getNumAnomalies() {
        return numAnomalies;
    }

    public int getPeakWidth() {
        return peakWidth;
    }

    public List<String> getIgnore() {
        return ignore;
    }

    public List<String> getLabels() {
        return labels;
    }

    public boolean hasLabels() {
        return !labels.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        AnomalyParameters that = (AnomalyParameters) o;
        return new EqualsBuilder()
            .append(method, that.method)
            .append(smoothFactor, that.smoothFactor)
            .append(threshold, that.threshold)
            .append(numAnomalies, that.numAnomalies)
            .append(peakWidth, that.peakWidth)
            .append(ignore, that.ignore)
            .append(labels, that.labels)
            .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder()
            .append(method)
            .append(smoothFactor)
            .append(threshold)
            .append(numAnomalies)
            .append(peakWidth)
            .append(ignore)
            .append(labels)
            .toHashCode();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
            .append("method", method)
            .append("smoothFactor", smoothFactor)
            .append("threshold", threshold)
            .append("numAnomalies", numAnomalies)
            .append("peakWidth", peakWidth)
            .append("ignore", ignore)
            .append("labels", labels)
            .toString();
    }

    public static class Builder {
        private AnomalyMethod method = AnomalyMethod.fromName(AnomalyScoringSettings.DEFAULT_METHOD);
        private int smoothFactor = AnomalyScoringSettings.DEFAULT_SMOOTH_FACTOR;
        private double threshold = AnomalyScoringSettings.DEFAULT_THRESHOLD;
        private int numAnomalies = AnomalyScoringSettings.DEFAULT_N_ANOMALIES;
        private int peakWidth = AnomalyScoringSettings.DEFAULT_PEAK_WIDTH;
        private Collection<String> ignore = ImmutableList.of();
        private Collection<String> labels = ImmutableList.of();

        public Builder method(AnomalyMethod method) {
            this.method = method;
            return this;
        }

        public Builder method(String method) {
            this.method = AnomalyMethod.fromName(method);
            return this;
        }

        public Builder smoothFactor(int smoothFactor) {
            this.smoothFactor = smoothFactor;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder numAnomalies(int numAnomalies) {
            this.numAnomalies = numAnomalies;
            return this;
        }

        public Builder peakWidth(int peakWidth) {
            this.peakWidth = peakWidth;
            return this;
        }

        public Builder ignore(Collection<String> ignore) {
            this.ignore = ignore;
            return this;
        }

        public Builder labels(Collection<String> labels) {
            this.labels = labels;
            return this;
        }

        public AnomalyParameters build() {
            return new AnomalyParameters(this);
        }
    }
}
