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

import org.apache.commons.lang.builder.ToStringBuilder;

import com.google.common.base.Objects;

/**
 * Detection quality of a list of flagged time steps against ground-truth intervals.
 *
 * True positives count found intervals, false negatives missed intervals and
 * false positives flagged time steps outside every interval. Both ratios share
 * the true positive count; a ratio with a zero denominator is 0.
 */
public class DetectionScore {

    private final int truePositive;
    private final int falseNegative;
    private final int falsePositive;

    public DetectionScore(int truePositive, int falseNegative, int falsePositive) {
        this.truePositive = truePositive;
        this.falseNegative = falseNegative;
        this.falsePositive = falsePositive;
    }

    public int getTruePositive() {
        return truePositive;
    }

    public int getFalseNegative() {
        return falseNegative;
    }

    public int getFalsePositive() {
        return falsePositive;
    }

    /**
     * Returns tp / (tp + fn), the share of intervals that were found.
     *
     * @return recall, or 0 without any interval
     */
    public double getRecall() {
        return ratio(truePositive, truePositive + falseNegative);
    }

    /**
     * Returns tp / (tp + fp).
     *
     * The numerator counts intervals while fp counts time steps, so this is
     * precision-shaped rather than a per-step precision.
     *
     * @return the ratio, or 0 when nothing was found and nothing was flagged wrongly
     */
    public double getPrecision() {
        return ratio(truePositive, truePositive + falsePositive);
    }

    private static double ratio(int numerator, int denominator) {
        return denominator == 0 ? 0. : (double) numerator / denominator;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        DetectionScore that = (DetectionScore) o;
        return truePositive == that.truePositive && falseNegative == that.falseNegative && falsePositive == that.falsePositive;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(truePositive, falseNegative, falsePositive);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
            .append("truePositive", truePositive)
            .append("falseNegative", falseNegative)
            .append("falsePositive", falsePositive)
            .append("recall", getRecall())
            .append("precision", getPrecision())
            .toString();
    }
}
