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

package com.amazon.opendistroforelasticsearch.residual.ml;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.opendistroforelasticsearch.residual.common.exception.ShapeMismatchException;
import com.amazon.opendistroforelasticsearch.residual.constant.CommonErrorMessages;
import com.amazon.opendistroforelasticsearch.residual.dataprocessor.PeakFinder;
import com.amazon.opendistroforelasticsearch.residual.dataprocessor.Smoother;
import com.amazon.opendistroforelasticsearch.residual.model.AnomalySignal;
import com.amazon.opendistroforelasticsearch.residual.settings.AnomalyScoringSettings;
import com.amazon.opendistroforelasticsearch.residual.util.MatrixUtils;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

/**
 * A baseline model of prediction error magnitudes, used to convert new errors
 * into dimensionless anomaly scores.
 *
 * The model is trained on a matrix of errors, typically pooled over several
 * training files, where every column is one feature. Each column is smoothed
 * in absolute value and summarized by its mean and standard deviation. A new
 * error matrix with the same columns is smoothed the same way and every
 * feature is scored against its own baseline, either as a z-score or, in
 * Gaussian mode, as the upper-tail surprise of a fitted normal distribution.
 * The per-feature scores are averaged into one score per time step, and the
 * time steps whose score exceeds a threshold are anomalous.
 *
 * Fitting replaces any previous fit. Once fitted, the model is only read, so
 * it can be shared by concurrent scoring calls as long as nobody refits it
 * meanwhile; the model does no locking itself.
 */
public class ErrorNormalizationModel {

    private static final Logger logger = LogManager.getLogger(ErrorNormalizationModel.class);

    private final PeakFinder peakFinder;

    private ScoringMode mode;
    private double[] means;
    private double[] standardDeviations;
    private NormalDistribution[] distributions;

    public ErrorNormalizationModel() {
        this(new PeakFinder());
    }

    public ErrorNormalizationModel(PeakFinder peakFinder) {
        this.peakFinder = peakFinder;
    }

    /**
     * Fits z-score baselines.
     *
     * @param errors    a `numSamples x numFeatures` error matrix
     * @param smoother  smoother applied to the absolute errors
     * @see #fit(double[][], Smoother, ScoringMode)
     */
    public void fit(double[][] errors, Smoother smoother) {
        fit(errors, smoother, ScoringMode.Z_SCORE);
    }

    /**
     * Fits a per-feature baseline on a training error matrix.
     *
     * The columns must already be restricted to the scored features; queries
     * must use the same columns.
     *
     * @param errors    a `numSamples x numFeatures` error matrix with numSamples &gt; 0
     * @param smoother  smoother applied to the absolute errors
     * @param mode      scoring mode used by later queries
     * @throws IllegalArgumentException if the matrix is empty
     */
    public void fit(double[][] errors, Smoother smoother, ScoringMode mode) {
        Preconditions.checkArgument(errors.length > 0, CommonErrorMessages.EMPTY_TRAINING_ERRORS_MSG);
        int numFeatures = MatrixUtils.numColumns(errors);
        Preconditions.checkArgument(numFeatures > 0, CommonErrorMessages.EMPTY_TRAINING_ERRORS_MSG);

        double[][] smoothed = smoother.smoothColumns(MatrixUtils.abs(errors));
        double[] fittedMeans = new double[numFeatures];
        double[] fittedStandardDeviations = new double[numFeatures];
        for (int j = 0; j < numFeatures; j++) {
            SummaryStatistics stats = new SummaryStatistics();
            for (double[] row : smoothed) {
                stats.addValue(row[j]);
            }
            fittedMeans[j] = stats.getMean();
            // a single sample has an undefined deviation; treat it as a constant trace
            fittedStandardDeviations[j] = stats.getN() > 1 ? stats.getStandardDeviation() : 0.;
        }

        NormalDistribution[] fittedDistributions = null;
        if (mode == ScoringMode.GAUSSIAN) {
            fittedDistributions = new NormalDistribution[numFeatures];
            for (int j = 0; j < numFeatures; j++) {
                fittedDistributions[j] = new NormalDistribution(
                    fittedMeans[j],
                    fittedStandardDeviations[j] + AnomalyScoringSettings.EPSILON
                );
            }
        }

        this.mode = mode;
        this.means = fittedMeans;
        this.standardDeviations = fittedStandardDeviations;
        this.distributions = fittedDistributions;
        logger
            .debug(
                "Fitted {} error model on {} samples, means: {}, standard deviations: {}",
                mode,
                errors.length,
                Arrays.toString(fittedMeans),
                Arrays.toString(fittedStandardDeviations)
            );
    }

    public boolean isFitted() {
        return means != null;
    }

    public ScoringMode getMode() {
        return mode;
    }

    /**
     * Returns the number of feature columns the model was fitted on.
     *
     * @return number of features, 0 if not fitted
     */
    public int getNumFeatures() {
        return isFitted() ? means.length : 0;
    }

    public double[] getMeans() {
        checkFitted();
        return Arrays.copyOf(means, means.length);
    }

    public double[] getStandardDeviations() {
        checkFitted();
        return Arrays.copyOf(standardDeviations, standardDeviations.length);
    }

    /**
     * Computes one anomaly score per time step.
     *
     * @param errors    a `numSamples x numFeatures` error matrix with the fitted columns
     * @param smoother  smoother applied to the absolute errors
     * @return          a `numSamples` score signal
     * @throws ShapeMismatchException if the feature count differs from the fitted one
     */
    public double[] score(double[][] errors, Smoother smoother) {
        checkFitted();
        int numFeatures = MatrixUtils.numColumns(errors);
        if (errors.length > 0 && numFeatures != means.length) {
            throw new ShapeMismatchException(CommonErrorMessages.MODEL_SHAPE_MISMATCH_MSG, means.length, numFeatures);
        }

        double[][] smoothed = smoother.smoothColumns(MatrixUtils.abs(errors));
        double[][] featureScores = new double[smoothed.length][numFeatures];
        for (int i = 0; i < smoothed.length; i++) {
            for (int j = 0; j < numFeatures; j++) {
                featureScores[i][j] = featureScore(j, smoothed[i][j]);
            }
        }
        return MatrixUtils.rowMeans(featureScores);
    }

    /**
     * Finds the anomalous time steps of an error matrix.
     *
     * @param errors     a `numSamples x numFeatures` error matrix with the fitted columns
     * @param threshold  scores strictly above this value are anomalous
     * @param smoother   smoother applied to the absolute errors
     * @return           ascending anomalous time steps, the score signal and its local maxima
     * @throws ShapeMismatchException if the feature count differs from the fitted one
     */
    public AnomalySignal anomalyDates(double[][] errors, double threshold, Smoother smoother) {
        double[] scores = score(errors, smoother);
        List<Integer> anomalies = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            if (scores[i] > threshold) {
                anomalies.add(i);
            }
        }
        logger.debug("{} of {} time steps score above {}", anomalies.size(), scores.length, threshold);
        return new AnomalySignal(anomalies, scores, peakFinder.findPeaks(scores));
    }

    @VisibleForTesting
    double featureScore(int feature, double smoothedError) {
        if (mode == ScoringMode.GAUSSIAN) {
            // P(X >= x) computed as P(X <= 2 * mean - x) keeps precision deep in the upper tail
            double tail = distributions[feature].cumulativeProbability(2 * means[feature] - smoothedError);
            return -Math.log10(Math.max(tail, AnomalyScoringSettings.MIN_TAIL_PROBABILITY));
        }
        return (smoothedError - means[feature]) / (standardDeviations[feature] + AnomalyScoringSettings.EPSILON);
    }

    private void checkFitted() {
        Preconditions.checkState(isFitted(), CommonErrorMessages.MODEL_NOT_FITTED_MSG);
    }
}
