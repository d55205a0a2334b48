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

import java.util.Locale;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.opendistroforelasticsearch.residual.common.exception.InvalidConfigurationException;
import com.amazon.opendistroforelasticsearch.residual.common.exception.LabelNotFoundException;
import com.amazon.opendistroforelasticsearch.residual.common.exception.ShapeMismatchException;
import com.amazon.opendistroforelasticsearch.residual.constant.CommonErrorMessages;
import com.amazon.opendistroforelasticsearch.residual.dataprocessor.MinMaxNormalizer;
import com.amazon.opendistroforelasticsearch.residual.dataprocessor.PeakFinder;
import com.amazon.opendistroforelasticsearch.residual.dataprocessor.Smoother;
import com.amazon.opendistroforelasticsearch.residual.ml.ErrorNormalizationModel;
import com.amazon.opendistroforelasticsearch.residual.ml.ScoringMode;
import com.amazon.opendistroforelasticsearch.residual.model.AnomalySignal;
import com.amazon.opendistroforelasticsearch.residual.model.FeatureSelection;
import com.amazon.opendistroforelasticsearch.residual.util.MatrixUtils;

/**
 * Computes the anomalous time steps of a prediction error matrix.
 *
 * Every call first drops the ignored feature columns, then runs the configured
 * method on the remaining ones:
 * <ul>
 * <li>threshold_norm and gaussian score raw errors with an
 * {@link ErrorNormalizationModel} and flag scores above the threshold;</li>
 * <li>threshold, peaks and votes work on min-max normalized absolute errors.</li>
 * </ul>
 *
 * The error model is an explicit argument, usually fitted with {@link #fit}
 * on held-out training errors. When no fitted model is given, one is fitted on
 * the very errors being scored ("fit-on-query").
 */
public class AnomalyPolicy {

    private static final Logger logger = LogManager.getLogger(AnomalyPolicy.class);

    private final AnomalyParameters parameters;
    private final FeatureSelection featureSelection;
    private final Smoother smoother;
    private final MinMaxNormalizer normalizer;
    private final PeakFinder peakFinder;

    /**
     * Creates a policy.
     *
     * @param parameters configuration with feature labels, see {@link AnomalyParameters#withLabels}
     * @throws InvalidConfigurationException if the parameters carry no labels or ignore every label
     * @throws LabelNotFoundException if a label occurs more than once
     */
    public AnomalyPolicy(AnomalyParameters parameters) {
        this(parameters, new MinMaxNormalizer(), new PeakFinder());
    }

    public AnomalyPolicy(AnomalyParameters parameters, MinMaxNormalizer normalizer, PeakFinder peakFinder) {
        if (!parameters.hasLabels()) {
            throw new InvalidConfigurationException(CommonErrorMessages.LABELS_MISSING_MSG);
        }
        this.parameters = parameters;
        this.featureSelection = FeatureSelection.of(parameters.getLabels(), parameters.getIgnore());
        this.smoother = parameters.getSmoother();
        this.normalizer = normalizer;
        this.peakFinder = peakFinder;
    }

    public AnomalyParameters getParameters() {
        return parameters;
    }

    public FeatureSelection getFeatureSelection() {
        return featureSelection;
    }

    /**
     * Fits an error model on training errors for this policy's method and features.
     *
     * @param errors a `numSamples x labels.size()` matrix, typically pooled over training files
     * @return a new fitted model in the scoring mode of the method; for methods
     *     without an error model the z-score mode is used
     * @throws ShapeMismatchException if the matrix does not have one column per label
     */
    public ErrorNormalizationModel fit(double[][] errors) {
        double[][] selected = featureSelection.apply(errors);
        AnomalyMethod method = parameters.getMethod();
        ScoringMode mode = method.usesErrorModel() ? method.getScoringMode() : ScoringMode.Z_SCORE;
        ErrorNormalizationModel errorModel = new ErrorNormalizationModel(peakFinder);
        errorModel.fit(selected, smoother, mode);
        logger.info("Fitted error model on {} samples of features {}", selected.length, featureSelection.getSelectedLabels());
        return errorModel;
    }

    /**
     * Computes anomalies, fitting the error model on the queried errors when the method needs one.
     *
     * @param errors a `numSamples x labels.size()` error matrix
     * @return anomalous time steps, score signal and peaks
     * @see #computeAnomalies(double[][], ErrorNormalizationModel, boolean)
     */
    public AnomalySignal computeAnomalies(double[][] errors) {
        return computeAnomalies(errors, null, false);
    }

    public AnomalySignal computeAnomalies(double[][] errors, ErrorNormalizationModel errorModel) {
        return computeAnomalies(errors, errorModel, false);
    }

    /**
     * Computes the anomalous time steps of an error matrix.
     *
     * Every method produces a score signal; the peak indices are absent for
     * threshold and votes.
     *
     * @param errors a `numSamples x labels.size()` error matrix
     * @param errorModel a model fitted on the same feature selection, or null to fit on the queried errors
     * @param display log the outcome at info level instead of debug
     * @return anomalous time steps, score signal and peaks
     * @throws ShapeMismatchException if the matrix does not have one column per label,
     *     or the model was fitted on a different number of features
     * @throws InvalidConfigurationException if the model was fitted in another scoring mode than the method's
     */
    public AnomalySignal computeAnomalies(double[][] errors, ErrorNormalizationModel errorModel, boolean display) {
        double[][] selected = featureSelection.apply(errors);
        AnomalyMethod method = parameters.getMethod();

        AnomalyDetectionStrategy strategy;
        if (method.usesErrorModel()) {
            strategy = new ErrorModelStrategy(resolveErrorModel(selected, errorModel), parameters.getThreshold(), smoother);
        } else {
            selected = normalizer.normalize(MatrixUtils.abs(selected));
            strategy = normalizedErrorStrategy(method);
        }
        AnomalySignal signal = strategy.detect(selected);

        logger
            .log(
                display ? Level.INFO : Level.DEBUG,
                "Method {} flagged {} of {} time steps",
                method,
                signal.getAnomalyCount(),
                selected.length
            );
        return signal;
    }

    private ErrorNormalizationModel resolveErrorModel(double[][] selected, ErrorNormalizationModel errorModel) {
        ScoringMode mode = parameters.getMethod().getScoringMode();
        if (errorModel != null && errorModel.isFitted()) {
            if (errorModel.getMode() != mode) {
                throw new InvalidConfigurationException(
                    String
                        .format(
                            Locale.ROOT,
                            CommonErrorMessages.MODEL_MODE_MISMATCH_MSG,
                            errorModel.getMode(),
                            parameters.getMethod(),
                            mode
                        )
                );
            }
            return errorModel;
        }
        if (selected.length == 0) {
            // an empty query has no time step to score; a zero baseline keeps the shape checks
            ErrorNormalizationModel emptyModel = new ErrorNormalizationModel(peakFinder);
            emptyModel.fit(new double[][] { new double[featureSelection.size()] }, smoother, mode);
            return emptyModel;
        }
        logger.debug("No fitted error model, fitting {} model on the queried errors", mode);
        ErrorNormalizationModel queryModel = new ErrorNormalizationModel(peakFinder);
        queryModel.fit(selected, smoother, mode);
        return queryModel;
    }

    private AnomalyDetectionStrategy normalizedErrorStrategy(AnomalyMethod method) {
        switch (method) {
            case THRESHOLD:
                return new AverageThresholdStrategy(parameters.getThreshold(), smoother);
            case PEAKS:
                return new PeakStrategy(parameters.getNumAnomalies(), parameters.getPeakWidth(), smoother, peakFinder);
            case VOTES:
                return new VoteStrategy(parameters.getNumAnomalies(), smoother);
            default:
                throw new InvalidConfigurationException(
                    String
                        .format(
                            Locale.ROOT,
                            CommonErrorMessages.UNKNOWN_METHOD_MSG,
                            method,
                            AnomalyMethod.availableMethods()
                        )
                );
        }
    }
}
