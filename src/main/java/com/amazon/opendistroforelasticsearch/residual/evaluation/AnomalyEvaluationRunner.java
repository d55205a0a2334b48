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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.opendistroforelasticsearch.residual.constant.CommonErrorMessages;
import com.amazon.opendistroforelasticsearch.residual.forecast.Forecast;
import com.amazon.opendistroforelasticsearch.residual.forecast.ForecastProvider;
import com.amazon.opendistroforelasticsearch.residual.forecast.ResidualCalculator;
import com.amazon.opendistroforelasticsearch.residual.ml.ErrorAggregator;
import com.amazon.opendistroforelasticsearch.residual.ml.ErrorNormalizationModel;
import com.amazon.opendistroforelasticsearch.residual.model.AnomalySignal;
import com.amazon.opendistroforelasticsearch.residual.model.DetectionScore;
import com.amazon.opendistroforelasticsearch.residual.model.FeatureSelection;
import com.amazon.opendistroforelasticsearch.residual.model.GroundTruthInterval;
import com.amazon.opendistroforelasticsearch.residual.policy.AnomalyParameters;
import com.amazon.opendistroforelasticsearch.residual.policy.AnomalyPolicy;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Runs forecasting models over data files and scores their prediction errors.
 *
 * The runner owns the feature labels of the data and binds them to the anomaly
 * parameters. Forecasts and errors are cached per data file and model until
 * {@link #reset()}. Error models learned with {@link #learnAnomalies} are kept
 * per model name; models without one are scored with fit-on-query.
 *
 * Not thread-safe.
 */
public class AnomalyEvaluationRunner {

    private static final Logger logger = LogManager.getLogger(AnomalyEvaluationRunner.class);

    private final List<String> labels;
    private final Map<String, ForecastProvider> providers;
    private final AnomalyPolicy policy;
    private final ResidualCalculator residualCalculator;
    private final ErrorAggregator errorAggregator;
    private final DetectionEvaluator evaluator;

    // data file -> model name -> value
    private final Map<String, Map<String, Forecast>> forecasts;
    private final Map<String, Map<String, double[][]>> errors;
    private final Map<String, ErrorNormalizationModel> errorModels;

    public AnomalyEvaluationRunner(
        List<String> labels,
        List<ForecastProvider> providers,
        AnomalyParameters parameters,
        ResidualCalculator residualCalculator,
        ErrorAggregator errorAggregator,
        DetectionEvaluator evaluator
    ) {
        this.labels = ImmutableList.copyOf(labels);
        this.providers = new LinkedHashMap<>();
        for (ForecastProvider provider : providers) {
            this.providers.put(provider.getModelName(), provider);
        }
        this.policy = new AnomalyPolicy(parameters.withLabels(labels));
        this.residualCalculator = residualCalculator;
        this.errorAggregator = errorAggregator;
        this.evaluator = evaluator;
        this.forecasts = new LinkedHashMap<>();
        this.errors = new LinkedHashMap<>();
        this.errorModels = new LinkedHashMap<>();
    }

    public AnomalyPolicy getPolicy() {
        return policy;
    }

    public List<String> getLabels() {
        return labels;
    }

    /**
     * Forecasts the given files with every model and caches the prediction errors.
     *
     * @param dataFiles data files to forecast
     * @param override recompute files that are already cached
     */
    public void predictAll(List<String> dataFiles, boolean override) {
        for (String dataFile : dataFiles) {
            if (!override && errors.containsKey(dataFile)) {
                continue;
            }
            Map<String, Forecast> fileForecasts = new LinkedHashMap<>();
            Map<String, double[][]> fileErrors = new LinkedHashMap<>();
            for (ForecastProvider provider : providers.values()) {
                Forecast forecast = provider.forecast(dataFile);
                fileForecasts.put(provider.getModelName(), forecast);
                fileErrors.put(provider.getModelName(), residualCalculator.residuals(forecast, provider.getShift()));
            }
            forecasts.put(dataFile, fileForecasts);
            errors.put(dataFile, fileErrors);
        }
        logger.info("Computed prediction errors of {} models on {} data files", providers.size(), dataFiles.size());
    }

    /**
     * Returns the cached errors of a data file.
     *
     * @param dataFile data file
     * @return errors by model name
     * @throws IllegalArgumentException if the file was not predicted
     */
    public Map<String, double[][]> getErrors(String dataFile) {
        Map<String, double[][]> fileErrors = errors.get(dataFile);
        Preconditions.checkArgument(fileErrors != null, CommonErrorMessages.NO_ERRORS_FOR_FILE_MSG + dataFile);
        return Collections.unmodifiableMap(fileErrors);
    }

    public Optional<ErrorNormalizationModel> getErrorModel(String modelName) {
        return Optional.ofNullable(errorModels.get(modelName));
    }

    /**
     * Drops every cached forecast and error. Learned error models are kept.
     */
    public void reset() {
        forecasts.clear();
        errors.clear();
    }

    /**
     * Fits the error model of one forecasting model on the pooled errors of training files.
     *
     * @param modelName forecasting model name
     * @param trainFiles training data files, predicted on demand
     * @return the fitted error model, which replaces any previous one
     */
    public ErrorNormalizationModel learnAnomalies(String modelName, List<String> trainFiles) {
        checkProvider(modelName);
        Preconditions.checkArgument(!trainFiles.isEmpty(), "trainFiles must not be empty.");
        predictAll(trainFiles, false);
        double[][] pooled = errorAggregator.concatErrors(errors, trainFiles).get(modelName);
        ErrorNormalizationModel errorModel = policy.fit(pooled);
        errorModels.put(modelName, errorModel);
        logger.info("Learned error model of {} on {} training files", modelName, trainFiles.size());
        return errorModel;
    }

    /**
     * Computes the anomalies of every model on a data file.
     *
     * @param dataFile data file, predicted on demand
     * @return anomalies by model name, on the error time axis
     */
    public Map<String, AnomalySignal> computeAnomalies(String dataFile) {
        predictAll(ImmutableList.of(dataFile), false);
        Map<String, AnomalySignal> anomalies = new LinkedHashMap<>();
        for (Entry<String, double[][]> entry : errors.get(dataFile).entrySet()) {
            anomalies.put(entry.getKey(), policy.computeAnomalies(entry.getValue(), errorModels.get(entry.getKey()), true));
        }
        return anomalies;
    }

    /**
     * Scores the anomalies of every model on a data file against its ground truth.
     *
     * Anomalies are moved back to the data file's time axis by each model's
     * shift before matching.
     *
     * @param dataFile data file, predicted on demand
     * @param groundTruth anomaly intervals of the data file
     * @return detection scores by model name
     */
    public Map<String, DetectionScore> evaluate(String dataFile, List<GroundTruthInterval> groundTruth) {
        Map<String, DetectionScore> scores = new LinkedHashMap<>();
        for (Entry<String, AnomalySignal> entry : computeAnomalies(dataFile).entrySet()) {
            int shift = providers.get(entry.getKey()).getShift();
            DetectionScore score = evaluator.score(entry.getValue().getAnomalyIndices(), groundTruth, shift);
            logger
                .info(
                    "{} on {}: true pos {}, false neg {}, false pos {}",
                    entry.getKey(),
                    dataFile,
                    score.getTruePositive(),
                    score.getFalseNegative(),
                    score.getFalsePositive()
                );
            scores.put(entry.getKey(), score);
        }
        return scores;
    }

    /**
     * Returns the mean absolute normalized error of one model on one feature of a data file.
     *
     * @param dataFile data file, predicted on demand
     * @param modelName forecasting model name
     * @param label feature label
     * @return mean absolute error with prediction and target scaled to the target's range
     */
    public double signalMeanError(String dataFile, String modelName, String label) {
        checkProvider(modelName);
        predictAll(ImmutableList.of(dataFile), false);
        Forecast forecast = forecasts.get(dataFile).get(modelName);
        int shift = providers.get(modelName).getShift();
        double[][] target = forecast.getTarget();
        double[][] shiftedTarget = Arrays.copyOfRange(target, Math.min(shift, target.length), target.length);
        return residualCalculator
            .signalMeanError(forecast.getPrediction(), shiftedTarget, FeatureSelection.columnIndex(labels, label));
    }

    private void checkProvider(String modelName) {
        Preconditions.checkArgument(providers.containsKey(modelName), CommonErrorMessages.NO_FORECAST_PROVIDER_MSG + modelName);
    }
}
