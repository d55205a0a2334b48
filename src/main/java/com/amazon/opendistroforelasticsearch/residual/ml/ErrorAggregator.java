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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.opendistroforelasticsearch.residual.common.exception.ShapeMismatchException;
import com.amazon.opendistroforelasticsearch.residual.constant.CommonErrorMessages;
import com.amazon.opendistroforelasticsearch.residual.util.MatrixUtils;
import com.google.common.base.Preconditions;

/**
 * Pools the error matrices of several data files into one training matrix per model.
 */
public class ErrorAggregator {

    private static final Logger logger = LogManager.getLogger(ErrorAggregator.class);

    /**
     * Stacks, for every model, the error matrices of the given files along the time axis.
     *
     * Files are appended in the given order and rows keep their order within
     * each file. Nothing is deduplicated.
     *
     * @param perFileErrors  errors by data file, then by model name
     * @param files          data files to pool
     * @return               pooled errors by model name, in first-seen model order
     * @throws IllegalArgumentException if a file has no errors
     * @throws ShapeMismatchException if a model's files have different feature counts
     */
    public Map<String, double[][]> concatErrors(Map<String, Map<String, double[][]>> perFileErrors, List<String> files) {
        Map<String, double[][]> pooled = new LinkedHashMap<>();
        for (String file : files) {
            Map<String, double[][]> fileErrors = perFileErrors.get(file);
            Preconditions.checkArgument(fileErrors != null, CommonErrorMessages.NO_ERRORS_FOR_FILE_MSG + file);
            for (Entry<String, double[][]> entry : fileErrors.entrySet()) {
                double[][] previous = pooled.get(entry.getKey());
                pooled.put(entry.getKey(), previous == null ? entry.getValue() : concat(previous, entry.getValue()));
            }
        }
        logger.debug("Pooled errors of {} files for models {}", files.size(), pooled.keySet());
        return pooled;
    }

    private double[][] concat(double[][] top, double[][] bottom) {
        if (top.length > 0 && bottom.length > 0) {
            int expected = MatrixUtils.numColumns(top);
            int actual = MatrixUtils.numColumns(bottom);
            if (expected != actual) {
                throw new ShapeMismatchException(CommonErrorMessages.CONCAT_SHAPE_MISMATCH_MSG, expected, actual);
            }
        }
        double[][] result = new double[top.length + bottom.length][];
        System.arraycopy(top, 0, result, 0, top.length);
        System.arraycopy(bottom, 0, result, top.length, bottom.length);
        return result;
    }
}
