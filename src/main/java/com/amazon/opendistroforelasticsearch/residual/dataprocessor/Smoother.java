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

package com.amazon.opendistroforelasticsearch.residual.dataprocessor;

/*
 * An object for smoothing error signals.
 *
 * Instantaneous prediction errors are noisy: a single large error is rarely
 * an anomaly on its own. A Smoother turns an error signal into a trend signal
 * so that only sustained errors stand out.
 */
public interface Smoother {

    /*
     * Smooths a single signal.
     *
     * @param signal  A `numSamples` sized signal.
     * @return        A `numSamples` sized smoothed signal.
     */
    double[] smooth(double[] signal);

    /*
     * Smooths every column of a matrix independently.
     *
     * @param matrix  A `numSamples x numFeatures` matrix.
     * @return        A `numSamples x numFeatures` matrix of smoothed columns.
     */
    double[][] smoothColumns(double[][] matrix);
}
