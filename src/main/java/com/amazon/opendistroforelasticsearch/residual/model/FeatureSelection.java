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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import org.apache.commons.lang.builder.ToStringBuilder;

import com.amazon.opendistroforelasticsearch.residual.common.exception.InvalidConfigurationException;
import com.amazon.opendistroforelasticsearch.residual.common.exception.LabelNotFoundException;
import com.amazon.opendistroforelasticsearch.residual.common.exception.ShapeMismatchException;
import com.amazon.opendistroforelasticsearch.residual.constant.CommonErrorMessages;
import com.amazon.opendistroforelasticsearch.residual.util.MatrixUtils;
import com.google.common.collect.ImmutableList;

/**
 * The ordered feature columns an anomaly policy scores: every label of the
 * full label list except the ignored ones.
 */
public class FeatureSelection {

    private final List<String> labels;
    private final List<String> selectedLabels;
    private final int[] columnIndices;

    private FeatureSelection(List<String> labels, List<String> selectedLabels, int[] columnIndices) {
        this.labels = labels;
        this.selectedLabels = selectedLabels;
        this.columnIndices = columnIndices;
    }

    /**
     * Resolves the columns of {@code labels} that are not ignored.
     *
     * Ignored labels that are not part of {@code labels} have no effect.
     *
     * @param labels full feature label list, one label per error matrix column
     * @param ignore labels to exclude from scoring
     * @return the feature selection
     * @throws InvalidConfigurationException if every label is ignored
     */
    public static FeatureSelection of(List<String> labels, Collection<String> ignore) {
        List<String> selected = new ArrayList<>();
        List<Integer> indices = new ArrayList<>();
        for (String label : labels) {
            if (!ignore.contains(label)) {
                selected.add(label);
                indices.add(columnIndex(labels, label));
            }
        }
        if (selected.isEmpty()) {
            throw new InvalidConfigurationException(CommonErrorMessages.NO_FEATURE_SELECTED_MSG);
        }
        return new FeatureSelection(
            ImmutableList.copyOf(labels),
            ImmutableList.copyOf(selected),
            indices.stream().mapToInt(Integer::intValue).toArray()
        );
    }

    /**
     * Returns the column of a label in a header. The match is exact and case-sensitive.
     *
     * @param header column labels
     * @param label label to look up
     * @return index of the label in the header
     * @throws LabelNotFoundException if the header does not contain the label exactly once
     */
    public static int columnIndex(List<String> header, String label) {
        int index = header.indexOf(label);
        if (index < 0) {
            throw new LabelNotFoundException(label, CommonErrorMessages.LABEL_NOT_FOUND_MSG + label + " in " + header);
        }
        if (header.lastIndexOf(label) != index) {
            throw new LabelNotFoundException(label, CommonErrorMessages.DUPLICATE_LABEL_MSG + label);
        }
        return index;
    }

    /**
     * Keeps the selected columns of an error matrix laid out like the full label list.
     *
     * @param errors a `numSamples x labels.size()` matrix
     * @return a `numSamples x numSelected` matrix
     * @throws ShapeMismatchException if the matrix has a column count other than the label count
     */
    public double[][] apply(double[][] errors) {
        int numColumns = MatrixUtils.numColumns(errors);
        if (errors.length > 0 && numColumns != labels.size()) {
            throw new ShapeMismatchException(CommonErrorMessages.LABEL_SHAPE_MISMATCH_MSG, labels.size(), numColumns);
        }
        return MatrixUtils.selectColumns(errors, columnIndices);
    }

    public List<String> getLabels() {
        return labels;
    }

    public List<String> getSelectedLabels() {
        return selectedLabels;
    }

    public int[] getColumnIndices() {
        return Arrays.copyOf(columnIndices, columnIndices.length);
    }

    public int size() {
        return columnIndices.length;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this).append("selectedLabels", selectedLabels).toString();
    }
}
