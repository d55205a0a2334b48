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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.amazon.opendistroforelasticsearch.residual.common.exception.InvalidConfigurationException;
import com.amazon.opendistroforelasticsearch.residual.common.exception.LabelNotFoundException;
import com.amazon.opendistroforelasticsearch.residual.common.exception.ShapeMismatchException;

public class FeatureSelectionTests {

    private final List<String> labels = Arrays.asList("cpu", "memory", "disk");

    @Test
    public void of_dropsIgnoredLabelsInOrder() {
        FeatureSelection selection = FeatureSelection.of(labels, Arrays.asList("memory"));

        assertEquals(Arrays.asList("cpu", "disk"), selection.getSelectedLabels());
        assertArrayEquals(new int[] { 0, 2 }, selection.getColumnIndices());
        assertEquals(2, selection.size());
    }

    @Test
    public void of_ignoresUnknownIgnoredLabels() {
        FeatureSelection selection = FeatureSelection.of(labels, Arrays.asList("network"));

        assertEquals(labels, selection.getSelectedLabels());
    }

    @Test
    public void of_matchesLabelsExactly() {
        FeatureSelection selection = FeatureSelection.of(labels, Arrays.asList("CPU"));

        assertEquals(3, selection.size());
    }

    @Test(expected = InvalidConfigurationException.class)
    public void of_rejectsIgnoringEveryLabel() {
        FeatureSelection.of(labels, labels);
    }

    @Test(expected = LabelNotFoundException.class)
    public void of_rejectsDuplicateLabels() {
        FeatureSelection.of(Arrays.asList("cpu", "cpu"), Collections.emptyList());
    }

    @Test
    public void columnIndex_reportsMissingLabel() {
        try {
            FeatureSelection.columnIndex(labels, "network");
            fail("Expected LabelNotFoundException");
        } catch (LabelNotFoundException e) {
            assertEquals("network", e.getLabel());
        }
    }

    @Test
    public void apply_keepsSelectedColumns() {
        FeatureSelection selection = FeatureSelection.of(labels, Arrays.asList("cpu"));

        double[][] selected = selection.apply(new double[][] { { 1, 2, 3 }, { 4, 5, 6 } });

        assertArrayEquals(new double[][] { { 2, 3 }, { 5, 6 } }, selected);
    }

    @Test
    public void apply_acceptsEmptyMatrix() {
        FeatureSelection selection = FeatureSelection.of(labels, Collections.emptyList());

        assertEquals(0, selection.apply(new double[0][]).length);
    }

    @Test(expected = ShapeMismatchException.class)
    public void apply_rejectsColumnCountOtherThanLabels() {
        FeatureSelection.of(labels, Collections.emptyList()).apply(new double[][] { { 1, 2 } });
    }
}
