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
import com.google.common.base.Preconditions;

/**
 * A labeled time range known to contain an anomalous event. Both bounds are inclusive.
 */
public class GroundTruthInterval {

    private final int start;
    private final int end;

    public GroundTruthInterval(int start, int end) {
        Preconditions.checkArgument(start <= end, "Interval start %s is after its end %s", start, end);
        this.start = start;
        this.end = end;
    }

    public static GroundTruthInterval of(int start, int end) {
        return new GroundTruthInterval(start, end);
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public boolean contains(int timeStep) {
        return start <= timeStep && timeStep <= end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        GroundTruthInterval that = (GroundTruthInterval) o;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(start, end);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this).append("start", start).append("end", end).toString();
    }
}
