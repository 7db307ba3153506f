/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fnsource.api.java.io.function;

import org.fnsource.annotation.PublicEvolving;

import java.io.Serializable;

import static org.fnsource.util.Preconditions.checkArgument;

/**
 * A contiguous, half-open range {@code [start, start + length)} of element indices that is
 * produced by one worker.
 */
@PublicEvolving
public final class IndexRange implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int start;

    private final int length;

    public IndexRange(int start, int length) {
        checkArgument(start >= 0, "The start of a range must not be negative, was %s.", start);
        checkArgument(length >= 0, "The length of a range must not be negative, was %s.", length);
        checkArgument(
                (long) start + length <= Integer.MAX_VALUE,
                "The range [%s, %s + %s) exceeds the integer index space.",
                start,
                start,
                length);
        this.start = start;
        this.length = length;
    }

    /** Returns the first index of the range. */
    public int getStart() {
        return start;
    }

    /** Returns the number of indices in the range. */
    public int getLength() {
        return length;
    }

    /** Returns the index after the last index of the range. */
    public int getEnd() {
        return start + length;
    }

    // --------------------------------------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        IndexRange that = (IndexRange) o;
        return start == that.start && length == that.length;
    }

    @Override
    public int hashCode() {
        return 31 * start + length;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + getEnd() + ')';
    }
}
