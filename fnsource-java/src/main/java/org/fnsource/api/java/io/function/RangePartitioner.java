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

import org.fnsource.annotation.Internal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.fnsource.util.Preconditions.checkArgument;

/**
 * Divides the index space {@code [0, n)} of a function-based source into contiguous ranges.
 *
 * <p>All ranges have the same size {@code max(1, n / parallelismHint)}, except the last one,
 * which additionally takes the remainder of the division. For {@code n = 10} and a hint of
 * {@code 3} the ranges are {@code [0, 3)}, {@code [3, 6)} and {@code [6, 10)}. The hint is not a
 * bound: when {@code n} is not a multiple of the hint the number of ranges may exceed it.
 *
 * <p>Partitioning is a pure function of its arguments. Ranges are returned in ascending order.
 */
@Internal
public final class RangePartitioner {

    /**
     * Computes the ranges for the given number of elements.
     *
     * <p>All ranges but the last one have {@link #splitSize(int, int)} elements. The number of
     * ranges is {@code n / splitSize}, rounded down, so the last range takes the remainder and can
     * be up to {@code 2 * splitSize - 1} elements long.
     *
     * @param n The number of elements, at least zero.
     * @param parallelismHint The desired number of ranges, at least one.
     * @return The ranges in ascending order. Empty if {@code n} is zero.
     */
    public static List<IndexRange> partition(int n, int parallelismHint) {
        checkArgument(n >= 0, "The number of elements must not be negative, was %s.", n);
        checkArgument(
                parallelismHint >= 1,
                "The parallelism hint must be at least 1, was %s.",
                parallelismHint);

        if (n == 0) {
            return Collections.emptyList();
        }

        final int splitSize = splitSize(n, parallelismHint);
        final int numRanges = n / splitSize;

        final List<IndexRange> ranges = new ArrayList<>(numRanges);
        for (int i = 0; i < numRanges - 1; i++) {
            ranges.add(new IndexRange(i * splitSize, splitSize));
        }

        // the last range absorbs the remainder
        final int lastStart = (numRanges - 1) * splitSize;
        ranges.add(new IndexRange(lastStart, n - lastStart));
        return ranges;
    }

    /**
     * Computes the regular range size for the given number of elements. A size of zero, which
     * occurs when the hint exceeds the number of elements, is raised to one.
     */
    public static int splitSize(int n, int parallelismHint) {
        return Math.max(1, n / parallelismHint);
    }

    // --------------------------------------------------------------------------------------------

    /** Private constructor to prevent instantiation. */
    private RangePartitioner() {}
}
