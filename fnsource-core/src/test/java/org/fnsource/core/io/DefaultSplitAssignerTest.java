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

package org.fnsource.core.io;

import org.fnsource.api.common.io.DefaultInputSplitAssigner;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for the {@link DefaultInputSplitAssigner}. */
class DefaultSplitAssignerTest {

    @Test
    void testSerialSplitAssignment() {
        final int numSplits = 50;

        Set<InputSplit> splits = new HashSet<>();
        for (int i = 0; i < numSplits; i++) {
            splits.add(new TestingInputSplit(i));
        }

        DefaultInputSplitAssigner ia = new DefaultInputSplitAssigner(splits);
        InputSplit is;
        while ((is = ia.getNextInputSplit("", 0)) != null) {
            assertThat(splits.remove(is)).isTrue();
        }

        assertThat(splits).isEmpty();
        assertThat(ia.getNextInputSplit("", 0)).isNull();
    }

    @Test
    void testSplitsAreServedInPlanningOrder() {
        final InputSplit[] planned = {
            new TestingInputSplit(0), new TestingInputSplit(1), new TestingInputSplit(2)
        };
        DefaultInputSplitAssigner ia = new DefaultInputSplitAssigner(planned);

        List<Integer> served = new ArrayList<>();
        InputSplit is;
        while ((is = ia.getNextInputSplit("host", 3)) != null) {
            served.add(is.getSplitNumber());
        }

        assertThat(served).containsExactly(0, 1, 2);
    }

    @Test
    void testReturnedSplitsAreAssignedAgain() {
        DefaultInputSplitAssigner ia =
                new DefaultInputSplitAssigner(
                        new InputSplit[] {new TestingInputSplit(0), new TestingInputSplit(1)});

        InputSplit first = ia.getNextInputSplit("", 0);
        assertThat(ia.getNumberOfRemainingSplits()).isOne();

        // the task that received the first split failed
        ia.returnInputSplit(Collections.singletonList(first), 0);
        assertThat(ia.getNumberOfRemainingSplits()).isEqualTo(2);

        assertThat(ia.getNextInputSplit("", 1)).isEqualTo(new TestingInputSplit(1));
        assertThat(ia.getNextInputSplit("", 1)).isEqualTo(first);
        assertThat(ia.getNextInputSplit("", 1)).isNull();
    }

    @Test
    void testConcurrentSplitAssignment() throws InterruptedException {
        final int numThreads = 10;
        final int numSplits = 500;
        final int sumOfIds = (numSplits - 1) * numSplits / 2;

        Set<InputSplit> splits = new HashSet<>();
        for (int i = 0; i < numSplits; i++) {
            splits.add(new TestingInputSplit(i));
        }

        final DefaultInputSplitAssigner ia = new DefaultInputSplitAssigner(splits);

        final AtomicInteger splitsRetrieved = new AtomicInteger(0);
        final AtomicInteger retrievedSumOfIds = new AtomicInteger(0);

        Runnable retriever =
                () -> {
                    InputSplit split;
                    while ((split = ia.getNextInputSplit("", 0)) != null) {
                        splitsRetrieved.incrementAndGet();
                        retrievedSumOfIds.addAndGet(split.getSplitNumber());
                    }
                };

        // create the threads
        Thread[] threads = new Thread[numThreads];
        for (int i = 0; i < numThreads; i++) {
            threads[i] = new Thread(retriever);
            threads[i].setDaemon(true);
        }

        // launch concurrently
        for (int i = 0; i < numThreads; i++) {
            threads[i].start();
        }

        // sync
        for (int i = 0; i < numThreads; i++) {
            threads[i].join(5000);
        }

        // verify
        for (int i = 0; i < numThreads; i++) {
            assertThat(threads[i].isAlive()).isFalse();
        }

        assertThat(splitsRetrieved).hasValue(numSplits);
        assertThat(retrievedSumOfIds).hasValue(sumOfIds);

        // nothing left
        assertThat(ia.getNextInputSplit("", 0)).isNull();
    }
}
