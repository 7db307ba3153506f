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

package org.fnsource.api.common.io;

import org.fnsource.annotation.Internal;
import org.fnsource.core.io.InputSplit;
import org.fnsource.core.io.InputSplitAssigner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.List;

/**
 * This is the default implementation of the {@link InputSplitAssigner} interface. The default
 * input split assigner simply returns all input splits of an input vertex in the order they were
 * originally computed.
 */
@Internal
public class DefaultInputSplitAssigner implements InputSplitAssigner {

    /** The logging object which is used to report information and errors. */
    private static final Logger LOG = LoggerFactory.getLogger(DefaultInputSplitAssigner.class);

    /** The list of all splits */
    private final Deque<InputSplit> splits = new ArrayDeque<>();

    public DefaultInputSplitAssigner(InputSplit[] splits) {
        this(Arrays.asList(splits));
    }

    public DefaultInputSplitAssigner(Collection<? extends InputSplit> splits) {
        this.splits.addAll(splits);
    }

    @Override
    public InputSplit getNextInputSplit(String host, int taskId) {
        InputSplit next = null;

        // keep the synchronized part short
        synchronized (this.splits) {
            if (this.splits.size() > 0) {
                next = this.splits.removeFirst();
            }
        }

        if (LOG.isDebugEnabled()) {
            if (next == null) {
                LOG.debug("No more input splits available");
            } else {
                LOG.debug("Assigning split {} to task {} on host {}", next, taskId, host);
            }
        }
        return next;
    }

    @Override
    public void returnInputSplit(List<InputSplit> splits, int taskId) {
        synchronized (this.splits) {
            for (InputSplit split : splits) {
                LOG.warn("Task {} returned split {}, it will be assigned again.", taskId, split);
                this.splits.addLast(split);
            }
        }
    }

    /** Returns the number of splits that have not been assigned yet. */
    public int getNumberOfRemainingSplits() {
        synchronized (this.splits) {
            return this.splits.size();
        }
    }
}
