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

import org.fnsource.annotation.Public;
import org.fnsource.api.common.io.statistics.BaseStatistics;
import org.fnsource.configuration.Configuration;
import org.fnsource.core.io.InputSplit;
import org.fnsource.core.io.InputSplitSource;

import javax.annotation.Nullable;

import java.io.IOException;

/**
 * Describes an input that is divided into splits which are produced in parallel by independent
 * workers. It is the integration point between a data source and the batch execution host.
 *
 * <p>The partitioned source handles the following:
 *
 * <ul>
 *   <li>It describes how the input is split into splits that can be processed in parallel.
 *   <li>It describes how to read records from one input split.
 *   <li>It describes how to gather basic statistics from the input.
 * </ul>
 *
 * <p>The life cycle of a partitioned source is the following:
 *
 * <ol>
 *   <li>After being instantiated, it is configured with the job {@link Configuration}.
 *   <li>Optionally: It is called by the planner to produce basic statistics about the input.
 *   <li>It is called to create the input splits.
 *   <li>Each parallel worker receives the binary form of its split, reads it back and asks the
 *       source for a {@link SplitReader} that produces the records of the split.
 * </ol>
 *
 * @param <OT> The type of the produced records.
 * @param <T> The type of input split.
 */
@Public
public interface PartitionedSource<OT, T extends InputSplit> extends InputSplitSource<T> {

    /**
     * Configures this source. This method is always called first on a newly instantiated source.
     *
     * @param parameters The configuration with all parameters.
     * @throws IOException Thrown, if objects referenced by the configuration could not be
     *     retrieved.
     */
    void configure(Configuration parameters) throws IOException;

    /**
     * Gets the basic statistics from the input described by this source. If the source does not
     * know how to create those statistics, it may return null.
     *
     * <p>When this method is called, the source is guaranteed to be configured.
     *
     * @param cachedStatistics The statistics that were cached. May be null.
     * @return The base statistics for the input, or null, if not available.
     */
    @Nullable
    BaseStatistics getStatistics(@Nullable BaseStatistics cachedStatistics) throws IOException;

    /**
     * Creates the different splits of the input that can be processed in parallel.
     *
     * <p>When this method is called, the source is guaranteed to be configured.
     *
     * @param minNumSplits The desired number of splits, as a hint. Sources may create fewer or
     *     more splits.
     * @return The splits of this input that can be processed in parallel.
     * @throws IOException Thrown, when the creation of the splits was erroneous.
     */
    @Override
    T[] createInputSplits(int minNumSplits) throws IOException;

    /**
     * Gets the type of the input splits that are processed by this source. Workers instantiate
     * this type through its nullary constructor and read their split into it.
     *
     * @return The type of the input splits.
     */
    Class<? extends T> getInputSplitType();

    /**
     * Creates a reader for the given split and opens it.
     *
     * @param split The split to be read.
     * @return An opened reader positioned before the first record of the split.
     * @throws IOException Thrown, if the split could not be opened.
     */
    SplitReader<OT, T> createReader(T split) throws IOException;
}
