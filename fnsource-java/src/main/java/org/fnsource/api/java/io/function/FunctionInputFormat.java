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
import org.fnsource.annotation.VisibleForTesting;
import org.fnsource.api.common.cache.DistributedObjectStore;
import org.fnsource.api.common.cache.ObjectStoreFactory;
import org.fnsource.api.common.functions.IndexFunction;
import org.fnsource.api.common.io.DefaultInputSplitAssigner;
import org.fnsource.api.common.io.PartitionedSource;
import org.fnsource.api.common.io.statistics.BaseStatistics;
import org.fnsource.configuration.Configuration;
import org.fnsource.configuration.CoreOptions;
import org.fnsource.configuration.IllegalConfigurationException;
import org.fnsource.core.io.InputSplitAssigner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.io.IOException;
import java.util.List;

import static org.fnsource.util.Preconditions.checkNotNull;
import static org.fnsource.util.Preconditions.checkState;

/**
 * The input format of sources created through {@link FunctionInput}. It reads the length and the
 * identifier of the source from the job configuration and pulls the function that the source
 * published to the object store of the job.
 *
 * <p>One format serves any function source: all parameters come from the configuration, the
 * identifier selecting which published function is used.
 *
 * @param <T> The type of the produced elements.
 */
@PublicEvolving
public class FunctionInputFormat<T> implements PartitionedSource<T, FunctionInputSplit<T>> {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(FunctionInputFormat.class);

    private final ObjectStoreFactory storeFactory;

    private int numElements;

    private int instanceId;

    private int defaultParallelism = CoreOptions.DEFAULT_PARALLELISM.defaultValue();

    @Nullable private transient IndexFunction<T> function;

    /** Creates a format that picks the object store according to the job configuration. */
    public FunctionInputFormat() {
        this(ObjectStoreFactory.fromConfiguration());
    }

    public FunctionInputFormat(ObjectStoreFactory storeFactory) {
        this.storeFactory = checkNotNull(storeFactory, "storeFactory");
    }

    // --------------------------------------------------------------------------------------------

    /**
     * Reads the parameters of the source and pulls its function.
     *
     * @throws org.fnsource.api.common.cache.KeyNotFoundException Thrown, if no function was
     *     published for the configured identifier.
     * @throws IllegalConfigurationException Thrown, if the configured length is negative.
     */
    @Override
    public void configure(Configuration parameters) throws IOException {
        final int n = parameters.get(FunctionInputOptions.LENGTH);
        if (n < 0) {
            throw new IllegalConfigurationException(
                    "The number of elements of a function source must not be negative, was %s.", n);
        }
        final int id = parameters.get(FunctionInputOptions.INSTANCE_ID);

        LOG.debug("id={}", id);
        LOG.debug("n={}", n);

        final DistributedObjectStore store = storeFactory.createStore(parameters);
        final IndexFunction<T> pulled =
                store.get(FunctionInputOptions.functionKey(id), userClassLoader());

        this.numElements = n;
        this.instanceId = id;
        this.defaultParallelism = parameters.get(CoreOptions.DEFAULT_PARALLELISM);
        this.function = checkNotNull(pulled, "The published function is null.");
    }

    @Override
    public BaseStatistics getStatistics(@Nullable BaseStatistics cachedStatistics) {
        return new FunctionSourceStatistics(numElements);
    }

    /**
     * Creates one split per range of {@link RangePartitioner#partition(int, int)}. All splits
     * share the pulled function.
     *
     * @param minNumSplits The parallelism hint. Values below one select the configured default
     *     parallelism.
     */
    @Override
    public FunctionInputSplit<T>[] createInputSplits(int minNumSplits) {
        checkState(function != null, "The format has not been configured.");

        final int parallelismHint = minNumSplits >= 1 ? minNumSplits : defaultParallelism;
        final int splitSize = RangePartitioner.splitSize(numElements, parallelismHint);

        LOG.debug("id={}", instanceId);
        LOG.debug("n={}", numElements);
        LOG.debug("numSplitsHint={}", parallelismHint);
        LOG.debug("splitSize={}", splitSize);

        final List<IndexRange> ranges = RangePartitioner.partition(numElements, parallelismHint);

        @SuppressWarnings("unchecked")
        final FunctionInputSplit<T>[] splits = new FunctionInputSplit[ranges.size()];
        for (int i = 0; i < splits.length; i++) {
            splits[i] = new FunctionInputSplit<>(i, ranges.get(i), function);
        }
        return splits;
    }

    @Override
    public InputSplitAssigner getInputSplitAssigner(FunctionInputSplit<T>[] inputSplits) {
        return new DefaultInputSplitAssigner(inputSplits);
    }

    @Override
    @SuppressWarnings({"unchecked", "rawtypes"})
    public Class<FunctionInputSplit<T>> getInputSplitType() {
        return (Class<FunctionInputSplit<T>>) (Class) FunctionInputSplit.class;
    }

    @Override
    public FunctionSplitReader<T> createReader(FunctionInputSplit<T> split) {
        final FunctionSplitReader<T> reader = new FunctionSplitReader<>();
        reader.open(split);
        return reader;
    }

    // --------------------------------------------------------------------------------------------

    public int getNumElements() {
        return numElements;
    }

    public int getInstanceId() {
        return instanceId;
    }

    @VisibleForTesting
    @Nullable
    IndexFunction<T> getFunction() {
        return function;
    }

    private static ClassLoader userClassLoader() {
        final ClassLoader cl = Thread.currentThread().getContextClassLoader();
        return cl != null ? cl : FunctionInputFormat.class.getClassLoader();
    }

    @Override
    public String toString() {
        return "FunctionInputFormat (id=" + instanceId + ", n=" + numElements + ')';
    }

    // --------------------------------------------------------------------------------------------

    /** Statistics of a function source: the number of records is known, the byte size is not. */
    private static final class FunctionSourceStatistics implements BaseStatistics {

        private final long numberOfRecords;

        FunctionSourceStatistics(long numberOfRecords) {
            this.numberOfRecords = numberOfRecords;
        }

        @Override
        public long getTotalInputSize() {
            return SIZE_UNKNOWN;
        }

        @Override
        public long getNumberOfRecords() {
            return numberOfRecords;
        }

        @Override
        public float getAverageRecordWidth() {
            return AVG_RECORD_BYTES_UNKNOWN;
        }
    }
}
