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
import org.fnsource.api.common.cache.ObjectStoreFactory;
import org.fnsource.api.common.functions.IndexFunction;
import org.fnsource.api.common.io.DataSource;
import org.fnsource.configuration.Configuration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

import static org.fnsource.util.Preconditions.checkArgument;
import static org.fnsource.util.Preconditions.checkNotNull;

/**
 * A data source of {@code n} elements, where the element at index {@code i} is {@code f(i)}.
 * Instances are created through {@link FunctionInput#fromFunction(int, IndexFunction)}.
 *
 * @param <T> The type of the produced elements.
 */
@PublicEvolving
public class FunctionDataSource<T> implements DataSource<T> {

    private static final Logger LOG = LoggerFactory.getLogger(FunctionDataSource.class);

    private final int numElements;

    private final IndexFunction<T> function;

    private final int instanceId;

    private final ObjectStoreFactory storeFactory;

    FunctionDataSource(
            int numElements,
            IndexFunction<T> function,
            InstanceIdAllocator idAllocator,
            ObjectStoreFactory storeFactory) {
        checkArgument(
                numElements >= 0,
                "The number of elements must not be negative, was %s.",
                numElements);
        this.function = checkNotNull(function, "function");
        this.storeFactory = checkNotNull(storeFactory, "storeFactory");
        this.numElements = numElements;
        this.instanceId = checkNotNull(idAllocator, "idAllocator").next();
    }

    @Override
    public String getName() {
        return "FunctionInput(n=" + numElements + ", id=" + instanceId + ')';
    }

    /** A function source has no input that could be missing. */
    @Override
    public void inputCheck() {}

    /**
     * Writes the length and the identifier of this source into the configuration and publishes
     * the function to the object store of the job, under a key derived from the identifier.
     */
    @Override
    public void inputConfigure(Configuration configuration) throws IOException {
        configuration.set(FunctionInputOptions.LENGTH, numElements);
        configuration.set(FunctionInputOptions.INSTANCE_ID, instanceId);

        final String key = FunctionInputOptions.functionKey(instanceId);
        storeFactory.createStore(configuration).put(key, function);

        LOG.debug("Published the function of {} under key '{}'.", getName(), key);
    }

    /** Returns exactly the number of elements of this source. */
    @Override
    public long inputSize() {
        return numElements;
    }

    @Override
    public FunctionInputFormat<T> getInputFormat() {
        return new FunctionInputFormat<>(storeFactory);
    }

    public int getInstanceId() {
        return instanceId;
    }

    public int getNumElements() {
        return numElements;
    }

    @Override
    public String toString() {
        return getName();
    }
}
