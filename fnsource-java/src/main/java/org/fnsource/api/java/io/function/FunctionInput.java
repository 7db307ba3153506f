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

/**
 * Entry point for creating data sources whose elements are computed from their index.
 *
 * <pre>{@code
 * FunctionDataSource<Long> squares = FunctionInput.fromFunction(1000, i -> (long) i * i);
 * }</pre>
 *
 * <p>The elements are never materialized in one place. Each parallel worker evaluates the
 * function only for the indices of the split it reads.
 */
@PublicEvolving
public final class FunctionInput {

    /**
     * Creates a source of {@code n} elements computed by the given function. The source takes its
     * identifier from {@link InstanceIdAllocator#shared()} and picks the object store according to
     * the job configuration.
     *
     * @param n The number of elements.
     * @param function The function mapping each index in {@code [0, n)} to its element.
     * @param <T> The type of the elements.
     * @return The data source.
     */
    public static <T> FunctionDataSource<T> fromFunction(int n, IndexFunction<T> function) {
        return fromFunction(
                n, function, InstanceIdAllocator.shared(), ObjectStoreFactory.fromConfiguration());
    }

    /**
     * Creates a source of {@code n} elements computed by the given function.
     *
     * @param n The number of elements.
     * @param function The function mapping each index in {@code [0, n)} to its element.
     * @param idAllocator The allocator the identifier of the source is taken from.
     * @param storeFactory The factory of the object store the function is published to.
     * @param <T> The type of the elements.
     * @return The data source.
     */
    public static <T> FunctionDataSource<T> fromFunction(
            int n,
            IndexFunction<T> function,
            InstanceIdAllocator idAllocator,
            ObjectStoreFactory storeFactory) {
        return new FunctionDataSource<>(n, function, idAllocator, storeFactory);
    }

    private FunctionInput() {}
}
