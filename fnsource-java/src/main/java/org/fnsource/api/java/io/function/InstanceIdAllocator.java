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

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands out identifiers for function-based data sources. Several function sources may be used in
 * the same job; each publishes its generator function under a key derived from its identifier, so
 * identifiers must not repeat while a job that uses them is running.
 *
 * <p>An allocator is meant to be created once per planning context and passed to every {@link
 * FunctionInput#fromFunction(int, org.fnsource.api.common.functions.IndexFunction,
 * InstanceIdAllocator, org.fnsource.api.common.cache.ObjectStoreFactory)} call of that context.
 * Callers that do not manage a context use the process wide {@link #shared()} allocator.
 *
 * <p>This class is thread-safe.
 */
@PublicEvolving
public final class InstanceIdAllocator {

    private static final InstanceIdAllocator SHARED = new InstanceIdAllocator();

    private final AtomicInteger nextId;

    public InstanceIdAllocator() {
        this(0);
    }

    /**
     * Creates an allocator whose first identifier is the given value.
     *
     * @param firstId The first identifier handed out.
     */
    public InstanceIdAllocator(int firstId) {
        this.nextId = new AtomicInteger(firstId);
    }

    /** Returns the allocator shared by all callers in this process. */
    public static InstanceIdAllocator shared() {
        return SHARED;
    }

    /**
     * Returns a new identifier. Identifiers increase monotonically.
     *
     * @throws IllegalStateException Thrown, if the identifier space is exhausted.
     */
    public int next() {
        final int id = nextId.getAndUpdate(i -> i == Integer.MAX_VALUE ? i : i + 1);
        if (id == Integer.MAX_VALUE) {
            throw new IllegalStateException(
                    "The instance identifiers of this allocator are exhausted.");
        }
        return id;
    }
}
