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

package org.fnsource.api.common.functions;

import org.fnsource.annotation.Public;

/**
 * Base interface for generator functions that map an element index to an element value. A data
 * source built from an {@code IndexFunction} with count {@code n} contains exactly the values
 * {@code f(0), f(1), ..., f(n - 1)}.
 *
 * <p>The function is serialized once when the job is submitted and deserialized on every worker
 * that produces a range of the elements, so it must be serializable together with everything it
 * captures. It must also be pure: every worker evaluates it independently and the same index must
 * always produce the same value.
 *
 * <pre>{@code
 * IndexFunction<Long> squares = i -> (long) i * i;
 * }</pre>
 *
 * @param <T> Type of the generated elements.
 */
@Public
@FunctionalInterface
public interface IndexFunction<T> extends Function {

    /**
     * Computes the element at the given index.
     *
     * @param index The index of the element, in {@code [0, n)}.
     * @return The element value.
     * @throws Exception This method may throw exceptions. Throwing an exception will cause the
     *     producing task to fail.
     */
    T apply(int index) throws Exception;
}
