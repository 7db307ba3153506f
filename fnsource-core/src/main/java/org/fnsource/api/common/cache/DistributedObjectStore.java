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

package org.fnsource.api.common.cache;

import org.fnsource.annotation.PublicEvolving;

import java.io.IOException;
import java.io.Serializable;

/**
 * A key/value blob store through which a job publishes an object once, at submission time, and
 * every planner and worker of the job retrieves it afterwards.
 *
 * <p>Implementations must guarantee that a {@link #put(String, Serializable)} that completes
 * before the job starts is visible to every {@link #get(String, ClassLoader)} during execution.
 * Stores are written by a single submitter and read concurrently by many workers.
 */
@PublicEvolving
public interface DistributedObjectStore {

    /**
     * Publishes the given object under the given key, replacing any previous value.
     *
     * @param key The job scoped name of the object.
     * @param value The object to publish.
     * @throws IOException Thrown, if the object could not be serialized or stored.
     */
    void put(String key, Serializable value) throws IOException;

    /**
     * Retrieves the object stored under the given key. Every call returns a fresh copy that is
     * independent of the copies returned to other callers.
     *
     * @param key The job scoped name of the object.
     * @param classLoader The class loader used to resolve the classes of the object.
     * @return The retrieved object.
     * @throws KeyNotFoundException Thrown, if no object is stored under the key.
     * @throws IOException Thrown, if the stored object could not be read or deserialized.
     */
    <T> T get(String key, ClassLoader classLoader) throws IOException;

    /** Checks whether an object is stored under the given key. */
    boolean contains(String key) throws IOException;
}
