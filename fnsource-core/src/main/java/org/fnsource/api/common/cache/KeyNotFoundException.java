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

/**
 * Thrown by a {@link DistributedObjectStore} when no object is stored under a requested key. This
 * indicates that the object was never published or that a wrong key was derived.
 */
@PublicEvolving
public class KeyNotFoundException extends IOException {

    private static final long serialVersionUID = 1L;

    private final String key;

    public KeyNotFoundException(String key) {
        super("No object has been published under the key '" + key + "'.");
        this.key = key;
    }

    /** Returns the key that was not found. */
    public String getKey() {
        return key;
    }
}
