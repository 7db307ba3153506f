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
import org.fnsource.configuration.ConfigOption;
import org.fnsource.configuration.ConfigOptions;

/**
 * Configuration options through which a {@link FunctionDataSource} hands its parameters to the
 * {@link FunctionInputFormat}. All keys live below the {@value #PROPERTY_PREFIX} namespace.
 */
@PublicEvolving
public class FunctionInputOptions {

    /** The namespace of all keys of function-based sources. */
    public static final String PROPERTY_PREFIX = "fnsource.function";

    /** The number of elements of the source. */
    public static final ConfigOption<Integer> LENGTH =
            ConfigOptions.key(PROPERTY_PREFIX + ".n")
                    .intType()
                    .defaultValue(0)
                    .withDescription("The number of elements produced by the function source.");

    /** The identifier of the source whose function is published. */
    public static final ConfigOption<Integer> INSTANCE_ID =
            ConfigOptions.key(PROPERTY_PREFIX + ".id")
                    .intType()
                    .defaultValue(0)
                    .withDescription(
                            "The identifier of the function source, used to derive the key of its function.");

    /**
     * Returns the key under which the function of the source with the given identifier is
     * published.
     */
    public static String functionKey(int instanceId) {
        return PROPERTY_PREFIX + ".f" + instanceId;
    }

    /** Not intended to be instantiated. */
    private FunctionInputOptions() {}
}
