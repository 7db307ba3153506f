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
import org.fnsource.configuration.ConfigOption;
import org.fnsource.configuration.ConfigOptions;

/** Configuration options that select the {@link DistributedObjectStore} of a job. */
@PublicEvolving
public class ObjectStoreOptions {

    /** The kinds of object stores that can be configured. */
    public enum StoreType {
        /** Objects travel inside the job configuration. */
        CONFIGURATION,
        /** Objects are files in a directory shared by all processes. */
        FILESYSTEM
    }

    public static final ConfigOption<StoreType> STORE_TYPE =
            ConfigOptions.key("fnsource.object-store.type")
                    .enumType(StoreType.class)
                    .defaultValue(StoreType.CONFIGURATION)
                    .withDescription(
                            "Where objects published at job submission are kept. 'configuration' "
                                    + "embeds them in the job configuration, 'filesystem' writes "
                                    + "them to the shared directory given by 'fnsource.object-store.dir'.");

    public static final ConfigOption<String> STORE_DIRECTORY =
            ConfigOptions.key("fnsource.object-store.dir")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Directory shared by all processes of a job, used by the 'filesystem' object store.");

    /** Not intended to be instantiated. */
    private ObjectStoreOptions() {}
}
