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
import org.fnsource.configuration.Configuration;
import org.fnsource.configuration.IllegalConfigurationException;

import java.io.Serializable;
import java.nio.file.Paths;

/**
 * Creates the {@link DistributedObjectStore} that belongs to a job configuration. Factories are
 * shipped to the planner together with the data source, hence they are serializable.
 */
@PublicEvolving
@FunctionalInterface
public interface ObjectStoreFactory extends Serializable {

    /**
     * Creates the store for the job with the given configuration.
     *
     * @param configuration The job configuration.
     * @return The object store of the job.
     */
    DistributedObjectStore createStore(Configuration configuration);

    /**
     * Returns a factory that picks the store implementation according to {@link
     * ObjectStoreOptions#STORE_TYPE} of the configuration it is given.
     */
    static ObjectStoreFactory fromConfiguration() {
        return ObjectStoreFactory::createConfiguredStore;
    }

    /**
     * Creates the store that is selected by the options of the given configuration.
     *
     * @throws IllegalConfigurationException Thrown, if the file system store is selected without a
     *     directory.
     */
    static DistributedObjectStore createConfiguredStore(Configuration configuration) {
        switch (configuration.get(ObjectStoreOptions.STORE_TYPE)) {
            case FILESYSTEM:
                final String dir =
                        configuration
                                .getOptional(ObjectStoreOptions.STORE_DIRECTORY)
                                .orElseThrow(ObjectStoreFactory::missingDirectory);
                return new FileSystemObjectStore(Paths.get(dir));
            case CONFIGURATION:
            default:
                return new ConfigurationObjectStore(configuration);
        }
    }

    private static IllegalConfigurationException missingDirectory() {
        return new IllegalConfigurationException(
                "The file system object store requires the option '%s'.",
                ObjectStoreOptions.STORE_DIRECTORY.key());
    }
}
