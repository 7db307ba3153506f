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

import org.fnsource.annotation.Internal;
import org.fnsource.configuration.Configuration;
import org.fnsource.util.InstantiationUtil;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Serializable;

import static org.fnsource.util.Preconditions.checkNotNull;

/**
 * A {@link DistributedObjectStore} that embeds the serialized objects in the job {@link
 * Configuration}. The configuration is shipped to every planner and worker of the job, so the
 * objects travel with it.
 */
@Internal
public class ConfigurationObjectStore implements DistributedObjectStore {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationObjectStore.class);

    private final Configuration configuration;

    public ConfigurationObjectStore(Configuration configuration) {
        this.configuration = checkNotNull(configuration);
    }

    @Override
    public void put(String key, Serializable value) throws IOException {
        checkNotNull(key, "key");
        checkNotNull(value, "value");

        InstantiationUtil.writeObjectToConfig(value, configuration, key);
        LOG.debug("Published object of type {} under key '{}'.", value.getClass().getName(), key);
    }

    @Override
    public <T> T get(String key, ClassLoader classLoader) throws IOException {
        checkNotNull(key, "key");

        final T value;
        try {
            value = InstantiationUtil.readObjectFromConfig(configuration, key, classLoader);
        } catch (ClassNotFoundException e) {
            throw new IOException(
                    "Could not resolve the class of the object stored under key '" + key + "'.", e);
        }

        if (value == null) {
            throw new KeyNotFoundException(key);
        }
        return value;
    }

    @Override
    public boolean contains(String key) {
        return configuration.containsKey(key);
    }
}
