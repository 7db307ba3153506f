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
import org.fnsource.util.InstantiationUtil;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.regex.Pattern;

import static org.fnsource.util.Preconditions.checkArgument;
import static org.fnsource.util.Preconditions.checkNotNull;

/**
 * A {@link DistributedObjectStore} that keeps one file per key in a directory that is shared by
 * all processes of the job, like a file registered with a distributed cache.
 *
 * <p>Objects are first written to a temporary file and then moved into place, so that readers
 * never observe a partially written object.
 */
@Internal
public class FileSystemObjectStore implements DistributedObjectStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileSystemObjectStore.class);

    private static final Pattern VALID_KEY = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path directory;

    public FileSystemObjectStore(Path directory) {
        this.directory = checkNotNull(directory, "directory");
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public void put(String key, Serializable value) throws IOException {
        checkNotNull(value, "value");
        final Path target = pathFor(key);

        Files.createDirectories(directory);
        final Path tmp = Files.createTempFile(directory, "." + key, ".tmp");
        try {
            Files.write(tmp, InstantiationUtil.serializeObject(value));
            Files.move(
                    tmp,
                    target,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
        LOG.debug("Published object of type {} to {}.", value.getClass().getName(), target);
    }

    @Override
    public <T> T get(String key, ClassLoader classLoader) throws IOException {
        final Path source = pathFor(key);

        try (InputStream in = Files.newInputStream(source)) {
            return InstantiationUtil.deserializeObject(in, classLoader);
        } catch (NoSuchFileException e) {
            throw new KeyNotFoundException(key);
        } catch (ClassNotFoundException e) {
            throw new IOException(
                    "Could not resolve the class of the object stored in " + source + '.', e);
        }
    }

    @Override
    public boolean contains(String key) {
        return Files.isRegularFile(pathFor(key));
    }

    private Path pathFor(String key) {
        checkNotNull(key, "key");
        checkArgument(
                VALID_KEY.matcher(key).matches() && !key.startsWith("."),
                "Invalid key '%s'. Keys may only contain letters, digits, '.', '_' and '-' and must not start with '.'.",
                key);
        return directory.resolve(key);
    }

    @Override
    public String toString() {
        return "FileSystemObjectStore{" + directory + '}';
    }
}
