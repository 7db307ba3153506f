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

package org.fnsource.api.java;

import org.fnsource.api.common.cache.DistributedObjectStore;
import org.fnsource.api.common.cache.KeyNotFoundException;
import org.fnsource.api.common.cache.ObjectStoreFactory;
import org.fnsource.api.common.cache.ObjectStoreOptions;
import org.fnsource.api.common.functions.FunctionEvaluationException;
import org.fnsource.api.java.io.function.FunctionDataSource;
import org.fnsource.api.java.io.function.FunctionInput;
import org.fnsource.api.java.io.function.InstanceIdAllocator;
import org.fnsource.configuration.Configuration;
import org.fnsource.configuration.CoreOptions;
import org.fnsource.configuration.IllegalConfigurationException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.Serializable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for the {@link LocalSourceRunner}. */
class LocalSourceRunnerTest {

    @Test
    void testSquares() throws Exception {
        final List<Long> values =
                runner(3).collect(FunctionInput.fromFunction(10, i -> (long) i * i));

        assertThat(values).containsExactly(0L, 1L, 4L, 9L, 16L, 25L, 36L, 49L, 64L, 81L);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4, 7, 16, 150})
    void testAllElementsInIndexOrder(int parallelism) throws Exception {
        final int n = 100;

        final List<String> values =
                runner(parallelism).collect(FunctionInput.fromFunction(n, i -> "element-" + i));

        assertThat(values)
                .isEqualTo(
                        IntStream.range(0, n)
                                .mapToObj(i -> "element-" + i)
                                .collect(Collectors.toList()));
    }

    @Test
    void testFileSystemStore(@TempDir Path tempDir) throws Exception {
        final Configuration config = new Configuration();
        config.set(CoreOptions.DEFAULT_PARALLELISM, 4);
        config.set(ObjectStoreOptions.STORE_TYPE, ObjectStoreOptions.StoreType.FILESYSTEM);
        config.set(ObjectStoreOptions.STORE_DIRECTORY, tempDir.toString());

        final List<Integer> values =
                new LocalSourceRunner(config).collect(FunctionInput.fromFunction(50, i -> 2 * i));

        assertThat(values).hasSize(50).startsWith(0, 2, 4).endsWith(96, 98);
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).hasSize(1);
        }
    }

    @Test
    void testNoElements() throws Exception {
        assertThat(runner(4).collect(FunctionInput.fromFunction(0, i -> i))).isEmpty();
    }

    @Test
    void testRunnerConfigurationIsNotModified() throws Exception {
        final Configuration config = new Configuration();
        config.set(CoreOptions.DEFAULT_PARALLELISM, 2);

        new LocalSourceRunner(config).collect(FunctionInput.fromFunction(4, i -> i));

        assertThat(config.keySet()).containsExactly(CoreOptions.DEFAULT_PARALLELISM.key());
    }

    @Test
    void testSeveralSourcesWithOneRunner() throws Exception {
        final LocalSourceRunner runner = runner(2);
        final InstanceIdAllocator allocator = new InstanceIdAllocator();
        final ObjectStoreFactory factory = ObjectStoreFactory.fromConfiguration();

        final FunctionDataSource<Integer> ones =
                FunctionInput.fromFunction(3, i -> 1, allocator, factory);
        final FunctionDataSource<Integer> twos =
                FunctionInput.fromFunction(2, i -> 2, allocator, factory);

        assertThat(runner.collect(ones)).containsExactly(1, 1, 1);
        assertThat(runner.collect(twos)).containsExactly(2, 2);
    }

    @Test
    void testFunctionFailure() {
        final FunctionDataSource<Integer> source =
                FunctionInput.fromFunction(
                        20,
                        i -> {
                            if (i == 13) {
                                throw new IllegalStateException("unlucky");
                            }
                            return i;
                        });

        assertThatThrownBy(() -> runner(4).collect(source))
                .isInstanceOf(SourceExecutionException.class)
                .hasMessageContaining(source.getName())
                .cause()
                .isInstanceOfSatisfying(
                        FunctionEvaluationException.class,
                        e -> assertThat(e.getIndex()).isEqualTo(13))
                .hasRootCauseMessage("unlucky");
    }

    @Test
    void testMissingFunction() {
        final FunctionDataSource<Integer> source =
                FunctionInput.fromFunction(
                        5,
                        i -> i,
                        new InstanceIdAllocator(),
                        config -> new DiscardingObjectStore());

        assertThatThrownBy(() -> runner(1).collect(source))
                .isInstanceOf(SourceExecutionException.class)
                .hasCauseInstanceOf(KeyNotFoundException.class);
    }

    @Test
    void testInvalidParallelism() {
        assertThatThrownBy(() -> runner(0).collect(FunctionInput.fromFunction(5, i -> i)))
                .isInstanceOf(IllegalConfigurationException.class);
    }

    // --------------------------------------------------------------------------------------------

    private static LocalSourceRunner runner(int parallelism) {
        final Configuration config = new Configuration();
        config.set(CoreOptions.DEFAULT_PARALLELISM, parallelism);
        return new LocalSourceRunner(config);
    }

    /** A store that loses everything published to it. */
    private static final class DiscardingObjectStore implements DistributedObjectStore {

        @Override
        public void put(String key, Serializable value) {}

        @Override
        public <T> T get(String key, ClassLoader classLoader) throws IOException {
            throw new KeyNotFoundException(key);
        }

        @Override
        public boolean contains(String key) {
            return false;
        }
    }
}
