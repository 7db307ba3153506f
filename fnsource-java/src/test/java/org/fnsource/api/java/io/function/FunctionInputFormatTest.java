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

import org.fnsource.api.common.cache.ConfigurationObjectStore;
import org.fnsource.api.common.cache.KeyNotFoundException;
import org.fnsource.api.common.cache.ObjectStoreFactory;
import org.fnsource.api.common.functions.IndexFunction;
import org.fnsource.api.common.io.DefaultInputSplitAssigner;
import org.fnsource.api.common.io.statistics.BaseStatistics;
import org.fnsource.configuration.Configuration;
import org.fnsource.configuration.CoreOptions;
import org.fnsource.configuration.IllegalConfigurationException;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for the {@link FunctionInputFormat}. */
class FunctionInputFormatTest {

    private static final IndexFunction<Integer> SQUARE = i -> i * i;

    @Test
    void testConfigure() throws Exception {
        final Configuration config = publish(10, 4, SQUARE);

        final FunctionInputFormat<Integer> format = new FunctionInputFormat<>();
        format.configure(config);

        assertThat(format.getNumElements()).isEqualTo(10);
        assertThat(format.getInstanceId()).isEqualTo(4);
        assertThat(format.getFunction()).isNotNull();
        assertThat(format.getFunction().apply(7)).isEqualTo(49);
    }

    @Test
    void testSplitsForHint() throws IOException {
        final FunctionInputFormat<Integer> format = configured(10, SQUARE);

        final FunctionInputSplit<Integer>[] splits = format.createInputSplits(3);

        assertThat(splits).hasSize(3);
        assertThat(splits[0].getRange()).isEqualTo(new IndexRange(0, 3));
        assertThat(splits[1].getRange()).isEqualTo(new IndexRange(3, 3));
        assertThat(splits[2].getRange()).isEqualTo(new IndexRange(6, 4));
        for (int i = 0; i < splits.length; i++) {
            assertThat(splits[i].getSplitNumber()).isEqualTo(i);
            assertThat(splits[i].getFunction()).isSameAs(splits[0].getFunction());
        }
    }

    @Test
    void testConfiguredParallelismIsFallbackHint() throws IOException {
        final Configuration config = publish(12, 0, SQUARE);
        config.set(CoreOptions.DEFAULT_PARALLELISM, 4);

        final FunctionInputFormat<Integer> format = new FunctionInputFormat<>();
        format.configure(config);

        assertThat(format.createInputSplits(0)).hasSize(4);
        assertThat(format.createInputSplits(-1)).hasSize(4);
        assertThat(format.createInputSplits(2)).hasSize(2);
    }

    @Test
    void testDefaultParallelismIsOne() throws IOException {
        final FunctionInputFormat<Integer> format = configured(5, SQUARE);

        final FunctionInputSplit<Integer>[] splits = format.createInputSplits(0);
        assertThat(splits).hasSize(1);
        assertThat(splits[0].getRange()).isEqualTo(new IndexRange(0, 5));
    }

    @Test
    void testNoElements() throws IOException {
        final FunctionInputFormat<Integer> format = configured(0, SQUARE);

        assertThat(format.createInputSplits(8)).isEmpty();
        assertThat(format.getStatistics(null).getNumberOfRecords()).isZero();
    }

    @Test
    void testReadingAllSplits() throws Exception {
        final FunctionInputFormat<Integer> format = configured(10, SQUARE);

        final List<Integer> values = new ArrayList<>();
        for (FunctionInputSplit<Integer> split : format.createInputSplits(3)) {
            try (FunctionSplitReader<Integer> reader = format.createReader(split)) {
                reader.forEachRemaining(values::add);
            }
        }

        assertThat(values).containsExactly(0, 1, 4, 9, 16, 25, 36, 49, 64, 81);
    }

    @Test
    void testStatistics() throws IOException {
        final BaseStatistics statistics = configured(1000, SQUARE).getStatistics(null);

        assertThat(statistics.getNumberOfRecords()).isEqualTo(1000L);
        assertThat(statistics.getTotalInputSize()).isEqualTo(BaseStatistics.SIZE_UNKNOWN);
        assertThat(statistics.getAverageRecordWidth())
                .isEqualTo(BaseStatistics.AVG_RECORD_BYTES_UNKNOWN);
    }

    @Test
    void testAssignerAndSplitType() throws IOException {
        final FunctionInputFormat<Integer> format = configured(4, SQUARE);

        assertThat(format.getInputSplitAssigner(format.createInputSplits(2)))
                .isInstanceOf(DefaultInputSplitAssigner.class);
        assertThat(format.getInputSplitType()).isEqualTo(FunctionInputSplit.class);
    }

    @Test
    void testMissingFunction() {
        final Configuration config = new Configuration();
        config.set(FunctionInputOptions.LENGTH, 10);
        config.set(FunctionInputOptions.INSTANCE_ID, 9);

        assertThatThrownBy(() -> new FunctionInputFormat<Integer>().configure(config))
                .isInstanceOfSatisfying(
                        KeyNotFoundException.class,
                        e -> assertThat(e.getKey()).isEqualTo("fnsource.function.f9"));
    }

    @Test
    void testNegativeLength() throws IOException {
        final Configuration config = publish(3, 1, SQUARE);
        config.set(FunctionInputOptions.LENGTH, -3);

        assertThatThrownBy(() -> new FunctionInputFormat<Integer>().configure(config))
                .isInstanceOf(IllegalConfigurationException.class);
    }

    @Test
    void testSplitsRequireConfiguration() {
        assertThatThrownBy(() -> new FunctionInputFormat<Integer>().createInputSplits(1))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testCustomStoreFactory() throws Exception {
        final Configuration shared = new Configuration();
        final ObjectStoreFactory factory = ignored -> new ConfigurationObjectStore(shared);
        new ConfigurationObjectStore(shared).put(FunctionInputOptions.functionKey(2), SQUARE);

        final Configuration config = new Configuration();
        config.set(FunctionInputOptions.LENGTH, 3);
        config.set(FunctionInputOptions.INSTANCE_ID, 2);

        final FunctionInputFormat<Integer> format = new FunctionInputFormat<>(factory);
        format.configure(config);

        assertThat(format.createInputSplits(1)[0].getFunction().apply(3)).isEqualTo(9);
    }

    // --------------------------------------------------------------------------------------------

    private static Configuration publish(int n, int id, IndexFunction<?> function)
            throws IOException {
        final Configuration config = new Configuration();
        config.set(FunctionInputOptions.LENGTH, n);
        config.set(FunctionInputOptions.INSTANCE_ID, id);
        new ConfigurationObjectStore(config).put(FunctionInputOptions.functionKey(id), function);
        return config;
    }

    private static <T> FunctionInputFormat<T> configured(int n, IndexFunction<T> function)
            throws IOException {
        final FunctionInputFormat<T> format = new FunctionInputFormat<>();
        format.configure(publish(n, 0, function));
        return format;
    }
}
