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

import org.fnsource.annotation.PublicEvolving;
import org.fnsource.api.common.io.DataSource;
import org.fnsource.api.common.io.PartitionedSource;
import org.fnsource.api.common.io.SplitReader;
import org.fnsource.configuration.Configuration;
import org.fnsource.configuration.CoreOptions;
import org.fnsource.configuration.IllegalConfigurationException;
import org.fnsource.core.io.InputSplit;
import org.fnsource.core.io.InputSplitAssigner;
import org.fnsource.util.ExceptionUtils;
import org.fnsource.util.InstantiationUtil;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

import static org.fnsource.util.Preconditions.checkNotNull;

/**
 * Reads a {@link DataSource} with a number of worker threads in the current JVM and collects all
 * of its records.
 *
 * <p>The runner goes through the same steps as a distributed job: the source publishes its
 * parameters into a copy of the runner's configuration, the input format plans the splits, and
 * every split is encoded to bytes. The workers then pull splits from the split assigner, decode
 * them with the user class loader and read them. The number of workers is the configured {@link
 * CoreOptions#DEFAULT_PARALLELISM}, which is also the parallelism hint for planning.
 *
 * <p>The records are returned in split order, which for function sources is index order.
 */
@PublicEvolving
public class LocalSourceRunner {

    private static final Logger LOG = LoggerFactory.getLogger(LocalSourceRunner.class);

    private static final String LOCAL_HOST = "localhost";

    private final Configuration configuration;

    private final ClassLoader userClassLoader;

    public LocalSourceRunner(Configuration configuration) {
        this(configuration, defaultClassLoader());
    }

    public LocalSourceRunner(Configuration configuration, ClassLoader userClassLoader) {
        this.configuration = checkNotNull(configuration, "configuration");
        this.userClassLoader = checkNotNull(userClassLoader, "userClassLoader");
    }

    /**
     * Reads all records of the given source.
     *
     * @param source The source to read.
     * @param <T> The type of the records.
     * @return All records, in split order.
     * @throws SourceExecutionException Thrown, if the source could not be configured or planned,
     *     or if any worker failed. The first failure is the cause.
     */
    public <T> List<T> collect(DataSource<T> source) throws SourceExecutionException {
        checkNotNull(source, "source");

        final Configuration jobConfiguration = configuration.clone();
        final int parallelism = jobConfiguration.get(CoreOptions.DEFAULT_PARALLELISM);
        if (parallelism < 1) {
            throw new IllegalConfigurationException(
                    "The parallelism must be at least 1, was %s.", parallelism);
        }

        LOG.info("Reading source {} with parallelism {}.", source.getName(), parallelism);

        try {
            source.inputCheck();
            source.inputConfigure(jobConfiguration);
        } catch (IOException e) {
            throw new SourceExecutionException(
                    "Could not configure the source " + source.getName() + '.', e);
        }

        final List<T> result =
                execute(source.getName(), source.getInputFormat(), jobConfiguration, parallelism);

        LOG.info("Finished reading source {}, {} records.", source.getName(), result.size());
        return result;
    }

    private <T, S extends InputSplit> List<T> execute(
            String sourceName,
            PartitionedSource<T, S> format,
            Configuration jobConfiguration,
            int parallelism)
            throws SourceExecutionException {

        final S[] splits;
        final byte[][] encodedSplits;
        try {
            format.configure(jobConfiguration);
            splits = format.createInputSplits(parallelism);

            encodedSplits = new byte[splits.length][];
            for (S split : splits) {
                encodedSplits[split.getSplitNumber()] =
                        InstantiationUtil.writeToByteArray(split);
            }
        } catch (Exception e) {
            throw new SourceExecutionException(
                    "Could not create the input splits of " + sourceName + '.', e);
        }

        LOG.debug("Created {} input splits for {}.", splits.length, sourceName);

        final InputSplitAssigner assigner = format.getInputSplitAssigner(splits);
        final AtomicReferenceArray<List<T>> results = new AtomicReferenceArray<>(splits.length);

        final ExecutorService executor =
                Executors.newFixedThreadPool(parallelism, new WorkerThreadFactory(sourceName));
        try {
            final CompletionService<Void> completionService =
                    new ExecutorCompletionService<>(executor);

            for (int taskId = 0; taskId < parallelism; taskId++) {
                final int workerTaskId = taskId;
                completionService.submit(
                        () -> {
                            runWorker(format, assigner, encodedSplits, results, workerTaskId);
                            return null;
                        });
            }

            Throwable failure = null;
            for (int i = 0; i < parallelism; i++) {
                try {
                    completionService.take().get();
                } catch (ExecutionException e) {
                    if (failure == null) {
                        // cancels the remaining workers
                        executor.shutdownNow();
                    }
                    failure =
                            ExceptionUtils.firstOrSuppressed(
                                    ExceptionUtils.stripExecutionException(e), failure);
                }
            }

            if (failure != null) {
                throw new SourceExecutionException(
                        "Reading the source " + sourceName + " failed.", failure);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceExecutionException(
                    "Interrupted while reading the source " + sourceName + '.', e);
        } finally {
            executor.shutdownNow();
        }

        final List<T> collected = new ArrayList<>();
        for (int i = 0; i < splits.length; i++) {
            final List<T> splitResult = results.get(i);
            if (splitResult == null) {
                throw new SourceExecutionException(
                        "The input split " + i + " of " + sourceName + " was not read.");
            }
            collected.addAll(splitResult);
        }
        return collected;
    }

    private <T, S extends InputSplit> void runWorker(
            PartitionedSource<T, S> format,
            InputSplitAssigner assigner,
            byte[][] encodedSplits,
            AtomicReferenceArray<List<T>> results,
            int taskId)
            throws Exception {

        InputSplit assigned;
        while ((assigned = assigner.getNextInputSplit(LOCAL_HOST, taskId)) != null) {
            if (Thread.currentThread().isInterrupted()) {
                return;
            }

            final int splitNumber = assigned.getSplitNumber();
            LOG.debug("Worker {} reads input split {}.", taskId, splitNumber);

            final S split =
                    InstantiationUtil.readFromByteArray(
                            InstantiationUtil.instantiate(format.getInputSplitType()),
                            encodedSplits[splitNumber],
                            userClassLoader);

            final List<T> records = new ArrayList<>();
            try (SplitReader<T, S> reader = format.createReader(split)) {
                while (reader.advance()) {
                    records.add(reader.current());
                    if (Thread.currentThread().isInterrupted()) {
                        return;
                    }
                }
            }
            results.set(splitNumber, records);

            LOG.debug(
                    "Worker {} finished input split {} with {} records.",
                    taskId,
                    splitNumber,
                    records.size());
        }
    }

    private static ClassLoader defaultClassLoader() {
        final ClassLoader cl = Thread.currentThread().getContextClassLoader();
        return cl != null ? cl : LocalSourceRunner.class.getClassLoader();
    }

    // --------------------------------------------------------------------------------------------

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger threadNumber = new AtomicInteger();

        private final String namePrefix;

        WorkerThreadFactory(String sourceName) {
            this.namePrefix = "Source worker for " + sourceName + " #";
        }

        @Override
        public Thread newThread(Runnable runnable) {
            final Thread thread = new Thread(runnable, namePrefix + threadNumber.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
