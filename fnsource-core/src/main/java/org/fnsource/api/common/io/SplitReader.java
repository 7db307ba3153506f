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

package org.fnsource.api.common.io;

import org.fnsource.annotation.Public;
import org.fnsource.core.io.InputSplit;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Produces the records of one {@link InputSplit} on a worker. Records are pulled one at a time:
 * {@link #advance()} moves to the next record and {@link #current()} returns it.
 *
 * <pre>{@code
 * reader.open(split);
 * while (reader.advance()) {
 *     consume(reader.current());
 * }
 * reader.close();
 * }</pre>
 *
 * <p>Readers are used by a single thread. Implementations should be written such that an instance
 * can be opened again for another split after it was closed.
 *
 * @param <OT> The type of the produced records.
 * @param <T> The type of input split.
 */
@Public
public interface SplitReader<OT, T extends InputSplit> extends AutoCloseable {

    /**
     * Opens the reader on the given split. The reader is positioned before the first record.
     *
     * @param split The split to be opened.
     * @throws IOException Thrown, if the spit could not be opened due to an I/O problem.
     */
    void open(T split) throws IOException;

    /**
     * Moves to the next record of the split.
     *
     * @return True, if a record was produced and is available through {@link #current()}, false
     *     if the split is exhausted.
     * @throws Exception Thrown, if producing the record failed. The reader must not be advanced
     *     again after a failure.
     */
    boolean advance() throws Exception;

    /**
     * Returns the record produced by the last successful call to {@link #advance()}.
     *
     * @throws IllegalStateException Thrown, if no record is available.
     */
    OT current();

    /**
     * Returns the fraction of the split that has been consumed, between {@code 0.0} and {@code
     * 1.0}. The value never decreases while the split is read.
     */
    float getProgress();

    /**
     * Closes the reader. After this method returns without an error, the split is assumed to be
     * correctly read.
     */
    @Override
    void close() throws IOException;

    /**
     * Advances the reader until the split is exhausted and hands every record to the given
     * action.
     *
     * @param action The action receiving the records.
     * @throws Exception Thrown, if producing a record failed.
     */
    default void forEachRemaining(Consumer<? super OT> action) throws Exception {
        while (advance()) {
            action.accept(current());
        }
    }
}
