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

import org.fnsource.annotation.Internal;
import org.fnsource.annotation.PublicEvolving;
import org.fnsource.api.common.functions.FunctionEvaluationException;
import org.fnsource.api.common.functions.IndexFunction;
import org.fnsource.api.common.io.SplitReader;
import org.fnsource.util.ExceptionUtils;

import static org.fnsource.util.Preconditions.checkNotNull;
import static org.fnsource.util.Preconditions.checkState;

/**
 * Reads a {@link FunctionInputSplit} by evaluating the function of the split for every index of
 * its range, in ascending order. Elements are computed lazily: each call to {@link #advance()}
 * evaluates the function exactly once.
 *
 * <p>The reader is not thread-safe. It holds no resources, so abandoning it without closing it is
 * safe.
 *
 * @param <T> The type of the produced elements.
 */
@PublicEvolving
public class FunctionSplitReader<T> implements SplitReader<T, FunctionInputSplit<T>> {

    /** The life cycle states of the reader. */
    public enum ReaderState {
        /** Opened, no element produced yet. */
        READY,
        /** At least one element has been produced. */
        PRODUCING,
        /** All elements of the range have been produced. */
        EXHAUSTED,
        /** The function failed. */
        FAILED
    }

    private IndexFunction<T> function;

    private int start;

    private int end;

    private int index;

    private T current;

    private boolean hasCurrent;

    private boolean closed;

    private ReaderState state;

    @Override
    public void open(FunctionInputSplit<T> split) {
        checkNotNull(split, "split");

        this.function = split.getFunction();
        this.start = split.getStart();
        this.end = split.getStart() + (int) split.getLength();
        this.index = start;
        this.current = null;
        this.hasCurrent = false;
        this.closed = false;
        this.state = ReaderState.READY;
    }

    @Override
    public boolean advance() throws FunctionEvaluationException {
        checkState(state != null, "The reader has not been opened.");
        checkState(!closed, "The reader has been closed.");
        checkState(state != ReaderState.FAILED, "The reader failed before and cannot advance.");

        if (index >= end) {
            current = null;
            hasCurrent = false;
            state = ReaderState.EXHAUSTED;
            return false;
        }

        final T value;
        try {
            value = function.apply(index);
        } catch (Throwable t) {
            ExceptionUtils.rethrowIfFatalError(t);
            current = null;
            hasCurrent = false;
            state = ReaderState.FAILED;
            throw new FunctionEvaluationException(index, t);
        }

        current = value;
        hasCurrent = true;
        index++;
        state = ReaderState.PRODUCING;
        return true;
    }

    @Override
    public T current() {
        if (!hasCurrent) {
            throw new IllegalStateException("no current value");
        }
        return current;
    }

    /**
     * Returns the consumed fraction of the range. A range without elements is always complete.
     * The progress is below {@code 1.0} as long as elements are left, also for ranges that are too
     * long for the fraction to be exact.
     */
    @Override
    public float getProgress() {
        if (index >= end) {
            return 1.0f;
        }
        final float progress = (index - start) / (float) (end - start);
        return Math.min(progress, Math.nextDown(1.0f));
    }

    @Override
    public void close() {
        closed = true;
        current = null;
        hasCurrent = false;
    }

    /** Returns the current life cycle state, or null if the reader was never opened. */
    @Internal
    public ReaderState getState() {
        return state;
    }

    /** Returns the next index the function will be evaluated for. */
    @Internal
    public int getNextIndex() {
        return index;
    }
}
