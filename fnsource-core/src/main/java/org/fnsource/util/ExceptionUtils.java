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

package org.fnsource.util;

import org.fnsource.annotation.Internal;

import javax.annotation.Nullable;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.fnsource.util.Preconditions.checkNotNull;

/** A collection of utility functions for dealing with exceptions and exception workflows. */
@Internal
public final class ExceptionUtils {

    /**
     * Checks whether the given exception indicates a situation that may leave the JVM in a
     * corrupted state, meaning a state where continued normal operation can only be guaranteed via
     * clean process restart.
     *
     * @param t The exception to check.
     * @return True, if the exception is considered fatal to the JVM, false otherwise.
     */
    public static boolean isJvmFatalError(Throwable t) {
        return (t instanceof InternalError) || (t instanceof UnknownError);
    }

    /**
     * Rethrows the given {@code Throwable}, if it represents an error that is fatal to the JVM.
     *
     * @param t The Throwable to check and rethrow.
     */
    public static void rethrowIfFatalError(Throwable t) {
        if (isJvmFatalError(t)) {
            throw (Error) t;
        }
    }

    /**
     * Adds a new exception as a {@link Throwable#addSuppressed(Throwable) suppressed exception} to
     * a prior exception, or returns the new exception, if no prior exception exists.
     *
     * @param newException The newly occurred exception
     * @param previous The previously occurred exception, possibly null.
     * @return The new exception, if no previous exception exists, or the previous exception with
     *     the new exception in the list of suppressed exceptions.
     */
    public static <T extends Throwable> T firstOrSuppressed(T newException, @Nullable T previous) {
        checkNotNull(newException, "newException");

        if (previous == null || previous == newException) {
            return newException;
        } else {
            previous.addSuppressed(newException);
            return previous;
        }
    }

    /**
     * Unpacks {@link ExecutionException} and {@link CompletionException} wrappers and returns the
     * first cause that is neither. Otherwise the given Throwable is returned.
     *
     * @param throwable to unpack
     * @return the innermost non-wrapper cause, or the given Throwable
     */
    public static Throwable stripExecutionException(Throwable throwable) {
        while ((throwable instanceof ExecutionException || throwable instanceof CompletionException)
                && throwable.getCause() != null) {
            throwable = throwable.getCause();
        }

        return throwable;
    }

    // ------------------------------------------------------------------------

    /** Private constructor to prevent instantiation. */
    private ExceptionUtils() {}
}
