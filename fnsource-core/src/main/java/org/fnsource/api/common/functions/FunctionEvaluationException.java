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

package org.fnsource.api.common.functions;

import org.fnsource.annotation.PublicEvolving;
import org.fnsource.util.FnSourceException;

/**
 * Thrown when a user-defined {@link IndexFunction} fails while computing an element. The original
 * failure is available as the cause. The failure is not retried by the data source; the task that
 * produced the range fails with it.
 */
@PublicEvolving
public class FunctionEvaluationException extends FnSourceException {

    private static final long serialVersionUID = 1L;

    private final int index;

    public FunctionEvaluationException(int index, Throwable cause) {
        super("The generator function failed for index " + index + '.', cause);
        this.index = index;
    }

    /** Returns the index for which the function failed. */
    public int getIndex() {
        return index;
    }
}
