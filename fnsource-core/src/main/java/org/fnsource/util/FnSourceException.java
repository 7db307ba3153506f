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

import org.fnsource.annotation.Public;

/**
 * Base class of all checked exceptions raised by fnsource. Exceptions that are caused by user
 * code, such as a failing generator function, should extend this class.
 */
@Public
public class FnSourceException extends Exception {

    private static final long serialVersionUID = 450688772469004724L;

    /**
     * Creates a new exception with the given message and null as the cause.
     *
     * @param message The exception message
     */
    public FnSourceException(String message) {
        super(message);
    }

    /**
     * Creates a new exception with a null message and the given cause.
     *
     * @param cause The exception that caused this exception
     */
    public FnSourceException(Throwable cause) {
        super(cause);
    }

    /**
     * Creates a new exception with the given message and cause.
     *
     * @param message The exception message
     * @param cause The exception that caused this exception
     */
    public FnSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
