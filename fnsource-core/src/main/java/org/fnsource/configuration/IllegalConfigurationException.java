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
package org.fnsource.configuration;

import org.fnsource.annotation.PublicEvolving;

/**
 * Signals that a {@link Configuration} holds a value that cannot be used, such as a negative
 * element count, a missing object store directory or a number that does not fit its option.
 */
@PublicEvolving
public class IllegalConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 3412897306515829541L;

    /**
     * @param format message template in {@link String#format(String, Object...)} syntax
     * @param arguments values for the placeholders of the template
     */
    public IllegalConfigurationException(String format, Object... arguments) {
        super(String.format(format, arguments));
    }

    public IllegalConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
