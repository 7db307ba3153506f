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

import static org.fnsource.util.Preconditions.checkNotNull;

/**
 * Entry point for declaring {@link ConfigOption}s. Options are declared as constants of option
 * holder classes:
 *
 * <pre>{@code
 * public static final ConfigOption<Integer> LENGTH =
 *     ConfigOptions.key("fnsource.function.n")
 *         .intType()
 *         .defaultValue(0)
 *         .withDescription("The number of elements produced by the function source.");
 * }</pre>
 */
@PublicEvolving
public class ConfigOptions {

    /** Starts the declaration of the option with the given key. */
    public static OptionBuilder key(String key) {
        return new OptionBuilder(checkNotNull(key, "key"));
    }

    // ------------------------------------------------------------------------

    /** Selects the value type of an option. */
    public static final class OptionBuilder {

        private final String key;

        OptionBuilder(String key) {
            this.key = key;
        }

        public TypedConfigOptionBuilder<Boolean> booleanType() {
            return ofType(Boolean.class);
        }

        public TypedConfigOptionBuilder<Integer> intType() {
            return ofType(Integer.class);
        }

        public TypedConfigOptionBuilder<Long> longType() {
            return ofType(Long.class);
        }

        public TypedConfigOptionBuilder<String> stringType() {
            return ofType(String.class);
        }

        /**
         * Declares an option whose values are constants of the given enum. String values are
         * matched against the constant names ignoring case.
         */
        public <T extends Enum<T>> TypedConfigOptionBuilder<T> enumType(Class<T> enumClass) {
            return ofType(checkNotNull(enumClass, "enumClass"));
        }

        private <T> TypedConfigOptionBuilder<T> ofType(Class<T> type) {
            return new TypedConfigOptionBuilder<>(key, type);
        }
    }

    /**
     * Completes the declaration of an option whose value type is known.
     *
     * @param <T> The value type of the option.
     */
    public static class TypedConfigOptionBuilder<T> {

        private final String key;

        private final Class<T> type;

        TypedConfigOptionBuilder(String key, Class<T> type) {
            this.key = key;
            this.type = type;
        }

        /** Completes the option with the value used when a configuration lacks the key. */
        public ConfigOption<T> defaultValue(T value) {
            return new ConfigOption<>(key, type, "", checkNotNull(value, "value"));
        }

        /** Completes an option that has no value unless a configuration sets one. */
        public ConfigOption<T> noDefaultValue() {
            return new ConfigOption<>(key, type, "", null);
        }
    }

    // ------------------------------------------------------------------------

    private ConfigOptions() {}
}
