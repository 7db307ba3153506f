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

import org.fnsource.annotation.Public;
import org.fnsource.core.io.IOReadableWritable;
import org.fnsource.core.memory.DataInputView;
import org.fnsource.core.memory.DataOutputView;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.io.IOException;
import java.io.Serializable;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.fnsource.util.Preconditions.checkNotNull;

/**
 * A map of configuration values. A job configuration carries the parameters that data sources
 * publish at submission time to the planner and to the workers, either as a Java serialized object
 * or in the binary form of {@link IOReadableWritable}.
 *
 * <p>Values are strings, integers, longs, booleans, byte arrays or enum constants. Typed reads
 * convert between these where possible, so an integer option can be set from a string. All
 * methods are thread-safe.
 */
@Public
public class Configuration implements IOReadableWritable, Serializable, Cloneable {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(Configuration.class);

    // type tags of the binary form
    private static final byte TYPE_STRING = 0;
    private static final byte TYPE_INT = 1;
    private static final byte TYPE_LONG = 2;
    private static final byte TYPE_BOOLEAN = 3;
    private static final byte TYPE_BYTES = 6;

    /** The values, guarded by the map itself. */
    private final HashMap<String, Object> confData;

    public Configuration() {
        this.confData = new HashMap<>();
    }

    /** Creates a copy of the given configuration. */
    public Configuration(Configuration other) {
        synchronized (other.confData) {
            this.confData = new HashMap<>(other.confData);
        }
    }

    /** Creates a configuration holding the given string values. */
    public static Configuration fromMap(Map<String, String> map) {
        final Configuration configuration = new Configuration();
        map.forEach(configuration::setString);
        return configuration;
    }

    // --------------------------------------------------------------------------------------------
    //  Access by option
    // --------------------------------------------------------------------------------------------

    /**
     * Returns the value of the given option converted to its type, or the default value of the
     * option if the key is not set.
     *
     * @throws IllegalConfigurationException Thrown, if the stored value cannot be converted.
     */
    @Nullable
    public <T> T get(ConfigOption<T> option) {
        return getOptional(option).orElseGet(option::defaultValue);
    }

    /** Returns the value of the given option converted to its type, if the key is set. */
    public <T> Optional<T> getOptional(ConfigOption<T> option) {
        return getRawValue(option.key()).map(value -> convertValue(option, value));
    }

    /**
     * Sets the value of the given option.
     *
     * @return This configuration.
     */
    public <T> Configuration set(ConfigOption<T> option, T value) {
        setValueInternal(option.key(), value);
        return this;
    }

    public boolean contains(ConfigOption<?> option) {
        return containsKey(option.key());
    }

    /**
     * Removes the value of the given option.
     *
     * @return True, if a value was removed.
     */
    public boolean removeConfig(ConfigOption<?> option) {
        synchronized (confData) {
            return confData.remove(option.key()) != null;
        }
    }

    // --------------------------------------------------------------------------------------------
    //  Access by key
    // --------------------------------------------------------------------------------------------

    public String getString(String key, String defaultValue) {
        return getRawValue(key).map(Configuration::convertToString).orElse(defaultValue);
    }

    public void setString(String key, String value) {
        setValueInternal(key, value);
    }

    public int getInteger(String key, int defaultValue) {
        return getRawValue(key).map(value -> convertToInt(key, value)).orElse(defaultValue);
    }

    public void setInteger(String key, int value) {
        setValueInternal(key, value);
    }

    public long getLong(String key, long defaultValue) {
        return getRawValue(key).map(value -> convertToLong(key, value)).orElse(defaultValue);
    }

    public void setLong(String key, long value) {
        setValueInternal(key, value);
    }

    /**
     * Returns the byte array stored under the given key. Byte arrays are only ever read as they
     * were stored, no other value converts to them.
     *
     * @throws IllegalArgumentException Thrown, if the key holds a value that is no byte array.
     */
    public byte[] getBytes(String key, byte[] defaultValue) {
        final Optional<Object> value = getRawValue(key);
        if (!value.isPresent()) {
            return defaultValue;
        }
        if (value.get() instanceof byte[]) {
            return (byte[]) value.get();
        }
        throw new IllegalArgumentException(
                "The value of key '" + key + "' is not a byte array: " + value.get());
    }

    public void setBytes(String key, byte[] bytes) {
        setValueInternal(key, bytes);
    }

    /** Returns a snapshot of the keys that hold a value. */
    public Set<String> keySet() {
        synchronized (confData) {
            return new HashSet<>(confData.keySet());
        }
    }

    public boolean containsKey(String key) {
        synchronized (confData) {
            return confData.containsKey(key);
        }
    }

    /** Returns all values as strings. Byte arrays have no string form and are left out. */
    public Map<String, String> toMap() {
        final Map<String, String> map = new HashMap<>();
        synchronized (confData) {
            confData.forEach(
                    (key, value) -> {
                        if (!(value instanceof byte[])) {
                            map.put(key, convertToString(value));
                        }
                    });
        }
        return map;
    }

    @Override
    public Configuration clone() {
        return new Configuration(this);
    }

    // --------------------------------------------------------------------------------------------

    private void setValueInternal(String key, Object value) {
        checkNotNull(key, "The key must not be null.");
        checkNotNull(value, "The value of key '%s' must not be null.", key);

        synchronized (confData) {
            confData.put(key, value);
        }
    }

    private Optional<Object> getRawValue(String key) {
        checkNotNull(key, "The key must not be null.");

        synchronized (confData) {
            return Optional.ofNullable(confData.get(key));
        }
    }

    // --------------------------------------------------------------------------------------------
    //  Conversions
    // --------------------------------------------------------------------------------------------

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static <T> T convertValue(ConfigOption<T> option, Object value) {
        final Class<T> type = option.getClazz();
        final Object converted;
        if (type == String.class) {
            converted = convertToString(value);
        } else if (type == Integer.class) {
            converted = convertToInt(option.key(), value);
        } else if (type == Long.class) {
            converted = convertToLong(option.key(), value);
        } else if (type == Boolean.class) {
            converted = convertToBoolean(option.key(), value);
        } else if (type.isEnum()) {
            converted = convertToEnum(option.key(), value, (Class<? extends Enum>) type);
        } else {
            throw new IllegalArgumentException("Unsupported option type: " + type.getName());
        }
        return (T) converted;
    }

    private static String convertToString(Object value) {
        if (value instanceof byte[]) {
            return Arrays.toString((byte[]) value);
        } else if (value instanceof Enum) {
            return ((Enum<?>) value).name();
        }
        return value.toString();
    }

    private static int convertToInt(String key, Object value) {
        final long longValue = convertToLong(key, value);
        if (longValue < Integer.MIN_VALUE || longValue > Integer.MAX_VALUE) {
            throw new IllegalConfigurationException(
                    "The value %s of key '%s' does not fit into an integer.", longValue, key);
        }
        return (int) longValue;
    }

    private static long convertToLong(String key, Object value) {
        if (value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(convertToString(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalConfigurationException(
                    String.format("The value '%s' of key '%s' is not a number.", value, key), e);
        }
    }

    private static boolean convertToBoolean(String key, Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        final String text = convertToString(value).trim();
        if (text.equalsIgnoreCase("true")) {
            return true;
        } else if (text.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalConfigurationException(
                "The value '%s' of key '%s' is neither 'true' nor 'false'.", text, key);
    }

    @SuppressWarnings("rawtypes")
    private static Enum<?> convertToEnum(String key, Object value, Class<? extends Enum> type) {
        if (type.isInstance(value)) {
            return (Enum<?>) value;
        }
        final String name = convertToString(value).trim();
        for (Enum<?> constant : type.getEnumConstants()) {
            if (constant.name().equalsIgnoreCase(name)) {
                return constant;
            }
        }
        throw new IllegalConfigurationException(
                "The value '%s' of key '%s' is not one of %s.",
                name, key, Arrays.toString(type.getEnumConstants()).toLowerCase(Locale.ROOT));
    }

    // --------------------------------------------------------------------------------------------
    //  Binary form
    // --------------------------------------------------------------------------------------------

    /**
     * Writes the number of entries followed by each entry as key, type tag and value. Enum
     * constants are written as their names and read back as strings.
     */
    @Override
    public void write(DataOutputView out) throws IOException {
        synchronized (confData) {
            out.writeInt(confData.size());
            for (Map.Entry<String, Object> entry : confData.entrySet()) {
                out.writeUTF(entry.getKey());
                writeValue(out, entry.getKey(), entry.getValue());
            }
        }
    }

    private static void writeValue(DataOutputView out, String key, Object value)
            throws IOException {
        if (value instanceof String) {
            out.writeByte(TYPE_STRING);
            out.writeUTF((String) value);
        } else if (value instanceof Integer) {
            out.writeByte(TYPE_INT);
            out.writeInt((Integer) value);
        } else if (value instanceof Long) {
            out.writeByte(TYPE_LONG);
            out.writeLong((Long) value);
        } else if (value instanceof Boolean) {
            out.writeByte(TYPE_BOOLEAN);
            out.writeBoolean((Boolean) value);
        } else if (value instanceof byte[]) {
            final byte[] bytes = (byte[]) value;
            out.writeByte(TYPE_BYTES);
            out.writeInt(bytes.length);
            out.write(bytes);
        } else if (value instanceof Enum) {
            LOG.debug("Writing the enum value of key '{}' as its name.", key);
            out.writeByte(TYPE_STRING);
            out.writeUTF(((Enum<?>) value).name());
        } else {
            throw new IOException(
                    "Cannot write value of type "
                            + value.getClass().getName()
                            + " of key '"
                            + key
                            + "'.");
        }
    }

    @Override
    public void read(DataInputView in) throws IOException {
        final int numEntries = in.readInt();
        final Map<String, Object> entries = new HashMap<>();
        for (int i = 0; i < numEntries; i++) {
            final String key = in.readUTF();
            entries.put(key, readValue(in, key));
        }

        synchronized (confData) {
            confData.putAll(entries);
        }
    }

    private static Object readValue(DataInputView in, String key) throws IOException {
        final byte type = in.readByte();
        switch (type) {
            case TYPE_STRING:
                return in.readUTF();
            case TYPE_INT:
                return in.readInt();
            case TYPE_LONG:
                return in.readLong();
            case TYPE_BOOLEAN:
                return in.readBoolean();
            case TYPE_BYTES:
                final int length = in.readInt();
                if (length < 0) {
                    throw new IOException(
                            "Negative length of the byte array of key '" + key + "'.");
                }
                final byte[] bytes = new byte[length];
                in.readFully(bytes);
                return bytes;
            default:
                throw new IOException("Unknown type tag " + type + " of key '" + key + "'.");
        }
    }

    // --------------------------------------------------------------------------------------------

    @Override
    public int hashCode() {
        return keySet().hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Configuration)) {
            return false;
        }
        final Map<String, Object> mine = snapshot();
        final Map<String, Object> theirs = ((Configuration) obj).snapshot();
        if (!mine.keySet().equals(theirs.keySet())) {
            return false;
        }
        for (Map.Entry<String, Object> entry : mine.entrySet()) {
            if (!valueEquals(entry.getValue(), theirs.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private Map<String, Object> snapshot() {
        synchronized (confData) {
            return new HashMap<>(confData);
        }
    }

    private static boolean valueEquals(Object a, Object b) {
        if (a instanceof byte[] && b instanceof byte[]) {
            return Arrays.equals((byte[]) a, (byte[]) b);
        }
        return a.equals(b);
    }

    @Override
    public String toString() {
        return toMap().toString();
    }
}
