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
import org.fnsource.configuration.Configuration;
import org.fnsource.core.io.IOReadableWritable;
import org.fnsource.core.memory.DataInputViewStreamWrapper;
import org.fnsource.core.memory.DataOutputViewStreamWrapper;

import javax.annotation.Nullable;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.ObjectStreamClass;
import java.lang.reflect.Modifier;
import java.util.HashMap;
import java.util.Map;

/**
 * Utility class to create instances from class objects and to move objects between their Java
 * serialized form and their in-memory form.
 */
@Internal
public final class InstantiationUtil {

    /** A custom ObjectInputStream that can load classes using a specific ClassLoader. */
    public static class ClassLoaderObjectInputStream extends ObjectInputStream {

        private static final Map<String, Class<?>> PRIMITIVE_CLASSES = new HashMap<>(16);

        static {
            PRIMITIVE_CLASSES.put("boolean", boolean.class);
            PRIMITIVE_CLASSES.put("byte", byte.class);
            PRIMITIVE_CLASSES.put("char", char.class);
            PRIMITIVE_CLASSES.put("short", short.class);
            PRIMITIVE_CLASSES.put("int", int.class);
            PRIMITIVE_CLASSES.put("long", long.class);
            PRIMITIVE_CLASSES.put("float", float.class);
            PRIMITIVE_CLASSES.put("double", double.class);
            PRIMITIVE_CLASSES.put("void", void.class);
        }

        protected final ClassLoader classLoader;

        public ClassLoaderObjectInputStream(InputStream in, @Nullable ClassLoader classLoader)
                throws IOException {
            super(in);
            this.classLoader = classLoader;
        }

        @Override
        protected Class<?> resolveClass(ObjectStreamClass desc)
                throws IOException, ClassNotFoundException {
            if (classLoader != null) {
                String name = desc.getName();
                try {
                    return Class.forName(name, false, classLoader);
                } catch (ClassNotFoundException ex) {
                    Class<?> cl = PRIMITIVE_CLASSES.get(name);
                    if (cl != null) {
                        return cl;
                    } else {
                        throw ex;
                    }
                }
            }

            return super.resolveClass(desc);
        }
    }

    // --------------------------------------------------------------------------------------------
    //  Instantiation
    // --------------------------------------------------------------------------------------------

    /**
     * Creates a new instance of the given class.
     *
     * @param <T> The generic type of the class.
     * @param clazz The class to instantiate.
     * @return An instance of the given class.
     * @throws RuntimeException Thrown, if the class could not be instantiated. The exception
     *     contains a detailed message about the reason why the instantiation failed.
     */
    public static <T> T instantiate(Class<T> clazz) {
        Preconditions.checkNotNull(clazz);

        final String error = checkForInstantiationError(clazz);
        if (error != null) {
            throw new RuntimeException(
                    "The class '" + clazz.getName() + "' is not instantiable: " + error);
        }

        try {
            return clazz.getDeclaredConstructor().newInstance();
        } catch (Throwable t) {
            ExceptionUtils.rethrowIfFatalError(t);
            String message = t.getMessage();
            throw new RuntimeException(
                    "Could not instantiate type '"
                            + clazz.getName()
                            + "' Most likely the constructor (or a member variable initialization) threw an exception"
                            + (message == null ? "." : ": " + message),
                    t);
        }
    }

    /**
     * Checks whether the class can be instantiated through its public nullary constructor.
     *
     * @return null, if the class can be instantiated, otherwise a description of the problem.
     */
    @Nullable
    public static String checkForInstantiationError(Class<?> clazz) {
        if (!Modifier.isPublic(clazz.getModifiers())) {
            return "The class is not public.";
        } else if (clazz.isArray()) {
            return "The class is an array. An array cannot be simply instantiated, as with a parameterless constructor.";
        } else if (Modifier.isAbstract(clazz.getModifiers())
                || clazz.isInterface()
                || clazz.isPrimitive()) {
            return "The class is not a proper class. It is either abstract, an interface, or a primitive type.";
        } else if (clazz.getEnclosingClass() != null && !Modifier.isStatic(clazz.getModifiers())) {
            return "The class is an inner class, but not statically accessible.";
        } else if (!hasPublicNullaryConstructor(clazz)) {
            return "The class has no (implicit) public nullary constructor, i.e. a constructor without arguments.";
        } else {
            return null;
        }
    }

    private static boolean hasPublicNullaryConstructor(Class<?> clazz) {
        try {
            return Modifier.isPublic(clazz.getConstructor().getModifiers());
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    // --------------------------------------------------------------------------------------------
    //  Java serialization
    // --------------------------------------------------------------------------------------------

    public static byte[] serializeObject(Object o) throws IOException {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
                ObjectOutputStream oos = new ObjectOutputStream(baos)) {
            oos.writeObject(o);
            oos.flush();
            return baos.toByteArray();
        }
    }

    public static <T> T deserializeObject(byte[] bytes, ClassLoader cl)
            throws IOException, ClassNotFoundException {
        return deserializeObject(new ByteArrayInputStream(bytes), cl);
    }

    @SuppressWarnings("unchecked")
    public static <T> T deserializeObject(InputStream in, ClassLoader cl)
            throws IOException, ClassNotFoundException {

        final ClassLoader old = Thread.currentThread().getContextClassLoader();
        // not using resource try to avoid AutoClosable's close() on the given stream
        try {
            ObjectInputStream oois = new ClassLoaderObjectInputStream(in, cl);
            Thread.currentThread().setContextClassLoader(cl);
            return (T) oois.readObject();
        } finally {
            Thread.currentThread().setContextClassLoader(old);
        }
    }

    public static boolean isSerializable(Object o) {
        try {
            serializeObject(o);
        } catch (IOException e) {
            return false;
        }

        return true;
    }

    @Nullable
    public static <T> T readObjectFromConfig(Configuration config, String key, ClassLoader cl)
            throws IOException, ClassNotFoundException {
        byte[] bytes = config.getBytes(key, null);
        if (bytes == null) {
            return null;
        }

        return deserializeObject(bytes, cl);
    }

    public static void writeObjectToConfig(Object o, Configuration config, String key)
            throws IOException {
        byte[] bytes = serializeObject(o);
        config.setBytes(key, bytes);
    }

    // --------------------------------------------------------------------------------------------
    //  IOReadableWritable
    // --------------------------------------------------------------------------------------------

    /**
     * Writes the given writable into a fresh byte array.
     *
     * @param writable The object to write.
     * @return The binary representation of the object.
     * @throws IOException Thrown, if the object could not be written.
     */
    public static byte[] writeToByteArray(IOReadableWritable writable) throws IOException {
        final ByteArrayOutputStream baos = new ByteArrayOutputStream(64);
        try (DataOutputViewStreamWrapper out = new DataOutputViewStreamWrapper(baos)) {
            writable.write(out);
        }
        return baos.toByteArray();
    }

    /**
     * Reads the state of the given writable from a byte array that was produced by {@link
     * #writeToByteArray(IOReadableWritable)}. The given class loader is installed as the context
     * class loader while reading, so that objects embedded in the writable are resolved against
     * it.
     *
     * @param target The (typically freshly instantiated) object to read into.
     * @param bytes The binary representation.
     * @param cl The class loader to resolve embedded classes.
     * @return The target object.
     * @throws IOException Thrown, if the object could not be read.
     */
    public static <T extends IOReadableWritable> T readFromByteArray(
            T target, byte[] bytes, ClassLoader cl) throws IOException {
        final ClassLoader old = Thread.currentThread().getContextClassLoader();
        try (DataInputViewStreamWrapper in =
                new DataInputViewStreamWrapper(new ByteArrayInputStream(bytes))) {
            Thread.currentThread().setContextClassLoader(cl);
            target.read(in);
            return target;
        } finally {
            Thread.currentThread().setContextClassLoader(old);
        }
    }

    // --------------------------------------------------------------------------------------------

    /** Private constructor to prevent instantiation. */
    private InstantiationUtil() {
        throw new RuntimeException();
    }
}
