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

import org.fnsource.annotation.PublicEvolving;
import org.fnsource.api.common.functions.IndexFunction;
import org.fnsource.core.io.CorruptSplitException;
import org.fnsource.core.io.InputSplit;
import org.fnsource.core.memory.DataInputView;
import org.fnsource.core.memory.DataOutputView;
import org.fnsource.util.InstantiationUtil;

import javax.annotation.Nullable;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.ObjectStreamException;

import static org.fnsource.util.Preconditions.checkArgument;
import static org.fnsource.util.Preconditions.checkNotNull;
import static org.fnsource.util.Preconditions.checkState;

/**
 * An input split that covers a range of indices of a function-based source, together with the
 * function that computes the elements.
 *
 * <p>Splits created by one planning call share the same function object. When a split is written
 * for transport to a worker it embeds its own serialized copy of the function, so a split read on
 * a worker owns an independent function instance. The binary layout is
 *
 * <pre>
 * [start: int32][length: int32][payloadSize: int32][payload: payloadSize bytes]
 * </pre>
 *
 * <p>where the payload is the Java serialized form of the function. The split number is not part
 * of the binary form.
 *
 * @param <T> The type of the elements computed by the function.
 */
@PublicEvolving
public class FunctionInputSplit<T> implements InputSplit {

    private static final long serialVersionUID = 1L;

    private static final String[] NO_HOSTS = new String[0];

    private static final int READ_CHUNK_SIZE = 4096;

    private int splitNumber;

    private int start;

    private int length;

    @Nullable private IndexFunction<T> function;

    /** Default constructor for instantiation during de-serialization. */
    public FunctionInputSplit() {}

    /**
     * Creates a split for the given range.
     *
     * @param splitNumber The number of this split.
     * @param range The range of indices covered by this split.
     * @param function The function that computes the elements.
     */
    public FunctionInputSplit(int splitNumber, IndexRange range, IndexFunction<T> function) {
        this(splitNumber, range.getStart(), range.getLength(), function);
    }

    public FunctionInputSplit(int splitNumber, int start, int length, IndexFunction<T> function) {
        checkArgument(
                start >= 0 && length >= 0, "Invalid range start=%s, length=%s.", start, length);
        this.splitNumber = splitNumber;
        this.start = start;
        this.length = length;
        this.function = checkNotNull(function, "function");
    }

    // --------------------------------------------------------------------------------------------

    @Override
    public int getSplitNumber() {
        return splitNumber;
    }

    /** Returns the first index of this split. */
    public int getStart() {
        return start;
    }

    /** Returns the number of elements of this split. */
    public long getLength() {
        return length;
    }

    /** Returns the range of indices covered by this split. */
    public IndexRange getRange() {
        return new IndexRange(start, length);
    }

    /** Returns the function that computes the elements of this split. */
    public IndexFunction<T> getFunction() {
        checkState(function != null, "The split has not been initialized with a function.");
        return function;
    }

    /** Function splits synthesize their elements, so no host is preferred. */
    @Override
    public String[] getHostnames() {
        return NO_HOSTS;
    }

    // --------------------------------------------------------------------------------------------
    //  Serialization
    // --------------------------------------------------------------------------------------------

    @Override
    public void write(DataOutputView out) throws IOException {
        final byte[] payload = InstantiationUtil.serializeObject(getFunction());

        out.writeInt(start);
        out.writeInt(length);
        out.writeInt(payload.length);
        out.write(payload);
    }

    /**
     * Reads the split from its binary form. The embedded function is resolved against the context
     * class loader of the calling thread.
     *
     * @throws CorruptSplitException Thrown, if the binary form is truncated or malformed, or the
     *     function could not be reconstructed from it.
     */
    @Override
    public void read(DataInputView in) throws IOException {
        final int readStart;
        final int readLength;
        final byte[] payload;

        try {
            readStart = in.readInt();
            readLength = in.readInt();
            final int payloadSize = in.readInt();

            if (readStart < 0
                    || readLength < 0
                    || (long) readStart + readLength > Integer.MAX_VALUE) {
                throw new CorruptSplitException(
                        "Invalid range in function split: start="
                                + readStart
                                + ", length="
                                + readLength);
            }
            if (payloadSize < 0) {
                throw new CorruptSplitException(
                        "Invalid function payload size in function split: " + payloadSize);
            }

            payload = readPayload(in, payloadSize);
        } catch (EOFException e) {
            throw new CorruptSplitException("The function split is truncated.", e);
        }

        this.function = deserializeFunction(payload);
        this.start = readStart;
        this.length = readLength;
    }

    /** Reads the payload in chunks. Memory grows with the bytes present, not the claimed size. */
    private static byte[] readPayload(DataInputView in, int payloadSize) throws IOException {
        final ByteArrayOutputStream payload =
                new ByteArrayOutputStream(Math.min(payloadSize, READ_CHUNK_SIZE));
        final byte[] chunk = new byte[Math.min(payloadSize, READ_CHUNK_SIZE)];

        int remaining = payloadSize;
        while (remaining > 0) {
            final int toRead = Math.min(remaining, chunk.length);
            in.readFully(chunk, 0, toRead);
            payload.write(chunk, 0, toRead);
            remaining -= toRead;
        }
        return payload.toByteArray();
    }

    private static <T> IndexFunction<T> deserializeFunction(byte[] payload)
            throws CorruptSplitException {
        final Object deserialized;
        try {
            deserialized =
                    InstantiationUtil.deserializeObject(
                            payload, Thread.currentThread().getContextClassLoader());
        } catch (EOFException | ObjectStreamException e) {
            throw new CorruptSplitException("The function payload of the split is malformed.", e);
        } catch (ClassNotFoundException e) {
            throw new CorruptSplitException(
                    "Could not resolve the class of the function embedded in the split.", e);
        } catch (IOException e) {
            throw new CorruptSplitException(
                    "Could not reconstruct the function embedded in the split.", e);
        }

        if (!(deserialized instanceof IndexFunction)) {
            throw new CorruptSplitException(
                    "The payload of the split does not contain an index function but "
                            + (deserialized == null ? "null" : deserialized.getClass().getName())
                            + '.');
        }

        @SuppressWarnings("unchecked")
        IndexFunction<T> function = (IndexFunction<T>) deserialized;
        return function;
    }

    /** Returns the binary form of this split. */
    public byte[] toBytes() throws IOException {
        return InstantiationUtil.writeToByteArray(this);
    }

    /**
     * Reads a split from its binary form.
     *
     * @param bytes The binary form, as produced by {@link #toBytes()}.
     * @param classLoader The class loader to resolve the embedded function with.
     * @return The split. Its split number is zero, as the number is not part of the binary form.
     * @throws CorruptSplitException Thrown, if the binary form is truncated or malformed.
     */
    public static <T> FunctionInputSplit<T> fromBytes(byte[] bytes, ClassLoader classLoader)
            throws IOException {
        return InstantiationUtil.readFromByteArray(new FunctionInputSplit<>(), bytes, classLoader);
    }

    /**
     * Sets the split number of a split that was read from its binary form.
     *
     * @param splitNumber The number of the split in its plan.
     */
    public void setSplitNumber(int splitNumber) {
        this.splitNumber = splitNumber;
    }

    // --------------------------------------------------------------------------------------------

    @Override
    public int hashCode() {
        return 31 * (31 * splitNumber + start) + length;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof FunctionInputSplit) {
            FunctionInputSplit<?> other = (FunctionInputSplit<?>) obj;
            return this.splitNumber == other.splitNumber
                    && this.start == other.start
                    && this.length == other.length;
        } else {
            return false;
        }
    }

    @Override
    public String toString() {
        return "FunctionInputSplit (" + splitNumber + ") [" + start + ", " + (start + length) + ')';
    }
}
