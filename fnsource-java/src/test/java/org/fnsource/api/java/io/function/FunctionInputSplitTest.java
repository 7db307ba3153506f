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

import org.fnsource.api.common.functions.IndexFunction;
import org.fnsource.core.io.CorruptSplitException;
import org.fnsource.util.InstantiationUtil;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for the {@link FunctionInputSplit}. */
class FunctionInputSplitTest {

    private final ClassLoader classLoader = getClass().getClassLoader();

    @Test
    void testRoundTrip() throws Exception {
        final IndexFunction<String> function = i -> "element-" + i;
        final FunctionInputSplit<String> split = new FunctionInputSplit<>(0, 20, 5, function);

        final FunctionInputSplit<String> copy =
                FunctionInputSplit.fromBytes(split.toBytes(), classLoader);

        assertThat(copy.getStart()).isEqualTo(20);
        assertThat(copy.getLength()).isEqualTo(5L);
        assertThat(copy.getRange()).isEqualTo(new IndexRange(20, 5));
        assertThat(copy.getFunction()).isNotSameAs(function);
        assertThat(copy.getFunction().apply(23)).isEqualTo("element-23");
    }

    @Test
    void testWireLayout() throws IOException {
        final Offset function = new Offset(100);
        final FunctionInputSplit<Integer> split = new FunctionInputSplit<>(3, 7, 9, function);

        final byte[] payload = InstantiationUtil.serializeObject(function);
        final ByteBuffer bytes = ByteBuffer.wrap(split.toBytes());

        assertThat(bytes.remaining()).isEqualTo(12 + payload.length);
        assertThat(bytes.getInt()).isEqualTo(7);
        assertThat(bytes.getInt()).isEqualTo(9);
        assertThat(bytes.getInt()).isEqualTo(payload.length);

        final byte[] embedded = new byte[bytes.remaining()];
        bytes.get(embedded);
        assertThat(embedded).isEqualTo(payload);
    }

    @Test
    void testSplitNumberIsNotSerialized() throws Exception {
        final FunctionInputSplit<Integer> split =
                new FunctionInputSplit<>(4, new IndexRange(0, 2), new Offset(1));

        final FunctionInputSplit<Integer> copy =
                FunctionInputSplit.fromBytes(split.toBytes(), classLoader);
        assertThat(copy.getSplitNumber()).isZero();
        assertThat(copy).isNotEqualTo(split);

        copy.setSplitNumber(4);
        assertThat(copy).isEqualTo(split).hasSameHashCodeAs(split);
    }

    @Test
    void testDecodedSplitsOwnTheirFunction() throws Exception {
        final Counting function = new Counting();
        final FunctionInputSplit<Integer> first = new FunctionInputSplit<>(0, 0, 2, function);
        final FunctionInputSplit<Integer> second = new FunctionInputSplit<>(1, 2, 2, function);

        final FunctionInputSplit<Integer> firstCopy =
                FunctionInputSplit.fromBytes(first.toBytes(), classLoader);
        final FunctionInputSplit<Integer> secondCopy =
                FunctionInputSplit.fromBytes(second.toBytes(), classLoader);

        firstCopy.getFunction().apply(0);
        firstCopy.getFunction().apply(1);

        assertThat(((Counting) firstCopy.getFunction()).calls).isEqualTo(2);
        assertThat(((Counting) secondCopy.getFunction()).calls).isZero();
        assertThat(function.calls).isZero();
    }

    @Test
    void testNoPreferredHosts() {
        final FunctionInputSplit<Integer> split = new FunctionInputSplit<>(0, 0, 1, new Offset(0));
        assertThat(split.getHostnames()).isEmpty();
    }

    @Test
    void testTruncatedHeader() throws IOException {
        final byte[] bytes = new FunctionInputSplit<>(0, 0, 10, new Offset(0)).toBytes();

        for (int length : new int[] {0, 3, 4, 8, 11}) {
            final byte[] truncated = Arrays.copyOf(bytes, length);
            assertThatThrownBy(() -> FunctionInputSplit.fromBytes(truncated, classLoader))
                    .as("truncated to %s bytes", length)
                    .isInstanceOf(CorruptSplitException.class);
        }
    }

    @Test
    void testTruncatedPayload() throws IOException {
        final byte[] bytes = new FunctionInputSplit<>(0, 0, 10, new Offset(0)).toBytes();
        final byte[] truncated = Arrays.copyOf(bytes, bytes.length - 1);

        assertThatThrownBy(() -> FunctionInputSplit.fromBytes(truncated, classLoader))
                .isInstanceOf(CorruptSplitException.class);
    }

    @Test
    void testNegativePayloadSize() throws IOException {
        final byte[] bytes = header(0, 10, -1);

        assertThatThrownBy(() -> FunctionInputSplit.fromBytes(bytes, classLoader))
                .isInstanceOf(CorruptSplitException.class)
                .hasMessageContaining("-1");
    }

    @Test
    void testOversizedPayloadSizeOnShortStream() throws IOException {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(header(0, 10, Integer.MAX_VALUE - 16));
        out.write(new byte[] {1, 2, 3});

        assertThatThrownBy(() -> FunctionInputSplit.fromBytes(out.toByteArray(), classLoader))
                .isInstanceOf(CorruptSplitException.class)
                .hasMessageContaining("truncated");
    }

    @Test
    void testPayloadLongerThanReadChunk() throws Exception {
        final IndexFunction<String> function = new Padded(new byte[20_000]);
        final byte[] bytes = new FunctionInputSplit<>(0, 0, 1, function).toBytes();

        final FunctionInputSplit<String> copy = FunctionInputSplit.fromBytes(bytes, classLoader);

        assertThat(copy.getFunction().apply(3)).isEqualTo("20000-3");
    }

    @Test
    void testGarbagePayload() throws IOException {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(header(0, 10, 4));
        out.write(new byte[] {1, 2, 3, 4});

        assertThatThrownBy(() -> FunctionInputSplit.fromBytes(out.toByteArray(), classLoader))
                .isInstanceOf(CorruptSplitException.class);
    }

    @Test
    void testPayloadThatIsNoFunction() throws IOException {
        final byte[] payload = InstantiationUtil.serializeObject("not a function");
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(header(0, 10, payload.length));
        out.write(payload);

        assertThatThrownBy(() -> FunctionInputSplit.fromBytes(out.toByteArray(), classLoader))
                .isInstanceOf(CorruptSplitException.class)
                .hasMessageContaining(String.class.getName());
    }

    @Test
    void testInvalidRange() throws IOException {
        final byte[] payload = InstantiationUtil.serializeObject(new Offset(0));
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(header(Integer.MAX_VALUE, 10, payload.length));
        out.write(payload);

        assertThatThrownBy(() -> FunctionInputSplit.fromBytes(out.toByteArray(), classLoader))
                .isInstanceOf(CorruptSplitException.class);
    }

    @Test
    void testUninitializedSplitCannotBeWritten() {
        assertThatThrownBy(() -> new FunctionInputSplit<Integer>().toBytes())
                .isInstanceOf(IllegalStateException.class);
    }

    // --------------------------------------------------------------------------------------------

    private static byte[] header(int start, int length, int payloadSize) throws IOException {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeInt(start);
            out.writeInt(length);
            out.writeInt(payloadSize);
        }
        return bytes.toByteArray();
    }

    private static final class Offset implements IndexFunction<Integer> {

        private static final long serialVersionUID = 1L;

        private final int offset;

        Offset(int offset) {
            this.offset = offset;
        }

        @Override
        public Integer apply(int index) {
            return index + offset;
        }
    }

    private static final class Padded implements IndexFunction<String> {

        private static final long serialVersionUID = 1L;

        private final byte[] padding;

        Padded(byte[] padding) {
            this.padding = padding;
        }

        @Override
        public String apply(int index) {
            return padding.length + "-" + index;
        }
    }

    private static final class Counting implements IndexFunction<Integer> {

        private static final long serialVersionUID = 1L;

        private int calls;

        @Override
        public Integer apply(int index) {
            calls++;
            return index;
        }
    }
}
