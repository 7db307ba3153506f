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

package org.fnsource.core.memory;

import org.fnsource.annotation.Public;

import java.io.DataInput;
import java.io.IOException;

/**
 * A view over a sequence of bytes that can be read sequentially. Split descriptors and
 * configurations read themselves from such a view when they arrive at a worker.
 */
@Public
public interface DataInputView extends DataInput {

    /**
     * Skips {@code numBytes} bytes. In contrast to the {@link #skipBytes(int)} method, this method
     * always skips the desired number of bytes or throws an {@link java.io.EOFException}.
     *
     * @param numBytes The number of bytes to skip.
     * @throws IOException Thrown, if the input could not be advanced to the desired position.
     */
    void skipBytesToRead(int numBytes) throws IOException;

    /**
     * Reads up to {@code len} bytes and stores them into {@code b} starting at offset {@code off}.
     *
     * @return the number of actually read bytes or -1 if there is no more data left
     */
    int read(byte[] b, int off, int len) throws IOException;
}
