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

import org.fnsource.annotation.PublicEvolving;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

import static org.fnsource.util.Preconditions.checkArgument;

/**
 * A {@link DataInputView} on top of a plain {@link InputStream}. Skipping falls back to reading
 * when the stream skips nothing, so only the true end of the stream fails a skip.
 */
@PublicEvolving
public class DataInputViewStreamWrapper extends DataInputStream implements DataInputView {

    public DataInputViewStreamWrapper(InputStream in) {
        super(in);
    }

    @Override
    public void skipBytesToRead(int numBytes) throws IOException {
        checkArgument(numBytes >= 0, "Cannot skip a negative number of bytes: %s.", numBytes);
        int remaining = numBytes;
        while (remaining > 0) {
            final int skipped = skipBytes(remaining);
            if (skipped > 0) {
                remaining -= skipped;
            } else if (read() >= 0) {
                remaining--;
            } else {
                throw new EOFException(
                        "Reached the end of the stream with "
                                + remaining
                                + " of "
                                + numBytes
                                + " bytes left to skip.");
            }
        }
    }
}
