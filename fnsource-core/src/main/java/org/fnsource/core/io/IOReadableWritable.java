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

package org.fnsource.core.io;

import org.fnsource.annotation.Public;
import org.fnsource.core.memory.DataInputView;
import org.fnsource.core.memory.DataOutputView;

import java.io.IOException;

/**
 * An object with an explicit binary form. Splits and configurations implement it so that they can
 * be shipped to workers as bytes and rebuilt there.
 *
 * <p>Implementations are rebuilt by instantiating them through a public nullary constructor and
 * calling {@link #read(DataInputView)}, so they need such a constructor.
 */
@Public
public interface IOReadableWritable {

    /**
     * Writes the binary form of this object.
     *
     * @param out The view to write to.
     * @throws IOException Thrown, if the view could not be written.
     */
    void write(DataOutputView out) throws IOException;

    /**
     * Replaces the state of this object with the state read from its binary form.
     *
     * @param in The view to read from.
     * @throws IOException Thrown, if the view ends early or does not hold a valid binary form.
     */
    void read(DataInputView in) throws IOException;
}
