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

import org.fnsource.core.memory.DataInputView;
import org.fnsource.core.memory.DataOutputView;

import java.io.IOException;

/** An input split that consists of nothing but its number. */
public class TestingInputSplit implements InputSplit {

    private static final long serialVersionUID = 1L;

    private int splitNumber;

    public TestingInputSplit() {}

    public TestingInputSplit(int splitNumber) {
        this.splitNumber = splitNumber;
    }

    @Override
    public int getSplitNumber() {
        return splitNumber;
    }

    @Override
    public void write(DataOutputView out) throws IOException {
        out.writeInt(splitNumber);
    }

    @Override
    public void read(DataInputView in) throws IOException {
        splitNumber = in.readInt();
    }

    @Override
    public int hashCode() {
        return splitNumber;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof TestingInputSplit
                && ((TestingInputSplit) obj).splitNumber == splitNumber;
    }

    @Override
    public String toString() {
        return "TestingInputSplit " + splitNumber;
    }
}
