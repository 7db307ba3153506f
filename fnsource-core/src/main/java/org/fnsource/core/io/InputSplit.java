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

import java.io.Serializable;

/**
 * This interface must be implemented by all kind of input splits that can be assigned to parallel
 * workers. A split is written to bytes by the planner and read back on the worker that processes
 * it, hence every implementation needs a public nullary constructor.
 */
@Public
public interface InputSplit extends IOReadableWritable, Serializable {

    /**
     * Returns the number of this input split.
     *
     * @return the number of this input split
     */
    int getSplitNumber();

    /**
     * Returns the names of the hosts storing the data this split refers to. Splits of synthesized
     * data have no locality and return an empty array.
     *
     * @return the names of the hosts storing the data, never null
     */
    default String[] getHostnames() {
        return new String[0];
    }
}
