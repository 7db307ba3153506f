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

package org.fnsource.api.common.io;

import org.fnsource.annotation.Public;
import org.fnsource.configuration.Configuration;

import java.io.IOException;

/**
 * A data source as the planner of a batch job sees it. At submission time the source checks its
 * preconditions and publishes whatever its {@link PartitionedSource} needs into the job
 * configuration; the planner then uses the partitioned source to create and read the splits.
 *
 * @param <OT> The type of the produced records.
 */
@Public
public interface DataSource<OT> {

    /** Returns the name of this source, used in logs and plans. */
    String getName();

    /**
     * Checks that the input of the source is valid before the job is submitted.
     *
     * @throws IOException Thrown, if the input is not valid.
     */
    void inputCheck() throws IOException;

    /**
     * Publishes the parameters of this source into the job configuration. Called once per job
     * before planning starts.
     *
     * @param configuration The job configuration.
     * @throws IOException Thrown, if the parameters could not be published.
     */
    void inputConfigure(Configuration configuration) throws IOException;

    /**
     * Returns an estimate of the number of records this source produces, or a negative value if
     * unknown.
     */
    long inputSize();

    /** Returns the partitioned source that creates and reads the splits of this data source. */
    PartitionedSource<OT, ?> getInputFormat();
}
