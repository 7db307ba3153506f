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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for the {@link Preconditions}. */
class PreconditionsTest {

    @Test
    void testCheckNotNullReturnsReference() {
        final String reference = "value";
        assertThat(Preconditions.checkNotNull(reference, "message")).isSameAs(reference);
    }

    @Test
    void testCheckNotNullWithMessage() {
        assertThatThrownBy(() -> Preconditions.checkNotNull(null, "the reference"))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("the reference");
    }

    @Test
    void testCheckArgumentFormatsTemplate() {
        assertThatThrownBy(
                        () ->
                                Preconditions.checkArgument(
                                        false, "value %s is not in %s", 7, "[0, 5)"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("value 7 is not in [0, 5)");
    }

    @Test
    void testCheckArgumentWithSurplusArguments() {
        assertThatThrownBy(() -> Preconditions.checkArgument(false, "bad %s", 1, 2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("bad 1 [2]");
    }

    @Test
    void testCheckStatePassesOnTrueCondition() {
        Preconditions.checkState(true, "not thrown");
        Preconditions.checkArgument(true, "not thrown");
    }

    @Test
    void testCheckStateFails() {
        assertThatThrownBy(() -> Preconditions.checkState(false, "state %s", "broken"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("state broken");
    }
}
