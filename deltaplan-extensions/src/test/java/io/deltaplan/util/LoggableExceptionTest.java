/*
 * LoggableExceptionTest.java
 *
 * This source file is part of the deltaplan open source project
 *
 * Copyright 2021-2024 the deltaplan project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.deltaplan.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.arrayContaining;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.emptyArray;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link LoggableException}.
 */
public class LoggableExceptionTest {
    @Test
    void keysKeepInsertionOrder() {
        LoggableException e = new LoggableException("boom", "zeta", 1, "alpha", 2);
        e.addLogInfo("mid", 3);
        assertThat(List.copyOf(e.getLogInfo().keySet()), contains("zeta", "alpha", "mid"));
        assertThat(e.exportLogInfo(), arrayContaining("zeta", 1, "alpha", 2, "mid", 3));
    }

    @Test
    void overwritingKeepsFirstPosition() {
        LoggableException e = new LoggableException("boom", "a", 1, "b", 2);
        e.addLogInfo("a", 10);
        assertThat(e.exportLogInfo(), arrayContaining("a", 10, "b", 2));
    }

    @Test
    void unbalancedKeyValues() {
        assertThrows(IllegalArgumentException.class, () -> new LoggableException("boom", "a", 1, "b"));
    }

    @Test
    void noLogInfo() {
        LoggableException e = new LoggableException("boom");
        assertTrue(e.getLogInfo().isEmpty());
        assertThat(e.exportLogInfo(), emptyArray());
        assertEquals("boom", e.getMessage());
    }
}
