/*
 * KeyValueLogMessageTest.java
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

package io.deltaplan.logging;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link KeyValueLogMessage}.
 */
public class KeyValueLogMessageTest {
    @Test
    void keysAreSorted() {
        assertEquals("planned delta query equivalence=\"[[0, 3]]\" input_count=\"2\"",
                KeyValueLogMessage.of("planned delta query",
                        LogMessageKeys.INPUT_COUNT, 2,
                        LogMessageKeys.EQUIVALENCE, "[[0, 3]]"));
    }

    @Test
    void valuesAreSanitized() {
        final KeyValueLogMessage message = KeyValueLogMessage.build("explain",
                LogMessageKeys.TOKEN, "\"a\"\nb",
                "odd=key", null);
        assertEquals(Map.of("token", "'a'\\nb", "oddkey", "null"), message.getKeyValueMap());
    }

    @Test
    void addingKeys() {
        final KeyValueLogMessage message = KeyValueLogMessage.build("failed")
                .addKeyAndValue(LogMessageKeys.CODE, "P0UR")
                .addKeysAndValues(Map.of(LogMessageKeys.NAME, "x"));
        assertEquals("failed code=\"P0UR\" name=\"x\"", message.toString());
        assertEquals("failed", message.getStaticMessage());
    }

    @Test
    void unbalancedKeysAndValues() {
        assertThrows(IllegalArgumentException.class, () -> KeyValueLogMessage.of("oops", LogMessageKeys.NAME));
    }
}
