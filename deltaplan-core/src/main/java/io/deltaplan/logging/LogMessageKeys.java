/*
 * LogMessageKeys.java
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

import io.deltaplan.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Keys used in {@link KeyValueLogMessage}s and in the log info of deltaplan exceptions.
 * All keys live here so that collisions are easy to spot.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    // general keys
    TITLE("ttl"),
    MESSAGE,
    CODE,
    // plan graph
    NODE_ID,
    NODE_KIND,
    NODE_COUNT,
    RESULT_COUNT,
    SOURCE_COUNT,
    COMPLEXITY_THRESHOLD,
    // names and references
    NAME,
    LOCAL_ID,
    SOURCE_ID,
    // columns and types
    COLUMN,
    ARITY,
    EXPECTED_TYPE,
    ACTUAL_TYPE,
    TOKEN,
    VALUE,
    // functions
    FUNCTION,
    ARGUMENT_TYPES,
    // joins
    INPUT,
    INPUT_COUNT,
    EQUIVALENCE,
    KEY,
    DELTA_RULES,
    DEMAND,
    ARRANGEMENT_COUNT,
    // dsl
    LINE,
    POSITION;

    @Nonnull
    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    LogMessageKeys(@Nonnull String key) {
        this.logKey = key;
    }

    @Override
    public String toString() {
        return logKey;
    }
}
