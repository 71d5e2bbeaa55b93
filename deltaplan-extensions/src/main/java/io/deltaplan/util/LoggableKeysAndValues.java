/*
 * LoggableKeysAndValues.java
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

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Associates structured log information with an object.
 * A deltaplan log line is a fixed title followed by {@code key="value"} pairs naming the node, column or
 * binding that the line is about, so that failures of the same kind can be searched for by title and then
 * told apart by their keys.
 *
 * @param <T> type of object to associate loggable information with
 */
interface LoggableKeysAndValues<T extends LoggableKeysAndValues<T>> {

    /**
     * Get the log information associated with this object as a map, in the order the keys were first added.
     *
     * @return a single map with all log information
     */
    @Nonnull
    Map<String, Object> getLogInfo();

    /**
     * Add a key/value pair to the log information.
     *
     * @param description the key
     * @param object the value
     * @return this object
     */
    @Nonnull
    T addLogInfo(@Nonnull String description, Object object);

    /**
     * Add a flattened list of key/value pairs to the log information. Every even element is a key and
     * every odd element is the value for the key before it, so <code>["k0", "v0", "k1", "v1"]</code> adds
     * two pairs. This is the same format that {@link #exportLogInfo()} produces.
     *
     * @param keyValue flattened key/value pairs
     * @return this object
     * @throws IllegalArgumentException if <code>keyValue</code> has odd length
     */
    @Nonnull
    T addLogInfo(@Nonnull Object ... keyValue);

    /**
     * Export the log information as a flattened array of alternating keys and values.
     *
     * @return a flattened array of key/value pairs
     */
    @Nonnull
    Object[] exportLogInfo();
}
