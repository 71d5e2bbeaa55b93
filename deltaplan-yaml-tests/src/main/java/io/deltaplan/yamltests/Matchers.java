/*
 * Matchers.java
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

package io.deltaplan.yamltests;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * Shape checks for the objects SnakeYAML hands back. Each check fails the running test with a description of what
 * was expected.
 */
public final class Matchers {

    private Matchers() {
        // utility class
    }

    @Nonnull
    public static List<?> arrayList(@Nullable Object obj, @Nonnull String desc) {
        if (obj instanceof List) {
            return (List<?>)obj;
        }
        return fail(String.format("Expecting '%s' to be of type '%s'", desc, List.class.getSimpleName()));
    }

    @Nonnull
    public static Map<?, ?> map(@Nullable Object obj, @Nonnull String desc) {
        if (obj instanceof Map<?, ?>) {
            return (Map<?, ?>)obj;
        }
        return fail(String.format("Expecting '%s' to be of type '%s'", desc, Map.class.getSimpleName()));
    }

    @Nonnull
    public static String string(@Nullable Object obj, @Nonnull String desc) {
        if (obj instanceof String) {
            return (String)obj;
        }
        return fail(String.format("Expecting '%s' to be of type '%s'", desc, String.class.getSimpleName()));
    }

    public static boolean bool(@Nullable Object obj, @Nonnull String desc) {
        if (obj instanceof Boolean) {
            return (Boolean)obj;
        }
        return fail(String.format("Expecting '%s' to be of type '%s'", desc, Boolean.class.getSimpleName()));
    }

    public static int intValue(@Nullable Object obj, @Nonnull String desc) {
        if (obj instanceof Integer) {
            return (Integer)obj;
        }
        return fail(String.format("Expecting '%s' to be of type '%s'", desc, Integer.class.getSimpleName()));
    }

    @Nonnull
    public static Map.Entry<?, ?> firstEntry(@Nullable Object obj, @Nonnull String desc) {
        final Map<?, ?> map = map(obj, desc);
        if (map.isEmpty()) {
            return fail(String.format("Expecting '%s' to have at least one entry", desc));
        }
        return map.entrySet().iterator().next();
    }

    /**
     * The key of an entry as a string, looking through the line number wrapper.
     * @param entry a map entry
     * @return the key
     */
    @Nonnull
    public static String key(@Nonnull Map.Entry<?, ?> entry) {
        final Object key = entry.getKey();
        if (key instanceof CustomYamlConstructor.LinedObject) {
            return string(((CustomYamlConstructor.LinedObject)key).getObject(), "key");
        }
        return string(key, "key");
    }

    /**
     * The line number of an entry whose key carries one.
     * @param entry a map entry
     * @return the 1-based line number, or {@code -1} if the key was not tracked
     */
    public static int lineNumber(@Nonnull Map.Entry<?, ?> entry) {
        final Object key = entry.getKey();
        if (key instanceof CustomYamlConstructor.LinedObject) {
            return ((CustomYamlConstructor.LinedObject)key).getLineNumber();
        }
        return -1;
    }
}
