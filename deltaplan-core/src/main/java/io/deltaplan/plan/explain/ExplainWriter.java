/*
 * ExplainWriter.java
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

package io.deltaplan.plan.explain;

import javax.annotation.Nonnull;

/**
 * Accumulates explain text up to a maximum size. Once the maximum is reached, the text is cut and an ellipsis
 * appended, and further appends are ignored.
 *
 * <p>
 * Not thread safe; use a new writer for each rendering.
 * </p>
 */
final class ExplainWriter {
    private static final String ELLIPSIS = "...";

    private final int maxSize;
    @Nonnull
    private final StringBuilder text = new StringBuilder();
    private boolean done;

    ExplainWriter(int maxSize) {
        this.maxSize = maxSize;
    }

    boolean isDone() {
        return done;
    }

    @Nonnull
    ExplainWriter append(@Nonnull String toAppend) {
        if (done) {
            return this;
        }
        if ((long)text.length() + toAppend.length() > maxSize) {
            text.append(toAppend, 0, maxSize - text.length()).append(ELLIPSIS);
            done = true;
        } else {
            text.append(toAppend);
        }
        return this;
    }

    @Nonnull
    ExplainWriter newLine() {
        return append("\n");
    }

    @Override
    public String toString() {
        return text.toString();
    }
}
