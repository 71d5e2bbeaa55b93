/*
 * PlanDslParseException.java
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

package io.deltaplan.dsl;

import io.deltaplan.PlanCoreException;
import io.deltaplan.annotation.API;
import io.deltaplan.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The text handed to {@link PlanDsl} is not a well-formed plan description. Distinct from
 * {@link io.deltaplan.PlanConstructionException}, which reports well-formed requests that break a construction rule.
 */
@SuppressWarnings("serial")
@API(API.Status.STABLE)
public class PlanDslParseException extends PlanCoreException {
    private final int line;
    private final int position;

    public PlanDslParseException(@Nonnull String msg, int line, int position) {
        this(msg, line, position, null);
    }

    public PlanDslParseException(@Nonnull String msg, int line, int position, @Nullable Throwable cause) {
        super(msg + " at " + line + ":" + position, cause);
        this.line = line;
        this.position = position;
        addLogInfo(LogMessageKeys.LINE, line, LogMessageKeys.POSITION, position);
    }

    /**
     * The line of the offending token, starting at 1.
     * @return the line
     */
    public int getLine() {
        return line;
    }

    /**
     * The character position of the offending token within its line, starting at 0.
     * @return the position
     */
    public int getPosition() {
        return position;
    }
}
