/*
 * PlanConstructionException.java
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

package io.deltaplan;

import io.deltaplan.annotation.API;
import io.deltaplan.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A construction request was rejected. The {@link ErrorCode} says which rule the request broke; the log info
 * names the offending node, column, binding or function so that the failure can be reproduced.
 * Construction is all-or-nothing, so no part of the plan graph is observable after this is thrown.
 */
@SuppressWarnings("serial")
@API(API.Status.STABLE)
public class PlanConstructionException extends PlanCoreException {
    @Nonnull
    private final ErrorCode errorCode;

    public PlanConstructionException(@Nonnull ErrorCode errorCode, @Nonnull String msg, @Nullable Object ... keyValues) {
        super(msg, keyValues);
        this.errorCode = errorCode;
        addLogInfo(LogMessageKeys.CODE, errorCode.getCodeString());
    }

    @Nonnull
    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * The kinds of construction failure.
     */
    public enum ErrorCode {
        /** A {@code Get} names neither a source nor a binding in scope. */
        UNRESOLVED_REFERENCE("P0UR"),
        /** A column reference is not below the arity it is evaluated against. */
        COLUMN_OUT_OF_RANGE("P0CR"),
        /** A column reference appears where only a literal value is accepted. */
        INVALID_LITERAL_CONTEXT("P0LC"),
        /** A join equivalence references fewer than two inputs, or a join has no inputs. */
        MALFORMED_CONSTRAINT("P0MC"),
        /** Some input of a join cannot be reached through equivalences from every other input. */
        NO_VALID_JOIN_STRATEGY("P0NJ"),
        /** A binding refers to itself. */
        CYCLIC_REFERENCE("P0CY"),
        /** A value or expression does not have the type its position requires. */
        TYPE_MISMATCH("P0TM"),
        /** A function name, argument count or argument type does not resolve in the function catalog. */
        INVALID_FUNCTION_CALL("P0FC"),
        /** A join implementation supplied with the request is not a valid delta query for that join. */
        INVALID_JOIN_IMPLEMENTATION("P0JI"),
        /** A source name is declared more than once. */
        DUPLICATE_DEFINITION("P0DD"),
        /** A scalar parameter (such as a limit or an offset) is out of its domain. */
        INVALID_ARGUMENT("P0IA");

        @Nonnull
        private final String codeString;

        ErrorCode(@Nonnull String codeString) {
            this.codeString = codeString;
        }

        @Nonnull
        public String getCodeString() {
            return codeString;
        }
    }
}
