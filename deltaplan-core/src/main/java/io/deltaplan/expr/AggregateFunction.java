/*
 * AggregateFunction.java
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

package io.deltaplan.expr;

import io.deltaplan.annotation.API;
import io.deltaplan.types.ColumnType;
import io.deltaplan.types.ScalarType;

import javax.annotation.Nonnull;
import java.util.Locale;
import java.util.Optional;

/**
 * Aggregate functions available to {@code Reduce}. Result types follow the input column's declared type;
 * there is no implicit widening.
 */
@API(API.Status.STABLE)
public enum AggregateFunction {
    COUNT,
    SUM,
    MIN,
    MAX,
    ANY,
    ALL;

    @Nonnull
    public String getFunctionName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Nonnull
    public static Optional<AggregateFunction> forName(@Nonnull String name) {
        for (AggregateFunction function : values()) {
            if (function.getFunctionName().equals(name)) {
                return Optional.of(function);
            }
        }
        return Optional.empty();
    }

    /**
     * The type produced for an input column of the given type.
     * @param inputType the type of the aggregated column
     * @return the result type, or empty if the function does not accept the input type
     */
    @Nonnull
    public Optional<ColumnType> resultType(@Nonnull ColumnType inputType) {
        final ScalarType scalarType = inputType.getScalarType();
        switch (this) {
            case COUNT:
                return Optional.of(ColumnType.of(ScalarType.INT64));
            case SUM:
                // the sum of an empty or all-null group is null
                return scalarType.isNumeric() ? Optional.of(ColumnType.nullable(scalarType)) : Optional.empty();
            case MIN:
            case MAX:
                return Optional.of(ColumnType.nullable(scalarType));
            case ANY:
            case ALL:
                return scalarType == ScalarType.BOOL ? Optional.of(inputType) : Optional.empty();
            default:
                throw new IllegalStateException("unknown aggregate function " + this);
        }
    }
}
