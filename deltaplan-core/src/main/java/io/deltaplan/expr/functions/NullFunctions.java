/*
 * NullFunctions.java
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

package io.deltaplan.expr.functions;

import io.deltaplan.types.ColumnType;
import io.deltaplan.types.Datum;
import io.deltaplan.types.ScalarType;
import com.google.auto.service.AutoService;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;

/**
 * Functions that observe SQL null instead of propagating it.
 */
public final class NullFunctions {
    private NullFunctions() {
        // container for the function classes
    }

    @AutoService(BuiltInFunction.class)
    public static class IsNullFn extends BuiltInFunction {
        public IsNullFn() {
            super("is_null", ImmutableList.of(ParameterType.any()));
        }

        @Nonnull
        @Override
        public String getDisplayName() {
            return "isnull";
        }

        @Nonnull
        @Override
        public Optional<ColumnType> resolveResultType(@Nonnull List<ColumnType> argumentTypes) {
            return Optional.of(ColumnType.of(ScalarType.BOOL));
        }

        @Nonnull
        @Override
        public Datum evaluate(@Nonnull List<Datum> arguments) {
            return Datum.bool(arguments.get(0).isNull());
        }
    }

    /**
     * The first non-null argument. The result is nullable only when every argument is.
     */
    @AutoService(BuiltInFunction.class)
    public static class CoalesceFn extends BuiltInFunction {
        public CoalesceFn() {
            super("coalesce", ImmutableList.of(ParameterType.any()), ParameterType.any());
        }

        @Nonnull
        @Override
        public Optional<ColumnType> resolveResultType(@Nonnull List<ColumnType> argumentTypes) {
            if (!allSameScalarType(argumentTypes)) {
                return Optional.empty();
            }
            final boolean nullable = argumentTypes.stream().allMatch(ColumnType::isNullable);
            return Optional.of(ColumnType.of(argumentTypes.get(0).getScalarType(), nullable));
        }

        @Nonnull
        @Override
        public Datum evaluate(@Nonnull List<Datum> arguments) {
            for (Datum argument : arguments) {
                if (!argument.isNull()) {
                    return argument;
                }
            }
            return arguments.get(0);
        }
    }
}
