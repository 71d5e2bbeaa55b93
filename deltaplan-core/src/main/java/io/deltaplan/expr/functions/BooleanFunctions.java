/*
 * BooleanFunctions.java
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
 * Boolean connectives with SQL three-valued logic.
 */
public final class BooleanFunctions {
    private BooleanFunctions() {
        // container for the function classes
    }

    @AutoService(BuiltInFunction.class)
    public static class NotFn extends BuiltInFunction {
        public NotFn() {
            super("not", ImmutableList.of(ParameterType.of(ScalarType.BOOL)));
        }

        @Nonnull
        @Override
        public Optional<ColumnType> resolveResultType(@Nonnull List<ColumnType> argumentTypes) {
            return Optional.of(argumentTypes.get(0));
        }

        @Nonnull
        @Override
        public Datum evaluate(@Nonnull List<Datum> arguments) {
            final Datum argument = arguments.get(0);
            return argument.isNull() ? argument : Datum.bool(!argument.isTrue());
        }
    }

    abstract static class ConnectiveFn extends BinaryOperatorFunction {
        private final boolean dominant;

        /**
         * Create a connective.
         * @param dominant the value that decides the result regardless of the other operand, {@code false} for
         * {@code and} and {@code true} for {@code or}
         */
        ConnectiveFn(@Nonnull String functionName, boolean dominant) {
            super(functionName, functionName, ParameterType.of(ScalarType.BOOL));
            this.dominant = dominant;
        }

        @Nonnull
        @Override
        public Optional<ColumnType> resolveResultType(@Nonnull List<ColumnType> argumentTypes) {
            return Optional.of(ColumnType.of(ScalarType.BOOL, anyNullable(argumentTypes)));
        }

        @Nonnull
        @Override
        public Datum evaluate(@Nonnull List<Datum> arguments) {
            boolean sawNull = false;
            for (Datum argument : arguments) {
                if (argument.isNull()) {
                    sawNull = true;
                } else if (argument.isTrue() == dominant) {
                    return Datum.bool(dominant);
                }
            }
            return sawNull ? Datum.nullOf(ScalarType.BOOL) : Datum.bool(!dominant);
        }
    }

    @AutoService(BuiltInFunction.class)
    public static class AndFn extends ConnectiveFn {
        public AndFn() {
            super("and", false);
        }
    }

    @AutoService(BuiltInFunction.class)
    public static class OrFn extends ConnectiveFn {
        public OrFn() {
            super("or", true);
        }
    }
}
