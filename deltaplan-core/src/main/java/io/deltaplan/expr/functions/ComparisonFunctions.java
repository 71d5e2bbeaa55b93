/*
 * ComparisonFunctions.java
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

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;
import java.util.function.IntPredicate;

/**
 * Comparisons between two values of the same type. A comparison involving SQL null is null.
 */
public final class ComparisonFunctions {
    private ComparisonFunctions() {
        // container for the function classes
    }

    abstract static class ComparisonFn extends BinaryOperatorFunction {
        @Nonnull
        private final IntPredicate test;

        ComparisonFn(@Nonnull String functionName, @Nonnull String operator, @Nonnull IntPredicate test) {
            super(functionName, operator, ParameterType.any());
            this.test = test;
        }

        @Nonnull
        @Override
        public Optional<ColumnType> resolveResultType(@Nonnull List<ColumnType> argumentTypes) {
            if (!allSameScalarType(argumentTypes)) {
                return Optional.empty();
            }
            return Optional.of(ColumnType.of(ScalarType.BOOL, anyNullable(argumentTypes)));
        }

        @Nonnull
        @Override
        public Datum evaluate(@Nonnull List<Datum> arguments) {
            if (anyNull(arguments)) {
                return Datum.nullOf(ScalarType.BOOL);
            }
            return Datum.bool(test.test(arguments.get(0).compareTo(arguments.get(1))));
        }
    }

    @AutoService(BuiltInFunction.class)
    public static class EqFn extends ComparisonFn {
        public EqFn() {
            super("eq", "=", c -> c == 0);
        }
    }

    @AutoService(BuiltInFunction.class)
    public static class NotEqFn extends ComparisonFn {
        public NotEqFn() {
            super("not_eq", "!=", c -> c != 0);
        }
    }

    @AutoService(BuiltInFunction.class)
    public static class LtFn extends ComparisonFn {
        public LtFn() {
            super("lt", "<", c -> c < 0);
        }
    }

    @AutoService(BuiltInFunction.class)
    public static class LteFn extends ComparisonFn {
        public LteFn() {
            super("lte", "<=", c -> c <= 0);
        }
    }

    @AutoService(BuiltInFunction.class)
    public static class GtFn extends ComparisonFn {
        public GtFn() {
            super("gt", ">", c -> c > 0);
        }
    }

    @AutoService(BuiltInFunction.class)
    public static class GteFn extends ComparisonFn {
        public GteFn() {
            super("gte", ">=", c -> c >= 0);
        }
    }
}
