/*
 * CastFunctions.java
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
 * Explicit conversions between scalar types. There is no implicit widening anywhere else, so mixing types in
 * arithmetic or comparisons requires one of these.
 */
public final class CastFunctions {
    private CastFunctions() {
        // container for the function classes
    }

    abstract static class CastFn extends BuiltInFunction {
        @Nonnull
        private final String displayName;
        @Nonnull
        private final ScalarType targetType;

        CastFn(@Nonnull String functionName, @Nonnull String displayName, @Nonnull ScalarType sourceType, @Nonnull ScalarType targetType) {
            super(functionName, ImmutableList.of(ParameterType.of(sourceType)));
            this.displayName = displayName;
            this.targetType = targetType;
        }

        @Nonnull
        @Override
        public String getDisplayName() {
            return displayName;
        }

        @Nonnull
        @Override
        public Optional<ColumnType> resolveResultType(@Nonnull List<ColumnType> argumentTypes) {
            return Optional.of(ColumnType.of(targetType, argumentTypes.get(0).isNullable()));
        }

        @Nonnull
        @Override
        public Datum evaluate(@Nonnull List<Datum> arguments) {
            final Datum argument = arguments.get(0);
            return argument.isNull() ? Datum.nullOf(targetType) : convert(argument);
        }

        @Nonnull
        protected abstract Datum convert(@Nonnull Datum argument);
    }

    @AutoService(BuiltInFunction.class)
    public static class CastInt32ToInt64Fn extends CastFn {
        public CastInt32ToInt64Fn() {
            super("cast_int32_to_int64", "i32toi64", ScalarType.INT32, ScalarType.INT64);
        }

        @Nonnull
        @Override
        protected Datum convert(@Nonnull Datum argument) {
            return Datum.int64(argument.getLong());
        }
    }

    @AutoService(BuiltInFunction.class)
    public static class CastInt64ToFloat64Fn extends CastFn {
        public CastInt64ToFloat64Fn() {
            super("cast_int64_to_float64", "i64tof64", ScalarType.INT64, ScalarType.FLOAT64);
        }

        @Nonnull
        @Override
        protected Datum convert(@Nonnull Datum argument) {
            return Datum.float64((double)argument.getLong());
        }
    }

    @AutoService(BuiltInFunction.class)
    public static class CastInt64ToStringFn extends CastFn {
        public CastInt64ToStringFn() {
            super("cast_int64_to_string", "i64tostr", ScalarType.INT64, ScalarType.STRING);
        }

        @Nonnull
        @Override
        protected Datum convert(@Nonnull Datum argument) {
            return Datum.string(Long.toString(argument.getLong()));
        }
    }
}
