/*
 * ScalarForm.java
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

package io.deltaplan.plan.construction;

import io.deltaplan.annotation.API;
import io.deltaplan.types.ScalarType;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.util.List;

/**
 * An unvalidated scalar expression in a construction request. Plan construction turns it into a
 * {@link io.deltaplan.expr.ScalarExpr} once the row it is evaluated against is known.
 */
@API(API.Status.STABLE)
public abstract class ScalarForm {
    private ScalarForm() {
    }

    /**
     * The text of this form as written, used to name it in errors.
     * @return the token
     */
    @Nonnull
    public abstract String getToken();

    @Override
    public String toString() {
        return getToken();
    }

    @Nonnull
    public static ColumnForm column(int column) {
        return new ColumnForm(column);
    }

    /**
     * An untyped literal. Its type comes from the position it is used in, or from its value.
     * @param value a {@link Long}, {@link BigDecimal}, {@link String}, {@link Boolean} or {@code null}
     * @return the form
     */
    @Nonnull
    public static LiteralForm literal(@Nullable Object value) {
        return new LiteralForm(normalize(value), null);
    }

    @Nonnull
    public static LiteralForm literal(@Nullable Object value, @Nonnull ScalarType type) {
        return new LiteralForm(normalize(value), type);
    }

    @Nonnull
    public static CallForm call(@Nonnull String functionName, @Nonnull ScalarForm... arguments) {
        return new CallForm(functionName, ImmutableList.copyOf(arguments));
    }

    @Nonnull
    public static CallForm call(@Nonnull String functionName, @Nonnull List<ScalarForm> arguments) {
        return new CallForm(functionName, ImmutableList.copyOf(arguments));
    }

    @Nullable
    private static Object normalize(@Nullable Object value) {
        if (value instanceof Integer || value instanceof Short) {
            return ((Number)value).longValue();
        }
        if (value instanceof Double || value instanceof Float) {
            return new BigDecimal(value.toString());
        }
        return value;
    }

    /**
     * A column reference {@code #n}.
     */
    public static final class ColumnForm extends ScalarForm {
        private final int column;

        private ColumnForm(int column) {
            this.column = column;
        }

        public int getColumn() {
            return column;
        }

        @Nonnull
        @Override
        public String getToken() {
            return "#" + column;
        }
    }

    /**
     * A literal value, optionally with an explicit type.
     */
    public static final class LiteralForm extends ScalarForm {
        @Nullable
        private final Object value;
        @Nullable
        private final ScalarType type;

        private LiteralForm(@Nullable Object value, @Nullable ScalarType type) {
            this.value = value;
            this.type = type;
        }

        @Nullable
        public Object getValue() {
            return value;
        }

        @Nullable
        public ScalarType getType() {
            return type;
        }

        @Nonnull
        @Override
        public String getToken() {
            if (value == null) {
                return "null";
            }
            return value instanceof String ? "\"" + value + "\"" : value.toString();
        }
    }

    /**
     * A call of a built-in function by name.
     */
    public static final class CallForm extends ScalarForm {
        @Nonnull
        private final String functionName;
        @Nonnull
        private final ImmutableList<ScalarForm> arguments;

        private CallForm(@Nonnull String functionName, @Nonnull ImmutableList<ScalarForm> arguments) {
            this.functionName = functionName;
            this.arguments = arguments;
        }

        @Nonnull
        public String getFunctionName() {
            return functionName;
        }

        @Nonnull
        public ImmutableList<ScalarForm> getArguments() {
            return arguments;
        }

        @Nonnull
        @Override
        public String getToken() {
            return functionName;
        }
    }
}
