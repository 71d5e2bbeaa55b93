/*
 * BuiltInFunction.java
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

import io.deltaplan.annotation.API;
import io.deltaplan.types.ColumnType;
import io.deltaplan.types.Datum;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Main interface for defining a built-in scalar function. Implementations register themselves through
 * {@link java.util.ServiceLoader} and are found by name through the {@link FunctionCatalog}.
 *
 * <p>
 * A function declares its fixed parameter types and optionally a variadic suffix. The catalog only checks
 * arguments against those declarations; rules that relate arguments to each other, such as arithmetic operands
 * sharing one type, live in {@link #resolveResultType(List)}.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public abstract class BuiltInFunction {
    /**
     * Parameter shape of a function.
     */
    public enum Shape {
        UNARY,
        BINARY,
        VARIADIC
    }

    @Nonnull
    final String functionName;

    @Nonnull
    final List<ParameterType> parameterTypes;

    @Nullable
    final ParameterType variadicSuffixType;

    protected BuiltInFunction(@Nonnull final String functionName, @Nonnull final List<ParameterType> parameterTypes) {
        this(functionName, parameterTypes, null);
    }

    protected BuiltInFunction(@Nonnull final String functionName, @Nonnull final List<ParameterType> parameterTypes, @Nullable final ParameterType variadicSuffixType) {
        this.functionName = functionName;
        this.parameterTypes = ImmutableList.copyOf(parameterTypes);
        this.variadicSuffixType = variadicSuffixType;
    }

    @Nonnull
    public String getFunctionName() {
        return functionName;
    }

    @Nonnull
    public List<ParameterType> getParameterTypes() {
        return parameterTypes;
    }

    @Nullable
    public ParameterType getVariadicSuffixType() {
        return variadicSuffixType;
    }

    public boolean hasVariadicSuffix() {
        return variadicSuffixType != null;
    }

    @Nonnull
    public Shape getShape() {
        if (hasVariadicSuffix()) {
            return Shape.VARIADIC;
        }
        return parameterTypes.size() == 1 ? Shape.UNARY : Shape.BINARY;
    }

    /**
     * Compute the type of a call given the types of its arguments. The argument count and the declared parameter
     * types have already been checked by the catalog.
     * @param argumentTypes the argument types
     * @return the result type, or empty if this combination of arguments is not valid
     */
    @Nonnull
    public abstract Optional<ColumnType> resolveResultType(@Nonnull List<ColumnType> argumentTypes);

    /**
     * Compute the value of a call on well-typed arguments.
     * @param arguments the argument values
     * @return the result value
     */
    @Nonnull
    public abstract Datum evaluate(@Nonnull List<Datum> arguments);

    /**
     * The name used when rendering a call. Defaults to the catalog name.
     * @return the display name
     */
    @Nonnull
    public String getDisplayName() {
        return functionName;
    }

    /**
     * Render a call to this function.
     * @param renderedArguments the arguments, already rendered
     * @return the rendered call
     */
    @Nonnull
    public String explain(@Nonnull List<String> renderedArguments) {
        return getDisplayName() + "(" + String.join(", ", renderedArguments) + ")";
    }

    protected static boolean anyNullable(@Nonnull List<ColumnType> argumentTypes) {
        return argumentTypes.stream().anyMatch(ColumnType::isNullable);
    }

    protected static boolean anyNull(@Nonnull List<Datum> arguments) {
        return arguments.stream().anyMatch(Datum::isNull);
    }

    protected static boolean allSameScalarType(@Nonnull List<ColumnType> argumentTypes) {
        return argumentTypes.stream().map(ColumnType::getScalarType).distinct().count() <= 1;
    }

    @Nonnull
    @Override
    public String toString() {
        return functionName + "(" + parameterTypes.stream().map(Object::toString).collect(Collectors.joining(","))
               + (hasVariadicSuffix() ? "," + variadicSuffixType + "..." : "") + ")";
    }
}
