/*
 * ScalarResolver.java
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

import io.deltaplan.PlanConstructionException;
import io.deltaplan.PlanConstructionException.ErrorCode;
import io.deltaplan.expr.CallExpr;
import io.deltaplan.expr.ColumnExpr;
import io.deltaplan.expr.LiteralExpr;
import io.deltaplan.expr.ScalarExpr;
import io.deltaplan.expr.functions.BuiltInFunction;
import io.deltaplan.expr.functions.FunctionCatalog;
import io.deltaplan.logging.LogMessageKeys;
import io.deltaplan.types.ColumnType;
import io.deltaplan.types.Datum;
import io.deltaplan.types.RelationType;
import io.deltaplan.types.ScalarType;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Optional;

/**
 * Validates {@link ScalarForm}s against the row they are evaluated over and turns them into typed
 * {@link ScalarExpr}s.
 */
final class ScalarResolver {
    private ScalarResolver() {
        // utility class
    }

    /**
     * Resolve a scalar expression over a row.
     * @param form the expression
     * @param rowType the type of the row it reads
     * @return the typed expression
     * @throws PlanConstructionException if a column is out of range, a function call does not resolve or a literal
     * has no valid type
     */
    @Nonnull
    static ScalarExpr resolve(@Nonnull ScalarForm form, @Nonnull RelationType rowType) {
        if (form instanceof ScalarForm.ColumnForm) {
            final int column = ((ScalarForm.ColumnForm)form).getColumn();
            checkColumn(column, rowType.getArity(), form.getToken());
            return new ColumnExpr(column, rowType.getColumnType(column));
        }
        if (form instanceof ScalarForm.LiteralForm) {
            return new LiteralExpr(resolveFreeLiteral((ScalarForm.LiteralForm)form));
        }
        final ScalarForm.CallForm call = (ScalarForm.CallForm)form;
        final ImmutableList.Builder<ScalarExpr> arguments = ImmutableList.builder();
        final ImmutableList.Builder<ColumnType> argumentTypes = ImmutableList.builder();
        final ImmutableList.Builder<ScalarType> scalarTypes = ImmutableList.builder();
        for (ScalarForm argumentForm : call.getArguments()) {
            final ScalarExpr argument = resolve(argumentForm, rowType);
            arguments.add(argument);
            argumentTypes.add(argument.getType());
            scalarTypes.add(argument.getType().getScalarType());
        }
        final ImmutableList<ScalarType> types = scalarTypes.build();
        final Optional<BuiltInFunction> function = FunctionCatalog.resolveFunction(call.getFunctionName(), types);
        final Optional<ColumnType> resultType = function.flatMap(fn -> fn.resolveResultType(argumentTypes.build()));
        if (resultType.isEmpty()) {
            throw new PlanConstructionException(ErrorCode.INVALID_FUNCTION_CALL,
                    "function call does not resolve",
                    LogMessageKeys.FUNCTION, call.getFunctionName(),
                    LogMessageKeys.ARGUMENT_TYPES, types);
        }
        return new CallExpr(function.get(), arguments.build(), resultType.get());
    }

    /**
     * Resolve a value of a constant row against its declared column type.
     * @param form the value
     * @param columnType the declared type of the column
     * @return the datum
     * @throws PlanConstructionException with {@link ErrorCode#INVALID_LITERAL_CONTEXT} if the value is not a
     * literal, or {@link ErrorCode#TYPE_MISMATCH} if it does not fit the column
     */
    @Nonnull
    static Datum resolveLiteral(@Nonnull ScalarForm form, @Nonnull ColumnType columnType) {
        if (!(form instanceof ScalarForm.LiteralForm)) {
            throw new PlanConstructionException(ErrorCode.INVALID_LITERAL_CONTEXT,
                    "only literal values are allowed here",
                    LogMessageKeys.TOKEN, form.getToken());
        }
        final ScalarForm.LiteralForm literal = (ScalarForm.LiteralForm)form;
        final ScalarType explicitType = literal.getType();
        if (explicitType != null && explicitType != columnType.getScalarType()) {
            throw typeMismatch(literal, columnType.getScalarType(), explicitType);
        }
        if (literal.getValue() == null && !columnType.isNullable()) {
            throw new PlanConstructionException(ErrorCode.TYPE_MISMATCH,
                    "null value in non-nullable column",
                    LogMessageKeys.TOKEN, literal.getToken(),
                    LogMessageKeys.EXPECTED_TYPE, columnType);
        }
        return coerce(literal, columnType.getScalarType());
    }

    @Nonnull
    private static Datum resolveFreeLiteral(@Nonnull ScalarForm.LiteralForm literal) {
        final ScalarType explicitType = literal.getType();
        if (explicitType != null) {
            return coerce(literal, explicitType);
        }
        final Optional<ScalarType> defaultType = Datum.defaultTypeOf(literal.getValue());
        if (defaultType.isEmpty()) {
            throw new PlanConstructionException(ErrorCode.TYPE_MISMATCH,
                    "literal has no type",
                    LogMessageKeys.TOKEN, literal.getToken());
        }
        return coerce(literal, defaultType.get());
    }

    @Nonnull
    private static Datum coerce(@Nonnull ScalarForm.LiteralForm literal, @Nonnull ScalarType type) {
        final Optional<Datum> datum = Datum.coerce(type, literal.getValue());
        if (datum.isEmpty()) {
            throw typeMismatch(literal, type, Datum.defaultTypeOf(literal.getValue()).orElse(null));
        }
        return datum.get();
    }

    @Nonnull
    private static PlanConstructionException typeMismatch(@Nonnull ScalarForm.LiteralForm literal, @Nonnull ScalarType expected,
                                                          @Nullable ScalarType actual) {
        return new PlanConstructionException(ErrorCode.TYPE_MISMATCH,
                "literal does not fit type",
                LogMessageKeys.TOKEN, literal.getToken(),
                LogMessageKeys.EXPECTED_TYPE, expected,
                LogMessageKeys.ACTUAL_TYPE, actual);
    }

    static void checkColumn(int column, int arity, @Nonnull String token) {
        if (column < 0 || column >= arity) {
            throw new PlanConstructionException(ErrorCode.COLUMN_OUT_OF_RANGE,
                    "column reference out of range",
                    LogMessageKeys.TOKEN, token,
                    LogMessageKeys.COLUMN, column,
                    LogMessageKeys.ARITY, arity);
        }
    }
}
