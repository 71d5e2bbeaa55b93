/*
 * ArithmeticFunctions.java
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

import io.deltaplan.PlanCoreException;
import io.deltaplan.logging.LogMessageKeys;
import io.deltaplan.types.ColumnType;
import io.deltaplan.types.Datum;
import io.deltaplan.types.ScalarType;
import com.google.auto.service.AutoService;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.Optional;

/**
 * Arithmetic over numeric operands. Binary operators require both operands to have the same type and produce
 * that type; integer overflow and division by zero are evaluation errors.
 */
public final class ArithmeticFunctions {
    private ArithmeticFunctions() {
        // container for the function classes
    }

    /**
     * Integer, floating point and decimal forms of one operator.
     */
    interface NumericOperation {
        long applyLong(long left, long right);

        double applyDouble(double left, double right);

        @Nonnull
        BigDecimal applyNumeric(@Nonnull BigDecimal left, @Nonnull BigDecimal right);
    }

    abstract static class ArithmeticOperatorFn extends BinaryOperatorFunction {
        @Nonnull
        private final NumericOperation operation;

        ArithmeticOperatorFn(@Nonnull String functionName, @Nonnull String operator, @Nonnull NumericOperation operation) {
            super(functionName, operator, ParameterType.anyNumeric());
            this.operation = operation;
        }

        @Nonnull
        @Override
        public Optional<ColumnType> resolveResultType(@Nonnull List<ColumnType> argumentTypes) {
            if (!allSameScalarType(argumentTypes)) {
                return Optional.empty();
            }
            return Optional.of(ColumnType.of(argumentTypes.get(0).getScalarType(), anyNullable(argumentTypes)));
        }

        @Nonnull
        @Override
        public Datum evaluate(@Nonnull List<Datum> arguments) {
            final ScalarType type = arguments.get(0).getType();
            if (anyNull(arguments)) {
                return Datum.nullOf(type);
            }
            final Datum left = arguments.get(0);
            final Datum right = arguments.get(1);
            try {
                if (type.isInteger()) {
                    return integerResult(type, operation.applyLong(left.getLong(), right.getLong()));
                } else if (type.isFloatingPoint()) {
                    return Datum.of(type, operation.applyDouble(left.getDouble(), right.getDouble()));
                } else {
                    return Datum.of(type, operation.applyNumeric(left.getNumeric(), right.getNumeric()));
                }
            } catch (ArithmeticException e) {
                throw new PlanCoreException("arithmetic error", e)
                        .addLogInfo(LogMessageKeys.FUNCTION, getFunctionName())
                        .addLogInfo(LogMessageKeys.VALUE, arguments);
            }
        }
    }

    @Nonnull
    static Datum integerResult(@Nonnull ScalarType type, long value) {
        final boolean fits;
        switch (type) {
            case INT16:
                fits = value >= Short.MIN_VALUE && value <= Short.MAX_VALUE;
                break;
            case INT32:
                fits = value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
                break;
            default:
                fits = true;
                break;
        }
        if (!fits) {
            throw new ArithmeticException(type + " out of range");
        }
        return Datum.of(type, value);
    }

    @AutoService(BuiltInFunction.class)
    public static class AddFn extends ArithmeticOperatorFn {
        public AddFn() {
            super("add", "+", new NumericOperation() {
                @Override
                public long applyLong(long left, long right) {
                    return Math.addExact(left, right);
                }

                @Override
                public double applyDouble(double left, double right) {
                    return left + right;
                }

                @Nonnull
                @Override
                public BigDecimal applyNumeric(@Nonnull BigDecimal left, @Nonnull BigDecimal right) {
                    return left.add(right);
                }
            });
        }
    }

    @AutoService(BuiltInFunction.class)
    public static class SubFn extends ArithmeticOperatorFn {
        public SubFn() {
            super("sub", "-", new NumericOperation() {
                @Override
                public long applyLong(long left, long right) {
                    return Math.subtractExact(left, right);
                }

                @Override
                public double applyDouble(double left, double right) {
                    return left - right;
                }

                @Nonnull
                @Override
                public BigDecimal applyNumeric(@Nonnull BigDecimal left, @Nonnull BigDecimal right) {
                    return left.subtract(right);
                }
            });
        }
    }

    @AutoService(BuiltInFunction.class)
    public static class MulFn extends ArithmeticOperatorFn {
        public MulFn() {
            super("mul", "*", new NumericOperation() {
                @Override
                public long applyLong(long left, long right) {
                    return Math.multiplyExact(left, right);
                }

                @Override
                public double applyDouble(double left, double right) {
                    return left * right;
                }

                @Nonnull
                @Override
                public BigDecimal applyNumeric(@Nonnull BigDecimal left, @Nonnull BigDecimal right) {
                    return left.multiply(right);
                }
            });
        }
    }

    @AutoService(BuiltInFunction.class)
    public static class DivFn extends ArithmeticOperatorFn {
        public DivFn() {
            super("div", "/", new NumericOperation() {
                @Override
                public long applyLong(long left, long right) {
                    if (right == 0L) {
                        throw new ArithmeticException("division by zero");
                    }
                    if (left == Long.MIN_VALUE && right == -1L) {
                        throw new ArithmeticException("int64 out of range");
                    }
                    return left / right;
                }

                @Override
                public double applyDouble(double left, double right) {
                    if (right == 0.0d) {
                        throw new ArithmeticException("division by zero");
                    }
                    return left / right;
                }

                @Nonnull
                @Override
                public BigDecimal applyNumeric(@Nonnull BigDecimal left, @Nonnull BigDecimal right) {
                    return left.divide(right, MathContext.DECIMAL128);
                }
            });
        }
    }

    @AutoService(BuiltInFunction.class)
    public static class ModFn extends ArithmeticOperatorFn {
        public ModFn() {
            super("mod", "%", new NumericOperation() {
                @Override
                public long applyLong(long left, long right) {
                    if (right == 0L) {
                        throw new ArithmeticException("division by zero");
                    }
                    return left % right;
                }

                @Override
                public double applyDouble(double left, double right) {
                    if (right == 0.0d) {
                        throw new ArithmeticException("division by zero");
                    }
                    return left % right;
                }

                @Nonnull
                @Override
                public BigDecimal applyNumeric(@Nonnull BigDecimal left, @Nonnull BigDecimal right) {
                    return left.remainder(right);
                }
            });
        }
    }

    abstract static class UnaryNumericFn extends BuiltInFunction {
        UnaryNumericFn(@Nonnull String functionName) {
            super(functionName, ImmutableList.of(ParameterType.anyNumeric()));
        }

        @Nonnull
        @Override
        public Optional<ColumnType> resolveResultType(@Nonnull List<ColumnType> argumentTypes) {
            return Optional.of(argumentTypes.get(0));
        }
    }

    @AutoService(BuiltInFunction.class)
    public static class NegFn extends UnaryNumericFn {
        public NegFn() {
            super("neg");
        }

        @Nonnull
        @Override
        public Datum evaluate(@Nonnull List<Datum> arguments) {
            final Datum argument = arguments.get(0);
            final ScalarType type = argument.getType();
            if (argument.isNull()) {
                return argument;
            }
            if (type.isInteger()) {
                try {
                    return integerResult(type, Math.negateExact(argument.getLong()));
                } catch (ArithmeticException e) {
                    throw new PlanCoreException("arithmetic error", e)
                            .addLogInfo(LogMessageKeys.FUNCTION, getFunctionName())
                            .addLogInfo(LogMessageKeys.VALUE, argument);
                }
            } else if (type.isFloatingPoint()) {
                return Datum.of(type, -argument.getDouble());
            }
            return Datum.of(type, argument.getNumeric().negate());
        }
    }

    @AutoService(BuiltInFunction.class)
    public static class AbsFn extends UnaryNumericFn {
        public AbsFn() {
            super("abs");
        }

        @Nonnull
        @Override
        public Datum evaluate(@Nonnull List<Datum> arguments) {
            final Datum argument = arguments.get(0);
            final ScalarType type = argument.getType();
            if (argument.isNull()) {
                return argument;
            }
            if (type.isInteger()) {
                try {
                    return integerResult(type, Math.absExact(argument.getLong()));
                } catch (ArithmeticException e) {
                    throw new PlanCoreException("arithmetic error", e)
                            .addLogInfo(LogMessageKeys.FUNCTION, getFunctionName())
                            .addLogInfo(LogMessageKeys.VALUE, argument);
                }
            } else if (type.isFloatingPoint()) {
                return Datum.of(type, Math.abs(argument.getDouble()));
            }
            return Datum.of(type, argument.getNumeric().abs());
        }
    }
}
