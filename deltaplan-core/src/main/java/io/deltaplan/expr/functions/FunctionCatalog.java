/*
 * FunctionCatalog.java
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
import io.deltaplan.types.ScalarType;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.function.Supplier;

/**
 * Registry of the {@link BuiltInFunction}s found on the class path. Functions are loaded once, on first use.
 */
@API(API.Status.EXPERIMENTAL)
public class FunctionCatalog {
    private static final Logger logger = LoggerFactory.getLogger(FunctionCatalog.class);

    private FunctionCatalog() {
        // prevent instantiation
    }

    private static final Supplier<ImmutableMap<FunctionKey, BuiltInFunction>> catalogSupplier =
            Suppliers.memoize(FunctionCatalog::loadFunctions);

    private static ImmutableMap<FunctionKey, BuiltInFunction> getFunctionCatalog() {
        return catalogSupplier.get();
    }

    private static ImmutableMap<FunctionKey, BuiltInFunction> loadFunctions() {
        final ImmutableMap.Builder<FunctionKey, BuiltInFunction> catalogBuilder = ImmutableMap.builder();
        final ServiceLoader<BuiltInFunction> loader = ServiceLoader.load(BuiltInFunction.class);

        loader.forEach(builtInFunction -> {
            catalogBuilder.put(new FunctionKey(builtInFunction.getFunctionName(), builtInFunction.getParameterTypes().size(), builtInFunction.hasVariadicSuffix()), builtInFunction);
            if (logger.isDebugEnabled()) {
                logger.debug("loaded function {}", builtInFunction);
            }
        });

        return catalogBuilder.build();
    }

    /**
     * All registered functions.
     * @return the functions, in no particular order
     */
    @Nonnull
    public static List<BuiltInFunction> getFunctions() {
        return ImmutableList.copyOf(getFunctionCatalog().values());
    }

    /**
     * Find the function a call with the given name and argument types refers to. A fixed-arity function is
     * preferred over a variadic one of the same name.
     * @param functionName the name used in the call
     * @param argumentTypes the scalar types of the arguments
     * @return the function, or empty if no function accepts these arguments
     */
    @Nonnull
    public static Optional<BuiltInFunction> resolveFunction(@Nonnull final String functionName, @Nonnull List<ScalarType> argumentTypes) {
        int numberOfArguments = argumentTypes.size();
        BuiltInFunction builtInFunction = getFunctionCatalog().get(new FunctionKey(functionName, numberOfArguments, false));
        if (builtInFunction == null) {
            // try again as a variadic function
            builtInFunction = getFunctionCatalog().get(new FunctionKey(functionName, numberOfArguments, true));
            if (builtInFunction != null) {
                // at least as many arguments as there are fixed parameters
                if (builtInFunction.getParameterTypes().size() > numberOfArguments) {
                    return Optional.empty();
                }

                final ParameterType variadicSuffixType = Objects.requireNonNull(builtInFunction.getVariadicSuffixType());
                for (int i = builtInFunction.getParameterTypes().size(); i < numberOfArguments; i++) {
                    if (!variadicSuffixType.accepts(argumentTypes.get(i))) {
                        return Optional.empty();
                    }
                }
            }
        }

        if (builtInFunction == null) {
            return Optional.empty();
        }

        final List<ParameterType> parameterTypes = builtInFunction.getParameterTypes();
        for (int i = 0; i < parameterTypes.size(); i ++) {
            if (!parameterTypes.get(i).accepts(argumentTypes.get(i))) {
                return Optional.empty();
            }
        }

        return Optional.of(builtInFunction);
    }

    private static class FunctionKey {
        @Nonnull
        final String functionName;

        final int numParameters;

        final boolean isVariadic;

        public FunctionKey(@Nonnull final String functionName, final int numParameters, final boolean isVariadic) {
            this.functionName = functionName;
            this.numParameters = numParameters;
            this.isVariadic = isVariadic;
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof FunctionKey)) {
                return false;
            }
            final FunctionKey that = (FunctionKey)o;

            if (isVariadic) {
                return that.isVariadic && functionName.equals(that.functionName);
            } else {
                return !that.isVariadic && numParameters == that.numParameters && functionName.equals(that.functionName);
            }
        }

        @Override
        public int hashCode() {
            if (isVariadic) {
                return Objects.hash(functionName);
            } else {
                return Objects.hash(functionName, numParameters);
            }
        }
    }
}
