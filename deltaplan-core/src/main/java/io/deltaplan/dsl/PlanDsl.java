/*
 * PlanDsl.java
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

package io.deltaplan.dsl;

import io.deltaplan.annotation.API;
import io.deltaplan.plan.PlanGraph;
import io.deltaplan.plan.construction.ConstructionRequest;
import io.deltaplan.plan.construction.PlanBuilder;
import io.deltaplan.plan.planning.PlannerConfiguration;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

import javax.annotation.Nonnull;

/**
 * Entry point of the textual plan language, an S-expression rendering of construction requests:
 *
 * <pre>
 * (defsource x [int64 int64 (string null)])
 * (join [(get x) (get x)] [[#0 #3]] (demand [#0 #1]))
 * (top_k (get x) [#1] [#0 (#2 desc)] 5 1)
 * </pre>
 *
 * <p>
 * {@link #parse(String)} only checks syntax; {@link #build(String)} also constructs and validates the plan graph.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class PlanDsl {
    private PlanDsl() {
        // utility class
    }

    /**
     * Parse plan text into a construction request.
     * @param text the plan text
     * @return the request
     * @throws PlanDslParseException if the text is not well formed
     */
    @Nonnull
    public static ConstructionRequest parse(@Nonnull String text) {
        final PlanDslLexer lexer = new PlanDslLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);
        final PlanDslParser parser = new PlanDslParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);
        return new PlanDslVisitorImpl().visitRequestForms(parser.request());
    }

    @Nonnull
    public static PlanGraph build(@Nonnull String text) {
        return build(text, PlannerConfiguration.defaultPlannerConfiguration());
    }

    /**
     * Parse plan text and construct its plan graph.
     * @param text the plan text
     * @param configuration the planner configuration
     * @return the plan graph
     * @throws PlanDslParseException if the text is not well formed
     * @throws io.deltaplan.PlanConstructionException if the request breaks a construction rule
     */
    @Nonnull
    public static PlanGraph build(@Nonnull String text, @Nonnull PlannerConfiguration configuration) {
        return new PlanBuilder(configuration).build(parse(text));
    }

    /**
     * Turns ANTLR syntax errors into {@link PlanDslParseException}s.
     */
    private static final class ThrowingErrorListener extends BaseErrorListener {
        private static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine,
                                String msg, RecognitionException e) {
            throw new PlanDslParseException(msg, line, charPositionInLine, e);
        }
    }
}
