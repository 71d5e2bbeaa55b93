/*
 * PlanCommand.java
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

package io.deltaplan.yamltests;

import io.deltaplan.PlanComplexityException;
import io.deltaplan.PlanConstructionException;
import io.deltaplan.PlanCoreException;
import io.deltaplan.dsl.PlanDsl;
import io.deltaplan.dsl.PlanDslParseException;
import io.deltaplan.plan.PlanGraph;
import io.deltaplan.plan.planning.PlannerConfiguration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * One test of a {@code test_block}: plan text together with what building it must produce. A test is a list of
 * single-entry maps:
 *
 * <pre>
 * - plan: "(defsource x [int64]) (get x)"
 * - explain: "%0 =\n| Get x (u0)"
 * </pre>
 *
 * <p>
 * {@code explain} compares the whole explain text, {@code explain_contains} a fragment of it, and {@code error}
 * the code of the failure. Construction failures are identified by their error code string, parse failures by
 * {@code PARSE} and plans over the complexity threshold by {@code COMPLEXITY}.
 * </p>
 */
public final class PlanCommand {
    static final String PLAN = "plan";
    static final String EXPLAIN = "explain";
    static final String EXPLAIN_CONTAINS = "explain_contains";
    static final String ERROR = "error";

    static final String PARSE_ERROR = "PARSE";
    static final String COMPLEXITY_ERROR = "COMPLEXITY";

    private static final Logger logger = LogManager.getLogger(PlanCommand.class);

    private final int lineNumber;
    @Nonnull
    private final String planText;
    @Nullable
    private final String expectedExplain;
    @Nullable
    private final String expectedExplainFragment;
    @Nullable
    private final String expectedError;

    private PlanCommand(int lineNumber, @Nonnull String planText, @Nullable String expectedExplain,
                        @Nullable String expectedExplainFragment, @Nullable String expectedError) {
        this.lineNumber = lineNumber;
        this.planText = planText;
        this.expectedExplain = expectedExplain;
        this.expectedExplainFragment = expectedExplainFragment;
        this.expectedError = expectedError;
    }

    @Nonnull
    static PlanCommand parse(@Nonnull Object test) {
        final List<?> entries = Matchers.arrayList(test, "test");
        final Map.Entry<?, ?> planEntry = Matchers.firstEntry(entries.isEmpty() ? null : entries.get(0), "test");
        if (!PLAN.equals(Matchers.key(planEntry))) {
            fail("Illegal Format: a test has to start with a 'plan', found '" + Matchers.key(planEntry) + "'");
        }
        final int lineNumber = Matchers.lineNumber(planEntry);
        String explain = null;
        String explainFragment = null;
        String error = null;
        for (Object config : entries.subList(1, entries.size())) {
            final Map.Entry<?, ?> entry = Matchers.firstEntry(config, "test configuration");
            final String key = Matchers.key(entry);
            switch (key) {
                case EXPLAIN:
                    explain = Matchers.string(entry.getValue(), EXPLAIN);
                    break;
                case EXPLAIN_CONTAINS:
                    explainFragment = Matchers.string(entry.getValue(), EXPLAIN_CONTAINS);
                    break;
                case ERROR:
                    error = Matchers.string(entry.getValue(), ERROR);
                    break;
                default:
                    fail("Illegal Format: unknown test configuration '" + key + "' for plan at line " + lineNumber);
            }
        }
        if (explain == null && explainFragment == null && error == null) {
            fail("Illegal Format: plan at line " + lineNumber + " has nothing to check");
        }
        if (error != null && (explain != null || explainFragment != null)) {
            fail("Illegal Format: plan at line " + lineNumber + " expects both an error and an explain");
        }
        return new PlanCommand(lineNumber, Matchers.string(planEntry.getValue(), PLAN), explain, explainFragment, error);
    }

    int getLineNumber() {
        return lineNumber;
    }

    /**
     * Build the plan and check it against the expectations, failing the running test on a mismatch.
     * @param configuration the planner configuration in effect
     */
    void execute(@Nonnull PlannerConfiguration configuration) {
        logger.debug("⚪️ Planning at line {}", lineNumber);
        final PlanGraph graph;
        try {
            graph = PlanDsl.build(planText, configuration);
        } catch (PlanCoreException e) {
            final String actualError = errorCode(e);
            if (expectedError == null) {
                fail("‼️ plan at line " + lineNumber + " failed with " + actualError, e);
            }
            assertEquals(expectedError, actualError, () -> "‼️ wrong error for plan at line " + lineNumber + ": " + e.getMessage());
            return;
        }
        final String actualExplain = graph.explain();
        if (expectedError != null) {
            fail("‼️ expected error " + expectedError + " for plan at line " + lineNumber + ", but it planned as:\n" + actualExplain);
        }
        if (expectedExplain != null) {
            assertEquals(expectedExplain.stripTrailing(), actualExplain, () -> "‼️ explain mismatch for plan at line " + lineNumber);
        }
        if (expectedExplainFragment != null) {
            assertTrue(actualExplain.contains(expectedExplainFragment.stripTrailing()),
                    () -> "‼️ explain of plan at line " + lineNumber + " does not contain '" + expectedExplainFragment
                            + "':\n" + actualExplain);
        }
    }

    @Nonnull
    private static String errorCode(@Nonnull PlanCoreException e) {
        if (e instanceof PlanConstructionException) {
            return ((PlanConstructionException)e).getErrorCode().getCodeString();
        } else if (e instanceof PlanDslParseException) {
            return PARSE_ERROR;
        } else if (e instanceof PlanComplexityException) {
            return COMPLEXITY_ERROR;
        }
        throw e;
    }
}
