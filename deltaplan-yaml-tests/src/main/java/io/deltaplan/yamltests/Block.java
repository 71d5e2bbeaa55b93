/*
 * Block.java
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

import io.deltaplan.plan.planning.PlannerConfiguration;
import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * Block is a single document of a YAML test file. It is either a {@link ConfigBlock} or a {@link TestBlock}.
 * <ul>
 *      <li>{@link ConfigBlock}: changes the planner configuration used by the test blocks that follow it.</li>
 *      <li>{@link TestBlock}: a named group of plan tests, run in order.</li>
 * </ul>
 */
public abstract class Block {

    private static final Logger logger = LogManager.getLogger(Block.class);

    private final int lineNumber;
    @Nonnull
    final YamlExecutionContext executionContext;

    Block(int lineNumber, @Nonnull YamlExecutionContext executionContext) {
        this.lineNumber = lineNumber;
        this.executionContext = executionContext;
    }

    int getLineNumber() {
        return lineNumber;
    }

    public abstract void execute();

    /**
     * Looks at the document to determine which kind of block it is, and parses it as that kind.
     *
     * @param document a document of the file
     * @param executionContext state shared by the blocks of the file
     *
     * @return a parsed block
     */
    @Nonnull
    public static Block parse(@Nonnull Object document, @Nonnull YamlExecutionContext executionContext) {
        final Map<?, ?> blockObject = Matchers.map(document, "block");
        if (blockObject.size() != 1) {
            fail("Illegal Format: a block has exactly one key, found " + blockObject.keySet());
        }
        final Map.Entry<?, ?> entry = Matchers.firstEntry(blockObject, "block");
        final String key = Matchers.key(entry);
        switch (key) {
            case ConfigBlock.CONFIG_BLOCK:
                return new ConfigBlock(Matchers.lineNumber(entry), entry.getValue(), executionContext);
            case TestBlock.TEST_BLOCK:
                return new TestBlock(Matchers.lineNumber(entry), entry.getValue(), executionContext);
            default:
                return fail("Cannot recognize the type of block '" + key + "'");
        }
    }

    /**
     * Sets planner options for the rest of the file. Options not named keep their current value.
     *
     * <pre>
     * config:
     *   plan_joins: false
     *   prefer_arranged_inputs: true
     *   complexity_threshold: 100
     * </pre>
     */
    static final class ConfigBlock extends Block {
        static final String CONFIG_BLOCK = "config";
        static final String PLAN_JOINS = "plan_joins";
        static final String PREFER_ARRANGED_INPUTS = "prefer_arranged_inputs";
        static final String COMPLEXITY_THRESHOLD = "complexity_threshold";

        @Nullable
        private Boolean planJoins;
        @Nullable
        private Boolean preferArrangedInputs;
        @Nullable
        private Integer complexityThreshold;

        private ConfigBlock(int lineNumber, @Nullable Object options, @Nonnull YamlExecutionContext executionContext) {
            super(lineNumber, executionContext);
            for (Map.Entry<?, ?> option : Matchers.map(options, CONFIG_BLOCK).entrySet()) {
                final String name = Matchers.key(option);
                switch (name) {
                    case PLAN_JOINS:
                        planJoins = Matchers.bool(option.getValue(), name);
                        break;
                    case PREFER_ARRANGED_INPUTS:
                        preferArrangedInputs = Matchers.bool(option.getValue(), name);
                        break;
                    case COMPLEXITY_THRESHOLD:
                        complexityThreshold = Matchers.intValue(option.getValue(), name);
                        break;
                    default:
                        fail("Illegal Format: unknown option '" + name + "' in config block at line " + lineNumber);
                }
            }
        }

        @Override
        public void execute() {
            final PlannerConfiguration.Builder builder = executionContext.getPlannerConfiguration().asBuilder();
            if (planJoins != null) {
                builder.setPlanJoins(planJoins);
            }
            if (preferArrangedInputs != null) {
                builder.setPreferArrangedInputs(preferArrangedInputs);
            }
            if (complexityThreshold != null) {
                builder.setComplexityThreshold(complexityThreshold);
            }
            final PlannerConfiguration configuration = builder.build();
            logger.debug("⚪️ Applying planner configuration {}", configuration);
            executionContext.setPlannerConfiguration(configuration);
        }
    }

    /**
     * A named list of plan tests. A failing test does not stop the tests after it; the first failure is kept and
     * reported once the whole file has run.
     *
     * <pre>
     * test_block:
     *   name: joins
     *   tests:
     *     -
     *       - plan: ...
     *       - explain: ...
     * </pre>
     */
    static final class TestBlock extends Block {
        static final String TEST_BLOCK = "test_block";
        static final String NAME = "name";
        static final String TESTS = "tests";

        @Nonnull
        private final String name;
        @Nonnull
        private final List<PlanCommand> commands;
        @Nullable
        private Throwable failure;

        private TestBlock(int lineNumber, @Nullable Object body, @Nonnull YamlExecutionContext executionContext) {
            super(lineNumber, executionContext);
            final Map<?, ?> blockMap = Matchers.map(body, TEST_BLOCK);
            String blockName = "unnamed";
            List<?> tests = null;
            for (Map.Entry<?, ?> entry : blockMap.entrySet()) {
                final String key = Matchers.key(entry);
                if (NAME.equals(key)) {
                    blockName = Matchers.string(entry.getValue(), NAME);
                } else if (TESTS.equals(key)) {
                    tests = Matchers.arrayList(entry.getValue(), TESTS);
                } else {
                    fail("Illegal Format: unknown key '" + key + "' in test block at line " + lineNumber);
                }
            }
            if (tests == null) {
                fail("Illegal Format: test block at line " + lineNumber + " has no tests");
            }
            this.name = blockName;
            final ImmutableList.Builder<PlanCommand> commandsBuilder = ImmutableList.builder();
            for (Object test : tests) {
                commandsBuilder.add(PlanCommand.parse(test));
            }
            this.commands = commandsBuilder.build();
        }

        @Nonnull
        String getName() {
            return name;
        }

        @Override
        public void execute() {
            final PlannerConfiguration configuration = executionContext.getPlannerConfiguration();
            for (PlanCommand command : commands) {
                try {
                    command.execute(configuration);
                } catch (AssertionError | RuntimeException e) {
                    logger.debug("🔴 Plan at line {} of {} fails", command.getLineNumber(), executionContext.getResourcePath());
                    if (failure == null) {
                        failure = e;
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
        }

        @Nonnull
        Optional<Throwable> getFailure() {
            return Optional.ofNullable(failure);
        }
    }
}
