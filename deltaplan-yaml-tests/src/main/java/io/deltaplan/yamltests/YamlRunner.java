/*
 * YamlRunner.java
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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.Assertions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs a YAML test file from the class path. The file is a stream of documents, each a {@code config} or a
 * {@code test_block} (see {@link Block}). Every test block runs even if an earlier one fails; the run fails at the
 * end if any of them did.
 */
@SuppressWarnings({"PMD.GuardLogStatement"})
public final class YamlRunner {

    private static final Logger logger = LogManager.getLogger(YamlRunner.class);

    @Nonnull
    private final String resourcePath;
    @Nonnull
    private final YamlExecutionContext executionContext;

    public YamlRunner(@Nonnull String resourcePath) {
        this(resourcePath, PlannerConfiguration.defaultPlannerConfiguration());
    }

    public YamlRunner(@Nonnull String resourcePath, @Nonnull PlannerConfiguration initialConfiguration) {
        this.resourcePath = resourcePath;
        this.executionContext = new YamlExecutionContext(resourcePath, initialConfiguration);
    }

    public void run() throws IOException {
        final LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setAllowDuplicateKeys(false);
        final Yaml yaml = new Yaml(new CustomYamlConstructor(loaderOptions));

        final List<Object> documents = new ArrayList<>();
        try (InputStream inputStream = getInputStream(resourcePath)) {
            yaml.loadAll(inputStream).forEach(documents::add);
        }

        final List<Block> blocks = new ArrayList<>();
        for (Object document : documents) {
            if (document != null) {
                blocks.add(Block.parse(document, executionContext));
            }
        }
        if (blocks.stream().noneMatch(block -> block instanceof Block.TestBlock)) {
            Assertions.fail("Illegal Format: " + resourcePath + " has no test_block");
        }

        final List<Block.TestBlock> testBlocks = new ArrayList<>();
        for (Block block : blocks) {
            logger.debug("⚪️ Executing block at line {} in {}", block.getLineNumber(), resourcePath);
            block.execute();
            if (block instanceof Block.TestBlock) {
                testBlocks.add((Block.TestBlock)block);
            }
        }
        evaluateTestBlockResults(testBlocks);
    }

    private void evaluateTestBlockResults(@Nonnull List<Block.TestBlock> testBlocks) {
        int failures = 0;
        Throwable firstFailure = null;
        logger.info("--------------------------------------------------------------------------------------------------------------");
        logger.info("TEST RESULTS {}", resourcePath);
        logger.info("--------------------------------------------------------------------------------------------------------------");
        for (int i = 0; i < testBlocks.size(); i++) {
            final Block.TestBlock testBlock = testBlocks.get(i);
            final Optional<Throwable> failure = testBlock.getFailure();
            if (failure.isEmpty()) {
                logger.info("🟢 TestBlock {}/{} '{}' runs successfully", i + 1, testBlocks.size(), testBlock.getName());
            } else {
                logger.error("🔴 TestBlock {}/{} '{}' (at line {}) fails", i + 1, testBlocks.size(), testBlock.getName(),
                        testBlock.getLineNumber());
                logger.error("Error:", failure.get());
                if (firstFailure == null) {
                    firstFailure = failure.get();
                }
                failures++;
            }
        }
        if (failures > 0) {
            logger.error("⚠️ Some TestBlocks in {} do not pass.", resourcePath);
            Assertions.fail(failures + " test block(s) in " + resourcePath + " failed", firstFailure);
        } else {
            logger.info("🟢 All tests in {} pass successfully.", resourcePath);
        }
    }

    @Nonnull
    private static InputStream getInputStream(@Nonnull String resourcePath) {
        final ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        final InputStream inputStream = classLoader.getResourceAsStream(resourcePath);
        if (inputStream == null) {
            return Assertions.fail(String.format("could not find '%s' in resources bundle", resourcePath));
        }
        return inputStream;
    }
}
