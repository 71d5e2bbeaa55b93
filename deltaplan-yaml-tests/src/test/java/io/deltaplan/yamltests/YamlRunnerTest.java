/*
 * YamlRunnerTest.java
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
import org.junit.jupiter.api.Test;
import org.opentest4j.AssertionFailedError;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests that {@link YamlRunner} reports broken test files instead of passing them.
 */
public class YamlRunnerTest {

    @Test
    void explainMismatchFailsTheFile() {
        final AssertionFailedError e = assertThrows(AssertionFailedError.class,
                () -> new YamlRunner("runner/wrong-explain.yaml").run());
        assertThat(e.getMessage(), containsString("1 test block(s)"));
        assertThat(e.getCause(), instanceOf(AssertionFailedError.class));
        assertThat(e.getCause().getMessage(), containsString("explain mismatch"));
    }

    @Test
    void unexpectedErrorNamesTheCode() {
        final AssertionFailedError e = assertThrows(AssertionFailedError.class,
                () -> new YamlRunner("runner/unexpected-error.yaml").run());
        assertThat(e.getCause().getMessage(), containsString("failed with P0UR"));
    }

    @Test
    void unknownOptionIsAFormatError() {
        final AssertionFailedError e = assertThrows(AssertionFailedError.class,
                () -> new YamlRunner("runner/unknown-option.yaml").run());
        assertThat(e.getMessage(), containsString("plan_everything"));
    }

    @Test
    void missingFile() {
        final AssertionFailedError e = assertThrows(AssertionFailedError.class,
                () -> new YamlRunner("no-such-file.yaml").run());
        assertThat(e.getMessage(), containsString("no-such-file.yaml"));
    }

    @Test
    void initialConfigurationApplies() {
        // planning disabled from the start leaves the join unimplemented, so the golden explain no longer matches
        assertThrows(AssertionFailedError.class,
                () -> new YamlRunner("join-tests.yaml", PlannerConfiguration.builder().setPlanJoins(false).build()).run());
    }
}
