/*
 * EquivalenceClassesTest.java
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

package io.deltaplan.plan.planning;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for {@link EquivalenceClasses}.
 */
public class EquivalenceClassesTest {
    @Test
    void sortsAndDeduplicates() {
        assertThat(EquivalenceClasses.canonicalize(List.of(List.of(3, 0, 3))),
                contains(List.of(0, 3)));
    }

    @Test
    void mergesOverlappingClasses() {
        assertThat(EquivalenceClasses.canonicalize(List.of(List.of(5, 7), List.of(1, 2), List.of(2, 5))),
                contains(List.of(1, 2, 5, 7)));
        assertThat(EquivalenceClasses.canonicalize(List.of(List.of(0, 1), List.of(2, 3), List.of(4, 5), List.of(3, 4))),
                contains(List.of(0, 1), List.of(2, 3, 4, 5)));
    }

    @Test
    void ordersClassesBySmallestColumn() {
        assertThat(EquivalenceClasses.canonicalize(List.of(List.of(6, 4), List.of(5, 1), List.of(3, 2))),
                contains(List.of(1, 5), List.of(2, 3), List.of(4, 6)));
    }

    @Test
    void skipsEmptyClasses() {
        assertThat(EquivalenceClasses.canonicalize(List.of(List.of(), List.of())), empty());
        assertThat(EquivalenceClasses.canonicalize(List.of(List.of(), List.of(1, 0))), contains(List.of(0, 1)));
    }

    @Test
    void equalConstraintsCanonicalizeEqually() {
        final ImmutableList<ImmutableList<Integer>> first = EquivalenceClasses.canonicalize(List.of(List.of(0, 3), List.of(1, 4), List.of(4, 5)));
        final ImmutableList<ImmutableList<Integer>> second = EquivalenceClasses.canonicalize(List.of(List.of(5, 1), List.of(3, 0), List.of(1, 4)));
        assertEquals(first, second);
    }
}
