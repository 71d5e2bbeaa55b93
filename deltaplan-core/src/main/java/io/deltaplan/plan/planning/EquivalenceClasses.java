/*
 * EquivalenceClasses.java
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

import io.deltaplan.annotation.API;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * Canonical form of a join's equality constraints.
 */
@API(API.Status.INTERNAL)
public final class EquivalenceClasses {
    private EquivalenceClasses() {
        // utility class
    }

    /**
     * Canonicalize a list of equality constraints. Each constraint is de-duplicated and sorted, constraints that
     * share a column are merged into one class, and the classes are ordered by their smallest column. Two lists
     * that describe the same equalities have the same canonical form.
     * @param equivalences the constraints, each a list of concatenated-row columns
     * @return the canonical classes
     */
    @Nonnull
    public static ImmutableList<ImmutableList<Integer>> canonicalize(@Nonnull List<? extends List<Integer>> equivalences) {
        final List<TreeSet<Integer>> classes = new ArrayList<>();
        for (List<Integer> equivalence : equivalences) {
            TreeSet<Integer> merged = new TreeSet<>(equivalence);
            if (merged.isEmpty()) {
                continue;
            }
            // absorb every existing class that overlaps the new one
            for (int i = classes.size() - 1; i >= 0; i--) {
                final TreeSet<Integer> existing = classes.get(i);
                if (overlaps(existing, merged)) {
                    merged.addAll(existing);
                    classes.remove(i);
                }
            }
            classes.add(merged);
        }
        classes.sort(Comparator.comparing(TreeSet::first));
        final ImmutableList.Builder<ImmutableList<Integer>> builder = ImmutableList.builderWithExpectedSize(classes.size());
        for (TreeSet<Integer> equivalenceClass : classes) {
            builder.add(ImmutableList.copyOf(equivalenceClass));
        }
        return builder.build();
    }

    private static boolean overlaps(@Nonnull TreeSet<Integer> left, @Nonnull TreeSet<Integer> right) {
        for (Integer column : right) {
            if (left.contains(column)) {
                return true;
            }
        }
        return false;
    }
}
