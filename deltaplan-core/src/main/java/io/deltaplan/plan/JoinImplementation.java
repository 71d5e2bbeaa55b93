/*
 * JoinImplementation.java
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

package io.deltaplan.plan;

import io.deltaplan.annotation.API;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * The execution strategy chosen for a {@link JoinNode}: either none yet, or a delta query with one
 * {@link DeltaRule} per input.
 */
@API(API.Status.STABLE)
public abstract class JoinImplementation {
    /**
     * Kinds of implementation.
     */
    public enum Kind {
        UNPLANNED,
        DELTA_QUERY
    }

    private JoinImplementation() {
    }

    @Nonnull
    public abstract Kind getKind();

    @Nonnull
    public static JoinImplementation unplanned() {
        return Unplanned.INSTANCE;
    }

    @Nonnull
    public static DeltaQuery deltaQuery(@Nonnull List<DeltaRule> rules) {
        return new DeltaQuery(rules);
    }

    @Nonnull
    public DeltaQuery asDeltaQuery() {
        Verify.verify(getKind() == Kind.DELTA_QUERY, "join implementation is not a delta query");
        return (DeltaQuery)this;
    }

    /**
     * A join whose strategy has not been chosen.
     */
    public static final class Unplanned extends JoinImplementation {
        private static final Unplanned INSTANCE = new Unplanned();

        private Unplanned() {
        }

        @Nonnull
        @Override
        public Kind getKind() {
            return Kind.UNPLANNED;
        }

        @Override
        public String toString() {
            return "Unimplemented";
        }
    }

    /**
     * A delta-query strategy. Rule {@code i} describes the update for changes to input {@code i}.
     */
    public static final class DeltaQuery extends JoinImplementation {
        @Nonnull
        private final ImmutableList<DeltaRule> rules;

        private DeltaQuery(@Nonnull List<DeltaRule> rules) {
            this.rules = ImmutableList.copyOf(rules);
        }

        @Nonnull
        @Override
        public Kind getKind() {
            return Kind.DELTA_QUERY;
        }

        @Nonnull
        public ImmutableList<DeltaRule> getRules() {
            return rules;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof DeltaQuery && rules.equals(((DeltaQuery)o).rules));
        }

        @Override
        public int hashCode() {
            return rules.hashCode();
        }

        @Override
        public String toString() {
            return "DeltaQuery" + rules;
        }
    }
}
