/*
 * DeltaQueryPlanner.java
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

import io.deltaplan.PlanConstructionException;
import io.deltaplan.PlanConstructionException.ErrorCode;
import io.deltaplan.annotation.API;
import io.deltaplan.logging.KeyValueLogMessage;
import io.deltaplan.logging.LogMessageKeys;
import io.deltaplan.plan.DeltaRule;
import io.deltaplan.plan.DeltaStep;
import io.deltaplan.plan.JoinImplementation;
import io.deltaplan.plan.JoinInputMapper;
import io.deltaplan.plan.KeySet;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Chooses delta-query implementations for joins.
 *
 * <p>
 * For every input {@code i} of a join the planner builds one {@link DeltaRule}: starting from the changes of
 * {@code i}, it repeatedly picks an input that is not yet bound and can be probed with a key made of columns
 * that are equated with columns of the inputs bound so far. The key for input {@code j} given bound inputs
 * {@code B} takes, for each equivalence class (in canonical order) that contains a column of {@code j} and a column
 * of some input in {@code B}, the smallest column of {@code j} in that class.
 * </p>
 *
 * <p>
 * Among the inputs that can be probed, the planner picks one already arranged by its key (if the configuration
 * asks for that), then one with a longer key, then the one with the lowest index. The result depends only on the
 * input arities, the canonical equivalences and the available arrangements, so equal requests plan identically.
 * An input that cannot be reached from the changed input through equivalences makes the join unplannable;
 * the planner never falls back to a cross product.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class DeltaQueryPlanner {
    private static final Logger logger = LoggerFactory.getLogger(DeltaQueryPlanner.class);

    /**
     * Tells the planner which keys an input is already arranged by.
     */
    @FunctionalInterface
    public interface ArrangementLookup {
        ArrangementLookup NONE = (input, key) -> false;

        boolean isArranged(int input, @Nonnull KeySet key);
    }

    @Nonnull
    private final PlannerConfiguration configuration;

    public DeltaQueryPlanner(@Nonnull PlannerConfiguration configuration) {
        this.configuration = configuration;
    }

    @Nonnull
    public PlannerConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Plan a delta query for a join.
     * @param mapper the arities of the join inputs
     * @param equivalences the join's equivalences in canonical form
     * @param arrangements the arrangements already available for the inputs
     * @return a delta query with one rule per input
     * @throws PlanConstructionException with {@link ErrorCode#NO_VALID_JOIN_STRATEGY} if some rule cannot reach
     * every input
     */
    @Nonnull
    public JoinImplementation.DeltaQuery plan(@Nonnull JoinInputMapper mapper,
                                              @Nonnull List<? extends List<Integer>> equivalences,
                                              @Nonnull ArrangementLookup arrangements) {
        final int inputCount = mapper.getInputCount();
        final ImmutableList.Builder<DeltaRule> rules = ImmutableList.builderWithExpectedSize(inputCount);
        for (int changed = 0; changed < inputCount; changed++) {
            rules.add(planRule(mapper, equivalences, arrangements, changed));
        }
        final JoinImplementation.DeltaQuery deltaQuery = JoinImplementation.deltaQuery(rules.build());
        if (logger.isDebugEnabled()) {
            logger.debug(KeyValueLogMessage.of("planned delta query",
                    LogMessageKeys.INPUT_COUNT, inputCount,
                    LogMessageKeys.EQUIVALENCE, equivalences,
                    LogMessageKeys.DELTA_RULES, deltaQuery.getRules()));
        }
        return deltaQuery;
    }

    @Nonnull
    private DeltaRule planRule(@Nonnull JoinInputMapper mapper,
                               @Nonnull List<? extends List<Integer>> equivalences,
                               @Nonnull ArrangementLookup arrangements,
                               int changed) {
        final int inputCount = mapper.getInputCount();
        final BitSet bound = new BitSet(inputCount);
        bound.set(changed);
        final List<DeltaStep> steps = new ArrayList<>(inputCount - 1);
        while (bound.cardinality() < inputCount) {
            int bestInput = -1;
            KeySet bestKey = null;
            boolean bestArranged = false;
            for (int candidate = 0; candidate < inputCount; candidate++) {
                if (bound.get(candidate)) {
                    continue;
                }
                final KeySet key = probeKey(mapper, equivalences, bound, candidate);
                if (key.isEmpty()) {
                    continue;
                }
                final boolean arranged = configuration.shouldPreferArrangedInputs() && arrangements.isArranged(candidate, key);
                if (bestKey == null || isBetter(arranged, key, bestArranged, bestKey)) {
                    bestInput = candidate;
                    bestKey = key;
                    bestArranged = arranged;
                }
            }
            if (bestKey == null) {
                throw new PlanConstructionException(ErrorCode.NO_VALID_JOIN_STRATEGY,
                        "join has no valid incremental strategy",
                        LogMessageKeys.INPUT, changed,
                        LogMessageKeys.INPUT_COUNT, inputCount,
                        LogMessageKeys.EQUIVALENCE, equivalences);
            }
            steps.add(new DeltaStep(bestInput, bestKey));
            bound.set(bestInput);
        }
        return new DeltaRule(changed, steps);
    }

    // candidates are visited in ascending index order, so ties keep the lower index
    private static boolean isBetter(boolean arranged, @Nonnull KeySet key, boolean bestArranged, @Nonnull KeySet bestKey) {
        if (arranged != bestArranged) {
            return arranged;
        }
        return key.size() > bestKey.size();
    }

    /**
     * The key input {@code input} can be probed with once the inputs in {@code bound} are bound.
     * @param mapper the arities of the join inputs
     * @param equivalences the join's equivalences in canonical form
     * @param bound the bound inputs
     * @param input the input to probe
     * @return the key in the input's local column numbering, empty if the input is not constrained against
     * any bound input
     */
    @Nonnull
    public static KeySet probeKey(@Nonnull JoinInputMapper mapper,
                                  @Nonnull List<? extends List<Integer>> equivalences,
                                  @Nonnull BitSet bound,
                                  int input) {
        final List<Integer> key = new ArrayList<>();
        for (List<Integer> equivalence : equivalences) {
            final Integer own = smallestColumnOf(mapper, equivalence, input);
            if (own != null && touchesBound(mapper, equivalence, bound, input)) {
                key.add(mapper.localColumn(own));
            }
        }
        return KeySet.of(key);
    }

    @Nullable
    private static Integer smallestColumnOf(@Nonnull JoinInputMapper mapper, @Nonnull List<Integer> equivalence, int input) {
        // classes are sorted, so the first match is the smallest
        for (Integer column : equivalence) {
            if (mapper.inputOf(column) == input) {
                return column;
            }
        }
        return null;
    }

    private static boolean touchesBound(@Nonnull JoinInputMapper mapper, @Nonnull List<Integer> equivalence,
                                        @Nonnull BitSet bound, int input) {
        for (Integer column : equivalence) {
            final int owner = mapper.inputOf(column);
            if (owner != input && bound.get(owner)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Check that a delta query supplied with a construction request is a valid implementation of a join: one
     * rule per input in input order, each visiting every other input exactly once, with non-empty keys whose
     * columns are in range for the probed input and equated with a column of an already bound input.
     * @param mapper the arities of the join inputs
     * @param equivalences the join's equivalences in canonical form
     * @param deltaQuery the supplied implementation
     * @throws PlanConstructionException with {@link ErrorCode#INVALID_JOIN_IMPLEMENTATION} if it is not valid
     */
    public void validate(@Nonnull JoinInputMapper mapper,
                         @Nonnull List<? extends List<Integer>> equivalences,
                         @Nonnull JoinImplementation.DeltaQuery deltaQuery) {
        final int inputCount = mapper.getInputCount();
        final List<DeltaRule> rules = deltaQuery.getRules();
        if (rules.size() != inputCount) {
            throw invalid("delta query must have one rule per input", -1, null)
                    .addLogInfo(LogMessageKeys.INPUT_COUNT, inputCount)
                    .addLogInfo(LogMessageKeys.DELTA_RULES, rules.size());
        }
        for (int changed = 0; changed < inputCount; changed++) {
            final DeltaRule rule = rules.get(changed);
            if (rule.getChangedInput() != changed) {
                throw invalid("delta rules must be listed in input order", changed, null);
            }
            if (rule.getSteps().size() != inputCount - 1) {
                throw invalid("delta rule must probe every other input exactly once", changed, null);
            }
            final BitSet bound = new BitSet(inputCount);
            bound.set(changed);
            for (DeltaStep step : rule.getSteps()) {
                final int probed = step.getInput();
                if (probed < 0 || probed >= inputCount || bound.get(probed)) {
                    throw invalid("delta rule must probe every other input exactly once", changed, step);
                }
                if (step.getKey().isEmpty()) {
                    throw invalid("delta step key must not be empty", changed, step);
                }
                for (Integer column : step.getKey().getColumns()) {
                    if (column < 0 || column >= mapper.getArity(probed)) {
                        throw invalid("delta step key column out of range for probed input", changed, step)
                                .addLogInfo(LogMessageKeys.COLUMN, column);
                    }
                    if (!isConstrained(mapper, equivalences, bound, probed, mapper.globalColumn(probed, column))) {
                        throw invalid("delta step key column is not equated with a bound input", changed, step)
                                .addLogInfo(LogMessageKeys.COLUMN, column);
                    }
                }
                bound.set(probed);
            }
        }
    }

    private static boolean isConstrained(@Nonnull JoinInputMapper mapper, @Nonnull List<? extends List<Integer>> equivalences,
                                         @Nonnull BitSet bound, int input, int globalColumn) {
        for (List<Integer> equivalence : equivalences) {
            if (equivalence.contains(globalColumn) && touchesBound(mapper, equivalence, bound, input)) {
                return true;
            }
        }
        return false;
    }

    @Nonnull
    private static PlanConstructionException invalid(@Nonnull String message, int changed, @Nullable DeltaStep step) {
        final PlanConstructionException exception = new PlanConstructionException(ErrorCode.INVALID_JOIN_IMPLEMENTATION, message);
        if (changed >= 0) {
            exception.addLogInfo(LogMessageKeys.INPUT, changed);
        }
        if (step != null) {
            exception.addLogInfo(LogMessageKeys.KEY, step);
        }
        return exception;
    }
}
