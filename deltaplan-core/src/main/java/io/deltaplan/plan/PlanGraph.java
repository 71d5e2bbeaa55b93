/*
 * PlanGraph.java
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
import io.deltaplan.plan.explain.PlanExplainer;
import io.deltaplan.plan.planning.ArrangementRegistry;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;

/**
 * The immutable result of plan construction. Nodes are stored in a table indexed by their identifiers, in
 * construction order; {@link #getResults()} lists the node computing each top-level result of the request.
 */
@API(API.Status.STABLE)
public final class PlanGraph {
    @Nonnull
    private final ImmutableList<RelationNode> nodes;
    @Nonnull
    private final ImmutableList<SourceDefinition> sources;
    @Nonnull
    private final ImmutableList<RelationNode> results;
    @Nonnull
    private final ImmutableSortedMap<LocalId, LetNode> bindings;
    @Nonnull
    private final ArrangementRegistry arrangements;

    public PlanGraph(@Nonnull List<RelationNode> nodes,
                     @Nonnull List<SourceDefinition> sources,
                     @Nonnull List<RelationNode> results,
                     @Nonnull Map<LocalId, LetNode> bindings,
                     @Nonnull ArrangementRegistry arrangements) {
        for (int i = 0; i < nodes.size(); i++) {
            Preconditions.checkArgument(nodes.get(i).getId() == i, "node table out of order at %s", i);
        }
        this.nodes = ImmutableList.copyOf(nodes);
        this.sources = ImmutableList.copyOf(sources);
        this.results = ImmutableList.copyOf(results);
        this.bindings = ImmutableSortedMap.copyOf(bindings);
        this.arrangements = arrangements;
    }

    @Nonnull
    public ImmutableList<RelationNode> getNodes() {
        return nodes;
    }

    @Nonnull
    public RelationNode getNode(int id) {
        return nodes.get(id);
    }

    public int getNodeCount() {
        return nodes.size();
    }

    @Nonnull
    public ImmutableList<SourceDefinition> getSources() {
        return sources;
    }

    @Nonnull
    public ImmutableList<RelationNode> getResults() {
        return results;
    }

    /**
     * Look up the {@code Let} that introduced a binding.
     * @param localId the binding
     * @return the let node
     * @throws IllegalArgumentException if the binding does not belong to this graph
     */
    @Nonnull
    public LetNode getBinding(@Nonnull LocalId localId) {
        final LetNode let = bindings.get(localId);
        Preconditions.checkArgument(let != null, "unknown binding %s", localId);
        return let;
    }

    @Nonnull
    public ImmutableSortedMap<LocalId, LetNode> getBindings() {
        return bindings;
    }

    @Nonnull
    public ArrangementRegistry getArrangements() {
        return arrangements;
    }

    /**
     * Render this graph in the canonical explain format.
     * @return the explain text
     */
    @Nonnull
    public String explain() {
        return PlanExplainer.explain(this);
    }

    @Override
    public String toString() {
        return PlanExplainer.explain(this, PlanExplainer.DEFAULT_LOG_MAX_SIZE);
    }
}
