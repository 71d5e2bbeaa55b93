/*
 * PlanBuilder.java
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

package io.deltaplan.plan.construction;

import io.deltaplan.PlanComplexityException;
import io.deltaplan.PlanConstructionException;
import io.deltaplan.PlanConstructionException.ErrorCode;
import io.deltaplan.PlanCoreException;
import io.deltaplan.annotation.API;
import io.deltaplan.expr.AggregateExpr;
import io.deltaplan.expr.AggregateFunction;
import io.deltaplan.expr.ColumnExpr;
import io.deltaplan.expr.ScalarExpr;
import io.deltaplan.logging.KeyValueLogMessage;
import io.deltaplan.logging.LogMessageKeys;
import io.deltaplan.plan.ArrangeByNode;
import io.deltaplan.plan.ColumnOrder;
import io.deltaplan.plan.ConstantNode;
import io.deltaplan.plan.DeltaRule;
import io.deltaplan.plan.DeltaStep;
import io.deltaplan.plan.FilterNode;
import io.deltaplan.plan.GetNode;
import io.deltaplan.plan.JoinImplementation;
import io.deltaplan.plan.JoinInputMapper;
import io.deltaplan.plan.JoinNode;
import io.deltaplan.plan.KeySet;
import io.deltaplan.plan.LetNode;
import io.deltaplan.plan.LocalId;
import io.deltaplan.plan.MapNode;
import io.deltaplan.plan.PlanGraph;
import io.deltaplan.plan.ReduceNode;
import io.deltaplan.plan.RelationNode;
import io.deltaplan.plan.SourceDefinition;
import io.deltaplan.plan.TopKNode;
import io.deltaplan.plan.planning.ArrangementRegistry;
import io.deltaplan.plan.planning.CollectionId;
import io.deltaplan.plan.planning.DeltaQueryPlanner;
import io.deltaplan.plan.planning.EquivalenceClasses;
import io.deltaplan.plan.planning.PlannerConfiguration;
import io.deltaplan.types.ColumnType;
import io.deltaplan.types.Datum;
import io.deltaplan.types.RelationType;
import io.deltaplan.types.ScalarType;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a {@link PlanGraph} from a {@link ConstructionRequest}.
 *
 * <p>
 * Forms are folded in request order. Every relational form is validated against the types of its inputs before
 * its node is created, so node identifiers follow construction order and inputs always precede their consumers.
 * Joins are planned (or their explicit implementation validated) as they are built, and every arrangement that
 * {@code ArrangeBy}, join probes, {@code Reduce} and {@code TopK} need is recorded in the graph's
 * {@link ArrangementRegistry}.
 * </p>
 *
 * <p>
 * Construction is all-or-nothing: the first violated rule aborts the request with a
 * {@link PlanConstructionException} and no graph is returned. A builder holds no state between requests and may
 * be reused.
 * </p>
 */
@API(API.Status.STABLE)
public class PlanBuilder {
    private static final Logger logger = LoggerFactory.getLogger(PlanBuilder.class);

    @Nonnull
    private final PlannerConfiguration configuration;
    @Nonnull
    private final DeltaQueryPlanner planner;

    public PlanBuilder() {
        this(PlannerConfiguration.defaultPlannerConfiguration());
    }

    public PlanBuilder(@Nonnull PlannerConfiguration configuration) {
        this.configuration = configuration;
        this.planner = new DeltaQueryPlanner(configuration);
    }

    @Nonnull
    public PlannerConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Construct the plan graph for a request.
     * @param request the source declarations and relational forms
     * @return the validated, immutable plan graph
     * @throws PlanConstructionException if the request breaks a construction rule
     * @throws PlanComplexityException if the request would create more nodes than the configured threshold
     */
    @Nonnull
    public PlanGraph build(@Nonnull ConstructionRequest request) {
        final Construction construction = new Construction();
        try {
            for (TopLevelForm form : request.getForms()) {
                if (form instanceof SourceForm) {
                    construction.declareSource((SourceForm)form);
                } else {
                    construction.addResult(((RelationForm)form).accept(construction));
                }
            }
            final PlanGraph graph = construction.finish();
            if (logger.isDebugEnabled()) {
                logger.debug(KeyValueLogMessage.of("built plan graph",
                        LogMessageKeys.NODE_COUNT, graph.getNodeCount(),
                        LogMessageKeys.RESULT_COUNT, graph.getResults().size(),
                        LogMessageKeys.SOURCE_COUNT, graph.getSources().size(),
                        LogMessageKeys.ARRANGEMENT_COUNT, graph.getArrangements().size()));
            }
            return graph;
        } catch (PlanCoreException e) {
            if (logger.isDebugEnabled()) {
                logger.debug(KeyValueLogMessage.build("plan construction failed", e.exportLogInfo())
                        .addKeyAndValue(LogMessageKeys.MESSAGE, e.getMessage())
                        .toString());
            }
            throw e;
        }
    }

    /**
     * A binding in scope. Its type is unknown while its value is being built.
     */
    private static final class Binding {
        @Nonnull
        private final String name;
        @Nonnull
        private final LocalId localId;
        @Nullable
        private RelationType type;

        Binding(@Nonnull String name, @Nonnull LocalId localId) {
            this.name = name;
            this.localId = localId;
        }
    }

    /**
     * The state of one construction. Discarded when construction fails.
     */
    private final class Construction implements RelationFormVisitor<RelationNode> {
        @Nonnull
        private final List<RelationNode> nodes = new ArrayList<>();
        @Nonnull
        private final Map<String, SourceDefinition> sources = new LinkedHashMap<>();
        @Nonnull
        private final List<RelationNode> results = new ArrayList<>();
        @Nonnull
        private final Map<LocalId, LetNode> bindings = new LinkedHashMap<>();
        // reads of a binding share the arrangements of its value
        @Nonnull
        private final Map<LocalId, CollectionId> bindingCollections = new HashMap<>();
        // innermost binding first
        @Nonnull
        private final Deque<Binding> scope = new ArrayDeque<>();
        @Nonnull
        private final ArrangementRegistry.Builder arrangements = ArrangementRegistry.newBuilder();
        private int nextLocalId;

        void declareSource(@Nonnull SourceForm form) {
            if (sources.containsKey(form.getName())) {
                throw new PlanConstructionException(ErrorCode.DUPLICATE_DEFINITION,
                        "source declared more than once",
                        LogMessageKeys.NAME, form.getName());
            }
            final SourceDefinition source = new SourceDefinition(form.getName(), sources.size(), form.getType());
            sources.put(source.getName(), source);
        }

        void addResult(@Nonnull RelationNode node) {
            results.add(node);
        }

        @Nonnull
        PlanGraph finish() {
            return new PlanGraph(nodes, ImmutableList.copyOf(sources.values()), results, bindings, arrangements.build());
        }

        private int nextId() {
            if (nodes.size() >= configuration.getComplexityThreshold()) {
                throw new PlanComplexityException(configuration.getComplexityThreshold());
            }
            return nodes.size();
        }

        @Nonnull
        private CollectionId collectionOf(@Nonnull RelationNode node) {
            return CollectionId.of(node, bindingCollections::get);
        }

        @Nonnull
        private <N extends RelationNode> N add(@Nonnull N node) {
            Verify.verify(node.getId() == nodes.size(), "node created out of order");
            nodes.add(node);
            return node;
        }

        @Override
        public RelationNode visitConstant(@Nonnull RelationForm.ConstantForm form) {
            final RelationType type = form.getType();
            final ImmutableList.Builder<ImmutableList<Datum>> rows = ImmutableList.builderWithExpectedSize(form.getRows().size());
            for (List<ScalarForm> row : form.getRows()) {
                if (row.size() != type.getArity()) {
                    throw new PlanConstructionException(ErrorCode.TYPE_MISMATCH,
                            "constant row does not match declared arity",
                            LogMessageKeys.VALUE, row,
                            LogMessageKeys.ARITY, type.getArity());
                }
                final ImmutableList.Builder<Datum> datums = ImmutableList.builderWithExpectedSize(row.size());
                for (int i = 0; i < row.size(); i++) {
                    datums.add(ScalarResolver.resolveLiteral(row.get(i), type.getColumnType(i)));
                }
                rows.add(datums.build());
            }
            return add(new ConstantNode(nextId(), type, rows.build()));
        }

        @Override
        public RelationNode visitGet(@Nonnull RelationForm.GetForm form) {
            final String name = form.getName();
            for (Binding binding : scope) {
                if (binding.name.equals(name)) {
                    if (binding.type == null) {
                        throw new PlanConstructionException(ErrorCode.CYCLIC_REFERENCE,
                                "binding refers to itself",
                                LogMessageKeys.NAME, name,
                                LogMessageKeys.LOCAL_ID, binding.localId);
                    }
                    return add(GetNode.ofLocal(nextId(), name, binding.localId, binding.type));
                }
            }
            final SourceDefinition source = sources.get(name);
            if (source == null) {
                throw new PlanConstructionException(ErrorCode.UNRESOLVED_REFERENCE,
                        "unknown source or binding",
                        LogMessageKeys.NAME, name);
            }
            return add(GetNode.ofSource(nextId(), source));
        }

        @Override
        public RelationNode visitLet(@Nonnull RelationForm.LetForm form) {
            final Binding binding = new Binding(form.getName(), new LocalId(nextLocalId++));
            scope.push(binding);
            try {
                final RelationNode value = form.getValue().accept(this);
                binding.type = value.getType();
                bindingCollections.put(binding.localId, collectionOf(value));
                final RelationNode body = form.getBody().accept(this);
                final LetNode let = add(new LetNode(nextId(), binding.localId, binding.name, value, body));
                bindings.put(binding.localId, let);
                return let;
            } finally {
                scope.pop();
            }
        }

        @Override
        public RelationNode visitMap(@Nonnull RelationForm.MapForm form) {
            final RelationNode input = form.getInput().accept(this);
            RelationType rowType = input.getType();
            final ImmutableList.Builder<ScalarExpr> scalars = ImmutableList.builderWithExpectedSize(form.getScalars().size());
            for (ScalarForm scalarForm : form.getScalars()) {
                final ScalarExpr scalar = ScalarResolver.resolve(scalarForm, rowType);
                scalars.add(scalar);
                rowType = rowType.append(scalar.getType());
            }
            return add(new MapNode(nextId(), input, scalars.build()));
        }

        @Override
        public RelationNode visitFilter(@Nonnull RelationForm.FilterForm form) {
            final RelationNode input = form.getInput().accept(this);
            final ImmutableList.Builder<ScalarExpr> predicates = ImmutableList.builderWithExpectedSize(form.getPredicates().size());
            for (ScalarForm predicateForm : form.getPredicates()) {
                final ScalarExpr predicate = ScalarResolver.resolve(predicateForm, input.getType());
                if (predicate.getType().getScalarType() != ScalarType.BOOL) {
                    throw new PlanConstructionException(ErrorCode.TYPE_MISMATCH,
                            "filter predicate is not boolean",
                            LogMessageKeys.TOKEN, predicateForm.getToken(),
                            LogMessageKeys.EXPECTED_TYPE, ScalarType.BOOL,
                            LogMessageKeys.ACTUAL_TYPE, predicate.getType());
                }
                predicates.add(predicate);
            }
            return add(new FilterNode(nextId(), input, predicates.build()));
        }

        @Override
        public RelationNode visitArrangeBy(@Nonnull RelationForm.ArrangeByForm form) {
            final RelationNode input = form.getInput().accept(this);
            final List<KeySet> keys = new ArrayList<>(form.getKeys().size());
            for (List<Integer> key : form.getKeys()) {
                for (Integer column : key) {
                    ScalarResolver.checkColumn(column, input.getArity(), ColumnExpr.explainColumn(column));
                }
                keys.add(KeySet.of(key));
            }
            final ArrangeByNode arrangeBy = add(new ArrangeByNode(nextId(), input, keys));
            final CollectionId collection = collectionOf(input);
            for (KeySet key : arrangeBy.getKeys()) {
                arrangements.request(collection, key, arrangeBy.getId());
            }
            return arrangeBy;
        }

        @Override
        public RelationNode visitJoin(@Nonnull RelationForm.JoinForm form) {
            if (form.getInputs().isEmpty()) {
                throw new PlanConstructionException(ErrorCode.MALFORMED_CONSTRAINT, "join has no inputs");
            }
            final ImmutableList.Builder<RelationNode> inputsBuilder = ImmutableList.builderWithExpectedSize(form.getInputs().size());
            for (RelationForm inputForm : form.getInputs()) {
                inputsBuilder.add(inputForm.accept(this));
            }
            final ImmutableList<RelationNode> inputs = inputsBuilder.build();
            final JoinInputMapper mapper = JoinInputMapper.forInputs(inputs);

            for (List<Integer> equivalence : form.getEquivalences()) {
                checkEquivalence(mapper, equivalence);
            }
            final ImmutableList<ImmutableList<Integer>> equivalences = EquivalenceClasses.canonicalize(form.getEquivalences());

            ImmutableSortedSet<Integer> demand = null;
            if (form.getDemand() != null) {
                for (Integer column : form.getDemand()) {
                    ScalarResolver.checkColumn(column, mapper.getTotalArity(), ColumnExpr.explainColumn(column));
                }
                demand = ImmutableSortedSet.copyOf(form.getDemand());
            }

            final JoinImplementation implementation;
            if (form.getDeltaQuery() != null) {
                final ImmutableList.Builder<DeltaRule> rules = ImmutableList.builder();
                for (int i = 0; i < form.getDeltaQuery().size(); i++) {
                    rules.add(new DeltaRule(i, form.getDeltaQuery().get(i)));
                }
                final JoinImplementation.DeltaQuery deltaQuery = JoinImplementation.deltaQuery(rules.build());
                planner.validate(mapper, equivalences, deltaQuery);
                implementation = deltaQuery;
            } else if (configuration.shouldPlanJoins()) {
                implementation = planner.plan(mapper, equivalences,
                        (input, key) -> arrangements.contains(collectionOf(inputs.get(input)), key));
            } else {
                implementation = JoinImplementation.unplanned();
            }

            final JoinNode join = add(new JoinNode(nextId(), inputs, equivalences, demand, implementation));
            if (implementation.getKind() == JoinImplementation.Kind.DELTA_QUERY) {
                for (DeltaRule rule : implementation.asDeltaQuery().getRules()) {
                    for (DeltaStep step : rule.getSteps()) {
                        arrangements.request(collectionOf(inputs.get(step.getInput())), step.getKey(), join.getId());
                    }
                }
            }
            return join;
        }

        private void checkEquivalence(@Nonnull JoinInputMapper mapper, @Nonnull List<Integer> equivalence) {
            final Set<Integer> referencedInputs = new HashSet<>();
            for (Integer column : equivalence) {
                if (column < 0 || column >= mapper.getTotalArity()) {
                    throw new PlanConstructionException(ErrorCode.MALFORMED_CONSTRAINT,
                            "join constraint column out of range",
                            LogMessageKeys.EQUIVALENCE, equivalence,
                            LogMessageKeys.COLUMN, column,
                            LogMessageKeys.ARITY, mapper.getTotalArity());
                }
                referencedInputs.add(mapper.inputOf(column));
            }
            if (referencedInputs.size() < 2) {
                throw new PlanConstructionException(ErrorCode.MALFORMED_CONSTRAINT,
                        "join constraint must reference at least two inputs",
                        LogMessageKeys.EQUIVALENCE, equivalence);
            }
        }

        @Override
        public RelationNode visitReduce(@Nonnull RelationForm.ReduceForm form) {
            final RelationNode input = form.getInput().accept(this);
            final RelationType inputType = input.getType();
            final ImmutableList.Builder<ScalarExpr> groupKeyBuilder = ImmutableList.builderWithExpectedSize(form.getGroupKey().size());
            for (ScalarForm keyForm : form.getGroupKey()) {
                groupKeyBuilder.add(ScalarResolver.resolve(keyForm, inputType));
            }
            final ImmutableList<ScalarExpr> groupKey = groupKeyBuilder.build();
            final ImmutableList.Builder<AggregateExpr> aggregates = ImmutableList.builderWithExpectedSize(form.getAggregates().size());
            for (AggregateForm aggregateForm : form.getAggregates()) {
                aggregates.add(resolveAggregate(aggregateForm, inputType));
            }
            final ReduceNode reduce = add(new ReduceNode(nextId(), input, groupKey, aggregates.build()));

            final List<Integer> keyColumns = new ArrayList<>(groupKey.size());
            for (ScalarExpr key : groupKey) {
                if (!(key instanceof ColumnExpr)) {
                    return reduce;
                }
                keyColumns.add(((ColumnExpr)key).getColumn());
            }
            if (!keyColumns.isEmpty()) {
                arrangements.request(collectionOf(input), KeySet.of(keyColumns), reduce.getId());
            }
            return reduce;
        }

        @Nonnull
        private AggregateExpr resolveAggregate(@Nonnull AggregateForm form, @Nonnull RelationType inputType) {
            final Optional<AggregateFunction> function = AggregateFunction.forName(form.getFunctionName());
            if (function.isEmpty()) {
                throw new PlanConstructionException(ErrorCode.INVALID_FUNCTION_CALL,
                        "unknown aggregate function",
                        LogMessageKeys.FUNCTION, form.getFunctionName());
            }
            ScalarResolver.checkColumn(form.getColumn(), inputType.getArity(), ColumnExpr.explainColumn(form.getColumn()));
            final ColumnType columnType = inputType.getColumnType(form.getColumn());
            final Optional<ColumnType> resultType = function.get().resultType(columnType);
            if (resultType.isEmpty()) {
                throw new PlanConstructionException(ErrorCode.TYPE_MISMATCH,
                        "aggregate does not accept input type",
                        LogMessageKeys.FUNCTION, form.getFunctionName(),
                        LogMessageKeys.COLUMN, form.getColumn(),
                        LogMessageKeys.ACTUAL_TYPE, columnType);
            }
            return new AggregateExpr(function.get(), form.getColumn(), form.isDistinct(), resultType.get());
        }

        @Override
        public RelationNode visitTopK(@Nonnull RelationForm.TopKForm form) {
            final RelationNode input = form.getInput().accept(this);
            for (Integer column : form.getGroupKey()) {
                ScalarResolver.checkColumn(column, input.getArity(), ColumnExpr.explainColumn(column));
            }
            for (ColumnOrder order : form.getOrder()) {
                ScalarResolver.checkColumn(order.getColumn(), input.getArity(), ColumnExpr.explainColumn(order.getColumn()));
            }
            if (form.getLimit().isPresent() && form.getLimit().getAsLong() < 0) {
                throw new PlanConstructionException(ErrorCode.INVALID_ARGUMENT,
                        "top k limit must not be negative",
                        LogMessageKeys.VALUE, form.getLimit().getAsLong());
            }
            if (form.getOffset() < 0) {
                throw new PlanConstructionException(ErrorCode.INVALID_ARGUMENT,
                        "top k offset must not be negative",
                        LogMessageKeys.VALUE, form.getOffset());
            }
            final TopKNode topK = add(new TopKNode(nextId(), input, form.getGroupKey(), form.getOrder(), form.getLimit(), form.getOffset()));
            if (!form.getGroupKey().isEmpty()) {
                arrangements.request(collectionOf(input), KeySet.of(form.getGroupKey()), topK.getId());
            }
            return topK;
        }
    }
}
