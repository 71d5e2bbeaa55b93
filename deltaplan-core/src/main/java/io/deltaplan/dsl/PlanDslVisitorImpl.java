/*
 * PlanDslVisitorImpl.java
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

package io.deltaplan.dsl;

import io.deltaplan.plan.ColumnOrder;
import io.deltaplan.plan.DeltaStep;
import io.deltaplan.plan.KeySet;
import io.deltaplan.plan.construction.AggregateForm;
import io.deltaplan.plan.construction.ConstructionRequest;
import io.deltaplan.plan.construction.RelationForm;
import io.deltaplan.plan.construction.ScalarForm;
import io.deltaplan.plan.construction.SourceForm;
import io.deltaplan.types.ColumnType;
import io.deltaplan.types.RelationType;
import io.deltaplan.types.ScalarType;
import com.google.common.collect.ImmutableList;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.util.List;
import java.util.OptionalLong;

/**
 * Turns a parse tree of the plan DSL into construction forms. Relational forms are built by this visitor;
 * scalars by {@link ScalarFormVisitor}.
 */
public class PlanDslVisitorImpl extends PlanDslParserBaseVisitor<RelationForm> {
    @Nonnull
    private final ScalarFormVisitor scalarVisitor = new ScalarFormVisitor();

    @Nonnull
    public ConstructionRequest visitRequestForms(@Nonnull PlanDslParser.RequestContext ctx) {
        final ConstructionRequest.Builder builder = ConstructionRequest.newBuilder();
        for (PlanDslParser.FormContext form : ctx.form()) {
            if (form.sourceDeclaration() != null) {
                final PlanDslParser.SourceDeclarationContext source = form.sourceDeclaration();
                builder.add(new SourceForm(source.IDENTIFIER().getText(), relationType(source.columnTypeList())));
            } else {
                builder.addResult(form.relation().accept(this));
            }
        }
        return builder.build();
    }

    @Override
    public RelationForm visitConstantRelation(PlanDslParser.ConstantRelationContext ctx) {
        final ImmutableList.Builder<List<ScalarForm>> rows = ImmutableList.builder();
        for (PlanDslParser.RowContext row : ctx.row()) {
            rows.add(scalars(row.scalar()));
        }
        return RelationForm.constant(rows.build(), relationType(ctx.columnTypeList()));
    }

    @Override
    public RelationForm visitGetRelation(PlanDslParser.GetRelationContext ctx) {
        return RelationForm.get(ctx.IDENTIFIER().getText());
    }

    @Override
    public RelationForm visitLetRelation(PlanDslParser.LetRelationContext ctx) {
        return RelationForm.let(ctx.IDENTIFIER().getText(), ctx.relation(0).accept(this), ctx.relation(1).accept(this));
    }

    @Override
    public RelationForm visitMapRelation(PlanDslParser.MapRelationContext ctx) {
        return RelationForm.map(ctx.relation().accept(this), scalars(ctx.scalarList().scalar()));
    }

    @Override
    public RelationForm visitFilterRelation(PlanDslParser.FilterRelationContext ctx) {
        return RelationForm.filter(ctx.relation().accept(this), scalars(ctx.scalarList().scalar()));
    }

    @Override
    public RelationForm visitArrangeByRelation(PlanDslParser.ArrangeByRelationContext ctx) {
        final ImmutableList.Builder<List<Integer>> keys = ImmutableList.builder();
        for (PlanDslParser.ColumnListContext key : ctx.columnList()) {
            keys.add(columns(key));
        }
        return RelationForm.arrangeBy(ctx.relation().accept(this), keys.build());
    }

    @Override
    public RelationForm visitJoinRelation(PlanDslParser.JoinRelationContext ctx) {
        final ImmutableList.Builder<RelationForm> inputs = ImmutableList.builder();
        for (PlanDslParser.RelationContext input : ctx.relation()) {
            inputs.add(input.accept(this));
        }
        final ImmutableList.Builder<List<Integer>> equivalences = ImmutableList.builder();
        for (PlanDslParser.ColumnListContext equivalence : ctx.columnList()) {
            equivalences.add(columns(equivalence));
        }
        final List<Integer> demand = ctx.demandClause() == null ? null : columns(ctx.demandClause().columnList());
        List<List<DeltaStep>> deltaQuery = null;
        if (ctx.deltaQueryClause() != null) {
            final ImmutableList.Builder<List<DeltaStep>> rules = ImmutableList.builder();
            for (PlanDslParser.DeltaRuleContext rule : ctx.deltaQueryClause().deltaRule()) {
                final ImmutableList.Builder<DeltaStep> steps = ImmutableList.builder();
                for (PlanDslParser.DeltaStepContext step : rule.deltaStep()) {
                    steps.add(new DeltaStep(parseInt(step.INTEGER()), KeySet.of(columns(step.columnList()))));
                }
                rules.add(steps.build());
            }
            deltaQuery = rules.build();
        }
        return RelationForm.join(inputs.build(), equivalences.build(), demand, deltaQuery);
    }

    @Override
    public RelationForm visitReduceRelation(PlanDslParser.ReduceRelationContext ctx) {
        final ImmutableList.Builder<AggregateForm> aggregates = ImmutableList.builder();
        for (PlanDslParser.AggregateContext aggregate : ctx.aggregate()) {
            aggregates.add(new AggregateForm(aggregate.IDENTIFIER().getText(),
                    column(aggregate.COLUMN_REF()), aggregate.DISTINCT() != null));
        }
        return RelationForm.reduce(ctx.relation().accept(this), scalars(ctx.scalarList().scalar()), aggregates.build());
    }

    @Override
    public RelationForm visitDistinctRelation(PlanDslParser.DistinctRelationContext ctx) {
        return RelationForm.distinct(ctx.relation().accept(this), scalars(ctx.scalarList().scalar()));
    }

    @Override
    public RelationForm visitTopKRelation(PlanDslParser.TopKRelationContext ctx) {
        final ImmutableList.Builder<ColumnOrder> order = ImmutableList.builder();
        for (PlanDslParser.OrderItemContext item : ctx.orderItem()) {
            if (item instanceof PlanDslParser.ExplicitOrderItemContext) {
                final PlanDslParser.ExplicitOrderItemContext explicit = (PlanDslParser.ExplicitOrderItemContext)item;
                order.add(new ColumnOrder(column(explicit.COLUMN_REF()), explicit.DESC() != null));
            } else {
                order.add(ColumnOrder.ascending(column(((PlanDslParser.ImplicitOrderItemContext)item).COLUMN_REF())));
            }
        }
        OptionalLong limit = OptionalLong.empty();
        if (ctx.limitValue() != null && ctx.limitValue().INTEGER() != null) {
            limit = OptionalLong.of(parseLong(ctx.limitValue().INTEGER()));
        }
        final long offset = ctx.INTEGER() == null ? 0L : parseLong(ctx.INTEGER());
        return RelationForm.topK(ctx.relation().accept(this), columns(ctx.columnList()), order.build(), limit, offset);
    }

    @Nonnull
    private ImmutableList<ScalarForm> scalars(@Nonnull List<PlanDslParser.ScalarContext> contexts) {
        final ImmutableList.Builder<ScalarForm> scalars = ImmutableList.builderWithExpectedSize(contexts.size());
        for (PlanDslParser.ScalarContext scalar : contexts) {
            scalars.add(scalar.accept(scalarVisitor));
        }
        return scalars.build();
    }

    @Nonnull
    private static RelationType relationType(@Nonnull PlanDslParser.ColumnTypeListContext ctx) {
        final ImmutableList.Builder<ColumnType> columnTypes = ImmutableList.builder();
        for (PlanDslParser.ColumnTypeContext columnType : ctx.columnType()) {
            if (columnType instanceof PlanDslParser.NullableColumnTypeContext) {
                columnTypes.add(ColumnType.nullable(scalarType(((PlanDslParser.NullableColumnTypeContext)columnType).IDENTIFIER())));
            } else {
                columnTypes.add(ColumnType.of(scalarType(((PlanDslParser.NonNullableColumnTypeContext)columnType).IDENTIFIER())));
            }
        }
        return RelationType.of(columnTypes.build());
    }

    @Nonnull
    static ScalarType scalarType(@Nonnull TerminalNode identifier) {
        return ScalarType.forName(identifier.getText())
                .orElseThrow(() -> error("unknown type " + identifier.getText(), identifier.getSymbol(), null));
    }

    @Nonnull
    private static ImmutableList<Integer> columns(@Nonnull PlanDslParser.ColumnListContext ctx) {
        final ImmutableList.Builder<Integer> columns = ImmutableList.builder();
        for (TerminalNode columnRef : ctx.COLUMN_REF()) {
            columns.add(column(columnRef));
        }
        return columns.build();
    }

    static int column(@Nonnull TerminalNode columnRef) {
        final String text = columnRef.getText();
        try {
            return Integer.parseInt(text.substring(1));
        } catch (NumberFormatException e) {
            throw error("column reference out of bounds " + text, columnRef.getSymbol(), e);
        }
    }

    private static int parseInt(@Nonnull TerminalNode integer) {
        try {
            return Integer.parseInt(integer.getText());
        } catch (NumberFormatException e) {
            throw error("integer out of bounds " + integer.getText(), integer.getSymbol(), e);
        }
    }

    static long parseLong(@Nonnull TerminalNode integer) {
        try {
            return Long.parseLong(integer.getText());
        } catch (NumberFormatException e) {
            throw error("integer out of bounds " + integer.getText(), integer.getSymbol(), e);
        }
    }

    @Nonnull
    static PlanDslParseException error(@Nonnull String message, @Nonnull Token token, @Nullable Throwable cause) {
        return new PlanDslParseException(message, token.getLine(), token.getCharPositionInLine(), cause);
    }

    /**
     * Builds {@link ScalarForm}s from scalar parse trees.
     */
    static class ScalarFormVisitor extends PlanDslParserBaseVisitor<ScalarForm> {
        @Override
        public ScalarForm visitColumnScalar(PlanDslParser.ColumnScalarContext ctx) {
            return ScalarForm.column(column(ctx.COLUMN_REF()));
        }

        @Override
        public ScalarForm visitLiteralScalar(PlanDslParser.LiteralScalarContext ctx) {
            return ScalarForm.literal(literalValue(ctx.literalValue()));
        }

        @Override
        public ScalarForm visitTypedLiteralScalar(PlanDslParser.TypedLiteralScalarContext ctx) {
            return ScalarForm.literal(literalValue(ctx.literalValue()), scalarType(ctx.IDENTIFIER()));
        }

        @Override
        public ScalarForm visitCallScalar(PlanDslParser.CallScalarContext ctx) {
            final ImmutableList.Builder<ScalarForm> arguments = ImmutableList.builder();
            for (PlanDslParser.ScalarContext argument : ctx.scalar()) {
                arguments.add(argument.accept(this));
            }
            return ScalarForm.call(ctx.IDENTIFIER().getText(), arguments.build());
        }

        @Nullable
        private static Object literalValue(@Nonnull PlanDslParser.LiteralValueContext ctx) {
            if (ctx.INTEGER() != null) {
                return parseLong(ctx.INTEGER());
            } else if (ctx.DECIMAL() != null) {
                return new BigDecimal(ctx.DECIMAL().getText());
            } else if (ctx.STRING() != null) {
                return unquote(ctx.STRING().getText());
            } else if (ctx.TRUE() != null) {
                return Boolean.TRUE;
            } else if (ctx.FALSE() != null) {
                return Boolean.FALSE;
            }
            return null;
        }

        @Nonnull
        private static String unquote(@Nonnull String quoted) {
            final StringBuilder sb = new StringBuilder(quoted.length());
            for (int i = 1; i < quoted.length() - 1; i++) {
                char c = quoted.charAt(i);
                if (c == '\\' && i + 1 < quoted.length() - 1) {
                    c = quoted.charAt(++i);
                    if (c == 'n') {
                        c = '\n';
                    } else if (c == 't') {
                        c = '\t';
                    }
                }
                sb.append(c);
            }
            return sb.toString();
        }
    }
}
