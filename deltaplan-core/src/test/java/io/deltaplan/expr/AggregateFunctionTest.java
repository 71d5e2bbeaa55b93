/*
 * AggregateFunctionTest.java
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

package io.deltaplan.expr;

import io.deltaplan.types.ColumnType;
import io.deltaplan.types.ScalarType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

/**
 * Tests for {@link AggregateFunction} and {@link AggregateExpr}.
 */
public class AggregateFunctionTest {
    @Test
    void lookupByName() {
        assertEquals(AggregateFunction.SUM, AggregateFunction.forName("sum").orElseThrow());
        assertFalse(AggregateFunction.forName("SUM").isPresent());
        assertFalse(AggregateFunction.forName("median").isPresent());
    }

    @Test
    void resultTypes() {
        assertEquals(ColumnType.of(ScalarType.INT64), AggregateFunction.COUNT.resultType(ColumnType.nullable(ScalarType.STRING)).orElseThrow());
        assertEquals(ColumnType.nullable(ScalarType.INT32), AggregateFunction.SUM.resultType(ColumnType.of(ScalarType.INT32)).orElseThrow());
        assertFalse(AggregateFunction.SUM.resultType(ColumnType.of(ScalarType.STRING)).isPresent());
        assertEquals(ColumnType.nullable(ScalarType.STRING), AggregateFunction.MAX.resultType(ColumnType.of(ScalarType.STRING)).orElseThrow());
        assertEquals(ColumnType.of(ScalarType.BOOL), AggregateFunction.ALL.resultType(ColumnType.of(ScalarType.BOOL)).orElseThrow());
        assertFalse(AggregateFunction.ANY.resultType(ColumnType.of(ScalarType.INT64)).isPresent());
    }

    @Test
    void rendering() {
        assertEquals("sum(#1)", new AggregateExpr(AggregateFunction.SUM, 1, false, ColumnType.nullable(ScalarType.INT64)).explain());
        assertEquals("count(distinct #2)", new AggregateExpr(AggregateFunction.COUNT, 2, true, ColumnType.of(ScalarType.INT64)).explain());
    }
}
