/*
 * DatumTest.java
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

package io.deltaplan.types;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.math.BigDecimal;
import java.util.stream.Stream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link Datum}.
 */
public class DatumTest {
    @Test
    void coercion() {
        assertEquals(Datum.int64(3), Datum.coerce(ScalarType.INT64, 3L).orElseThrow());
        assertEquals(ScalarType.INT16, Datum.coerce(ScalarType.INT16, 300L).orElseThrow().getType());
        assertFalse(Datum.coerce(ScalarType.INT16, 40000L).isPresent());
        assertFalse(Datum.coerce(ScalarType.INT32, 1L + Integer.MAX_VALUE).isPresent());
        assertEquals(Datum.float64(2.0), Datum.coerce(ScalarType.FLOAT64, 2L).orElseThrow());
        assertEquals(new BigDecimal("1.25"), Datum.coerce(ScalarType.NUMERIC, new BigDecimal("1.25")).orElseThrow().getNumeric());
        assertFalse(Datum.coerce(ScalarType.INT64, new BigDecimal("1.5")).isPresent());
        assertFalse(Datum.coerce(ScalarType.BOOL, "true").isPresent());
        assertTrue(Datum.coerce(ScalarType.STRING, null).orElseThrow().isNull());
    }

    static Stream<Arguments> numericLiterals() {
        return Stream.of(
                Arguments.of(ScalarType.INT16, 32767L, true),
                Arguments.of(ScalarType.INT16, -32768L, true),
                Arguments.of(ScalarType.INT16, 32768L, false),
                Arguments.of(ScalarType.INT16, -32769L, false),
                Arguments.of(ScalarType.INT32, 2147483647L, true),
                Arguments.of(ScalarType.INT32, 2147483648L, false),
                Arguments.of(ScalarType.INT32, -2147483649L, false),
                Arguments.of(ScalarType.INT64, Long.MIN_VALUE, true),
                Arguments.of(ScalarType.INT64, new BigDecimal("2.0"), false),
                Arguments.of(ScalarType.FLOAT32, 16777216L, true),
                Arguments.of(ScalarType.FLOAT32, 16777217L, false),
                Arguments.of(ScalarType.FLOAT32, new BigDecimal("3.4E38"), true),
                Arguments.of(ScalarType.FLOAT32, new BigDecimal("1E39"), false),
                Arguments.of(ScalarType.FLOAT32, new BigDecimal("-1E39"), false),
                Arguments.of(ScalarType.FLOAT32, new BigDecimal("0.1"), true),
                Arguments.of(ScalarType.FLOAT64, 9007199254740992L, true),
                Arguments.of(ScalarType.FLOAT64, 9007199254740993L, false),
                Arguments.of(ScalarType.FLOAT64, Long.MAX_VALUE, false),
                Arguments.of(ScalarType.FLOAT64, Long.MIN_VALUE, true),
                Arguments.of(ScalarType.FLOAT64, new BigDecimal("1E308"), true),
                Arguments.of(ScalarType.FLOAT64, new BigDecimal("1E309"), false),
                Arguments.of(ScalarType.FLOAT64, new BigDecimal("-1E309"), false),
                Arguments.of(ScalarType.NUMERIC, Long.MAX_VALUE, true),
                Arguments.of(ScalarType.NUMERIC, new BigDecimal("1E400"), true)
        );
    }

    @ParameterizedTest(name = "{1} as {0}")
    @MethodSource("numericLiterals")
    void numericLiteralsConvertOnlyWhenTheyFit(ScalarType type, Object value, boolean fits) {
        assertEquals(fits, Datum.coerce(type, value).isPresent());
    }

    @Test
    void defaultTypes() {
        assertEquals(ScalarType.INT64, Datum.defaultTypeOf(1L).orElseThrow());
        assertEquals(ScalarType.FLOAT64, Datum.defaultTypeOf(new BigDecimal("0.5")).orElseThrow());
        assertEquals(ScalarType.STRING, Datum.defaultTypeOf("s").orElseThrow());
        assertEquals(ScalarType.BOOL, Datum.defaultTypeOf(false).orElseThrow());
        assertFalse(Datum.defaultTypeOf(null).isPresent());
    }

    @Test
    void rendering() {
        assertEquals("-12", Datum.int64(-12).toString());
        assertEquals("null", Datum.nullOf(ScalarType.INT64).toString());
        assertEquals("\"say \\\"hi\\\"\"", Datum.string("say \"hi\"").toString());
        assertEquals("0.10", Datum.coerce(ScalarType.NUMERIC, new BigDecimal("0.10")).orElseThrow().toString());
        assertEquals("true", Datum.bool(true).toString());
    }

    @Test
    void floatingPointRendersWithoutExponent() {
        assertEquals("1.5", Datum.float64(1.5).toString());
        assertEquals("2.0", Datum.coerce(ScalarType.FLOAT64, 2L).orElseThrow().toString());
        assertEquals("100000000000000000000", Datum.float64(1.0E20).toString());
        assertEquals("-0.00025", Datum.float64(-2.5E-4).toString());
        assertEquals("1000000000000000000000000000000000000000",
                Datum.coerce(ScalarType.FLOAT64, new BigDecimal("1E39")).orElseThrow().toString());
        assertEquals("Infinity", Datum.float64(Double.POSITIVE_INFINITY).toString());
        assertEquals("NaN", Datum.float64(Double.NaN).toString());
    }

    @Test
    void ordering() {
        assertThat(Datum.int64(1).compareTo(Datum.int64(2)), lessThan(0));
        assertThat(Datum.nullOf(ScalarType.INT64).compareTo(Datum.int64(2)), greaterThan(0));
        assertThat(Datum.string("b").compareTo(Datum.string("a")), greaterThan(0));
        assertThrows(IllegalArgumentException.class, () -> Datum.int64(1).compareTo(Datum.string("a")));
    }
}
