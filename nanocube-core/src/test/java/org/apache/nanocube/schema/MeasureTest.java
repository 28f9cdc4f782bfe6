/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.nanocube.schema;

import org.apache.nanocube.CubeBuildException;
import org.apache.nanocube.data.InMemoryTable;
import org.apache.nanocube.types.DataType;
import org.apache.nanocube.types.DataTypes;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link Measure}. */
class MeasureTest {

    @Test
    void testIntegerColumn() {
        Measure measure = fromColumn(DataTypes.SMALLINT(), Arrays.asList(1, 2, 3));
        assertThat(measure.type()).isEqualTo(MeasureType.INT64);
        assertThat(measure.longValues()).containsExactly(1L, 2L, 3L);
        assertThat(measure.doubleValues()).isNull();
        assertThat(measure.toDoubleArray()).containsExactly(1.0, 2.0, 3.0);
    }

    @Test
    void testNullsPromoteToDouble() {
        Measure measure = fromColumn(DataTypes.BIGINT(), Arrays.asList(1L, null, 3L));
        assertThat(measure.type()).isEqualTo(MeasureType.FLOAT64);
        assertThat(measure.getDouble(0)).isEqualTo(1.0);
        assertThat(measure.getDouble(1)).isNaN();
        assertThat(measure.longValues()).isNull();
    }

    @Test
    void testDecimalColumn() {
        Measure measure =
                fromColumn(
                        DataTypes.DECIMAL(),
                        Arrays.asList(new BigDecimal("1.25"), null, new BigDecimal("2")));
        assertThat(measure.type()).isEqualTo(MeasureType.FLOAT64);
        assertThat(measure.getDouble(0)).isEqualTo(1.25);
        assertThat(measure.getDouble(1)).isNaN();
        assertThat(measure.getDouble(2)).isEqualTo(2.0);
    }

    @Test
    void testNonNumericValue() {
        assertThatThrownBy(
                        () ->
                                fromColumn(
                                        DataTypes.DECIMAL(),
                                        Arrays.asList(new BigDecimal("1"), "two")))
                .isInstanceOf(CubeBuildException.class)
                .hasMessageContaining("'two'")
                .hasMessageContaining("row 1");
    }

    private static Measure fromColumn(DataType type, List<?> values) {
        InMemoryTable table = InMemoryTable.builder().column("m", type, values).build();
        return Measure.fromColumn("m", type, table.column("m"), table.rowCount());
    }
}
