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

package org.apache.nanocube;

import org.apache.nanocube.data.InMemoryTable;
import org.apache.nanocube.index.IndexingMethod;
import org.apache.nanocube.query.Aggregation;
import org.apache.nanocube.query.Query;
import org.apache.nanocube.query.QueryResult;
import org.apache.nanocube.query.UnknownNameException;
import org.apache.nanocube.schema.MeasureType;
import org.apache.nanocube.types.DataTypes;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.apache.nanocube.CubeTestUtils.salesTable;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/** Tests for {@link NanoCube}. */
class NanoCubeTest {

    @ParameterizedTest
    @EnumSource(IndexingMethod.class)
    void testPointQueries(IndexingMethod method) {
        NanoCube cube = NanoCube.builder(salesTable()).indexingMethod(method).build();

        assertThat(cube.rowCount()).isEqualTo(5);
        assertThat(cube.indexingMethod()).isEqualTo(method);
        assertThat(cube.dimensionNames()).containsExactly("customer", "product");
        assertThat(cube.measureNames()).containsExactly("sales");

        Map<String, Object> filters = new HashMap<>();
        filters.put("customer", "A");
        filters.put("product", "P1");
        assertThat(cube.get("sales", filters).asNumber()).isEqualTo(100L);

        assertThat(cube.get("sales", filter("customer", "A")).asNumber())
                .isEqualTo(900L);
        assertThat(
                        cube.get("sales", filter("product", Arrays.asList("P1", "P2")))
                                .asNumber())
                .isEqualTo(1200L);
        assertThat(cube.get("sales", Collections.emptyMap()).asNumber()).isEqualTo(1500L);
    }

    @Test
    void testArrayFilterMeansAnyOf() {
        NanoCube cube = NanoCube.builder(salesTable()).build();
        assertThat(
                        cube.get("sales", filter("product", new String[] {"P1", "P3"}))
                                .asLong())
                .isEqualTo(800L);
    }

    @Test
    void testResultShapes() {
        InMemoryTable table =
                InMemoryTable.builder()
                        .field("customer", DataTypes.STRING())
                        .field("sales", DataTypes.BIGINT())
                        .field("cost", DataTypes.DOUBLE())
                        .addRow("A", 100L, 1.5)
                        .addRow("B", 200L, 2.5)
                        .addRow("A", 300L, 3.0)
                        .build();
        NanoCube cube = NanoCube.builder(table).build();
        Map<String, Object> onlyA = filter("customer", "A");

        QueryResult scalar = cube.get("cost", onlyA);
        assertThat(scalar.kind()).isEqualTo(QueryResult.Kind.SCALAR);
        assertThat(scalar.asNumber()).isEqualTo(4.5);

        QueryResult vector = cube.get(Arrays.asList("cost", "sales"), onlyA);
        assertThat(vector.kind()).isEqualTo(QueryResult.Kind.VECTOR);
        assertThat(vector.asList()).containsExactly(4.5, 400L);

        QueryResult map = cube.get(onlyA, Aggregation.MAX);
        assertThat(map.kind()).isEqualTo(QueryResult.Kind.MAP);
        Map<String, Number> expected = new LinkedHashMap<>();
        expected.put("sales", 300L);
        expected.put("cost", 3.0);
        assertThat(map.asMap()).containsExactlyEntriesOf(expected);

        assertThatThrownBy(map::asNumber).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testResultTypes() {
        NanoCube cube = NanoCube.builder(salesTable()).build();
        Map<String, Object> onlyA = filter("customer", "A");

        assertThat(cube.get("sales", onlyA, Aggregation.SUM).asNumber()).isInstanceOf(Long.class);
        assertThat(cube.get("sales", onlyA, Aggregation.MIN).asNumber()).isEqualTo(100L);
        assertThat(cube.get("sales", onlyA, Aggregation.MAX).asNumber()).isEqualTo(500L);
        assertThat(cube.get("sales", onlyA, Aggregation.COUNT).asNumber()).isEqualTo(3L);
        assertThat(cube.get("sales", onlyA, Aggregation.MEAN).asNumber()).isEqualTo(300.0);
        assertThat(cube.get("sales", onlyA, Aggregation.VAR).asDouble())
                .isCloseTo(80000.0 / 3, within(1e-9));
        assertThat(cube.get("sales", onlyA, Aggregation.STD).asDouble())
                .isCloseTo(Math.sqrt(80000.0 / 3), within(1e-9));
    }

    @ParameterizedTest
    @EnumSource(IndexingMethod.class)
    void testUnionOfDisjointMembers(IndexingMethod method) {
        NanoCube cube = NanoCube.builder(salesTable()).indexingMethod(method).build();
        long p1 = cube.get("sales", filter("product", "P1")).asLong();
        long p2 = cube.get("sales", filter("product", "P2")).asLong();
        long any = cube.get("sales", filter("product", Arrays.asList("P1", "P2"))).asLong();
        assertThat(any).isEqualTo(p1 + p2);

        Map<String, Object> filters = new HashMap<>();
        filters.put("customer", Arrays.asList("A", "B"));
        filters.put("product", "P3");
        assertThat(cube.get("sales", filters).asLong()).isEqualTo(300L);
    }

    @Test
    void testUnknownMemberYieldsIdentity() {
        NanoCube cube = NanoCube.builder(salesTable()).build();

        assertThat(cube.get("sales", filter("customer", "Z")).asNumber()).isEqualTo(0L);
        assertThat(cube.get("sales", filter("customer", "Z"), Aggregation.MEAN).asNumber())
                .isEqualTo(0.0);
        // members of a foreign type never match
        assertThat(cube.get("sales", filter("customer", 1)).asNumber()).isEqualTo(0L);
        assertThat(cube.get("sales", filter("customer", Arrays.asList("A", "Z"))).asNumber())
                .isEqualTo(900L);
        assertThat(cube.get("sales", filter("customer", Collections.emptyList())).asNumber())
                .isEqualTo(0L);
    }

    @Test
    void testUnknownNames() {
        NanoCube cube = NanoCube.builder(salesTable()).build();

        assertThatThrownBy(() -> cube.get("profit", Collections.emptyMap()))
                .isInstanceOf(UnknownNameException.class)
                .hasMessageContaining("profit")
                .satisfies(
                        e ->
                                assertThat(((UnknownNameException) e).kind())
                                        .isEqualTo(UnknownNameException.Kind.MEASURE));
        assertThatThrownBy(() -> cube.get("sales", filter("store", "S1")))
                .isInstanceOf(UnknownNameException.class)
                .hasMessageContaining("store")
                .satisfies(
                        e ->
                                assertThat(((UnknownNameException) e).kind())
                                        .isEqualTo(UnknownNameException.Kind.DIMENSION));
        assertThatThrownBy(() -> cube.dimension("sales"))
                .isInstanceOf(UnknownNameException.class);
        assertThatThrownBy(() -> cube.measure("customer"))
                .isInstanceOf(UnknownNameException.class);
    }

    @Test
    void testCacheIsTransparent() {
        NanoCube cube = NanoCube.builder(salesTable()).build();
        Map<String, Object> filters = filter("customer", "B");

        QueryResult first = cube.get("sales", filters);
        assertThat(cube.cacheSize()).isEqualTo(1);
        QueryResult second = cube.get("sales", filters);
        assertThat(second).isEqualTo(first);
        assertThat(cube.cacheSize()).isEqualTo(1);

        // a single member and a one element list share one cache entry
        cube.get("sales", filter("customer", Collections.singletonList("B")));
        assertThat(cube.cacheSize()).isEqualTo(1);

        cube.get("sales", filters, Aggregation.MEAN);
        assertThat(cube.cacheSize()).isEqualTo(2);

        cube.invalidateCache();
        assertThat(cube.cacheSize()).isZero();
        assertThat(cube.get("sales", filters)).isEqualTo(first);
    }

    @Test
    void testCacheDisabled() {
        NanoCube cube =
                NanoCube.builder(salesTable()).option(CubeOptions.CACHE_ENABLED, false).build();
        assertThat(cube.get("sales", filter("customer", "A")).asLong())
                .isEqualTo(900L);
        assertThat(cube.cacheSize()).isZero();
    }

    @Test
    void testFilterOrderDoesNotMatter() {
        NanoCube cube = NanoCube.builder(salesTable()).build();
        Query forward =
                Query.builder()
                        .measures("sales")
                        .filter("customer", "A")
                        .filterAny("product", "P2", "P1")
                        .build();
        Query backward =
                Query.builder()
                        .measures("sales")
                        .filterAny("product", "P1", "P2", "P1")
                        .filter("customer", "A")
                        .build();
        assertThat(cube.get(forward).asLong()).isEqualTo(600L);
        assertThat(cube.get(backward)).isEqualTo(cube.get(forward));
        assertThat(cube.cacheSize()).isEqualTo(1);
    }

    @Test
    void testNullMember() {
        InMemoryTable table =
                InMemoryTable.builder()
                        .field("region", DataTypes.STRING())
                        .field("units", DataTypes.BIGINT())
                        .addRow("north", 1L)
                        .addRow(null, 2L)
                        .addRow("south", 4L)
                        .addRow(null, 8L)
                        .build();
        NanoCube cube = NanoCube.builder(table).build();

        assertThat(cube.dimension("region").members()).containsExactly("north", "south");
        assertThat(cube.dimension("region").hasNullMember()).isTrue();
        assertThat(cube.get("units", filter("region", null)).asLong())
                .isEqualTo(10L);
        assertThat(
                        cube.get("units", filter("region", Arrays.asList(null, "north")))
                                .asLong())
                .isEqualTo(11L);
        assertThat(cube.get("units", Collections.emptyMap()).asLong()).isEqualTo(15L);
    }

    @Test
    void testIntegerMeasureWithNullsIsPromoted() {
        InMemoryTable table =
                InMemoryTable.builder()
                        .field("customer", DataTypes.STRING())
                        .field("units", DataTypes.INT())
                        .addRow("A", 1)
                        .addRow("A", null)
                        .addRow("B", 5)
                        .build();
        NanoCube cube = NanoCube.builder(table).build();

        assertThat(cube.measure("units").type()).isEqualTo(MeasureType.FLOAT64);
        Map<String, Object> onlyA = filter("customer", "A");
        assertThat(cube.get("units", onlyA).asNumber()).isEqualTo(1.0);
        assertThat(cube.get("units", onlyA, Aggregation.COUNT).asNumber()).isEqualTo(1L);
        assertThat(cube.get("units", onlyA, Aggregation.MEAN).asNumber()).isEqualTo(1.0);
    }

    @Test
    void testExplicitColumns() {
        InMemoryTable table =
                InMemoryTable.builder()
                        .field("year", DataTypes.INT())
                        .field("day", DataTypes.DATE())
                        .field("sales", DataTypes.BIGINT())
                        .field("price", DataTypes.DOUBLE())
                        .addRow(2023, LocalDate.of(2023, 5, 1), 10L, 1.0)
                        .addRow(2024, LocalDate.of(2024, 5, 1), 20L, 2.0)
                        .addRow(2024, LocalDate.of(2024, 6, 1), 30L, 4.0)
                        .build();
        NanoCube cube = NanoCube.builder(table).dimensions("year", "day").build();

        assertThat(cube.dimensionNames()).containsExactly("year", "day");
        assertThat(cube.measureNames()).containsExactly("sales", "price");
        assertThat(cube.get("sales", filter("year", 2024)).asLong())
                .isEqualTo(50L);
        assertThat(cube.get("sales", filter("year", 2024L)).asLong())
                .isEqualTo(50L);
        assertThat(
                        cube.get("price", filter("day", LocalDate.of(2024, 6, 1)))
                                .asDouble())
                .isEqualTo(4.0);

        NanoCube onlyPrice = NanoCube.builder(table).measures("price").build();
        assertThat(onlyPrice.measureNames()).containsExactly("price");
        assertThat(onlyPrice.dimensionNames()).containsExactly("day");
    }

    @Test
    void testInvalidBuild() {
        assertThatThrownBy(() -> NanoCube.builder(salesTable()).dimensions("store").build())
                .isInstanceOf(CubeBuildException.class)
                .hasMessageContaining("store");
        assertThatThrownBy(() -> NanoCube.builder(salesTable()).measures("customer").build())
                .isInstanceOf(CubeBuildException.class)
                .hasMessageContaining("customer");
        assertThatThrownBy(
                        () ->
                                NanoCube.builder(salesTable())
                                        .dimensions("customer", "sales")
                                        .measures("sales")
                                        .build())
                .isInstanceOf(CubeBuildException.class)
                .hasMessageContaining("sales");
        assertThatThrownBy(
                        () ->
                                NanoCube.builder(salesTable())
                                        .option(CubeOptions.INDEX_BUILD_PARALLELISM, 0)
                                        .build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testParallelBuildMatchesSequentialBuild() {
        InMemoryTable table = CubeTestUtils.randomTable(7, 2_000);
        NanoCube sequential = NanoCube.builder(table).build();
        NanoCube parallel =
                NanoCube.builder(table).option(CubeOptions.INDEX_BUILD_PARALLELISM, 4).build();

        assertThat(parallel.dimensionNames()).isEqualTo(sequential.dimensionNames());
        for (String name : sequential.dimensionNames()) {
            assertThat(parallel.dimension(name).members())
                    .isEqualTo(sequential.dimension(name).members());
            for (Object member : sequential.dimension(name).members()) {
                assertThat(parallel.dimension(name).rowsFor(member).toArray())
                        .isEqualTo(sequential.dimension(name).rowsFor(member).toArray());
            }
        }
        List<String> measures = Arrays.asList("units", "price");
        Map<String, Object> filters = filter("customer", "C");
        assertThat(parallel.get(measures, filters)).isEqualTo(sequential.get(measures, filters));
    }

    @Test
    void testEmptyTable() {
        InMemoryTable table =
                InMemoryTable.builder()
                        .field("customer", DataTypes.STRING())
                        .field("sales", DataTypes.BIGINT())
                        .build();
        NanoCube cube = NanoCube.builder(table).build();
        assertThat(cube.rowCount()).isZero();
        assertThat(cube.dimension("customer").members()).isEmpty();
        assertThat(cube.get("sales", Collections.emptyMap()).asNumber()).isEqualTo(0L);
        assertThat(cube.get("sales", filter("customer", "A")).asNumber())
                .isEqualTo(0L);
    }

    private static Map<String, Object> filter(String dimension, Object value) {
        return Collections.singletonMap(dimension, value);
    }
}
