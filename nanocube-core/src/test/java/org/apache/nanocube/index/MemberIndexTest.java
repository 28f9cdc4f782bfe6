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

package org.apache.nanocube.index;

import org.apache.nanocube.CubeBuildException;
import org.apache.nanocube.data.InMemoryTable;
import org.apache.nanocube.types.DataType;
import org.apache.nanocube.types.DataTypes;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link MemberIndex}. */
class MemberIndexTest {

    @Test
    void testMembersPartitionRows() {
        MemberIndex index =
                build(DataTypes.STRING(), Arrays.asList("b", "a", null, "b", "c", null, "a"));

        assertThat(index.members()).containsExactly("a", "b", "c");
        assertThat(index.memberCount()).isEqualTo(3);
        assertThat(index.rowsFor("a").toArray()).containsExactly(1, 6);
        assertThat(index.rowsFor("b").toArray()).containsExactly(0, 3);
        assertThat(index.rowsFor(null).toArray()).containsExactly(2, 5);
        assertThat(index.hasNullMember()).isTrue();
        assertThat(index.rowsFor("z").isEmpty()).isTrue();
        assertThat(index.rowsForAny(Arrays.asList("c", "a", "c")).toArray())
                .containsExactly(1, 4, 6);
    }

    @Test
    void testIntegerMembersAcceptAnyIntegralFilter() {
        MemberIndex index = build(DataTypes.INT(), Arrays.asList(2020, 2021, 2020));

        assertThat(index.members()).containsExactly(2020L, 2021L);
        assertThat(index.rowsFor(2020).toArray()).containsExactly(0, 2);
        assertThat(index.rowsFor(2020L).toArray()).containsExactly(0, 2);
        assertThat(index.rowsFor((short) 2021).toArray()).containsExactly(1);
        assertThat(index.rowsFor(2020.0).isEmpty()).isTrue();
        assertThat(index.rowsFor("2020").isEmpty()).isTrue();
        assertThat(index.hasNullMember()).isFalse();
        assertThat(index.rowsFor(null).isEmpty()).isTrue();
    }

    @Test
    void testBooleanAndDateMembers() {
        MemberIndex flags = build(DataTypes.BOOLEAN(), Arrays.asList(true, false, true));
        assertThat(flags.members()).containsExactly(false, true);
        assertThat(flags.rowsFor(true).toArray()).containsExactly(0, 2);

        LocalDate day = LocalDate.of(2024, 2, 29);
        MemberIndex days = build(DataTypes.DATE(), Arrays.asList(day, day.plusDays(1), day));
        assertThat(days.rowsFor(day).toArray()).containsExactly(0, 2);
        assertThat(days.rowsFor("2024-02-29").isEmpty()).isTrue();
    }

    @Test
    void testInvalidColumns() {
        assertThatThrownBy(() -> build(DataTypes.STRING(), Arrays.asList("a", 1)))
                .isInstanceOf(CubeBuildException.class)
                .hasMessageContaining("dim")
                .hasMessageContaining("row 1");
        assertThatThrownBy(() -> build(DataTypes.BYTES(), Arrays.asList(new byte[] {1})))
                .isInstanceOf(CubeBuildException.class)
                .hasMessageContaining("cannot be indexed");
    }

    private static MemberIndex build(DataType type, List<?> values) {
        InMemoryTable table = InMemoryTable.builder().column("dim", type, values).build();
        return MemberIndex.build(
                "dim",
                type,
                table.column("dim"),
                table.rowCount(),
                IndexingMethod.SORTED_ARRAY.backend());
    }
}
