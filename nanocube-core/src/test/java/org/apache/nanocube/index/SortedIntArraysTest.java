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

import org.junit.jupiter.api.Test;

import java.util.Random;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link SortedIntArrays}. */
class SortedIntArraysTest {

    @Test
    void testUnion() {
        assertThat(SortedIntArrays.union(new int[] {1, 3, 5}, new int[] {2, 3, 6}))
                .containsExactly(1, 2, 3, 5, 6);
        assertThat(SortedIntArrays.union(new int[0], new int[] {4})).containsExactly(4);
        assertThat(SortedIntArrays.union(new int[] {4}, new int[0])).containsExactly(4);
    }

    @Test
    void testIntersect() {
        assertThat(SortedIntArrays.intersect(new int[] {1, 3, 5, 7}, new int[] {3, 4, 7, 9}))
                .containsExactly(3, 7);
        assertThat(SortedIntArrays.intersect(new int[] {1, 2}, new int[] {3, 4})).isEmpty();
        assertThat(SortedIntArrays.intersect(new int[0], new int[] {3, 4})).isEmpty();
    }

    @Test
    void testGallopingMatchesMerge() {
        Random random = new Random(11);
        for (int round = 0; round < 50; round++) {
            int[] small = randomSorted(random, 1 + random.nextInt(10), 100_000);
            int[] large = randomSorted(random, 2_000 + random.nextInt(3_000), 100_000);
            int[] expected = SortedIntArrays.mergeIntersect(small, large);

            assertThat(SortedIntArrays.gallopingIntersect(small, large)).isEqualTo(expected);
            assertThat(SortedIntArrays.intersect(small, large)).isEqualTo(expected);
            assertThat(SortedIntArrays.intersect(large, small)).isEqualTo(expected);
        }
    }

    @Test
    void testGallopingEdges() {
        int[] large = new int[1000];
        for (int i = 0; i < large.length; i++) {
            large[i] = i * 2;
        }
        assertThat(SortedIntArrays.gallopingIntersect(new int[] {0, 1998}, large))
                .containsExactly(0, 1998);
        assertThat(SortedIntArrays.gallopingIntersect(new int[] {-1, 1999, 5000}, large))
                .isEmpty();
        assertThat(SortedIntArrays.gallopingIntersect(new int[] {3, 4, 5, 6}, large))
                .containsExactly(4, 6);
    }

    @Test
    void testStrictlyAscending() {
        assertThat(SortedIntArrays.isStrictlyAscending(new int[0])).isTrue();
        assertThat(SortedIntArrays.isStrictlyAscending(new int[] {0, 2, 9})).isTrue();
        assertThat(SortedIntArrays.isStrictlyAscending(new int[] {0, 2, 2})).isFalse();
        assertThat(SortedIntArrays.isStrictlyAscending(new int[] {-1, 2})).isFalse();
    }

    private static int[] randomSorted(Random random, int size, int bound) {
        TreeSet<Integer> values = new TreeSet<>();
        while (values.size() < size) {
            values.add(random.nextInt(bound));
        }
        return values.stream().mapToInt(Integer::intValue).toArray();
    }
}
