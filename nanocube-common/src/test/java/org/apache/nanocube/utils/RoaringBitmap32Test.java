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

package org.apache.nanocube.utils;

import org.junit.jupiter.api.Test;
import org.roaringbitmap.IntIterator;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link RoaringBitmap32}. */
class RoaringBitmap32Test {

    @Test
    void testSetOperations() {
        RoaringBitmap32 a = RoaringBitmap32.fromSorted(new int[] {1, 3, 5, 7}, 4);
        RoaringBitmap32 b = RoaringBitmap32.fromSorted(new int[] {3, 4, 5}, 3);
        RoaringBitmap32 c = RoaringBitmap32.fromSorted(new int[] {9}, 1);

        assertThat(RoaringBitmap32.and(a, b).toArray()).containsExactly(3, 5);
        assertThat(RoaringBitmap32.or(a, b).toArray()).containsExactly(1, 3, 4, 5, 7);
        assertThat(RoaringBitmap32.or(Arrays.asList(a, b, c).iterator()).toArray())
                .containsExactly(1, 3, 4, 5, 7, 9);

        // static operations leave their inputs untouched
        assertThat(a.getCardinality()).isEqualTo(4);
        assertThat(a.contains(1)).isTrue();
        assertThat(a.contains(4)).isFalse();
    }

    @Test
    void testFromSortedHonoursLength() {
        int[] rows = {2, 4, 6, 8, 100};
        RoaringBitmap32 bitmap = RoaringBitmap32.fromSorted(rows, 4);
        assertThat(bitmap.toArray()).containsExactly(2, 4, 6, 8);

        List<Integer> iterated = new ArrayList<>();
        IntIterator iterator = bitmap.intIterator();
        while (iterator.hasNext()) {
            iterated.add(iterator.next());
        }
        assertThat(iterated).containsExactly(2, 4, 6, 8);
        assertThat(bitmap.clone()).isEqualTo(bitmap).isNotSameAs(bitmap);
    }

    @Test
    void testSerializeRoundTrip() throws IOException {
        int[] rows = new int[10_001];
        for (int i = 0; i < 10_000; i++) {
            rows[i] = i;
        }
        rows[10_000] = 70_000;
        RoaringBitmap32 bitmap = RoaringBitmap32.fromSorted(rows, rows.length);

        RoaringBitmap32 restored = new RoaringBitmap32();
        restored.deserialize(ByteBuffer.wrap(bitmap.serialize()));

        assertThat(restored).isEqualTo(bitmap);
        assertThat(restored.getCardinality()).isEqualTo(10_001);
        assertThat(new RoaringBitmap32().getCardinality()).isZero();
    }

    @Test
    void testToArrayIsUnsignedOrder() {
        RoaringBitmap32 bitmap = RoaringBitmap32.fromSorted(new int[] {0, 5, -1}, 3);
        assertThat(bitmap.toArray()).containsExactly(0, 5, -1);
    }
}
