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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link DeltaVarintCompressor}. */
class DeltaVarintCompressorTest {

    @Test
    void testAscendingRowIds() {
        int[] rows = {0, 1, 2, 3, 10, 127, 128, 1_000_000, Integer.MAX_VALUE};
        byte[] compressed = DeltaVarintCompressor.compress(rows);
        assertThat(DeltaVarintCompressor.decompress(compressed)).containsExactly(rows);
    }

    @Test
    void testSmallDeltasUseOneByte() {
        int[] rows = new int[100];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = i * 3;
        }
        assertThat(DeltaVarintCompressor.compress(rows)).hasSize(rows.length);
    }

    @Test
    void testNegativeAndDescendingValues() {
        int[] values = {5, -3, Integer.MIN_VALUE, Integer.MAX_VALUE, 0};
        assertThat(DeltaVarintCompressor.decompress(DeltaVarintCompressor.compress(values)))
                .containsExactly(values);
    }

    @Test
    void testEmpty() {
        assertThat(DeltaVarintCompressor.compress(new int[0])).isEmpty();
        assertThat(DeltaVarintCompressor.decompress(new byte[0])).isEmpty();
    }

    @Test
    void testTruncatedInput() {
        byte[] truncated = {(byte) 0x80};
        assertThatThrownBy(() -> DeltaVarintCompressor.decompress(truncated))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("end of input");
    }

    @Test
    void testOverflowingValue() {
        int[] max = {Integer.MAX_VALUE};
        byte[] head = DeltaVarintCompressor.compress(max);
        byte[] overflow = new byte[head.length + 1];
        System.arraycopy(head, 0, overflow, 0, head.length);
        overflow[head.length] = 2;
        assertThatThrownBy(() -> DeltaVarintCompressor.decompress(overflow))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("overflows");
    }
}
