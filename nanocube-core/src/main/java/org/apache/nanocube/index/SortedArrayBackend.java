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

import org.apache.nanocube.utils.DeltaVarintCompressor;

import java.io.IOException;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/** {@link IndexingMethod#SORTED_ARRAY} 的实现,序列化使用差分 Varint 编码。 */
public final class SortedArrayBackend implements RowSetBackend {

    public static final SortedArrayBackend INSTANCE = new SortedArrayBackend();

    private static final SortedArrayRowSet EMPTY = new SortedArrayRowSet(new int[0]);

    private SortedArrayBackend() {}

    @Override
    public IndexingMethod indexingMethod() {
        return IndexingMethod.SORTED_ARRAY;
    }

    @Override
    public RowSet fromSorted(int[] sortedIds, int length) {
        if (length == 0) {
            return EMPTY;
        }
        return new SortedArrayRowSet(
                length == sortedIds.length ? sortedIds : Arrays.copyOf(sortedIds, length));
    }

    @Override
    public RowSet empty() {
        return EMPTY;
    }

    /** 总是先合并最短的两个数组,使总的归并代价最小。 */
    @Override
    public RowSet unionAll(List<RowSet> rowSets) {
        if (rowSets.isEmpty()) {
            return EMPTY;
        }
        if (rowSets.size() == 1) {
            return SortedArrayRowSet.cast(rowSets.get(0));
        }
        PriorityQueue<int[]> queue =
                new PriorityQueue<>(rowSets.size(), Comparator.comparingInt(a -> a.length));
        for (RowSet rowSet : rowSets) {
            queue.add(SortedArrayRowSet.cast(rowSet).ids());
        }
        while (queue.size() > 1) {
            queue.add(SortedIntArrays.union(queue.poll(), queue.poll()));
        }
        return new SortedArrayRowSet(queue.poll());
    }

    @Override
    public byte[] serialize(RowSet rowSet) {
        return DeltaVarintCompressor.compress(SortedArrayRowSet.cast(rowSet).ids());
    }

    @Override
    public RowSet deserialize(byte[] bytes) throws IOException {
        int[] ids;
        try {
            ids = DeltaVarintCompressor.decompress(bytes);
        } catch (IllegalArgumentException e) {
            throw new IOException("Corrupted sorted row id array.", e);
        }
        if (!SortedIntArrays.isStrictlyAscending(ids)) {
            throw new IOException("Row ids are not strictly ascending.");
        }
        return ids.length == 0 ? EMPTY : new SortedArrayRowSet(ids);
    }
}
