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

import org.apache.nanocube.utils.RoaringBitmap32;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Iterator;
import java.util.List;

/** {@link IndexingMethod#ROARING} 的实现,序列化使用 Roaring 的可移植格式。 */
public final class BitmapBackend implements RowSetBackend {

    public static final BitmapBackend INSTANCE = new BitmapBackend();

    private static final BitmapRowSet EMPTY = new BitmapRowSet(new RoaringBitmap32());

    private BitmapBackend() {}

    @Override
    public IndexingMethod indexingMethod() {
        return IndexingMethod.ROARING;
    }

    @Override
    public RowSet fromSorted(int[] sortedIds, int length) {
        return new BitmapRowSet(RoaringBitmap32.fromSorted(sortedIds, length));
    }

    @Override
    public RowSet empty() {
        return EMPTY;
    }

    @Override
    public RowSet unionAll(List<RowSet> rowSets) {
        if (rowSets.isEmpty()) {
            return EMPTY;
        }
        if (rowSets.size() == 1) {
            return BitmapRowSet.cast(rowSets.get(0));
        }
        Iterator<RowSet> iterator = rowSets.iterator();
        return new BitmapRowSet(
                RoaringBitmap32.or(
                        new Iterator<RoaringBitmap32>() {
                            @Override
                            public boolean hasNext() {
                                return iterator.hasNext();
                            }

                            @Override
                            public RoaringBitmap32 next() {
                                return BitmapRowSet.cast(iterator.next()).bitmap();
                            }
                        }));
    }

    @Override
    public byte[] serialize(RowSet rowSet) {
        // serialize() runs runOptimize on the bitmap, work on a copy
        return BitmapRowSet.cast(rowSet).bitmap().clone().serialize();
    }

    @Override
    public RowSet deserialize(byte[] bytes) throws IOException {
        RoaringBitmap32 bitmap = new RoaringBitmap32();
        try {
            bitmap.deserialize(ByteBuffer.wrap(bytes));
        } catch (RuntimeException e) {
            throw new IOException("Corrupted roaring bitmap.", e);
        }
        return new BitmapRowSet(bitmap);
    }
}
