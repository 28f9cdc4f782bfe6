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

import org.apache.nanocube.utils.Preconditions;
import org.apache.nanocube.utils.RoaringBitmap32;

import org.roaringbitmap.IntIterator;

import java.util.function.IntConsumer;

/** 基于 {@link RoaringBitmap32} 的行集合。 */
public final class BitmapRowSet implements RowSet {

    private final RoaringBitmap32 bitmap;

    private final int cardinality;

    BitmapRowSet(RoaringBitmap32 bitmap) {
        this.bitmap = bitmap;
        this.cardinality = (int) bitmap.getCardinality();
    }

    RoaringBitmap32 bitmap() {
        return bitmap;
    }

    @Override
    public int cardinality() {
        return cardinality;
    }

    @Override
    public boolean contains(int rowId) {
        return bitmap.contains(rowId);
    }

    @Override
    public RowSet union(RowSet other) {
        return new BitmapRowSet(RoaringBitmap32.or(bitmap, cast(other).bitmap));
    }

    @Override
    public RowSet intersect(RowSet other) {
        return new BitmapRowSet(RoaringBitmap32.and(bitmap, cast(other).bitmap));
    }

    @Override
    public int[] toArray() {
        return bitmap.toArray();
    }

    @Override
    public void forEach(IntConsumer consumer) {
        IntIterator iterator = bitmap.intIterator();
        while (iterator.hasNext()) {
            consumer.accept(iterator.next());
        }
    }

    @Override
    public IndexingMethod indexingMethod() {
        return IndexingMethod.ROARING;
    }

    static BitmapRowSet cast(RowSet rowSet) {
        Preconditions.checkArgument(
                rowSet instanceof BitmapRowSet,
                "Cannot combine a bitmap row set with %s.",
                rowSet.indexingMethod());
        return (BitmapRowSet) rowSet;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return bitmap.equals(((BitmapRowSet) o).bitmap);
    }

    @Override
    public int hashCode() {
        return bitmap.hashCode();
    }

    @Override
    public String toString() {
        return "BitmapRowSet" + bitmap;
    }
}
