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

import java.util.Arrays;
import java.util.function.IntConsumer;

/** 基于升序 int 数组的行集合。 */
public final class SortedArrayRowSet implements RowSet {

    private final int[] ids;

    SortedArrayRowSet(int[] ids) {
        this.ids = ids;
    }

    int[] ids() {
        return ids;
    }

    @Override
    public int cardinality() {
        return ids.length;
    }

    @Override
    public boolean contains(int rowId) {
        return Arrays.binarySearch(ids, rowId) >= 0;
    }

    @Override
    public RowSet union(RowSet other) {
        return new SortedArrayRowSet(SortedIntArrays.union(ids, cast(other).ids));
    }

    @Override
    public RowSet intersect(RowSet other) {
        return new SortedArrayRowSet(SortedIntArrays.intersect(ids, cast(other).ids));
    }

    @Override
    public int[] toArray() {
        return ids.clone();
    }

    @Override
    public void forEach(IntConsumer consumer) {
        for (int id : ids) {
            consumer.accept(id);
        }
    }

    @Override
    public IndexingMethod indexingMethod() {
        return IndexingMethod.SORTED_ARRAY;
    }

    static SortedArrayRowSet cast(RowSet rowSet) {
        Preconditions.checkArgument(
                rowSet instanceof SortedArrayRowSet,
                "Cannot combine a sorted array row set with %s.",
                rowSet.indexingMethod());
        return (SortedArrayRowSet) rowSet;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(ids, ((SortedArrayRowSet) o).ids);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(ids);
    }

    @Override
    public String toString() {
        return "SortedArrayRowSet" + Arrays.toString(ids);
    }
}
