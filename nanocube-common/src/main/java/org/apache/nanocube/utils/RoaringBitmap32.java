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

import org.roaringbitmap.IntIterator;
import org.roaringbitmap.RoaringBitmap;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Iterator;
import java.util.Objects;

/**
 * 对 {@link RoaringBitmap} 的 32 位包装。
 *
 * <p>把第三方位图类型限制在这一个类中,索引层只依赖这里暴露的操作。序列化使用 Roaring 的可移植格式,
 * 序列化前会执行 {@code runOptimize} 以压缩连续区间。
 */
public class RoaringBitmap32 {

    private final RoaringBitmap roaringBitmap;

    public RoaringBitmap32() {
        this.roaringBitmap = new RoaringBitmap();
    }

    private RoaringBitmap32(RoaringBitmap roaringBitmap) {
        this.roaringBitmap = roaringBitmap;
    }

    public boolean contains(int x) {
        return roaringBitmap.contains(x);
    }

    public long getCardinality() {
        return roaringBitmap.getLongCardinality();
    }

    public RoaringBitmap32 clone() {
        return new RoaringBitmap32(roaringBitmap.clone());
    }

    public byte[] serialize() {
        roaringBitmap.runOptimize();
        ByteBuffer buffer = ByteBuffer.allocate(roaringBitmap.serializedSizeInBytes());
        roaringBitmap.serialize(buffer);
        return buffer.array();
    }

    public void deserialize(ByteBuffer buffer) throws IOException {
        roaringBitmap.deserialize(buffer);
    }

    /** 按无符号顺序返回所有元素,大于 {@link Integer#MAX_VALUE} 的元素以负数出现在末尾。 */
    public int[] toArray() {
        return roaringBitmap.toArray();
    }

    /** 升序的原始 int 迭代器,避免装箱。 */
    public IntIterator intIterator() {
        return roaringBitmap.getIntIterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RoaringBitmap32 that = (RoaringBitmap32) o;
        return Objects.equals(this.roaringBitmap, that.roaringBitmap);
    }

    @Override
    public int hashCode() {
        return roaringBitmap.hashCode();
    }

    @Override
    public String toString() {
        return roaringBitmap.toString();
    }

    /**
     * 由升序数组批量构建位图。
     *
     * @param sorted 升序且无重复的元素
     * @param length 有效元素个数
     */
    public static RoaringBitmap32 fromSorted(int[] sorted, int length) {
        RoaringBitmap bitmap = new RoaringBitmap();
        bitmap.addN(sorted, 0, length);
        bitmap.runOptimize();
        return new RoaringBitmap32(bitmap);
    }

    public static RoaringBitmap32 and(final RoaringBitmap32 x1, final RoaringBitmap32 x2) {
        return new RoaringBitmap32(RoaringBitmap.and(x1.roaringBitmap, x2.roaringBitmap));
    }

    public static RoaringBitmap32 or(final RoaringBitmap32 x1, final RoaringBitmap32 x2) {
        return new RoaringBitmap32(RoaringBitmap.or(x1.roaringBitmap, x2.roaringBitmap));
    }

    public static RoaringBitmap32 or(Iterator<RoaringBitmap32> iterator) {
        return new RoaringBitmap32(
                RoaringBitmap.or(
                        new Iterator<RoaringBitmap>() {
                            @Override
                            public boolean hasNext() {
                                return iterator.hasNext();
                            }

                            @Override
                            public RoaringBitmap next() {
                                return iterator.next().roaringBitmap;
                            }
                        }));
    }
}
