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

/**
 * 成员索引中行集合的表示方式。
 *
 * <p>两种方式对任意查询返回相同的结果,只在内存占用和集合运算速度上有差别。{@code persistentId}
 * 会写入立方体文件头,已分配的编号不能修改。
 */
public enum IndexingMethod {

    /** Roaring 压缩位图,适合大基数且分布密集的成员。 */
    ROARING(0),

    /** 升序 int 数组,适合成员很多且每个成员只覆盖少量行的维度。 */
    SORTED_ARRAY(1);

    private final int persistentId;

    IndexingMethod(int persistentId) {
        this.persistentId = persistentId;
    }

    public int persistentId() {
        return persistentId;
    }

    public RowSetBackend backend() {
        switch (this) {
            case ROARING:
                return BitmapBackend.INSTANCE;
            case SORTED_ARRAY:
                return SortedArrayBackend.INSTANCE;
            default:
                throw new IllegalStateException("Unknown indexing method " + this);
        }
    }

    public static IndexingMethod fromPersistentId(int persistentId) {
        for (IndexingMethod method : values()) {
            if (method.persistentId == persistentId) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown persistentId " + persistentId);
    }
}
