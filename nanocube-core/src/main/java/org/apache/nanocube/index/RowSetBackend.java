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

import java.io.IOException;
import java.util.List;

/**
 * 行集合的构造与序列化方式。
 *
 * <p>每种 {@link IndexingMethod} 对应一个无状态的实现。
 */
public interface RowSetBackend {

    IndexingMethod indexingMethod();

    /**
     * 由升序且无重复的行号构造集合。
     *
     * @param sortedIds 行号数组,只读取前 {@code length} 个元素,调用方之后不能再修改该数组
     * @param length 有效元素个数
     */
    RowSet fromSorted(int[] sortedIds, int length);

    RowSet empty();

    /** 多个集合的并集,输入为空时返回空集合。 */
    RowSet unionAll(List<RowSet> rowSets);

    byte[] serialize(RowSet rowSet);

    /**
     * 反序列化 {@link #serialize(RowSet)} 的输出。
     *
     * @throws IOException 数据损坏时抛出
     */
    RowSet deserialize(byte[] bytes) throws IOException;
}
