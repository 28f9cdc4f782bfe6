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

import java.util.function.IntConsumer;

/**
 * 不可变的行号集合。
 *
 * <p>集合运算返回新实例,不修改参与运算的集合。同一次运算的两个集合必须来自同一个 {@link RowSetBackend}。
 */
public interface RowSet {

    int cardinality();

    default boolean isEmpty() {
        return cardinality() == 0;
    }

    boolean contains(int rowId);

    RowSet union(RowSet other);

    RowSet intersect(RowSet other);

    /** 以升序返回所有行号。 */
    int[] toArray();

    /** 按升序遍历所有行号。 */
    void forEach(IntConsumer consumer);

    IndexingMethod indexingMethod();
}
