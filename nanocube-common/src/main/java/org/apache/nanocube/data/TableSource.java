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

package org.apache.nanocube.data;

import org.apache.nanocube.annotation.Public;
import org.apache.nanocube.data.columnar.ColumnVector;
import org.apache.nanocube.types.DataField;

import java.util.List;

/**
 * 构建立方体时读取的表格数据源。
 *
 * <p>行号是 {@code [0, rowCount())} 中的位置,同一个数据源的所有列必须按相同的行顺序给出。
 * 立方体构建完成后不再持有数据源的引用。
 *
 * <p>列向量的具体类型由字段类型决定:
 *
 * <ul>
 *   <li>TINYINT、SMALLINT、INT、BIGINT:{@link org.apache.nanocube.data.columnar.LongColumnVector}
 *   <li>FLOAT、DOUBLE:{@link org.apache.nanocube.data.columnar.DoubleColumnVector}
 *   <li>BOOLEAN:{@link org.apache.nanocube.data.columnar.BooleanColumnVector}
 *   <li>其它类型:{@link org.apache.nanocube.data.columnar.ObjectColumnVector}
 * </ul>
 *
 * <p>任何列也可以用 {@link org.apache.nanocube.data.columnar.ObjectColumnVector} 提供,读取方会按字段类型校验值。
 */
@Public
public interface TableSource {

    int rowCount();

    /** 按列顺序返回所有字段。 */
    List<DataField> fields();

    /**
     * 返回指定列的向量。
     *
     * @throws IllegalArgumentException 列不存在时抛出
     */
    ColumnVector column(String name);
}
