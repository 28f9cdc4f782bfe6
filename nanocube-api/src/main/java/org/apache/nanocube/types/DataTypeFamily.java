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

package org.apache.nanocube.types;

import org.apache.nanocube.annotation.Public;

/**
 * 数据类型族,用于按大类判断列的角色。
 *
 * <p>列分类器只依赖类型族做判断:{@link #NUMERIC} 且非布尔的列默认作为度量,
 * 非度量且不属于 {@link #APPROXIMATE_NUMERIC} 的列默认作为维度。
 */
@Public
public enum DataTypeFamily {
    /** 字符串类型族,包含 CHAR 和 VARCHAR。 */
    CHARACTER_STRING,

    /** 二进制字符串类型族,包含 BINARY 和 VARBINARY。 */
    BINARY_STRING,

    /** 数值类型族,包含整数、定点数和浮点数。 */
    NUMERIC,

    /** 整数类型族,包含 TINYINT、SMALLINT、INTEGER 和 BIGINT。 */
    INTEGER_NUMERIC,

    /** 精确数值类型族,包含整数类型和 DECIMAL。 */
    EXACT_NUMERIC,

    /** 近似数值类型族,包含 FLOAT 和 DOUBLE。 */
    APPROXIMATE_NUMERIC,

    /** 日期时间类型族,包含 DATE 和 TIMESTAMP。 */
    DATETIME
}
