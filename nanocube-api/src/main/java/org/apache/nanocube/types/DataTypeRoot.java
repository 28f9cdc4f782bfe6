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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 逻辑数据类型的根。
 *
 * <p>每个根属于一个或多个 {@link DataTypeFamily},类型判断应尽量基于类型族而不是具体的根。
 */
@Public
public enum DataTypeRoot {
    CHAR(DataTypeFamily.CHARACTER_STRING),

    VARCHAR(DataTypeFamily.CHARACTER_STRING),

    BOOLEAN(),

    BINARY(DataTypeFamily.BINARY_STRING),

    VARBINARY(DataTypeFamily.BINARY_STRING),

    DECIMAL(DataTypeFamily.NUMERIC, DataTypeFamily.EXACT_NUMERIC),

    TINYINT(
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.EXACT_NUMERIC),

    SMALLINT(
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.EXACT_NUMERIC),

    INTEGER(
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.EXACT_NUMERIC),

    BIGINT(
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.EXACT_NUMERIC),

    FLOAT(DataTypeFamily.NUMERIC, DataTypeFamily.APPROXIMATE_NUMERIC),

    DOUBLE(DataTypeFamily.NUMERIC, DataTypeFamily.APPROXIMATE_NUMERIC),

    /** 日期,对应 {@link java.time.LocalDate}。 */
    DATE(DataTypeFamily.DATETIME),

    /** 不带时区的时间戳,对应 {@link java.time.LocalDateTime}。 */
    TIMESTAMP_WITHOUT_TIME_ZONE(DataTypeFamily.DATETIME);

    /** 该类型根所属的类型族集合,不可变 */
    private final Set<DataTypeFamily> families;

    DataTypeRoot(DataTypeFamily... families) {
        EnumSet<DataTypeFamily> set = EnumSet.noneOf(DataTypeFamily.class);
        Collections.addAll(set, families);
        this.families = Collections.unmodifiableSet(set);
    }

    public Set<DataTypeFamily> getFamilies() {
        return families;
    }
}
