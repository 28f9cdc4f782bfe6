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

/**
 * 基于类型族的常用类型判断。
 *
 * <p>立方体只关心三类问题:一列能否作为度量,能否作为维度,以及度量值按整数还是浮点数存储。
 */
public final class DataTypeChecks {

    /** 数值类型且不是布尔值,可以作为度量。 */
    public static boolean isMeasureCandidate(DataType dataType) {
        return dataType.is(DataTypeFamily.NUMERIC) && !dataType.is(DataTypeRoot.BOOLEAN);
    }

    /** 默认维度:不是度量候选,也不是近似数值。 */
    public static boolean isDefaultDimension(DataType dataType) {
        return !isMeasureCandidate(dataType) && !dataType.is(DataTypeFamily.APPROXIMATE_NUMERIC);
    }

    /**
     * 判断该类型的值能否作为维度成员,即可以稳定地比较和哈希。
     *
     * <p>二进制字符串和 DECIMAL 不能作为维度成员。
     */
    public static boolean isMemberComparable(DataType dataType) {
        return !dataType.is(DataTypeFamily.BINARY_STRING) && !dataType.is(DataTypeRoot.DECIMAL);
    }

    public static boolean isIntegerNumeric(DataType dataType) {
        return dataType.is(DataTypeFamily.INTEGER_NUMERIC);
    }

    private DataTypeChecks() {}
}
