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

import org.apache.nanocube.types.DataType;

/**
 * 按成员值的 Java 表示对维度类型分组的访问者。
 *
 * <p>同一组内的类型使用相同的成员表示:所有整数类型都以 {@link Long} 表示,FLOAT 和 DOUBLE 都以
 * {@link Double} 表示。二进制字符串和 DECIMAL 不能作为维度,访问时抛出 {@link
 * UnsupportedOperationException}。
 *
 * @param <R> 访问结果类型
 */
public abstract class MemberTypeVisitor<R> {

    /** 访问字符串类型(CHAR, VARCHAR),成员为 {@link String}。 */
    public abstract R visitString();

    /** 访问布尔类型(BOOLEAN),成员为 {@link Boolean}。 */
    public abstract R visitBoolean();

    /** 访问整数类型(TINYINT, SMALLINT, INTEGER, BIGINT),成员为 {@link Long}。 */
    public abstract R visitLong();

    /** 访问浮点类型(FLOAT, DOUBLE),成员为 {@link Double}。 */
    public abstract R visitDouble();

    /** 访问日期类型(DATE),成员为 {@link java.time.LocalDate}。 */
    public abstract R visitDate();

    /** 访问时间戳类型(TIMESTAMP),成员为 {@link java.time.LocalDateTime}。 */
    public abstract R visitTimestamp();

    public final R visit(DataType type) {
        switch (type.getTypeRoot()) {
            case CHAR:
            case VARCHAR:
                return visitString();
            case BOOLEAN:
                return visitBoolean();
            case TINYINT:
            case SMALLINT:
            case INTEGER:
            case BIGINT:
                return visitLong();
            case FLOAT:
            case DOUBLE:
                return visitDouble();
            case DATE:
                return visitDate();
            case TIMESTAMP_WITHOUT_TIME_ZONE:
                return visitTimestamp();
            default:
                throw new UnsupportedOperationException(
                        "Type " + type.asSQLString() + " cannot be used as a dimension.");
        }
    }
}
