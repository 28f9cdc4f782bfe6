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

import javax.annotation.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.function.Function;

/**
 * 把任意 Java 值转换为维度成员的规范表示。
 *
 * <p>构建索引和解析查询过滤条件使用同一个转换,因此 {@code Integer} 类型的过滤值可以匹配 BIGINT
 * 维度中的成员。无法转换的值返回 {@code null}。
 */
public final class MemberNormalizer {

    private final Function<Object, Object> converter;

    private MemberNormalizer(Function<Object, Object> converter) {
        this.converter = converter;
    }

    /**
     * 为指定的维度类型创建转换器。
     *
     * @throws UnsupportedOperationException 类型不能作为维度时抛出
     */
    public static MemberNormalizer forType(DataType type) {
        return new MemberNormalizer(CONVERTER_VISITOR.visit(type));
    }

    /**
     * 转换一个非空值。
     *
     * @return 规范化后的成员,值的类型与维度类型不匹配时返回 {@code null}
     */
    @Nullable
    public Object normalize(Object value) {
        return converter.apply(value);
    }

    private static final MemberTypeVisitor<Function<Object, Object>> CONVERTER_VISITOR =
            new MemberTypeVisitor<Function<Object, Object>>() {
                @Override
                public Function<Object, Object> visitString() {
                    return value -> value instanceof String ? value : null;
                }

                @Override
                public Function<Object, Object> visitBoolean() {
                    return value -> value instanceof Boolean ? value : null;
                }

                @Override
                public Function<Object, Object> visitLong() {
                    return value ->
                            value instanceof Long
                                            || value instanceof Integer
                                            || value instanceof Short
                                            || value instanceof Byte
                                    ? (Object) ((Number) value).longValue()
                                    : null;
                }

                @Override
                public Function<Object, Object> visitDouble() {
                    return value ->
                            value instanceof Number
                                    ? (Object) ((Number) value).doubleValue()
                                    : null;
                }

                @Override
                public Function<Object, Object> visitDate() {
                    return value -> value instanceof LocalDate ? value : null;
                }

                @Override
                public Function<Object, Object> visitTimestamp() {
                    return value -> value instanceof LocalDateTime ? value : null;
                }
            };
}
