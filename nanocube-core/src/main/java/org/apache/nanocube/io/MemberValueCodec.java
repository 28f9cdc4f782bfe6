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

package org.apache.nanocube.io;

import org.apache.nanocube.index.MemberTypeVisitor;
import org.apache.nanocube.types.DataType;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.function.Function;

/**
 * 成员值与元数据中文本形式之间的转换。
 *
 * <p>浮点数使用 {@link Double#toString(double)},因此 {@code NaN} 和无穷大也能还原。日期和时间戳使用 ISO-8601。
 */
final class MemberValueCodec {

    private final Function<Object, String> encoder;
    private final Function<String, Object> decoder;

    private MemberValueCodec(Function<Object, String> encoder, Function<String, Object> decoder) {
        this.encoder = encoder;
        this.decoder = decoder;
    }

    static MemberValueCodec forType(DataType type) {
        return CODEC_VISITOR.visit(type);
    }

    String encode(Object member) {
        return encoder.apply(member);
    }

    /**
     * 解析成员值。
     *
     * @throws IllegalArgumentException 或 {@link java.time.format.DateTimeParseException} 文本无法解析时抛出
     */
    Object decode(String text) {
        return decoder.apply(text);
    }

    private static final MemberTypeVisitor<MemberValueCodec> CODEC_VISITOR =
            new MemberTypeVisitor<MemberValueCodec>() {
                @Override
                public MemberValueCodec visitString() {
                    return new MemberValueCodec(String.class::cast, text -> text);
                }

                @Override
                public MemberValueCodec visitBoolean() {
                    return new MemberValueCodec(String::valueOf, MemberValueCodec::parseBoolean);
                }

                @Override
                public MemberValueCodec visitLong() {
                    return new MemberValueCodec(String::valueOf, Long::valueOf);
                }

                @Override
                public MemberValueCodec visitDouble() {
                    return new MemberValueCodec(String::valueOf, Double::valueOf);
                }

                @Override
                public MemberValueCodec visitDate() {
                    return new MemberValueCodec(String::valueOf, LocalDate::parse);
                }

                @Override
                public MemberValueCodec visitTimestamp() {
                    return new MemberValueCodec(String::valueOf, LocalDateTime::parse);
                }
            };

    private static Boolean parseBoolean(String text) {
        switch (text.toLowerCase(Locale.ROOT)) {
            case "true":
                return Boolean.TRUE;
            case "false":
                return Boolean.FALSE;
            default:
                throw new IllegalArgumentException("Not a boolean: " + text);
        }
    }
}
