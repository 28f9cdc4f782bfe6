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

package org.apache.nanocube.query;

import java.util.Locale;

/**
 * 度量的聚合函数。
 *
 * <p>所有聚合都忽略缺失值({@code NaN})。{@link #STD} 和 {@link #VAR} 是总体统计量,除数为 n。{@link
 * #COUNT} 统计非缺失值的个数。
 */
public enum Aggregation {
    SUM,
    MEAN,
    MIN,
    MAX,
    STD,
    VAR,
    COUNT;

    /** 按名称解析,忽略大小写。 */
    public static Aggregation fromName(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (Aggregation aggregation : values()) {
            if (aggregation.name().equals(normalized)) {
                return aggregation;
            }
        }
        throw new IllegalArgumentException("Unknown aggregation " + name);
    }
}
