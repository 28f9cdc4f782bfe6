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

import org.apache.nanocube.utils.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 查询结果。
 *
 * <ul>
 *   <li>{@link Kind#SCALAR}:只请求了一个度量
 *   <li>{@link Kind#VECTOR}:请求了多个度量,按请求顺序排列
 *   <li>{@link Kind#MAP}:没有指定度量,包含所有度量,按度量在立方体中的顺序排列
 * </ul>
 *
 * <p>值的类型为 {@link Long} 或 {@link Double},见 {@link MeasureAggregator}。
 */
public final class QueryResult {

    /** 结果的形态。 */
    public enum Kind {
        SCALAR,
        VECTOR,
        MAP
    }

    private final Kind kind;
    private final List<String> names;
    private final List<Number> values;

    private QueryResult(Kind kind, List<String> names, List<Number> values) {
        Preconditions.checkArgument(names.size() == values.size());
        this.kind = kind;
        this.names = Collections.unmodifiableList(names);
        this.values = Collections.unmodifiableList(values);
    }

    public static QueryResult scalar(String measure, Number value) {
        return new QueryResult(
                Kind.SCALAR,
                Collections.singletonList(measure),
                Collections.singletonList(value));
    }

    public static QueryResult vector(List<String> measures, List<Number> values) {
        return new QueryResult(Kind.VECTOR, new ArrayList<>(measures), new ArrayList<>(values));
    }

    public static QueryResult map(List<String> measures, List<Number> values) {
        return new QueryResult(Kind.MAP, new ArrayList<>(measures), new ArrayList<>(values));
    }

    public Kind kind() {
        return kind;
    }

    /** 返回标量结果。 */
    public Number asNumber() {
        Preconditions.checkState(kind == Kind.SCALAR, "Result of kind %s is not a scalar.", kind);
        return values.get(0);
    }

    public double asDouble() {
        return asNumber().doubleValue();
    }

    public long asLong() {
        return asNumber().longValue();
    }

    /** 按度量顺序返回所有值。 */
    public List<Number> asList() {
        return values;
    }

    /** 返回度量名到值的有序映射,适用于任意形态。 */
    public Map<String, Number> asMap() {
        LinkedHashMap<String, Number> result = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            result.put(names.get(i), values.get(i));
        }
        return result;
    }

    public List<String> measures() {
        return names;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        QueryResult that = (QueryResult) o;
        return kind == that.kind && names.equals(that.names) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, names, values);
    }

    @Override
    public String toString() {
        switch (kind) {
            case SCALAR:
                return String.valueOf(values.get(0));
            case VECTOR:
                return values.toString();
            default:
                return asMap().toString();
        }
    }
}
