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

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 一次点查询:要聚合的度量、各维度上的过滤条件以及聚合函数。
 *
 * <p>不同维度的过滤条件之间是"与"关系,同一维度内的多个成员是"或"关系。不指定度量时返回所有度量。
 *
 * <pre>{@code
 * Query query =
 *         Query.builder()
 *                 .measures("sales")
 *                 .filter("customer", "A")
 *                 .filterAny("product", "P1", "P2")
 *                 .aggregation(Aggregation.MEAN)
 *                 .build();
 * }</pre>
 */
public final class Query {

    private final List<String> measures;
    private final Map<String, FilterValue> filters;
    private final Aggregation aggregation;

    private Query(
            List<String> measures, Map<String, FilterValue> filters, Aggregation aggregation) {
        this.measures = Collections.unmodifiableList(measures);
        this.filters = Collections.unmodifiableMap(filters);
        this.aggregation = aggregation;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 由度量列表和过滤映射创建查询。映射中的 {@link Collection} 或数组值表示"任意一个"。
     *
     * @param measures 度量名,空列表表示所有度量
     */
    public static Query of(
            List<String> measures, Map<String, ?> filters, Aggregation aggregation) {
        return builder().measures(measures).filters(filters).aggregation(aggregation).build();
    }

    public List<String> measures() {
        return measures;
    }

    public Map<String, FilterValue> filters() {
        return filters;
    }

    public Aggregation aggregation() {
        return aggregation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Query query = (Query) o;
        return measures.equals(query.measures)
                && filters.equals(query.filters)
                && aggregation == query.aggregation;
    }

    @Override
    public int hashCode() {
        return Objects.hash(measures, filters, aggregation);
    }

    @Override
    public String toString() {
        return aggregation + "(" + measures + ") where " + filters;
    }

    /** {@link Query} 的构建器。同一维度多次设置过滤条件时,后设置的覆盖先设置的。 */
    public static final class Builder {

        private final List<String> measures = new ArrayList<>();
        private final LinkedHashMap<String, FilterValue> filters = new LinkedHashMap<>();
        private Aggregation aggregation = Aggregation.SUM;

        public Builder measures(String... names) {
            return measures(Arrays.asList(names));
        }

        public Builder measures(Collection<String> names) {
            for (String name : names) {
                measures.add(Preconditions.checkNotNull(name, "Measure name must not be null."));
            }
            return this;
        }

        public Builder filter(String dimension, @Nullable Object member) {
            return filter(dimension, FilterValue.of(member));
        }

        public Builder filter(String dimension, FilterValue value) {
            Preconditions.checkNotNull(dimension, "Dimension name must not be null.");
            filters.put(dimension, Preconditions.checkNotNull(value));
            return this;
        }

        public Builder filterAny(String dimension, Object... members) {
            return filter(dimension, FilterValue.anyOf(members));
        }

        public Builder filterAny(String dimension, Collection<?> members) {
            return filter(dimension, FilterValue.anyOf(members));
        }

        public Builder filters(Map<String, ?> values) {
            for (Map.Entry<String, ?> entry : values.entrySet()) {
                filter(entry.getKey(), FilterValue.from(entry.getValue()));
            }
            return this;
        }

        public Builder aggregation(Aggregation aggregation) {
            this.aggregation = Preconditions.checkNotNull(aggregation);
            return this;
        }

        public Query build() {
            return new Query(
                    new ArrayList<>(measures), new LinkedHashMap<>(filters), aggregation);
        }
    }
}
