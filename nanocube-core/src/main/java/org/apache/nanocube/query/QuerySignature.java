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

import org.apache.nanocube.index.MemberIndex;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 查询结果缓存的键。
 *
 * <p>由聚合函数、按请求顺序排列的度量名、以及按维度名排序的过滤条件组成。每个维度的成员经过规范化、
 * 去重并排序,因此单个成员与只含一个元素的列表得到相同的签名,过滤映射的顺序也不影响签名。
 */
public final class QuerySignature {

    /** 成员排序规则,空值成员排在最前。 */
    public static final Comparator<Object> MEMBER_ORDER =
            Comparator.nullsFirst(MemberIndex.MEMBER_ORDER);

    private final Aggregation aggregation;
    private final List<String> measures;
    private final SortedMap<String, List<Object>> filters;

    private QuerySignature(
            Aggregation aggregation,
            List<String> measures,
            SortedMap<String, List<Object>> filters) {
        this.aggregation = aggregation;
        this.measures = measures;
        this.filters = filters;
    }

    /**
     * 创建签名。
     *
     * @param filters 维度名到已规范化成员的映射,同一维度内的成员类型必须相同
     */
    public static QuerySignature of(
            Aggregation aggregation,
            List<String> measures,
            Map<String, ? extends Collection<?>> filters) {
        TreeMap<String, List<Object>> canonical = new TreeMap<>();
        for (Map.Entry<String, ? extends Collection<?>> entry : filters.entrySet()) {
            TreeSet<Object> members = new TreeSet<>(MEMBER_ORDER);
            members.addAll(entry.getValue());
            canonical.put(
                    entry.getKey(), Collections.unmodifiableList(new ArrayList<>(members)));
        }
        return new QuerySignature(
                aggregation,
                Collections.unmodifiableList(new ArrayList<>(measures)),
                Collections.unmodifiableSortedMap(canonical));
    }

    public Aggregation aggregation() {
        return aggregation;
    }

    public List<String> measures() {
        return measures;
    }

    /** 按维度名排序的过滤条件,每个维度的成员去重并排序。 */
    public SortedMap<String, List<Object>> filters() {
        return filters;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        QuerySignature that = (QuerySignature) o;
        return aggregation == that.aggregation
                && measures.equals(that.measures)
                && filters.equals(that.filters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregation, measures, filters);
    }

    @Override
    public String toString() {
        return "QuerySignature{" + aggregation + ", " + measures + ", " + filters + '}';
    }
}
