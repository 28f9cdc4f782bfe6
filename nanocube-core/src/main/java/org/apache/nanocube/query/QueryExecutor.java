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

import org.apache.nanocube.cache.ResultCache;
import org.apache.nanocube.index.MemberIndex;
import org.apache.nanocube.index.RowSet;
import org.apache.nanocube.schema.Dimension;
import org.apache.nanocube.schema.Measure;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 执行点查询。
 *
 * <ol>
 *   <li>校验维度名和度量名,规范化过滤成员并生成 {@link QuerySignature}
 *   <li>查询结果缓存,未命中时继续计算
 *   <li>每个维度的过滤条件解析为一个行集合,多个成员取并集
 *   <li>按基数从小到大依次求交集,交集为空时立即停止
 *   <li>在选中的行上聚合每个请求的度量
 * </ol>
 */
public class QueryExecutor {

    private static final Comparator<RowSet> BY_CARDINALITY =
            Comparator.comparingInt(RowSet::cardinality);

    private final Map<String, Dimension> dimensions;
    private final Map<String, Measure> measures;
    private final ResultCache cache;

    public QueryExecutor(
            Map<String, Dimension> dimensions, Map<String, Measure> measures, ResultCache cache) {
        this.dimensions = dimensions;
        this.measures = measures;
        this.cache = cache;
    }

    /**
     * 执行查询。
     *
     * @throws UnknownNameException 查询引用了不存在的维度或度量时抛出
     */
    public QueryResult execute(Query query) {
        QuerySignature signature = signatureOf(query);
        return cache.getOrCompute(signature, () -> compute(signature));
    }

    /** 校验名称并生成规范化的签名。 */
    public QuerySignature signatureOf(Query query) {
        for (String measure : query.measures()) {
            if (!measures.containsKey(measure)) {
                throw new UnknownNameException(
                        UnknownNameException.Kind.MEASURE, measure, measures.keySet());
            }
        }

        Map<String, List<Object>> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, FilterValue> entry : query.filters().entrySet()) {
            Dimension dimension = dimensions.get(entry.getKey());
            if (dimension == null) {
                throw new UnknownNameException(
                        UnknownNameException.Kind.DIMENSION, entry.getKey(), dimensions.keySet());
            }
            MemberIndex index = dimension.index();
            List<Object> members = new ArrayList<>(entry.getValue().members().size());
            for (Object member : entry.getValue().members()) {
                if (member == null) {
                    members.add(null);
                    continue;
                }
                // values of a foreign type can never match, they are dropped here
                Object value = index.normalize(member);
                if (value != null) {
                    members.add(value);
                }
            }
            normalized.put(entry.getKey(), members);
        }
        return QuerySignature.of(query.aggregation(), query.measures(), normalized);
    }

    /**
     * 计算满足过滤条件的行集合。
     *
     * @return 行集合,没有任何过滤条件时返回 {@code null} 表示所有行
     */
    @Nullable
    public RowSet select(QuerySignature signature) {
        if (signature.filters().isEmpty()) {
            return null;
        }

        List<RowSet> rowSets = new ArrayList<>(signature.filters().size());
        for (Map.Entry<String, List<Object>> entry : signature.filters().entrySet()) {
            MemberIndex index = dimensions.get(entry.getKey()).index();
            List<Object> members = entry.getValue();
            rowSets.add(
                    members.size() == 1
                            ? index.rowsFor(members.get(0))
                            : index.rowsForAny(members));
        }
        rowSets.sort(BY_CARDINALITY);

        RowSet selection = rowSets.get(0);
        for (int i = 1; i < rowSets.size() && !selection.isEmpty(); i++) {
            selection = selection.intersect(rowSets.get(i));
        }
        return selection;
    }

    private QueryResult compute(QuerySignature signature) {
        RowSet selection = select(signature);
        int[] rows = selection == null ? null : selection.toArray();
        Aggregation aggregation = signature.aggregation();

        List<String> names = signature.measures();
        boolean allMeasures = names.isEmpty();
        if (allMeasures) {
            names = new ArrayList<>(measures.keySet());
        }
        List<Number> values = new ArrayList<>(names.size());
        for (String name : names) {
            values.add(MeasureAggregator.aggregate(measures.get(name), aggregation, rows));
        }

        if (allMeasures) {
            return QueryResult.map(names, values);
        } else if (names.size() == 1) {
            return QueryResult.scalar(names.get(0), values.get(0));
        }
        return QueryResult.vector(names, values);
    }
}
