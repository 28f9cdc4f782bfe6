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

import org.apache.nanocube.CubeBuildException;
import org.apache.nanocube.data.columnar.BooleanColumnVector;
import org.apache.nanocube.data.columnar.ColumnVector;
import org.apache.nanocube.data.columnar.DoubleColumnVector;
import org.apache.nanocube.data.columnar.LongColumnVector;
import org.apache.nanocube.data.columnar.ObjectColumnVector;
import org.apache.nanocube.types.DataType;
import org.apache.nanocube.utils.IntArrayList;
import org.apache.nanocube.utils.Preconditions;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * 一个维度的倒排索引:成员值到行集合的映射。
 *
 * <p>所有成员(包括空值成员)的行集合两两不相交,并集恰好是 {@code [0, rowCount)}。空值成员单独保存,
 * 不出现在 {@link #members()} 中,通过 {@code rowsFor(null)} 查询。
 *
 * <p>查询时传入的成员会先经过 {@link MemberNormalizer} 转换,不存在的成员返回空集合。
 */
public final class MemberIndex {

    /** 规范化成员的自然顺序,同一维度内的成员类型相同。 */
    @SuppressWarnings("unchecked")
    public static final Comparator<Object> MEMBER_ORDER =
            (a, b) -> ((Comparable<Object>) a).compareTo(b);

    private final DataType type;
    private final RowSetBackend backend;
    private final NavigableMap<Object, RowSet> members;
    @Nullable private final RowSet nullRows;
    private final MemberNormalizer normalizer;

    private MemberIndex(
            DataType type,
            RowSetBackend backend,
            NavigableMap<Object, RowSet> members,
            @Nullable RowSet nullRows) {
        this.type = type;
        this.backend = backend;
        this.members = Collections.unmodifiableNavigableMap(members);
        this.nullRows = nullRows;
        this.normalizer = MemberNormalizer.forType(type);
    }

    /**
     * 由已经规范化的成员映射创建索引,用于从文件加载。
     *
     * @param members 成员到行集合的映射,成员必须已经规范化
     * @param nullRows 空值成员的行集合,没有空值时为 {@code null}
     */
    public static MemberIndex of(
            DataType type,
            RowSetBackend backend,
            Map<Object, RowSet> members,
            @Nullable RowSet nullRows) {
        TreeMap<Object, RowSet> sorted = new TreeMap<>(MEMBER_ORDER);
        sorted.putAll(members);
        return new MemberIndex(type, backend, sorted, nullRows);
    }

    /**
     * 扫描一列数据构建索引。
     *
     * @param name 维度名,用于错误信息
     * @throws CubeBuildException 列中存在与维度类型不匹配的值时抛出
     */
    public static MemberIndex build(
            String name, DataType type, ColumnVector column, int rowCount, RowSetBackend backend) {
        MemberNormalizer normalizer;
        try {
            normalizer = MemberNormalizer.forType(type);
        } catch (UnsupportedOperationException e) {
            throw new CubeBuildException(
                    String.format(
                            "Dimension '%s' has type %s which cannot be indexed.",
                            name, type.asSQLString()),
                    e);
        }

        if (column.getCapacity() < rowCount) {
            throw new CubeBuildException(
                    String.format(
                            "Dimension '%s' has %s values but the table has %s rows.",
                            name, column.getCapacity(), rowCount));
        }
        ValueReader reader = ValueReader.of(column);
        HashMap<Object, IntArrayList> buckets = new HashMap<>();
        IntArrayList nullBucket = null;
        for (int i = 0; i < rowCount; i++) {
            Object raw = column.isNullAt(i) ? null : reader.read(i);
            if (raw == null) {
                if (nullBucket == null) {
                    nullBucket = new IntArrayList(16);
                }
                nullBucket.add(i);
                continue;
            }
            Object member = normalizer.normalize(raw);
            if (member == null) {
                throw new CubeBuildException(
                        String.format(
                                "Dimension '%s' of type %s contains value '%s' of class %s at row %s.",
                                name,
                                type.asSQLString(),
                                raw,
                                raw.getClass().getName(),
                                i));
            }
            buckets.computeIfAbsent(member, k -> new IntArrayList(16)).add(i);
        }

        // buckets are filled in row order, so every id list is already ascending
        TreeMap<Object, RowSet> members = new TreeMap<>(MEMBER_ORDER);
        for (Map.Entry<Object, IntArrayList> entry : buckets.entrySet()) {
            IntArrayList ids = entry.getValue();
            members.put(entry.getKey(), backend.fromSorted(ids.elements(), ids.size()));
        }
        RowSet nullRows =
                nullBucket == null
                        ? null
                        : backend.fromSorted(nullBucket.elements(), nullBucket.size());
        return new MemberIndex(type, backend, members, nullRows);
    }

    public DataType type() {
        return type;
    }

    public IndexingMethod indexingMethod() {
        return backend.indexingMethod();
    }

    /**
     * 返回单个成员的行集合。
     *
     * @param member 成员值,{@code null} 表示空值成员
     * @return 行集合,成员不存在时返回空集合
     */
    public RowSet rowsFor(@Nullable Object member) {
        if (member == null) {
            return nullRows == null ? backend.empty() : nullRows;
        }
        Object normalized = normalizer.normalize(member);
        if (normalized == null) {
            return backend.empty();
        }
        RowSet rows = members.get(normalized);
        return rows == null ? backend.empty() : rows;
    }

    /** 返回多个成员行集合的并集,重复的成员只计算一次。 */
    public RowSet rowsForAny(Collection<?> memberValues) {
        LinkedHashSet<Object> distinct = new LinkedHashSet<>(memberValues);
        if (distinct.size() == 1) {
            return rowsFor(distinct.iterator().next());
        }
        List<RowSet> rowSets = new ArrayList<>(distinct.size());
        for (Object member : distinct) {
            RowSet rows = rowsFor(member);
            if (!rows.isEmpty()) {
                rowSets.add(rows);
            }
        }
        return backend.unionAll(rowSets);
    }

    /** 按自然顺序返回所有非空成员。 */
    public List<Object> members() {
        return new ArrayList<>(members.keySet());
    }

    public boolean hasNullMember() {
        return nullRows != null;
    }

    @Nullable
    public RowSet nullRows() {
        return nullRows;
    }

    /** 非空成员的个数。 */
    public int memberCount() {
        return members.size();
    }

    /** 按成员顺序返回成员到行集合的只读映射。 */
    public NavigableMap<Object, RowSet> entries() {
        return members;
    }

    /** 规范化一个过滤值,无法匹配任何成员时返回 {@code null}。 */
    @Nullable
    public Object normalize(Object value) {
        Preconditions.checkNotNull(value);
        return normalizer.normalize(value);
    }

    /** 按列向量的具体类型读取单元格值。 */
    private interface ValueReader {

        Object read(int i);

        static ValueReader of(ColumnVector column) {
            if (column instanceof LongColumnVector) {
                return ((LongColumnVector) column)::getLong;
            } else if (column instanceof DoubleColumnVector) {
                return ((DoubleColumnVector) column)::getDouble;
            } else if (column instanceof BooleanColumnVector) {
                return ((BooleanColumnVector) column)::getBoolean;
            } else if (column instanceof ObjectColumnVector) {
                return ((ObjectColumnVector) column)::getObject;
            }
            throw new IllegalArgumentException(
                    "Unsupported column vector " + column.getClass().getName());
        }
    }
}
