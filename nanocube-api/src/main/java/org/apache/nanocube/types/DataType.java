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

import org.apache.nanocube.annotation.Public;
import org.apache.nanocube.utils.Preconditions;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * 描述一列的逻辑数据类型。
 *
 * <p>一个数据类型由类型根 {@link DataTypeRoot} 和可空性组成。实例是不可变的,修改可空性会返回新实例。
 *
 * <p>使用示例:
 *
 * <pre>{@code
 * DataType amount = DataTypes.BIGINT();
 * DataType region = DataTypes.STRING().notNull();
 * }</pre>
 *
 * @see DataTypes 用于创建各种数据类型的工厂类
 */
@Public
public final class DataType implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final String NOT_NULL_SUFFIX = " NOT NULL";

    /** 标识该类型的值是否可以为 null */
    private final boolean isNullable;

    /** 该类型的根分类 */
    private final DataTypeRoot typeRoot;

    public DataType(boolean isNullable, DataTypeRoot typeRoot) {
        this.isNullable = isNullable;
        this.typeRoot = Preconditions.checkNotNull(typeRoot);
    }

    public boolean isNullable() {
        return isNullable;
    }

    public DataTypeRoot getTypeRoot() {
        return typeRoot;
    }

    /** 判断该类型的根是否等于指定的 {@code typeRoot}。 */
    public boolean is(DataTypeRoot typeRoot) {
        return this.typeRoot == typeRoot;
    }

    /** 判断该类型的根是否属于指定的类型族。 */
    public boolean is(DataTypeFamily family) {
        return typeRoot.getFamilies().contains(family);
    }

    /** 判断该类型的根是否等于给定的任意一个 {@code typeRoots}。 */
    public boolean isAnyOf(DataTypeRoot... typeRoots) {
        return Arrays.stream(typeRoots).anyMatch(tr -> this.typeRoot == tr);
    }

    /** 判断该类型的根是否属于给定的任意一个类型族。 */
    public boolean isAnyOf(DataTypeFamily... families) {
        return Arrays.stream(families).anyMatch(this::is);
    }

    /**
     * 返回具有指定可空性的类型副本。
     *
     * @param isNullable 新类型是否可空
     * @return 新的类型实例
     */
    public DataType copy(boolean isNullable) {
        return isNullable == this.isNullable ? this : new DataType(isNullable, typeRoot);
    }

    public DataType notNull() {
        return copy(false);
    }

    public DataType nullable() {
        return copy(true);
    }

    /**
     * 返回 SQL 风格的类型字符串,例如 {@code BIGINT} 或 {@code STRING NOT NULL}。
     *
     * <p>该字符串会写入立方体文件的元数据中,可以通过 {@link DataTypes#parse(String)} 还原。
     */
    public String asSQLString() {
        String name = typeRoot == DataTypeRoot.VARCHAR ? "STRING" : sqlName(typeRoot);
        return isNullable ? name : name + NOT_NULL_SUFFIX;
    }

    static String sqlName(DataTypeRoot root) {
        switch (root) {
            case INTEGER:
                return "INT";
            case TIMESTAMP_WITHOUT_TIME_ZONE:
                return "TIMESTAMP";
            default:
                return root.name();
        }
    }

    static boolean hasNotNullSuffix(String sql) {
        return sql.toUpperCase(Locale.ROOT).endsWith(NOT_NULL_SUFFIX);
    }

    static String stripNotNullSuffix(String sql) {
        return sql.substring(0, sql.length() - NOT_NULL_SUFFIX.length());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DataType dataType = (DataType) o;
        return isNullable == dataType.isNullable && typeRoot == dataType.typeRoot;
    }

    @Override
    public int hashCode() {
        return Objects.hash(isNullable, typeRoot);
    }

    @Override
    public String toString() {
        return asSQLString();
    }
}
