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

import java.util.Locale;

/**
 * 创建 {@link DataType} 的工厂方法集合。
 *
 * <p>所有工厂方法返回可空的类型,需要非空类型时调用 {@link DataType#notNull()}。
 */
@Public
public class DataTypes {

    public static DataType STRING() {
        return new DataType(true, DataTypeRoot.VARCHAR);
    }

    public static DataType CHAR() {
        return new DataType(true, DataTypeRoot.CHAR);
    }

    public static DataType BOOLEAN() {
        return new DataType(true, DataTypeRoot.BOOLEAN);
    }

    public static DataType BYTES() {
        return new DataType(true, DataTypeRoot.VARBINARY);
    }

    public static DataType BINARY() {
        return new DataType(true, DataTypeRoot.BINARY);
    }

    public static DataType DECIMAL() {
        return new DataType(true, DataTypeRoot.DECIMAL);
    }

    public static DataType TINYINT() {
        return new DataType(true, DataTypeRoot.TINYINT);
    }

    public static DataType SMALLINT() {
        return new DataType(true, DataTypeRoot.SMALLINT);
    }

    public static DataType INT() {
        return new DataType(true, DataTypeRoot.INTEGER);
    }

    public static DataType BIGINT() {
        return new DataType(true, DataTypeRoot.BIGINT);
    }

    public static DataType FLOAT() {
        return new DataType(true, DataTypeRoot.FLOAT);
    }

    public static DataType DOUBLE() {
        return new DataType(true, DataTypeRoot.DOUBLE);
    }

    public static DataType DATE() {
        return new DataType(true, DataTypeRoot.DATE);
    }

    public static DataType TIMESTAMP() {
        return new DataType(true, DataTypeRoot.TIMESTAMP_WITHOUT_TIME_ZONE);
    }

    public static DataField FIELD(String name, DataType type) {
        return new DataField(name, type);
    }

    /**
     * 解析 {@link DataType#asSQLString()} 生成的类型字符串。
     *
     * @param sql 类型字符串,例如 {@code BIGINT NOT NULL}
     * @return 解析出的数据类型
     * @throws IllegalArgumentException 如果类型名称无法识别
     */
    public static DataType parse(String sql) {
        String text = sql.trim();
        boolean nullable = true;
        if (DataType.hasNotNullSuffix(text)) {
            nullable = false;
            text = DataType.stripNotNullSuffix(text).trim();
        }
        String name = text.toUpperCase(Locale.ROOT);
        if ("STRING".equals(name)) {
            return new DataType(nullable, DataTypeRoot.VARCHAR);
        }
        for (DataTypeRoot root : DataTypeRoot.values()) {
            if (DataType.sqlName(root).equals(name)) {
                return new DataType(nullable, root);
            }
        }
        throw new IllegalArgumentException("Unknown data type: " + sql);
    }

    private DataTypes() {}
}
