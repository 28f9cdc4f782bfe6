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

package org.apache.nanocube.schema;

import org.apache.nanocube.CubeBuildException;
import org.apache.nanocube.data.TableSource;
import org.apache.nanocube.types.DataField;
import org.apache.nanocube.types.DataTypeChecks;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 决定表中哪些列作为维度,哪些列作为度量。
 *
 * <ul>
 *   <li>未显式指定度量时,所有非布尔的数值列都是度量
 *   <li>未显式指定维度时,所有既不是度量也不是浮点数的列都是维度
 *   <li>显式指定的列表按给定顺序原样使用
 *   <li>只显式指定维度时,默认度量不包含这些维度列
 * </ul>
 */
public final class ColumnClassifier {

    /**
     * 对表中的列分类。
     *
     * @param dimensions 显式指定的维度,{@code null} 表示按默认规则推断
     * @param measures 显式指定的度量,{@code null} 表示按默认规则推断
     * @throws CubeBuildException 列不存在、度量不是数值类型或同一列同时作为维度和度量时抛出
     */
    public static ColumnRoles classify(
            TableSource table, @Nullable List<String> dimensions, @Nullable List<String> measures) {
        Map<String, DataField> fields = new LinkedHashMap<>();
        for (DataField field : table.fields()) {
            fields.put(field.name(), field);
        }

        Set<String> explicitDimensions =
                dimensions == null
                        ? Collections.emptySet()
                        : new HashSet<>(distinct(dimensions, "dimension"));

        List<DataField> measureFields = new ArrayList<>();
        if (measures == null) {
            for (DataField field : fields.values()) {
                if (DataTypeChecks.isMeasureCandidate(field.type())
                        && !explicitDimensions.contains(field.name())) {
                    measureFields.add(field);
                }
            }
        } else {
            for (String name : distinct(measures, "measure")) {
                DataField field = lookup(fields, name, "Measure");
                if (!DataTypeChecks.isMeasureCandidate(field.type())) {
                    throw new CubeBuildException(
                            String.format(
                                    "Measure '%s' has non-numeric type %s.",
                                    name, field.type().asSQLString()));
                }
                measureFields.add(field);
            }
        }

        Set<String> measureNames = new HashSet<>();
        measureFields.forEach(f -> measureNames.add(f.name()));

        List<DataField> dimensionFields = new ArrayList<>();
        if (dimensions == null) {
            for (DataField field : fields.values()) {
                if (!measureNames.contains(field.name())
                        && DataTypeChecks.isDefaultDimension(field.type())) {
                    dimensionFields.add(field);
                }
            }
        } else {
            for (String name : dimensions) {
                DataField field = lookup(fields, name, "Dimension");
                if (measureNames.contains(name)) {
                    throw new CubeBuildException(
                            String.format(
                                    "Column '%s' cannot be both a dimension and a measure.",
                                    name));
                }
                dimensionFields.add(field);
            }
        }

        return new ColumnRoles(dimensionFields, measureFields);
    }

    private static List<String> distinct(List<String> names, String role) {
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (!seen.add(name)) {
                throw new CubeBuildException(
                        String.format("Column '%s' is declared twice as %s.", name, role));
            }
        }
        return names;
    }

    private static DataField lookup(Map<String, DataField> fields, String name, String role) {
        DataField field = fields.get(name);
        if (field == null) {
            throw new CubeBuildException(
                    String.format(
                            "%s '%s' does not exist in the table, available columns: %s.",
                            role, name, fields.keySet()));
        }
        return field;
    }

    /** 分类结果:按顺序排列的维度列和度量列。 */
    public static final class ColumnRoles {

        private final List<DataField> dimensions;
        private final List<DataField> measures;

        ColumnRoles(List<DataField> dimensions, List<DataField> measures) {
            this.dimensions = Collections.unmodifiableList(dimensions);
            this.measures = Collections.unmodifiableList(measures);
        }

        public List<DataField> dimensions() {
            return dimensions;
        }

        public List<DataField> measures() {
            return measures;
        }

        @Override
        public String toString() {
            return "ColumnRoles{dimensions=" + dimensions + ", measures=" + measures + '}';
        }
    }

    private ColumnClassifier() {}
}
