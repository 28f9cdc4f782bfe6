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

package org.apache.nanocube.data;

import org.apache.nanocube.annotation.Public;
import org.apache.nanocube.data.columnar.ColumnVector;
import org.apache.nanocube.data.columnar.heap.AbstractHeapVector;
import org.apache.nanocube.data.columnar.heap.HeapBooleanVector;
import org.apache.nanocube.data.columnar.heap.HeapDoubleVector;
import org.apache.nanocube.data.columnar.heap.HeapLongVector;
import org.apache.nanocube.data.columnar.heap.HeapObjectVector;
import org.apache.nanocube.types.DataField;
import org.apache.nanocube.types.DataType;
import org.apache.nanocube.types.DataTypeFamily;
import org.apache.nanocube.types.DataTypeRoot;
import org.apache.nanocube.utils.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 完全驻留在内存中的 {@link TableSource}。
 *
 * <pre>{@code
 * InMemoryTable table =
 *         InMemoryTable.builder()
 *                 .field("customer", DataTypes.STRING())
 *                 .field("sales", DataTypes.BIGINT())
 *                 .addRow("A", 100L)
 *                 .addRow("B", 200L)
 *                 .build();
 * }</pre>
 *
 * <p>整数、浮点和布尔列以原始类型的向量保存,写入的值必须是对应的 {@link Number} 或 {@link Boolean};
 * 其它列原样保存对象。
 */
@Public
public class InMemoryTable implements TableSource {

    private final int rowCount;
    private final List<DataField> fields;
    private final Map<String, ColumnVector> columns;

    private InMemoryTable(int rowCount, List<DataField> fields, Map<String, ColumnVector> columns) {
        this.rowCount = rowCount;
        this.fields = Collections.unmodifiableList(fields);
        this.columns = columns;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public int rowCount() {
        return rowCount;
    }

    @Override
    public List<DataField> fields() {
        return fields;
    }

    @Override
    public ColumnVector column(String name) {
        ColumnVector vector = columns.get(name);
        Preconditions.checkArgument(vector != null, "Column %s does not exist.", name);
        return vector;
    }

    @Override
    public String toString() {
        return "InMemoryTable{rowCount=" + rowCount + ", fields=" + fields + '}';
    }

    /** {@link InMemoryTable} 的构建器,先声明字段,再按行或按列写入数据。 */
    public static class Builder {

        private final List<DataField> fields = new ArrayList<>();
        private final LinkedHashMap<String, AbstractHeapVector> vectors = new LinkedHashMap<>();
        private int rowCount = 0;

        public Builder field(String name, DataType type) {
            Preconditions.checkArgument(
                    !vectors.containsKey(name), "Duplicate column name %s.", name);
            Preconditions.checkState(
                    rowCount == 0, "Fields must be declared before rows are added.");
            fields.add(new DataField(name, type));
            vectors.put(name, createVector(type));
            return this;
        }

        /** 声明一列并一次性写入该列的全部值。所有列必须等长。 */
        public Builder column(String name, DataType type, List<?> values) {
            Preconditions.checkArgument(
                    !vectors.containsKey(name), "Duplicate column name %s.", name);
            if (!fields.isEmpty()) {
                Preconditions.checkArgument(
                        values.size() == rowCount,
                        "Column %s has %s values but the table has %s rows.",
                        name,
                        values.size(),
                        rowCount);
            }
            DataField field = new DataField(name, type);
            AbstractHeapVector vector = createVector(type);
            for (Object value : values) {
                append(field, vector, value);
            }
            fields.add(field);
            vectors.put(name, vector);
            rowCount = values.size();
            return this;
        }

        public Builder addRow(Object... values) {
            Preconditions.checkArgument(
                    values.length == fields.size(),
                    "Row has %s values but the table has %s fields.",
                    values.length,
                    fields.size());
            for (int i = 0; i < values.length; i++) {
                DataField field = fields.get(i);
                append(field, vectors.get(field.name()), values[i]);
            }
            rowCount++;
            return this;
        }

        public InMemoryTable build() {
            return new InMemoryTable(
                    rowCount, new ArrayList<>(fields), new LinkedHashMap<>(vectors));
        }

        private static AbstractHeapVector createVector(DataType type) {
            if (type.is(DataTypeFamily.INTEGER_NUMERIC)) {
                return new HeapLongVector(16);
            } else if (type.is(DataTypeFamily.APPROXIMATE_NUMERIC)) {
                return new HeapDoubleVector(16);
            } else if (type.is(DataTypeRoot.BOOLEAN)) {
                return new HeapBooleanVector(16);
            }
            return new HeapObjectVector(16);
        }

        private static void append(DataField field, AbstractHeapVector vector, Object value) {
            if (value == null) {
                Preconditions.checkArgument(
                        field.type().isNullable(),
                        "Column %s is NOT NULL but a null value was given.",
                        field.name());
                vector.appendNull();
            } else if (vector instanceof HeapLongVector) {
                checkValue(field, value, isIntegral(value));
                ((HeapLongVector) vector).appendLong(((Number) value).longValue());
            } else if (vector instanceof HeapDoubleVector) {
                checkValue(field, value, value instanceof Number);
                ((HeapDoubleVector) vector).appendDouble(((Number) value).doubleValue());
            } else if (vector instanceof HeapBooleanVector) {
                checkValue(field, value, value instanceof Boolean);
                ((HeapBooleanVector) vector).appendBoolean((Boolean) value);
            } else {
                ((HeapObjectVector) vector).appendObject(value);
            }
        }

        private static boolean isIntegral(Object value) {
            return value instanceof Byte
                    || value instanceof Short
                    || value instanceof Integer
                    || value instanceof Long;
        }

        private static void checkValue(DataField field, Object value, boolean matches) {
            Preconditions.checkArgument(
                    matches,
                    "Value %s of class %s does not match type %s of column %s.",
                    value,
                    value.getClass().getName(),
                    field.type().asSQLString(),
                    field.name());
        }
    }
}
