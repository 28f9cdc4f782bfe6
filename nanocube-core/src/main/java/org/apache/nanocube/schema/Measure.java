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
import org.apache.nanocube.data.columnar.ColumnVector;
import org.apache.nanocube.data.columnar.DoubleColumnVector;
import org.apache.nanocube.data.columnar.LongColumnVector;
import org.apache.nanocube.data.columnar.ObjectColumnVector;
import org.apache.nanocube.types.DataType;
import org.apache.nanocube.types.DataTypeChecks;
import org.apache.nanocube.utils.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.util.Arrays;

/**
 * 度量:一个按原始行顺序保存的数值向量。
 *
 * <p>整数列保存为 {@link MeasureType#INT64}。含有空值的整数列会被提升为 {@link
 * MeasureType#FLOAT64},空值保存为 {@code NaN}。
 */
public final class Measure {

    private static final Logger LOG = LoggerFactory.getLogger(Measure.class);

    private final String name;
    private final MeasureType type;
    @Nullable private final long[] longs;
    @Nullable private final double[] doubles;

    private Measure(
            String name, MeasureType type, @Nullable long[] longs, @Nullable double[] doubles) {
        this.name = name;
        this.type = type;
        this.longs = longs;
        this.doubles = doubles;
    }

    public static Measure ofLongs(String name, long[] values) {
        return new Measure(name, MeasureType.INT64, Preconditions.checkNotNull(values), null);
    }

    public static Measure ofDoubles(String name, double[] values) {
        return new Measure(name, MeasureType.FLOAT64, null, Preconditions.checkNotNull(values));
    }

    /**
     * 从列中读取度量向量。
     *
     * @throws CubeBuildException 列长度不足或包含非数值时抛出
     */
    public static Measure fromColumn(
            String name, DataType type, ColumnVector column, int rowCount) {
        if (column.getCapacity() < rowCount) {
            throw new CubeBuildException(
                    String.format(
                            "Measure '%s' has %s values but the table has %s rows.",
                            name, column.getCapacity(), rowCount));
        }

        boolean hasNulls = false;
        for (int i = 0; i < rowCount && !hasNulls; i++) {
            hasNulls = column.isNullAt(i);
        }

        boolean integral = DataTypeChecks.isIntegerNumeric(type);
        if (integral && !hasNulls) {
            long[] values = new long[rowCount];
            for (int i = 0; i < rowCount; i++) {
                values[i] = readLong(name, column, i);
            }
            return ofLongs(name, values);
        }

        if (integral) {
            LOG.warn(
                    "Measure '{}' of type {} contains nulls, promoting it to FLOAT64.",
                    name,
                    type.asSQLString());
        }
        double[] values = new double[rowCount];
        for (int i = 0; i < rowCount; i++) {
            values[i] = column.isNullAt(i) ? Double.NaN : readDouble(name, column, i);
        }
        return ofDoubles(name, values);
    }

    private static long readLong(String name, ColumnVector column, int i) {
        if (column instanceof LongColumnVector) {
            return ((LongColumnVector) column).getLong(i);
        }
        Object value = readObject(name, column, i);
        if (value instanceof Long
                || value instanceof Integer
                || value instanceof Short
                || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        throw mismatch(name, value, i);
    }

    private static double readDouble(String name, ColumnVector column, int i) {
        if (column instanceof DoubleColumnVector) {
            return ((DoubleColumnVector) column).getDouble(i);
        } else if (column instanceof LongColumnVector) {
            return ((LongColumnVector) column).getLong(i);
        }
        Object value = readObject(name, column, i);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw mismatch(name, value, i);
    }

    private static Object readObject(String name, ColumnVector column, int i) {
        if (column instanceof ObjectColumnVector) {
            return ((ObjectColumnVector) column).getObject(i);
        }
        throw new CubeBuildException(
                String.format(
                        "Measure '%s' is backed by unsupported column vector %s.",
                        name, column.getClass().getName()));
    }

    private static CubeBuildException mismatch(String name, Object value, int row) {
        return new CubeBuildException(
                String.format(
                        "Measure '%s' contains non-numeric value '%s' of class %s at row %s.",
                        name, value, value == null ? null : value.getClass().getName(), row));
    }

    public String name() {
        return name;
    }

    public MeasureType type() {
        return type;
    }

    public int size() {
        return type == MeasureType.INT64 ? longs.length : doubles.length;
    }

    /** 读取 INT64 度量的值。 */
    public long getLong(int i) {
        Preconditions.checkState(type == MeasureType.INT64, "Measure %s is not INT64.", name);
        return longs[i];
    }

    /** 以 double 读取任意度量的值,缺失值为 {@code NaN}。 */
    public double getDouble(int i) {
        return type == MeasureType.INT64 ? longs[i] : doubles[i];
    }

    public double[] toDoubleArray() {
        if (type == MeasureType.FLOAT64) {
            return doubles.clone();
        }
        double[] result = new double[longs.length];
        for (int i = 0; i < longs.length; i++) {
            result[i] = longs[i];
        }
        return result;
    }

    /** 返回内部的 long 数组,调用方不能修改。FLOAT64 度量返回 {@code null}。 */
    @Nullable
    public long[] longValues() {
        return longs;
    }

    /** 返回内部的 double 数组,调用方不能修改。INT64 度量返回 {@code null}。 */
    @Nullable
    public double[] doubleValues() {
        return doubles;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Measure measure = (Measure) o;
        return name.equals(measure.name)
                && type == measure.type
                && Arrays.equals(longs, measure.longs)
                && Arrays.equals(doubles, measure.doubles);
    }

    @Override
    public int hashCode() {
        int result = name.hashCode();
        result = 31 * result + type.hashCode();
        result = 31 * result + Arrays.hashCode(longs);
        result = 31 * result + Arrays.hashCode(doubles);
        return result;
    }

    @Override
    public String toString() {
        return "Measure{name='" + name + "', type=" + type + ", size=" + size() + '}';
    }
}
