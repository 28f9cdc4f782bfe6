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

import org.apache.nanocube.schema.Measure;
import org.apache.nanocube.schema.MeasureType;

import javax.annotation.Nullable;

/**
 * 在选中的行上聚合一个度量。
 *
 * <p>结果类型:INT64 度量的 SUM、MIN、MAX 以及任意度量的 COUNT 返回 {@link Long},其余返回 {@link
 * Double}。
 *
 * <p>没有选中任何行时返回 0({@code 0L} 或 {@code 0.0})。选中了行但所有值都缺失时,SUM 和 COUNT 返回
 * 0,其余返回 {@code NaN}。
 */
public final class MeasureAggregator {

    /**
     * 聚合度量。
     *
     * @param rows 升序的行号,{@code null} 表示所有行
     */
    public static Number aggregate(Measure measure, Aggregation aggregation, @Nullable int[] rows) {
        int n = rows == null ? measure.size() : rows.length;
        boolean longResult = isLongResult(measure.type(), aggregation);
        if (n == 0) {
            return longResult ? (Number) 0L : (Number) 0.0;
        }
        if (measure.type() == MeasureType.INT64) {
            return aggregateLongs(measure.longValues(), aggregation, rows, n);
        }
        return aggregateDoubles(measure.doubleValues(), aggregation, rows, n);
    }

    public static boolean isLongResult(MeasureType type, Aggregation aggregation) {
        switch (aggregation) {
            case COUNT:
                return true;
            case SUM:
            case MIN:
            case MAX:
                return type == MeasureType.INT64;
            default:
                return false;
        }
    }

    private static Number aggregateLongs(
            long[] values, Aggregation aggregation, @Nullable int[] rows, int n) {
        switch (aggregation) {
            case COUNT:
                return (long) n;
            case SUM:
                {
                    long sum = 0;
                    for (int i = 0; i < n; i++) {
                        sum += values[row(rows, i)];
                    }
                    return sum;
                }
            case MIN:
                {
                    long min = Long.MAX_VALUE;
                    for (int i = 0; i < n; i++) {
                        min = Math.min(min, values[row(rows, i)]);
                    }
                    return min;
                }
            case MAX:
                {
                    long max = Long.MIN_VALUE;
                    for (int i = 0; i < n; i++) {
                        max = Math.max(max, values[row(rows, i)]);
                    }
                    return max;
                }
            default:
                {
                    double sum = 0;
                    for (int i = 0; i < n; i++) {
                        sum += values[row(rows, i)];
                    }
                    double mean = sum / n;
                    if (aggregation == Aggregation.MEAN) {
                        return mean;
                    }
                    double squares = 0;
                    for (int i = 0; i < n; i++) {
                        double d = values[row(rows, i)] - mean;
                        squares += d * d;
                    }
                    return dispersion(aggregation, squares / n);
                }
        }
    }

    private static Number aggregateDoubles(
            double[] values, Aggregation aggregation, @Nullable int[] rows, int n) {
        long count = 0;
        double sum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            double v = values[row(rows, i)];
            if (Double.isNaN(v)) {
                continue;
            }
            count++;
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }

        switch (aggregation) {
            case COUNT:
                return count;
            case SUM:
                return sum;
            default:
                break;
        }
        if (count == 0) {
            return Double.NaN;
        }
        switch (aggregation) {
            case MIN:
                return min;
            case MAX:
                return max;
            case MEAN:
                return sum / count;
            default:
                {
                    double mean = sum / count;
                    double squares = 0;
                    for (int i = 0; i < n; i++) {
                        double v = values[row(rows, i)];
                        if (!Double.isNaN(v)) {
                            double d = v - mean;
                            squares += d * d;
                        }
                    }
                    return dispersion(aggregation, squares / count);
                }
        }
    }

    private static double dispersion(Aggregation aggregation, double variance) {
        return aggregation == Aggregation.STD ? Math.sqrt(variance) : variance;
    }

    private static int row(@Nullable int[] rows, int i) {
        return rows == null ? i : rows[i];
    }

    private MeasureAggregator() {}
}
