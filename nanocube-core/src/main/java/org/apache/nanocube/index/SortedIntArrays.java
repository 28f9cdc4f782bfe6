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

import java.util.Arrays;

/**
 * 升序无重复 int 数组上的集合运算。
 *
 * <p>并集和大小相近的交集使用线性归并;当两个数组长度之比超过 {@link #GALLOP_RATIO} 时,
 * 交集改为对较大的数组做指数查找加二分查找。
 */
public final class SortedIntArrays {

    static final int GALLOP_RATIO = 32;

    public static int[] union(int[] a, int[] b) {
        if (a.length == 0) {
            return b;
        }
        if (b.length == 0) {
            return a;
        }
        int[] result = new int[a.length + b.length];
        int i = 0;
        int j = 0;
        int k = 0;
        while (i < a.length && j < b.length) {
            int x = a[i];
            int y = b[j];
            if (x < y) {
                result[k++] = x;
                i++;
            } else if (x > y) {
                result[k++] = y;
                j++;
            } else {
                result[k++] = x;
                i++;
                j++;
            }
        }
        while (i < a.length) {
            result[k++] = a[i++];
        }
        while (j < b.length) {
            result[k++] = b[j++];
        }
        return k == result.length ? result : Arrays.copyOf(result, k);
    }

    public static int[] intersect(int[] a, int[] b) {
        if (a.length == 0 || b.length == 0) {
            return new int[0];
        }
        int[] small = a.length <= b.length ? a : b;
        int[] large = small == a ? b : a;
        if ((long) small.length * GALLOP_RATIO < large.length) {
            return gallopingIntersect(small, large);
        }
        return mergeIntersect(small, large);
    }

    static int[] mergeIntersect(int[] a, int[] b) {
        int[] result = new int[Math.min(a.length, b.length)];
        int i = 0;
        int j = 0;
        int k = 0;
        while (i < a.length && j < b.length) {
            int x = a[i];
            int y = b[j];
            if (x < y) {
                i++;
            } else if (x > y) {
                j++;
            } else {
                result[k++] = x;
                i++;
                j++;
            }
        }
        return k == result.length ? result : Arrays.copyOf(result, k);
    }

    static int[] gallopingIntersect(int[] small, int[] large) {
        int[] result = new int[small.length];
        int k = 0;
        int low = 0;
        for (int value : small) {
            // exponential probe for the first position whose value is >= target
            int bound = 1;
            while (low + bound < large.length && large[low + bound] < value) {
                bound <<= 1;
            }
            int high = Math.min(low + bound, large.length - 1);
            int pos = Arrays.binarySearch(large, low, high + 1, value);
            if (pos >= 0) {
                result[k++] = value;
                low = pos + 1;
            } else {
                low = -pos - 1;
            }
            if (low >= large.length) {
                break;
            }
        }
        return k == result.length ? result : Arrays.copyOf(result, k);
    }

    /** 校验数组严格升序,用于反序列化后的完整性检查。 */
    public static boolean isStrictlyAscending(int[] values) {
        for (int i = 1; i < values.length; i++) {
            if (values[i] <= values[i - 1]) {
                return false;
            }
        }
        return values.length == 0 || values[0] >= 0;
    }

    private SortedIntArrays() {}
}
