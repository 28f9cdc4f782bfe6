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

package org.apache.nanocube.data.columnar.heap;

import org.apache.nanocube.data.columnar.LongColumnVector;

import java.util.Arrays;

/** 堆上的 long 列向量。 */
public class HeapLongVector extends AbstractHeapVector implements LongColumnVector {

    public long[] vector;

    public HeapLongVector(int len) {
        super(len);
        vector = new long[len];
    }

    @Override
    void reserveForHeapVector(int newCapacity) {
        if (vector.length < newCapacity) {
            vector = Arrays.copyOf(vector, newCapacity);
        }
    }

    @Override
    public long getLong(int i) {
        return vector[i];
    }

    public void setLong(int i, long value) {
        vector[i] = value;
    }

    public void appendLong(long v) {
        reserve(elementsAppended + 1);
        setLong(elementsAppended, v);
        elementsAppended++;
    }
}
