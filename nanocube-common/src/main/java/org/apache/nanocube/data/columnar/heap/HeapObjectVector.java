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

import org.apache.nanocube.data.columnar.ObjectColumnVector;

import java.util.Arrays;

/** 堆上的对象列向量,空值位置同时记录在空值数组中。 */
public class HeapObjectVector extends AbstractHeapVector implements ObjectColumnVector {

    public Object[] vector;

    public HeapObjectVector(int len) {
        super(len);
        vector = new Object[len];
    }

    @Override
    void reserveForHeapVector(int newCapacity) {
        if (vector.length < newCapacity) {
            vector = Arrays.copyOf(vector, newCapacity);
        }
    }

    @Override
    public Object getObject(int i) {
        return vector[i];
    }

    public void appendObject(Object v) {
        if (v == null) {
            appendNull();
            return;
        }
        reserve(elementsAppended + 1);
        vector[elementsAppended] = v;
        elementsAppended++;
    }
}
