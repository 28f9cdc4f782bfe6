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

import org.apache.nanocube.data.columnar.ColumnVector;

import java.util.Arrays;

/**
 * 堆上列向量的基类,维护空值标记和追加位置。
 *
 * <p>向量按追加方式写入,容量不足时自动扩容。{@link #getCapacity()} 返回已追加的元素个数。
 */
public abstract class AbstractHeapVector implements ColumnVector {

    protected boolean[] isNull;

    /** 没有任何空值时为 true,读取时可以跳过空值数组。 */
    protected boolean noNulls = true;

    protected int elementsAppended;

    public AbstractHeapVector(int capacity) {
        isNull = new boolean[capacity];
    }

    public void setNullAt(int i) {
        isNull[i] = true;
        noNulls = false;
    }

    public void appendNull() {
        reserve(elementsAppended + 1);
        setNullAt(elementsAppended);
        elementsAppended++;
    }

    @Override
    public boolean isNullAt(int i) {
        return !noNulls && isNull[i];
    }

    public boolean hasNulls() {
        return !noNulls;
    }

    @Override
    public int getCapacity() {
        return elementsAppended;
    }

    protected void reserve(int requiredCapacity) {
        if (requiredCapacity > isNull.length) {
            int newCapacity = (int) Math.min(Integer.MAX_VALUE - 8, requiredCapacity * 2L);
            isNull = Arrays.copyOf(isNull, newCapacity);
            reserveForHeapVector(newCapacity);
        }
    }

    abstract void reserveForHeapVector(int newCapacity);
}
