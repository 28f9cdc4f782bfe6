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

import org.apache.nanocube.utils.Preconditions;

import javax.annotation.Nullable;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 一个维度上的过滤条件:等于某个成员,或属于一组成员中的任意一个。
 *
 * <p>成员可以是 {@code null},表示该维度的空值成员。
 */
public final class FilterValue {

    private final boolean single;

    private final List<Object> members;

    private FilterValue(boolean single, List<Object> members) {
        this.single = single;
        this.members = Collections.unmodifiableList(members);
    }

    public static FilterValue of(@Nullable Object member) {
        List<Object> members = new ArrayList<>(1);
        members.add(member);
        return new FilterValue(true, members);
    }

    public static FilterValue anyOf(Collection<?> members) {
        Preconditions.checkNotNull(members, "members");
        return new FilterValue(false, new ArrayList<>(members));
    }

    public static FilterValue anyOf(Object... members) {
        return anyOf(Arrays.asList(members));
    }

    /**
     * 把任意过滤值转换为 {@link FilterValue}:{@link Collection} 和数组表示"任意一个",其它值表示单个成员。
     */
    public static FilterValue from(@Nullable Object value) {
        if (value instanceof FilterValue) {
            return (FilterValue) value;
        } else if (value instanceof Collection) {
            return anyOf((Collection<?>) value);
        } else if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> members = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                members.add(Array.get(value, i));
            }
            return new FilterValue(false, members);
        }
        return of(value);
    }

    public boolean isSingle() {
        return single;
    }

    public List<Object> members() {
        return members;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FilterValue that = (FilterValue) o;
        return single == that.single && members.equals(that.members);
    }

    @Override
    public int hashCode() {
        return Objects.hash(single, members);
    }

    @Override
    public String toString() {
        return single ? String.valueOf(members.get(0)) : "anyOf" + members;
    }
}
