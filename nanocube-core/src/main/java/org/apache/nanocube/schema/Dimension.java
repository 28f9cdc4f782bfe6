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

import org.apache.nanocube.index.MemberIndex;
import org.apache.nanocube.index.RowSet;
import org.apache.nanocube.types.DataType;

import javax.annotation.Nullable;

import java.util.Collection;
import java.util.List;

/** 维度:名称、在立方体中的位置、类型以及成员索引。 */
public final class Dimension {

    private final String name;
    private final int ordinal;
    private final DataType type;
    private final MemberIndex index;

    public Dimension(String name, int ordinal, DataType type, MemberIndex index) {
        this.name = name;
        this.ordinal = ordinal;
        this.type = type;
        this.index = index;
    }

    public String name() {
        return name;
    }

    public int ordinal() {
        return ordinal;
    }

    public DataType type() {
        return type;
    }

    public MemberIndex index() {
        return index;
    }

    /** 按自然顺序返回所有非空成员。 */
    public List<Object> members() {
        return index.members();
    }

    public RowSet rowsFor(@Nullable Object member) {
        return index.rowsFor(member);
    }

    public RowSet rowsForAny(Collection<?> members) {
        return index.rowsForAny(members);
    }

    public boolean hasNullMember() {
        return index.hasNullMember();
    }

    public int memberCount() {
        return index.memberCount();
    }

    @Override
    public String toString() {
        return "Dimension{name='"
                + name
                + "', type="
                + type.asSQLString()
                + ", members="
                + index.memberCount()
                + (index.hasNullMember() ? " + null" : "")
                + '}';
    }
}
