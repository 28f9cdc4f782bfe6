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

package org.apache.nanocube.types;

import org.apache.nanocube.annotation.Public;
import org.apache.nanocube.utils.Preconditions;

import java.io.Serializable;
import java.util.Objects;

/** 表中的一个命名字段,由字段名和 {@link DataType} 组成。 */
@Public
public final class DataField implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;

    private final DataType type;

    public DataField(String name, DataType type) {
        this.name = Preconditions.checkNotNull(name, "Field name must not be null.");
        this.type = Preconditions.checkNotNull(type, "Field type must not be null.");
    }

    public String name() {
        return name;
    }

    public DataType type() {
        return type;
    }

    public DataField newType(DataType newType) {
        return new DataField(name, newType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DataField field = (DataField) o;
        return name.equals(field.name) && type.equals(field.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return String.format("`%s` %s", name, type.asSQLString());
    }
}
