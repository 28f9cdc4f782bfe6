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

package org.apache.nanocube.io;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonGetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * 元数据中的一个维度。
 *
 * <p>{@code type} 是 {@link org.apache.nanocube.types.DataType#asSQLString()} 的结果。维度没有空值成员时
 * {@code nullBlob} 不写出。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DimensionMeta {

    public static final String FIELD_NAME = "name";
    public static final String FIELD_TYPE = "type";
    public static final String FIELD_MEMBERS = "members";
    public static final String FIELD_NULL_BLOB = "nullBlob";

    @JsonProperty(FIELD_NAME)
    private final String name;

    @JsonProperty(FIELD_TYPE)
    private final String type;

    @JsonProperty(FIELD_MEMBERS)
    private final List<MemberMeta> members;

    @JsonProperty(FIELD_NULL_BLOB)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @Nullable
    private final Integer nullBlob;

    @JsonCreator
    public DimensionMeta(
            @JsonProperty(FIELD_NAME) String name,
            @JsonProperty(FIELD_TYPE) String type,
            @JsonProperty(FIELD_MEMBERS) List<MemberMeta> members,
            @JsonProperty(FIELD_NULL_BLOB) @Nullable Integer nullBlob) {
        this.name = name;
        this.type = type;
        this.members = members;
        this.nullBlob = nullBlob;
    }

    @JsonGetter(FIELD_NAME)
    public String name() {
        return name;
    }

    @JsonGetter(FIELD_TYPE)
    public String type() {
        return type;
    }

    @JsonGetter(FIELD_MEMBERS)
    public List<MemberMeta> members() {
        return members;
    }

    @JsonGetter(FIELD_NULL_BLOB)
    @Nullable
    public Integer nullBlob() {
        return nullBlob;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DimensionMeta that = (DimensionMeta) o;
        return Objects.equals(name, that.name)
                && Objects.equals(type, that.type)
                && Objects.equals(members, that.members)
                && Objects.equals(nullBlob, that.nullBlob);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, members, nullBlob);
    }
}
