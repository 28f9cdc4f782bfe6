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
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** 元数据中的一个成员:成员值的文本形式和其行集合所在的数据块编号。 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MemberMeta {

    public static final String FIELD_VALUE = "value";
    public static final String FIELD_BLOB = "blob";

    @JsonProperty(FIELD_VALUE)
    private final String value;

    @JsonProperty(FIELD_BLOB)
    private final int blob;

    @JsonCreator
    public MemberMeta(
            @JsonProperty(FIELD_VALUE) String value, @JsonProperty(FIELD_BLOB) int blob) {
        this.value = value;
        this.blob = blob;
    }

    @JsonGetter(FIELD_VALUE)
    public String value() {
        return value;
    }

    @JsonGetter(FIELD_BLOB)
    public int blob() {
        return blob;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        MemberMeta that = (MemberMeta) o;
        return blob == that.blob && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, blob);
    }
}
