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

/** 元数据中的一个度量:名称、存储类型({@code INT64} 或 {@code FLOAT64})和数据块编号。 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MeasureMeta {

    public static final String FIELD_NAME = "name";
    public static final String FIELD_TYPE = "type";
    public static final String FIELD_BLOB = "blob";

    @JsonProperty(FIELD_NAME)
    private final String name;

    @JsonProperty(FIELD_TYPE)
    private final String type;

    @JsonProperty(FIELD_BLOB)
    private final int blob;

    @JsonCreator
    public MeasureMeta(
            @JsonProperty(FIELD_NAME) String name,
            @JsonProperty(FIELD_TYPE) String type,
            @JsonProperty(FIELD_BLOB) int blob) {
        this.name = name;
        this.type = type;
        this.blob = blob;
    }

    @JsonGetter(FIELD_NAME)
    public String name() {
        return name;
    }

    @JsonGetter(FIELD_TYPE)
    public String type() {
        return type;
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
        MeasureMeta that = (MeasureMeta) o;
        return blob == that.blob
                && Objects.equals(name, that.name)
                && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, blob);
    }
}
