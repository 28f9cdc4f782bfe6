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

import java.util.List;
import java.util.Objects;

/**
 * 立方体文件的元数据,以 JSON 形式保存在第 0 个数据块中。
 *
 * <p>{@code indexingMethod} 和 {@code compression} 与文件头中的编号重复保存,读取时两者必须一致。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CubeFileMeta {

    public static final String FIELD_FORMAT_VERSION = "formatVersion";
    public static final String FIELD_ROW_COUNT = "rowCount";
    public static final String FIELD_INDEXING_METHOD = "indexingMethod";
    public static final String FIELD_COMPRESSION = "compression";
    public static final String FIELD_DIMENSIONS = "dimensions";
    public static final String FIELD_MEASURES = "measures";

    @JsonProperty(FIELD_FORMAT_VERSION)
    private final int formatVersion;

    @JsonProperty(FIELD_ROW_COUNT)
    private final int rowCount;

    @JsonProperty(FIELD_INDEXING_METHOD)
    private final String indexingMethod;

    @JsonProperty(FIELD_COMPRESSION)
    private final String compression;

    @JsonProperty(FIELD_DIMENSIONS)
    private final List<DimensionMeta> dimensions;

    @JsonProperty(FIELD_MEASURES)
    private final List<MeasureMeta> measures;

    @JsonCreator
    public CubeFileMeta(
            @JsonProperty(FIELD_FORMAT_VERSION) int formatVersion,
            @JsonProperty(FIELD_ROW_COUNT) int rowCount,
            @JsonProperty(FIELD_INDEXING_METHOD) String indexingMethod,
            @JsonProperty(FIELD_COMPRESSION) String compression,
            @JsonProperty(FIELD_DIMENSIONS) List<DimensionMeta> dimensions,
            @JsonProperty(FIELD_MEASURES) List<MeasureMeta> measures) {
        this.formatVersion = formatVersion;
        this.rowCount = rowCount;
        this.indexingMethod = indexingMethod;
        this.compression = compression;
        this.dimensions = dimensions;
        this.measures = measures;
    }

    @JsonGetter(FIELD_FORMAT_VERSION)
    public int formatVersion() {
        return formatVersion;
    }

    @JsonGetter(FIELD_ROW_COUNT)
    public int rowCount() {
        return rowCount;
    }

    @JsonGetter(FIELD_INDEXING_METHOD)
    public String indexingMethod() {
        return indexingMethod;
    }

    @JsonGetter(FIELD_COMPRESSION)
    public String compression() {
        return compression;
    }

    @JsonGetter(FIELD_DIMENSIONS)
    public List<DimensionMeta> dimensions() {
        return dimensions;
    }

    @JsonGetter(FIELD_MEASURES)
    public List<MeasureMeta> measures() {
        return measures;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CubeFileMeta that = (CubeFileMeta) o;
        return formatVersion == that.formatVersion
                && rowCount == that.rowCount
                && Objects.equals(indexingMethod, that.indexingMethod)
                && Objects.equals(compression, that.compression)
                && Objects.equals(dimensions, that.dimensions)
                && Objects.equals(measures, that.measures);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                formatVersion, rowCount, indexingMethod, compression, dimensions, measures);
    }
}
