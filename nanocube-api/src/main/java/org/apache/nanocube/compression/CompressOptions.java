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

package org.apache.nanocube.compression;

import java.io.Serializable;
import java.util.Objects;

/**
 * 立方体文件中数据块的压缩选项。
 *
 * <p>目前支持的算法:
 *
 * <ul>
 *   <li><b>zstd</b>: 默认算法,压缩率高,级别 1-22 可调,默认级别 3
 *   <li><b>lz4</b>: 速度优先,压缩率较低
 *   <li><b>none</b>: 不压缩,用于调试或已经很紧凑的数据
 * </ul>
 */
public class CompressOptions implements Serializable {

    private static final long serialVersionUID = 1L;

    /** 压缩算法名称。 */
    private final String compress;

    /** Zstd 压缩级别(1-22)。 */
    private final int zstdLevel;

    public CompressOptions(String compress, int zstdLevel) {
        this.compress = compress;
        this.zstdLevel = zstdLevel;
    }

    public String compress() {
        return compress;
    }

    public int zstdLevel() {
        return zstdLevel;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CompressOptions that = (CompressOptions) o;
        return zstdLevel == that.zstdLevel && Objects.equals(compress, that.compress);
    }

    @Override
    public int hashCode() {
        return Objects.hash(compress, zstdLevel);
    }

    @Override
    public String toString() {
        return "CompressOptions{"
                + "compress='"
                + compress
                + '\''
                + ", zstdLevel="
                + zstdLevel
                + '}';
    }

    /** 默认选项:zstd,级别 3。 */
    public static CompressOptions defaultOptions() {
        return new CompressOptions("zstd", 3);
    }
}
