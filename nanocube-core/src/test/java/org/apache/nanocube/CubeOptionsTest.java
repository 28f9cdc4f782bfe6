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

package org.apache.nanocube;

import org.apache.nanocube.compression.BlockCompressionType;
import org.apache.nanocube.index.IndexingMethod;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link CubeOptions}. */
class CubeOptionsTest {

    @Test
    void testDefaults() {
        CubeOptions options = CubeOptions.defaults();
        assertThat(options.indexingMethod()).isEqualTo(IndexingMethod.ROARING);
        assertThat(options.cacheEnabled()).isTrue();
        assertThat(options.cacheMaxEntries()).isEqualTo(100_000L);
        assertThat(options.fileCompression()).isEqualTo(BlockCompressionType.ZSTD);
        assertThat(options.zstdLevel()).isEqualTo(3);
        assertThat(options.buildParallelism()).isEqualTo(1);
        assertThat(options.compressOptions().compress()).isEqualTo("zstd");
    }

    @Test
    void testFromMap() {
        Map<String, String> conf = new HashMap<>();
        conf.put("indexing-method", "sorted-array");
        conf.put("cache.enabled", "false");
        conf.put("cache.max-entries", "-1");
        conf.put("file.compression", "LZ4");
        conf.put("file.compression.zstd-level", "9");
        conf.put("index.build.parallelism", "4");
        CubeOptions options = CubeOptions.fromMap(conf);

        assertThat(options.indexingMethod()).isEqualTo(IndexingMethod.SORTED_ARRAY);
        assertThat(options.cacheEnabled()).isFalse();
        assertThat(options.cacheMaxEntries()).isEqualTo(-1L);
        assertThat(options.fileCompression()).isEqualTo(BlockCompressionType.LZ4);
        assertThat(options.compressOptions().compress()).isEqualTo("lz4");
        assertThat(options.compressOptions().zstdLevel()).isEqualTo(9);
        assertThat(options.buildParallelism()).isEqualTo(4);
    }

    @Test
    void testInvalidValues() {
        Map<String, String> conf = new HashMap<>();
        conf.put("file.compression", "lzo");
        conf.put("file.compression.zstd-level", "30");
        conf.put("index.build.parallelism", "0");
        conf.put("indexing-method", "hash");
        CubeOptions options = CubeOptions.fromMap(conf);

        assertThatThrownBy(options::fileCompression)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("file.compression");
        assertThatThrownBy(options::zstdLevel)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("between 1 and 22");
        assertThatThrownBy(options::buildParallelism)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 1");
        assertThatThrownBy(options::indexingMethod)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("indexing-method");
    }

    @Test
    void testBuilderOptionsReachTheCube() {
        Map<String, String> conf = new HashMap<>();
        conf.put("indexing-method", "sorted-array");
        conf.put("cache.enabled", "false");
        NanoCube cube = NanoCube.builder(CubeTestUtils.salesTable()).options(conf).build();

        assertThat(cube.indexingMethod()).isEqualTo(IndexingMethod.SORTED_ARRAY);
        assertThat(cube.options().cacheEnabled()).isFalse();
    }
}
