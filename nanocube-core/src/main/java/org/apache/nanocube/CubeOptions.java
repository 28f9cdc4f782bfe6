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
import org.apache.nanocube.compression.CompressOptions;
import org.apache.nanocube.index.IndexingMethod;
import org.apache.nanocube.options.ConfigOption;
import org.apache.nanocube.options.Options;
import org.apache.nanocube.utils.Preconditions;

import java.util.Locale;
import java.util.Map;

import static org.apache.nanocube.options.ConfigOptions.key;

/**
 * 立方体的配置项。
 *
 * <p>所有配置项都可以通过字符串键值对设置:
 *
 * <pre>{@code
 * Map<String, String> conf = new HashMap<>();
 * conf.put("indexing-method", "sorted-array");
 * conf.put("file.compression", "lz4");
 * CubeOptions options = CubeOptions.fromMap(conf);
 * }</pre>
 */
public class CubeOptions {

    public static final ConfigOption<IndexingMethod> INDEXING_METHOD =
            key("indexing-method")
                    .enumType(IndexingMethod.class)
                    .defaultValue(IndexingMethod.ROARING)
                    .withDescription(
                            "Row set representation of the member index, "
                                    + "'roaring' for compressed bitmaps or 'sorted-array' "
                                    + "for sorted integer arrays.");

    public static final ConfigOption<Boolean> CACHE_ENABLED =
            key("cache.enabled")
                    .booleanType()
                    .defaultValue(true)
                    .withDescription("Whether query results are cached by query signature.");

    public static final ConfigOption<Long> CACHE_MAX_ENTRIES =
            key("cache.max-entries")
                    .longType()
                    .defaultValue(100_000L)
                    .withDescription(
                            "Maximum number of cached query results, "
                                    + "a value less than or equal to 0 means unbounded.");

    public static final ConfigOption<String> FILE_COMPRESSION =
            key("file.compression")
                    .stringType()
                    .defaultValue("zstd")
                    .withDescription(
                            "Compression of index and measure blobs in the cube file, "
                                    + "one of 'zstd', 'lz4' or 'none'.");

    public static final ConfigOption<Integer> FILE_COMPRESSION_ZSTD_LEVEL =
            key("file.compression.zstd-level")
                    .intType()
                    .defaultValue(3)
                    .withDescription("Zstd compression level, between 1 and 22.");

    public static final ConfigOption<Integer> INDEX_BUILD_PARALLELISM =
            key("index.build.parallelism")
                    .intType()
                    .defaultValue(1)
                    .withDescription("Number of threads used to build dimension indexes.");

    private final Options options;

    public CubeOptions(Options options) {
        this.options = options;
    }

    public static CubeOptions fromMap(Map<String, String> options) {
        return new CubeOptions(Options.fromMap(options));
    }

    public static CubeOptions defaults() {
        return new CubeOptions(new Options());
    }

    public Options toConfiguration() {
        return options;
    }

    public IndexingMethod indexingMethod() {
        return options.get(INDEXING_METHOD);
    }

    public boolean cacheEnabled() {
        return options.get(CACHE_ENABLED);
    }

    public long cacheMaxEntries() {
        return options.get(CACHE_MAX_ENTRIES);
    }

    public BlockCompressionType fileCompression() {
        try {
            return BlockCompressionType.fromName(options.get(FILE_COMPRESSION));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    String.format(
                            "Could not parse value '%s' for key '%s'.",
                            options.get(FILE_COMPRESSION), FILE_COMPRESSION.key()),
                    e);
        }
    }

    public int zstdLevel() {
        int level = options.get(FILE_COMPRESSION_ZSTD_LEVEL);
        Preconditions.checkArgument(
                level >= 1 && level <= 22,
                "%s must be between 1 and 22, but is %s.",
                FILE_COMPRESSION_ZSTD_LEVEL.key(),
                level);
        return level;
    }

    public CompressOptions compressOptions() {
        return new CompressOptions(
                fileCompression().name().toLowerCase(Locale.ROOT), zstdLevel());
    }

    public int buildParallelism() {
        int parallelism = options.get(INDEX_BUILD_PARALLELISM);
        Preconditions.checkArgument(
                parallelism >= 1,
                "%s must be at least 1, but is %s.",
                INDEX_BUILD_PARALLELISM.key(),
                parallelism);
        return parallelism;
    }

    @Override
    public String toString() {
        return "CubeOptions" + options.toMap();
    }
}
