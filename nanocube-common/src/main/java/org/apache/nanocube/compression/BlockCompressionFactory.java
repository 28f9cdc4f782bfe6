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

import javax.annotation.Nullable;

/**
 * 块压缩工厂,为一种压缩算法创建压缩器和解压器。
 *
 * <p>不压缩({@code none})时工厂方法返回 {@code null},调用方直接使用原始字节。Zstd 的压缩级别在创建工厂时确定,
 * 解压不需要级别。
 */
public final class BlockCompressionFactory {

    static final int DEFAULT_ZSTD_LEVEL = 3;

    private final BlockCompressionType compressionType;

    private final int zstdLevel;

    private BlockCompressionFactory(BlockCompressionType compressionType, int zstdLevel) {
        this.compressionType = compressionType;
        this.zstdLevel = zstdLevel;
    }

    public BlockCompressionType getCompressionType() {
        return compressionType;
    }

    public BlockCompressor getCompressor() {
        return compressionType == BlockCompressionType.ZSTD
                ? new ZstdBlockCompressor(zstdLevel)
                : new Lz4BlockCompressor();
    }

    public BlockDecompressor getDecompressor() {
        return compressionType == BlockCompressionType.ZSTD
                ? new ZstdBlockDecompressor()
                : new Lz4BlockDecompressor();
    }

    @Nullable
    public static BlockCompressionFactory create(CompressOptions compression) {
        BlockCompressionType type = BlockCompressionType.fromName(compression.compress());
        return type == BlockCompressionType.NONE
                ? null
                : new BlockCompressionFactory(type, compression.zstdLevel());
    }

    @Nullable
    public static BlockCompressionFactory create(BlockCompressionType compression) {
        switch (compression) {
            case NONE:
                return null;
            case ZSTD:
            case LZ4:
                return new BlockCompressionFactory(compression, DEFAULT_ZSTD_LEVEL);
            default:
                throw new IllegalStateException("Unknown CompressionMethod " + compression);
        }
    }
}
