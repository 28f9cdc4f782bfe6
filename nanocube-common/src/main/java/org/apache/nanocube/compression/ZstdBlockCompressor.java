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

import com.github.luben.zstd.Zstd;

import static org.apache.nanocube.compression.CompressorUtils.HEADER_LENGTH;
import static org.apache.nanocube.compression.CompressorUtils.writeHeader;

/**
 * 基于 zstd-jni 的 {@link BlockCompressor}。
 *
 * <p>每个块是一个独立的 zstd 帧,前面带有与 LZ4 相同格式的头部。
 */
public class ZstdBlockCompressor implements BlockCompressor {

    private final int level;

    public ZstdBlockCompressor(int level) {
        this.level = level;
    }

    @Override
    public int getMaxCompressedSize(int srcSize) {
        return HEADER_LENGTH + (int) Zstd.compressBound(srcSize);
    }

    @Override
    public int compress(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff)
            throws BufferCompressionException {
        if (srcLen == 0) {
            return writeHeader(dst, dstOff, 0, 0);
        }
        int dstSize = dst.length - dstOff - HEADER_LENGTH;
        if (dstSize < 0) {
            throw new BufferCompressionException("Buffer length too small");
        }
        long compressedLen;
        try {
            compressedLen =
                    Zstd.compressByteArray(
                            dst, dstOff + HEADER_LENGTH, dstSize, src, srcOff, srcLen, level);
        } catch (RuntimeException e) {
            throw new BufferCompressionException(e);
        }
        if (Zstd.isError(compressedLen)) {
            throw new BufferCompressionException(Zstd.getErrorName(compressedLen));
        }
        return writeHeader(dst, dstOff, (int) compressedLen, srcLen);
    }
}
