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

import net.jpountz.lz4.LZ4Compressor;
import net.jpountz.lz4.LZ4Factory;

import static org.apache.nanocube.compression.CompressorUtils.HEADER_LENGTH;
import static org.apache.nanocube.compression.CompressorUtils.writeHeader;

/** 基于 lz4-java 快速压缩器的 {@link BlockCompressor}。 */
public class Lz4BlockCompressor implements BlockCompressor {

    private final LZ4Compressor compressor = LZ4Factory.fastestInstance().fastCompressor();

    @Override
    public int getMaxCompressedSize(int srcSize) {
        return HEADER_LENGTH + compressor.maxCompressedLength(srcSize);
    }

    @Override
    public int compress(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff)
            throws BufferCompressionException {
        if (srcLen == 0) {
            return writeHeader(dst, dstOff, 0, 0);
        }
        int compressedLen;
        try {
            compressedLen = compressor.compress(src, srcOff, srcLen, dst, dstOff + HEADER_LENGTH);
        } catch (RuntimeException e) {
            throw new BufferCompressionException(e);
        }
        return writeHeader(dst, dstOff, compressedLen, srcLen);
    }
}
