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
import static org.apache.nanocube.compression.CompressorUtils.checkBlock;
import static org.apache.nanocube.compression.CompressorUtils.readIntLE;

/** 解压 {@link ZstdBlockCompressor} 输出的数据块。 */
public class ZstdBlockDecompressor implements BlockDecompressor {

    @Override
    public int decompress(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff)
            throws BufferDecompressionException {
        int originalLen = checkBlock(src, srcOff, srcLen, dst, dstOff);
        if (originalLen == 0) {
            return 0;
        }
        long decompressed;
        try {
            decompressed =
                    Zstd.decompressByteArray(
                            dst,
                            dstOff,
                            originalLen,
                            src,
                            srcOff + HEADER_LENGTH,
                            readIntLE(src, srcOff));
        } catch (RuntimeException e) {
            throw new BufferDecompressionException("Input is corrupted", e);
        }
        if (Zstd.isError(decompressed) || decompressed != originalLen) {
            throw new BufferDecompressionException("Input is corrupted");
        }
        return originalLen;
    }
}
