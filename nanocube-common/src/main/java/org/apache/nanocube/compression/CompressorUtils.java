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

/**
 * 压缩块头部的读写和整块压缩、解压的便捷方法。
 *
 * <p>每个压缩块都以 {@link #HEADER_LENGTH} 字节的头部开始:压缩后长度和原始长度,均为小端序 int。
 */
public class CompressorUtils {

    public static final int HEADER_LENGTH = 8;

    public static void writeIntLE(int i, byte[] buf, int offset) {
        buf[offset++] = (byte) i;
        buf[offset++] = (byte) (i >>> 8);
        buf[offset++] = (byte) (i >>> 16);
        buf[offset] = (byte) (i >>> 24);
    }

    public static int readIntLE(byte[] buf, int i) {
        return (buf[i] & 0xFF)
                | ((buf[i + 1] & 0xFF) << 8)
                | ((buf[i + 2] & 0xFF) << 16)
                | ((buf[i + 3] & 0xFF) << 24);
    }

    static int writeHeader(byte[] dst, int dstOff, int compressedLen, int originalLen) {
        writeIntLE(compressedLen, dst, dstOff);
        writeIntLE(originalLen, dst, dstOff + 4);
        return HEADER_LENGTH + compressedLen;
    }

    public static void validateLength(int compressedLen, int originalLen)
            throws BufferDecompressionException {
        if (originalLen < 0
                || compressedLen < 0
                || (originalLen == 0 && compressedLen != 0)
                || (originalLen != 0 && compressedLen == 0)) {
            throw new BufferDecompressionException("Input is corrupted, invalid length.");
        }
    }

    /**
     * 读取压缩块头部中的原始长度,并校验源数据足够容纳头部。
     *
     * @throws BufferDecompressionException 源数据比头部还短或长度非法时抛出
     */
    public static int readOriginalLength(byte[] src, int srcOff, int srcLen)
            throws BufferDecompressionException {
        if (srcLen < HEADER_LENGTH) {
            throw new BufferDecompressionException("Source data is shorter than block header.");
        }
        int compressedLen = readIntLE(src, srcOff);
        int originalLen = readIntLE(src, srcOff + 4);
        validateLength(compressedLen, originalLen);
        return originalLen;
    }

    /** 解压前的统一校验:头部合法,源数据完整,目标缓冲区足够。返回原始长度。 */
    static int checkBlock(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff)
            throws BufferDecompressionException {
        int originalLen = readOriginalLength(src, srcOff, srcLen);
        if (dst.length - dstOff < originalLen) {
            throw new BufferDecompressionException("Buffer length too small");
        }
        if (srcLen - HEADER_LENGTH < readIntLE(src, srcOff)) {
            throw new BufferDecompressionException(
                    "Source data is not integral for decompression.");
        }
        return originalLen;
    }

    /** 使用给定工厂压缩整个字节数组,返回只包含有效数据的新数组。 */
    public static byte[] compress(BlockCompressionFactory factory, byte[] src) {
        BlockCompressor compressor = factory.getCompressor();
        byte[] dst = new byte[compressor.getMaxCompressedSize(src.length)];
        int len = compressor.compress(src, 0, src.length, dst, 0);
        byte[] result = new byte[len];
        System.arraycopy(dst, 0, result, 0, len);
        return result;
    }

    /** 解压由 {@link #compress(BlockCompressionFactory, byte[])} 生成的数据块。 */
    public static byte[] decompress(BlockCompressionFactory factory, byte[] src) {
        int originalLen = readOriginalLength(src, 0, src.length);
        byte[] dst = new byte[originalLen];
        int len = factory.getDecompressor().decompress(src, 0, src.length, dst, 0);
        if (len != originalLen) {
            throw new BufferDecompressionException("Input is corrupted");
        }
        return dst;
    }

    private CompressorUtils() {}
}
