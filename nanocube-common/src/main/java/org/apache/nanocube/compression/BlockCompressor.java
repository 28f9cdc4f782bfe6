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
 * 数据块压缩器。
 *
 * <p>输出以 {@link CompressorUtils#HEADER_LENGTH} 字节的头部开始,依次是压缩后长度和原始长度(小端序),
 * 解压器依靠该头部确定目标缓冲区大小并校验数据完整性。
 */
public interface BlockCompressor {

    /** 返回压缩 {@code srcSize} 字节时目标缓冲区所需的最大长度,包含头部。 */
    int getMaxCompressedSize(int srcSize);

    /**
     * 压缩源数据到目标缓冲区。
     *
     * @return 写入目标缓冲区的字节数,包含头部
     * @throws BufferCompressionException 压缩失败时抛出
     */
    int compress(byte[] src, int srcOff, int srcLen, byte[] dst, int dstOff)
            throws BufferCompressionException;
}
