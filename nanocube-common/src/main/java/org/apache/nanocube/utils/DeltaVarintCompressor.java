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

package org.apache.nanocube.utils;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;

/**
 * 对整数数组做差分 + ZigZag + Varint 编码。
 *
 * <p>升序的行号数组差分后大多是很小的正数,每个元素通常只占 1 到 2 个字节。编码结果不包含元素个数,
 * 解码时读到输入末尾为止。
 */
public class DeltaVarintCompressor {

    public static byte[] compress(int[] data) {
        if (data == null || data.length == 0) {
            return new byte[0];
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length * 2);
        // Store the first element
        encodeVarint(data[0], out);
        for (int i = 1; i < data.length; i++) {
            encodeVarint((long) data[i] - data[i - 1], out);
        }
        return out.toByteArray();
    }

    /**
     * 解码 {@link #compress(int[])} 的输出。
     *
     * @throws IllegalArgumentException 输入被截断或数值溢出时抛出
     */
    public static int[] decompress(byte[] compressed) {
        if (compressed == null || compressed.length == 0) {
            return new int[0];
        }

        ByteArrayInputStream in = new ByteArrayInputStream(compressed);
        IntArrayList result = new IntArrayList(compressed.length);
        long previous = 0;
        boolean first = true;
        while (in.available() > 0) {
            long delta = decodeVarint(in);
            long value = first ? delta : previous + delta;
            if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Decoded value overflows int: " + value);
            }
            result.add((int) value);
            previous = value;
            first = false;
        }
        return result.toArray();
    }

    private static void encodeVarint(long value, ByteArrayOutputStream out) {
        // ZigZag transformation for long
        long tmp = (value << 1) ^ (value >> 63);
        while ((tmp & ~0x7FL) != 0) {
            out.write(((int) tmp & 0x7F) | 0x80);
            tmp >>>= 7;
        }
        out.write((byte) tmp);
    }

    private static long decodeVarint(ByteArrayInputStream in) {
        long result = 0;
        int shift = 0;
        while (true) {
            long b = in.read();
            if (b == -1) {
                throw new IllegalArgumentException("Unexpected end of input");
            }
            result |= (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                break;
            }
            shift += 7;
            if (shift > 63) {
                throw new IllegalArgumentException("Varint overflow");
            }
        }
        // Reverse ZigZag transformation
        long zigzag = result >>> 1;
        return (result & 1) == 0 ? zigzag : (~zigzag);
    }
}
