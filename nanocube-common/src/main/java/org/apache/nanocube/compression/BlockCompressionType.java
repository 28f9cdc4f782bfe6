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
 * 块压缩算法类型。
 *
 * <p>{@code persistentId} 会写入立方体文件头,已分配的编号不能修改。
 */
public enum BlockCompressionType {
    NONE(0),
    ZSTD(1),
    LZ4(2);

    private final int persistentId;

    BlockCompressionType(int persistentId) {
        this.persistentId = persistentId;
    }

    public int persistentId() {
        return this.persistentId;
    }

    public static BlockCompressionType getCompressionTypeByPersistentId(int persistentId) {
        BlockCompressionType[] types = values();
        for (BlockCompressionType type : types) {
            if (type.persistentId == persistentId) {
                return type;
            }
        }

        throw new IllegalArgumentException("Unknown persistentId " + persistentId);
    }

    /** 按名称解析压缩类型,忽略大小写。 */
    public static BlockCompressionType fromName(String name) {
        for (BlockCompressionType type : values()) {
            if (type.name().equalsIgnoreCase(name.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown compression " + name);
    }
}
