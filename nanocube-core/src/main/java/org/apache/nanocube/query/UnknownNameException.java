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

package org.apache.nanocube.query;

import java.util.Collection;
import java.util.Locale;

/**
 * 查询中引用了不存在的维度或度量。
 *
 * <p>维度存在但成员不存在不是错误,该成员匹配空的行集合。
 */
public class UnknownNameException extends QueryException {

    private static final long serialVersionUID = 1L;

    /** 未知名称的种类。 */
    public enum Kind {
        DIMENSION,
        MEASURE
    }

    private final Kind kind;

    private final String name;

    public UnknownNameException(Kind kind, String name, Collection<String> available) {
        super(
                String.format(
                        "Unknown %s '%s', available: %s.",
                        kind.name().toLowerCase(Locale.ROOT), name, available));
        this.kind = kind;
        this.name = name;
    }

    public Kind kind() {
        return kind;
    }

    public String name() {
        return name;
    }
}
