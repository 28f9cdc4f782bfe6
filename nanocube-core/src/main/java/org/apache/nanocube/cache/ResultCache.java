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

package org.apache.nanocube.cache;

import org.apache.nanocube.query.QueryResult;
import org.apache.nanocube.query.QuerySignature;

import java.util.function.Supplier;

/**
 * 以 {@link QuerySignature} 为键的查询结果缓存。
 *
 * <p>实现必须是线程安全的。缓存是否命中不能改变查询结果。
 */
public interface ResultCache {

    /** 返回缓存的结果,未命中时调用 {@code loader} 计算并缓存。 */
    QueryResult getOrCompute(QuerySignature signature, Supplier<QueryResult> loader);

    /** 当前缓存的条目数。 */
    long size();

    void invalidateAll();
}
