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

/** 不缓存任何结果,每次查询都重新计算。 */
public final class NoOpResultCache implements ResultCache {

    public static final NoOpResultCache INSTANCE = new NoOpResultCache();

    private NoOpResultCache() {}

    @Override
    public QueryResult getOrCompute(QuerySignature signature, Supplier<QueryResult> loader) {
        return loader.get();
    }

    @Override
    public long size() {
        return 0;
    }

    @Override
    public void invalidateAll() {}
}
