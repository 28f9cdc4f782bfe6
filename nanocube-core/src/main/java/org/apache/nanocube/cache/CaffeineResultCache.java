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

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;

import java.util.function.Supplier;

/**
 * 基于 Caffeine 的结果缓存。
 *
 * <p>{@code maxEntries <= 0} 时不限制条目数,结果在立方体的整个生命周期内保留;否则按 Caffeine 的
 * 淘汰策略保留最多 {@code maxEntries} 个结果。维护任务在调用线程上执行。
 */
@ThreadSafe
public class CaffeineResultCache implements ResultCache {

    private static final Logger LOG = LoggerFactory.getLogger(CaffeineResultCache.class);

    private final Cache<QuerySignature, QueryResult> cache;

    public CaffeineResultCache(long maxEntries) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder().executor(Runnable::run);
        if (maxEntries > 0) {
            builder.maximumSize(maxEntries);
        }
        this.cache = builder.build();
    }

    @Override
    public QueryResult getOrCompute(QuerySignature signature, Supplier<QueryResult> loader) {
        return cache.get(
                signature,
                key -> {
                    if (LOG.isDebugEnabled()) {
                        LOG.debug("Result cache miss for {}", key);
                    }
                    return loader.get();
                });
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        cache.cleanUp();
    }
}
