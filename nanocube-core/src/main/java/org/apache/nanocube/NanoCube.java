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

package org.apache.nanocube;

import org.apache.nanocube.annotation.Public;
import org.apache.nanocube.cache.CaffeineResultCache;
import org.apache.nanocube.cache.NoOpResultCache;
import org.apache.nanocube.cache.ResultCache;
import org.apache.nanocube.data.TableSource;
import org.apache.nanocube.index.IndexingMethod;
import org.apache.nanocube.index.MemberIndex;
import org.apache.nanocube.index.RowSetBackend;
import org.apache.nanocube.io.CubeContents;
import org.apache.nanocube.io.CubeFileFormat;
import org.apache.nanocube.options.ConfigOption;
import org.apache.nanocube.options.Options;
import org.apache.nanocube.query.Aggregation;
import org.apache.nanocube.query.Query;
import org.apache.nanocube.query.QueryExecutor;
import org.apache.nanocube.query.QueryResult;
import org.apache.nanocube.query.UnknownNameException;
import org.apache.nanocube.schema.ColumnClassifier;
import org.apache.nanocube.schema.Dimension;
import org.apache.nanocube.schema.Measure;
import org.apache.nanocube.types.DataField;
import org.apache.nanocube.utils.ExecutorThreadFactory;
import org.apache.nanocube.utils.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 内存中的多维点查询引擎。
 *
 * <p>构建时为每个维度建立成员到行集合的倒排索引,查询时对同一维度内的成员取并集,对不同维度的行集合按基数
 * 从小到大求交集,再在选中的行上聚合度量,整个过程不扫描原始表。
 *
 * <pre>{@code
 * NanoCube cube = NanoCube.builder(table).build();
 *
 * // sales where customer = 'A' and product in ('P1', 'P2')
 * Map<String, Object> filters = new HashMap<>();
 * filters.put("customer", "A");
 * filters.put("product", Arrays.asList("P1", "P2"));
 * long sales = cube.get("sales", filters).asLong();
 * }</pre>
 *
 * <p>构建完成后立方体不可变,不持有原始表的引用,可以被多个线程并发查询。查询结果按规范化的查询签名缓存,
 * 缓存不会改变任何结果。
 *
 * <p>{@link #save(Path)} 和 {@link #load(Path)} 使用 {@link CubeFileFormat} 保存和恢复立方体。
 */
@Public
@ThreadSafe
public class NanoCube {

    private static final Logger LOG = LoggerFactory.getLogger(NanoCube.class);

    private final int rowCount;
    private final IndexingMethod indexingMethod;
    private final LinkedHashMap<String, Dimension> dimensions;
    private final LinkedHashMap<String, Measure> measures;
    private final CubeOptions options;
    private final ResultCache cache;
    private final QueryExecutor executor;

    private NanoCube(CubeContents contents, CubeOptions options) {
        this.rowCount = contents.rowCount();
        this.indexingMethod = contents.indexingMethod();
        this.dimensions = new LinkedHashMap<>();
        for (Dimension dimension : contents.dimensions()) {
            dimensions.put(dimension.name(), dimension);
        }
        this.measures = new LinkedHashMap<>();
        for (Measure measure : contents.measures()) {
            measures.put(measure.name(), measure);
        }
        this.options = options;
        this.cache = createCache(options);
        this.executor =
                new QueryExecutor(
                        Collections.unmodifiableMap(dimensions),
                        Collections.unmodifiableMap(measures),
                        cache);
    }

    public static Builder builder(TableSource table) {
        return new Builder(table);
    }

    private static ResultCache createCache(CubeOptions options) {
        if (!options.cacheEnabled()) {
            return NoOpResultCache.INSTANCE;
        }
        return new CaffeineResultCache(options.cacheMaxEntries());
    }

    // ------------------------------------------------------------------------
    //  Query
    // ------------------------------------------------------------------------

    /**
     * 执行查询。
     *
     * @throws UnknownNameException 查询引用了不存在的维度或度量时抛出
     */
    public QueryResult get(Query query) {
        return executor.execute(query);
    }

    /** 对单个度量求和。过滤映射中的 {@link java.util.Collection} 或数组值表示"任意一个"。 */
    public QueryResult get(String measure, Map<String, ?> filters) {
        return get(measure, filters, Aggregation.SUM);
    }

    public QueryResult get(String measure, Map<String, ?> filters, Aggregation aggregation) {
        return get(Query.of(Collections.singletonList(measure), filters, aggregation));
    }

    public QueryResult get(List<String> measures, Map<String, ?> filters) {
        return get(measures, filters, Aggregation.SUM);
    }

    public QueryResult get(List<String> measures, Map<String, ?> filters, Aggregation aggregation) {
        return get(Query.of(measures, filters, aggregation));
    }

    /** 聚合所有度量,结果按度量在立方体中的顺序排列。 */
    public QueryResult get(Map<String, ?> filters) {
        return get(filters, Aggregation.SUM);
    }

    public QueryResult get(Map<String, ?> filters, Aggregation aggregation) {
        return get(Query.of(Collections.emptyList(), filters, aggregation));
    }

    // ------------------------------------------------------------------------
    //  Schema
    // ------------------------------------------------------------------------

    public int rowCount() {
        return rowCount;
    }

    public IndexingMethod indexingMethod() {
        return indexingMethod;
    }

    public CubeOptions options() {
        return options;
    }

    public List<String> dimensionNames() {
        return new ArrayList<>(dimensions.keySet());
    }

    public List<String> measureNames() {
        return new ArrayList<>(measures.keySet());
    }

    public List<Dimension> dimensions() {
        return new ArrayList<>(dimensions.values());
    }

    public List<Measure> measures() {
        return new ArrayList<>(measures.values());
    }

    /** @throws UnknownNameException 维度不存在时抛出 */
    public Dimension dimension(String name) {
        Dimension dimension = dimensions.get(name);
        if (dimension == null) {
            throw new UnknownNameException(
                    UnknownNameException.Kind.DIMENSION, name, dimensions.keySet());
        }
        return dimension;
    }

    /** @throws UnknownNameException 度量不存在时抛出 */
    public Measure measure(String name) {
        Measure measure = measures.get(name);
        if (measure == null) {
            throw new UnknownNameException(
                    UnknownNameException.Kind.MEASURE, name, measures.keySet());
        }
        return measure;
    }

    // ------------------------------------------------------------------------
    //  Cache
    // ------------------------------------------------------------------------

    /** 当前缓存的查询结果个数,缓存关闭时为 0。 */
    public long cacheSize() {
        return cache.size();
    }

    public void invalidateCache() {
        cache.invalidateAll();
    }

    // ------------------------------------------------------------------------
    //  Persistence
    // ------------------------------------------------------------------------

    /** 按配置的压缩方式把立方体写入文件,已存在的文件会被覆盖。 */
    public void save(Path path) throws IOException {
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(path))) {
            int blobs = save(out);
            LOG.info(
                    "Saved cube with {} rows and {} blobs to {} using {} compression.",
                    rowCount,
                    blobs,
                    path,
                    options.fileCompression());
        }
    }

    /**
     * 把立方体写入输出流,不关闭输出流。
     *
     * @return 写入的数据块个数
     */
    public int save(OutputStream out) throws IOException {
        return CubeFileFormat.write(
                new CubeContents(rowCount, indexingMethod, dimensions(), measures()),
                options.compressOptions(),
                out);
    }

    /** 使用默认配置加载立方体。 */
    public static NanoCube load(Path path) throws IOException {
        return load(path, CubeOptions.defaults());
    }

    /**
     * 加载立方体。文件中保存的索引方式和压缩方式优先于 {@code options},缓存配置取自 {@code options}。
     *
     * @throws org.apache.nanocube.io.CubeFormatException 文件损坏或不兼容时抛出
     */
    public static NanoCube load(Path path, CubeOptions options) throws IOException {
        long start = System.currentTimeMillis();
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            NanoCube cube = load(in, options);
            LOG.info(
                    "Loaded cube with {} rows, {} dimensions and {} measures from {} in {} ms.",
                    cube.rowCount,
                    cube.dimensions.size(),
                    cube.measures.size(),
                    path,
                    System.currentTimeMillis() - start);
            return cube;
        }
    }

    public static NanoCube load(InputStream in, CubeOptions options) throws IOException {
        return new NanoCube(CubeFileFormat.read(in), options);
    }

    @Override
    public String toString() {
        return "NanoCube{rows="
                + rowCount
                + ", indexingMethod="
                + indexingMethod
                + ", dimensions="
                + dimensions.values()
                + ", measures="
                + measures.values()
                + '}';
    }

    // ------------------------------------------------------------------------
    //  Build
    // ------------------------------------------------------------------------

    /** {@link NanoCube} 的构建器。 */
    public static final class Builder {

        private final TableSource table;
        @Nullable private List<String> dimensions;
        @Nullable private List<String> measures;
        private final Options options = new Options();

        private Builder(TableSource table) {
            this.table = Preconditions.checkNotNull(table, "table");
        }

        /** 显式指定维度,按给定顺序使用。不调用时按列类型推断。 */
        public Builder dimensions(String... names) {
            return dimensions(Arrays.asList(names));
        }

        public Builder dimensions(List<String> names) {
            this.dimensions = new ArrayList<>(names);
            return this;
        }

        /** 显式指定度量,按给定顺序使用。不调用时使用所有非布尔的数值列。 */
        public Builder measures(String... names) {
            return measures(Arrays.asList(names));
        }

        public Builder measures(List<String> names) {
            this.measures = new ArrayList<>(names);
            return this;
        }

        public Builder indexingMethod(IndexingMethod method) {
            return option(CubeOptions.INDEXING_METHOD, method);
        }

        public <T> Builder option(ConfigOption<T> option, T value) {
            options.set(option, value);
            return this;
        }

        public Builder options(Map<String, String> conf) {
            conf.forEach(options::setString);
            return this;
        }

        public Builder options(CubeOptions cubeOptions) {
            return options(cubeOptions.toConfiguration().toMap());
        }

        /**
         * 构建立方体。
         *
         * @throws CubeBuildException 维度或度量声明非法,或列中的值与类型不符时抛出
         */
        public NanoCube build() {
            long start = System.currentTimeMillis();
            CubeOptions cubeOptions = new CubeOptions(options);
            IndexingMethod method = cubeOptions.indexingMethod();
            int parallelism = cubeOptions.buildParallelism();

            ColumnClassifier.ColumnRoles roles =
                    ColumnClassifier.classify(table, dimensions, measures);
            int rowCount = table.rowCount();

            List<Measure> measureList = new ArrayList<>(roles.measures().size());
            for (DataField field : roles.measures()) {
                measureList.add(
                        Measure.fromColumn(
                                field.name(), field.type(), table.column(field.name()), rowCount));
            }

            List<Dimension> dimensionList =
                    parallelism > 1 && roles.dimensions().size() > 1
                            ? buildDimensionsInParallel(roles.dimensions(), method, parallelism)
                            : buildDimensions(roles.dimensions(), method);

            NanoCube cube =
                    new NanoCube(
                            new CubeContents(rowCount, method, dimensionList, measureList),
                            cubeOptions);
            LOG.info(
                    "Built cube with {} rows, {} dimensions and {} measures using {} in {} ms.",
                    rowCount,
                    dimensionList.size(),
                    measureList.size(),
                    method,
                    System.currentTimeMillis() - start);
            return cube;
        }

        private List<Dimension> buildDimensions(List<DataField> fields, IndexingMethod method) {
            List<Dimension> result = new ArrayList<>(fields.size());
            for (int i = 0; i < fields.size(); i++) {
                result.add(buildDimension(fields.get(i), i, method.backend()));
            }
            return result;
        }

        private List<Dimension> buildDimensionsInParallel(
                List<DataField> fields, IndexingMethod method, int parallelism) {
            ExecutorService pool =
                    Executors.newFixedThreadPool(
                            Math.min(parallelism, fields.size()),
                            new ExecutorThreadFactory("nanocube-index-build"));
            try {
                List<Future<Dimension>> futures = new ArrayList<>(fields.size());
                for (int i = 0; i < fields.size(); i++) {
                    DataField field = fields.get(i);
                    int ordinal = i;
                    futures.add(
                            pool.submit(() -> buildDimension(field, ordinal, method.backend())));
                }
                List<Dimension> result = new ArrayList<>(fields.size());
                for (Future<Dimension> future : futures) {
                    result.add(future.get());
                }
                return result;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new CubeBuildException("Failed to build dimension index.", cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CubeBuildException("Interrupted while building dimension indexes.", e);
            } finally {
                pool.shutdownNow();
            }
        }

        private Dimension buildDimension(DataField field, int ordinal, RowSetBackend backend) {
            long start = System.nanoTime();
            MemberIndex index =
                    MemberIndex.build(
                            field.name(),
                            field.type(),
                            table.column(field.name()),
                            table.rowCount(),
                            backend);
            if (LOG.isDebugEnabled()) {
                LOG.debug(
                        "Indexed dimension '{}' with {} members{} in {} us.",
                        field.name(),
                        index.memberCount(),
                        index.hasNullMember() ? " and a null member" : "",
                        (System.nanoTime() - start) / 1000);
            }
            return new Dimension(field.name(), ordinal, field.type(), index);
        }
    }
}
