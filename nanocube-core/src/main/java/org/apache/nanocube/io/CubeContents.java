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

package org.apache.nanocube.io;

import org.apache.nanocube.index.IndexingMethod;
import org.apache.nanocube.schema.Dimension;
import org.apache.nanocube.schema.Measure;

import java.util.Collections;
import java.util.List;

/** 一个立方体中需要持久化的全部内容。 */
public final class CubeContents {

    private final int rowCount;
    private final IndexingMethod indexingMethod;
    private final List<Dimension> dimensions;
    private final List<Measure> measures;

    public CubeContents(
            int rowCount,
            IndexingMethod indexingMethod,
            List<Dimension> dimensions,
            List<Measure> measures) {
        this.rowCount = rowCount;
        this.indexingMethod = indexingMethod;
        this.dimensions = Collections.unmodifiableList(dimensions);
        this.measures = Collections.unmodifiableList(measures);
    }

    public int rowCount() {
        return rowCount;
    }

    public IndexingMethod indexingMethod() {
        return indexingMethod;
    }

    public List<Dimension> dimensions() {
        return dimensions;
    }

    public List<Measure> measures() {
        return measures;
    }
}
