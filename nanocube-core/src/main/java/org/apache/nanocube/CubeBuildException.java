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

/**
 * 构建立方体失败时抛出,例如维度或度量声明非法,或列中的值与声明的类型不符。
 *
 * <p>消息中会包含出错的列名。构建失败时不会产生部分构建的立方体。
 */
public class CubeBuildException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CubeBuildException(String message) {
        super(message);
    }

    public CubeBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
