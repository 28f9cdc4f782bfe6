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

import java.io.IOException;

/**
 * 立方体文件损坏或不兼容。
 *
 * <p>消息中会指明出错的头部字段或数据块编号。抛出该异常时不会返回部分加载的立方体。
 */
public class CubeFormatException extends IOException {

    private static final long serialVersionUID = 1L;

    public CubeFormatException(String message) {
        super(message);
    }

    public CubeFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
