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

package org.apache.nanocube.options;

import org.apache.nanocube.annotation.Public;

import javax.annotation.concurrent.ThreadSafe;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 基于字符串键值对的配置容器。
 *
 * <p>所有值都以字符串形式保存,读取时按 {@link ConfigOption} 声明的类型转换。键不存在时返回配置项的默认值。
 * 所有公开方法都是同步的,可以在多个线程之间共享同一个实例。
 *
 * <pre>{@code
 * Options options = new Options();
 * options.set(CubeOptions.INDEXING_METHOD, IndexingMethod.SORTED_ARRAY);
 * options.setString("cache.enabled", "false");
 *
 * boolean caching = options.get(CubeOptions.CACHE_ENABLED); // false
 * }</pre>
 */
@Public
@ThreadSafe
public class Options {

    /** 存储具体键值对的映射 */
    private final HashMap<String, String> data;

    public Options() {
        this.data = new HashMap<>();
    }

    public Options(Map<String, String> map) {
        this();
        map.forEach(this::setString);
    }

    public static Options fromMap(Map<String, String> map) {
        return new Options(map);
    }

    public synchronized void setString(String key, String value) {
        data.put(key, value);
    }

    /**
     * 设置类型化的配置值。
     *
     * @param option 配置项
     * @param value 配置值,不能为 null
     * @return 当前对象,便于链式调用
     */
    public synchronized <T> Options set(ConfigOption<T> option, T value) {
        if (value == null) {
            throw new NullPointerException("Value must not be null.");
        }
        data.put(option.key(), OptionsUtils.convertToString(value));
        return this;
    }

    /**
     * 读取配置值,不存在时返回默认值。
     *
     * @throws IllegalArgumentException 如果原始值无法转换为目标类型
     */
    public synchronized <T> T get(ConfigOption<T> option) {
        return getOptional(option).orElseGet(option::defaultValue);
    }

    public synchronized String get(String key) {
        return data.get(key);
    }

    public synchronized <T> Optional<T> getOptional(ConfigOption<T> option) {
        Optional<Object> rawValue = Optional.ofNullable(data.get(option.key()));
        Class<?> clazz = option.getClazz();

        try {
            return rawValue.map(v -> OptionsUtils.convertValue(v, clazz));
        } catch (Exception e) {
            throw new IllegalArgumentException(
                    String.format(
                            "Could not parse value '%s' for key '%s'.",
                            rawValue.map(Object::toString).orElse(""), option.key()),
                    e);
        }
    }

    public synchronized boolean contains(ConfigOption<?> configOption) {
        return data.containsKey(configOption.key());
    }

    public synchronized Set<String> keySet() {
        return data.keySet();
    }

    public synchronized Map<String, String> toMap() {
        return new HashMap<>(data);
    }

    public synchronized void remove(ConfigOption<?> option) {
        data.remove(option.key());
    }

    @Override
    public synchronized boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Options options = (Options) o;
        return Objects.equals(data, options.data);
    }

    @Override
    public synchronized int hashCode() {
        return Objects.hash(data);
    }

    @Override
    public synchronized String toString() {
        return "Options" + data;
    }
}
