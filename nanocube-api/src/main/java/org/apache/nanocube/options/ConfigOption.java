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

import java.util.Objects;

import static org.apache.nanocube.utils.Preconditions.checkNotNull;

/**
 * 描述一个配置项:键、值类型、默认值以及说明文字。
 *
 * <p>配置项通过 {@link ConfigOptions#key(String)} 的构建器创建,创建后不可变。值的读取由
 * {@link Options#get(ConfigOption)} 完成,它会按 {@link #getClazz()} 把原始字符串转换成目标类型。
 *
 * <pre>{@code
 * public static final ConfigOption<Boolean> CACHE_ENABLED =
 *         ConfigOptions.key("cache.enabled")
 *                 .booleanType()
 *                 .defaultValue(true)
 *                 .withDescription("Whether query results are cached.");
 * }</pre>
 *
 * @param <T> 配置值的类型
 */
@Public
public class ConfigOption<T> {

    /** 配置键 */
    private final String key;

    /** 默认值,可能为 null */
    private final T defaultValue;

    /** 说明文字 */
    private final String description;

    /** 值的类型,用于字符串到目标类型的转换 */
    private final Class<?> clazz;

    ConfigOption(String key, Class<?> clazz, String description, T defaultValue) {
        this.key = checkNotNull(key);
        this.clazz = checkNotNull(clazz);
        this.description = description;
        this.defaultValue = defaultValue;
    }

    Class<?> getClazz() {
        return clazz;
    }

    /**
     * 返回带有新说明文字的配置项副本。
     *
     * @param description 说明文字
     * @return 新的配置项
     */
    public ConfigOption<T> withDescription(final String description) {
        return new ConfigOption<>(key, clazz, description, defaultValue);
    }

    public String key() {
        return key;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    public T defaultValue() {
        return defaultValue;
    }

    public String description() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o != null && o.getClass() == ConfigOption.class) {
            ConfigOption<?> that = (ConfigOption<?>) o;
            return this.key.equals(that.key) && Objects.equals(defaultValue, that.defaultValue);
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return 31 * key.hashCode() + (defaultValue != null ? defaultValue.hashCode() : 0);
    }

    @Override
    public String toString() {
        return String.format("Key: '%s' , default: %s", key, defaultValue);
    }
}
