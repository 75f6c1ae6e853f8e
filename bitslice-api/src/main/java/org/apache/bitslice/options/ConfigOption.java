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

package org.apache.bitslice.options;

import org.apache.bitslice.annotation.Public;

import static org.apache.bitslice.utils.Preconditions.checkNotNull;

/**
 * 配置选项类,描述一个配置参数。
 *
 * <p>封装了配置键、默认值、描述信息以及值的类型。通过 {@link ConfigOptions} 构建,创建后不可变。
 *
 * <pre>{@code
 * ConfigOption<Integer> maxThreads = ConfigOptions
 *     .key("bsi.parallel.max-threads")
 *     .intType()
 *     .defaultValue(8)
 *     .withDescription("线程池的最大线程数");
 * }</pre>
 *
 * @param <T> 配置选项关联的值的类型
 */
@Public
public class ConfigOption<T> {

    /** 该配置选项的键 */
    private final String key;

    /** 该配置选项的默认值 */
    private final T defaultValue;

    /** 该配置选项的描述信息 */
    private final String description;

    /** 值的类型 */
    private final Class<?> clazz;

    ConfigOption(String key, Class<?> clazz, String description, T defaultValue) {
        this.key = checkNotNull(key);
        this.description = description;
        this.defaultValue = defaultValue;
        this.clazz = checkNotNull(clazz);
    }

    Class<?> getClazz() {
        return clazz;
    }

    /**
     * 创建一个带有给定描述的新配置选项。
     *
     * @param description 该选项的描述
     * @return 新的配置选项
     */
    public ConfigOption<T> withDescription(final String description) {
        return new ConfigOption<>(key, clazz, description, defaultValue);
    }

    public String key() {
        return key;
    }

    public T defaultValue() {
        return defaultValue;
    }

    public String description() {
        return description;
    }

    @Override
    public String toString() {
        return String.format("Key: '%s' , default: %s", key, defaultValue);
    }
}
