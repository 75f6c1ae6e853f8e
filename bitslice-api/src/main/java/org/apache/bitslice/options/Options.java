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

import java.util.HashMap;

/**
 * 基于字符串键值对的配置容器。
 *
 * <p>值以字符串形式存储,读取时根据 {@link ConfigOption} 声明的类型转换。
 * 所有方法都是同步的,可以在线程间共享同一个实例。
 *
 * <pre>{@code
 * Options options = new Options();
 * options.set(BitSliceIndexOptions.MAX_THREADS, 4);
 * int threads = options.get(BitSliceIndexOptions.MAX_THREADS);
 * }</pre>
 */
@Public
public class Options {

    /** 存储配置数据 */
    private final HashMap<String, String> data = new HashMap<>();

    /**
     * 使用 ConfigOption 设置配置值。
     *
     * @param option 配置选项
     * @param value 配置值
     * @return 当前 Options 对象,用于链式调用
     */
    public synchronized <T> Options set(ConfigOption<T> option, T value) {
        if (value == null) {
            throw new NullPointerException("Value must not be null.");
        }
        data.put(option.key(), value.toString());
        return this;
    }

    /**
     * 获取配置选项的值,如果未设置则返回默认值。
     *
     * @param option 配置选项
     * @return 配置值或默认值
     * @throws IllegalArgumentException 如果无法解析值
     */
    public synchronized <T> T get(ConfigOption<T> option) {
        String rawValue = data.get(option.key());
        if (rawValue == null) {
            return option.defaultValue();
        }
        try {
            return convertValue(rawValue, option.getClazz());
        } catch (Exception e) {
            throw new IllegalArgumentException(
                    String.format(
                            "Could not parse value '%s' for key '%s'.", rawValue, option.key()),
                    e);
        }
    }

    // -------------------------------------------------------------------------
    //                     Internal methods
    // -------------------------------------------------------------------------

    @SuppressWarnings("unchecked")
    private static <T> T convertValue(String rawValue, Class<?> clazz) {
        if (Integer.class.equals(clazz)) {
            return (T) Integer.valueOf(rawValue.trim());
        }
        throw new IllegalArgumentException("Unsupported type: " + clazz);
    }
}
