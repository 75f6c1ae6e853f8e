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

package org.apache.bitslice.utils;

import javax.annotation.Nullable;

/**
 * 前置条件检查工具类。
 *
 * <p>用于校验方法参数。所有方法在条件不满足时抛出对应的运行时异常:
 *
 * <ul>
 *   <li>{@link #checkNotNull} 抛出 {@link NullPointerException}
 *   <li>{@link #checkArgument} 抛出 {@link IllegalArgumentException}
 * </ul>
 *
 * <p>错误信息模板只支持 {@code %s} 占位符,多余的参数会被追加在消息末尾。
 */
public final class Preconditions {

    // ------------------------------------------------------------------------
    //  Null checks
    // ------------------------------------------------------------------------

    /**
     * 确保给定的对象引用不为 null。
     *
     * @param reference 要检查的对象引用
     * @return 非 null 的对象引用
     * @throws NullPointerException 如果 {@code reference} 为 null
     */
    public static <T> T checkNotNull(@Nullable T reference) {
        if (reference == null) {
            throw new NullPointerException();
        }
        return reference;
    }

    /**
     * 确保给定的对象引用不为 null,否则使用给定消息抛出异常。
     *
     * @param reference 要检查的对象引用
     * @param errorMessage 异常消息
     * @return 非 null 的对象引用
     */
    public static <T> T checkNotNull(@Nullable T reference, @Nullable String errorMessage) {
        if (reference == null) {
            throw new NullPointerException(String.valueOf(errorMessage));
        }
        return reference;
    }

    /**
     * 确保给定的对象引用不为 null,否则使用格式化消息抛出异常。
     *
     * @param reference 要检查的对象引用
     * @param errorMessageTemplate 消息模板
     * @param errorMessageArgs 模板参数
     * @return 非 null 的对象引用
     */
    public static <T> T checkNotNull(
            @Nullable T reference,
            @Nullable String errorMessageTemplate,
            @Nullable Object... errorMessageArgs) {
        if (reference == null) {
            throw new NullPointerException(format(errorMessageTemplate, errorMessageArgs));
        }
        return reference;
    }

    // ------------------------------------------------------------------------
    //  Boolean Condition Checking (Argument)
    // ------------------------------------------------------------------------

    /**
     * 检查参数条件。
     *
     * @param condition 条件
     * @throws IllegalArgumentException 如果条件为 false
     */
    public static void checkArgument(boolean condition) {
        if (!condition) {
            throw new IllegalArgumentException();
        }
    }

    /**
     * 检查参数条件,失败时使用给定消息。
     *
     * @param condition 条件
     * @param errorMessage 异常消息
     */
    public static void checkArgument(boolean condition, @Nullable Object errorMessage) {
        if (!condition) {
            throw new IllegalArgumentException(String.valueOf(errorMessage));
        }
    }

    /**
     * 检查参数条件,失败时使用格式化消息。
     *
     * @param condition 条件
     * @param errorMessageTemplate 消息模板
     * @param errorMessageArgs 模板参数
     */
    public static void checkArgument(
            boolean condition,
            @Nullable String errorMessageTemplate,
            @Nullable Object... errorMessageArgs) {
        if (!condition) {
            throw new IllegalArgumentException(format(errorMessageTemplate, errorMessageArgs));
        }
    }

    // ------------------------------------------------------------------------
    //  Utilities
    // ------------------------------------------------------------------------

    private static String format(@Nullable String template, @Nullable Object... args) {
        final int numArgs = args == null ? 0 : args.length;
        template = String.valueOf(template); // null -> "null"

        // start substituting the arguments into the '%s' placeholders
        StringBuilder builder = new StringBuilder(template.length() + 16 * numArgs);
        int templateStart = 0;
        int i = 0;
        while (i < numArgs) {
            int placeholderStart = template.indexOf("%s", templateStart);
            if (placeholderStart == -1) {
                break;
            }
            builder.append(template, templateStart, placeholderStart);
            builder.append(args[i++]);
            templateStart = placeholderStart + 2;
        }
        builder.append(template.substring(templateStart));

        // if we run out of placeholders, append the extra args in square braces
        if (i < numArgs) {
            builder.append(" [");
            builder.append(args[i++]);
            while (i < numArgs) {
                builder.append(", ");
                builder.append(args[i++]);
            }
            builder.append(']');
        }

        return builder.toString();
    }

    /** 不允许实例化。 */
    private Preconditions() {}
}
