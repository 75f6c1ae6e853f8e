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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 未捕获异常处理器,记录异常后终止进程。
 *
 * <p>工作线程中逃逸的异常意味着位图状态可能已不一致,继续运行比停止更危险。
 */
public final class FatalExitExceptionHandler implements Thread.UncaughtExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(FatalExitExceptionHandler.class);

    /** 单例实例 */
    public static final FatalExitExceptionHandler INSTANCE = new FatalExitExceptionHandler();

    /** 退出码 */
    public static final int EXIT_CODE = -17;

    @SuppressWarnings("finally")
    @Override
    public void uncaughtException(Thread t, Throwable e) {
        try {
            LOG.error(
                    "FATAL: Thread '{}' produced an uncaught exception. Stopping the process...",
                    t.getName(),
                    e);
        } finally {
            System.exit(EXIT_CODE);
        }
    }
}
