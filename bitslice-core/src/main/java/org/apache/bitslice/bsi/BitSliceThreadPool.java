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

package org.apache.bitslice.bsi;

import java.util.concurrent.ThreadPoolExecutor;

import static org.apache.bitslice.utils.ThreadPoolUtils.createCachedThreadPool;

/**
 * 位切片索引并行操作共享的线程池。
 *
 * <p>默认线程数为 CPU 核心数。请求的线程数超过当前上限时,用更大的线程池替换旧的。
 */
public class BitSliceThreadPool {

    private static final String THREAD_NAME = "BIT-SLICE-INDEX-THREAD-POOL";

    private static ThreadPoolExecutor executorService =
            createCachedThreadPool(Runtime.getRuntime().availableProcessors(), THREAD_NAME);

    /**
     * 获取至少拥有 {@code threadNum} 个线程上限的执行器。
     *
     * @param threadNum 请求的线程数
     * @return 线程池执行器
     */
    public static synchronized ThreadPoolExecutor getExecutorService(int threadNum) {
        if (threadNum <= executorService.getMaximumPoolSize()) {
            return executorService;
        }
        // the previous pool is cached and lets its idle threads time out
        executorService = createCachedThreadPool(threadNum, THREAD_NAME);

        return executorService;
    }
}
