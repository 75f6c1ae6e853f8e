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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 线程池工具类。
 *
 * <ul>
 *   <li>{@link #createCachedThreadPool} 创建空闲线程会自动回收的固定上限线程池
 *   <li>{@link #invokeAll} 提交一批任务并按提交顺序收集结果
 * </ul>
 */
public class ThreadPoolUtils {

    private static final Logger LOG = LoggerFactory.getLogger(ThreadPoolUtils.class);

    /**
     * 创建一个最多 {@code threadNum} 个线程的线程池,空闲一分钟的线程会被回收。
     *
     * @param threadNum 最大线程数
     * @param namePrefix 线程名称前缀
     * @return 线程池
     */
    public static ThreadPoolExecutor createCachedThreadPool(int threadNum, String namePrefix) {
        ThreadPoolExecutor executor =
                new ThreadPoolExecutor(
                        threadNum,
                        threadNum,
                        1,
                        TimeUnit.MINUTES,
                        new LinkedBlockingQueue<>(),
                        new ExecutorThreadFactory(namePrefix));
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    /**
     * 提交所有任务并等待完成,按提交顺序返回结果。
     *
     * <p>任意一个任务失败时,取消尚未完成的任务并以 {@link RuntimeException} 重新抛出失败原因。
     * 等待过程中被中断会恢复中断标志后抛出。
     *
     * @param executor 执行任务的线程池
     * @param tasks 任务列表
     * @return 各任务的结果
     */
    public static <T> List<T> invokeAll(ExecutorService executor, List<Callable<T>> tasks) {
        List<Future<T>> futures = new ArrayList<>(tasks.size());
        for (Callable<T> task : tasks) {
            futures.add(executor.submit(task));
        }

        List<T> results = new ArrayList<>(tasks.size());
        try {
            for (Future<T> future : futures) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for parallel tasks.", e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            LOG.warn("Parallel task failed, remaining tasks are cancelled.", cause);
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new RuntimeException(cause);
        }
        return results;
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }
}
