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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Test for {@link ThreadPoolUtils}. */
public class ThreadPoolUtilsTest {

    private ThreadPoolExecutor executor;

    @BeforeEach
    public void before() {
        executor = ThreadPoolUtils.createCachedThreadPool(3, "test-pool");
    }

    @AfterEach
    public void after() {
        executor.shutdownNow();
    }

    @Test
    public void testResultsInSubmitOrder() {
        List<Callable<Integer>> tasks = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            int n = i;
            tasks.add(
                    () -> {
                        Thread.sleep(20 - n);
                        return n * n;
                    });
        }
        List<Integer> results = ThreadPoolUtils.invokeAll(executor, tasks);
        assertThat(results).hasSize(20);
        for (int i = 0; i < 20; i++) {
            assertThat(results.get(i)).isEqualTo(i * i);
        }
    }

    @Test
    public void testThreadNaming() {
        List<Callable<Thread>> tasks = new ArrayList<>();
        tasks.add(Thread::currentThread);
        Thread thread = ThreadPoolUtils.invokeAll(executor, tasks).get(0);
        assertThat(thread.getName()).startsWith("test-pool-thread-");
        assertThat(thread.isDaemon()).isTrue();
        assertThat(executor.getMaximumPoolSize()).isEqualTo(3);
    }

    @Test
    public void testUncheckedFailureIsRethrown() {
        List<Callable<Integer>> tasks = new ArrayList<>();
        tasks.add(() -> 1);
        tasks.add(
                () -> {
                    throw new IllegalStateException("boom");
                });
        assertThatThrownBy(() -> ThreadPoolUtils.invokeAll(executor, tasks))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");
    }

    @Test
    public void testCheckedFailureIsWrapped() {
        List<Callable<Integer>> tasks = new ArrayList<>();
        tasks.add(
                () -> {
                    throw new IOException("disk");
                });
        assertThatThrownBy(() -> ThreadPoolUtils.invokeAll(executor, tasks))
                .isInstanceOf(RuntimeException.class)
                .hasCauseInstanceOf(IOException.class);
    }
}
