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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Test for {@link Options}. */
public class OptionsTest {

    private static final ConfigOption<Integer> THREADS =
            ConfigOptions.key("test.threads")
                    .intType()
                    .defaultValue(4)
                    .withDescription("worker threads");

    @Test
    public void testDefaultValue() {
        Options options = new Options();
        assertThat(options.get(THREADS)).isEqualTo(4);
        assertThat(THREADS.key()).isEqualTo("test.threads");
        assertThat(THREADS.description()).isEqualTo("worker threads");
    }

    @Test
    public void testSetAndGet() {
        Options options = new Options();
        assertThat(options.set(THREADS, 16)).isSameAs(options);
        assertThat(options.get(THREADS)).isEqualTo(16);

        options.set(THREADS, -1);
        assertThat(options.get(THREADS)).isEqualTo(-1);
    }

    @Test
    public void testNullValue() {
        Options options = new Options();
        assertThatThrownBy(() -> options.set(THREADS, null))
                .isInstanceOf(NullPointerException.class);
    }
}
