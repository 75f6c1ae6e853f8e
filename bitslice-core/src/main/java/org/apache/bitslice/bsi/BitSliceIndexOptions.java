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

import org.apache.bitslice.options.ConfigOption;
import org.apache.bitslice.options.ConfigOptions;

/** 位切片索引的配置项。 */
public class BitSliceIndexOptions {

    public static final ConfigOption<Integer> MAX_THREADS =
            ConfigOptions.key("bsi.parallel.max-threads")
                    .intType()
                    .defaultValue(Runtime.getRuntime().availableProcessors())
                    .withDescription(
                            "Upper bound of worker threads used by one parallel operation, "
                                    + "whatever parallelism the caller asks for.");

    public static final ConfigOption<Integer> MIN_SHARD_SIZE =
            ConfigOptions.key("bsi.parallel.min-shard-size")
                    .intType()
                    .defaultValue(1024)
                    .withDescription(
                            "Minimum number of candidate rows per shard. Row sets smaller "
                                    + "than two shards are processed on the calling thread.");

    private BitSliceIndexOptions() {}
}
