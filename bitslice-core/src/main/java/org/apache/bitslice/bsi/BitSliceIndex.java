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

import org.apache.bitslice.annotation.Public;
import org.apache.bitslice.options.Options;
import org.apache.bitslice.utils.Pair;
import org.apache.bitslice.utils.RoaringBitmap64;
import org.apache.bitslice.utils.ThreadPoolUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

import static org.apache.bitslice.bsi.BitSliceComparator.requiredBits;
import static org.apache.bitslice.utils.Preconditions.checkArgument;
import static org.apache.bitslice.utils.Preconditions.checkNotNull;

/**
 * 位切片索引(Bit-Sliced Index, BSI)。
 *
 * <p>保存从 64 位行号到 64 位有符号整数的稀疏映射。每个值按二进制位拆开,第 i 位为 1 的所有行
 * 组成第 i 个切片;另有一个存在位图(Existence Bitmap, ebm)记录哪些行有值。
 *
 * <pre>
 * 行号 -> 值:  0 -> 5 (101), 1 -> 3 (011), 2 -> 7 (111)
 *
 * ebm       = {0, 1, 2}
 * slices[0] = {0, 1, 2}
 * slices[1] = {1, 2}
 * slices[2] = {0, 2}
 * </pre>
 *
 * <h3>编码</h3>
 * <ul>
 *   <li>切片数随写入的值自动增长,只追加空切片,不会自动收缩
 *   <li>非负值 v 需要 {@code 64 - numberOfLeadingZeros(v)} 个切片
 *   <li>负值按补码存储并使索引扩展到 64 个切片,第 63 个切片即符号位
 *   <li>因此切片数小于 64 的索引只包含非负值,读回时无需额外的符号标记
 * </ul>
 *
 * <h3>查询与运算</h3>
 * <ul>
 *   <li>比较 {@link #compareValue}、求和 {@link #sum}、加法 {@link #add} 只做整列位图运算,
 *       不逐行还原整数
 *   <li>{@link #transpose} 与 {@link #transposeWithCounts} 把值域映射为行号域
 *   <li>{@link #parOr} 按位合并两个索引,与 {@link #add} 的算术语义不同
 * </ul>
 *
 * <h3>并发</h3>
 * <p>接受 {@code parallelism} 参数的操作在其大于 1 时把候选行(或切片)切成互不相交的分片,
 * 由共享线程池 {@link BitSliceThreadPool} 并行处理,再用位图并集合并结果。0 或 1 表示在调用线程上执行。
 * 实例本身不加锁:没有写者时并发读取是安全的,修改操作需要调用方串行化。
 *
 * <h3>序列化</h3>
 * <p>{@link #marshalBinary()} 输出一组独立的字节缓冲:第 0 个是 ebm,第 1..bitCount 个是从低位到高位的切片。
 *
 * <pre>{@code
 * BitSliceIndex bsi = BitSliceIndex.newDefault();
 * for (int i = 0; i < 100; i++) {
 *     bsi.setValue(i, i);
 * }
 * RoaringBitmap64 rows = bsi.compareValue(0, Operation.RANGE, 45, 55, null);
 * Pair<Long, Long> sum = bsi.sum(rows); // (550, 11)
 * }</pre>
 */
@Public
public class BitSliceIndex {

    private static final Logger LOG = LoggerFactory.getLogger(BitSliceIndex.class);

    /** {@link #writeTo} 的格式版本。 */
    public static final byte VERSION_1 = 1;

    /** 声明的最大值,仅用于确定初始切片数。 */
    private final long maxValue;

    /** 声明的最小值,仅用于确定初始切片数。 */
    private final long minValue;

    /** 单次并行操作最多使用的线程数。 */
    private final int maxThreads;

    /** 每个分片至少包含的候选行数。 */
    private final int minShardSize;

    /** 存在位图。 */
    private RoaringBitmap64 ebm;

    /** 位切片,下标 0 为最低位。 */
    private List<RoaringBitmap64> slices;

    /**
     * 创建按给定边界预分配切片的索引。
     *
     * <p>边界只是建议:初始切片数由两者中需要更多位的那个决定,之后仍随数据自动增长。
     *
     * @param maxValue 预期最大值
     * @param minValue 预期最小值
     */
    public BitSliceIndex(long maxValue, long minValue) {
        this(maxValue, minValue, new Options());
    }

    /**
     * 创建按给定边界预分配切片、使用给定配置的索引。
     *
     * @param maxValue 预期最大值
     * @param minValue 预期最小值
     * @param options 配置,见 {@link BitSliceIndexOptions}
     */
    public BitSliceIndex(long maxValue, long minValue, Options options) {
        this.maxValue = maxValue;
        this.minValue = minValue;
        this.maxThreads = options.get(BitSliceIndexOptions.MAX_THREADS);
        this.minShardSize = options.get(BitSliceIndexOptions.MIN_SHARD_SIZE);
        checkArgument(maxThreads > 0, "max threads must be positive, but is %s", maxThreads);
        checkArgument(
                minShardSize > 0, "min shard size must be positive, but is %s", minShardSize);

        this.ebm = new RoaringBitmap64();
        int bitCount = Math.max(requiredBits(maxValue), requiredBits(minValue));
        this.slices = new ArrayList<>(bitCount);
        for (int i = 0; i < bitCount; i++) {
            slices.add(new RoaringBitmap64());
        }
    }

    private BitSliceIndex(
            BitSliceIndex template, RoaringBitmap64 ebm, List<RoaringBitmap64> slices) {
        this(template.maxValue, template.minValue, template, ebm, slices);
    }

    /** 沿用 {@code template} 的线程配置。 */
    private BitSliceIndex(
            long maxValue,
            long minValue,
            BitSliceIndex template,
            RoaringBitmap64 ebm,
            List<RoaringBitmap64> slices) {
        this.maxValue = maxValue;
        this.minValue = minValue;
        this.maxThreads = template.maxThreads;
        this.minShardSize = template.minShardSize;
        this.ebm = ebm;
        this.slices = slices;
    }

    /** 创建完全按数据自动确定切片数的索引。 */
    public static BitSliceIndex newDefault() {
        return new BitSliceIndex(0, 0);
    }

    /** 创建完全按数据自动确定切片数、使用给定配置的索引。 */
    public static BitSliceIndex newDefault(Options options) {
        return new BitSliceIndex(0, 0, options);
    }

    // ------------------------------------------------------------------------
    //  Value access
    // ------------------------------------------------------------------------

    /**
     * 设置一行的值,覆盖该行原有的值。
     *
     * <p>必要时先追加空切片,然后根据值的每一位把行加入或移出每个切片。
     *
     * @param row 行号
     * @param value 值
     */
    public void setValue(long row, long value) {
        ensureBitCount(requiredBits(value));
        for (int i = 0; i < slices.size(); i++) {
            if (((value >>> i) & 1L) == 1L) {
                slices.get(i).add(row);
            } else {
                slices.get(i).remove(row);
            }
        }
        ebm.add(row);
    }

    /**
     * 批量设置行的值。
     *
     * @param rows 行号
     * @param values 与行号一一对应的值
     */
    public void setValues(long[] rows, long[] values) {
        checkArgument(
                rows.length == values.length,
                "rows and values must have the same length, but got %s and %s",
                rows.length,
                values.length);
        int bits = 0;
        for (long value : values) {
            bits = Math.max(bits, requiredBits(value));
        }
        ensureBitCount(bits);
        for (int i = 0; i < rows.length; i++) {
            setValue(rows[i], values[i]);
        }
    }

    /**
     * 批量设置行的值。
     *
     * @param values 行号到值的映射
     */
    public void setValues(Map<Long, Long> values) {
        values.forEach(this::setValue);
    }

    /**
     * 读取一行的值。
     *
     * @param row 行号
     * @return 该行的值,行不存在时返回 null
     */
    @Nullable
    public Long getValue(long row) {
        if (!ebm.contains(row)) {
            return null;
        }
        long value = 0;
        for (int i = 0; i < slices.size(); i++) {
            if (slices.get(i).contains(row)) {
                value |= 1L << i;
            }
        }
        return value;
    }

    public boolean valueExists(long row) {
        return ebm.contains(row);
    }

    public long getCardinality() {
        return ebm.getCardinality();
    }

    public int bitCount() {
        return slices.size();
    }

    public long getMaxValue() {
        return maxValue;
    }

    public long getMinValue() {
        return minValue;
    }

    /**
     * 获取存在位图的副本。
     *
     * @return 有值的行
     */
    public RoaringBitmap64 getExistenceBitmap() {
        return ebm.clone();
    }

    /**
     * 彻底删除给定行的值,这些行之后不再存在。
     *
     * @param filter 要删除的行
     */
    public void clearValues(RoaringBitmap64 filter) {
        checkNotNull(filter, "filter");
        ebm.andNot(filter);
        for (RoaringBitmap64 slice : slices) {
            slice.andNot(filter);
        }
    }

    // ------------------------------------------------------------------------
    //  Comparison
    // ------------------------------------------------------------------------

    /**
     * 比较查询。
     *
     * <p>返回值满足条件的行,总是 ebm 的子集,给定 filter 时也是 filter 的子集。
     * {@link Operation#RANGE} 表示 {@code a <= value <= b},其他操作忽略 {@code b}。
     *
     * @param parallelism 并行度,0 或 1 表示单线程
     * @param operation 比较操作
     * @param a 比较值,RANGE 时为下界
     * @param b RANGE 的上界
     * @param filter 限定的行,null 表示全部
     * @return 满足条件的行
     */
    public RoaringBitmap64 compareValue(
            int parallelism,
            Operation operation,
            long a,
            long b,
            @Nullable RoaringBitmap64 filter) {
        checkNotNull(operation, "operation");
        RoaringBitmap64[] view = sliceView();
        List<Callable<RoaringBitmap64>> tasks = new ArrayList<>();
        for (RoaringBitmap64 shard : shards(candidates(filter), parallelism)) {
            tasks.add(() -> BitSliceComparator.compare(view, operation, a, b, shard));
        }
        return RoaringBitmap64.or(execute(tasks, parallelism));
    }

    /**
     * 批量等值查询,等价于对每个值做 {@link Operation#EQ} 后求并集。
     *
     * <p>所有值在同一次自顶向下的切片扫描中一起匹配;并行时按值分片。
     *
     * @param parallelism 并行度
     * @param values 目标值
     * @return 值等于任意目标值的行
     */
    public RoaringBitmap64 batchEqual(int parallelism, long... values) {
        long[] distinct = Arrays.stream(values).distinct().toArray();
        RoaringBitmap64[] view = sliceView();
        RoaringBitmap64 candidates = ebm;

        int shardCount = Math.max(1, Math.min(parallelism, distinct.length));
        List<Callable<RoaringBitmap64>> tasks = new ArrayList<>(shardCount);
        for (int s = 0; s < shardCount; s++) {
            int from = (int) ((long) distinct.length * s / shardCount);
            int to = (int) ((long) distinct.length * (s + 1) / shardCount);
            long[] chunk = Arrays.copyOfRange(distinct, from, to);
            tasks.add(() -> BitSliceTraversal.equalAny(view, candidates, chunk));
        }
        return RoaringBitmap64.or(execute(tasks, parallelism));
    }

    /**
     * 求 filter 范围内的最小值或最大值。
     *
     * @param parallelism 并行度
     * @param minMax 求最小值还是最大值
     * @param filter 限定的行,null 表示全部
     * @return 极值,没有候选行时返回 null
     */
    @Nullable
    public Long minMax(int parallelism, MinMax minMax, @Nullable RoaringBitmap64 filter) {
        checkNotNull(minMax, "minMax");
        boolean max = minMax == MinMax.MAX;
        RoaringBitmap64[] view = sliceView();
        List<Callable<Long>> tasks = new ArrayList<>();
        for (RoaringBitmap64 shard : shards(candidates(filter), parallelism)) {
            tasks.add(() -> BitSliceComparator.extreme(view, max, shard));
        }

        Long result = null;
        for (Long value : execute(tasks, parallelism)) {
            if (value == null) {
                continue;
            }
            if (result == null || (max ? value > result : value < result)) {
                result = value;
            }
        }
        return result;
    }

    /**
     * 查找值最大的 k 行。末位存在并列值时可能多于 k 行。
     *
     * @param k 行数
     * @param filter 限定的行,null 表示全部
     * @return 行号位图
     */
    public RoaringBitmap64 topK(int k, @Nullable RoaringBitmap64 filter) {
        return topK(k, filter, false);
    }

    /**
     * 查找值最大的 k 行。
     *
     * @param k 行数
     * @param filter 限定的行,null 表示全部
     * @param strict 为 true 时丢弃多余的并列行,恰好返回 min(k, 候选行数) 行
     * @return 行号位图
     */
    public RoaringBitmap64 topK(int k, @Nullable RoaringBitmap64 filter, boolean strict) {
        checkArgument(k >= 0, "the k param can not be negative in topK, k=%s", k);
        return BitSliceComparator.topK(sliceView(), k, true, candidates(filter), strict);
    }

    /**
     * 查找值最小的 k 行。末位存在并列值时可能多于 k 行。
     *
     * @param k 行数
     * @param filter 限定的行,null 表示全部
     * @return 行号位图
     */
    public RoaringBitmap64 bottomK(int k, @Nullable RoaringBitmap64 filter) {
        return bottomK(k, filter, false);
    }

    /**
     * 查找值最小的 k 行。
     *
     * @param k 行数
     * @param filter 限定的行,null 表示全部
     * @param strict 为 true 时丢弃多余的并列行
     * @return 行号位图
     */
    public RoaringBitmap64 bottomK(int k, @Nullable RoaringBitmap64 filter, boolean strict) {
        checkArgument(k >= 0, "the k param can not be negative in bottomK, k=%s", k);
        return BitSliceComparator.topK(sliceView(), k, false, candidates(filter), strict);
    }

    // ------------------------------------------------------------------------
    //  Aggregation & transpose
    // ------------------------------------------------------------------------

    /**
     * 求和。
     *
     * <p>按切片加权计数:{@code sum = Σ 2^i * |slice[i] ∩ S|},S 为 ebm 与 filter 的交集。
     * 第 63 个切片的权重在 {@code long} 运算中回绕为 {@code -2^63},负值因此被正确计入。
     *
     * @param filter 限定的行,null 表示全部
     * @return (和, 行数)
     */
    public Pair<Long, Long> sum(@Nullable RoaringBitmap64 filter) {
        RoaringBitmap64 rows = candidates(filter);
        long count = rows.getCardinality();
        long sum = 0;
        if (count == 0) {
            return Pair.of(sum, count);
        }
        for (int i = 0; i < slices.size(); i++) {
            sum += RoaringBitmap64.andCardinality(slices.get(i), rows) << i;
        }
        return Pair.of(sum, count);
    }

    /**
     * 转置:返回索引中出现过的所有不同值,以值作为结果位图中的元素。
     *
     * <p>负值按无符号 64 位解释。
     *
     * @return 不同值的集合
     */
    public RoaringBitmap64 transpose() {
        RoaringBitmap64 result = new RoaringBitmap64();
        BitSliceTraversal.forEachValue(sliceView(), ebm, (value, rows) -> result.add(value));
        return result;
    }

    /**
     * 带计数的转置,即值的直方图。
     *
     * <p>返回一个新的索引:行号是原索引 filter 范围内出现的值,存储的值是持有该值的行数。
     * 新索引的切片数由最大的计数决定,它可以继续被查询和求和。新索引按数据自动确定切片数,
     * 声明的边界为 0,线程配置沿用当前索引。
     *
     * @param parallelism 并行度
     * @param filter 限定的行,null 表示全部
     * @return 新的直方图索引
     */
    public BitSliceIndex transposeWithCounts(int parallelism, @Nullable RoaringBitmap64 filter) {
        RoaringBitmap64[] view = sliceView();
        List<Callable<Map<Long, Long>>> tasks = new ArrayList<>();
        for (RoaringBitmap64 shard : shards(candidates(filter), parallelism)) {
            tasks.add(
                    () -> {
                        Map<Long, Long> counts = new HashMap<>();
                        BitSliceTraversal.forEachValue(
                                view,
                                shard,
                                (value, rows) ->
                                        counts.merge(value, rows.getCardinality(), Long::sum));
                        return counts;
                    });
        }

        Map<Long, Long> counts = new HashMap<>();
        for (Map<Long, Long> partial : execute(tasks, parallelism)) {
            partial.forEach((value, count) -> counts.merge(value, count, Long::sum));
        }

        // values and counts have their own domains, so the bounds are not inherited
        BitSliceIndex histogram =
                new BitSliceIndex(0, 0, this, new RoaringBitmap64(), new ArrayList<>());
        histogram.setValues(counts);
        return histogram;
    }

    // ------------------------------------------------------------------------
    //  Arithmetic
    // ------------------------------------------------------------------------

    /**
     * 逐行相加:结果的行集合是两者 ebm 的并集,只在一方存在的行按另一方为 0 计算。
     *
     * <p>{@code other} 可以是当前实例本身,此时每个值翻倍。结果超出 64 位时按补码回绕。
     *
     * @param other 另一个索引,不会被修改
     */
    public void add(BitSliceIndex other) {
        checkNotNull(other, "other");
        int before = slices.size();
        List<RoaringBitmap64> sum = BitSliceAdder.add(sliceView(), other.sliceView());
        RoaringBitmap64 newEbm = RoaringBitmap64.or(ebm, other.ebm);
        this.slices = sum;
        this.ebm = newEbm;
        logGrowth(before);
    }

    /**
     * 给 filter 中的每一行加 1。不存在的行从 0 开始,加 1 后成为存在的行。
     *
     * @param filter 需要加 1 的行
     */
    public void increment(RoaringBitmap64 filter) {
        checkNotNull(filter, "filter");
        int before = slices.size();
        this.slices = BitSliceAdder.increment(sliceView(), filter);
        ebm.or(filter);
        logGrowth(before);
    }

    /** 给每个存在的行加 1。 */
    public void incrementAll() {
        increment(ebm.clone());
    }

    // ------------------------------------------------------------------------
    //  Merge, projection, clone
    // ------------------------------------------------------------------------

    /**
     * 按位并集合并:每个切片与 ebm 分别与 {@code other} 的对应位图求并集。
     *
     * <p>两个索引的行不相交时结果等于两者的合集;同一行在两边都有值时,结果是两个值按位或,
     * 而不是算术和,需要求和时使用 {@link #add}。
     *
     * @param parallelism 并行度,按切片分片
     * @param other 另一个索引,不会被修改
     */
    public void parOr(int parallelism, BitSliceIndex other) {
        checkNotNull(other, "other");
        if (other == this) {
            return;
        }
        RoaringBitmap64[] theirs = other.sliceView();
        ensureBitCount(theirs.length);
        RoaringBitmap64[] ours = sliceView();

        List<Callable<Void>> tasks = new ArrayList<>();
        for (int[] range : sliceRanges(theirs.length, parallelism)) {
            tasks.add(
                    () -> {
                        for (int i = range[0]; i < range[1]; i++) {
                            ours[i].or(theirs[i]);
                        }
                        return null;
                    });
        }
        execute(tasks, parallelism);
        ebm.or(other.ebm);
    }

    /**
     * 按位交集合并:每个切片与 ebm 分别与 {@code other} 的对应位图求交集。
     *
     * <p>切片数保持不变,{@code other} 中不存在的高位切片被清空。
     *
     * @param parallelism 并行度,按切片分片
     * @param other 另一个索引,不会被修改
     */
    public void parAnd(int parallelism, BitSliceIndex other) {
        checkNotNull(other, "other");
        if (other == this) {
            return;
        }
        RoaringBitmap64[] theirs = other.sliceView();
        RoaringBitmap64[] ours = sliceView();

        List<Callable<Void>> tasks = new ArrayList<>();
        for (int[] range : sliceRanges(ours.length, parallelism)) {
            tasks.add(
                    () -> {
                        for (int i = range[0]; i < range[1]; i++) {
                            if (i < theirs.length) {
                                ours[i].and(theirs[i]);
                            } else {
                                ours[i].clear();
                            }
                        }
                        return null;
                    });
        }
        execute(tasks, parallelism);
        ebm.and(other.ebm);
    }

    /**
     * 投影:只保留同时存在于 ebm 与 {@code foundSet} 中的行,值不变。
     *
     * @param foundSet 要保留的行
     * @return 不共享存储的新索引
     */
    public BitSliceIndex newBSIRetainSet(RoaringBitmap64 foundSet) {
        checkNotNull(foundSet, "foundSet");
        RoaringBitmap64 retained = RoaringBitmap64.and(ebm, foundSet);
        List<RoaringBitmap64> retainedSlices = new ArrayList<>(slices.size());
        for (RoaringBitmap64 slice : slices) {
            retainedSlices.add(RoaringBitmap64.and(slice, retained));
        }
        return new BitSliceIndex(this, retained, retainedSlices);
    }

    /**
     * 深拷贝,包括 ebm、所有切片和声明的边界。
     *
     * @return 不共享存储的新索引
     */
    @Override
    public BitSliceIndex clone() {
        List<RoaringBitmap64> copied = new ArrayList<>(slices.size());
        for (RoaringBitmap64 slice : slices) {
            copied.add(slice.clone());
        }
        return new BitSliceIndex(this, ebm.clone(), copied);
    }

    /** 压缩 ebm 与所有切片中的连续区间。 */
    public void runOptimize() {
        ebm.runOptimize();
        for (RoaringBitmap64 slice : slices) {
            slice.runOptimize();
        }
    }

    /**
     * 序列化后的总字节数,即 {@link #marshalBinary()} 各缓冲长度之和。
     *
     * @return 字节数
     */
    public long getSizeInBytes() {
        long size = ebm.serializedSizeInBytes();
        for (RoaringBitmap64 slice : slices) {
            size += slice.serializedSizeInBytes();
        }
        return size;
    }

    // ------------------------------------------------------------------------
    //  Serialization
    // ------------------------------------------------------------------------

    /**
     * 序列化为一组独立的字节缓冲。
     *
     * <p>第 0 个缓冲是 ebm,第 1..bitCount 个缓冲依次是从最低位到最高位的切片。
     * 序列化前会对每个位图做 runOptimize,因此不应与其他线程的读取并发执行。
     *
     * @return 字节缓冲列表
     * @throws IOException 如果位图编码失败
     */
    public List<byte[]> marshalBinary() throws IOException {
        List<byte[]> buffers = new ArrayList<>(slices.size() + 1);
        buffers.add(ebm.serialize());
        for (RoaringBitmap64 slice : slices) {
            buffers.add(slice.serialize());
        }
        return buffers;
    }

    /**
     * 从 {@link #marshalBinary()} 的输出恢复索引,替换当前全部内容。
     *
     * <p>所有缓冲先解码到新的位图,全部成功后才替换当前状态;失败时当前索引保持不变。
     * 切片数被设置为缓冲个数减一。
     *
     * <p>截断、尾部多余字节以及底层编解码器能识别的损坏以 {@link IOException} 报告。
     * 编解码器不校验缓冲中记录的容器长度,被篡改的长度字段可能让它按该长度分配内存,
     * 此时抛出的是 {@link OutOfMemoryError}。来源不可信的缓冲需要在外层另行校验(如校验和)。
     *
     * @param buffers 字节缓冲列表,至少包含 ebm
     * @throws IOException 如果缓冲缺失、切片过多或任一位图解码失败
     */
    public void unmarshalBinary(List<byte[]> buffers) throws IOException {
        checkNotNull(buffers, "buffers");
        if (buffers.isEmpty()) {
            throw new IOException("at least the existence bitmap buffer is required");
        }
        if (buffers.size() - 1 > Long.SIZE) {
            throw new IOException(
                    String.format(
                            "too many bit slices: %s, at most %s are supported",
                            buffers.size() - 1, Long.SIZE));
        }

        RoaringBitmap64 newEbm = decode(buffers.get(0), 0);
        List<RoaringBitmap64> newSlices = new ArrayList<>(buffers.size() - 1);
        for (int i = 1; i < buffers.size(); i++) {
            newSlices.add(decode(buffers.get(i), i));
        }

        this.ebm = newEbm;
        this.slices = newSlices;
    }

    /**
     * 以带版本号的流格式写出 {@link #marshalBinary()} 的缓冲。
     *
     * <pre>
     * +---------+--------------+-------------------+-----------+-----
     * | version | buffer count | length (4 bytes)  | bytes ... | ...
     * | 1 byte  | 4 bytes      |                   |           |
     * +---------+--------------+-------------------+-----------+-----
     * </pre>
     *
     * @param out 输出流
     * @throws IOException 如果发生 I/O 错误
     */
    public void writeTo(DataOutput out) throws IOException {
        List<byte[]> buffers = marshalBinary();
        out.writeByte(VERSION_1);
        out.writeInt(buffers.size());
        for (byte[] buffer : buffers) {
            out.writeInt(buffer.length);
            out.write(buffer);
        }
    }

    /**
     * 从 {@link #writeTo} 写出的流读取索引。
     *
     * @param in 输入流
     * @return 自动确定切片数的新索引
     * @throws IOException 如果发生 I/O 错误、版本不兼容或数据损坏
     */
    public static BitSliceIndex readFrom(DataInput in) throws IOException {
        return readFrom(in, new Options());
    }

    /**
     * 从 {@link #writeTo} 写出的流读取索引,使用给定配置。
     *
     * @param in 输入流
     * @param options 新索引的配置
     * @return 新索引
     * @throws IOException 如果发生 I/O 错误、版本不兼容或数据损坏
     */
    public static BitSliceIndex readFrom(DataInput in, Options options) throws IOException {
        int version = in.readByte();
        if (version != VERSION_1) {
            throw new IOException(
                    String.format(
                            "deserialize bsi index fail, unsupported version %d, expected %d",
                            version, VERSION_1));
        }

        int count = in.readInt();
        if (count < 1 || count > Long.SIZE + 1) {
            throw new IOException("invalid bsi buffer count: " + count);
        }
        List<byte[]> buffers = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int length = in.readInt();
            if (length < 0) {
                throw new IOException("invalid bsi buffer length: " + length);
            }
            byte[] buffer = new byte[length];
            in.readFully(buffer);
            buffers.add(buffer);
        }

        BitSliceIndex bsi = newDefault(options);
        bsi.unmarshalBinary(buffers);
        return bsi;
    }

    // ------------------------------------------------------------------------

    /** 两个索引相等当且仅当切片数、ebm 与每个切片都相等;声明的边界不参与比较。 */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BitSliceIndex that = (BitSliceIndex) o;
        return Objects.equals(ebm, that.ebm) && Objects.equals(slices, that.slices);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ebm, slices);
    }

    @Override
    public String toString() {
        return "BitSliceIndex{"
                + "bitCount="
                + slices.size()
                + ", cardinality="
                + ebm.getCardinality()
                + ", maxValue="
                + maxValue
                + ", minValue="
                + minValue
                + '}';
    }

    /** {@link #minMax} 求值的方向。 */
    public enum MinMax {
        MIN,
        MAX
    }

    // ------------------------------------------------------------------------
    //  Internal methods
    // ------------------------------------------------------------------------

    private void ensureBitCount(int bitCount) {
        int before = slices.size();
        while (slices.size() < bitCount) {
            slices.add(new RoaringBitmap64());
        }
        logGrowth(before);
    }

    private void logGrowth(int before) {
        if (slices.size() != before && LOG.isDebugEnabled()) {
            LOG.debug("Bit slice index grew from {} to {} slices.", before, slices.size());
        }
    }

    private RoaringBitmap64[] sliceView() {
        return slices.toArray(new RoaringBitmap64[0]);
    }

    private RoaringBitmap64 candidates(@Nullable RoaringBitmap64 filter) {
        return filter == null ? ebm : RoaringBitmap64.and(ebm, filter);
    }

    /** 把候选行切成互不相交的连续分片,每片至少 minShardSize 行。 */
    private List<RoaringBitmap64> shards(RoaringBitmap64 candidates, int parallelism) {
        if (parallelism <= 1) {
            return Collections.singletonList(candidates);
        }
        long cardinality = candidates.getCardinality();
        int count = (int) Math.min(parallelism, cardinality / minShardSize);
        if (count <= 1) {
            return Collections.singletonList(candidates);
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Splitting {} candidate rows into {} shards.", cardinality, count);
        }
        return candidates.split(count);
    }

    /** 把 [0, bitCount) 切成至多 parallelism 个连续区间。 */
    private static List<int[]> sliceRanges(int bitCount, int parallelism) {
        int count = Math.max(1, Math.min(parallelism, bitCount));
        List<int[]> ranges = new ArrayList<>(count);
        for (int s = 0; s < count; s++) {
            ranges.add(new int[] {bitCount * s / count, bitCount * (s + 1) / count});
        }
        return ranges;
    }

    private <T> List<T> execute(List<Callable<T>> tasks, int parallelism) {
        if (parallelism <= 1 || tasks.size() <= 1) {
            List<T> results = new ArrayList<>(tasks.size());
            for (Callable<T> task : tasks) {
                try {
                    results.add(task.call());
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new RuntimeException(e);
                }
            }
            return results;
        }
        ExecutorService executor =
                BitSliceThreadPool.getExecutorService(Math.min(parallelism, maxThreads));
        return ThreadPoolUtils.invokeAll(executor, tasks);
    }

    private static RoaringBitmap64 decode(byte[] buffer, int index) throws IOException {
        RoaringBitmap64 bitmap = new RoaringBitmap64();
        try {
            bitmap.deserialize(checkNotNull(buffer, "buffer"));
        } catch (IOException e) {
            LOG.warn("Failed to decode bsi buffer {} of {} bytes.", index, buffer.length);
            throw new IOException(String.format("failed to decode bsi buffer %s", index), e);
        }
        return bitmap;
    }
}
