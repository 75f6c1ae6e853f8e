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

import org.apache.bitslice.utils.RoaringBitmap64;

import javax.annotation.Nullable;

import java.util.Iterator;

/**
 * 基于位切片的比较与极值算法。
 *
 * <p>所有方法只读取传入的切片与候选集,返回的位图都是新建的,不与参数共享存储,
 * 因此可以被多个工作线程在同一组切片上并发调用。
 *
 * <h3>有符号编码</h3>
 * <p>切片数小于 64 的索引只存储非负值。存入负值会使索引扩展到 64 个切片,
 * 此时第 63 个切片是符号位:该位为 1 的行比该位为 0 的行小。下面所有算法在符号切片上
 * 交换 0/1 的大小关系,其余切片按无符号位比较。
 */
final class BitSliceComparator {

    /** 符号切片的下标,仅当切片数为 64 时存在。 */
    static final int SIGN_BIT = Long.SIZE - 1;

    private BitSliceComparator() {}

    /**
     * 判断给定值能否用 {@code bitCount} 个切片表示。
     *
     * @param value 值
     * @param bitCount 切片数
     * @return 可以表示时返回 true
     */
    static boolean representable(long value, int bitCount) {
        if (bitCount >= Long.SIZE) {
            return true;
        }
        if (value < 0) {
            return false;
        }
        return bitCount == SIGN_BIT || value < (1L << bitCount);
    }

    /**
     * 存储一个值需要的切片数。负值总是需要全部 64 个切片。
     *
     * @param value 值
     * @return 切片数
     */
    static int requiredBits(long value) {
        return value < 0 ? Long.SIZE : Long.SIZE - Long.numberOfLeadingZeros(value);
    }

    /**
     * 对候选集执行比较,结果总是候选集的子集。
     *
     * @param slices 位切片,下标 0 为最低位
     * @param operation 比较操作
     * @param predicate 比较值,RANGE 时为下界
     * @param upper RANGE 的上界,其他操作忽略
     * @param candidates 候选行
     * @return 满足条件的行
     */
    static RoaringBitmap64 compare(
            RoaringBitmap64[] slices,
            Operation operation,
            long predicate,
            long upper,
            RoaringBitmap64 candidates) {
        if (candidates.isEmpty()) {
            return new RoaringBitmap64();
        }

        switch (operation) {
            case EQ:
                return sweep(slices, predicate, candidates).eq;
            case NEQ:
                {
                    Partition p = sweep(slices, predicate, candidates);
                    p.gt.or(p.lt);
                    return p.gt;
                }
            case LT:
                return sweep(slices, predicate, candidates).lt;
            case LTE:
                {
                    Partition p = sweep(slices, predicate, candidates);
                    p.lt.or(p.eq);
                    return p.lt;
                }
            case GT:
                return sweep(slices, predicate, candidates).gt;
            case GTE:
                {
                    Partition p = sweep(slices, predicate, candidates);
                    p.gt.or(p.eq);
                    return p.gt;
                }
            case RANGE:
                {
                    if (predicate > upper) {
                        return new RoaringBitmap64();
                    }
                    Partition low = sweep(slices, predicate, candidates);
                    low.gt.or(low.eq);
                    if (low.gt.isEmpty()) {
                        return low.gt;
                    }
                    // only rows already >= lower bound can still match
                    Partition high = sweep(slices, upper, low.gt);
                    high.lt.or(high.eq);
                    return high.lt;
                }
            default:
                throw new IllegalArgumentException("not support operation: " + operation);
        }
    }

    /**
     * O'Neil 位切片比较。
     *
     * <p>参考论文:<a href="https://dl.acm.org/doi/10.1145/253262.253268">Improved query
     * performance with variant indexes</a>
     *
     * <p>从最高位到最低位逐位比较,维护三个互不相交的位图:已确定大于的 gt、已确定小于的 lt、
     * 尚未确定的 eq。eq 为空时提前结束。扫描结束时剩余的 eq 即为等于比较值的行。
     *
     * <p>比较值超出当前切片数的表示范围时,所有候选行一次性落入 gt 或 lt。
     */
    static Partition sweep(RoaringBitmap64[] slices, long predicate, RoaringBitmap64 candidates) {
        int bitCount = slices.length;
        if (!representable(predicate, bitCount)) {
            // every stored value lies in [0, 2^bitCount)
            RoaringBitmap64 all = candidates.clone();
            return predicate < 0
                    ? new Partition(all, new RoaringBitmap64(), new RoaringBitmap64())
                    : new Partition(new RoaringBitmap64(), all, new RoaringBitmap64());
        }

        RoaringBitmap64 gt = new RoaringBitmap64();
        RoaringBitmap64 lt = new RoaringBitmap64();
        RoaringBitmap64 eq = candidates.clone();

        for (int i = bitCount - 1; i >= 0 && !eq.isEmpty(); i--) {
            RoaringBitmap64 slice = slices[i];
            boolean bit = ((predicate >>> i) & 1L) == 1L;
            if (i == SIGN_BIT) {
                if (bit) {
                    gt.or(RoaringBitmap64.andNot(eq, slice));
                    eq.and(slice);
                } else {
                    lt.or(RoaringBitmap64.and(eq, slice));
                    eq.andNot(slice);
                }
            } else if (bit) {
                lt.or(RoaringBitmap64.andNot(eq, slice));
                eq.and(slice);
            } else {
                gt.or(RoaringBitmap64.and(eq, slice));
                eq.andNot(slice);
            }
        }
        return new Partition(gt, lt, eq);
    }

    /**
     * 求候选集中的最小值或最大值。
     *
     * <p>从高位到低位贪心:求最大值时优先保留当前位"较大"的行,若不存在则保留全部行,
     * 并据此确定结果的该位。符号切片上"较大"的是该位为 0 的行。
     *
     * @param slices 位切片
     * @param max true 求最大值,false 求最小值
     * @param candidates 候选行
     * @return 极值,候选集为空时返回 null
     */
    @Nullable
    static Long extreme(RoaringBitmap64[] slices, boolean max, RoaringBitmap64 candidates) {
        if (candidates.isEmpty()) {
            return null;
        }

        long value = 0;
        RoaringBitmap64 e = candidates.clone();
        for (int i = slices.length - 1; i >= 0; i--) {
            RoaringBitmap64 ones = RoaringBitmap64.and(e, slices[i]);
            // on the sign slice a set bit means smaller
            boolean preferOnes = max != (i == SIGN_BIT);
            if (preferOnes) {
                if (!ones.isEmpty()) {
                    e = ones;
                    value |= 1L << i;
                }
            } else {
                RoaringBitmap64 zeros = RoaringBitmap64.andNot(e, slices[i]);
                if (zeros.isEmpty()) {
                    value |= 1L << i;
                } else {
                    e = zeros;
                }
            }
        }
        return value;
    }

    /**
     * 查找值最大(或最小)的 k 行。
     *
     * <p>参考论文:<a href="https://www.cs.umb.edu/~poneil/SIGBSTMH.pdf">Bit-Sliced Index
     * Arithmetic</a> 算法 4.1:
     *
     * <pre>
     * g = {}          // 已选中的集合
     * e = foundSet    // 候选集合
     * for i = slices.length-1 to 0:
     *   x = g ∪ (e ∩ upper(i))
     *   n = |x|
     *   if n > k:  e = e ∩ upper(i)
     *   if n < k:  g = x, e = e \ upper(i)
     *   if n == k: e = e ∩ upper(i), break
     * return g ∪ e
     * </pre>
     *
     * <p>upper(i) 为在第 i 位上排序靠前的行:求最大值时为该位较大的行,求最小值时为较小的行。
     *
     * @param slices 位切片
     * @param k 需要的行数
     * @param top true 查找最大的 k 行,false 查找最小的 k 行
     * @param candidates 候选行
     * @param strict 末位存在并列值时是否截断到恰好 k 行
     * @return 行号位图
     */
    static RoaringBitmap64 topK(
            RoaringBitmap64[] slices,
            int k,
            boolean top,
            RoaringBitmap64 candidates,
            boolean strict) {
        if (k == 0 || candidates.isEmpty()) {
            return new RoaringBitmap64();
        }
        if (candidates.getCardinality() <= k) {
            return candidates.clone();
        }

        RoaringBitmap64 g = new RoaringBitmap64();
        RoaringBitmap64 e = candidates.clone();
        for (int i = slices.length - 1; i >= 0; i--) {
            boolean preferOnes = top != (i == SIGN_BIT);
            RoaringBitmap64 ahead =
                    preferOnes
                            ? RoaringBitmap64.and(e, slices[i])
                            : RoaringBitmap64.andNot(e, slices[i]);
            RoaringBitmap64 x = RoaringBitmap64.or(g, ahead);
            long n = x.getCardinality();
            if (n > k) {
                e = ahead;
            } else if (n < k) {
                g = x;
                e.andNot(ahead);
            } else {
                e = ahead;
                break;
            }
        }

        RoaringBitmap64 f = RoaringBitmap64.or(g, e);
        if (!strict) {
            return f;
        }

        // return k rows, ties are broken by dropping the smallest row ids of the last group
        long n = f.getCardinality() - k;
        Iterator<Long> iterator = e.iterator();
        while (iterator.hasNext() && n > 0) {
            f.remove(iterator.next());
            n--;
        }
        return f;
    }

    /** 一次 O'Neil 扫描的结果:三个互不相交的位图,并集等于候选集。 */
    static final class Partition {
        final RoaringBitmap64 gt;
        final RoaringBitmap64 lt;
        final RoaringBitmap64 eq;

        Partition(RoaringBitmap64 gt, RoaringBitmap64 lt, RoaringBitmap64 eq) {
            this.gt = gt;
            this.lt = lt;
            this.eq = eq;
        }
    }
}
