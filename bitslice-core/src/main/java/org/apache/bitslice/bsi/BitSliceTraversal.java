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

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * 按值分组遍历位切片。
 *
 * <p>从最高位开始,用每个切片把行集合一分为二(该位为 1 / 为 0),直到最低位。
 * 每个叶子上的行集合对应一个确定的值。工作量与不同值的个数以及切片数成正比,
 * 不需要逐行重建整数。
 *
 * <p>使用显式栈,不做递归。
 */
final class BitSliceTraversal {

    private BitSliceTraversal() {}

    /** 接收一个值及持有该值的全部行。 */
    @FunctionalInterface
    interface ValueGroupConsumer {
        void accept(long value, RoaringBitmap64 rows);
    }

    /**
     * 按无符号升序遍历候选集中出现的每个不同值。
     *
     * @param slices 位切片
     * @param candidates 候选行
     * @param consumer 值分组的消费者
     */
    static void forEachValue(
            RoaringBitmap64[] slices, RoaringBitmap64 candidates, ValueGroupConsumer consumer) {
        if (candidates.isEmpty()) {
            return;
        }

        Deque<Node> stack = new ArrayDeque<>();
        stack.push(new Node(candidates, slices.length - 1, 0L, null));
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            if (node.bit < 0) {
                consumer.accept(node.prefix, node.rows);
                continue;
            }

            RoaringBitmap64 ones = RoaringBitmap64.and(node.rows, slices[node.bit]);
            RoaringBitmap64 zeros = RoaringBitmap64.andNot(node.rows, ones);
            // push ones first so that zeros are visited first
            if (!ones.isEmpty()) {
                stack.push(new Node(ones, node.bit - 1, node.prefix | (1L << node.bit), null));
            }
            if (!zeros.isEmpty()) {
                stack.push(new Node(zeros, node.bit - 1, node.prefix, null));
            }
        }
    }

    /**
     * 求值等于任意给定值的候选行。
     *
     * <p>值集合与行集合在同一次下降中一起被切分,共享公共前缀上的位图运算。
     * 无法用当前切片数表示的值不会匹配任何行。
     *
     * @param slices 位切片
     * @param candidates 候选行
     * @param values 目标值,可以重复
     * @return 匹配的行
     */
    static RoaringBitmap64 equalAny(
            RoaringBitmap64[] slices, RoaringBitmap64 candidates, long[] values) {
        RoaringBitmap64 result = new RoaringBitmap64();
        long[] targets =
                Arrays.stream(values)
                        .filter(v -> BitSliceComparator.representable(v, slices.length))
                        .distinct()
                        .toArray();
        if (targets.length == 0 || candidates.isEmpty()) {
            return result;
        }

        Deque<Node> stack = new ArrayDeque<>();
        stack.push(new Node(candidates, slices.length - 1, 0L, targets));
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            if (node.bit < 0) {
                result.or(node.rows);
                continue;
            }

            long[] oneValues = split(node.values, node.bit, true);
            long[] zeroValues = split(node.values, node.bit, false);
            RoaringBitmap64 ones = null;
            if (oneValues.length > 0) {
                ones = RoaringBitmap64.and(node.rows, slices[node.bit]);
                if (!ones.isEmpty()) {
                    stack.push(new Node(ones, node.bit - 1, 0L, oneValues));
                }
            }
            if (zeroValues.length > 0) {
                RoaringBitmap64 zeros =
                        ones == null
                                ? RoaringBitmap64.andNot(node.rows, slices[node.bit])
                                : RoaringBitmap64.andNot(node.rows, ones);
                if (!zeros.isEmpty()) {
                    stack.push(new Node(zeros, node.bit - 1, 0L, zeroValues));
                }
            }
        }
        return result;
    }

    private static long[] split(long[] values, int bit, boolean one) {
        return Arrays.stream(values).filter(v -> (((v >>> bit) & 1L) == 1L) == one).toArray();
    }

    private static final class Node {
        final RoaringBitmap64 rows;
        final int bit;
        final long prefix;
        @Nullable final long[] values;

        Node(RoaringBitmap64 rows, int bit, long prefix, @Nullable long[] values) {
            this.rows = rows;
            this.bit = bit;
            this.prefix = prefix;
            this.values = values;
        }
    }
}
