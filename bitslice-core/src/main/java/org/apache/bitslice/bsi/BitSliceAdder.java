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

import java.util.ArrayList;
import java.util.List;

/**
 * 以位图运算实现的行波进位加法器。
 *
 * <p>把整列数值当作一个整体相加,从最低位到最高位传递一个进位位图:
 *
 * <pre>
 * carry[0]   = {}
 * sum[i]     = a[i] XOR b[i] XOR carry[i]
 * carry[i+1] = (a[i] AND b[i]) OR (carry[i] AND (a[i] XOR b[i]))
 * </pre>
 *
 * <p>较窄的操作数高位按空切片补齐。切片数小于 64 的索引只存储非负值,所以补零与符号扩展等价。
 * 最终进位非空且宽度未满 64 时追加一个切片;宽度为 64 时丢弃进位,即按 2^64 取模回绕,
 * 与 {@code long} 加法一致。
 *
 * <p>返回的切片都是新建的位图,不与任何操作数共享存储。
 */
final class BitSliceAdder {

    private BitSliceAdder() {}

    /**
     * 逐行相加两组切片。
     *
     * @param a 第一个操作数的切片
     * @param b 第二个操作数的切片
     * @return 和的切片,长度为 max(|a|, |b|) 或再多一个
     */
    static List<RoaringBitmap64> add(RoaringBitmap64[] a, RoaringBitmap64[] b) {
        int width = Math.max(a.length, b.length);
        List<RoaringBitmap64> sum = new ArrayList<>(Math.min(width + 1, Long.SIZE));
        RoaringBitmap64 empty = new RoaringBitmap64();
        RoaringBitmap64 carry = new RoaringBitmap64();
        for (int i = 0; i < width; i++) {
            RoaringBitmap64 ai = i < a.length ? a[i] : empty;
            RoaringBitmap64 bi = i < b.length ? b[i] : empty;

            RoaringBitmap64 axb = RoaringBitmap64.xor(ai, bi);
            RoaringBitmap64 si = RoaringBitmap64.xor(axb, carry);

            RoaringBitmap64 nextCarry = RoaringBitmap64.and(ai, bi);
            axb.and(carry);
            nextCarry.or(axb);

            sum.add(si);
            carry = nextCarry;
        }
        if (!carry.isEmpty() && width < Long.SIZE) {
            sum.add(carry);
        }
        return sum;
    }

    /**
     * 给一组行加 1,等价于与"这些行的值为 1"的索引相加。
     *
     * <p>进位从最低位开始只在仍有进位的行上传播,进位为空时提前结束。
     *
     * @param slices 被加数的切片
     * @param rows 需要加 1 的行
     * @return 和的切片
     */
    static List<RoaringBitmap64> increment(RoaringBitmap64[] slices, RoaringBitmap64 rows) {
        List<RoaringBitmap64> sum = new ArrayList<>(Math.min(slices.length + 1, Long.SIZE));
        RoaringBitmap64 carry = rows.clone();
        for (RoaringBitmap64 slice : slices) {
            if (carry.isEmpty()) {
                sum.add(slice.clone());
                continue;
            }
            RoaringBitmap64 si = RoaringBitmap64.xor(slice, carry);
            carry.and(slice);
            sum.add(si);
        }
        if (!carry.isEmpty() && slices.length < Long.SIZE) {
            sum.add(carry);
        }
        return sum;
    }
}
