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

import org.apache.bitslice.annotation.VisibleForTesting;

import org.roaringbitmap.longlong.LongIterator;
import org.roaringbitmap.longlong.Roaring64Bitmap;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInput;
import java.io.DataInputStream;
import java.io.DataOutput;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.LongConsumer;

import static org.apache.bitslice.utils.Preconditions.checkArgument;

/**
 * 64 位整数的压缩位图实现。
 *
 * <p>对 {@link Roaring64Bitmap} 的一层包装,是位切片索引中存在位图与每个位切片的存储类型。
 * 元素按无符号 64 位整数解释,迭代顺序为无符号升序。
 *
 * <h2>代码示例</h2>
 * <pre>{@code
 * RoaringBitmap64 bitmap1 = RoaringBitmap64.bitmapOf(1L, 2L, 3L);
 * RoaringBitmap64 bitmap2 = RoaringBitmap64.bitmapOf(3L, 4L, 5L);
 *
 * // 不修改原位图的集合运算
 * RoaringBitmap64 and = RoaringBitmap64.and(bitmap1, bitmap2);    // {3}
 * RoaringBitmap64 xor = RoaringBitmap64.xor(bitmap1, bitmap2);    // {1, 2, 4, 5}
 *
 * // 原地运算
 * bitmap1.or(bitmap2); // bitmap1 现在包含 {1, 2, 3, 4, 5}
 *
 * // 序列化和反序列化
 * byte[] bytes = bitmap1.serialize();
 * RoaringBitmap64 deserialized = new RoaringBitmap64();
 * deserialized.deserialize(bytes);
 * }</pre>
 *
 * <h2>注意事项</h2>
 * <ul>
 *   <li>序列化前会自动调用 runOptimize() 优化存储</li>
 *   <li>静态集合运算总是返回新的位图,不与参数共享存储</li>
 *   <li>线程不安全,并发修改需要外部同步;没有写者时并发读取是安全的</li>
 * </ul>
 *
 * @see org.roaringbitmap.longlong.Roaring64Bitmap
 */
public class RoaringBitmap64 {

    /** 底层 Roaring64Bitmap 实现 */
    private final Roaring64Bitmap roaringBitmap;

    /** 构造空的 RoaringBitmap64。 */
    public RoaringBitmap64() {
        this.roaringBitmap = new Roaring64Bitmap();
    }

    private RoaringBitmap64(Roaring64Bitmap roaringBitmap) {
        this.roaringBitmap = roaringBitmap;
    }

    /**
     * 添加长整数到位图。
     *
     * @param x 要添加的长整数
     */
    public void add(long x) {
        roaringBitmap.addLong(x);
    }

    /**
     * 从位图中移除长整数。
     *
     * @param x 要移除的长整数
     */
    public void remove(long x) {
        roaringBitmap.removeLong(x);
    }

    public boolean contains(long x) {
        return roaringBitmap.contains(x);
    }

    public boolean isEmpty() {
        return roaringBitmap.isEmpty();
    }

    /**
     * 获取位图的基数(元素个数)。
     *
     * @return 位图中的元素个数
     */
    public long getCardinality() {
        return roaringBitmap.getLongCardinality();
    }

    /**
     * 与另一个位图执行 AND 运算(交集),修改当前位图。
     *
     * @param other 另一个位图
     */
    public void and(RoaringBitmap64 other) {
        roaringBitmap.and(other.roaringBitmap);
    }

    /**
     * 与另一个位图执行 OR 运算(并集),修改当前位图。
     *
     * @param other 另一个位图
     */
    public void or(RoaringBitmap64 other) {
        roaringBitmap.or(other.roaringBitmap);
    }

    /**
     * 与另一个位图执行 XOR 运算(对称差),修改当前位图。
     *
     * @param other 另一个位图
     */
    public void xor(RoaringBitmap64 other) {
        roaringBitmap.xor(other.roaringBitmap);
    }

    /**
     * 与另一个位图执行 AND-NOT 运算(差集),移除 other 中存在的元素。
     *
     * @param other 另一个位图
     */
    public void andNot(RoaringBitmap64 other) {
        roaringBitmap.andNot(other.roaringBitmap);
    }

    /**
     * 克隆此位图。
     *
     * @return 与当前位图不共享存储的新副本
     */
    public RoaringBitmap64 clone() {
        Roaring64Bitmap copy = new Roaring64Bitmap();
        copy.or(roaringBitmap);
        return new RoaringBitmap64(copy);
    }

    /** 清空位图。 */
    public void clear() {
        roaringBitmap.clear();
    }

    /** 将连续范围压缩为 Run Container。 */
    public void runOptimize() {
        roaringBitmap.runOptimize();
    }

    /**
     * 按无符号升序遍历所有元素。
     *
     * @param consumer 元素消费者
     */
    public void forEach(LongConsumer consumer) {
        LongIterator iterator = roaringBitmap.getLongIterator();
        while (iterator.hasNext()) {
            consumer.accept(iterator.next());
        }
    }

    /**
     * 获取位图的迭代器,按无符号升序迭代。
     *
     * @return 长整数迭代器
     */
    public Iterator<Long> iterator() {
        LongIterator iterator = roaringBitmap.getLongIterator();
        return new Iterator<Long>() {
            @Override
            public boolean hasNext() {
                return iterator.hasNext();
            }

            @Override
            public Long next() {
                if (!iterator.hasNext()) {
                    throw new NoSuchElementException();
                }
                return iterator.next();
            }
        };
    }

    /**
     * 将位图按元素顺序切分为至多 {@code shards} 个互不相交的连续分片。
     *
     * <p>每个分片的基数差不超过 1,所有分片的并集等于当前位图。空位图返回空列表。
     *
     * @param shards 期望的分片数,必须为正数
     * @return 分片列表
     */
    public List<RoaringBitmap64> split(int shards) {
        checkArgument(shards > 0, "shards must be positive, but is %s", shards);
        long cardinality = getCardinality();
        List<RoaringBitmap64> result = new ArrayList<>();
        if (cardinality == 0) {
            return result;
        }

        int n = (int) Math.min(shards, cardinality);
        long base = cardinality / n;
        long remainder = cardinality % n;

        LongIterator iterator = roaringBitmap.getLongIterator();
        for (int i = 0; i < n; i++) {
            long size = base + (i < remainder ? 1 : 0);
            Roaring64Bitmap shard = new Roaring64Bitmap();
            for (long j = 0; j < size; j++) {
                shard.addLong(iterator.next());
            }
            result.add(new RoaringBitmap64(shard));
        }
        return result;
    }

    /**
     * 获取序列化后的字节数。
     *
     * @return 字节数
     */
    public long serializedSizeInBytes() {
        return roaringBitmap.serializedSizeInBytes();
    }

    /**
     * 序列化位图到输出流。
     *
     * <p>序列化前会自动调用 runOptimize() 优化存储。
     *
     * @param out 输出流
     * @throws IOException 如果发生 I/O 错误
     */
    public void serialize(DataOutput out) throws IOException {
        roaringBitmap.runOptimize();
        roaringBitmap.serialize(out);
    }

    /**
     * 序列化位图到字节数组。
     *
     * @return 序列化后的字节数组
     * @throws IOException 如果发生 I/O 错误
     */
    public byte[] serialize() throws IOException {
        try (ByteArrayOutputStream bos = new ByteArrayOutputStream();
                DataOutputStream dos = new DataOutputStream(bos)) {
            serialize(dos);
            dos.flush();
            return bos.toByteArray();
        }
    }

    /**
     * 从输入流反序列化位图,覆盖当前内容。
     *
     * @param in 输入流
     * @throws IOException 如果发生 I/O 错误或数据损坏
     */
    public void deserialize(DataInput in) throws IOException {
        try {
            roaringBitmap.deserialize(in);
        } catch (RuntimeException e) {
            // the codec reports some truncated or corrupted inputs as unchecked exceptions
            roaringBitmap.clear();
            throw new IOException("Corrupted roaring bitmap: " + e.getMessage(), e);
        }
    }

    /**
     * 从字节数组反序列化位图,覆盖当前内容。
     *
     * <p>要求字节数组恰好包含一个位图,尾部多余字节视为数据损坏。长度字段被篡改的输入可能使
     * {@link Roaring64Bitmap} 按该长度分配内存并抛出 {@link OutOfMemoryError},这类错误不会被转换。
     *
     * @param rbmBytes 序列化的字节数组
     * @throws IOException 如果发生 I/O 错误或数据损坏
     */
    public void deserialize(byte[] rbmBytes) throws IOException {
        try (ByteArrayInputStream bis = new ByteArrayInputStream(rbmBytes);
                DataInputStream dis = new DataInputStream(bis)) {
            deserialize(dis);
            if (bis.available() > 0) {
                roaringBitmap.clear();
                throw new IOException(
                        String.format(
                                "Corrupted roaring bitmap: %s trailing bytes", bis.available()));
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RoaringBitmap64 that = (RoaringBitmap64) o;
        return Objects.equals(this.roaringBitmap, that.roaringBitmap);
    }

    /** 只由元素决定,与 runOptimize 后的容器类型无关,与 {@link #equals} 保持一致。 */
    @Override
    public int hashCode() {
        int hash = Long.hashCode(getCardinality());
        LongIterator iterator = roaringBitmap.getLongIterator();
        while (iterator.hasNext()) {
            hash = 31 * hash + Long.hashCode(iterator.next());
        }
        return hash;
    }

    @Override
    public String toString() {
        return roaringBitmap.toString();
    }

    /**
     * 创建包含指定长整数的位图。
     *
     * @param dat 要包含的长整数数组
     * @return 新的位图
     */
    @VisibleForTesting
    public static RoaringBitmap64 bitmapOf(long... dat) {
        RoaringBitmap64 roaringBitmap64 = new RoaringBitmap64();
        for (long ele : dat) {
            roaringBitmap64.add(ele);
        }
        return roaringBitmap64;
    }

    /**
     * 计算两个位图的交集(AND 运算),返回新的位图。
     *
     * @param x1 第一个位图
     * @param x2 第二个位图
     * @return 交集位图
     */
    public static RoaringBitmap64 and(final RoaringBitmap64 x1, final RoaringBitmap64 x2) {
        RoaringBitmap64 result = x1.clone();
        result.and(x2);
        return result;
    }

    /**
     * 计算两个位图的并集(OR 运算),返回新的位图。
     *
     * @param x1 第一个位图
     * @param x2 第二个位图
     * @return 并集位图
     */
    public static RoaringBitmap64 or(final RoaringBitmap64 x1, final RoaringBitmap64 x2) {
        RoaringBitmap64 result = x1.clone();
        result.or(x2);
        return result;
    }

    /**
     * 计算多个位图的并集,返回新的位图。
     *
     * @param bitmaps 位图集合
     * @return 并集位图,集合为空时返回空位图
     */
    public static RoaringBitmap64 or(Collection<RoaringBitmap64> bitmaps) {
        RoaringBitmap64 result = new RoaringBitmap64();
        for (RoaringBitmap64 bitmap : bitmaps) {
            result.or(bitmap);
        }
        return result;
    }

    /**
     * 计算两个位图的对称差(XOR 运算),返回新的位图。
     *
     * @param x1 第一个位图
     * @param x2 第二个位图
     * @return 对称差位图
     */
    public static RoaringBitmap64 xor(final RoaringBitmap64 x1, final RoaringBitmap64 x2) {
        RoaringBitmap64 result = x1.clone();
        result.xor(x2);
        return result;
    }

    /**
     * 计算两个位图的差集(AND-NOT 运算),返回新的位图。
     *
     * @param x1 第一个位图
     * @param x2 第二个位图
     * @return 包含在 x1 中但不在 x2 中的元素
     */
    public static RoaringBitmap64 andNot(final RoaringBitmap64 x1, final RoaringBitmap64 x2) {
        RoaringBitmap64 result = x1.clone();
        result.andNot(x2);
        return result;
    }

    /**
     * 计算两个位图交集的基数。
     *
     * @param x1 第一个位图
     * @param x2 第二个位图
     * @return 交集的元素个数
     */
    public static long andCardinality(final RoaringBitmap64 x1, final RoaringBitmap64 x2) {
        return and(x1, x2).getCardinality();
    }
}
