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

import org.apache.bitslice.options.Options;
import org.apache.bitslice.utils.Pair;
import org.apache.bitslice.utils.RoaringBitmap64;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.LongPredicate;

import static org.apache.bitslice.bsi.BitSliceIndex.MinMax.MAX;
import static org.apache.bitslice.bsi.BitSliceIndex.MinMax.MIN;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Test for {@link BitSliceIndex}. */
public class BitSliceIndexTest {

    private static final int ROW_COUNT = 5000;

    private BitSliceIndex bsi;

    @BeforeEach
    public void setup() {
        bsi = BitSliceIndex.newDefault();
        for (long i = 0; i < 100; i++) {
            bsi.setValue(i, i);
        }
    }

    @Test
    public void testSetAndGet() {
        for (long i = 0; i < 100; i++) {
            assertThat(bsi.getValue(i)).isEqualTo(i);
            assertThat(bsi.valueExists(i)).isTrue();
        }
        assertThat(bsi.getValue(100)).isNull();
        assertThat(bsi.valueExists(100)).isFalse();
        assertThat(bsi.getCardinality()).isEqualTo(100);

        // overwrite clears bits of the previous value
        bsi.setValue(7, 64);
        assertThat(bsi.getValue(7)).isEqualTo(64);
        bsi.setValue(7, 0);
        assertThat(bsi.getValue(7)).isEqualTo(0);
        assertThat(bsi.valueExists(7)).isTrue();
        assertThat(bsi.getCardinality()).isEqualTo(100);
    }

    @Test
    public void testBitCount() {
        assertThat(bsi.bitCount()).isEqualTo(7);
        assertThat(new BitSliceIndex(999, 0).bitCount()).isEqualTo(10);
        assertThat(new BitSliceIndex(100, 0).bitCount()).isEqualTo(7);
        assertThat(new BitSliceIndex(0, -1).bitCount()).isEqualTo(64);
        assertThat(BitSliceIndex.newDefault().bitCount()).isEqualTo(0);

        BitSliceIndex index = new BitSliceIndex(999, 0);
        assertThat(index.getMaxValue()).isEqualTo(999);
        assertThat(index.getMinValue()).isEqualTo(0);
        index.setValue(1, 1L << 20);
        assertThat(index.bitCount()).isEqualTo(21);
        // never shrinks
        index.setValue(1, 1);
        assertThat(index.bitCount()).isEqualTo(21);
    }

    @Test
    public void testCompareValue() {
        assertThat(bsi.compareValue(0, Operation.EQ, 50, 0, null))
                .isEqualTo(RoaringBitmap64.bitmapOf(50));
        assertThat(bsi.compareValue(0, Operation.NEQ, 50, 0, null).getCardinality())
                .isEqualTo(99);
        assertThat(bsi.compareValue(0, Operation.LT, 50, 0, null)).isEqualTo(range(0, 50));
        assertThat(bsi.compareValue(0, Operation.LTE, 50, 0, null)).isEqualTo(range(0, 51));
        assertThat(bsi.compareValue(0, Operation.GT, 50, 0, null)).isEqualTo(range(51, 100));
        assertThat(bsi.compareValue(0, Operation.GTE, 50, 0, null)).isEqualTo(range(50, 100));
        assertThat(bsi.compareValue(0, Operation.RANGE, 45, 55, null)).isEqualTo(range(45, 56));

        // empty range
        assertThat(bsi.compareValue(0, Operation.RANGE, 55, 45, null).isEmpty()).isTrue();

        // predicates outside the representable range
        assertThat(bsi.compareValue(0, Operation.EQ, 1000, 0, null).isEmpty()).isTrue();
        assertThat(bsi.compareValue(0, Operation.LT, 1000, 0, null)).isEqualTo(range(0, 100));
        assertThat(bsi.compareValue(0, Operation.GT, -1, 0, null)).isEqualTo(range(0, 100));
        assertThat(bsi.compareValue(0, Operation.LTE, -1, 0, null).isEmpty()).isTrue();

        // with filter
        RoaringBitmap64 filter = RoaringBitmap64.bitmapOf(1, 48, 50, 52, 500);
        assertThat(bsi.compareValue(0, Operation.GTE, 50, 0, filter))
                .isEqualTo(RoaringBitmap64.bitmapOf(50, 52));
    }

    @Test
    public void testSum() {
        RoaringBitmap64 rows = bsi.compareValue(0, Operation.RANGE, 45, 55, null);
        Pair<Long, Long> sum = bsi.sum(rows);
        assertThat(sum.getKey()).isEqualTo(550);
        assertThat(sum.getValue()).isEqualTo(11);

        assertThat(bsi.sum(null)).isEqualTo(Pair.of(4950L, 100L));
        assertThat(bsi.sum(new RoaringBitmap64())).isEqualTo(Pair.of(0L, 0L));
        // rows without a value are not counted
        assertThat(bsi.sum(RoaringBitmap64.bitmapOf(10, 1000))).isEqualTo(Pair.of(10L, 1L));
    }

    @Test
    public void testTranspose() {
        assertThat(bsi.transpose()).isEqualTo(range(0, 100));

        BitSliceIndex index = BitSliceIndex.newDefault();
        index.setValue(1, 5);
        index.setValue(2, 5);
        index.setValue(3, -2);
        assertThat(index.transpose()).isEqualTo(RoaringBitmap64.bitmapOf(5, -2));
        assertThat(BitSliceIndex.newDefault().transpose().isEmpty()).isTrue();
    }

    @Test
    public void testTransposeWithCounts() {
        bsi.setValue(101, 50);
        BitSliceIndex histogram = bsi.transposeWithCounts(0, null);
        assertThat(histogram.getCardinality()).isEqualTo(100);
        assertThat(histogram.getValue(50)).isEqualTo(2);
        assertThat(histogram.getValue(49)).isEqualTo(1);
        assertThat(histogram.getValue(100)).isNull();
        assertThat(histogram.bitCount()).isEqualTo(2);
        assertThat(histogram.sum(null)).isEqualTo(Pair.of(101L, 100L));

        BitSliceIndex filtered =
                bsi.transposeWithCounts(0, RoaringBitmap64.bitmapOf(50, 101, 3));
        assertThat(filtered.getExistenceBitmap()).isEqualTo(RoaringBitmap64.bitmapOf(3, 50));
        assertThat(filtered.getValue(50)).isEqualTo(2);
        assertThat(filtered.getValue(3)).isEqualTo(1);

        // the histogram does not share bitmaps with the source
        histogram.setValue(50, 7);
        assertThat(bsi.getValue(101)).isEqualTo(50);
    }

    @Test
    public void testTransposeWithCountsUsesAutoBounds() {
        BitSliceIndex index = new BitSliceIndex(999, 0);
        index.setValue(1, 999);
        index.setValue(2, 999);
        index.setValue(3, 7);

        BitSliceIndex histogram = index.transposeWithCounts(0, null);
        assertThat(histogram.getMaxValue()).isEqualTo(0);
        assertThat(histogram.getMinValue()).isEqualTo(0);
        assertThat(histogram.bitCount()).isEqualTo(2);
        assertThat(histogram.getValue(999)).isEqualTo(2);
        assertThat(histogram.getValue(7)).isEqualTo(1);
    }

    @Test
    public void testParOr() {
        BitSliceIndex first = BitSliceIndex.newDefault();
        BitSliceIndex second = BitSliceIndex.newDefault();
        for (long i = 0; i < 50; i++) {
            first.setValue(i, i);
        }
        for (long i = 50; i < 100; i++) {
            second.setValue(i, i);
        }
        assertThat(first.bitCount()).isEqualTo(6);

        first.parOr(0, second);
        assertThat(first).isEqualTo(bsi);
        assertThat(first.bitCount()).isEqualTo(7);
        for (long i = 0; i < 100; i++) {
            assertThat(first.getValue(i)).isEqualTo(i);
        }
        assertThat(second.getCardinality()).isEqualTo(50);

        // overlapping rows are merged bitwise
        BitSliceIndex a = BitSliceIndex.newDefault();
        BitSliceIndex b = BitSliceIndex.newDefault();
        a.setValue(1, 5);
        b.setValue(1, 3);
        a.parOr(4, b);
        assertThat(a.getValue(1)).isEqualTo(7);
    }

    @Test
    public void testParAnd() {
        BitSliceIndex retained = bsi.newBSIRetainSet(range(0, 50));
        BitSliceIndex copy = bsi.clone();
        copy.parAnd(2, retained);
        assertThat(copy).isEqualTo(retained);
        assertThat(copy.getCardinality()).isEqualTo(50);
        assertThat(copy.getValue(60)).isNull();
        assertThat(copy.getValue(30)).isEqualTo(30);
    }

    @Test
    public void testNewBSIRetainSet() {
        RoaringBitmap64 found = RoaringBitmap64.bitmapOf(3, 30, 60, 1000);
        BitSliceIndex retained = bsi.newBSIRetainSet(found);
        assertThat(retained.getExistenceBitmap()).isEqualTo(RoaringBitmap64.bitmapOf(3, 30, 60));
        assertThat(retained.getValue(30)).isEqualTo(30);
        assertThat(retained.getValue(31)).isNull();
        assertThat(retained.bitCount()).isEqualTo(bsi.bitCount());

        retained.setValue(30, 0);
        assertThat(bsi.getValue(30)).isEqualTo(30);
        assertThat(bsi.getCardinality()).isEqualTo(100);
    }

    @Test
    public void testCloneAndAdd() {
        BitSliceIndex clone = bsi.clone();
        assertThat(clone).isEqualTo(bsi);
        assertThat(clone.getMaxValue()).isEqualTo(bsi.getMaxValue());

        clone.add(bsi);
        for (long i = 0; i < 100; i++) {
            assertThat(clone.getValue(i)).isEqualTo(i * 2);
            assertThat(bsi.getValue(i)).isEqualTo(i);
        }
        assertThat(clone.bitCount()).isEqualTo(8);
        assertThat(clone.sum(null)).isEqualTo(Pair.of(9900L, 100L));

        // add to itself
        bsi.add(bsi);
        assertThat(bsi).isEqualTo(clone);
    }

    @Test
    public void testAddDisjointRows() {
        BitSliceIndex a = BitSliceIndex.newDefault();
        BitSliceIndex b = BitSliceIndex.newDefault();
        a.setValue(1, 10);
        a.setValue(2, 20);
        b.setValue(2, 5);
        b.setValue(3, 1L << 40);
        a.add(b);
        assertThat(a.getValue(1)).isEqualTo(10);
        assertThat(a.getValue(2)).isEqualTo(25);
        assertThat(a.getValue(3)).isEqualTo(1L << 40);
        assertThat(a.getCardinality()).isEqualTo(3);
    }

    @Test
    public void testIncrement() {
        bsi.incrementAll();
        for (long i = 0; i < 100; i++) {
            assertThat(bsi.getValue(i)).isEqualTo(i + 1);
        }
        assertThat(bsi.sum(null)).isEqualTo(Pair.of(5050L, 100L));

        // absent rows start from zero
        bsi.increment(RoaringBitmap64.bitmapOf(0, 200));
        assertThat(bsi.getValue(0)).isEqualTo(2);
        assertThat(bsi.getValue(200)).isEqualTo(1);
        assertThat(bsi.getCardinality()).isEqualTo(101);

        BitSliceIndex index = BitSliceIndex.newDefault();
        index.setValue(1, 127);
        index.increment(RoaringBitmap64.bitmapOf(1));
        assertThat(index.getValue(1)).isEqualTo(128);
        assertThat(index.bitCount()).isEqualTo(8);
    }

    @Test
    public void testIncrementWrapsAround() {
        BitSliceIndex index = BitSliceIndex.newDefault();
        index.setValue(1, -1);
        index.setValue(2, Long.MAX_VALUE);
        index.incrementAll();
        assertThat(index.getValue(1)).isEqualTo(0);
        assertThat(index.getValue(2)).isEqualTo(Long.MIN_VALUE);
        assertThat(index.bitCount()).isEqualTo(64);
    }

    @Test
    public void testNegativeValues() {
        BitSliceIndex index = BitSliceIndex.newDefault();
        long[] values = {-5, -1, 0, 3, Long.MIN_VALUE, Long.MAX_VALUE, 100};
        for (int i = 0; i < values.length; i++) {
            index.setValue(i, values[i]);
        }
        assertThat(index.bitCount()).isEqualTo(64);
        for (int i = 0; i < values.length; i++) {
            assertThat(index.getValue(i)).isEqualTo(values[i]);
        }

        assertThat(index.compareValue(0, Operation.LT, 0, 0, null))
                .isEqualTo(RoaringBitmap64.bitmapOf(0, 1, 4));
        assertThat(index.compareValue(0, Operation.GTE, -1, 0, null))
                .isEqualTo(RoaringBitmap64.bitmapOf(1, 2, 3, 5, 6));
        assertThat(index.compareValue(0, Operation.RANGE, -5, 3, null))
                .isEqualTo(RoaringBitmap64.bitmapOf(0, 1, 2, 3));
        assertThat(index.compareValue(0, Operation.EQ, Long.MIN_VALUE, 0, null))
                .isEqualTo(RoaringBitmap64.bitmapOf(4));

        assertThat(index.minMax(0, MIN, null)).isEqualTo(Long.MIN_VALUE);
        assertThat(index.minMax(0, MAX, null)).isEqualTo(Long.MAX_VALUE);

        RoaringBitmap64 small = RoaringBitmap64.bitmapOf(0, 1, 2, 3, 6);
        assertThat(index.sum(small)).isEqualTo(Pair.of(97L, 5L));
        assertThat(index.minMax(0, MIN, small)).isEqualTo(-5);
        assertThat(index.minMax(0, MAX, small)).isEqualTo(100);
    }

    @Test
    public void testMinMax() {
        assertThat(bsi.minMax(0, MIN, null)).isEqualTo(0);
        assertThat(bsi.minMax(0, MAX, null)).isEqualTo(99);

        RoaringBitmap64 rows = bsi.compareValue(0, Operation.RANGE, 45, 55, null);
        assertThat(bsi.minMax(0, MIN, rows)).isEqualTo(45);
        assertThat(bsi.minMax(0, MAX, rows)).isEqualTo(55);

        assertThat(bsi.minMax(0, MAX, RoaringBitmap64.bitmapOf(1000))).isNull();
        assertThat(BitSliceIndex.newDefault().minMax(0, MIN, null)).isNull();
    }

    @Test
    public void testTopK() {
        assertThat(bsi.topK(10, null)).isEqualTo(range(90, 100));
        assertThat(bsi.bottomK(10, null)).isEqualTo(range(0, 10));
        assertThat(bsi.topK(0, null).isEmpty()).isTrue();
        assertThat(bsi.topK(1000, null)).isEqualTo(range(0, 100));
        assertThat(bsi.topK(3, range(10, 20))).isEqualTo(range(17, 20));
        assertThatThrownBy(() -> bsi.topK(-1, null))
                .isInstanceOf(IllegalArgumentException.class);

        // ties
        BitSliceIndex index = BitSliceIndex.newDefault();
        for (long i = 0; i < 100; i++) {
            index.setValue(i, i % 10);
        }
        RoaringBitmap64 nines = index.compareValue(0, Operation.EQ, 9, 0, null);
        assertThat(index.topK(5, null)).isEqualTo(nines);
        RoaringBitmap64 strict = index.topK(5, null, true);
        assertThat(strict.getCardinality()).isEqualTo(5);
        assertThat(RoaringBitmap64.andNot(strict, nines).isEmpty()).isTrue();

        // signed values
        BitSliceIndex signed = BitSliceIndex.newDefault();
        for (long v = -3; v <= 3; v++) {
            signed.setValue(v + 3, v);
        }
        assertThat(signed.topK(2, null)).isEqualTo(RoaringBitmap64.bitmapOf(5, 6));
        assertThat(signed.bottomK(2, null)).isEqualTo(RoaringBitmap64.bitmapOf(0, 1));
    }

    @Test
    public void testBatchEqual() {
        assertThat(bsi.batchEqual(0, 5, 10, 500, -1, 10))
                .isEqualTo(RoaringBitmap64.bitmapOf(5, 10));
        assertThat(bsi.batchEqual(3, 1, 2, 3, 4, 5, 6, 7)).isEqualTo(range(1, 8));
        assertThat(bsi.batchEqual(0).isEmpty()).isTrue();
    }

    @Test
    public void testClearValues() {
        bsi.clearValues(range(0, 10));
        assertThat(bsi.getCardinality()).isEqualTo(90);
        assertThat(bsi.getValue(5)).isNull();
        assertThat(bsi.getValue(15)).isEqualTo(15);
        assertThat(bsi.sum(null)).isEqualTo(Pair.of(4950L - 45L, 90L));
        assertThat(bsi.compareValue(0, Operation.LT, 10, 0, null).isEmpty()).isTrue();
    }

    @Test
    public void testSetValues() {
        BitSliceIndex index = BitSliceIndex.newDefault();
        index.setValues(new long[] {1, 2, 3}, new long[] {10, -20, 30});
        assertThat(index.getValue(2)).isEqualTo(-20);
        assertThat(index.bitCount()).isEqualTo(64);

        Map<Long, Long> values = new HashMap<>();
        values.put(4L, 40L);
        values.put(1L, 11L);
        index.setValues(values);
        assertThat(index.getValue(1)).isEqualTo(11);
        assertThat(index.getValue(4)).isEqualTo(40);
        assertThat(index.getCardinality()).isEqualTo(4);

        assertThatThrownBy(() -> index.setValues(new long[] {1}, new long[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testEquality() {
        BitSliceIndex other = new BitSliceIndex(100, 0);
        for (long i = 0; i < 100; i++) {
            other.setValue(i, i);
        }
        // bounds are not part of equality
        assertThat(other).isEqualTo(bsi);
        assertThat(other.hashCode()).isEqualTo(bsi.hashCode());

        other.setValue(3, 4);
        assertThat(other).isNotEqualTo(bsi);
    }

    @Test
    public void testHashCodeAfterMarshal() throws IOException {
        BitSliceIndex index = BitSliceIndex.newDefault();
        for (long i = 0; i < 5000; i++) {
            index.setValue(i, i);
        }
        BitSliceIndex clone = index.clone();

        // marshalling compacts runs in place
        index.marshalBinary();
        assertThat(index).isEqualTo(clone);
        assertThat(index.hashCode()).isEqualTo(clone.hashCode());

        clone.runOptimize();
        index.setValue(0, 0);
        assertThat(index.hashCode()).isEqualTo(clone.hashCode());
    }

    @Test
    public void testMarshalRoundTrip() throws IOException {
        bsi.setValue(1000, 1L << 50);
        List<byte[]> buffers = bsi.marshalBinary();
        assertThat(buffers).hasSize(bsi.bitCount() + 1);

        assertThat(bsi.getSizeInBytes()).isPositive();

        BitSliceIndex restored = BitSliceIndex.newDefault();
        restored.setValue(7, 7);
        restored.unmarshalBinary(buffers);
        assertThat(restored).isEqualTo(bsi);
        assertThat(restored.bitCount()).isEqualTo(bsi.bitCount());
        assertThat(restored.getExistenceBitmap()).isEqualTo(bsi.getExistenceBitmap());
        assertThat(restored.getValue(1000)).isEqualTo(1L << 50);

        // only the existence bitmap
        BitSliceIndex zeros = BitSliceIndex.newDefault();
        zeros.setValue(1, 0);
        BitSliceIndex restoredZeros = BitSliceIndex.newDefault();
        restoredZeros.unmarshalBinary(zeros.marshalBinary());
        assertThat(restoredZeros.bitCount()).isEqualTo(0);
        assertThat(restoredZeros.getValue(1)).isEqualTo(0);
    }

    @Test
    public void testUnmarshalMalformedInput() throws IOException {
        BitSliceIndex before = bsi.clone();

        assertThatThrownBy(() -> bsi.unmarshalBinary(Collections.emptyList()))
                .isInstanceOf(IOException.class);

        List<byte[]> corrupted = new ArrayList<>(BitSliceIndex.newDefault().marshalBinary());
        corrupted.add(new byte[0]);
        assertThatThrownBy(() -> bsi.unmarshalBinary(corrupted)).isInstanceOf(IOException.class);

        List<byte[]> tooMany = new ArrayList<>();
        byte[] empty = new RoaringBitmap64().serialize();
        for (int i = 0; i < 66; i++) {
            tooMany.add(empty);
        }
        assertThatThrownBy(() -> bsi.unmarshalBinary(tooMany)).isInstanceOf(IOException.class);

        assertThat(bsi).isEqualTo(before);
        assertThat(bsi.getValue(42)).isEqualTo(42);
    }

    @Test
    public void testUnmarshalTruncatedBuffers() throws IOException {
        BitSliceIndex index = BitSliceIndex.newDefault();
        for (long i = 0; i < 5000; i += 3) {
            index.setValue(i, i);
        }
        List<byte[]> buffers = index.marshalBinary();
        BitSliceIndex before = bsi.clone();

        for (int i = 0; i < buffers.size(); i++) {
            List<byte[]> truncated = new ArrayList<>(buffers);
            byte[] buffer = buffers.get(i);
            truncated.set(i, Arrays.copyOf(buffer, buffer.length / 2));
            assertThatThrownBy(() -> bsi.unmarshalBinary(truncated))
                    .isInstanceOf(IOException.class);
        }
        assertThat(bsi).isEqualTo(before);

        // the stream framing rejects a cut inside a buffer as well
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        index.writeTo(new DataOutputStream(bos));
        byte[] bytes = Arrays.copyOf(bos.toByteArray(), bos.size() - 1);
        assertThatThrownBy(
                        () ->
                                BitSliceIndex.readFrom(
                                        new DataInputStream(new ByteArrayInputStream(bytes))))
                .isInstanceOf(IOException.class);
    }

    @Test
    public void testStreamRoundTrip() throws IOException {
        bsi.setValue(5, -5);
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        bsi.writeTo(new DataOutputStream(bos));
        byte[] bytes = bos.toByteArray();
        assertThat(bytes[0]).isEqualTo(BitSliceIndex.VERSION_1);

        BitSliceIndex restored =
                BitSliceIndex.readFrom(new DataInputStream(new ByteArrayInputStream(bytes)));
        assertThat(restored).isEqualTo(bsi);
        assertThat(restored.getValue(5)).isEqualTo(-5);

        bytes[0] = 2;
        assertThatThrownBy(
                        () ->
                                BitSliceIndex.readFrom(
                                        new DataInputStream(new ByteArrayInputStream(bytes))))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("unsupported version");
    }

    @Test
    public void testInvalidOptions() {
        Options options = new Options();
        options.set(BitSliceIndexOptions.MAX_THREADS, 0);
        assertThatThrownBy(() -> BitSliceIndex.newDefault(options))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @RepeatedTest(5)
    public void testRandomUnsigned() {
        Random random = new Random();
        Map<Long, Long> data = new HashMap<>();
        for (int i = 0; i < ROW_COUNT; i++) {
            data.put(random.nextLong() & 0xFFFFFFFFL, (long) random.nextInt(100000));
        }
        checkAgainstNaive(data, random);
    }

    @RepeatedTest(5)
    public void testRandomSigned() {
        Random random = new Random();
        Map<Long, Long> data = new HashMap<>();
        for (int i = 0; i < ROW_COUNT; i++) {
            long value =
                    random.nextInt(4) == 0 ? random.nextLong() : random.nextInt(2001) - 1000L;
            data.put((long) random.nextInt(ROW_COUNT * 4), value);
        }
        checkAgainstNaive(data, random);
    }

    @RepeatedTest(5)
    public void testRandomAdd() {
        Random random = new Random();
        Map<Long, Long> left = new HashMap<>();
        Map<Long, Long> right = new HashMap<>();
        boolean signed = random.nextBoolean();
        for (int i = 0; i < 1000; i++) {
            long value = signed ? random.nextLong() : random.nextInt(1000);
            left.put((long) random.nextInt(2000), value);
            right.put((long) random.nextInt(2000), random.nextLong() >>> 1);
        }

        BitSliceIndex a = build(left, new Options());
        BitSliceIndex b = build(right, new Options());
        BitSliceIndex ab = a.clone();
        ab.add(b);
        BitSliceIndex ba = b.clone();
        ba.add(a);
        assertThat(ab).isEqualTo(ba);

        Map<Long, Long> expected = new HashMap<>(left);
        right.forEach((row, value) -> expected.merge(row, value, Long::sum));
        assertThat(ab.getCardinality()).isEqualTo(expected.size());
        expected.forEach((row, value) -> assertThat(ab.getValue(row)).isEqualTo(value));
    }

    private void checkAgainstNaive(Map<Long, Long> data, Random random) {
        Options options = new Options();
        options.set(BitSliceIndexOptions.MIN_SHARD_SIZE, 1);
        options.set(BitSliceIndexOptions.MAX_THREADS, 4);
        BitSliceIndex index = build(data, options);

        assertThat(index.getCardinality()).isEqualTo(data.size());
        data.forEach((row, value) -> assertThat(index.getValue(row)).isEqualTo(value));

        List<Long> values = new ArrayList<>(data.values());
        RoaringBitmap64 filter = new RoaringBitmap64();
        for (Long row : data.keySet()) {
            if (random.nextBoolean()) {
                filter.add(row);
            }
        }

        for (int i = 0; i < 20; i++) {
            long a = i % 4 == 0 ? random.nextLong() : values.get(random.nextInt(values.size()));
            long b = values.get(random.nextInt(values.size()));
            for (int parallelism : new int[] {0, 4}) {
                RoaringBitmap64 eq = index.compareValue(parallelism, Operation.EQ, a, 0, null);
                RoaringBitmap64 lt = index.compareValue(parallelism, Operation.LT, a, 0, null);
                RoaringBitmap64 gt = index.compareValue(parallelism, Operation.GT, a, 0, null);
                assertThat(eq).isEqualTo(naive(data, v -> v == a));
                assertThat(lt).isEqualTo(naive(data, v -> v < a));
                assertThat(gt).isEqualTo(naive(data, v -> v > a));
                assertThat(index.compareValue(parallelism, Operation.NEQ, a, 0, null))
                        .isEqualTo(naive(data, v -> v != a));
                assertThat(index.compareValue(parallelism, Operation.LTE, a, 0, null))
                        .isEqualTo(naive(data, v -> v <= a));
                assertThat(index.compareValue(parallelism, Operation.GTE, a, 0, null))
                        .isEqualTo(naive(data, v -> v >= a));
                assertThat(index.compareValue(parallelism, Operation.RANGE, a, b, null))
                        .isEqualTo(naive(data, v -> v >= a && v <= b));

                // partition law
                assertThat(eq.getCardinality() + lt.getCardinality() + gt.getCardinality())
                        .isEqualTo(data.size());

                assertThat(index.compareValue(parallelism, Operation.GTE, a, 0, filter))
                        .isEqualTo(RoaringBitmap64.and(naive(data, v -> v >= a), filter));
            }
        }

        // sum wraps like long arithmetic
        long sum = 0;
        long filteredSum = 0;
        for (Map.Entry<Long, Long> entry : data.entrySet()) {
            sum += entry.getValue();
            if (filter.contains(entry.getKey())) {
                filteredSum += entry.getValue();
            }
        }
        assertThat(index.sum(null)).isEqualTo(Pair.of(sum, (long) data.size()));
        assertThat(index.sum(filter).getKey()).isEqualTo(filteredSum);

        // min & max
        long min = Collections.min(values);
        long max = Collections.max(values);
        assertThat(index.minMax(4, MIN, null)).isEqualTo(min);
        assertThat(index.minMax(4, MAX, null)).isEqualTo(max);
        assertThat(index.minMax(0, MAX, null)).isEqualTo(max);

        // batch equal
        long[] targets = new long[10];
        for (int i = 0; i < targets.length; i++) {
            targets[i] = i % 3 == 0 ? random.nextLong() : values.get(random.nextInt(values.size()));
        }
        RoaringBitmap64 expected = new RoaringBitmap64();
        for (long target : targets) {
            expected.or(naive(data, v -> v == target));
        }
        assertThat(index.batchEqual(0, targets)).isEqualTo(expected);
        assertThat(index.batchEqual(4, targets)).isEqualTo(expected);

        // transpose & histogram
        RoaringBitmap64 distinct = new RoaringBitmap64();
        Map<Long, Long> counts = new HashMap<>();
        for (Long value : values) {
            distinct.add(value);
            counts.merge(value, 1L, Long::sum);
        }
        assertThat(index.transpose()).isEqualTo(distinct);
        BitSliceIndex histogram = index.transposeWithCounts(4, null);
        assertThat(histogram).isEqualTo(index.transposeWithCounts(0, null));
        assertThat(histogram.getCardinality()).isEqualTo(counts.size());
        counts.forEach((value, count) -> assertThat(histogram.getValue(value)).isEqualTo(count));

        // top k
        int k = 1 + random.nextInt(50);
        RoaringBitmap64 top = index.topK(k, null, true);
        assertThat(top.getCardinality()).isEqualTo(k);
        Long threshold = index.minMax(0, MIN, top);
        assertThat(index.compareValue(0, Operation.GT, threshold, 0, null).getCardinality())
                .isLessThan(k);

        // parallel merge equals sequential merge
        BitSliceIndex left = index.newBSIRetainSet(filter);
        BitSliceIndex right =
                index.newBSIRetainSet(RoaringBitmap64.andNot(index.getExistenceBitmap(), filter));
        left.parOr(4, right);
        assertThat(left).isEqualTo(index);
    }

    private static BitSliceIndex build(Map<Long, Long> data, Options options) {
        BitSliceIndex index = BitSliceIndex.newDefault(options);
        index.setValues(data);
        return index;
    }

    private static RoaringBitmap64 naive(Map<Long, Long> data, LongPredicate predicate) {
        RoaringBitmap64 result = new RoaringBitmap64();
        data.forEach(
                (row, value) -> {
                    if (predicate.test(value)) {
                        result.add(row);
                    }
                });
        return result;
    }

    private static RoaringBitmap64 range(long from, long to) {
        RoaringBitmap64 result = new RoaringBitmap64();
        for (long i = from; i < to; i++) {
            result.add(i);
        }
        return result;
    }
}
