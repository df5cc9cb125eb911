package com.ginindex.postings;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.ginindex.config.Constants;
import com.ginindex.storage.CorruptIndexException;
import com.ginindex.storage.VarIntCodec;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * 倒排构建器与自适应编码测试。
 */
class PostingsBuilderTest {

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 15, 16, 100, 4999, 5000, 5001, 100000})
    @DisplayName("各基数下序列化后读取得到同一行ID集合")
    void testRoundTripAcrossCardinalities(int cardinality) throws IOException {
        Random random = new Random(cardinality);
        TreeSet<Integer> expected = new TreeSet<>();
        PostingsBuilder builder = new PostingsBuilder();
        while (expected.size() < cardinality) {
            int rowId = random.nextInt(cardinality * 8 + 1) + 1;
            expected.add(rowId);
            builder.add(rowId);
        }

        byte[] bytes = serialize(builder);
        DataInputStream in = input(bytes);
        PostingsList restored = PostingsBuilder.deserialize(in, bytes.length);

        int[] expectedIds = expected.stream().mapToInt(Integer::intValue).toArray();
        assertArrayEquals(expectedIds, restored.toArray());
        assertEquals(cardinality, restored.cardinality());
        assertEquals(-1, in.read(), "倒排列表之后不应有多余字节");
    }

    @Test
    void testEncodingByCardinality() throws IOException {
        assertEquals(PostingsEncoding.ARRAY, roundTrip(range(1, 15)).encoding());
        assertEquals(PostingsEncoding.BITMAP, roundTrip(range(1, 16)).encoding());
        assertEquals(PostingsEncoding.BITMAP, roundTrip(range(1, 5000)).encoding());
        assertEquals(PostingsEncoding.COMPRESSED_BITMAP, roundTrip(range(1, 5001)).encoding());
    }

    @Test
    @DisplayName("稀疏大集合 run 压缩无收益时保持原始位图")
    void testSparseLargeSetStaysPlainBitmap() throws IOException {
        PostingsBuilder builder = new PostingsBuilder();
        for (int rowId = 1; builder.cardinality() < 6000; rowId += 3) {
            builder.add(rowId);
        }

        PostingsList restored = deserialize(serialize(builder));

        assertEquals(PostingsEncoding.BITMAP, restored.encoding());
        assertEquals(6000, restored.cardinality());
    }

    @Test
    void testArrayLayout() throws IOException {
        PostingsBuilder builder = new PostingsBuilder();
        builder.add(3);
        builder.add(1);
        builder.add(3);

        byte[] bytes = serialize(builder);

        // header = (2 << 2) | 0b01，随后是 1 与增量 2
        assertArrayEquals(new byte[] {0x09, 0x01, 0x02}, bytes);
        assertTrue(builder.contains(3));
        assertFalse(builder.contains(2));
    }

    @Test
    void testEmptyBuilderWritesZeroLengthArray() throws IOException {
        byte[] bytes = serialize(new PostingsBuilder());

        assertArrayEquals(new byte[] {0x01}, bytes);
        PostingsList restored = deserialize(bytes);
        assertTrue(restored.isEmpty());
    }

    @Test
    void testNegativeRowIdRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PostingsBuilder().add(-1));
    }

    @Test
    @DisplayName("标记 0b11 视为格式损坏")
    void testUnknownTagIsCorrupt() throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        VarIntCodec.writeVarLong((1L << 2) | 0b11, buffer);
        buffer.write(1);

        assertThrows(CorruptIndexException.class, () -> deserialize(buffer.toByteArray()));
    }

    @Test
    void testTruncatedArrayFails() throws IOException {
        byte[] bytes = serialize(builderOf(range(1, 10)));
        byte[] truncated = Arrays.copyOf(bytes, bytes.length - 3);

        // 可读上限按完整长度给出，数据在中途结束
        assertThrows(EOFException.class, () -> PostingsBuilder.deserialize(input(truncated), bytes.length));
    }

    @Test
    @DisplayName("位图长度超过剩余字节时视为损坏")
    void testTruncatedBitmapIsCorrupt() throws IOException {
        byte[] bytes = serialize(builderOf(range(1, 100)));
        byte[] truncated = Arrays.copyOf(bytes, bytes.length / 2);

        assertThrows(CorruptIndexException.class, () -> deserialize(truncated));
    }

    @Test
    @DisplayName("声明超大长度的位图头在分配内存前被拒绝")
    void testOversizedBitmapHeaderIsCorrupt() throws IOException {
        for (PostingsEncoding encoding : List.of(PostingsEncoding.BITMAP, PostingsEncoding.COMPRESSED_BITMAP)) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            VarIntCodec.writeVarLong(((long) (Integer.MAX_VALUE - 8) << 2) | encoding.tag(), buffer);
            buffer.write(new byte[] {1, 2, 3, 4});

            assertThrows(CorruptIndexException.class, () -> deserialize(buffer.toByteArray()));
        }
    }

    @Test
    @DisplayName("数组编码的行ID个数超过剩余字节或达到位图阈值时视为损坏")
    void testOversizedArrayCountIsCorrupt() throws IOException {
        ByteArrayOutputStream huge = new ByteArrayOutputStream();
        VarIntCodec.writeVarLong(((long) (Integer.MAX_VALUE - 8) << 2) | PostingsEncoding.ARRAY.tag(), huge);
        huge.write(new byte[] {1, 1, 1});
        assertThrows(CorruptIndexException.class, () -> deserialize(huge.toByteArray()));

        ByteArrayOutputStream atThreshold = new ByteArrayOutputStream();
        VarIntCodec.writeVarLong(((long) Constants.MIN_SIZE_FOR_BITMAP_ENCODING << 2) | PostingsEncoding.ARRAY.tag(),
            atThreshold);
        for (int index = 0; index < Constants.MIN_SIZE_FOR_BITMAP_ENCODING; index++) {
            atThreshold.write(1);
        }
        assertThrows(CorruptIndexException.class, () -> deserialize(atThreshold.toByteArray()));
    }

    @Test
    void testNegativeMaxBytesRejected() {
        assertThrows(IllegalArgumentException.class, () -> PostingsBuilder.deserialize(input(new byte[] {0x01}), -1));
    }

    @Test
    void testGarbageBitmapPayloadIsCorrupt() throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        VarIntCodec.writeVarLong((8L << 2) | PostingsEncoding.BITMAP.tag(), buffer);
        buffer.write(new byte[] {0x7F, 0x7F, 0x7F, 0x7F, 0x7F, 0x7F, 0x7F, 0x7F});

        assertThrows(CorruptIndexException.class, () -> deserialize(buffer.toByteArray()));
    }

    @Test
    void testUnionRechoosesEncoding() throws IOException {
        PostingsList first = roundTrip(range(1, 10));
        PostingsList second = roundTrip(range(11, 20));

        PostingsList merged = PostingsList.union(List.of(first, second));

        assertEquals(20, merged.cardinality());
        assertEquals(PostingsEncoding.BITMAP, merged.encoding());
        assertTrue(merged.contains(11));
        assertFalse(merged.contains(21));
        assertTrue(merged.intersectsRange(5, 5));
        assertFalse(merged.intersectsRange(21, 100));
        assertFalse(merged.intersectsRange(10, 9));
        assertEquals(roundTrip(range(1, 20)), merged);
    }

    @Test
    void testEncodingFlags() throws CorruptIndexException {
        assertTrue(PostingsEncoding.BITMAP.isBitmap());
        assertFalse(PostingsEncoding.ARRAY.isBitmap());
        assertTrue(PostingsEncoding.COMPRESSED_BITMAP.isBitmap());
        assertTrue(PostingsEncoding.COMPRESSED_BITMAP.isCompressed());
        assertFalse(PostingsEncoding.BITMAP.isCompressed());
        for (PostingsEncoding encoding : PostingsEncoding.values()) {
            assertEquals(encoding, PostingsEncoding.fromTag(encoding.tag()));
        }
    }

    private static PostingsList roundTrip(int[] rowIds) throws IOException {
        return deserialize(serialize(builderOf(rowIds)));
    }

    private static PostingsBuilder builderOf(int[] rowIds) {
        PostingsBuilder builder = new PostingsBuilder();
        for (int rowId : rowIds) {
            builder.add(rowId);
        }
        return builder;
    }

    private static int[] range(int firstInclusive, int lastInclusive) {
        int[] rowIds = new int[lastInclusive - firstInclusive + 1];
        for (int index = 0; index < rowIds.length; index++) {
            rowIds[index] = firstInclusive + index;
        }
        return rowIds;
    }

    private static byte[] serialize(PostingsBuilder builder) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        long written = builder.serialize(new DataOutputStream(buffer));
        assertEquals(buffer.size(), written);
        return buffer.toByteArray();
    }

    private static PostingsList deserialize(byte[] bytes) throws IOException {
        return PostingsBuilder.deserialize(input(bytes), bytes.length);
    }

    private static DataInputStream input(byte[] bytes) {
        return new DataInputStream(new ByteArrayInputStream(bytes));
    }
}
