package com.ginindex.postings;

import com.ginindex.config.Constants;
import com.ginindex.storage.CorruptIndexException;
import com.ginindex.storage.DeltaCodec;
import com.ginindex.storage.VarIntCodec;
import org.roaringbitmap.RoaringBitmap;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInput;
import java.io.DataInputStream;
import java.io.DataOutput;
import java.io.DataOutputStream;
import java.io.IOException;

/**
 * 倒排列表编解码，按 {@link PostingsEncoding} 分派到各格式的编码与解码函数。
 *
 * 磁盘格式：VarLong 头 {@code (payload << 2) | tag}，随后是负载数据。
 * <ul>
 *   <li>ARRAY：payload 为行ID个数，随后是 Delta+VarInt 编码的递增行ID</li>
 *   <li>BITMAP / COMPRESSED_BITMAP：payload 为位图字节数，随后是 RoaringBitmap 可移植序列化格式</li>
 * </ul>
 */
final class PostingsCodec {

    private PostingsCodec() {
        // 工具类，禁止实例化
    }

    /**
     * 按基数选择编码；超过压缩阈值时比较 run 压缩前后的大小，取较小者。
     */
    static PostingsEncoding chooseEncoding(RoaringBitmap rowIds) {
        int cardinality = rowIds.getCardinality();
        if (cardinality < Constants.MIN_SIZE_FOR_BITMAP_ENCODING) {
            return PostingsEncoding.ARRAY;
        }
        if (cardinality <= Constants.BITMAP_COMPRESSION_CARDINALITY_THRESHOLD) {
            return PostingsEncoding.BITMAP;
        }
        RoaringBitmap plain = withoutRuns(rowIds);
        RoaringBitmap runOptimized = rowIds.clone();
        runOptimized.runOptimize();
        return runOptimized.serializedSizeInBytes() < plain.serializedSizeInBytes()
            ? PostingsEncoding.COMPRESSED_BITMAP
            : PostingsEncoding.BITMAP;
    }

    /**
     * 编码并写出倒排列表。
     *
     * @param rowIds 行ID集合
     * @param out 输出目标
     * @return 写出的字节数
     * @throws IOException 写入失败时抛出
     */
    static long encode(RoaringBitmap rowIds, DataOutput out) throws IOException {
        PostingsEncoding encoding = chooseEncoding(rowIds);
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        switch (encoding) {
            case ARRAY -> encodeArray(rowIds, buffer);
            case BITMAP -> encodeBitmap(withoutRuns(rowIds), PostingsEncoding.BITMAP, buffer);
            case COMPRESSED_BITMAP -> encodeBitmap(withRuns(rowIds), PostingsEncoding.COMPRESSED_BITMAP, buffer);
        }
        byte[] bytes = buffer.toByteArray();
        out.write(bytes);
        return bytes.length;
    }

    /**
     * 读取并解码一个倒排列表。
     *
     * 头部声明的长度在分配内存前与剩余字节数比较，超出即视为损坏。
     *
     * @param in 输入源，已定位到倒排列表起始位置
     * @param maxBytes 输入源从当前位置起最多可读的字节数
     * @return 解码后的倒排列表
     * @throws CorruptIndexException 标记未知、长度越界或负载损坏时抛出
     * @throws IOException 读取失败或数据截断时抛出
     */
    static PostingsList decode(DataInput in, long maxBytes) throws IOException {
        long header = VarIntCodec.readVarLong(in);
        PostingsEncoding encoding = PostingsEncoding.fromTag((int) (header & PostingsEncoding.TAG_MASK));
        long payload = header >>> PostingsEncoding.TAG_BITS;
        if (payload > Integer.MAX_VALUE || payload > maxBytes) {
            throw new CorruptIndexException("倒排负载长度越界: payload=" + payload + ", maxBytes=" + maxBytes
                + ", encoding=" + encoding);
        }
        if (encoding == PostingsEncoding.ARRAY && payload >= Constants.MIN_SIZE_FOR_BITMAP_ENCODING) {
            throw new CorruptIndexException("数组编码的行ID个数非法: " + payload);
        }
        RoaringBitmap rowIds = switch (encoding) {
            case ARRAY -> decodeArray((int) payload, in);
            case BITMAP, COMPRESSED_BITMAP -> decodeBitmap((int) payload, in);
        };
        return new PostingsList(rowIds, encoding);
    }

    private static void encodeArray(RoaringBitmap rowIds, ByteArrayOutputStream buffer) throws IOException {
        int[] sortedRowIds = rowIds.toArray();
        VarIntCodec.writeVarLong(header(sortedRowIds.length, PostingsEncoding.ARRAY), buffer);
        DeltaCodec.encodeDeltaVarInt(sortedRowIds, buffer);
    }

    private static void encodeBitmap(RoaringBitmap bitmap, PostingsEncoding encoding, ByteArrayOutputStream buffer)
            throws IOException {
        ByteArrayOutputStream bitmapBytes = new ByteArrayOutputStream(bitmap.serializedSizeInBytes());
        bitmap.serialize(new DataOutputStream(bitmapBytes));
        VarIntCodec.writeVarLong(header(bitmapBytes.size(), encoding), buffer);
        bitmapBytes.writeTo(buffer);
    }

    private static RoaringBitmap decodeArray(int count, DataInput in) throws IOException {
        return RoaringBitmap.bitmapOf(DeltaCodec.decodeDeltaVarInt(count, in));
    }

    private static RoaringBitmap decodeBitmap(int byteLength, DataInput in) throws IOException {
        byte[] bytes = new byte[byteLength];
        in.readFully(bytes);
        RoaringBitmap bitmap = new RoaringBitmap();
        try (DataInputStream bitmapInput = new DataInputStream(new ByteArrayInputStream(bytes))) {
            bitmap.deserialize(bitmapInput);
            if (bitmapInput.available() != 0) {
                throw new CorruptIndexException("位图负载包含未解析字节: remaining=" + bitmapInput.available());
            }
        } catch (CorruptIndexException exception) {
            throw exception;
        } catch (IOException | RuntimeException exception) {
            throw new CorruptIndexException("位图反序列化失败: byteLength=" + byteLength, exception);
        }
        return bitmap;
    }

    private static long header(int payload, PostingsEncoding encoding) {
        return ((long) payload << PostingsEncoding.TAG_BITS) | encoding.tag();
    }

    private static RoaringBitmap withoutRuns(RoaringBitmap rowIds) {
        if (!rowIds.hasRunCompression()) {
            return rowIds;
        }
        RoaringBitmap plain = rowIds.clone();
        plain.removeRunCompression();
        return plain;
    }

    private static RoaringBitmap withRuns(RoaringBitmap rowIds) {
        RoaringBitmap runOptimized = rowIds.clone();
        runOptimized.runOptimize();
        return runOptimized;
    }
}
