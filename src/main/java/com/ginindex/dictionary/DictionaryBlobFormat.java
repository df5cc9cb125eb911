package com.ginindex.dictionary;

import com.ginindex.compress.CompressionCodec;
import com.ginindex.storage.CorruptIndexException;
import com.ginindex.storage.VarIntCodec;

import java.io.ByteArrayOutputStream;
import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/**
 * .gin_dict 中单个段词典的 (size, blob) 记录格式。
 *
 * <pre>
 * VarLong  (rawSize << 1) | compressedFlag
 * VarInt   compressedSize      （仅当 compressedFlag = 1）
 * bytes    blob               （压缩或原始 FST 字节）
 * </pre>
 * 原始大小超过阈值时才压缩，rawSize = 0 表示空词典。
 */
public final class DictionaryBlobFormat {
    private static final int COMPRESSED_FLAG = 0x1;

    private final CompressionCodec compressionCodec;
    private final int compressionThresholdBytes;

    public DictionaryBlobFormat(CompressionCodec compressionCodec, int compressionThresholdBytes) {
        if (compressionCodec == null) {
            throw new IllegalArgumentException("压缩编解码器不能为空");
        }
        if (compressionThresholdBytes < 0) {
            throw new IllegalArgumentException("压缩阈值不能为负数: " + compressionThresholdBytes);
        }
        this.compressionCodec = compressionCodec;
        this.compressionThresholdBytes = compressionThresholdBytes;
    }

    /**
     * 判断给定大小的字节块是否会被压缩。
     */
    public boolean shouldCompress(int rawSize) {
        return rawSize > compressionThresholdBytes;
    }

    /**
     * 写出一条词典记录。
     *
     * @param rawBlob FST 原始字节
     * @param out 输出目标
     * @return 写出的字节数
     * @throws IOException 写入失败时抛出
     */
    public long write(byte[] rawBlob, DataOutput out) throws IOException {
        if (rawBlob == null) {
            throw new IllegalArgumentException("词典字节块不能为null");
        }
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        if (shouldCompress(rawBlob.length)) {
            byte[] compressed = compressionCodec.compress(rawBlob);
            VarIntCodec.writeVarLong(((long) rawBlob.length << 1) | COMPRESSED_FLAG, buffer);
            VarIntCodec.writeVarInt(compressed.length, buffer);
            buffer.write(compressed);
        } else {
            VarIntCodec.writeVarLong((long) rawBlob.length << 1, buffer);
            buffer.write(rawBlob);
        }
        byte[] bytes = buffer.toByteArray();
        out.write(bytes);
        return bytes.length;
    }

    /**
     * 读取一条词典记录并按需解压。
     *
     * @param in 输入源，已定位到记录起始位置
     * @param maxBytes 输入源从当前位置起最多可读的字节数
     * @return FST 原始字节
     * @throws CorruptIndexException 头部非法、长度越界或解压失败时抛出
     * @throws IOException 读取失败或数据截断时抛出
     */
    public byte[] read(DataInput in, long maxBytes) throws IOException {
        if (maxBytes < 0) {
            throw new IllegalArgumentException("maxBytes 不能为负数: " + maxBytes);
        }
        long header = VarIntCodec.readVarLong(in);
        boolean compressed = (header & COMPRESSED_FLAG) != 0;
        long rawSize = header >>> 1;
        if (rawSize > Integer.MAX_VALUE) {
            throw new CorruptIndexException("词典大小非法: " + rawSize);
        }
        if (!compressed) {
            if (rawSize > maxBytes) {
                throw new CorruptIndexException("词典长度越界: rawSize=" + rawSize + ", maxBytes=" + maxBytes);
            }
            byte[] raw = new byte[(int) rawSize];
            in.readFully(raw);
            return raw;
        }
        int compressedSize = VarIntCodec.readVarInt(in);
        if (compressedSize > maxBytes) {
            throw new CorruptIndexException("压缩词典长度越界: compressedSize=" + compressedSize + ", maxBytes=" + maxBytes);
        }
        byte[] compressedBlob = new byte[compressedSize];
        in.readFully(compressedBlob);
        return compressionCodec.decompress(compressedBlob, (int) rawSize);
    }
}
