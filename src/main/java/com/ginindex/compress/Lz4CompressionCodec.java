package com.ginindex.compress;

import com.ginindex.storage.CorruptIndexException;
import net.jpountz.lz4.LZ4Compressor;
import net.jpountz.lz4.LZ4Exception;
import net.jpountz.lz4.LZ4Factory;
import net.jpountz.lz4.LZ4SafeDecompressor;

/**
 * 基于 lz4-java 的块压缩实现，压缩端使用 fast 模式，解压端使用 safe 解压器。
 */
public final class Lz4CompressionCodec implements CompressionCodec {
    public static final Lz4CompressionCodec INSTANCE = new Lz4CompressionCodec();

    /** LZ4 块格式每个输入字节最多展开为 255 字节 */
    private static final long MAX_EXPANSION_RATIO = 255L;

    private final LZ4Compressor compressor;
    private final LZ4SafeDecompressor decompressor;

    private Lz4CompressionCodec() {
        LZ4Factory factory = LZ4Factory.fastestInstance();
        this.compressor = factory.fastCompressor();
        this.decompressor = factory.safeDecompressor();
    }

    @Override
    public String name() {
        return "lz4";
    }

    @Override
    public byte[] compress(byte[] raw) {
        if (raw == null) {
            throw new IllegalArgumentException("待压缩数据不能为null");
        }
        return compressor.compress(raw);
    }

    @Override
    public byte[] decompress(byte[] compressed, int expectedSize) throws CorruptIndexException {
        if (compressed == null) {
            throw new IllegalArgumentException("压缩数据不能为null");
        }
        if (expectedSize < 0 || expectedSize > compressed.length * MAX_EXPANSION_RATIO + 16) {
            throw new CorruptIndexException("解压目标长度非法: expected=" + expectedSize
                + ", compressedSize=" + compressed.length);
        }
        byte[] restored = new byte[expectedSize];
        int restoredLength;
        try {
            restoredLength = decompressor.decompress(compressed, 0, compressed.length, restored, 0, expectedSize);
        } catch (LZ4Exception exception) {
            throw new CorruptIndexException("LZ4 解压失败: compressedSize=" + compressed.length, exception);
        }
        if (restoredLength != expectedSize) {
            throw new CorruptIndexException("LZ4 解压长度不符: expected=" + expectedSize + ", actual=" + restoredLength);
        }
        return restored;
    }
}
