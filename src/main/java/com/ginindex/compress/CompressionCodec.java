package com.ginindex.compress;

import java.io.IOException;

/**
 * 通用字节块压缩编解码器，用于压缩体积较大的词典 FST。
 *
 * 实现必须保证 {@code decompress(compress(x), x.length)} 与 {@code x} 逐字节一致。
 */
public interface CompressionCodec {

    /**
     * 编解码器名称，用于日志。
     */
    String name();

    byte[] compress(byte[] raw);

    /**
     * 解压缩数据。
     *
     * @param compressed 压缩数据
     * @param expectedSize 原始数据长度
     * @return 原始数据
     * @throws IOException 数据损坏或长度不符时抛出
     */
    byte[] decompress(byte[] compressed, int expectedSize) throws IOException;
}
