package com.ginindex.storage;

import java.io.DataInput;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;

/**
 * VarInt变长整数编解码器
 *
 * 编码规则：每字节7位有效数据，最高位为续接标志
 * - 最高位为1：表示后续还有字节
 * - 最高位为0：表示这是最后一个字节
 *
 * 倒排头、词典头与行ID增量均使用该编码
 */
public final class VarIntCodec {

    private VarIntCodec() {
        // 工具类，禁止实例化
    }

    /**
     * 将int值编码为VarInt并写入输出流
     *
     * @param value 要编码的值（必须非负）
     * @param out 输出流
     * @throws IOException IO异常
     * @throws IllegalArgumentException 如果value为负数
     */
    public static void writeVarInt(int value, OutputStream out) throws IOException {
        if (value < 0) {
            throw new IllegalArgumentException("VarInt不支持负数: " + value);
        }

        while ((value & ~0x7F) != 0) {
            out.write((value & 0x7F) | 0x80);
            value >>>= 7;
        }
        out.write(value & 0x7F);
    }

    /**
     * 从DataInput读取VarInt并解码为int
     *
     * 与流式读取不同，这里遇到EOF直接视为文件截断
     *
     * @param in 输入源（随机访问文件或数据流）
     * @return 解码后的值
     * @throws EOFException 数据被截断时抛出
     * @throws CorruptIndexException VarInt超过32位范围时抛出
     */
    public static int readVarInt(DataInput in) throws IOException {
        int result = 0;
        int shift = 0;

        while (shift < 32) {
            int b = in.readUnsignedByte();
            result |= (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                if (result < 0) {
                    throw new CorruptIndexException("VarInt解码结果为负数: " + result);
                }
                return result;
            }
            shift += 7;
        }

        throw new CorruptIndexException("VarInt超过32位范围");
    }

    /**
     * 将long值编码为VarLong并写入输出流
     *
     * @param value 要编码的值（必须非负）
     * @param out 输出流
     * @throws IOException IO异常
     * @throws IllegalArgumentException 如果value为负数
     */
    public static void writeVarLong(long value, OutputStream out) throws IOException {
        if (value < 0) {
            throw new IllegalArgumentException("VarLong不支持负数: " + value);
        }

        while ((value & ~0x7FL) != 0) {
            out.write((int) ((value & 0x7F) | 0x80));
            value >>>= 7;
        }
        out.write((int) (value & 0x7F));
    }

    /**
     * 从DataInput读取VarLong并解码为long
     *
     * @param in 输入源
     * @return 解码后的值
     * @throws EOFException 数据被截断时抛出
     * @throws CorruptIndexException VarLong超过64位范围时抛出
     */
    public static long readVarLong(DataInput in) throws IOException {
        long result = 0;
        int shift = 0;

        while (shift < 64) {
            int b = in.readUnsignedByte();
            result |= (long) (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                if (result < 0) {
                    throw new CorruptIndexException("VarLong解码结果为负数: " + result);
                }
                return result;
            }
            shift += 7;
        }

        throw new CorruptIndexException("VarLong超过64位范围");
    }

    /**
     * 计算int值编码为VarInt所需的字节数
     *
     * @param value 要编码的值（必须非负）
     * @return 所需字节数
     * @throws IllegalArgumentException 如果value为负数
     */
    public static int varIntSize(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("VarInt不支持负数: " + value);
        }

        int size = 1;
        while ((value & ~0x7F) != 0) {
            size++;
            value >>>= 7;
        }
        return size;
    }
}
