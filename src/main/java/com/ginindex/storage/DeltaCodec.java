package com.ginindex.storage;

import java.io.DataInput;
import java.io.IOException;
import java.io.OutputStream;

/**
 * 行ID Delta编码器
 *
 * 用于压缩严格递增的行ID序列（小基数倒排的数组形式）。
 * 第一个值保持原样，其余写入与前一个值的差值，配合VarInt编码。
 *
 * 示例：[10, 15, 20, 25] -> [10, 5, 5, 5]
 */
public final class DeltaCodec {

    private DeltaCodec() {
        // 工具类，禁止实例化
    }

    /**
     * Delta编码 + VarInt组合编码，直接写入输出流
     *
     * @param sortedRowIds 非负严格递增序列
     * @param out 输出流
     * @throws IOException IO异常
     * @throws IllegalArgumentException 如果输入非严格递增
     */
    public static void encodeDeltaVarInt(int[] sortedRowIds, OutputStream out) throws IOException {
        if (sortedRowIds == null) {
            throw new IllegalArgumentException("输入数组不能为null");
        }
        if (sortedRowIds.length == 0) {
            return;
        }
        if (sortedRowIds[0] < 0) {
            throw new IllegalArgumentException("行ID不能为负数: " + sortedRowIds[0]);
        }

        VarIntCodec.writeVarInt(sortedRowIds[0], out);
        for (int i = 1; i < sortedRowIds.length; i++) {
            if (sortedRowIds[i] <= sortedRowIds[i - 1]) {
                throw new IllegalArgumentException(
                    "输入必须是严格递增序列，在位置 " + i + " 处违反"
                );
            }
            VarIntCodec.writeVarInt(sortedRowIds[i] - sortedRowIds[i - 1], out);
        }
    }

    /**
     * 读取Delta+VarInt编码的数据并解码
     *
     * @param count 期望读取的值数量
     * @param in 输入源
     * @return 解码后的原始序列
     * @throws IOException 数据截断或增量非法时抛出
     */
    public static int[] decodeDeltaVarInt(int count, DataInput in) throws IOException {
        if (count <= 0) {
            return new int[0];
        }

        int[] values = new int[count];
        values[0] = VarIntCodec.readVarInt(in);
        for (int i = 1; i < count; i++) {
            int delta = VarIntCodec.readVarInt(in);
            if (delta == 0) {
                throw new CorruptIndexException("行ID增量为0，序列未严格递增，位置 " + i);
            }
            long value = (long) values[i - 1] + delta;
            if (value > Integer.MAX_VALUE) {
                throw new CorruptIndexException("行ID溢出，位置 " + i + ", value=" + value);
            }
            values[i] = (int) value;
        }
        return values;
    }
}
