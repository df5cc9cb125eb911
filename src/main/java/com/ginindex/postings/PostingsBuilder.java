package com.ginindex.postings;

import org.roaringbitmap.RoaringBitmap;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/**
 * 单个词项在当前段内的倒排构建器，累积行ID集合并在段落盘时编码写出。
 *
 * 非线程安全，由持有当前段的唯一写入方使用。
 */
public final class PostingsBuilder {
    private final RoaringBitmap rowIds = new RoaringBitmap();

    /**
     * 检查行ID是否已经加入。
     *
     * @param rowId 行ID
     * @return 已加入返回true
     */
    public boolean contains(int rowId) {
        return rowIds.contains(rowId);
    }

    /**
     * 加入行ID，重复加入为空操作。
     *
     * @param rowId 非负行ID
     */
    public void add(int rowId) {
        if (rowId < 0) {
            throw new IllegalArgumentException("行ID不能为负数: " + rowId);
        }
        rowIds.add(rowId);
    }

    public int cardinality() {
        return rowIds.getCardinality();
    }

    /**
     * 按自适应策略编码并写出累积的行ID集合。
     *
     * @param out 输出目标
     * @return 写出的字节数
     * @throws IOException 写入失败时抛出
     */
    public long serialize(DataOutput out) throws IOException {
        return PostingsCodec.encode(rowIds, out);
    }

    /**
     * 从输入源读取一个由 {@link #serialize(DataOutput)} 写出的倒排列表。
     *
     * @param in 输入源，已定位到倒排列表起始位置
     * @param maxBytes 输入源从当前位置起最多可读的字节数
     * @return 解码后的倒排列表
     * @throws IOException 格式损坏或读取失败时抛出
     */
    public static PostingsList deserialize(DataInput in, long maxBytes) throws IOException {
        if (maxBytes < 0) {
            throw new IllegalArgumentException("maxBytes 不能为负数: " + maxBytes);
        }
        return PostingsCodec.decode(in, maxBytes);
    }
}
