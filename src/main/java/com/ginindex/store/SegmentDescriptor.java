package com.ginindex.store;

import com.ginindex.config.Constants;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * 段描述符，.gin_seg 中的定长记录（大端，24 字节）。
 *
 * @param segmentId 段ID，来自 .gin_sid 的下一个可用值
 * @param nextRowId 段落盘时第一个尚未分配的行ID，即段行号区间的开区间上界
 * @param postingsStartOffset 段倒排在 .gin_post 中的起始偏移
 * @param dictStartOffset 段词典在 .gin_dict 中的起始偏移
 */
public record SegmentDescriptor(int segmentId, int nextRowId, long postingsStartOffset, long dictStartOffset) {
    public static final int BYTES = Constants.SEGMENT_DESCRIPTOR_BYTES;

    /**
     * 返回替换 nextRowId 后的新描述符。
     */
    SegmentDescriptor withNextRowId(int newNextRowId) {
        return new SegmentDescriptor(segmentId, newNextRowId, postingsStartOffset, dictStartOffset);
    }

    /**
     * 整条记录一次写出。
     */
    void writeTo(DataOutput out) throws IOException {
        ByteBuffer record = ByteBuffer.allocate(BYTES)
            .putInt(segmentId)
            .putInt(nextRowId)
            .putLong(postingsStartOffset)
            .putLong(dictStartOffset);
        out.write(record.array());
    }

    static SegmentDescriptor readFrom(DataInput in) throws IOException {
        int segmentId = in.readInt();
        int nextRowId = in.readInt();
        long postingsStartOffset = in.readLong();
        long dictStartOffset = in.readLong();
        return new SegmentDescriptor(segmentId, nextRowId, postingsStartOffset, dictStartOffset);
    }
}
