package com.ginindex.postings;

import com.ginindex.storage.CorruptIndexException;

/**
 * 倒排列表的序列化格式，2 位标记：
 * <ul>
 *   <li>bit0：1 表示有序数组，0 表示位图</li>
 *   <li>bit1：仅对位图有意义，1 表示 run 压缩容器，0 表示原始容器</li>
 * </ul>
 * 数组 + 压缩（0b11）不是合法组合，读取时视为格式损坏。
 */
public enum PostingsEncoding {
    BITMAP(0b00),
    ARRAY(0b01),
    COMPRESSED_BITMAP(0b10);

    static final int ARRAY_CONTAINER_MASK = 0b01;
    static final int COMPRESSED_MASK = 0b10;
    static final int TAG_BITS = 2;
    static final int TAG_MASK = (1 << TAG_BITS) - 1;

    private final int tag;

    PostingsEncoding(int tag) {
        this.tag = tag;
    }

    public int tag() {
        return tag;
    }

    public boolean isBitmap() {
        return (tag & ARRAY_CONTAINER_MASK) == 0;
    }

    public boolean isCompressed() {
        return (tag & COMPRESSED_MASK) != 0;
    }

    /**
     * 按标记位解析格式。
     *
     * @param tag 2 位标记
     * @return 对应格式
     * @throws CorruptIndexException 标记未知时抛出
     */
    public static PostingsEncoding fromTag(int tag) throws CorruptIndexException {
        return switch (tag) {
            case 0b00 -> BITMAP;
            case 0b01 -> ARRAY;
            case 0b10 -> COMPRESSED_BITMAP;
            default -> throw new CorruptIndexException("未知倒排编码标记: 0b" + Integer.toBinaryString(tag));
        };
    }
}
