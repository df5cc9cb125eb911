package com.ginindex.config;

/**
 * 全局常量定义
 *
 * 包含索引文件后缀、文件格式版本、倒排编码阈值与分段参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 索引文件 ====================
    /** 段ID文件后缀：版本号 + 下一个可用段ID */
    public static final String GIN_SEGMENT_ID_FILE_TYPE = ".gin_sid";
    /** 段元数据文件后缀：定长段描述符数组 */
    public static final String GIN_SEGMENT_METADATA_FILE_TYPE = ".gin_seg";
    /** 词典文件后缀：(size, FST) 序列 */
    public static final String GIN_DICTIONARY_FILE_TYPE = ".gin_dict";
    /** 倒排文件后缀：倒排列表序列 */
    public static final String GIN_POSTINGS_FILE_TYPE = ".gin_post";
    /** 当前文件格式版本号 */
    public static final byte CURRENT_FORMAT_VERSION = 1;
    /** 段ID文件长度：1字节版本 + 4字节段ID */
    public static final int SEGMENT_ID_FILE_BYTES = Byte.BYTES + Integer.BYTES;
    /** 段描述符定长记录大小 */
    public static final int SEGMENT_DESCRIPTOR_BYTES = Integer.BYTES * 2 + Long.BYTES * 2;

    // ==================== 倒排编码参数 ====================
    /** 基数低于该值时使用有序数组编码 */
    public static final int MIN_SIZE_FOR_BITMAP_ENCODING = 16;
    /** 基数超过该值时尝试 run 压缩容器 */
    public static final int BITMAP_COMPRESSION_CARDINALITY_THRESHOLD = 5000;

    // ==================== 分段参数 ====================
    /** 不限制分段消化阈值，仅在 finalize 时落盘 */
    public static final long UNLIMITED_SEGMENT_DIGESTION_THRESHOLD_BYTES = 0L;
    /** FST 超过 100KiB 时才值得压缩 */
    public static final int FST_SIZE_COMPRESSION_THRESHOLD = 100 * 1024;
    /** 第一个段ID */
    public static final int FIRST_SEGMENT_ID = 1;
    /** 第一个行ID */
    public static final int FIRST_ROW_ID = 1;
}
