package com.ginindex.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;

/**
 * 索引存储运行时配置
 *
 * 支持从CLI参数或JSON配置文件注入，覆盖Constants默认值
 */
public class StoreConfig {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private long segmentDigestionThresholdBytes = Constants.UNLIMITED_SEGMENT_DIGESTION_THRESHOLD_BYTES;
    private int dictionaryCompressionThresholdBytes = Constants.FST_SIZE_COMPRESSION_THRESHOLD;

    public long getSegmentDigestionThresholdBytes() {
        return segmentDigestionThresholdBytes;
    }

    public void setSegmentDigestionThresholdBytes(long segmentDigestionThresholdBytes) {
        if (segmentDigestionThresholdBytes < 0) {
            throw new IllegalArgumentException("分段消化阈值不能为负数: " + segmentDigestionThresholdBytes);
        }
        this.segmentDigestionThresholdBytes = segmentDigestionThresholdBytes;
    }

    public int getDictionaryCompressionThresholdBytes() {
        return dictionaryCompressionThresholdBytes;
    }

    public void setDictionaryCompressionThresholdBytes(int dictionaryCompressionThresholdBytes) {
        if (dictionaryCompressionThresholdBytes < 0) {
            throw new IllegalArgumentException("词典压缩阈值不能为负数: " + dictionaryCompressionThresholdBytes);
        }
        this.dictionaryCompressionThresholdBytes = dictionaryCompressionThresholdBytes;
    }

    /**
     * 是否不限制分段大小（阈值为 0）。
     */
    @JsonIgnore
    public boolean isUnlimitedDigestion() {
        return segmentDigestionThresholdBytes == Constants.UNLIMITED_SEGMENT_DIGESTION_THRESHOLD_BYTES;
    }

    /**
     * 使用默认配置创建实例
     */
    public static StoreConfig defaults() {
        return new StoreConfig();
    }

    /**
     * 使用指定分段消化阈值创建实例。
     *
     * @param segmentDigestionThresholdBytes 阈值字节数，0 表示不限制
     * @return 配置实例
     */
    public static StoreConfig withDigestionThreshold(long segmentDigestionThresholdBytes) {
        StoreConfig config = new StoreConfig();
        config.setSegmentDigestionThresholdBytes(segmentDigestionThresholdBytes);
        return config;
    }

    /**
     * 从 JSON 配置文件读取配置，缺省字段保留默认值。
     *
     * @param file 配置文件
     * @return 配置实例
     * @throws IOException 读取或解析失败时抛出
     */
    public static StoreConfig readFrom(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("配置文件不能为空");
        }
        try {
            return OBJECT_MAPPER.readValue(file, StoreConfig.class);
        } catch (IOException exception) {
            throw new IOException("读取存储配置失败: " + file.getAbsolutePath(), exception);
        }
    }

    /**
     * 将当前配置写入 JSON 文件。
     *
     * @param file 配置文件
     * @throws IOException 写入失败时抛出
     */
    public void writeTo(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("配置文件不能为空");
        }
        try {
            OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(file, this);
        } catch (IOException exception) {
            throw new IOException("写入存储配置失败: " + file.getAbsolutePath(), exception);
        }
    }
}
