package com.memsegment.segment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.File;
import java.io.IOException;
import java.time.Instant;

/**
 * 段统计信息，描述段的基础规模与内存占用。
 */
public record SegmentStats(
    String segmentId,
    int docCount,
    int fieldCount,
    int postingCount,
    int termCount,
    long sizeBytes,
    Instant createTime
) {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * 序列化为格式化 JSON 文本。
     *
     * @return JSON 文本
     * @throws IOException 序列化失败时抛出
     */
    public String toJson() throws IOException {
        return OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(this);
    }

    /**
     * 将当前段统计写入指定 JSON 文件。
     *
     * @param file 统计文件
     * @throws IOException 写入失败时抛出
     */
    public void writeTo(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("统计文件不能为空");
        }
        try {
            OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(file, this);
        } catch (IOException exception) {
            throw new IOException("写入段统计失败: " + file.getAbsolutePath(), exception);
        }
    }

    /**
     * 从指定 JSON 文件读取段统计。
     *
     * @param file 统计文件
     * @return 反序列化后的段统计
     * @throws IOException 读取或解析失败时抛出
     */
    public static SegmentStats readFrom(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("统计文件不能为空");
        }
        try {
            return OBJECT_MAPPER.readValue(file, SegmentStats.class);
        } catch (IOException exception) {
            throw new IOException("读取段统计失败: " + file.getAbsolutePath(), exception);
        }
    }
}
