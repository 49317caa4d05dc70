package com.memsegment.analysis;

/**
 * 一个字段的分析结果：词项总数与词频表。
 */
public record AnalyzedField(int length, TokenFrequencies frequencies) {

    public AnalyzedField {
        if (length < 0) {
            throw new IllegalArgumentException("字段长度不能为负数: " + length);
        }
        if (frequencies == null) {
            throw new IllegalArgumentException("词频表不能为null");
        }
    }
}
