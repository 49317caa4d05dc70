package com.memsegment.analysis;

import com.memsegment.document.Document;

import java.util.List;

/**
 * 文档的预分析结果，lengths 与 analyzed 按下标对齐文档的常规字段序列。
 *
 * @param document 源文档
 * @param lengths 每个常规字段的词项总数
 * @param analyzed 每个常规字段的词频表
 */
public record AnalysisResult(Document document, List<Integer> lengths, List<TokenFrequencies> analyzed) {

    public AnalysisResult {
        if (document == null) {
            throw new IllegalArgumentException("文档不能为null");
        }
        if (lengths == null || analyzed == null) {
            throw new IllegalArgumentException("lengths与analyzed不能为null");
        }
        int fieldCount = document.fields().size();
        if (lengths.size() != fieldCount || analyzed.size() != fieldCount) {
            throw new IllegalArgumentException("分析结果与字段数不一致: fields=" + fieldCount
                + ", lengths=" + lengths.size() + ", analyzed=" + analyzed.size());
        }
        lengths = List.copyOf(lengths);
        analyzed = List.copyOf(analyzed);
    }

    public int length(int fieldIndex) {
        return lengths.get(fieldIndex);
    }

    public TokenFrequencies frequencies(int fieldIndex) {
        return analyzed.get(fieldIndex);
    }
}
