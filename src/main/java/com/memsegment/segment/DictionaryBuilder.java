package com.memsegment.segment;

import com.memsegment.analysis.AnalysisResult;
import com.memsegment.analysis.TokenFrequencies;
import com.memsegment.document.CompositeField;
import com.memsegment.document.Field;

import java.util.List;

/**
 * 第一遍扫描：为每个首次出现的 (字段, 词项) 分配倒排序号，并按最终数量预分配倒排数组。
 *
 * <p>按批次顺序扫描文档，文档内先扫描组合字段，再扫描常规字段。序号全局递增，从 1 开始。
 * 本遍不写入任何文档级数据。
 */
final class DictionaryBuilder {
    private final FieldRegistry registry;
    private int postingCount;

    DictionaryBuilder(FieldRegistry registry) {
        this.registry = registry;
    }

    PostingsAccumulator build(List<AnalysisResult> batch) {
        for (AnalysisResult result : batch) {
            for (CompositeField compositeField : result.document().compositeFields()) {
                int fieldId = registry.resolveOrDefine(compositeField.name());
                defineTerms(fieldId, compositeField.analyze().frequencies());
            }

            List<Field> fields = result.document().fields();
            for (int fieldIndex = 0; fieldIndex < fields.size(); fieldIndex++) {
                int fieldId = registry.resolveOrDefine(fields.get(fieldIndex).name());
                defineTerms(fieldId, result.frequencies(fieldIndex));
            }
        }
        registry.checkConsistency();
        return PostingsAccumulator.allocate(postingCount);
    }

    int postingCount() {
        return postingCount;
    }

    private void defineTerms(int fieldId, TokenFrequencies frequencies) {
        for (String term : frequencies.terms()) {
            if (registry.ordinal(fieldId, term) == 0) {
                registry.defineTerm(fieldId, term, ++postingCount);
            }
        }
    }
}
