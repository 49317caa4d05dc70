package com.memsegment.segment;

import com.memsegment.analysis.AnalysisResult;
import com.memsegment.analysis.AnalyzedField;
import com.memsegment.analysis.TokenFrequencies;
import com.memsegment.analysis.TokenFrequency;
import com.memsegment.analysis.TokenLocation;
import com.memsegment.document.CompositeField;
import com.memsegment.document.Field;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 第二遍扫描：逐文档写入倒排、词频、归一化值、位置、存储值与 doc-values 标记。
 *
 * <p>文档号由本类按调用顺序连续分配，因此各追加序列与成员位图的递增顺序天然对齐。
 * 不允许乱序或并行调用 {@link #assemble(AnalysisResult)}。
 */
final class DocumentAssembler {
    private final FieldRegistry registry;
    private final PostingsAccumulator postings;
    private final List<Map<Integer, List<StoredValue>>> storedValues = new ArrayList<>();
    private final TreeSet<Integer> docValueFields = new TreeSet<>();

    DocumentAssembler(FieldRegistry registry, PostingsAccumulator postings) {
        this.registry = registry;
        this.postings = postings;
    }

    /**
     * 组装一篇文档并返回其文档号。
     */
    int assemble(AnalysisResult result) {
        int docNum = storedValues.size();
        Map<Integer, List<StoredValue>> documentStored = new LinkedHashMap<>();
        storedValues.add(documentStored);

        FieldCollation collation = new FieldCollation();
        for (CompositeField compositeField : result.document().compositeFields()) {
            int fieldId = registry.resolveOrDefine(compositeField.name());
            AnalyzedField analyzed = compositeField.analyze();
            collation.add(fieldId, compositeField.name(), analyzed.length(), analyzed.frequencies());
        }

        List<Field> fields = result.document().fields();
        for (int fieldIndex = 0; fieldIndex < fields.size(); fieldIndex++) {
            Field field = fields.get(fieldIndex);
            int fieldId = registry.resolveOrDefine(field.name());
            collation.add(fieldId, field.name(), result.length(fieldIndex), result.frequencies(fieldIndex));

            if (field.options().stored()) {
                documentStored.computeIfAbsent(fieldId, key -> new ArrayList<>())
                    .add(new StoredValue(field.kind().tag(), field.value(), field.arrayPositions()));
            }
            if (field.options().includeDocValues()) {
                docValueFields.add(fieldId);
            }
        }

        for (Map.Entry<Integer, TokenFrequencies> entry : collation.frequencies.entrySet()) {
            int fieldId = entry.getKey();
            float norm = (float) (1.0 / Math.sqrt(collation.lengths.get(fieldId)));
            for (TokenFrequency tokenFrequency : entry.getValue().values()) {
                addPosting(docNum, fieldId, norm, tokenFrequency);
            }
        }
        return docNum;
    }

    int documentCount() {
        return storedValues.size();
    }

    List<Map<Integer, List<StoredValue>>> storedValues() {
        return storedValues;
    }

    TreeSet<Integer> docValueFields() {
        return docValueFields;
    }

    private void addPosting(int docNum, int fieldId, float norm, TokenFrequency tokenFrequency) {
        int ordinal = registry.ordinal(fieldId, tokenFrequency.term());
        if (ordinal == 0) {
            throw new SegmentBuildException(SegmentBuildException.Kind.MISSING_POSTING,
                "词典中缺少倒排序号: field=" + registry.fieldName(fieldId)
                    + ", term=" + tokenFrequency.term() + ", docNum=" + docNum);
        }
        int postingIndex = ordinal - 1;
        postings.addDocument(postingIndex, docNum, tokenFrequency.frequency(), norm);

        if (tokenFrequency.locations().isEmpty()) {
            return;
        }
        postings.markLocations(postingIndex, docNum, tokenFrequency.locations().size());
        for (TokenLocation location : tokenFrequency.locations()) {
            int locationField = fieldId;
            if (location.field() != null && !location.field().isEmpty()) {
                locationField = registry.resolveOrDefine(location.field());
            }
            postings.addLocation(postingIndex, locationField, location);
        }
    }

    /**
     * 单篇文档内按字段ID汇总的词频表与词项总数。
     */
    private static final class FieldCollation {
        private final Map<Integer, TokenFrequencies> frequencies = new TreeMap<>();
        private final Map<Integer, Integer> lengths = new HashMap<>();

        private void add(int fieldId, String fieldName, int length, TokenFrequencies fieldFrequencies) {
            lengths.merge(fieldId, length, Integer::sum);
            TokenFrequencies existing = frequencies.get(fieldId);
            if (existing == null) {
                frequencies.put(fieldId, fieldFrequencies.copy());
            } else {
                existing.mergeAll(fieldName, fieldFrequencies);
            }
        }
    }
}
