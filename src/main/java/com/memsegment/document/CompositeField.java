package com.memsegment.document;

import com.memsegment.analysis.AnalyzedField;
import com.memsegment.analysis.TokenFrequencies;

import java.util.List;
import java.util.Set;

/**
 * 组合字段：将若干常规字段的分词结果以一个字段名汇总。
 *
 * <p>包含列表为空时接收除排除列表外的全部字段；排除列表优先。
 * 汇总过程中的词频按词项累加，位置信息标记其来源字段。
 */
public final class CompositeField {
    private final String name;
    private final Set<String> includedFields;
    private final Set<String> excludedFields;
    private final FieldOptions options;
    private final TokenFrequencies compositeFrequencies = new TokenFrequencies();
    private int totalLength;

    public CompositeField(String name, List<String> includedFields, List<String> excludedFields, FieldOptions options) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("组合字段名不能为空");
        }
        this.name = name;
        this.includedFields = includedFields == null ? Set.of() : Set.copyOf(includedFields);
        this.excludedFields = excludedFields == null ? Set.of() : Set.copyOf(excludedFields);
        this.options = options == null ? FieldOptions.INDEX_ONLY : options;
    }

    /**
     * 创建包含除排除列表外所有字段的组合字段。
     */
    public static CompositeField allExcept(String name, String... excludedFields) {
        return new CompositeField(name, List.of(), List.of(excludedFields), FieldOptions.INDEX_ONLY);
    }

    public static CompositeField including(String name, String... includedFields) {
        return new CompositeField(name, List.of(includedFields), List.of(), FieldOptions.INDEX_ONLY);
    }

    public String name() {
        return name;
    }

    public FieldOptions options() {
        return options;
    }

    public FieldKind kind() {
        return FieldKind.COMPOSITE;
    }

    public boolean includesField(String fieldName) {
        if (excludedFields.contains(fieldName)) {
            return false;
        }
        return includedFields.isEmpty() || includedFields.contains(fieldName);
    }

    /**
     * 汇入一个常规字段的分词结果，不接收的字段直接忽略。
     */
    public void compose(String fieldName, int length, TokenFrequencies frequencies) {
        if (!includesField(fieldName)) {
            return;
        }
        totalLength += length;
        compositeFrequencies.mergeAll(fieldName, frequencies);
    }

    /**
     * 返回当前汇总的词项总数与词频表副本。
     */
    public AnalyzedField analyze() {
        return new AnalyzedField(totalLength, compositeFrequencies.copy());
    }

    /**
     * 复制字段定义，不携带已汇总的数据。
     */
    public CompositeField emptyCopy() {
        return new CompositeField(name, List.copyOf(includedFields), List.copyOf(excludedFields), options);
    }
}
