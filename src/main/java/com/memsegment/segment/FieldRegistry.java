package com.memsegment.segment;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 构建期字段登记表：字段名与稠密字段ID的双向映射，以及按字段ID下标的词典和词项列表。
 *
 * <p>四个结构总是同步增长，字段ID即为它们的下标。词典中的倒排序号从 1 开始。
 */
final class FieldRegistry {
    private final Map<String, Integer> fieldIds = new HashMap<>();
    private final List<String> fieldNames = new ArrayList<>();
    private final List<Map<String, Integer>> dictionaries = new ArrayList<>();
    private final List<List<String>> termLists = new ArrayList<>();

    /**
     * 返回已登记字段的ID，未登记时分配下一个ID。
     */
    int resolveOrDefine(String name) {
        Integer existing = fieldIds.get(name);
        if (existing != null) {
            return existing;
        }
        int fieldId = fieldNames.size();
        fieldIds.put(name, fieldId);
        fieldNames.add(name);
        dictionaries.add(new HashMap<>());
        termLists.add(new ArrayList<>());
        return fieldId;
    }

    /**
     * 查找字段ID，未登记时返回 -1。
     */
    int fieldId(String name) {
        Integer fieldId = fieldIds.get(name);
        return fieldId == null ? -1 : fieldId;
    }

    String fieldName(int fieldId) {
        return fieldNames.get(fieldId);
    }

    int size() {
        return fieldNames.size();
    }

    List<String> fieldNames() {
        return fieldNames;
    }

    /**
     * 返回词项的倒排序号（从 1 开始），不存在时返回 0。
     */
    int ordinal(int fieldId, String term) {
        Integer ordinal = dictionaries.get(fieldId).get(term);
        return ordinal == null ? 0 : ordinal;
    }

    /**
     * 登记词项，已存在时返回 false 且不做任何修改。
     */
    boolean defineTerm(int fieldId, String term, int ordinal) {
        Map<String, Integer> dictionary = dictionaries.get(fieldId);
        if (dictionary.containsKey(term)) {
            return false;
        }
        dictionary.put(term, ordinal);
        termLists.get(fieldId).add(term);
        return true;
    }

    Map<String, Integer> dictionary(int fieldId) {
        return dictionaries.get(fieldId);
    }

    List<String> termList(int fieldId) {
        return termLists.get(fieldId);
    }

    /**
     * 按字节序排序每个字段的词项列表，倒排序号不受影响。
     */
    void sortTermLists() {
        for (List<String> termList : termLists) {
            termList.sort(TermOrder.BYTE_ORDER);
        }
    }

    void checkConsistency() {
        int names = fieldNames.size();
        if (fieldIds.size() != names || dictionaries.size() != names || termLists.size() != names) {
            throw new SegmentBuildException(SegmentBuildException.Kind.REGISTRY_INCONSISTENT,
                "字段登记表尺寸不一致: map=" + fieldIds.size() + ", names=" + names
                    + ", dictionaries=" + dictionaries.size() + ", termLists=" + termLists.size());
        }
    }
}
