package com.memsegment.segment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单个字段的词典视图，词项按字节序排列。
 */
public final class TermDictionary {
    private final Segment segment;
    private final int fieldId;

    TermDictionary(Segment segment, int fieldId) {
        this.segment = segment;
        this.fieldId = fieldId;
    }

    public boolean exists() {
        return fieldId >= 0;
    }

    public List<String> terms() {
        return exists() ? segment.terms(fieldId) : List.of();
    }

    public int size() {
        return terms().size();
    }

    /**
     * 词项对应的倒排列表，词项不存在时返回空列表。
     */
    public PostingsList postingsList(String term) {
        if (!exists()) {
            return PostingsList.empty();
        }
        int postingIndex = segment.postingIndex(fieldId, term);
        return postingIndex < 0 ? PostingsList.empty() : segment.postingsList(postingIndex);
    }

    public List<String> prefixTerms(String prefix) {
        List<String> result = new ArrayList<>();
        for (String term : terms().subList(lowerBound(prefix), size())) {
            if (!term.startsWith(prefix)) {
                break;
            }
            result.add(term);
        }
        return result;
    }

    /**
     * 区间 [start, end) 内的词项，任一端为 null 表示不设界。
     */
    public List<String> rangeTerms(String start, String end) {
        List<String> sortedTerms = terms();
        int from = start == null ? 0 : lowerBound(start);
        int to = end == null ? sortedTerms.size() : lowerBound(end);
        if (from >= to) {
            return List.of();
        }
        return List.copyOf(sortedTerms.subList(from, to));
    }

    private int lowerBound(String term) {
        int index = Collections.binarySearch(terms(), term, TermOrder.BYTE_ORDER);
        return index >= 0 ? index : -index - 1;
    }
}
