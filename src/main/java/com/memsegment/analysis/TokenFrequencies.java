package com.memsegment.analysis;

import com.memsegment.text.Token;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 一个字段的词频表，按词项首次出现顺序迭代。
 */
public final class TokenFrequencies {
    private final Map<String, TokenFrequency> frequencies = new LinkedHashMap<>();

    /**
     * 由分词结果构建词频表。
     *
     * @param tokens 分词结果
     * @param arrayPositions 字段的数组位置路径
     * @param includeLocations 是否记录位置信息
     */
    public static TokenFrequencies fromTokens(List<Token> tokens, int[] arrayPositions, boolean includeLocations) {
        TokenFrequencies result = new TokenFrequencies();
        for (Token token : tokens) {
            if (includeLocations) {
                result.addOccurrence(token.term(), new TokenLocation(
                    null, token.startOffset(), token.endOffset(), token.position(), arrayPositions));
            } else {
                result.addCount(token.term(), 1);
            }
        }
        return result;
    }

    public void addOccurrence(String term, TokenLocation location) {
        TokenFrequency existing = frequencies.get(term);
        List<TokenLocation> locations = new ArrayList<>();
        int count = 1;
        if (existing != null) {
            locations.addAll(existing.locations());
            count += existing.count();
        }
        locations.add(location);
        frequencies.put(term, new TokenFrequency(term, locations, count));
    }

    public void addCount(String term, int count) {
        TokenFrequency existing = frequencies.get(term);
        if (existing == null) {
            frequencies.put(term, new TokenFrequency(term, List.of(), count));
        } else {
            frequencies.put(term, new TokenFrequency(term, existing.locations(), existing.count() + count));
        }
    }

    /**
     * 合并另一个字段的词频表：相同词项词频相加、位置拼接，新词项追加在末尾。
     * 对方的位置信息一律标记为 remoteField。
     */
    public void mergeAll(String remoteField, TokenFrequencies other) {
        for (TokenFrequency incoming : other.frequencies.values()) {
            TokenFrequency existing = frequencies.get(incoming.term());
            if (existing == null) {
                frequencies.put(incoming.term(), incoming.withField(remoteField));
            } else {
                frequencies.put(incoming.term(), existing.merge(remoteField, incoming));
            }
        }
    }

    public TokenFrequency get(String term) {
        return frequencies.get(term);
    }

    public Set<String> terms() {
        return frequencies.keySet();
    }

    public Collection<TokenFrequency> values() {
        return frequencies.values();
    }

    public int size() {
        return frequencies.size();
    }

    public boolean isEmpty() {
        return frequencies.isEmpty();
    }

    public TokenFrequencies copy() {
        TokenFrequencies copied = new TokenFrequencies();
        copied.frequencies.putAll(frequencies);
        return copied;
    }

    @Override
    public String toString() {
        return "TokenFrequencies" + frequencies.keySet();
    }
}
