package com.memsegment.analysis;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个词项在一个字段内的词频与位置信息。
 *
 * <p>词频总是取 count。合并后位置数可能少于词频：只有部分来源记录了位置信息。
 */
public record TokenFrequency(String term, List<TokenLocation> locations, int count) {

    public TokenFrequency {
        if (term == null) {
            throw new IllegalArgumentException("词项不能为null");
        }
        locations = locations == null ? List.of() : List.copyOf(locations);
        if (count < locations.size()) {
            throw new IllegalArgumentException("词频小于位置数: count=" + count + ", locations=" + locations.size());
        }
    }

    public int frequency() {
        return count;
    }

    /**
     * 与另一份词频合并，对方的位置信息标记为来源字段。
     */
    TokenFrequency merge(String remoteField, TokenFrequency other) {
        List<TokenLocation> mergedLocations = new ArrayList<>(locations.size() + other.locations.size());
        mergedLocations.addAll(locations);
        for (TokenLocation location : other.locations) {
            mergedLocations.add(location.withField(remoteField));
        }
        return new TokenFrequency(term, mergedLocations, count + other.count);
    }

    TokenFrequency withField(String remoteField) {
        if (locations.isEmpty()) {
            return this;
        }
        List<TokenLocation> tagged = new ArrayList<>(locations.size());
        for (TokenLocation location : locations) {
            tagged.add(location.withField(remoteField));
        }
        return new TokenFrequency(term, tagged, count);
    }
}
