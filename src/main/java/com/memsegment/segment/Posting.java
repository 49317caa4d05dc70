package com.memsegment.segment;

import java.util.List;

/**
 * 倒排项：文档号、词频、归一化值与该文档内的位置记录。
 */
public record Posting(int docNum, int frequency, float norm, List<Location> locations) {

    public Posting {
        locations = locations == null ? List.of() : List.copyOf(locations);
    }
}
