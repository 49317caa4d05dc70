package com.memsegment.segment;

import com.memsegment.config.Constants;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 估算段的常驻内存字节数，仅作为元数据，不影响正确性。
 */
final class SegmentSizeEstimator {

    private SegmentSizeEstimator() {
    }

    static long estimate(FieldRegistry registry, PostingsAccumulator postings,
                         List<Map<Integer, List<StoredValue>>> stored, Set<Integer> docValueFields) {
        return Constants.SIZE_OF_OBJECT_HEADER
            + estimateRegistry(registry)
            + estimatePostings(postings)
            + estimateStored(stored)
            + (long) docValueFields.size() * Constants.SIZE_OF_INT
            + Constants.SIZE_OF_ARRAY_HEADER + registry.size();
    }

    private static long estimateRegistry(FieldRegistry registry) {
        long bytes = 0;
        for (int fieldId = 0; fieldId < registry.size(); fieldId++) {
            // 名称映射条目 + 反向列表引用 + 词典与词项列表对象
            bytes += Constants.SIZE_OF_MAP_ENTRY + stringSize(registry.fieldName(fieldId)) + Constants.SIZE_OF_REFERENCE;
            bytes += 2L * Constants.SIZE_OF_OBJECT_HEADER;
            for (String term : registry.termList(fieldId)) {
                bytes += Constants.SIZE_OF_MAP_ENTRY + stringSize(term) + Constants.SIZE_OF_REFERENCE + Constants.SIZE_OF_INT;
            }
        }
        return bytes;
    }

    private static long estimatePostings(PostingsAccumulator postings) {
        long bytes = 0;
        for (int index = 0; index < postings.postingCount(); index++) {
            bytes += postings.postings(index).getLongSizeInBytes();
            bytes += postings.postingsWithLocations(index).getLongSizeInBytes();
            bytes += arraySize(postings.frequencies(index).size(), Constants.SIZE_OF_INT);
            bytes += arraySize(postings.norms(index).size(), Constants.SIZE_OF_FLOAT);
            bytes += arraySize(postings.locationCounts(index).size(), Constants.SIZE_OF_INT);
            int locationCount = postings.locationFields(index).size();
            bytes += 4L * arraySize(locationCount, Constants.SIZE_OF_INT);
            bytes += arraySize(locationCount, Constants.SIZE_OF_REFERENCE);
            for (int[] arrayPositions : postings.locationArrayPositions(index)) {
                if (arrayPositions != null) {
                    bytes += arraySize(arrayPositions.length, Constants.SIZE_OF_INT);
                }
            }
        }
        return bytes;
    }

    private static long estimateStored(List<Map<Integer, List<StoredValue>>> stored) {
        long bytes = arraySize(stored.size(), Constants.SIZE_OF_REFERENCE);
        for (Map<Integer, List<StoredValue>> documentStored : stored) {
            bytes += Constants.SIZE_OF_OBJECT_HEADER;
            for (List<StoredValue> values : documentStored.values()) {
                bytes += Constants.SIZE_OF_MAP_ENTRY;
                for (StoredValue value : values) {
                    bytes += Constants.SIZE_OF_OBJECT_HEADER + 1
                        + arraySize(value.valueLength(), 1)
                        + arraySize(value.arrayPositionsLength(), Constants.SIZE_OF_INT);
                }
            }
        }
        return bytes;
    }

    private static long arraySize(int length, int elementSize) {
        return Constants.SIZE_OF_ARRAY_HEADER + (long) length * elementSize;
    }

    private static long stringSize(String value) {
        return Constants.SIZE_OF_STRING + (long) value.length() * Character.BYTES;
    }
}
