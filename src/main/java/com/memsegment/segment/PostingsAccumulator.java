package com.memsegment.segment;

import com.memsegment.analysis.TokenLocation;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.List;

/**
 * 构建期倒排并行数组，按倒排下标（序号 - 1）寻址。
 *
 * <p>槽位数在第一遍结束时确定并一次性分配；各序列在组装时按文档号递增顺序追加，
 * 第 N 个频率/归一化值对应成员位图中第 N 小的文档号，
 * 第 N 个位置数对应位置位图中第 N 小的文档号。
 */
final class PostingsAccumulator {
    private final RoaringBitmap[] postings;
    private final RoaringBitmap[] postingsWithLocations;
    private final List<List<Integer>> frequencies;
    private final List<List<Float>> norms;
    private final List<List<Integer>> locationCounts;
    private final List<List<Integer>> locationFields;
    private final List<List<Integer>> locationStarts;
    private final List<List<Integer>> locationEnds;
    private final List<List<Integer>> locationPositions;
    private final List<List<int[]>> locationArrayPositions;

    private PostingsAccumulator(int postingCount) {
        this.postings = new RoaringBitmap[postingCount];
        this.postingsWithLocations = new RoaringBitmap[postingCount];
        this.frequencies = new ArrayList<>(postingCount);
        this.norms = new ArrayList<>(postingCount);
        this.locationCounts = new ArrayList<>(postingCount);
        this.locationFields = new ArrayList<>(postingCount);
        this.locationStarts = new ArrayList<>(postingCount);
        this.locationEnds = new ArrayList<>(postingCount);
        this.locationPositions = new ArrayList<>(postingCount);
        this.locationArrayPositions = new ArrayList<>(postingCount);
        for (int index = 0; index < postingCount; index++) {
            postings[index] = new RoaringBitmap();
            postingsWithLocations[index] = new RoaringBitmap();
            frequencies.add(new ArrayList<>());
            norms.add(new ArrayList<>());
            locationCounts.add(new ArrayList<>());
            locationFields.add(new ArrayList<>());
            locationStarts.add(new ArrayList<>());
            locationEnds.add(new ArrayList<>());
            locationPositions.add(new ArrayList<>());
            locationArrayPositions.add(new ArrayList<>());
        }
    }

    static PostingsAccumulator allocate(int postingCount) {
        if (postingCount < 0) {
            throw new IllegalArgumentException("倒排数量不能为负数: " + postingCount);
        }
        return new PostingsAccumulator(postingCount);
    }

    int postingCount() {
        return postings.length;
    }

    void addDocument(int postingIndex, int docNum, int frequency, float norm) {
        postings[postingIndex].add(docNum);
        frequencies.get(postingIndex).add(frequency);
        norms.get(postingIndex).add(norm);
    }

    /**
     * 标记文档在该倒排中带有位置信息，并记录其位置条数。
     */
    void markLocations(int postingIndex, int docNum, int locationCount) {
        postingsWithLocations[postingIndex].add(docNum);
        locationCounts.get(postingIndex).add(locationCount);
    }

    /**
     * 追加一条位置记录，没有数组位置路径时追加 null 作为缺省标记。
     */
    void addLocation(int postingIndex, int fieldId, TokenLocation location) {
        locationFields.get(postingIndex).add(fieldId);
        locationStarts.get(postingIndex).add(location.start());
        locationEnds.get(postingIndex).add(location.end());
        locationPositions.get(postingIndex).add(location.position());
        locationArrayPositions.get(postingIndex).add(location.hasArrayPositions() ? location.arrayPositions() : null);
    }

    void runOptimize() {
        for (int index = 0; index < postings.length; index++) {
            postings[index].runOptimize();
            postingsWithLocations[index].runOptimize();
        }
    }

    RoaringBitmap postings(int postingIndex) {
        return postings[postingIndex];
    }

    RoaringBitmap postingsWithLocations(int postingIndex) {
        return postingsWithLocations[postingIndex];
    }

    List<Integer> frequencies(int postingIndex) {
        return frequencies.get(postingIndex);
    }

    List<Float> norms(int postingIndex) {
        return norms.get(postingIndex);
    }

    List<Integer> locationCounts(int postingIndex) {
        return locationCounts.get(postingIndex);
    }

    List<Integer> locationFields(int postingIndex) {
        return locationFields.get(postingIndex);
    }

    List<Integer> locationStarts(int postingIndex) {
        return locationStarts.get(postingIndex);
    }

    List<Integer> locationEnds(int postingIndex) {
        return locationEnds.get(postingIndex);
    }

    List<Integer> locationPositions(int postingIndex) {
        return locationPositions.get(postingIndex);
    }

    List<int[]> locationArrayPositions(int postingIndex) {
        return locationArrayPositions.get(postingIndex);
    }
}
