package com.memsegment.segment;

import org.roaringbitmap.IntIterator;
import org.roaringbitmap.RoaringBitmap;
import org.roaringbitmap.buffer.ImmutableRoaringBitmap;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 不可变的内存索引段。
 *
 * <p>由 {@link SegmentBuilder} 一次性构建，构建完成后任何字段都不再修改，
 * 可以在多个读线程间无锁共享。倒排相关数组均以倒排下标（0 起）寻址，
 * 第 N 个频率/归一化值对应成员位图中第 N 小的文档号，
 * 第 N 个位置数对应位置位图中第 N 小的文档号。
 */
public final class Segment {
    /** 身份字段总是最先登记 */
    public static final int IDENTITY_FIELD_ID = 0;

    private final Map<String, Integer> fieldIds;
    private final List<String> fieldNames;
    private final List<Map<String, Integer>> dictionaries;
    private final List<List<String>> terms;

    private final ImmutableRoaringBitmap[] postings;
    private final ImmutableRoaringBitmap[] postingsWithLocations;
    private final int[][] frequencies;
    private final float[][] norms;
    private final int[][] locationCounts;
    private final int[][] locationFields;
    private final int[][] locationStarts;
    private final int[][] locationEnds;
    private final int[][] locationPositions;
    private final int[][][] locationArrayPositions;

    private final List<Map<Integer, List<StoredValue>>> storedValues;
    private final boolean[] docValues;
    private final long sizeInBytes;

    Segment(FieldRegistry registry, PostingsAccumulator accumulator,
            List<Map<Integer, List<StoredValue>>> stored, Set<Integer> docValueFields, long sizeInBytes) {
        int fieldCount = registry.size();
        Map<String, Integer> frozenFieldIds = new HashMap<>();
        List<Map<String, Integer>> frozenDictionaries = new ArrayList<>(fieldCount);
        List<List<String>> frozenTerms = new ArrayList<>(fieldCount);
        for (int fieldId = 0; fieldId < fieldCount; fieldId++) {
            frozenFieldIds.put(registry.fieldName(fieldId), fieldId);
            Map<String, Integer> dictionary = new HashMap<>();
            for (Map.Entry<String, Integer> entry : registry.dictionary(fieldId).entrySet()) {
                dictionary.put(entry.getKey(), entry.getValue() - 1);
            }
            frozenDictionaries.add(Collections.unmodifiableMap(dictionary));
            frozenTerms.add(List.copyOf(registry.termList(fieldId)));
        }
        this.fieldIds = Collections.unmodifiableMap(frozenFieldIds);
        this.fieldNames = List.copyOf(registry.fieldNames());
        this.dictionaries = List.copyOf(frozenDictionaries);
        this.terms = List.copyOf(frozenTerms);

        int postingCount = accumulator.postingCount();
        this.postings = new ImmutableRoaringBitmap[postingCount];
        this.postingsWithLocations = new ImmutableRoaringBitmap[postingCount];
        this.frequencies = new int[postingCount][];
        this.norms = new float[postingCount][];
        this.locationCounts = new int[postingCount][];
        this.locationFields = new int[postingCount][];
        this.locationStarts = new int[postingCount][];
        this.locationEnds = new int[postingCount][];
        this.locationPositions = new int[postingCount][];
        this.locationArrayPositions = new int[postingCount][][];
        for (int index = 0; index < postingCount; index++) {
            postings[index] = freeze(accumulator.postings(index));
            postingsWithLocations[index] = freeze(accumulator.postingsWithLocations(index));
            frequencies[index] = toIntArray(accumulator.frequencies(index));
            norms[index] = toFloatArray(accumulator.norms(index));
            locationCounts[index] = toIntArray(accumulator.locationCounts(index));
            locationFields[index] = toIntArray(accumulator.locationFields(index));
            locationStarts[index] = toIntArray(accumulator.locationStarts(index));
            locationEnds[index] = toIntArray(accumulator.locationEnds(index));
            locationPositions[index] = toIntArray(accumulator.locationPositions(index));
            locationArrayPositions[index] = accumulator.locationArrayPositions(index).toArray(new int[0][]);
        }

        List<Map<Integer, List<StoredValue>>> frozenStored = new ArrayList<>(stored.size());
        for (Map<Integer, List<StoredValue>> documentStored : stored) {
            Map<Integer, List<StoredValue>> frozenDocument = new LinkedHashMap<>();
            documentStored.forEach((fieldId, values) -> frozenDocument.put(fieldId, List.copyOf(values)));
            frozenStored.add(Collections.unmodifiableMap(frozenDocument));
        }
        this.storedValues = List.copyOf(frozenStored);

        this.docValues = new boolean[fieldCount];
        for (int fieldId : docValueFields) {
            docValues[fieldId] = true;
        }
        this.sizeInBytes = sizeInBytes;
    }

    // ==================== 字段 ====================

    /**
     * 查找字段ID，不存在时返回 -1。
     */
    public int fieldId(String name) {
        Integer fieldId = fieldIds.get(name);
        return fieldId == null ? -1 : fieldId;
    }

    public String fieldName(int fieldId) {
        checkFieldId(fieldId);
        return fieldNames.get(fieldId);
    }

    /**
     * 按字段ID顺序排列的字段名。
     */
    public List<String> fields() {
        return fieldNames;
    }

    public int fieldCount() {
        return fieldNames.size();
    }

    // ==================== 词典 ====================

    /**
     * 字段词典：词项到倒排下标（0 起）。
     */
    public Map<String, Integer> termDictionary(int fieldId) {
        checkFieldId(fieldId);
        return dictionaries.get(fieldId);
    }

    /**
     * 按字节序排列的字段词项。
     */
    public List<String> terms(int fieldId) {
        checkFieldId(fieldId);
        return terms.get(fieldId);
    }

    /**
     * 返回词项的倒排下标，不存在时返回 -1。
     */
    public int postingIndex(int fieldId, String term) {
        Integer postingIndex = termDictionary(fieldId).get(term);
        return postingIndex == null ? -1 : postingIndex;
    }

    /**
     * 按字段名获取词典视图，字段不存在时返回空词典。
     */
    public TermDictionary dictionary(String fieldName) {
        return new TermDictionary(this, fieldId(fieldName));
    }

    // ==================== 倒排 ====================

    public int postingCount() {
        return postings.length;
    }

    public ImmutableRoaringBitmap postings(int postingIndex) {
        checkPostingIndex(postingIndex);
        return postings[postingIndex];
    }

    public ImmutableRoaringBitmap postingsWithLocations(int postingIndex) {
        checkPostingIndex(postingIndex);
        return postingsWithLocations[postingIndex];
    }

    public int[] frequencies(int postingIndex) {
        checkPostingIndex(postingIndex);
        return Arrays.copyOf(frequencies[postingIndex], frequencies[postingIndex].length);
    }

    public float[] norms(int postingIndex) {
        checkPostingIndex(postingIndex);
        return Arrays.copyOf(norms[postingIndex], norms[postingIndex].length);
    }

    /**
     * 每个带位置文档的位置条数，按位置位图中的文档号递增排列。
     */
    public int[] locationCounts(int postingIndex) {
        checkPostingIndex(postingIndex);
        return Arrays.copyOf(locationCounts[postingIndex], locationCounts[postingIndex].length);
    }

    public int[] locationFields(int postingIndex) {
        checkPostingIndex(postingIndex);
        return Arrays.copyOf(locationFields[postingIndex], locationFields[postingIndex].length);
    }

    public int[] locationStarts(int postingIndex) {
        checkPostingIndex(postingIndex);
        return Arrays.copyOf(locationStarts[postingIndex], locationStarts[postingIndex].length);
    }

    public int[] locationEnds(int postingIndex) {
        checkPostingIndex(postingIndex);
        return Arrays.copyOf(locationEnds[postingIndex], locationEnds[postingIndex].length);
    }

    public int[] locationPositions(int postingIndex) {
        checkPostingIndex(postingIndex);
        return Arrays.copyOf(locationPositions[postingIndex], locationPositions[postingIndex].length);
    }

    /**
     * 位置记录的数组位置路径，没有路径的记录为 null。
     */
    public int[][] locationArrayPositions(int postingIndex) {
        checkPostingIndex(postingIndex);
        int[][] source = locationArrayPositions[postingIndex];
        int[][] copied = new int[source.length][];
        for (int index = 0; index < source.length; index++) {
            copied[index] = source[index] == null ? null : Arrays.copyOf(source[index], source[index].length);
        }
        return copied;
    }

    /**
     * 获取倒排列表视图。
     */
    public PostingsList postingsList(int postingIndex) {
        checkPostingIndex(postingIndex);
        return new PostingsList(this, postingIndex);
    }

    // ==================== 存储值 ====================

    public int count() {
        return storedValues.size();
    }

    /**
     * 文档某字段的存储值，按组装时追加顺序排列。
     */
    public List<StoredValue> storedValues(int docNum, int fieldId) {
        checkDocNum(docNum);
        List<StoredValue> values = storedValues.get(docNum).get(fieldId);
        return values == null ? List.of() : values;
    }

    /**
     * 按字段ID顺序访问文档的全部存储值，visitor 返回 false 时提前结束。
     */
    public void visitDocument(int docNum, StoredFieldVisitor visitor) {
        checkDocNum(docNum);
        Map<Integer, List<StoredValue>> documentStored = storedValues.get(docNum);
        for (int fieldId = 0; fieldId < fieldNames.size(); fieldId++) {
            List<StoredValue> values = documentStored.get(fieldId);
            if (values == null) {
                continue;
            }
            for (StoredValue value : values) {
                if (!visitor.visit(fieldNames.get(fieldId), value)) {
                    return;
                }
            }
        }
    }

    /**
     * 返回身份字段（字段ID 0）取值属于 ids 的文档号集合。
     */
    public RoaringBitmap docNumbers(String... ids) {
        RoaringBitmap result = new RoaringBitmap();
        if (fieldNames.isEmpty()) {
            return result;
        }
        for (String id : ids) {
            int postingIndex = postingIndex(IDENTITY_FIELD_ID, id);
            if (postingIndex < 0) {
                continue;
            }
            IntIterator docIterator = postings[postingIndex].getIntIterator();
            while (docIterator.hasNext()) {
                result.add(docIterator.next());
            }
        }
        return result;
    }

    // ==================== doc-values ====================

    public boolean hasDocValues(int fieldId) {
        checkFieldId(fieldId);
        return docValues[fieldId];
    }

    /**
     * 请求了 doc-values 的字段名，按字段ID顺序排列。
     */
    public List<String> docValueFields() {
        List<String> names = new ArrayList<>();
        for (int fieldId = 0; fieldId < docValues.length; fieldId++) {
            if (docValues[fieldId]) {
                names.add(fieldNames.get(fieldId));
            }
        }
        return names;
    }

    // ==================== 元数据 ====================

    public long sizeInBytes() {
        return sizeInBytes;
    }

    public int termCount() {
        int termCount = 0;
        for (List<String> fieldTerms : terms) {
            termCount += fieldTerms.size();
        }
        return termCount;
    }

    public SegmentStats stats(String segmentId) {
        return new SegmentStats(segmentId, count(), fieldCount(), postingCount(), termCount(), sizeInBytes, Instant.now());
    }

    int rawFrequency(int postingIndex, int ordinalInPostings) {
        return frequencies[postingIndex][ordinalInPostings];
    }

    float rawNorm(int postingIndex, int ordinalInPostings) {
        return norms[postingIndex][ordinalInPostings];
    }

    ImmutableRoaringBitmap rawPostings(int postingIndex) {
        return postings[postingIndex];
    }

    ImmutableRoaringBitmap rawPostingsWithLocations(int postingIndex) {
        return postingsWithLocations[postingIndex];
    }

    int rawLocationCount(int postingIndex, int entryIndex) {
        return locationCounts[postingIndex][entryIndex];
    }

    Location rawLocation(int postingIndex, int locationIndex) {
        int[] arrayPositions = locationArrayPositions[postingIndex][locationIndex];
        return new Location(
            locationFields[postingIndex][locationIndex],
            locationStarts[postingIndex][locationIndex],
            locationEnds[postingIndex][locationIndex],
            locationPositions[postingIndex][locationIndex],
            arrayPositions);
    }

    private void checkFieldId(int fieldId) {
        if (fieldId < 0 || fieldId >= fieldNames.size()) {
            throw new IllegalArgumentException("字段ID越界: " + fieldId + ", fieldCount=" + fieldNames.size());
        }
    }

    private void checkPostingIndex(int postingIndex) {
        if (postingIndex < 0 || postingIndex >= postings.length) {
            throw new IllegalArgumentException("倒排下标越界: " + postingIndex + ", postingCount=" + postings.length);
        }
    }

    private void checkDocNum(int docNum) {
        if (docNum < 0 || docNum >= storedValues.size()) {
            throw new IllegalArgumentException("文档号越界: " + docNum + ", count=" + storedValues.size());
        }
    }

    /**
     * 序列化到只读缓冲区，返回的位图不与构建期位图共享存储。
     */
    private static ImmutableRoaringBitmap freeze(RoaringBitmap bitmap) {
        ByteBuffer buffer = ByteBuffer.allocate(bitmap.serializedSizeInBytes());
        bitmap.serialize(buffer);
        buffer.flip();
        return new ImmutableRoaringBitmap(buffer.asReadOnlyBuffer());
    }

    private static int[] toIntArray(List<Integer> values) {
        int[] result = new int[values.size()];
        for (int index = 0; index < result.length; index++) {
            result[index] = values.get(index);
        }
        return result;
    }

    private static float[] toFloatArray(List<Float> values) {
        float[] result = new float[values.size()];
        for (int index = 0; index < result.length; index++) {
            result[index] = values.get(index);
        }
        return result;
    }
}
