package com.memsegment.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memsegment.config.Constants;
import com.memsegment.config.SegmentConfig;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 从 JSON 批次文件读取文档。
 *
 * <pre>
 * [{"id": "a",
 *   "fields": [{"name": "body", "kind": "text", "value": "cat dog", "store": true}],
 *   "composites": [{"name": "_all", "excludes": ["_id"]}]}]
 * </pre>
 *
 * 未声明的字段选项取默认值：参与倒排、存储、不请求 doc-values，
 * 是否记录位置信息取决于 {@link SegmentConfig#isIncludeTermVectors()}。
 */
public final class BatchReader {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final SegmentConfig config;

    public BatchReader(SegmentConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config不能为null");
        }
        this.config = config;
    }

    /**
     * 读取批次文件。
     *
     * @param file JSON 批次文件
     * @return 按文件顺序排列的文档
     * @throws IOException 读取或解析失败时抛出
     */
    public List<Document> read(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("批次文件不能为空");
        }
        try {
            return toDocuments(OBJECT_MAPPER.readValue(file, new TypeReference<List<DocumentEntry>>() { }));
        } catch (IOException exception) {
            throw new IOException("读取批次文件失败: " + file.getAbsolutePath(), exception);
        }
    }

    public List<Document> readString(String json) throws IOException {
        return toDocuments(OBJECT_MAPPER.readValue(json, new TypeReference<List<DocumentEntry>>() { }));
    }

    private List<Document> toDocuments(List<DocumentEntry> entries) {
        if (entries == null) {
            return List.of();
        }
        if (entries.size() > Constants.MAX_BATCH_DOCUMENTS) {
            throw new IllegalArgumentException("批次文档数超过上限: " + entries.size() + " > " + Constants.MAX_BATCH_DOCUMENTS);
        }
        List<Document> documents = new ArrayList<>(entries.size());
        for (DocumentEntry entry : entries) {
            documents.add(toDocument(entry));
        }
        return documents;
    }

    private Document toDocument(DocumentEntry entry) {
        List<Field> fields = new ArrayList<>();
        if (entry.fields() != null) {
            for (FieldEntry fieldEntry : entry.fields()) {
                fields.add(toField(fieldEntry));
            }
        }
        List<CompositeField> composites = new ArrayList<>();
        if (entry.composites() != null) {
            for (CompositeEntry compositeEntry : entry.composites()) {
                composites.add(new CompositeField(compositeEntry.name(), compositeEntry.includes(),
                    compositeEntry.excludes(), FieldOptions.INDEX_ONLY));
            }
        }
        return new Document(entry.id(), fields, composites);
    }

    private Field toField(FieldEntry entry) {
        FieldOptions options = new FieldOptions(
            valueOrDefault(entry.index(), true),
            valueOrDefault(entry.store(), true),
            valueOrDefault(entry.termVectors(), config.isIncludeTermVectors()),
            valueOrDefault(entry.docValues(), false));
        return Field.of(entry.name(), FieldKind.fromName(entry.kind()), options, entry.value(), entry.arrayPositions());
    }

    private static boolean valueOrDefault(Boolean value, boolean defaultValue) {
        return value == null ? defaultValue : value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DocumentEntry(String id, List<FieldEntry> fields, List<CompositeEntry> composites) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FieldEntry(String name, String kind, String value, Boolean index, Boolean store,
                      Boolean termVectors, Boolean docValues, int[] arrayPositions) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CompositeEntry(String name, List<String> includes, List<String> excludes) {
    }
}
