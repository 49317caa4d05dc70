package com.memsegment.document;

import com.memsegment.config.SegmentConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchReaderTest {

    @TempDir
    Path tempDir;

    private final BatchReader reader = new BatchReader(SegmentConfig.defaults());

    @Test
    @DisplayName("解析字段、选项与组合字段")
    void testReadString() throws IOException {
        String json = """
            [{"id": "a",
              "fields": [
                {"name": "body", "kind": "text", "value": "cat dog"},
                {"name": "price", "kind": "number", "value": 42, "docValues": true, "store": false},
                {"name": "tags", "value": "red", "arrayPositions": [1]}
              ],
              "composites": [{"name": "_all", "excludes": ["_id"]}]}]
            """;

        List<Document> documents = reader.readString(json);

        assertEquals(1, documents.size());
        Document document = documents.get(0);
        assertEquals("a", document.id());
        assertEquals(3, document.fields().size());

        Field body = document.fields().get(0);
        assertEquals(FieldKind.TEXT, body.kind());
        assertEquals(FieldOptions.DEFAULT, body.options());

        Field price = document.fields().get(1);
        assertEquals(FieldKind.NUMERIC, price.kind());
        assertEquals("42", price.valueAsString());
        assertFalse(price.options().stored());
        assertTrue(price.options().includeDocValues());

        assertArrayEquals(new int[] {1}, document.fields().get(2).arrayPositions());

        CompositeField composite = document.compositeFields().get(0);
        assertEquals("_all", composite.name());
        assertFalse(composite.includesField("_id"));
        assertTrue(composite.includesField("body"));
    }

    @Test
    @DisplayName("位置信息默认值来自配置")
    void testTermVectorsDefaultFromConfig() throws IOException {
        SegmentConfig config = SegmentConfig.defaults();
        config.setIncludeTermVectors(false);

        List<Document> documents = new BatchReader(config)
            .readString("[{\"fields\": [{\"name\": \"body\", \"value\": \"cat\"}]}]");

        assertFalse(documents.get(0).fields().get(0).options().includeTermVectors());
        assertNull(documents.get(0).id());
    }

    @Test
    @DisplayName("未知属性被忽略")
    void testUnknownPropertiesIgnored() throws IOException {
        List<Document> documents = reader.readString(
            "[{\"id\": \"a\", \"extra\": 1, \"fields\": [{\"name\": \"body\", \"value\": \"x\", \"boost\": 2}]}]");

        assertEquals(1, documents.get(0).fields().size());
    }

    @Test
    @DisplayName("空批次")
    void testEmptyBatch() throws IOException {
        assertTrue(reader.readString("[]").isEmpty());
    }

    @Test
    @DisplayName("非法JSON抛出IOException")
    void testInvalidJson() {
        assertThrows(IOException.class, () -> reader.readString("[{\"id\": "));
    }

    @Test
    @DisplayName("读取批次文件")
    void testReadFile() throws IOException {
        Path batch = tempDir.resolve("batch.json");
        Files.writeString(batch, "[{\"id\": \"a\", \"fields\": [{\"name\": \"body\", \"value\": \"cat\"}]},"
            + "{\"id\": \"b\", \"fields\": [{\"name\": \"body\", \"value\": \"dog\"}]}]");

        List<Document> documents = reader.read(batch.toFile());

        assertEquals(List.of("a", "b"), documents.stream().map(Document::id).toList());
    }

    @Test
    @DisplayName("文件不存在时异常携带路径")
    void testReadMissingFile() {
        File missing = tempDir.resolve("missing.json").toFile();

        IOException exception = assertThrows(IOException.class, () -> reader.read(missing));
        assertTrue(exception.getMessage().contains("missing.json"));
    }

    @Test
    @DisplayName("参数校验")
    void testArgumentValidation() {
        assertThrows(IllegalArgumentException.class, () -> new BatchReader(null));
        assertThrows(IllegalArgumentException.class, () -> reader.read(null));
    }
}
