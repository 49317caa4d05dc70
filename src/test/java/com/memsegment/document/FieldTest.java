package com.memsegment.document;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FieldTest {

    @Test
    @DisplayName("字段值与数组位置做防御性复制")
    void testDefensiveCopies() {
        byte[] value = "cat".getBytes(StandardCharsets.UTF_8);
        int[] arrayPositions = {0, 2};
        Field field = new Field("tags", FieldKind.TEXT, FieldOptions.DEFAULT, value, arrayPositions);

        value[0] = 'b';
        arrayPositions[0] = 9;
        field.value()[1] = 'x';

        assertEquals("cat", field.valueAsString());
        assertArrayEquals(new int[] {0, 2}, field.arrayPositions());
    }

    @Test
    @DisplayName("缺省值与数组位置归一为空数组")
    void testNullValuesNormalized() {
        Field field = new Field("empty", FieldKind.NUMERIC, FieldOptions.INDEX_ONLY, null, null);

        assertEquals(0, field.value().length);
        assertEquals(0, field.arrayPositions().length);
        assertEquals("", field.valueAsString());
    }

    @Test
    @DisplayName("字段参数校验")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> Field.text("", "x"));
        assertThrows(IllegalArgumentException.class,
            () -> new Field("a", null, FieldOptions.DEFAULT, null, null));
        assertThrows(IllegalArgumentException.class,
            () -> new Field("a", FieldKind.TEXT, null, null, null));
    }

    @Test
    @DisplayName("字段选项派生")
    void testFieldOptions() {
        FieldOptions options = FieldOptions.INDEX_ONLY.withStored(true).withDocValues(true);

        assertTrue(options.indexed());
        assertTrue(options.stored());
        assertTrue(options.includeTermVectors());
        assertTrue(options.includeDocValues());
        assertFalse(FieldOptions.DEFAULT.includeDocValues());
    }

    @Test
    @DisplayName("文档查找字段与补充前置字段")
    void testDocumentHelpers() {
        Document document = Document.of("a", Field.text("title", "cat"), Field.text("body", "dog"));

        assertTrue(document.findField("body").isPresent());
        assertTrue(document.findField("missing").isEmpty());

        Document withId = document.withLeadingField(Field.text("_id", "a"));
        assertEquals(List.of("_id", "title", "body"),
            withId.fields().stream().map(Field::name).toList());
        assertEquals(2, document.fields().size());
    }
}
