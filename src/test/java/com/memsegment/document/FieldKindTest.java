package com.memsegment.document;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FieldKindTest {

    @ParameterizedTest
    @CsvSource({
        "TEXT, t",
        "NUMERIC, n",
        "DATE_TIME, d",
        "BOOLEAN, b",
        "GEO_POINT, g",
        "COMPOSITE, c",
        "UNKNOWN, x"
    })
    @DisplayName("存储类型标记与字段类型互相映射")
    void testTagMapping(FieldKind kind, char tag) {
        assertEquals((byte) tag, kind.tag());
        assertEquals(kind, FieldKind.fromTag((byte) tag));
    }

    @ParameterizedTest
    @CsvSource({
        "text, TEXT",
        "number, NUMERIC",
        "numeric, NUMERIC",
        "datetime, DATE_TIME",
        "date-time, DATE_TIME",
        "bool, BOOLEAN",
        "geo_point, GEO_POINT",
        "geopoint, GEO_POINT",
        "composite, COMPOSITE",
        "vector, UNKNOWN"
    })
    @DisplayName("批次文件类型名解析")
    void testFromName(String name, FieldKind expected) {
        assertEquals(expected, FieldKind.fromName(name));
    }

    @Test
    @DisplayName("未声明类型默认为文本，未知标记返回UNKNOWN")
    void testDefaults() {
        assertEquals(FieldKind.TEXT, FieldKind.fromName(null));
        assertEquals(FieldKind.TEXT, FieldKind.fromName("  "));
        assertEquals(FieldKind.UNKNOWN, FieldKind.fromTag((byte) 'z'));
    }
}
