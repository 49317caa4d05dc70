package com.memsegment.document;

import java.util.Locale;

/**
 * 字段声明类型，每种类型对应一个单字节存储类型标记。
 */
public enum FieldKind {
    TEXT('t'),
    NUMERIC('n'),
    DATE_TIME('d'),
    BOOLEAN('b'),
    GEO_POINT('g'),
    COMPOSITE('c'),
    UNKNOWN('x');

    private final byte tag;

    FieldKind(char tag) {
        this.tag = (byte) tag;
    }

    public byte tag() {
        return tag;
    }

    /**
     * 由存储类型标记反查字段类型，无法识别时返回 UNKNOWN。
     */
    public static FieldKind fromTag(byte tag) {
        for (FieldKind kind : values()) {
            if (kind.tag == tag) {
                return kind;
            }
        }
        return UNKNOWN;
    }

    /**
     * 解析批次文件中的类型名，例如 "text"、"datetime"、"geo_point"。
     */
    public static FieldKind fromName(String name) {
        if (name == null || name.isBlank()) {
            return TEXT;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "TEXT" -> TEXT;
            case "NUMERIC", "NUMBER" -> NUMERIC;
            case "DATE_TIME", "DATETIME" -> DATE_TIME;
            case "BOOLEAN", "BOOL" -> BOOLEAN;
            case "GEO_POINT", "GEOPOINT" -> GEO_POINT;
            case "COMPOSITE" -> COMPOSITE;
            default -> UNKNOWN;
        };
    }
}
