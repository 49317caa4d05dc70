package com.memsegment.document;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 常规字段，携带原始值字节与数组位置路径。
 *
 * @param name 字段名
 * @param kind 声明类型
 * @param options 索引选项
 * @param value 原始值字节
 * @param arrayPositions 数组位置路径，非数组字段为空数组
 */
public record Field(String name, FieldKind kind, FieldOptions options, byte[] value, int[] arrayPositions) {

    private static final int[] NO_ARRAY_POSITIONS = new int[0];

    public Field {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("字段名不能为空");
        }
        if (kind == null) {
            throw new IllegalArgumentException("字段类型不能为null, field=" + name);
        }
        if (options == null) {
            throw new IllegalArgumentException("字段选项不能为null, field=" + name);
        }
        value = value == null ? new byte[0] : Arrays.copyOf(value, value.length);
        arrayPositions = arrayPositions == null || arrayPositions.length == 0
            ? NO_ARRAY_POSITIONS
            : Arrays.copyOf(arrayPositions, arrayPositions.length);
    }

    public static Field text(String name, String text) {
        return new Field(name, FieldKind.TEXT, FieldOptions.DEFAULT, text.getBytes(StandardCharsets.UTF_8), null);
    }

    public static Field of(String name, FieldKind kind, FieldOptions options, String value, int... arrayPositions) {
        byte[] bytes = value == null ? null : value.getBytes(StandardCharsets.UTF_8);
        return new Field(name, kind, options, bytes, arrayPositions);
    }

    /**
     * 以 UTF-8 解码原始值。
     */
    public String valueAsString() {
        return new String(value, StandardCharsets.UTF_8);
    }

    @Override
    public byte[] value() {
        return Arrays.copyOf(value, value.length);
    }

    @Override
    public int[] arrayPositions() {
        return Arrays.copyOf(arrayPositions, arrayPositions.length);
    }
}
