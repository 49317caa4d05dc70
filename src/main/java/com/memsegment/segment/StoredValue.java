package com.memsegment.segment;

import com.memsegment.document.FieldKind;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 存储字段值：类型标记、原始字节与数组位置路径。
 */
public record StoredValue(byte typeTag, byte[] value, int[] arrayPositions) {

    public StoredValue {
        if (value == null) {
            throw new IllegalArgumentException("存储值不能为null");
        }
        value = Arrays.copyOf(value, value.length);
        arrayPositions = arrayPositions == null ? new int[0] : Arrays.copyOf(arrayPositions, arrayPositions.length);
    }

    public FieldKind kind() {
        return FieldKind.fromTag(typeTag);
    }

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

    int valueLength() {
        return value.length;
    }

    int arrayPositionsLength() {
        return arrayPositions.length;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof StoredValue that)) {
            return false;
        }
        return typeTag == that.typeTag
            && Arrays.equals(value, that.value)
            && Arrays.equals(arrayPositions, that.arrayPositions);
    }

    @Override
    public int hashCode() {
        int result = Byte.hashCode(typeTag);
        result = 31 * result + Arrays.hashCode(value);
        return 31 * result + Arrays.hashCode(arrayPositions);
    }

    @Override
    public String toString() {
        return "StoredValue[type=" + (char) typeTag + ", value=" + valueAsString()
            + ", arrayPositions=" + Arrays.toString(arrayPositions) + "]";
    }
}
