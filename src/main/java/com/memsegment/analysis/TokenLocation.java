package com.memsegment.analysis;

import java.util.Arrays;
import java.util.Objects;

/**
 * 词项的一次出现。
 *
 * @param field 出现所在字段名，为 null 时归属于收录它的字段
 * @param start 起始字节偏移
 * @param end 结束字节偏移
 * @param position 词项位置序号
 * @param arrayPositions 数组位置路径，可能为空数组
 */
public record TokenLocation(String field, int start, int end, int position, int[] arrayPositions) {

    public TokenLocation {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("非法偏移区间: [" + start + ", " + end + ")");
        }
        if (position < 0) {
            throw new IllegalArgumentException("位置不能为负数: " + position);
        }
        arrayPositions = arrayPositions == null ? new int[0] : Arrays.copyOf(arrayPositions, arrayPositions.length);
    }

    public TokenLocation(int start, int end, int position) {
        this(null, start, end, position, null);
    }

    /**
     * 返回标记为指定来源字段的副本，覆盖原有的来源字段。
     */
    public TokenLocation withField(String sourceField) {
        return new TokenLocation(sourceField, start, end, position, arrayPositions);
    }

    public boolean hasArrayPositions() {
        return arrayPositions.length > 0;
    }

    @Override
    public int[] arrayPositions() {
        return Arrays.copyOf(arrayPositions, arrayPositions.length);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TokenLocation that)) {
            return false;
        }
        return start == that.start
            && end == that.end
            && position == that.position
            && Objects.equals(field, that.field)
            && Arrays.equals(arrayPositions, that.arrayPositions);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(field, start, end, position);
        return 31 * result + Arrays.hashCode(arrayPositions);
    }
}
