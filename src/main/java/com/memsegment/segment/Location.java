package com.memsegment.segment;

import java.util.Arrays;

/**
 * 段内的一条位置记录。
 *
 * @param fieldId 出现所在字段ID
 * @param start 起始字节偏移
 * @param end 结束字节偏移
 * @param position 词项位置序号
 * @param arrayPositions 数组位置路径，缺省时为 null
 */
public record Location(int fieldId, int start, int end, int position, int[] arrayPositions) {

    public Location {
        arrayPositions = arrayPositions == null ? null : Arrays.copyOf(arrayPositions, arrayPositions.length);
    }

    @Override
    public int[] arrayPositions() {
        return arrayPositions == null ? null : Arrays.copyOf(arrayPositions, arrayPositions.length);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Location that)) {
            return false;
        }
        return fieldId == that.fieldId
            && start == that.start
            && end == that.end
            && position == that.position
            && Arrays.equals(arrayPositions, that.arrayPositions);
    }

    @Override
    public int hashCode() {
        int result = fieldId;
        result = 31 * result + start;
        result = 31 * result + end;
        result = 31 * result + position;
        return 31 * result + Arrays.hashCode(arrayPositions);
    }

    @Override
    public String toString() {
        return "Location[field=" + fieldId + ", start=" + start + ", end=" + end
            + ", position=" + position + ", arrayPositions=" + Arrays.toString(arrayPositions) + "]";
    }
}
