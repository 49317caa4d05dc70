package com.memsegment.document;

/**
 * 字段索引选项。
 *
 * @param indexed 是否参与倒排
 * @param stored 是否保存原始值
 * @param includeTermVectors 是否记录词项位置信息
 * @param includeDocValues 是否请求列式快速访问
 */
public record FieldOptions(boolean indexed, boolean stored, boolean includeTermVectors, boolean includeDocValues) {

    public static final FieldOptions DEFAULT = new FieldOptions(true, true, true, false);
    public static final FieldOptions INDEX_ONLY = new FieldOptions(true, false, true, false);

    public FieldOptions withStored(boolean value) {
        return new FieldOptions(indexed, value, includeTermVectors, includeDocValues);
    }

    public FieldOptions withDocValues(boolean value) {
        return new FieldOptions(indexed, stored, includeTermVectors, value);
    }
}
