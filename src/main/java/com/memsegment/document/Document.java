package com.memsegment.document;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 待索引文档：常规字段按出现顺序排列，组合字段聚合其他字段的分词结果。
 */
public record Document(String id, List<Field> fields, List<CompositeField> compositeFields) {

    public Document {
        fields = fields == null ? List.of() : List.copyOf(fields);
        compositeFields = compositeFields == null ? List.of() : List.copyOf(compositeFields);
    }

    public static Document of(String id, Field... fields) {
        return new Document(id, List.of(fields), List.of());
    }

    public Document withCompositeFields(List<CompositeField> composites) {
        return new Document(id, fields, composites);
    }

    /**
     * 在字段序列最前面插入一个字段。
     */
    public Document withLeadingField(Field field) {
        List<Field> reordered = new ArrayList<>(fields.size() + 1);
        reordered.add(field);
        reordered.addAll(fields);
        return new Document(id, reordered, compositeFields);
    }

    public Optional<Field> findField(String name) {
        for (Field field : fields) {
            if (field.name().equals(name)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
