package com.memsegment.segment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FieldRegistryTest {

    @Test
    @DisplayName("按首次出现顺序分配稠密字段ID")
    void testResolveOrDefineAssignsDenseIds() {
        FieldRegistry registry = new FieldRegistry();

        assertEquals(0, registry.resolveOrDefine("_id"));
        assertEquals(1, registry.resolveOrDefine("title"));
        assertEquals(2, registry.resolveOrDefine("body"));
        assertEquals(1, registry.resolveOrDefine("title"));

        assertEquals(3, registry.size());
        assertEquals(List.of("_id", "title", "body"), registry.fieldNames());
        assertEquals("body", registry.fieldName(2));
        assertEquals(2, registry.fieldId("body"));
        assertEquals(-1, registry.fieldId("missing"));
    }

    @Test
    @DisplayName("新字段同时获得空词典与空词项列表")
    void testNewFieldOwnsEmptyDictionary() {
        FieldRegistry registry = new FieldRegistry();
        int fieldId = registry.resolveOrDefine("body");

        assertTrue(registry.dictionary(fieldId).isEmpty());
        assertTrue(registry.termList(fieldId).isEmpty());
        assertEquals(0, registry.ordinal(fieldId, "cat"));
        registry.checkConsistency();
    }

    @Test
    @DisplayName("重复登记词项不改变序号")
    void testDefineTermOnce() {
        FieldRegistry registry = new FieldRegistry();
        int fieldId = registry.resolveOrDefine("body");

        assertTrue(registry.defineTerm(fieldId, "cat", 1));
        assertFalse(registry.defineTerm(fieldId, "cat", 2));

        assertEquals(1, registry.ordinal(fieldId, "cat"));
        assertEquals(List.of("cat"), registry.termList(fieldId));
    }

    @Test
    @DisplayName("词项列表按字节序排序且重复排序结果不变")
    void testSortTermListsIdempotent() {
        FieldRegistry registry = new FieldRegistry();
        int fieldId = registry.resolveOrDefine("body");
        registry.defineTerm(fieldId, "dog", 1);
        registry.defineTerm(fieldId, "Cat", 2);
        registry.defineTerm(fieldId, "ant", 3);

        registry.sortTermLists();
        List<String> once = List.copyOf(registry.termList(fieldId));
        registry.sortTermLists();

        assertEquals(List.of("Cat", "ant", "dog"), once);
        assertEquals(once, registry.termList(fieldId));
        assertEquals(1, registry.ordinal(fieldId, "dog"));
    }

    @Test
    @DisplayName("并行结构尺寸不一致时报告REGISTRY_INCONSISTENT")
    void testInconsistentRegistryDetected() {
        FieldRegistry registry = new FieldRegistry();
        registry.resolveOrDefine("_id");
        registry.fieldNames().add("ghost");

        SegmentBuildException exception = assertThrows(SegmentBuildException.class, registry::checkConsistency);
        assertEquals(SegmentBuildException.Kind.REGISTRY_INCONSISTENT, exception.getKind());
    }
}
