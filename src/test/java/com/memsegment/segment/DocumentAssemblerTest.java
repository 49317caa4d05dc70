package com.memsegment.segment;

import com.memsegment.analysis.AnalysisResult;
import com.memsegment.analysis.TokenFrequencies;
import com.memsegment.analysis.TokenLocation;
import com.memsegment.document.Field;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentAssemblerTest {

    @Test
    @DisplayName("文档号从0开始连续分配")
    void testDocNumbersAreDense() {
        List<AnalysisResult> batch = List.of(
            AnalysisFixtures.document(null).text("body", "cat").build(),
            AnalysisFixtures.document(null).text("body", "dog").build()
        );
        FieldRegistry registry = new FieldRegistry();
        PostingsAccumulator postings = new DictionaryBuilder(registry).build(batch);
        DocumentAssembler assembler = new DocumentAssembler(registry, postings);

        assertEquals(0, assembler.assemble(batch.get(0)));
        assertEquals(1, assembler.assemble(batch.get(1)));
        assertEquals(2, assembler.documentCount());
    }

    @Test
    @DisplayName("词典缺少词项时报告MISSING_POSTING")
    void testMissingPostingIsFatal() {
        FieldRegistry registry = new FieldRegistry();
        registry.resolveOrDefine("_id");
        registry.resolveOrDefine("body");
        DocumentAssembler assembler = new DocumentAssembler(registry, PostingsAccumulator.allocate(0));

        SegmentBuildException exception = assertThrows(SegmentBuildException.class,
            () -> assembler.assemble(AnalysisFixtures.document(null).text("body", "cat").build()));
        assertEquals(SegmentBuildException.Kind.MISSING_POSTING, exception.getKind());
        assertTrue(exception.getMessage().contains("cat"));
    }

    @Test
    @DisplayName("位置记录的来源字段通过登记表解析")
    void testLocationFieldOverride() {
        TokenFrequencies frequencies = new TokenFrequencies();
        frequencies.addOccurrence("cat", new TokenLocation("origin", 0, 3, 0, new int[] {2, 1}));
        frequencies.addOccurrence("cat", new TokenLocation(4, 7, 1));
        List<AnalysisResult> batch = List.of(
            AnalysisFixtures.document(null).field(Field.text("body", "cat cat"), 2, frequencies).build()
        );

        FieldRegistry registry = new FieldRegistry();
        registry.resolveOrDefine("_id");
        PostingsAccumulator postings = new DictionaryBuilder(registry).build(batch);
        new DocumentAssembler(registry, postings).assemble(batch.get(0));

        int origin = registry.fieldId("origin");
        assertEquals(2, origin);
        assertEquals(List.of(origin, registry.fieldId("body")), postings.locationFields(0));
        assertEquals(List.of(0, 4), postings.locationStarts(0));
        assertEquals(List.of(3, 7), postings.locationEnds(0));
        assertEquals(List.of(0, 1), postings.locationPositions(0));
        assertArrayEquals(new int[] {2, 1}, postings.locationArrayPositions(0).get(0));
        assertNull(postings.locationArrayPositions(0).get(1));
        registry.checkConsistency();
    }

    @Test
    @DisplayName("没有位置信息的词项不进入位置位图")
    void testCountsWithoutLocations() {
        List<AnalysisResult> batch = List.of(
            AnalysisFixtures.document(null)
                .field(Field.text("body", "cat cat dog"), 3, AnalysisFixtures.countsOnly("cat", "cat", "dog"))
                .build()
        );
        FieldRegistry registry = new FieldRegistry();
        PostingsAccumulator postings = new DictionaryBuilder(registry).build(batch);
        new DocumentAssembler(registry, postings).assemble(batch.get(0));

        assertEquals(List.of(2), postings.frequencies(0));
        assertTrue(postings.postings(0).contains(0));
        assertTrue(postings.postingsWithLocations(0).isEmpty());
        assertTrue(postings.locationFields(0).isEmpty());
    }

    @Test
    @DisplayName("同一文档重复字段的词项总数累加")
    void testRepeatedFieldLengthsAccumulate() {
        List<AnalysisResult> batch = List.of(
            AnalysisFixtures.document(null)
                .text("tags", "red")
                .text("tags", "red", "blue", "green")
                .build()
        );
        FieldRegistry registry = new FieldRegistry();
        PostingsAccumulator postings = new DictionaryBuilder(registry).build(batch);
        new DocumentAssembler(registry, postings).assemble(batch.get(0));

        int tags = registry.fieldId("tags");
        int red = registry.ordinal(tags, "red") - 1;
        assertEquals(List.of(2), postings.frequencies(red));
        assertEquals(List.of(0.5f), postings.norms(red));
        assertEquals(2, postings.locationFields(red).size());
    }
}
