package com.memsegment.segment;

import com.memsegment.analysis.AnalysisResult;
import com.memsegment.analysis.DocumentAnalyzer;
import com.memsegment.config.SegmentConfig;
import com.memsegment.document.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 段构建编排：登记身份字段 → 词典遍 → 逐文档组装 → 词项排序 → 内存估算 → 冻结。
 *
 * <p>每次 {@link #build(List)} 都使用独立的构建状态，同一实例可在多个线程中分别构建不同批次。
 * 构建是全有或全无的，失败时抛出 {@link SegmentBuildException}，不会返回部分段。
 */
public final class SegmentBuilder {
    private static final Logger logger = LoggerFactory.getLogger(SegmentBuilder.class);

    private final SegmentConfig config;

    public SegmentBuilder() {
        this(SegmentConfig.defaults());
    }

    public SegmentBuilder(SegmentConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config不能为null");
        }
        this.config = config;
    }

    public Segment build(List<AnalysisResult> batch) {
        if (batch == null) {
            throw new IllegalArgumentException("批次不能为null");
        }
        long startNanos = System.nanoTime();

        FieldRegistry registry = new FieldRegistry();
        registry.resolveOrDefine(config.getIdentityField());

        DictionaryBuilder dictionaryBuilder = new DictionaryBuilder(registry);
        PostingsAccumulator postings = dictionaryBuilder.build(batch);
        logger.debug("词典遍完成: fields={}, postings={}", registry.size(), postings.postingCount());

        DocumentAssembler assembler = new DocumentAssembler(registry, postings);
        for (AnalysisResult result : batch) {
            assembler.assemble(result);
        }
        registry.checkConsistency();
        logger.debug("组装遍完成: documents={}", assembler.documentCount());

        registry.sortTermLists();
        if (config.isOptimizeBitmaps()) {
            postings.runOptimize();
        }

        long sizeInBytes = SegmentSizeEstimator.estimate(
            registry, postings, assembler.storedValues(), assembler.docValueFields());
        Segment segment = new Segment(
            registry, postings, assembler.storedValues(), assembler.docValueFields(), sizeInBytes);

        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        logger.info("段构建完成: documents={}, fields={}, postings={}, sizeBytes={}, elapsedMs={}",
            segment.count(), segment.fieldCount(), segment.postingCount(), sizeInBytes, elapsedMs);
        return segment;
    }

    /**
     * 先用 {@link DocumentAnalyzer} 分析原始文档，再构建段。
     */
    public Segment buildFromDocuments(List<Document> documents) {
        return build(new DocumentAnalyzer(config).analyzeAll(documents));
    }
}
