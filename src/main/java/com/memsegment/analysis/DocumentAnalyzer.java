package com.memsegment.analysis;

import com.memsegment.config.SegmentConfig;
import com.memsegment.document.CompositeField;
import com.memsegment.document.Document;
import com.memsegment.document.Field;
import com.memsegment.document.FieldKind;
import com.memsegment.document.FieldOptions;
import com.memsegment.text.EnglishTokenizer;
import com.memsegment.text.Token;
import com.memsegment.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 文档分析器：为每个常规字段计算词项总数与词频表，并将结果汇入组合字段。
 *
 * <p>文本字段经分词器切分；其他类型字段与身份字段整体作为一个关键词。
 * 文档携带 id 但没有身份字段时，会在字段序列最前面补上一个存储的身份字段。
 */
public final class DocumentAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(DocumentAnalyzer.class);

    private static final FieldOptions IDENTITY_OPTIONS = new FieldOptions(true, true, false, false);

    private final SegmentConfig config;
    private final Tokenizer tokenizer;

    public DocumentAnalyzer(SegmentConfig config) {
        this(config, new EnglishTokenizer(config.isEnableStopWords()));
    }

    public DocumentAnalyzer(SegmentConfig config, Tokenizer tokenizer) {
        if (config == null || tokenizer == null) {
            throw new IllegalArgumentException("config与tokenizer不能为null");
        }
        this.config = config;
        this.tokenizer = tokenizer;
    }

    public List<AnalysisResult> analyzeAll(List<Document> documents) {
        List<AnalysisResult> results = new ArrayList<>(documents.size());
        for (Document document : documents) {
            results.add(analyze(document));
        }
        logger.debug("分析完成: documents={}", results.size());
        return results;
    }

    public AnalysisResult analyze(Document document) {
        if (document == null) {
            throw new IllegalArgumentException("文档不能为null");
        }
        Document prepared = ensureIdentityField(document);

        List<CompositeField> composites = new ArrayList<>(prepared.compositeFields().size());
        for (CompositeField compositeField : prepared.compositeFields()) {
            composites.add(compositeField.emptyCopy());
        }

        List<Integer> lengths = new ArrayList<>(prepared.fields().size());
        List<TokenFrequencies> analyzed = new ArrayList<>(prepared.fields().size());
        for (Field field : prepared.fields()) {
            if (!field.options().indexed()) {
                lengths.add(0);
                analyzed.add(new TokenFrequencies());
                continue;
            }

            List<Token> tokens = tokenize(field);
            TokenFrequencies frequencies = TokenFrequencies.fromTokens(
                tokens, field.arrayPositions(), field.options().includeTermVectors());
            lengths.add(tokens.size());
            analyzed.add(frequencies);

            for (CompositeField composite : composites) {
                composite.compose(field.name(), tokens.size(), frequencies);
            }
        }

        return new AnalysisResult(prepared.withCompositeFields(composites), lengths, analyzed);
    }

    private List<Token> tokenize(Field field) {
        if (field.kind() == FieldKind.TEXT && !field.name().equals(config.getIdentityField())) {
            return tokenizer.tokenize(field.value());
        }
        String keyword = field.valueAsString();
        if (keyword.isEmpty()) {
            return List.of();
        }
        int byteLength = keyword.getBytes(StandardCharsets.UTF_8).length;
        return List.of(new Token(keyword, 0, 0, byteLength));
    }

    private Document ensureIdentityField(Document document) {
        String identityField = config.getIdentityField();
        if (document.id() == null || document.findField(identityField).isPresent()) {
            return document;
        }
        return document.withLeadingField(
            Field.of(identityField, FieldKind.TEXT, IDENTITY_OPTIONS, document.id()));
    }
}
