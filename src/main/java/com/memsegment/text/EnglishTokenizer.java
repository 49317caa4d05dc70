package com.memsegment.text;

import com.memsegment.config.Constants;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class EnglishTokenizer implements Tokenizer {

    private static final Pattern SPLIT_PATTERN = Pattern.compile("[^a-zA-Z0-9]+");

    /** 英文停用词，仅在启用过滤时生效 */
    static final Set<String> STOP_WORDS = Set.of(
        "the", "a", "an", "is", "are", "was", "were", "be", "been",
        "has", "have", "had", "do", "does", "did", "will", "would",
        "and", "or", "but", "not", "in", "on", "at", "to", "for", "of",
        "with", "by", "from", "as", "into", "it", "its", "this", "that"
    );

    private final boolean enableStopWords;

    /**
     * 创建英文分词器。
     */
    public EnglishTokenizer(boolean enableStopWords) {
        this.enableStopWords = enableStopWords;
    }

    /**
     * 对英文与数字文本分词，输出 UTF-8 字节偏移。
     */
    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Token> tokens = new ArrayList<>();
        Matcher delimiterMatcher = SPLIT_PATTERN.matcher(text);
        ByteOffsetTracker offsetTracker = new ByteOffsetTracker(text);
        int nextPosition = 0;
        int segmentStart = 0;

        while (delimiterMatcher.find()) {
            nextPosition = appendTokenIfValid(text, segmentStart, delimiterMatcher.start(), nextPosition, offsetTracker, tokens);
            segmentStart = delimiterMatcher.end();
        }
        appendTokenIfValid(text, segmentStart, text.length(), nextPosition, offsetTracker, tokens);

        return List.copyOf(tokens);
    }

    /**
     * 校验并追加有效词项，返回更新后的下一个位置序号。
     */
    private int appendTokenIfValid(String sourceText, int startIndex, int endIndex, int position,
                                   ByteOffsetTracker offsetTracker, List<Token> tokens) {
        if (startIndex >= endIndex) {
            return position;
        }

        String normalizedTerm = sourceText.substring(startIndex, endIndex).toLowerCase(Locale.ROOT);
        if (normalizedTerm.length() < Constants.MIN_TERM_LENGTH) {
            return position;
        }
        if (enableStopWords && STOP_WORDS.contains(normalizedTerm)) {
            return position;
        }

        int startOffset = offsetTracker.byteOffsetOf(startIndex);
        int endOffset = offsetTracker.byteOffsetOf(endIndex);
        tokens.add(new Token(normalizedTerm, position, startOffset, endOffset));
        return position + 1;
    }

    /**
     * 将字符下标单调地换算为 UTF-8 字节偏移，调用方需按递增顺序查询。
     */
    private static final class ByteOffsetTracker {
        private final String text;
        private int charIndex;
        private int byteOffset;

        private ByteOffsetTracker(String text) {
            this.text = text;
        }

        private int byteOffsetOf(int targetIndex) {
            while (charIndex < targetIndex) {
                int codePoint = text.codePointAt(charIndex);
                byteOffset += utf8Length(codePoint);
                charIndex += Character.charCount(codePoint);
            }
            return byteOffset;
        }

        private static int utf8Length(int codePoint) {
            if (codePoint < 0x80) {
                return 1;
            }
            if (codePoint < 0x800) {
                return 2;
            }
            if (codePoint < 0x10000) {
                return 3;
            }
            return 4;
        }
    }
}
