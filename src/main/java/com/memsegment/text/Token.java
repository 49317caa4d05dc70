package com.memsegment.text;

/**
 * 分词结果，偏移量以 UTF-8 字节计。
 */
public record Token(
    String term,
    int position,
    int startOffset,
    int endOffset
) {
}
