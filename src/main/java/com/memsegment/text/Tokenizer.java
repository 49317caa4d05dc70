package com.memsegment.text;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 分词器。实现需保证词项位置递增，偏移量为 UTF-8 字节偏移。
 */
public interface Tokenizer {

    List<Token> tokenize(String text);

    /**
     * 对字段原始值字节分词，默认按 UTF-8 解码。
     */
    default List<Token> tokenize(byte[] utf8Value) {
        if (utf8Value == null || utf8Value.length == 0) {
            return List.of();
        }
        return tokenize(new String(utf8Value, StandardCharsets.UTF_8));
    }
}
