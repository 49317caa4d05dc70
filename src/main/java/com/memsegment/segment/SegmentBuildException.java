package com.memsegment.segment;

/**
 * 段构建失败。构建是全有或全无的：抛出后不存在部分段，调用方需丢弃整个批次。
 */
public class SegmentBuildException extends RuntimeException {

    /**
     * 失败类别。
     */
    public enum Kind {
        /** 第二遍组装时遇到第一遍未登记的 (字段, 词项) */
        MISSING_POSTING,
        /** 字段名映射、反向列表与字段词典数量不一致 */
        REGISTRY_INCONSISTENT
    }

    private final Kind kind;

    public SegmentBuildException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
