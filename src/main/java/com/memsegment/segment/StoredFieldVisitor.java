package com.memsegment.segment;

/**
 * 存储值访问回调，返回 false 表示停止访问。
 */
@FunctionalInterface
public interface StoredFieldVisitor {

    boolean visit(String field, StoredValue value);
}
