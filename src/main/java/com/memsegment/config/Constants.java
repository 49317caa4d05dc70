package com.memsegment.config;

/**
 * 全局常量定义
 * 
 * 包含身份字段名、存储类型标记、内存估算参数和CLI参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }
    
    // ==================== 字段参数 ====================
    /** 身份字段名，总是占用字段ID 0 */
    public static final String IDENTITY_FIELD = "_id";
    /** 分词后保留的最短词项长度 */
    public static final int MIN_TERM_LENGTH = 2;
    
    // ==================== 内存估算参数 ====================
    /** 对象引用大小 */
    public static final int SIZE_OF_REFERENCE = 8;
    /** 对象头大小 */
    public static final int SIZE_OF_OBJECT_HEADER = 16;
    /** 数组头大小 */
    public static final int SIZE_OF_ARRAY_HEADER = 16;
    /** 哈希表单个条目的额外开销 */
    public static final int SIZE_OF_MAP_ENTRY = 32;
    /** 字符串对象固定开销（不含字符数据） */
    public static final int SIZE_OF_STRING = 40;
    public static final int SIZE_OF_INT = Integer.BYTES;
    public static final int SIZE_OF_FLOAT = Float.BYTES;
    
    // ==================== CLI参数 ====================
    /** 单批次最大文档数 */
    public static final int MAX_BATCH_DOCUMENTS = 1_000_000;
    /** terms 子命令默认输出上限 */
    public static final int DEFAULT_TERMS_LIMIT = 100;
    /** terms 子命令输出上限 */
    public static final int MAX_TERMS_LIMIT = 100_000;
}
