package com.memsegment.config;

/**
 * 段构建运行时配置
 * 
 * 支持从CLI参数注入，覆盖Constants默认值
 */
public class SegmentConfig {
    private String identityField = Constants.IDENTITY_FIELD;
    private boolean enableStopWords = false;
    private boolean includeTermVectors = true;
    private boolean optimizeBitmaps = true;
    
    public String getIdentityField() {
        return identityField;
    }
    
    public void setIdentityField(String identityField) {
        if (identityField == null || identityField.isEmpty()) {
            throw new IllegalArgumentException("身份字段名不能为空");
        }
        this.identityField = identityField;
    }
    
    public boolean isEnableStopWords() {
        return enableStopWords;
    }
    
    public void setEnableStopWords(boolean enableStopWords) {
        this.enableStopWords = enableStopWords;
    }
    
    /**
     * 未显式声明时，字段是否记录词项位置信息
     */
    public boolean isIncludeTermVectors() {
        return includeTermVectors;
    }
    
    public void setIncludeTermVectors(boolean includeTermVectors) {
        this.includeTermVectors = includeTermVectors;
    }
    
    /**
     * 构建完成后是否对倒排位图执行 run 压缩
     */
    public boolean isOptimizeBitmaps() {
        return optimizeBitmaps;
    }
    
    public void setOptimizeBitmaps(boolean optimizeBitmaps) {
        this.optimizeBitmaps = optimizeBitmaps;
    }
    
    /**
     * 使用默认配置创建实例
     */
    public static SegmentConfig defaults() {
        return new SegmentConfig();
    }
}
