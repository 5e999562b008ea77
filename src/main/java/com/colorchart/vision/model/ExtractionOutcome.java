package com.colorchart.vision.model;

import com.colorchart.vision.core.ExtractionResult;

/**
 * 服务层提取结果：核心结果 + 降级提示 + 落盘文件
 */
public class ExtractionOutcome {
    private final ExtractionResult result;
    private final String warning;
    private final ReportFiles files;
    private final long processingTimeMs;

    public ExtractionOutcome(ExtractionResult result, String warning, ReportFiles files, long processingTimeMs) {
        this.result = result;
        this.warning = warning;
        this.files = files;
        this.processingTimeMs = processingTimeMs;
    }

    public ExtractionResult getResult() { return result; }

    /**
     * 光照补偿失败回退为原始颜色时的提示，正常情况为 null
     */
    public String getWarning() { return warning; }

    public boolean hasWarning() { return warning != null; }

    /**
     * 未要求落盘时为 null
     */
    public ReportFiles getFiles() { return files; }

    public long getProcessingTimeMs() { return processingTimeMs; }
}
