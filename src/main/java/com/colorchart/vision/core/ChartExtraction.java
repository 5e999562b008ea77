package com.colorchart.vision.core;

import com.colorchart.vision.core.marker.Marker;
import com.colorchart.vision.core.rectify.RectifiedImage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 带中间产物的提取结果，供报告/可视化使用
 * <p>
 * 校正图像持有 native 内存，由调用方负责释放。
 */
public class ChartExtraction implements AutoCloseable {
    private final ExtractionResult result;
    private final RectifiedImage rectified;
    private final Map<Integer, Marker> markers;
    private final String compensationWarning;

    public ChartExtraction(ExtractionResult result, RectifiedImage rectified, Map<Integer, Marker> markers) {
        this(result, rectified, markers, null);
    }

    public ChartExtraction(ExtractionResult result, RectifiedImage rectified, Map<Integer, Marker> markers,
                           String compensationWarning) {
        this.result = result;
        this.rectified = rectified;
        this.markers = Collections.unmodifiableMap(new LinkedHashMap<>(markers));
        this.compensationWarning = compensationWarning;
    }

    public ExtractionResult getResult() {
        return result;
    }

    public RectifiedImage getRectified() {
        return rectified;
    }

    /**
     * 检测到的全部标记（包括不属于色卡框的）
     */
    public Map<Integer, Marker> getMarkers() {
        return markers;
    }

    /**
     * 光照补偿被跳过的原因；补偿成功或未请求补偿时为空
     */
    public Optional<String> getCompensationWarning() {
        return Optional.ofNullable(compensationWarning);
    }

    @Override
    public void close() {
        rectified.release();
    }
}
