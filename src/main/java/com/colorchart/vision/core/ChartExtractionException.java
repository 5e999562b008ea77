package com.colorchart.vision.core;

import java.util.Collections;
import java.util.List;

/**
 * 色卡提取失败
 */
public class ChartExtractionException extends RuntimeException {
    private final FailureKind kind;
    private final int markersFound;
    private final List<Integer> missingMarkerIds;

    public ChartExtractionException(FailureKind kind, String message) {
        this(kind, message, -1, Collections.emptyList());
    }

    private ChartExtractionException(FailureKind kind, String message,
                                     int markersFound, List<Integer> missingMarkerIds) {
        super(message);
        this.kind = kind;
        this.markersFound = markersFound;
        this.missingMarkerIds = List.copyOf(missingMarkerIds);
    }

    public static ChartExtractionException insufficientMarkers(int found, int required, List<Integer> missing) {
        String message = String.format(
            "Only %d of %d markers visible (missing ids %s) - reposition the chart so all markers are in view",
            found, required, missing);
        return new ChartExtractionException(FailureKind.INSUFFICIENT_MARKERS, message, found, missing);
    }

    public FailureKind getKind() {
        return kind;
    }

    /**
     * 检测到的必需标记数量，仅对 INSUFFICIENT_MARKERS 有效，其余为 -1
     */
    public int getMarkersFound() {
        return markersFound;
    }

    public List<Integer> getMissingMarkerIds() {
        return missingMarkerIds;
    }
}
