package com.colorchart.vision.core.marker;

import com.colorchart.vision.core.geometry.Point;
import com.colorchart.vision.core.geometry.Quadrilateral;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 已解析的标记框
 * <p>
 * 四个角位置各对应一个标记，标记中心构成的四边形是凸的、非自相交的。
 * 只能由 {@link MarkerSetResolver} 创建。
 */
public final class ResolvedFrame {
    private final Map<CornerRole, Marker> markers;
    private final Quadrilateral centroids;

    ResolvedFrame(Map<CornerRole, Marker> markers, Quadrilateral centroids) {
        this.markers = Collections.unmodifiableMap(new EnumMap<>(markers));
        this.centroids = centroids;
    }

    public Marker marker(CornerRole role) {
        return markers.get(role);
    }

    public Map<CornerRole, Marker> getMarkers() {
        return markers;
    }

    /**
     * 标记中心四边形 [TL, TR, BR, BL]
     */
    public Quadrilateral getCentroids() {
        return centroids;
    }

    public Point centroid(CornerRole role) {
        return centroids.corner(role.ordinal());
    }

    @Override
    public String toString() {
        return "ResolvedFrame" + centroids;
    }
}
