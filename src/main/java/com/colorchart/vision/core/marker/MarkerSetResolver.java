package com.colorchart.vision.core.marker;

import com.colorchart.vision.core.ChartExtractionException;
import com.colorchart.vision.core.FailureKind;
import com.colorchart.vision.core.geometry.Point;
import com.colorchart.vision.core.geometry.Quadrilateral;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 标记集合解析器
 * <p>
 * 1. 校验四个必需 ID 是否都存在
 * 2. 按映射表分配角位置
 * 3. 以标记中心作为代表点，校验四边形几何有效性
 */
public class MarkerSetResolver {
    private static final Logger logger = LoggerFactory.getLogger(MarkerSetResolver.class);

    public static final double DEFAULT_MIN_SEPARATION = 10.0;
    public static final double DEFAULT_MIN_AREA = 1000.0;

    private final MarkerRoleTable roleTable;
    // 标记中心之间的最小距离（像素）
    private final double minSeparation;
    // 中心四边形的最小面积（平方像素）
    private final double minArea;

    public MarkerSetResolver(MarkerRoleTable roleTable) {
        this(roleTable, DEFAULT_MIN_SEPARATION, DEFAULT_MIN_AREA);
    }

    public MarkerSetResolver(MarkerRoleTable roleTable, double minSeparation, double minArea) {
        if (roleTable == null) {
            throw new IllegalArgumentException("roleTable is required");
        }
        this.roleTable = roleTable;
        this.minSeparation = minSeparation;
        this.minArea = minArea;
    }

    public ResolvedFrame resolve(Map<Integer, Marker> detected) {
        List<Integer> required = roleTable.requiredIds();
        List<Integer> missing = new ArrayList<>();
        for (int id : required) {
            if (detected == null || !detected.containsKey(id)) {
                missing.add(id);
            }
        }

        if (!missing.isEmpty()) {
            int found = required.size() - missing.size();
            logger.warn("Marker set incomplete: found {}/{} required markers, missing {}",
                found, required.size(), missing);
            throw ChartExtractionException.insufficientMarkers(found, required.size(), missing);
        }

        Map<CornerRole, Marker> byRole = new EnumMap<>(CornerRole.class);
        Point[] centers = new Point[4];
        for (CornerRole role : CornerRole.values()) {
            Marker marker = detected.get(roleTable.idFor(role));
            byRole.put(role, marker);
            centers[role.ordinal()] = marker.centroid();
        }

        Quadrilateral quad = Quadrilateral.of(centers);
        validate(quad);

        logger.info("Resolved marker frame: {}", quad);
        return new ResolvedFrame(byRole, quad);
    }

    private void validate(Quadrilateral quad) {
        double separation = quad.minCornerSeparation();
        if (separation < minSeparation) {
            throw degenerate(String.format(
                "Marker centres too close together (%.1f px) - move the camera closer to the chart", separation));
        }

        if (!quad.isConvexInCanonicalWinding()) {
            throw degenerate("Marker centres do not form a convex TL-TR-BR-BL quadrilateral "
                + "- check that the chart is not folded or the markers are not swapped");
        }

        double area = quad.signedArea();
        if (area < minArea) {
            throw degenerate(String.format(
                "Marker quadrilateral area too small (%.0f px^2) - move the camera closer to the chart", area));
        }
    }

    private ChartExtractionException degenerate(String message) {
        logger.warn("Degenerate marker geometry: {}", message);
        return new ChartExtractionException(FailureKind.DEGENERATE_GEOMETRY, message);
    }
}
