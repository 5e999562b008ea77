package com.colorchart.vision.core.rectify;

import com.colorchart.vision.config.NativeLibraryLoader;
import com.colorchart.vision.core.ChartExtractionException;
import com.colorchart.vision.core.FailureKind;
import com.colorchart.vision.core.geometry.Point;
import com.colorchart.vision.core.geometry.Quadrilateral;
import com.colorchart.vision.core.layout.ChartLayout;
import com.colorchart.vision.core.layout.ChartLayouts;
import com.colorchart.vision.core.marker.CornerRole;
import com.colorchart.vision.core.marker.Marker;
import com.colorchart.vision.core.marker.MarkerRoleTable;
import com.colorchart.vision.core.marker.MarkerSetResolver;
import com.colorchart.vision.core.marker.ResolvedFrame;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PerspectiveRectifierTest {

    private final PerspectiveRectifier rectifier = new PerspectiveRectifier();
    private final ChartLayout classic = ChartLayouts.classic();

    @BeforeAll
    public static void loadOpenCV() {
        NativeLibraryLoader.loadNativeLibraries();
    }

    @Test
    public void testCanonicalSize() {
        Size size = rectifier.canonicalSize(classic);
        assertEquals(Math.round(215.9 * 5), (long) size.width);
        assertEquals(Math.round(139.7 * 5), (long) size.height);
    }

    @Test
    public void testIdentityBoundaryKeepsImage() {
        Size size = rectifier.canonicalSize(classic);
        Mat source = new Mat(size, CvType.CV_8UC3);
        Core.randu(source, 0, 256);

        try (RectifiedImage rectified = rectifier.rectify(source,
                Quadrilateral.rectangle(0, 0, size.width, size.height), classic)) {
            assertEquals(source.size(), rectified.getImage().size());
            assertTrue(Core.norm(source, rectified.getImage(), Core.NORM_INF) <= 1.0);
        }
        source.release();
    }

    @Test
    public void testChartBoundaryFromMarkerCentres() {
        // 标记中心按 2 px/mm 放置，偏移 (100, 80)
        double k = 2.0;
        Point[] centres = new Point[4];
        for (CornerRole role : CornerRole.values()) {
            Point mm = classic.markerCenterMm(role);
            centres[role.ordinal()] = new Point(100 + mm.x * k, 80 + mm.y * k);
        }

        Quadrilateral boundary = rectifier.chartBoundary(Quadrilateral.of(centres), classic);

        assertEquals(100, boundary.topLeft().x, 1e-3);
        assertEquals(80, boundary.topLeft().y, 1e-3);
        assertEquals(100 + classic.getWidthMm() * k, boundary.bottomRight().x, 1e-3);
        assertEquals(80 + classic.getHeightMm() * k, boundary.bottomRight().y, 1e-3);
    }

    @Test
    public void testZeroDistortionCameraIsNoOp() {
        Mat image = new Mat(700, 900, CvType.CV_8UC3, new Scalar(200, 150, 100));
        ResolvedFrame frame = frame(new double[][]{{80, 70}, {820, 70}, {820, 580}, {80, 580}});
        CameraModel camera = new CameraModel(800, 800, 450, 350, 0, 0, 0, 0, 0);

        try (RectifiedImage plain = rectifier.rectify(image, frame, classic, null);
             RectifiedImage undistorted = rectifier.rectify(image, frame, classic, camera)) {
            for (int i = 0; i < 4; i++) {
                assertTrue(plain.getChartBoundary().corner(i)
                    .distanceTo(undistorted.getChartBoundary().corner(i)) < 1e-2);
            }
            Mat a = plain.getImage().submat(10, plain.getHeight() - 10, 10, plain.getWidth() - 10);
            Mat b = undistorted.getImage().submat(10, plain.getHeight() - 10, 10, plain.getWidth() - 10);
            assertTrue(Core.norm(a, b, Core.NORM_INF) <= 2.0);
            a.release();
            b.release();
        }
        image.release();
    }

    @Test
    public void testBoundaryFarOutsideImage() {
        Mat tiny = new Mat(10, 10, CvType.CV_8UC3, new Scalar(0, 0, 0));
        ResolvedFrame frame = frame(new double[][]{{100, 100}, {900, 100}, {900, 650}, {100, 650}});

        ChartExtractionException e = assertThrows(ChartExtractionException.class,
            () -> rectifier.rectify(tiny, frame, classic, null));
        assertEquals(FailureKind.DEGENERATE_GEOMETRY, e.getKind());
        tiny.release();
    }

    @Test
    public void testKeepsSixteenBitDepth() {
        Mat image = new Mat(700, 900, CvType.CV_16UC3, new Scalar(60000, 30000, 1000));
        ResolvedFrame frame = frame(new double[][]{{80, 70}, {820, 70}, {820, 580}, {80, 580}});

        try (RectifiedImage rectified = rectifier.rectify(image, frame, classic, null)) {
            assertEquals(CvType.CV_16UC3, rectified.getImage().type());
            double[] centre = rectified.getImage().get(rectified.getHeight() / 2, rectified.getWidth() / 2);
            assertEquals(60000, centre[0], 1.0);
        }
        image.release();
    }

    private static ResolvedFrame frame(double[][] centres) {
        Map<Integer, Marker> markers = new HashMap<>();
        for (int id = 0; id < 4; id++) {
            double x = centres[id][0];
            double y = centres[id][1];
            markers.put(id, new Marker(id, new Point[]{
                new Point(x - 10, y - 10), new Point(x + 10, y - 10),
                new Point(x + 10, y + 10), new Point(x - 10, y + 10)}));
        }
        return new MarkerSetResolver(MarkerRoleTable.defaults()).resolve(markers);
    }
}
