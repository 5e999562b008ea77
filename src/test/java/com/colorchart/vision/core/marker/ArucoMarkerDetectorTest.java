package com.colorchart.vision.core.marker;

import com.colorchart.vision.config.NativeLibraryLoader;
import com.colorchart.vision.core.SyntheticChartRenderer;
import com.colorchart.vision.core.geometry.Point;
import com.colorchart.vision.core.layout.ChartLayout;
import com.colorchart.vision.core.layout.ChartLayouts;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ArucoMarkerDetectorTest {

    private final ArucoMarkerDetector detector = new ArucoMarkerDetector();
    private final ChartLayout classic = ChartLayouts.classic();

    @BeforeAll
    public static void loadOpenCV() {
        NativeLibraryLoader.loadNativeLibraries();
    }

    @Test
    public void testDetectsAllFourMarkers() {
        Mat scene = SyntheticChartRenderer.render(classic, SyntheticChartRenderer.distinctColors(24));

        Map<Integer, Marker> markers = detector.detect(scene);

        assertEquals(Set.of(0, 1, 2, 3), markers.keySet());
        Point expected = new Point(
            (classic.markerCenterMm(CornerRole.TOP_LEFT).x + SyntheticChartRenderer.MARGIN_MM) * SyntheticChartRenderer.SCALE,
            (classic.markerCenterMm(CornerRole.TOP_LEFT).y + SyntheticChartRenderer.MARGIN_MM) * SyntheticChartRenderer.SCALE);
        assertTrue(markers.get(0).centroid().distanceTo(expected) < 1.5,
            "centroid " + markers.get(0).centroid() + " expected near " + expected);
        scene.release();
    }

    @Test
    public void testOmittedMarkerIsMissing() {
        Mat scene = SyntheticChartRenderer.render(classic, SyntheticChartRenderer.distinctColors(24), Set.of(2));

        Map<Integer, Marker> markers = detector.detect(scene);

        assertFalse(markers.containsKey(2));
        assertEquals(3, markers.size());
        scene.release();
    }

    @Test
    public void testGrayAndSixteenBitInput() {
        Mat scene = SyntheticChartRenderer.render(classic, SyntheticChartRenderer.distinctColors(24));
        Mat gray = new Mat();
        Imgproc.cvtColor(scene, gray, Imgproc.COLOR_BGR2GRAY);
        Mat scene16 = SyntheticChartRenderer.to16Bit(scene);

        assertEquals(4, detector.detect(gray).size());
        assertEquals(4, detector.detect(scene16).size());

        scene.release();
        gray.release();
        scene16.release();
    }

    @Test
    public void testBlankImage() {
        Mat blank = new Mat(200, 200, CvType.CV_8UC3, new Scalar(255, 255, 255));
        assertTrue(detector.detect(blank).isEmpty());
        blank.release();
    }

    @Test
    public void testEmptyImageRejected() {
        assertThrows(IllegalArgumentException.class, () -> detector.detect(new Mat()));
    }
}
