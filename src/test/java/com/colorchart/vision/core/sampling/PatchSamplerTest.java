package com.colorchart.vision.core.sampling;

import com.colorchart.vision.config.NativeLibraryLoader;
import com.colorchart.vision.core.BitDepth;
import com.colorchart.vision.core.geometry.Quadrilateral;
import com.colorchart.vision.core.layout.ChartLayout;
import com.colorchart.vision.core.layout.ChartLayouts;
import com.colorchart.vision.core.rectify.RectifiedImage;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PatchSamplerTest {

    private static final double PPM = 5.0;

    private final PatchSampler sampler = new PatchSampler();
    private final ChartLayout classic = ChartLayouts.classic();

    @BeforeAll
    public static void loadOpenCV() {
        NativeLibraryLoader.loadNativeLibraries();
    }

    @Test
    public void testRowMajorRgbMeans() {
        Mat image = paintCells(CvType.CV_8UC3, 1.0);

        try (RectifiedImage rectified = rectified(image, BitDepth.EIGHT)) {
            List<PatchSample> samples = sampler.sample(rectified, classic);

            assertEquals(24, samples.size());
            for (PatchSample s : samples) {
                assertEquals(s.getRow() * 6 + s.getCol(), s.getIndex());
                assertArrayEquals(expectedRgb(s.getIndex(), 1.0), s.getRgb(), 1e-9, "patch " + s.getIndex());
            }
        }
    }

    @Test
    public void testSixteenBitValuesNotRescaled() {
        Mat image = paintCells(CvType.CV_16UC3, 257.0);

        try (RectifiedImage rectified = rectified(image, BitDepth.SIXTEEN)) {
            List<PatchSample> samples = sampler.sample(rectified, classic);
            assertArrayEquals(expectedRgb(7, 257.0), samples.get(7).getRgb(), 1e-6);
            assertTrue(samples.get(7).getRgb()[0] > 255);
        }
    }

    @Test
    public void testGrayImageReplicatedToRgb() {
        Mat image = new Mat(699, 1080, CvType.CV_8UC1, new Scalar(77));

        try (RectifiedImage rectified = rectified(image, BitDepth.EIGHT)) {
            double[] rgb = sampler.sample(rectified, classic).get(0).getRgb();
            assertArrayEquals(new double[]{77, 77, 77}, rgb, 1e-9);
        }
    }

    @Test
    public void testBgraReorderedToRgb() {
        Mat image = new Mat(699, 1080, CvType.CV_8UC4, new Scalar(10, 20, 30, 255));

        try (RectifiedImage rectified = rectified(image, BitDepth.EIGHT)) {
            double[] rgb = sampler.sample(rectified, classic).get(5).getRgb();
            assertArrayEquals(new double[]{30, 20, 10}, rgb, 1e-9);
        }
    }

    @Test
    public void testRegionCoversCentralFraction() {
        Mat image = new Mat(699, 1080, CvType.CV_8UC3, new Scalar(0, 0, 0));

        try (RectifiedImage rectified = rectified(image, BitDepth.EIGHT)) {
            SamplingRegion region = sampler.region(rectified, classic, 1, 2);
            double cellArea = classic.getCellWidthMm() * PPM * classic.getCellHeightMm() * PPM;

            assertEquals(0.4, region.getArea() / cellArea, 0.02);
            double cellCenterX = (classic.getGridInsetXMm() + 2.5 * classic.getCellWidthMm()) * PPM;
            assertEquals(cellCenterX, (region.getMinX() + region.getMaxX()) / 2.0, 1.0);
        }
    }

    @Test
    public void testRegionNeverEmpty() {
        Mat image = new Mat(4, 6, CvType.CV_8UC3, new Scalar(1, 2, 3));
        RectifiedImage rectified = new RectifiedImage(image, 6 / 215.9, 4 / 139.7, BitDepth.EIGHT,
            Quadrilateral.rectangle(0, 0, 6, 4));

        List<PatchSample> samples = new PatchSampler(0.01).sample(rectified, classic);
        for (PatchSample s : samples) {
            assertTrue(s.getRegion().getArea() >= 1);
        }
        rectified.release();
    }

    private RectifiedImage rectified(Mat image, BitDepth depth) {
        return new RectifiedImage(image, PPM, PPM, depth,
            Quadrilateral.rectangle(0, 0, image.cols(), image.rows()));
    }

    /**
     * 按正视坐标绘制每个色块
     */
    private Mat paintCells(int type, double scale) {
        Mat image = new Mat(699, 1080, type, Scalar.all(0));
        for (int row = 0; row < classic.getRows(); row++) {
            for (int col = 0; col < classic.getCols(); col++) {
                int index = classic.indexOf(row, col);
                double x0 = (classic.getGridInsetXMm() + col * classic.getCellWidthMm()) * PPM;
                double y0 = (classic.getGridInsetYMm() + row * classic.getCellHeightMm()) * PPM;
                double[] rgb = expectedRgb(index, scale);
                Imgproc.rectangle(image, new Point(x0, y0),
                    new Point(x0 + classic.getCellWidthMm() * PPM, y0 + classic.getCellHeightMm() * PPM),
                    new Scalar(rgb[2], rgb[1], rgb[0]), -1);
            }
        }
        return image;
    }

    private static double[] expectedRgb(int index, double scale) {
        return new double[]{(10 + index * 10) * scale, (250 - index * 9) * scale, (index * 7 % 200) * scale};
    }
}
