package com.colorchart.vision.service;

import com.colorchart.vision.config.NativeLibraryLoader;
import com.colorchart.vision.core.ChartExtraction;
import com.colorchart.vision.core.ChartExtractionPipeline;
import com.colorchart.vision.core.SyntheticChartRenderer;
import com.colorchart.vision.core.layout.ChartLayout;
import com.colorchart.vision.core.layout.ChartLayouts;
import com.colorchart.vision.model.ReportFiles;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExtractionReportWriterTest {

    private final ExtractionReportWriter writer = new ExtractionReportWriter();
    private final ChartExtractionPipeline pipeline = ChartExtractionPipeline.withDefaults();

    @BeforeAll
    public static void loadOpenCV() {
        NativeLibraryLoader.loadNativeLibraries();
    }

    @Test
    public void testClassicReport(@TempDir Path dir) throws Exception {
        ChartLayout classic = ChartLayouts.classic();
        Mat scene = SyntheticChartRenderer.render(classic, SyntheticChartRenderer.distinctColors(24));

        ReportFiles files;
        try (ChartExtraction extraction = pipeline.extractDetailed(scene, null, false)) {
            files = writer.write(scene, extraction, dir.resolve("run"));
        }

        JsonNode json = new ObjectMapper().readTree(Paths.get(files.getData()).toFile());
        assertEquals("classic", json.get("colorchecker_type").asText());
        assertEquals("ColorChecker Classic", json.get("colorchecker_name").asText());
        assertEquals(4, json.get("layout").get("rows").asInt());
        assertEquals(6, json.get("layout").get("cols").asInt());
        assertEquals(24, json.get("layout").get("total_patches").asInt());
        assertEquals(8, json.get("bit_depth").asInt());
        assertEquals(24, json.get("patch_colors").size());
        assertEquals(3, json.get("patch_colors").get(0).size());
        assertFalse(json.has("patch_colors_compensated"));
        assertTrue(json.get("created_at").isTextual());

        Mat extracted = Imgcodecs.imread(files.getExtractedImage(), Imgcodecs.IMREAD_UNCHANGED);
        assertEquals(1080, extracted.cols());
        assertEquals(699, extracted.rows());
        assertTrue(Files.exists(Paths.get(files.getVisualization())));

        extracted.release();
        scene.release();
    }

    @Test
    public void testSixteenBitCompensatedReport(@TempDir Path dir) throws Exception {
        ChartLayout sg = ChartLayouts.digitalSg();
        List<double[]> colors = new ArrayList<>();
        for (int i = 0; i < sg.getPatchCount(); i++) {
            colors.add(sg.grayRole(i) != null ? new double[]{200, 200, 200} : new double[]{90, 160, 40});
        }
        Mat scene = SyntheticChartRenderer.render(sg, colors);
        SyntheticChartRenderer.applyFalloff(scene, sg, 0.3);
        Mat scene16 = SyntheticChartRenderer.to16Bit(scene);

        ReportFiles files;
        try (ChartExtraction extraction = pipeline.extractDetailed(scene16, null, true)) {
            files = writer.write(scene16, extraction, dir);
        }

        JsonNode json = new ObjectMapper().readTree(Paths.get(files.getData()).toFile());
        assertEquals("digitalsg", json.get("colorchecker_type").asText());
        assertEquals(16, json.get("bit_depth").asInt());
        assertEquals(140, json.get("patch_colors_compensated").size());
        assertEquals(3, json.get("compensation_factors").size());
        assertTrue(json.get("patch_colors").get(20).get(0).asDouble() > 255);

        Mat extracted = Imgcodecs.imread(files.getExtractedImage(), Imgcodecs.IMREAD_UNCHANGED);
        assertEquals(CvType.CV_16U, extracted.depth());
        Mat vis = Imgcodecs.imread(files.getVisualization(), Imgcodecs.IMREAD_UNCHANGED);
        assertEquals(CvType.CV_8UC3, vis.type());

        extracted.release();
        vis.release();
        scene.release();
        scene16.release();
    }
}
