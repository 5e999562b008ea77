package com.colorchart.vision.service;

import com.colorchart.vision.core.rectify.CameraModel;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class CameraModelLoaderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final CameraModelLoader loader = new CameraModelLoader(mapper);

    @Test
    public void testLoadCalibrationFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("camera.json");
        Files.writeString(file, "{\"camera_matrix\": [[1200, 0, 960], [0, 1180, 540], [0, 0, 1]],"
            + " \"dist_coeffs\": [-0.1, 0.02, 0.001, 0.0005, 0.0]}");

        CameraModel model = loader.load(file);

        assertEquals(1200, model.getFx(), 0.0);
        assertEquals(1180, model.getFy(), 0.0);
        assertEquals(960, model.getCx(), 0.0);
        assertEquals(540, model.getCy(), 0.0);
        assertArrayEquals(new double[]{-0.1, 0.02, 0.001, 0.0005, 0.0}, model.getDistCoeffs(), 0.0);
    }

    @Test
    public void testNestedDistortionArray() throws Exception {
        CameraModel model = loader.parse(mapper.readTree(
            "{\"camera_matrix\": [[800, 0, 320], [0, 800, 240], [0, 0, 1]], \"dist_coeffs\": [[0.1, -0.05, 0, 0]]}"));

        assertArrayEquals(new double[]{0.1, -0.05, 0, 0}, model.getDistCoeffs(), 0.0);
    }

    @Test
    public void testMissingDistortionMeansNone() throws Exception {
        CameraModel model = loader.parse(mapper.readTree(
            "{\"camera_matrix\": [[800, 0, 320], [0, 800, 240], [0, 0, 1]]}"));

        assertEquals(0, model.getDistCoeffs().length);
    }

    @Test
    public void testInvalidMatrix() throws Exception {
        assertThrows(IllegalArgumentException.class, () -> loader.parse(mapper.readTree(
            "{\"camera_matrix\": [[800, 0], [0, 800]]}")));
        assertThrows(IllegalArgumentException.class, () -> loader.parse(mapper.readTree(
            "{\"camera_matrix\": [[0, 0, 320], [0, 800, 240], [0, 0, 1]]}")));
    }

    @Test
    public void testMissingFile(@TempDir Path dir) {
        assertThrows(IllegalArgumentException.class, () -> loader.load(dir.resolve("nope.json")));
    }
}
