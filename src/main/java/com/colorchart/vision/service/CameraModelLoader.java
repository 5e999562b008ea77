package com.colorchart.vision.service;

import com.colorchart.vision.core.rectify.CameraModel;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 相机标定文件读取
 * <p>
 * 格式：{"camera_matrix": [[fx, 0, cx], [0, fy, cy], [0, 0, 1]], "dist_coeffs": [k1, k2, p1, p2, k3]}
 */
@Component
public class CameraModelLoader {
    private static final Logger logger = LoggerFactory.getLogger(CameraModelLoader.class);

    private final ObjectMapper objectMapper;

    public CameraModelLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public CameraModel load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Camera calibration file not found: " + path);
        }
        try {
            CameraModel model = parse(objectMapper.readTree(path.toFile()));
            logger.info("Loaded camera model from {}: {}", path, model);
            return model;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read camera calibration " + path, e);
        }
    }

    public CameraModel parse(JsonNode root) {
        JsonNode matrixNode = root.get("camera_matrix");
        if (matrixNode == null || !matrixNode.isArray() || matrixNode.size() != 3) {
            throw new IllegalArgumentException("camera_matrix must be a 3x3 array");
        }
        double[][] matrix = new double[3][3];
        for (int r = 0; r < 3; r++) {
            JsonNode row = matrixNode.get(r);
            if (!row.isArray() || row.size() != 3) {
                throw new IllegalArgumentException("camera_matrix row " + r + " must have 3 values");
            }
            for (int c = 0; c < 3; c++) {
                matrix[r][c] = row.get(c).asDouble();
            }
        }

        double[] dist = new double[0];
        JsonNode distNode = root.get("dist_coeffs");
        if (distNode != null && !distNode.isNull()) {
            // 兼容 [[k1, k2, ...]] 形式
            if (distNode.isArray() && distNode.size() == 1 && distNode.get(0).isArray()) {
                distNode = distNode.get(0);
            }
            dist = new double[distNode.size()];
            for (int i = 0; i < dist.length; i++) {
                dist[i] = distNode.get(i).asDouble();
            }
        }
        return CameraModel.fromMatrix(matrix, dist);
    }
}
