package com.colorchart.vision.service;

import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;

/**
 * 图像解码
 * <p>
 * 使用 IMREAD_UNCHANGED 保留原始位深和通道数，16 位 PNG/TIFF 不会被压缩为 8 位。
 */
@Component
public class ImageDecoder {
    private static final Logger logger = LoggerFactory.getLogger(ImageDecoder.class);

    /**
     * 解码 Base64 图像，允许带 data URL 前缀
     */
    public Mat decodeBase64(String base64) {
        if (base64 == null || base64.isBlank()) {
            throw new IllegalArgumentException("Image data is empty");
        }
        if (base64.contains(",")) {
            base64 = base64.substring(base64.indexOf(',') + 1);
        }
        byte[] data;
        try {
            data = Base64.getMimeDecoder().decode(base64);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid Base64 image data", e);
        }
        return decode(data, "base64 payload");
    }

    /**
     * 从文件读取图像
     */
    public Mat read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Image file not found: " + path);
        }
        byte[] data;
        try {
            // 走 imdecode 而不是 imread，避免非 ASCII 路径在部分平台上读取失败
            data = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read image " + path, e);
        }
        return decode(data, path.toString());
    }

    private Mat decode(byte[] data, String source) {
        MatOfByte buffer = new MatOfByte(data);
        try {
            Mat image = Imgcodecs.imdecode(buffer, Imgcodecs.IMREAD_UNCHANGED);
            if (image == null || image.empty()) {
                throw new IllegalArgumentException("Could not decode image from " + source);
            }
            logger.debug("Decoded {}: {}x{}, {} channel(s), depth {}",
                source, image.cols(), image.rows(), image.channels(), image.depth());
            return image;
        } finally {
            buffer.release();
        }
    }
}
