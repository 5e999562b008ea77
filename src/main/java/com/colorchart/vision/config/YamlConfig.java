package com.colorchart.vision.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "colorchart-vision")
public class YamlConfig {
    private MarkerConfig markers = new MarkerConfig();
    private LayoutConfig layouts = new LayoutConfig();
    private SamplingConfig sampling = new SamplingConfig();
    private CompensationConfig compensation = new CompensationConfig();
    private InputConfig input = new InputConfig();
    private OutputConfig output = new OutputConfig();

    @Data
    public static class MarkerConfig {
        // 必须与模板生成器一致
        private int topLeftId = 0;
        private int topRightId = 1;
        private int bottomRightId = 2;
        private int bottomLeftId = 3;
        private boolean subPixelRefinement = true;
        // 标记中心间最小距离（像素）
        private double minSeparation = 10.0;
        // 标记中心四边形最小面积（平方像素）
        private double minArea = 1000.0;
    }

    @Data
    public static class LayoutConfig {
        // 宽高比相对容差
        private double tolerance = 0.15;
        // 启用的版式，按优先级排列：classic, digitalsg
        private java.util.List<String> enabled = java.util.List.of("classic", "digitalsg");
    }

    @Data
    public static class SamplingConfig {
        private double pixelsPerMm = 5.0;
        // 每个色块中心取样区域的面积占比
        private double sampleAreaFraction = 0.4;
    }

    @Data
    public static class CompensationConfig {
        // 外圈灰阶均值下限（满量程比例）
        private double minSignalFraction = 0.005;
    }

    @Data
    public static class InputConfig {
        // extract-file 只读取此目录下的图像和标定文件
        private String directory = "data/input";
    }

    @Data
    public static class OutputConfig {
        private String directory = "data/output";
    }
}
