package com.colorchart.vision.config;

import com.colorchart.vision.core.ChartExtractionPipeline;
import com.colorchart.vision.core.illumination.IlluminationCompensator;
import com.colorchart.vision.core.layout.ChartLayout;
import com.colorchart.vision.core.layout.ChartLayoutTable;
import com.colorchart.vision.core.layout.ChartLayouts;
import com.colorchart.vision.core.layout.ChartTypeClassifier;
import com.colorchart.vision.core.marker.ArucoMarkerDetector;
import com.colorchart.vision.core.marker.MarkerDetector;
import com.colorchart.vision.core.marker.MarkerRoleTable;
import com.colorchart.vision.core.marker.MarkerSetResolver;
import com.colorchart.vision.core.rectify.PerspectiveRectifier;
import com.colorchart.vision.core.sampling.PatchSampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 提取流水线配置
 * <p>
 * 从 application.yml 读取配置，组装不可变的映射表和流水线
 */
@Configuration
public class ChartPipelineConfig {
    private static final Logger logger = LoggerFactory.getLogger(ChartPipelineConfig.class);

    @Autowired
    private YamlConfig yamlConfig;

    @Bean
    public MarkerRoleTable markerRoleTable() {
        YamlConfig.MarkerConfig m = yamlConfig.getMarkers();
        MarkerRoleTable table = MarkerRoleTable.of(
            m.getTopLeftId(), m.getTopRightId(), m.getBottomRightId(), m.getBottomLeftId());
        logger.info("Marker role table: {}", table);
        return table;
    }

    @Bean
    public ChartLayoutTable chartLayoutTable() {
        YamlConfig.LayoutConfig config = yamlConfig.getLayouts();
        ChartLayoutTable.Builder builder = ChartLayoutTable.builder();
        for (String key : config.getEnabled()) {
            builder.add(builtinLayout(key), config.getTolerance());
        }
        ChartLayoutTable table = builder.build();
        logger.info("Chart layout table: {}", table.entries());
        return table;
    }

    @Bean
    public MarkerDetector markerDetector() {
        NativeLibraryLoader.loadNativeLibraries();
        return new ArucoMarkerDetector(ArucoMarkerDetector.DEFAULT_DICTIONARY,
            yamlConfig.getMarkers().isSubPixelRefinement());
    }

    @Bean
    public ChartExtractionPipeline chartExtractionPipeline(MarkerDetector markerDetector,
                                                           MarkerRoleTable markerRoleTable,
                                                           ChartLayoutTable chartLayoutTable) {
        NativeLibraryLoader.loadNativeLibraries();

        YamlConfig.MarkerConfig markers = yamlConfig.getMarkers();
        YamlConfig.SamplingConfig sampling = yamlConfig.getSampling();

        logger.info("Pipeline config: pixelsPerMm={}, sampleAreaFraction={}, minSignalFraction={}",
            sampling.getPixelsPerMm(), sampling.getSampleAreaFraction(),
            yamlConfig.getCompensation().getMinSignalFraction());

        return new ChartExtractionPipeline(
            markerDetector,
            new MarkerSetResolver(markerRoleTable, markers.getMinSeparation(), markers.getMinArea()),
            new ChartTypeClassifier(chartLayoutTable),
            new PerspectiveRectifier(sampling.getPixelsPerMm()),
            new PatchSampler(sampling.getSampleAreaFraction()),
            new IlluminationCompensator(yamlConfig.getCompensation().getMinSignalFraction()));
    }

    private static ChartLayout builtinLayout(String key) {
        switch (key) {
            case ChartLayouts.CLASSIC:
                return ChartLayouts.classic();
            case ChartLayouts.DIGITAL_SG:
                return ChartLayouts.digitalSg();
            default:
                throw new IllegalArgumentException("Unknown chart layout: " + key
                    + " (supported: " + ChartLayouts.CLASSIC + ", " + ChartLayouts.DIGITAL_SG + ")");
        }
    }
}
