package com.colorchart.vision.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Paths;

/**
 * Web MVC 配置
 * <p>
 * 映射规则：/api/outputs/** -> 输出目录（校正图、可视化图、JSON 数据）
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    @Autowired
    private YamlConfig yamlConfig;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String location = Paths.get(yamlConfig.getOutput().getDirectory()).toAbsolutePath().toUri().toString();
        registry.addResourceHandler("/api/outputs/**")
                .addResourceLocations(location);
    }
}
