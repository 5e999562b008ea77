package com.colorchart.vision;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ColorChartVisionApplication {

    public static void main(String[] args) {
        SpringApplication.run(ColorChartVisionApplication.class, args);
    }
}
