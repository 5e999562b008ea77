package com.colorchart.vision.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * OpenAPI / Swagger 配置
 *
 * 访问地址：
 * - Swagger UI: http://localhost:{port}/swagger-ui.html
 * - API 文档 (JSON): http://localhost:{port}/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI colorChartOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Color Chart Vision API")
                        .description("""
                                色卡检测与颜色提取 API

                                ## 流程
                                图像 -> ArUco 标记检测 -> 标记框解析 -> 版式识别 -> 透视校正 -> 色块取样 -> 光照补偿（可选）

                                ### 支持的版式
                                | 版式 | 色块 | 光照补偿 |
                                |------|------|----------|
                                | `classic` | 4 x 6 = 24 | 不支持 |
                                | `digitalsg` | 10 x 14 = 140 | 支持（外圈 + 中心灰阶） |

                                ### 错误类型
                                | errorKind | 含义 |
                                |-----------|------|
                                | `INSUFFICIENT_MARKERS` | 四个标记未全部可见 |
                                | `DEGENERATE_GEOMETRY` | 标记位置不构成有效四边形 |
                                | `UNRECOGNIZED_LAYOUT` | 宽高比不匹配任何版式 |
                                | `COMPENSATION_UNSTABLE` | 灰阶参考过暗（自动回退为原始颜色） |

                                ### API 响应格式
                                ```json
                                {
                                  "status": "success | warning | error",
                                  "data": { ... },
                                  "message": "提示信息"
                                }
                                ```
                                """)
                        .version("1.0.0")
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")));
    }

    /**
     * 为所有 POST 接口添加统一的错误响应示例
     */
    @Bean
    public OpenApiCustomizer globalResponseCustomizer() {
        return openApi -> openApi.getPaths().forEach((path, pathItem) -> {
            if (pathItem.getPost() != null) {
                pathItem.getPost().getResponses().addApiResponse("422", createExtractionErrorResponse());
            }
        });
    }

    private ApiResponse createExtractionErrorResponse() {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "status", new Schema<>().type("string").description("状态").example("error"),
                "errorKind", new Schema<>().type("string").description("失败类型").example("INSUFFICIENT_MARKERS"),
                "message", new Schema<>().type("string").description("错误信息")
                        .example("Only 2 of 4 markers visible (missing ids [2, 3]) - reposition the chart so all markers are in view")
        ));

        return new ApiResponse()
                .description("色卡提取失败")
                .content(new Content()
                        .addMediaType("application/json",
                                new MediaType().schema(schema)));
    }
}
