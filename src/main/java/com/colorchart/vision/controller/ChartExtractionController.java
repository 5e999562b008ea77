package com.colorchart.vision.controller;

import com.colorchart.vision.core.ChartExtractionException;
import com.colorchart.vision.core.layout.ChartLayoutTable;
import com.colorchart.vision.core.rectify.CameraModel;
import com.colorchart.vision.dto.ExtractionRequest;
import com.colorchart.vision.dto.ExtractionResponse;
import com.colorchart.vision.dto.FileExtractionRequest;
import com.colorchart.vision.dto.LayoutInfo;
import com.colorchart.vision.model.ExtractionOutcome;
import com.colorchart.vision.service.ChartExtractionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 色卡提取控制器
 */
@RestController
@RequestMapping("/api/chart")
@Tag(name = "色卡提取", description = "ArUco 标记定位、版式识别、色块取样与光照补偿")
public class ChartExtractionController {
    private static final Logger logger = LoggerFactory.getLogger(ChartExtractionController.class);

    @Autowired
    private ChartExtractionService extractionService;

    @Autowired
    private ChartLayoutTable chartLayoutTable;

    /**
     * 提取 Base64 图像中的色卡颜色
     */
    @PostMapping("/extract")
    @Operation(
            summary = "提取色卡颜色",
            description = """
                    从上传图像中定位四个 ArUco 标记，识别色卡版式并提取每个色块的平均颜色。

                    **注意事项**：
                    - 四个标记必须全部可见（默认 ID 0-3 对应左上、右上、右下、左下）
                    - 颜色为 RGB 顺序，取值范围与源图像位深一致（8 位 0-255，16 位 0-65535）
                    - 光照补偿仅对 digitalsg 版式生效；补偿不稳定时返回原始颜色，status 为 warning
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "提取成功",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    name = "成功示例",
                                    value = """
                                            {
                                              "status": "success",
                                              "data": {
                                                "layoutKey": "classic",
                                                "rows": 4,
                                                "cols": 6,
                                                "totalPatches": 24,
                                                "bitDepth": 8,
                                                "patches": [{"index": 0, "row": 0, "col": 0, "rgb": [115.2, 82.1, 68.4]}]
                                              }
                                            }
                                            """
                            )
                    )
            ),
            @ApiResponse(responseCode = "400", description = "请求参数错误"),
            @ApiResponse(responseCode = "422", description = "色卡提取失败")
    })
    public ResponseEntity<Map<String, Object>> extract(@RequestBody ExtractionRequest request) {
        try {
            CameraModel camera = request.getCameraMatrix() == null
                ? null
                : CameraModel.fromMatrix(request.getCameraMatrix(), request.getDistCoeffs());
            ExtractionOutcome outcome = extractionService.extract(request.getImage(), camera,
                request.isCompensate(), request.isSaveReport(), request.getOutputDir());
            return success(outcome);
        } catch (ChartExtractionException e) {
            return extractionFailure(e);
        } catch (IllegalArgumentException e) {
            return badRequest(e);
        } catch (Exception e) {
            return serverError(e);
        }
    }

    /**
     * 提取服务器本地图像文件中的色卡颜色
     */
    @PostMapping("/extract-file")
    @Operation(
            summary = "提取本地图像中的色卡颜色",
            description = """
                    读取服务器上的图像文件（可选相机标定 JSON），提取结果写入输出目录。
                    相对路径按配置的输入/输出根目录解析，超出根目录的路径返回 400。
                    输出文件：
                    - colorchecker_extracted.png：校正后的色卡图
                    - detection_visualization.png：标记与边界可视化
                    - colorchecker_data.json：色块颜色数据
                    """
    )
    public ResponseEntity<Map<String, Object>> extractFile(@RequestBody FileExtractionRequest request) {
        try {
            if (request.getImagePath() == null || request.getImagePath().isBlank()) {
                throw new IllegalArgumentException("imagePath is required");
            }
            ExtractionOutcome outcome = extractionService.extractFile(request.getImagePath(),
                request.getCameraParamsPath(), request.isCompensate(), request.getOutputDir());
            return success(outcome);
        } catch (ChartExtractionException e) {
            return extractionFailure(e);
        } catch (IllegalArgumentException e) {
            return badRequest(e);
        } catch (Exception e) {
            return serverError(e);
        }
    }

    /**
     * 已启用的版式
     */
    @GetMapping("/layouts")
    @Operation(summary = "获取已启用的版式", description = "按识别优先级返回版式、目标宽高比和容差")
    public ResponseEntity<Map<String, Object>> layouts() {
        List<LayoutInfo> layouts = chartLayoutTable.entries().stream()
            .map(LayoutInfo::from)
            .collect(Collectors.toList());
        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("data", layouts);
        return ResponseEntity.ok(response);
    }

    private ResponseEntity<Map<String, Object>> success(ExtractionOutcome outcome) {
        Map<String, Object> response = new HashMap<>();
        response.put("data", ExtractionResponse.from(outcome));
        if (outcome.hasWarning()) {
            response.put("status", "warning");
            response.put("message", "光照补偿不稳定，已返回原始颜色：" + outcome.getWarning());
        } else {
            response.put("status", "success");
            response.put("message", "提取完成");
        }
        return ResponseEntity.ok(response);
    }

    private ResponseEntity<Map<String, Object>> extractionFailure(ChartExtractionException e) {
        logger.warn("Extraction failed [{}]: {}", e.getKind(), e.getMessage());
        Map<String, Object> response = new HashMap<>();
        response.put("status", "error");
        response.put("errorKind", e.getKind().name());
        response.put("message", e.getMessage());
        if (e.getMarkersFound() >= 0) {
            response.put("markersFound", e.getMarkersFound());
            response.put("missingMarkerIds", e.getMissingMarkerIds());
        }
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(response);
    }

    private ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        logger.warn("Bad request: {}", e.getMessage());
        Map<String, Object> response = new HashMap<>();
        response.put("status", "error");
        response.put("message", e.getMessage());
        return ResponseEntity.badRequest().body(response);
    }

    private ResponseEntity<Map<String, Object>> serverError(Exception e) {
        logger.error("Extraction error", e);
        Map<String, Object> response = new HashMap<>();
        response.put("status", "error");
        response.put("message", e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
}
