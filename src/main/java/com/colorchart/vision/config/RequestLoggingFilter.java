package com.colorchart.vision.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.ContentCachingResponseWrapper;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 色卡接口请求日志
 * <p>
 * 只处理 /api/chart/**。请求体多为 Base64 图像，只记录长度；
 * 提取失败（4xx/5xx）时在 debug 级别记录响应体，便于排查 errorKind。
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    private static final String CHART_API = "/api/chart/";
    private static final int MAX_ERROR_BODY_LOG = 2000;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(CHART_API);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        ContentCachingRequestWrapper requestWrapper = new ContentCachingRequestWrapper(request);
        ContentCachingResponseWrapper responseWrapper = new ContentCachingResponseWrapper(response);
        long startTime = System.currentTimeMillis();

        try {
            filterChain.doFilter(requestWrapper, responseWrapper);
        } finally {
            int status = responseWrapper.getStatus();
            logger.info("{} {} | request {} bytes | {} | {} ms", request.getMethod(), request.getRequestURI(),
                requestWrapper.getContentAsByteArray().length, status, System.currentTimeMillis() - startTime);

            byte[] body = responseWrapper.getContentAsByteArray();
            if (status >= 400 && body.length > 0 && logger.isDebugEnabled()) {
                int length = Math.min(body.length, MAX_ERROR_BODY_LOG);
                logger.debug("Error response: {}", new String(body, 0, length, StandardCharsets.UTF_8));
            }

            responseWrapper.copyBodyToResponse();
        }
    }
}
