package com.plot.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 全局异常处理器
 * 错误响应统一为 {"detail": ...} 格式
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    public static final String PLOT_NOT_FOUND = "Plot not found";

    /**
     * 处理剧情不存在
     */
    @ExceptionHandler(PlotNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handlePlotNotFound(PlotNotFoundException e) {
        logger.warn("剧情不存在: id={}", e.getPlotId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(detail(PLOT_NOT_FOUND));
    }

    /**
     * 处理请求体字段校验失败
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        List<Map<String, Object>> errors = new ArrayList<>();
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            errors.add(error(Arrays.asList("body", fieldError.getField()), fieldError.getDefaultMessage()));
        }
        logger.warn("参数校验失败: {}", errors);
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(detail(errors));
    }

    /**
     * 处理请求体缺失或JSON格式错误
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException e) {
        logger.warn("请求体无法解析: {}", e.getMessage());
        List<Map<String, Object>> errors = Collections.singletonList(
                error(Collections.singletonList("body"), "请求体缺失或JSON格式错误"));
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(detail(errors));
    }

    /**
     * 处理参数类型错误（如路径中的ID不是整数）
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        logger.warn("参数类型错误: {}", e.getMessage());
        String expected = e.getRequiredType() != null ? e.getRequiredType().getSimpleName() : "unknown";
        List<Map<String, Object>> errors = Collections.singletonList(
                error(Collections.singletonList(e.getName()), "参数 " + e.getName() + " 类型不正确，期望 " + expected));
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(detail(errors));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        logger.warn("不支持的请求方法: {}", e.getMethod());
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(detail("Method Not Allowed"));
    }

    /**
     * 处理不支持的请求体类型（如 text/plain）
     */
    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleMediaTypeNotSupported(HttpMediaTypeNotSupportedException e) {
        logger.warn("不支持的请求体类型: {}", e.getContentType());
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE).body(detail("Unsupported Media Type"));
    }

    /**
     * 客户端要求的响应类型无法提供，此时不能再写JSON响应体
     */
    @ExceptionHandler(HttpMediaTypeNotAcceptableException.class)
    public ResponseEntity<Void> handleMediaTypeNotAcceptable(HttpMediaTypeNotAcceptableException e) {
        logger.warn("无法提供可接受的响应类型: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_ACCEPTABLE).build();
    }

    /**
     * 处理参数缺失异常
     */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParameter(MissingServletRequestParameterException e) {
        logger.warn("参数缺失: {}", e.getParameterName());
        List<Map<String, Object>> errors = Collections.singletonList(
                error(Collections.singletonList(e.getParameterName()), "缺少必要参数: " + e.getParameterName()));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(detail(errors));
    }

    /**
     * 处理数据库操作异常
     */
    @ExceptionHandler(org.springframework.dao.DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleDataAccessException(Exception e) {
        logger.error("数据库操作异常: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(detail("Internal Server Error"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneralException(Exception e) {
        logger.error("系统异常: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(detail("Internal Server Error"));
    }

    private static Map<String, Object> detail(Object detail) {
        Map<String, Object> body = new HashMap<>();
        body.put("detail", detail);
        return body;
    }

    private static Map<String, Object> error(List<String> loc, String msg) {
        Map<String, Object> error = new HashMap<>();
        error.put("loc", loc);
        error.put("msg", msg);
        return error;
    }

    /**
     * 剧情不存在异常
     */
    public static class PlotNotFoundException extends RuntimeException {
        private final Long plotId;

        public PlotNotFoundException(Long plotId) {
            super(PLOT_NOT_FOUND);
            this.plotId = plotId;
        }

        public Long getPlotId() {
            return plotId;
        }
    }
}
