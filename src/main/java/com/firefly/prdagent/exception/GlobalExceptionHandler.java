package com.firefly.prdagent.exception;

import com.firefly.prdagent.vo.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;

import java.util.List;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ChatException.class)
    public ResponseEntity<ApiResponse<Object>> handleChatException(ChatException ex) {
        ChatErrorCode code = ex.getCode();
        if (code == ChatErrorCode.INTERNAL_ERROR || code == ChatErrorCode.LLM_ERROR) {
            log.error("对话请求失败 code={}: {}", code, ex.getMessage(), ex);
        } else {
            log.warn("对话请求失败 code={}: {}", code, ex.getMessage());
        }
        ApiResponse<Object> response = ApiResponse.failure(code, ex.getMessage());
        return ResponseEntity.status(code.getHttpStatus()).body(response);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> handleValidationException(MethodArgumentNotValidException ex) {
        List<ApiResponse.ValidationError> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> ApiResponse.ValidationError.builder()
                        .field(error.getField())
                        .message(error.getDefaultMessage())
                        .build())
                .collect(Collectors.toList());

        ApiResponse<Object> response = ApiResponse.invalid(errors);
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiResponse<Object>> handleMissingHeader(MissingRequestHeaderException ex) {
        log.warn("缺少请求头: {}", ex.getHeaderName());
        ApiResponse<Object> response = ApiResponse.error("缺少请求头: " + ex.getHeaderName(), 401);
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(response);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> handleIllegalArgumentException(IllegalArgumentException ex) {
        log.warn("参数错误: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error(ex.getMessage(), 400);
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(AsyncRequestTimeoutException.class)
    public ResponseEntity<String> handleAsyncRequestTimeoutException(AsyncRequestTimeoutException ex) {
        log.warn("异步请求超时: {}", ex.getMessage());
        String timeoutEvent = "event: error\ndata: timeout\n\n";
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .body(timeoutEvent);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleGenericException(Exception ex) {
        log.error("服务器内部错误", ex);
        ApiResponse<Object> response = ApiResponse.failure(ChatErrorCode.INTERNAL_ERROR, null);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
}
