package com.firefly.prdagent.vo;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.firefly.prdagent.exception.ChatErrorCode;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * 非流式接口的统一响应体；失败时 errorCode 为 {@link ChatErrorCode} 名称，前端按它分支处理
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private Boolean success;
    private String message;
    private T data;
    private Integer code;
    private String errorCode;
    private List<ValidationError> errors;

    @Data
    @Builder
    public static class ValidationError {
        private String field;
        private String message;
    }

    public static <T> ApiResponse<T> success(T data) {
        return success("操作成功", data);
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return ApiResponse.<T>builder()
                .success(true)
                .message(message)
                .data(data)
                .code(200)
                .build();
    }

    public static <T> ApiResponse<T> error(String message, int code) {
        return ApiResponse.<T>builder()
                .success(false)
                .message(message)
                .code(code)
                .build();
    }

    /**
     * 业务错误：HTTP 状态取自错误码，message 为空时用错误码的默认文案
     */
    public static <T> ApiResponse<T> failure(ChatErrorCode errorCode, String message) {
        return ApiResponse.<T>builder()
                .success(false)
                .message(message != null ? message : errorCode.getDefaultMessage())
                .code(errorCode.getHttpStatus().value())
                .errorCode(errorCode.name())
                .build();
    }

    public static <T> ApiResponse<T> invalid(List<ValidationError> errors) {
        return ApiResponse.<T>builder()
                .success(false)
                .message("参数验证失败")
                .code(400)
                .errors(errors)
                .build();
    }
}
