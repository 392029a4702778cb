package com.crescent.gateway.api;

import com.crescent.gateway.core.error.GatewayException;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 统一错误信封：{@code {error: {message, type, code}}}，所有方言共用
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "错误响应")
public class ErrorResponse {

    private ErrorDetail error;

    public static ErrorResponse of(GatewayException e) {
        return new ErrorResponse(ErrorDetail.builder()
                .message(e.getMessage())
                .type(e.getKind().getType())
                .code(e.getCode())
                .param(e.getParam())
                .build());
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetail {
        private String message;
        private String type;
        private String code;
        private String param;
    }
}
