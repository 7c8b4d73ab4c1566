package com.cardhub.web.common;

import java.io.Serializable;

/**
 * 牌桌服务统一 HTTP 响应体。
 * code 与 HTTP 状态一致：200 成功，400 参数错误，404 牌桌不存在，409 状态冲突（动作被拒绝等），500 其他。
 *
 * @param <T> 响应数据类型
 */
public record ApiResponse<T>(int code, String message, T data) implements Serializable {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, "success", data);
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(200, message, data);
    }

    public static <T> ApiResponse<T> error(int code, String message) {
        return new ApiResponse<>(code, message, null);
    }

    public static <T> ApiResponse<T> badRequest(String message) {
        return error(400, message);
    }

    public static <T> ApiResponse<T> notFound(String message) {
        return error(404, message);
    }

    /** 业务状态不允许（例如非法动作、牌局进行中加人） */
    public static <T> ApiResponse<T> conflict(String message) {
        return error(409, message);
    }

    public static <T> ApiResponse<T> serverError(String message) {
        return error(500, message);
    }

    public boolean isSuccess() {
        return code == 200;
    }
}
