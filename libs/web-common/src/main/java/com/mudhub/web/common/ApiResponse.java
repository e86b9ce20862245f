package com.mudhub.web.common;

import java.io.Serializable;

/**
 * 运维/内部接口统一响应格式。
 *
 * code 与 HTTP 语义保持一致：
 * 200 成功，400 参数错误，404 玩家不存在，409 状态冲突（如会话不匹配），
 * 429 发送过于频繁，500 服务器错误。
 *
 * @param <T> 响应数据类型
 */
public record ApiResponse<T>(int code, String message, T data) implements Serializable {

    public static final int OK = 200;
    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int CONFLICT = 409;
    public static final int TOO_MANY_REQUESTS = 429;
    public static final int SERVER_ERROR = 500;

    public static <T> ApiResponse<T> success() {
        return new ApiResponse<>(OK, "success", null);
    }

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(OK, "success", data);
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(OK, message, data);
    }

    /**
     * 失败响应（自定义状态码）
     */
    public static <T> ApiResponse<T> error(int code, String message) {
        return new ApiResponse<>(code, message, null);
    }

    /**
     * 失败响应（自定义状态码，附带数据，例如限流时返回剩余配额）
     */
    public static <T> ApiResponse<T> error(int code, String message, T data) {
        return new ApiResponse<>(code, message, data);
    }

    public static <T> ApiResponse<T> badRequest(String message) {
        return error(BAD_REQUEST, message);
    }

    public static <T> ApiResponse<T> notFound(String message) {
        return error(NOT_FOUND, message);
    }

    public static <T> ApiResponse<T> conflict(String message) {
        return error(CONFLICT, message);
    }

    public static <T> ApiResponse<T> tooManyRequests(String message) {
        return error(TOO_MANY_REQUESTS, message);
    }

    public static <T> ApiResponse<T> serverError(String message) {
        return error(SERVER_ERROR, message);
    }

    public boolean isSuccess() {
        return code == OK;
    }
}
