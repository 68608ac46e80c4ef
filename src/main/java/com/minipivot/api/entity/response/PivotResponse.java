package com.minipivot.api.entity.response;

/**
 * 通用响应，getData 为具体的结构化结果。
 */
public class PivotResponse<T> {

    private final boolean success;
    private final T data;
    private final String error;

    private PivotResponse(boolean success, T data, String error) {
        this.success = success;
        this.data = data;
        this.error = error;
    }

    public static <T> PivotResponse<T> success(T data) {
        return new PivotResponse<>(true, data, null);
    }

    public static <T> PivotResponse<T> failure(String message) {
        return new PivotResponse<>(false, null, message);
    }

    public boolean isSuccess() {
        return success;
    }

    public T getData() {
        return data;
    }

    public String getError() {
        return error;
    }
}
