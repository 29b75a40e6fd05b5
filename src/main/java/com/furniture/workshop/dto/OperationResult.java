package com.furniture.workshop.dto;

/** Uniform outcome of every cascade operation. */
public record OperationResult<T>(boolean success, T data, String message) {

    public static <T> OperationResult<T> ok(T data, String message) {
        return new OperationResult<>(true, data, message);
    }

    public static <T> OperationResult<T> failure(String message) {
        return new OperationResult<>(false, null, message);
    }
}
