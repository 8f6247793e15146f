package com.plant.hierarchy.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Uniform response envelope: status is "success" or "fail"
 *
 * @param <T> payload type
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiResponse<T> {

    public static final String SUCCESS = "success";
    public static final String FAIL = "fail";

    private String status;
    private String message;
    private T data;

    public static <T> ApiResponse<T> success(T data, String message) {
        return new ApiResponse<>(SUCCESS, message, data);
    }

    public static <T> ApiResponse<T> fail(String message) {
        return new ApiResponse<>(FAIL, message, null);
    }
}
