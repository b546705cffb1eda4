package com.bastion.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Error body of every failed API call.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiError {
    private String status;
    private String code;
    private String message;

    /**
     * Providers that were tried, for routing failures.
     */
    private List<String> attemptedProviders;

    public ApiError(String status, String code, String message) {
        this(status, code, message, null);
    }
}
