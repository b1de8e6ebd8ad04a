package com.pnode.pnode_analytics.api.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ErrorResponse {
    private String error;
    private String message;

    public static ErrorResponse notFound(String message) {
        return new ErrorResponse("Not found", message);
    }

    public static ErrorResponse internal(String message) {
        return new ErrorResponse("Internal server error", message);
    }
}
