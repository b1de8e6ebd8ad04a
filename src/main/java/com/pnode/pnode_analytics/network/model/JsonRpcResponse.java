package com.pnode.pnode_analytics.network.model;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class JsonRpcResponse<T> {
    private String jsonrpc;
    private T result;
    private JsonRpcError error;
    private Long id;

    @Data
    @NoArgsConstructor
    public static class JsonRpcError {
        private int code;
        private String message;
    }
}
