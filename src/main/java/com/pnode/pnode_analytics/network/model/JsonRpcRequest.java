package com.pnode.pnode_analytics.network.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class JsonRpcRequest {
    private String jsonrpc;
    private String method;
    private long id;

    public static JsonRpcRequest of(String method) {
        return new JsonRpcRequest("2.0", method, 1);
    }
}
