package com.pnode.pnode_analytics.network.client;

/**
 * A pRPC endpoint answered, but not with a usable result.
 */
public class PrpcException extends RuntimeException {

    public PrpcException(String message) {
        super(message);
    }
}
