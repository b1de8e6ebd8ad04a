package com.pnode.pnode_analytics.network.client;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PrpcClientTest {

    @Test
    void testRpcUrlForIpv4Host() {
        assertEquals("http://173.212.220.65:6000/rpc", PrpcClient.rpcUrl("173.212.220.65", 6000));
    }

    @Test
    void testRpcUrlBracketsIpv6Host() {
        assertEquals("http://[::1]:6000/rpc", PrpcClient.rpcUrl("::1", 6000));
        assertEquals("http://[2001:db8::7]:9001/rpc", PrpcClient.rpcUrl("2001:db8::7", 9001));
    }
}
