package com.pnode.pnode_analytics.network.client;

import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.channels.ClosedChannelException;
import java.util.concurrent.TimeoutException;

/**
 * Separates the failures expected from a fleet of volunteer nodes (timeouts, refused or
 * unreachable hosts) from anything else. Expected failures are logged quietly.
 */
public final class FailureClassifier {

    private FailureClassifier() {
    }

    public static boolean isTransient(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof TimeoutException
                    || current instanceof SocketTimeoutException
                    || current instanceof ConnectException
                    || current instanceof NoRouteToHostException
                    || current instanceof UnknownHostException
                    || current instanceof ClosedChannelException) {
                return true;
            }
            if (current instanceof WebClientRequestException && current.getCause() == null) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
