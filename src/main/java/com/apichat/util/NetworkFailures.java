package com.apichat.util;

import io.netty.handler.timeout.ReadTimeoutException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;
import org.springframework.web.reactive.function.client.WebClientRequestException;

/**
 * Classifies the exceptions that escape a blocking WebClient call. Reactor wraps checked
 * exceptions on {@code block()}, so the whole cause chain is inspected.
 */
public final class NetworkFailures {

    private NetworkFailures() {
    }

    public static boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t instanceof ReadTimeoutException) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when no response was received at all: refused connection, unknown host, or a
     * request-level failure reported by the client.
     */
    public static boolean isConnectionFailure(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof WebClientRequestException
                    || t instanceof ConnectException
                    || t instanceof UnknownHostException) {
                return true;
            }
        }
        return false;
    }
}
