package lichess.client.http;

import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.PortUnreachableException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Decides whether a failed send is worth retrying.
 * <p>
 * Only network-layer failures are transient: name resolution, refused or unreachable connections, timeouts and
 * socket errors. Application exceptions are always fatal, even when they wrap a socket error.
 */
public final class TransientFaultClassifier {
    private static final int MAX_CAUSE_DEPTH = 8;

    public FaultKind classify(Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof UnresolvedAddressException) {
            return FaultKind.TRANSIENT;
        }
        if (!(cause instanceof IOException)) {
            return FaultKind.FATAL;
        }
        Throwable current = cause;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (isTransientType(current)) {
                return FaultKind.TRANSIENT;
            }
            current = current.getCause();
        }
        return FaultKind.FATAL;
    }

    /**
     * True when the failure happened before a connection existed, so no part of the request reached the server.
     * Such failures can be retried even for requests whose body must not be sent twice.
     */
    public boolean isConnectFailure(Throwable failure) {
        Throwable cause = unwrap(failure);
        return cause instanceof UnknownHostException
                || cause instanceof UnresolvedAddressException
                || cause instanceof ConnectException
                || cause instanceof NoRouteToHostException
                || cause instanceof HttpConnectTimeoutException;
    }

    /**
     * Strips the wrappers {@link java.util.concurrent.CompletableFuture} puts around the real failure.
     */
    public static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static boolean isTransientType(Throwable t) {
        return t instanceof UnknownHostException
                || t instanceof UnresolvedAddressException
                || t instanceof ConnectException
                || t instanceof HttpTimeoutException
                || t instanceof SocketTimeoutException
                || t instanceof SocketException;
    }
}
