package dev.zhengxiang.multiplexer;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Decides whether a producer error is transient, i.e. whether a previously cached value may be
 * served instead of the error. Errors not classified transient are propagated to the callers and
 * discard the cached value.
 */
@FunctionalInterface
public interface TransientErrorPolicy {

    boolean isTransient(Throwable error);

    /**
     * Connectivity failures: the host could not be reached or the connection was lost. The whole
     * cause chain is inspected.
     */
    static TransientErrorPolicy connectivity() {
        return error -> {
            Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
            for (Throwable e = error; e != null && seen.add(e); e = e.getCause()) {
                if (e instanceof ConnectException
                        || e instanceof NoRouteToHostException
                        || e instanceof UnknownHostException
                        || e instanceof SocketException
                        || e instanceof HttpConnectTimeoutException) {
                    return true;
                }
            }
            return false;
        };
    }

    static TransientErrorPolicy never() {
        return error -> false;
    }

    static TransientErrorPolicy always() {
        return error -> true;
    }
}
