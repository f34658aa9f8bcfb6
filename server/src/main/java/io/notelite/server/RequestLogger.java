package io.notelite.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request-level logging for the status endpoint.
 * One line per request with method, path, status and latency; 5xx goes out at WARNING.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * @param coreMillis time spent waiting on the consistency core, or -1 if not measured
     * @param error      failure behind a 5xx, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long coreMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                coreMillis >= 0 ? ", core=" + coreMillis + "ms" : ""
        );

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else {
            log.fine(msg);
        }
    }
}
