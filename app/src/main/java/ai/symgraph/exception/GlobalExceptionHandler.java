package ai.symgraph.exception;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GlobalExceptionHandler implements UncaughtExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @Override
    public void uncaughtException(Thread thread, Throwable throwable) {
        handle(thread, throwable);
    }

    /**
     * Logs an exception that escaped a worker thread.
     *
     * <p>InterruptedException and CancellationException are expected when a batch is shut down early and are only
     * logged at debug level.
     */
    public static void handle(Thread thread, Throwable th) {
        if (isCausedBy(th, InterruptedException.class) || isCausedBy(th, CancellationException.class)) {
            logger.debug("Suppressing cancellation/interrupt on thread {}", thread.getName(), th);
            return;
        }
        logger.error("Uncaught exception on thread {}", thread.getName(), th);
    }

    public static boolean isCausedBy(Throwable th, Class<? extends Throwable> type) {
        for (Throwable t = th; t != null; t = t.getCause()) {
            if (type.isInstance(t)) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
