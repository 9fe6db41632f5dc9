package ai.symgraph.util;

import ai.symgraph.exception.GlobalExceptionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

public final class ExecutorServiceUtil {

    private static final GlobalExceptionHandler UNCAUGHT = new GlobalExceptionHandler();

    private ExecutorServiceUtil() {}

    /** Fixed pool of daemon threads named {@code threadPrefix1}, {@code threadPrefix2}, ... */
    public static ExecutorService newFixedThreadExecutor(int parallelism, String threadPrefix) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, was " + parallelism);
        }
        var factory = new ThreadFactory() {
            private final ThreadFactory delegate = Executors.defaultThreadFactory();
            private int count = 0;

            @Override
            public synchronized Thread newThread(Runnable r) {
                var t = delegate.newThread(r);
                t.setName(threadPrefix + ++count);
                t.setDaemon(true);
                t.setUncaughtExceptionHandler(UNCAUGHT);
                return t;
            }
        };
        return Executors.newFixedThreadPool(parallelism, factory);
    }
}
