package im.arun.formulary.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Provides the shared bounded pool that batch runs extract documents on.
 * Each document is processed start to finish by a single worker.
 */
public final class ExecutorProvider {
    static final int MAX_POOL_SIZE = 16;

    private static volatile ExecutorService instance;
    private static final Object LOCK = new Object();

    private ExecutorProvider() {}

    /**
     * Returns the shared ExecutorService, sized to the available processors (capped).
     */
    public static ExecutorService getExecutor() {
        return getExecutor(0);
    }

    /**
     * Returns the shared ExecutorService. The pool is sized on first use: {@code requestedThreads}
     * when positive, otherwise the number of available processors, capped at {@value #MAX_POOL_SIZE}.
     * Later calls reuse the existing pool whatever size they ask for.
     */
    public static ExecutorService getExecutor(int requestedThreads) {
        if (instance == null) {
            synchronized (LOCK) {
                if (instance == null) {
                    int poolSize = Math.min(poolSize(requestedThreads), MAX_POOL_SIZE);
                    instance = Executors.newFixedThreadPool(poolSize, new ThreadFactory() {
                        private final AtomicInteger counter = new AtomicInteger(0);
                        @Override
                        public Thread newThread(Runnable r) {
                            Thread t = new Thread(r, "formulary-worker-" + counter.incrementAndGet());
                            t.setDaemon(true);
                            return t;
                        }
                    });
                }
            }
        }
        return instance;
    }

    private static int poolSize(int requestedThreads) {
        return requestedThreads > 0 ? requestedThreads : Runtime.getRuntime().availableProcessors();
    }

    /**
     * Shuts down the shared executor. Call this during application shutdown.
     */
    public static void shutdown() {
        synchronized (LOCK) {
            if (instance != null) {
                instance.shutdown();
                instance = null;
            }
        }
    }
}
