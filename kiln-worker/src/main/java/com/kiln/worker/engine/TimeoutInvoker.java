package com.kiln.worker.engine;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one unit of link work on its own thread and waits at most the wall-time budget. On expiry the unit is
 * cancelled with an interrupt and {@link TimeoutException} is thrown; code that ignores interrupts may keep running
 * in the background as a daemon thread, so callers must not assume its side effects stopped.
 */
final class TimeoutInvoker {

    private TimeoutInvoker() {
    }

    static <T> T invoke(Callable<T> work, int timeoutSec, String threadName) throws Exception {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
        Future<T> future = executor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return work.call();
            } finally {
                MDC.clear();
            }
        });
        try {
            return future.get(timeoutSec, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        } finally {
            executor.shutdownNow();
        }
    }
}
