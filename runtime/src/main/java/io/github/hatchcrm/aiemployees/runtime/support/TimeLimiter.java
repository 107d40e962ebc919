package io.github.hatchcrm.aiemployees.runtime.support;

import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a blocking call on a worker thread and waits at most the given duration for it.
 * On timeout the worker is interrupted and {@link TimeoutException} is thrown to the caller.
 * Unchecked exceptions from the call are rethrown as-is.
 */
@Component
public class TimeLimiter implements DisposableBean {

    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "ai-bounded-call");
        t.setDaemon(true);
        return t;
    });

    public <T> T call(Callable<T> task, Duration timeout) throws TimeoutException {
        Future<T> future = executor.submit(task);
        try {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                return future.get();
            }
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for bounded call", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) throw runtime;
            if (cause instanceof Error error) throw error;
            throw new CompletionException(cause);
        }
    }

    @Override
    public void destroy() {
        executor.shutdownNow();
    }
}
