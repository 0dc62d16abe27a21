package dev.flowdoctor.refine;

import dev.flowdoctor.backend.ExternalServiceException;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs one collaborator call at a time on a dedicated thread, with a per-call timeout. Failures
 * arrive as {@link ExternalServiceException}; nothing is retried here. A call that times out
 * takes its thread with it, so the next call starts on a fresh one.
 */
public final class ExternalCallRunner implements AutoCloseable {

    private final Supplier<ExecutorService> executors;
    private ExecutorService executor;

    public ExternalCallRunner() {
        this(() -> Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "flow-doctor-external-call");
            thread.setDaemon(true);
            return thread;
        }));
    }

    ExternalCallRunner(Supplier<ExecutorService> executors) {
        this.executors = executors;
        this.executor = executors.get();
    }

    public <T> T call(String service, Duration timeout, Supplier<T> call) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(call, executor);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            executor.shutdownNow();
            executor = executors.get();
            throw new ExternalServiceException(service, null, "timed out after " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExternalServiceException external) {
                throw external;
            }
            throw new ExternalServiceException(service, null, String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExternalServiceException(service, null, "interrupted", e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
