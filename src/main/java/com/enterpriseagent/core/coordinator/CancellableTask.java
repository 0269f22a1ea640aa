package com.enterpriseagent.core.coordinator;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.function.Supplier;

/**
 * Runs adapter work on an executor behind a {@link CompletableFuture} whose
 * {@code cancel(true)} interrupts the worker thread.
 * <p>
 * {@link CompletableFuture#supplyAsync(Supplier, Executor)} only marks the
 * future as cancelled and lets the work run on.
 */
final class CancellableTask<T> extends CompletableFuture<T> {

    private final FutureTask<Void> task;

    private CancellableTask(Supplier<T> work) {
        this.task = new FutureTask<>(() -> {
            try {
                complete(work.get());
            } catch (Throwable t) {
                completeExceptionally(t);
            }
            return null;
        });
    }

    static <T> CompletableFuture<T> supply(Supplier<T> work, Executor executor) {
        var future = new CancellableTask<T>(work);
        executor.execute(future.task);
        return future;
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        boolean cancelled = super.cancel(mayInterruptIfRunning);
        task.cancel(mayInterruptIfRunning);
        return cancelled;
    }
}
