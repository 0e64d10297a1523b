/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;

/**
 * Tracks asynchronous lifecycle tasks, one per document, allowing for
 * cancellation of a pending task when a new one is scheduled.
 *
 * <p>Tasks are debounced: a task only starts once its delay has passed
 * without another task being scheduled for the same document. A task
 * cancelled before it starts never runs. Once started, it runs to
 * completion.
 */
final class DocumentLifecycleManager {
    private final Map<String, CompletableFuture<Void>> tasks = new ConcurrentHashMap<>();

    CompletableFuture<Void> getTask(String uri) {
        return tasks.get(uri);
    }

    void cancelTask(String uri) {
        CompletableFuture<Void> task = tasks.remove(uri);
        if (task != null && !task.isDone()) {
            task.cancel(true);
        }
    }

    /**
     * Cancels the pending task of a document, and schedules a new one.
     *
     * @param uri The URI of the document
     * @param delayMillis How long to wait before running the task
     * @param task The task to run
     * @return The scheduled task
     */
    CompletableFuture<Void> schedule(String uri, long delayMillis, Runnable task) {
        Executor executor = delayMillis > 0
                ? CompletableFuture.delayedExecutor(delayMillis, TimeUnit.MILLISECONDS)
                : ForkJoinPool.commonPool();
        CompletableFuture<Void> future = new CompletableFuture<>();
        // Registered before it can run, so a finished task can remove itself
        CompletableFuture<Void> previous = tasks.put(uri, future);
        if (previous != null && !previous.isDone()) {
            previous.cancel(true);
        }
        executor.execute(() -> {
            if (future.isDone()) {
                return;
            }
            try {
                task.run();
                future.complete(null);
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            } finally {
                tasks.remove(uri, future);
            }
        });
        return future;
    }

    void cancelAllTasks() {
        for (CompletableFuture<Void> task : tasks.values()) {
            task.cancel(true);
        }
        tasks.clear();
    }

    void waitForAllTasks() throws ExecutionException, InterruptedException {
        for (CompletableFuture<Void> task : tasks.values()) {
            if (!task.isDone()) {
                task.get();
            }
        }
    }
}
