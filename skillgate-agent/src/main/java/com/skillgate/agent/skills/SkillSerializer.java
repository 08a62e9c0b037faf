package com.skillgate.agent.skills;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Serializes tasks by key: only one task per key runs at a time, later calls
 * with the same key queue behind the current one. Tasks with different keys
 * run independently.
 */
public final class SkillSerializer {

    private final Map<String, CompletableFuture<?>> queue = new ConcurrentHashMap<>();
    private final Executor executor;

    public SkillSerializer() {
        this(ForkJoinPool.commonPool());
    }

    public SkillSerializer(Executor executor) {
        this.executor = executor;
    }

    /**
     * Run {@code task} once every earlier task for {@code key} has finished,
     * successfully or not. A checked exception from the task completes the
     * returned future exceptionally with that exception as cause.
     */
    public <T> CompletableFuture<T> serializeByKey(String key, Callable<T> task) {
        CompletableFuture<T> next;
        synchronized (queue) {
            CompletableFuture<?> prev = queue.getOrDefault(key, CompletableFuture.completedFuture(null));
            next = prev
                    .handle((ignored, ex) -> null) // always proceed, even on failure
                    .thenApplyAsync(ignored -> call(task), executor);
            queue.put(key, next);
        }
        CompletableFuture<T> tail = next;
        return next.whenComplete((result, ex) -> queue.remove(key, tail));
    }

    /** Number of keys with queued or running work. */
    public int pendingKeys() {
        return queue.size();
    }

    private static <T> T call(Callable<T> task) {
        try {
            return task.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }
}
