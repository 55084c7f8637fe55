package com.cashflow.session;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Strict FIFO execution per room. Each room gets its own single-thread executor, so tasks for
 * one room run one at a time in submission order while different rooms run in parallel.
 */
@Component
@Slf4j
public class RoomActionQueue {

    private final ConcurrentHashMap<String, ExecutorService> executors = new ConcurrentHashMap<>();
    private final Set<String> closedRooms = ConcurrentHashMap.newKeySet();

    /**
     * Queues {@code task} behind the room's earlier tasks. Once the room is closed the returned
     * future fails with {@link IllegalStateException} and no executor is created.
     */
    public <T> CompletableFuture<T> submit(String roomId, Supplier<T> task) {
        if (closedRooms.contains(roomId)) {
            return closed(roomId);
        }
        ExecutorService executor = executors.computeIfAbsent(roomId, id -> {
            log.debug("Opening action queue for room {}", id);
            return Executors.newSingleThreadExecutor(r -> {
                Thread thread = new Thread(r, "room-" + id);
                thread.setDaemon(true);
                return thread;
            });
        });
        // close() may have run between the check and the lookup
        if (closedRooms.contains(roomId)) {
            if (executors.remove(roomId, executor)) {
                executor.shutdown();
            }
            return closed(roomId);
        }
        try {
            return CompletableFuture.supplyAsync(task, executor);
        } catch (RejectedExecutionException e) {
            return closed(roomId);
        }
    }

    /**
     * Lets already queued tasks finish and stops accepting new ones for the room.
     */
    public void close(String roomId) {
        closedRooms.add(roomId);
        ExecutorService executor = executors.remove(roomId);
        if (executor != null) {
            executor.shutdown();
            log.debug("Closed action queue for room {}", roomId);
        }
    }

    public boolean isOpen(String roomId) {
        return executors.containsKey(roomId);
    }

    private static <T> CompletableFuture<T> closed(String roomId) {
        log.warn("Rejected action for closed room {}", roomId);
        return CompletableFuture.failedFuture(new IllegalStateException("Action queue closed for room " + roomId));
    }

    @PreDestroy
    public void shutdown() {
        executors.values().forEach(ExecutorService::shutdown);
        executors.clear();
    }
}
