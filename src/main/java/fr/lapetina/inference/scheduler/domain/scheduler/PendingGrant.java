package fr.lapetina.inference.scheduler.domain.scheduler;

import fr.lapetina.inference.scheduler.domain.model.SchedulingRequest;
import fr.lapetina.inference.scheduler.domain.model.SchedulingResult;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * A suspended caller: the future it waits on plus what is needed to build its result.
 * Stored as the task of a queue entry; the queue manager owns it while queued.
 */
final class PendingGrant {

    private final SchedulingRequest request;
    private final String backendId;
    private final CompletableFuture<SchedulingResult> future;
    private volatile String entryId;
    private volatile int depthAtEnqueue;
    private volatile ScheduledFuture<?> timeoutTask;

    PendingGrant(SchedulingRequest request, String backendId, CompletableFuture<SchedulingResult> future) {
        this.request = request;
        this.backendId = backendId;
        this.future = future;
    }

    SchedulingRequest request() {
        return request;
    }

    String requestId() {
        return request.requestId();
    }

    String backendId() {
        return backendId;
    }

    CompletableFuture<SchedulingResult> future() {
        return future;
    }

    String entryId() {
        return entryId;
    }

    int depthAtEnqueue() {
        return depthAtEnqueue;
    }

    void queued(String entryId, int depthAtEnqueue) {
        this.entryId = entryId;
        this.depthAtEnqueue = depthAtEnqueue;
    }

    void armTimeout(ScheduledFuture<?> task) {
        this.timeoutTask = task;
        // Resolved before the task was armed
        if (future.isDone()) {
            task.cancel(false);
        }
    }

    void disarmTimeout() {
        ScheduledFuture<?> task = timeoutTask;
        if (task != null) {
            task.cancel(false);
        }
    }
}
