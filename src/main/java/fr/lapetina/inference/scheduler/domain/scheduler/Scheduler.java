package fr.lapetina.inference.scheduler.domain.scheduler;

import fr.lapetina.inference.scheduler.domain.model.ReleaseOutcome;
import fr.lapetina.inference.scheduler.domain.model.SchedulingRequest;
import fr.lapetina.inference.scheduler.domain.model.SchedulingResult;
import fr.lapetina.inference.scheduler.domain.queue.QueueState;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Admission-control policy for inference requests.
 *
 * Implementations must be thread-safe. Every GRANTED result must be paired
 * with exactly one {@link #release} call for the same backend.
 */
public interface Scheduler extends AutoCloseable {

    /**
     * Returns the policy name used in configuration.
     */
    String getName();

    /**
     * Decides where a request runs.
     *
     * The returned future completes with GRANTED, TIMED_OUT or REJECTED; it never
     * completes exceptionally. Cancelling it withdraws a queued request.
     *
     * @param request ranked candidates, priority and optional timeout
     * @return the decision, possibly not yet completed when the request had to queue
     */
    CompletableFuture<SchedulingResult> schedule(SchedulingRequest request);

    /**
     * Hands back a slot obtained from {@link #schedule}. Wakes at most one waiter.
     * Never blocks. A release with no outstanding grant is logged and ignored.
     */
    void release(String backendId, ReleaseOutcome outcome);

    QueueState queueDepth(String backendId);

    /**
     * Aggregate view over all backend queues.
     */
    QueueMetrics queueMetrics();

    /**
     * Ingests live capacity information, keyed either by backend id (e.g. rate-limit
     * headers of one deployment) or by provider name (e.g. VRAM of an Ollama host).
     */
    void updateProviderStats(String providerId, Map<String, String> stats);

    @Override
    void close();
}
