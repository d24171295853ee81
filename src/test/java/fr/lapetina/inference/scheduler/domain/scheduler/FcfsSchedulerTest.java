package fr.lapetina.inference.scheduler.domain.scheduler;

import fr.lapetina.inference.scheduler.domain.model.Backend;
import fr.lapetina.inference.scheduler.domain.model.Priority;
import fr.lapetina.inference.scheduler.domain.model.ProviderType;
import fr.lapetina.inference.scheduler.domain.model.ReleaseOutcome;
import fr.lapetina.inference.scheduler.domain.model.SchedulingRequest;
import fr.lapetina.inference.scheduler.domain.model.SchedulingResult;
import fr.lapetina.inference.scheduler.domain.model.SchedulingResult.Outcome;
import fr.lapetina.inference.scheduler.domain.queue.QueueState;
import fr.lapetina.inference.scheduler.infrastructure.capacity.AzureCapacityFacade;
import fr.lapetina.inference.scheduler.infrastructure.capacity.BackendRegistry;
import fr.lapetina.inference.scheduler.infrastructure.capacity.OllamaCapacityFacade;
import fr.lapetina.inference.scheduler.infrastructure.metrics.SchedulerMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class FcfsSchedulerTest {

    private BackendRegistry registry;
    private SchedulerMetrics metrics;
    private FcfsScheduler scheduler;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.systemUTC();
        registry = new BackendRegistry(List.of(new OllamaCapacityFacade(clock), new AzureCapacityFacade(clock, 5)));
        registry.register(Backend.builder().id("m1").providerType(ProviderType.OLLAMA).providerName("gpu")
                .maxConcurrentRequests(1).build());
        registry.register(Backend.builder().id("m2").providerType(ProviderType.OLLAMA).providerName("gpu")
                .maxConcurrentRequests(1).build());
        registry.register(Backend.builder().id("cloud").providerType(ProviderType.AZURE).providerName("azure")
                .maxConcurrentRequests(2).build());
        metrics = new SchedulerMetrics("fcfs_test");
        scheduler = new FcfsScheduler(registry, StarvationGuard.defaults(), metrics, clock,
                Duration.ofSeconds(5), Duration.ofMillis(20));
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
        metrics.close();
    }

    private static SchedulingRequest request(String id, String... candidates) {
        SchedulingRequest.Builder builder = SchedulingRequest.builder().requestId(id);
        for (String candidate : candidates) {
            builder.candidate(candidate);
        }
        return builder.build();
    }

    private int inFlight(String backendId) {
        return registry.facadeFor(backendId).orElseThrow().currentCapacity(backendId).inFlight();
    }

    @Test
    @DisplayName("should grant the first candidate with free capacity, in rank order")
    void shouldGrantFirstFreeCandidate() {
        SchedulingResult first = scheduler.schedule(request("r1", "m1", "m2")).join();
        SchedulingResult second = scheduler.schedule(request("r2", "m1", "m2")).join();

        assertThat(first.backendId()).isEqualTo("m1");
        assertThat(second.backendId()).isEqualTo("m2");
        assertThat(second.wasQueued()).isFalse();
    }

    @Test
    @DisplayName("should block the caller until a release frees a slot")
    void shouldBlockUntilRelease() throws Exception {
        scheduler.schedule(request("A", "m1")).join();

        CompletableFuture<SchedulingResult> blocked =
                CompletableFuture.supplyAsync(() -> scheduler.schedule(request("B", "m1")).join());
        Thread.sleep(150);
        assertThat(blocked).isNotDone();

        scheduler.release("m1", ReleaseOutcome.success("A", Duration.ofMillis(5)));

        SchedulingResult result = blocked.get(5, TimeUnit.SECONDS);
        assertThat(result.outcome()).isEqualTo(Outcome.GRANTED);
        assertThat(result.wasQueued()).isTrue();
        assertThat(result.queueWait()).isGreaterThanOrEqualTo(Duration.ofMillis(50));
        assertThat(inFlight("m1")).isEqualTo(1);
    }

    @Test
    @DisplayName("should time out when no candidate frees up before the deadline")
    void shouldTimeOut() {
        scheduler.schedule(request("A", "m1")).join();

        long start = System.nanoTime();
        SchedulingResult result = scheduler.schedule(SchedulingRequest.builder()
                .requestId("B").candidate("m1").timeout(Duration.ofMillis(150)).build()).join();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(result.outcome()).isEqualTo(Outcome.TIMED_OUT);
        assertThat(elapsedMs).isBetween(140L, 2000L);
        assertThat(inFlight("m1")).isEqualTo(1);
    }

    @Test
    @DisplayName("should keep no queue")
    void shouldKeepNoQueue() {
        scheduler.schedule(request("A", "m1")).join();

        assertThat(scheduler.queueDepth("m1")).isEqualTo(QueueState.EMPTY);
        assertThat(scheduler.queueMetrics()).isEqualTo(QueueMetrics.EMPTY);
        assertThat(scheduler.getName()).isEqualTo("fcfs");
    }

    @Test
    @DisplayName("should reject invalid requests without blocking")
    void shouldRejectInvalid() {
        assertThat(scheduler.schedule(request("r")).join().outcome()).isEqualTo(Outcome.REJECTED);
        assertThat(scheduler.schedule(request("r", "ghost")).join().outcome()).isEqualTo(Outcome.REJECTED);
    }

    @Test
    @DisplayName("should ignore a release without an outstanding grant")
    void shouldIgnoreSpuriousRelease() {
        scheduler.release("m1", ReleaseOutcome.of("nobody", ReleaseOutcome.Status.FAILURE));

        assertThat(inFlight("m1")).isZero();
        assertThat(scheduler.schedule(request("r", "m1")).join().isGranted()).isTrue();
    }

    @Test
    @DisplayName("should reject and keep the interrupt flag when the caller is interrupted")
    void shouldHandleInterrupt() throws Exception {
        scheduler.schedule(request("A", "m1")).join();
        AtomicReference<SchedulingResult> result = new AtomicReference<>();
        AtomicBoolean stillInterrupted = new AtomicBoolean();

        Thread caller = new Thread(() -> {
            result.set(scheduler.schedule(request("B", "m1")).join());
            stillInterrupted.set(Thread.currentThread().isInterrupted());
        });
        caller.start();
        Thread.sleep(100);
        caller.interrupt();
        caller.join(5000);

        assertThat(result.get().outcome()).isEqualTo(Outcome.REJECTED);
        assertThat(stillInterrupted).isTrue();
    }

    @Test
    @DisplayName("should wake blocked callers when a rate-limit update restores budget")
    void shouldWakeOnStatsUpdate() throws Exception {
        scheduler.updateProviderStats("cloud", Map.of(AzureCapacityFacade.HEADER_REMAINING_REQUESTS, "3"));

        CompletableFuture<SchedulingResult> blocked =
                CompletableFuture.supplyAsync(() -> scheduler.schedule(request("B", "cloud")).join());
        Thread.sleep(100);
        assertThat(blocked).isNotDone();

        scheduler.updateProviderStats("cloud", Map.of(AzureCapacityFacade.HEADER_REMAINING_REQUESTS, "50"));

        assertThat(blocked.get(5, TimeUnit.SECONDS).backendId()).isEqualTo("cloud");
    }

    @Test
    @DisplayName("should release blocked callers with a rejection on close")
    void shouldRejectOnClose() throws Exception {
        scheduler.schedule(request("A", "m1")).join();
        CompletableFuture<SchedulingResult> blocked =
                CompletableFuture.supplyAsync(() -> scheduler.schedule(request("B", "m1")).join());
        Thread.sleep(100);

        scheduler.close();

        assertThat(blocked.get(5, TimeUnit.SECONDS).outcome()).isEqualTo(Outcome.REJECTED);
    }

    @Test
    @DisplayName("should record priority on the result even though it does not affect order")
    void shouldCarryPriority() {
        SchedulingResult result = scheduler.schedule(SchedulingRequest.builder()
                .requestId("r").candidate("m1").priority(Priority.HIGH).build()).join();

        assertThat(result.priorityWhenScheduled()).isEqualTo(Priority.HIGH);
    }
}
