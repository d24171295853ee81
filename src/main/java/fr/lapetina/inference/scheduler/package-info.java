/**
 * Inference Scheduler - admission control for inference requests across heterogeneous model backends.
 *
 * <p>Given a ranked list of candidate backends and a priority, the scheduler grants a slot on
 * the first candidate with live capacity, or queues the request by priority until a slot frees,
 * with anti-starvation promotion and a per-request timeout.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.inference.scheduler.SchedulerFactory} - Main entry point for creating
 *       a fully-configured scheduler from YAML configuration</li>
 *   <li>{@link fr.lapetina.inference.scheduler.domain.scheduler.Scheduler} - The policy contract</li>
 *   <li>{@link fr.lapetina.inference.scheduler.domain.queue.PriorityQueueManager} - Per-backend
 *       multi-level queue</li>
 * </ul>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Utilization-aware and first-come-first-served policies</li>
 *   <li>Capacity facades for Ollama (slots, VRAM, keep-alive) and Azure (rate-limit headers)</li>
 *   <li>Hot-reload of starvation thresholds</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.inference.scheduler.SchedulerFactory
 */
package fr.lapetina.inference.scheduler;
