/**
 * YAML configuration for the scheduler, loaded with SnakeYAML.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * scheduler:
 *   type: utilization
 *   defaultQueueTimeoutMs: 300000
 * starvation:
 *   lowThresholdMs: 10000
 *   normalThresholdMs: 30000
 *   sweepMode: both
 * providers:
 *   - name: gpu-1
 *     type: ollama
 *     url: http://gpu-1:11434
 *     totalVramMb: 24576
 * backends:
 *   - id: llama3-gpu-1
 *     provider: gpu-1
 *     model: llama3:8b
 *     maxConcurrentRequests: 4
 *     requiredVramMb: 6000
 * }</pre>
 *
 * <p>Only the starvation thresholds take effect on reload; other changes need a restart.
 */
package fr.lapetina.inference.scheduler.infrastructure.config;
