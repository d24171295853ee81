/**
 * Value objects exchanged between the orchestrator, the schedulers and the capacity facades.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.inference.scheduler.domain.model.SchedulingRequest} - Ranked candidates, priority and timeout</li>
 *   <li>{@link fr.lapetina.inference.scheduler.domain.model.SchedulingResult} - Granted, timed out or rejected</li>
 *   <li>{@link fr.lapetina.inference.scheduler.domain.model.Priority} - LOW, NORMAL, HIGH</li>
 *   <li>{@link fr.lapetina.inference.scheduler.domain.model.Backend} - One model deployment</li>
 *   <li>{@link fr.lapetina.inference.scheduler.domain.model.CapacitySnapshot} - Live capacity of a backend</li>
 * </ul>
 *
 * <p>All classes here are immutable.
 */
package fr.lapetina.inference.scheduler.domain.model;
