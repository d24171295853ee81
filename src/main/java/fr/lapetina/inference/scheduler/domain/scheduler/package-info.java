/**
 * Scheduling policies and the logic they share.
 *
 * <h2>Policies</h2>
 * <table border="1">
 *   <tr><th>Name</th><th>Class</th><th>When saturated</th></tr>
 *   <tr><td>utilization</td><td>{@link fr.lapetina.inference.scheduler.domain.scheduler.UtilizationAwareScheduler}</td>
 *       <td>Queues on the first-ranked backend, by priority, with timeout</td></tr>
 *   <tr><td>fcfs</td><td>{@link fr.lapetina.inference.scheduler.domain.scheduler.FcfsScheduler}</td>
 *       <td>Blocks the calling thread until any candidate frees up</td></tr>
 * </table>
 *
 * <h2>Request Lifecycle (utilization)</h2>
 * <pre>
 * EVALUATING ──capacity──► GRANTED ──release()──► slot freed or handed to next waiter
 *      │
 *      └──saturated──► QUEUED ──release() / stats──► GRANTED
 *                         ├──deadline──► TIMED_OUT
 *                         └──cancel()──► withdrawn
 * </pre>
 *
 * <h2>Anti-Starvation</h2>
 * <p>{@link fr.lapetina.inference.scheduler.domain.scheduler.StarvationGuard} promotes entries
 * waiting past their level's threshold by one level per sweep. Sweeps run on release, on a
 * period, or both, per {@link fr.lapetina.inference.scheduler.domain.scheduler.SweepMode}.
 */
package fr.lapetina.inference.scheduler.domain.scheduler;
