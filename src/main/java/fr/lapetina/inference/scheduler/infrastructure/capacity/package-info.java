/**
 * Capacity-reporting facades, one per provider family, and the backend registry that
 * dispatches to them.
 *
 * <h2>Provider Families</h2>
 * <table border="1">
 *   <tr><th>Facade</th><th>Capacity bound</th><th>Fed by</th></tr>
 *   <tr><td>{@link fr.lapetina.inference.scheduler.infrastructure.capacity.OllamaCapacityFacade}</td>
 *       <td>Parallel slots, VRAM headroom for cold models</td><td>{@code /api/ps} poller</td></tr>
 *   <tr><td>{@link fr.lapetina.inference.scheduler.infrastructure.capacity.AzureCapacityFacade}</td>
 *       <td>Local concurrency cap, remaining request budget</td><td>Response rate-limit headers</td></tr>
 * </table>
 *
 * <p>Facades answer from memory and never block; slot reservation is atomic per backend.
 */
package fr.lapetina.inference.scheduler.infrastructure.capacity;
