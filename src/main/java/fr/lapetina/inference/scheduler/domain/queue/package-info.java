/**
 * Per-backend multi-level priority queue shared by the scheduling policies.
 *
 * <p>{@link fr.lapetina.inference.scheduler.domain.queue.PriorityQueueManager} is a closed data
 * structure: it never performs I/O, never calls back into a scheduler and never escalates an
 * entry on its own. Escalation triggers and selection live one layer up, in
 * {@code fr.lapetina.inference.scheduler.domain.scheduler}.
 */
package fr.lapetina.inference.scheduler.domain.queue;
