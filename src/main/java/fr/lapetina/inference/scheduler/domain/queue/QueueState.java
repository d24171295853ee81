package fr.lapetina.inference.scheduler.domain.queue;

import fr.lapetina.inference.scheduler.domain.model.Priority;

/**
 * Queue depth of one backend broken down by priority level. Read-only snapshot.
 */
public record QueueState(int low, int normal, int high) {

    public static final QueueState EMPTY = new QueueState(0, 0, 0);

    public QueueState {
        if (low < 0 || normal < 0 || high < 0) {
            throw new IllegalArgumentException("Queue depths must not be negative");
        }
    }

    public int total() {
        return low + normal + high;
    }

    public int count(Priority priority) {
        return switch (priority) {
            case LOW -> low;
            case NORMAL -> normal;
            case HIGH -> high;
        };
    }

    public boolean isEmpty() {
        return total() == 0;
    }

    @Override
    public String toString() {
        return "QueueState{low=" + low + ", normal=" + normal + ", high=" + high + ", total=" + total() + '}';
    }
}
