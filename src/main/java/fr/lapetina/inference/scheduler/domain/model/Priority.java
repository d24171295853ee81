package fr.lapetina.inference.scheduler.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * Priority classes for scheduling requests.
 *
 * Strictly ordered by numeric weight: LOW=1, NORMAL=5, HIGH=10.
 */
public enum Priority {
    LOW(1),
    NORMAL(5),
    HIGH(10);

    /** Dequeue order: highest weight first. */
    public static final List<Priority> DESCENDING = List.of(HIGH, NORMAL, LOW);

    private final int weight;

    Priority(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }

    public boolean isHigherThan(Priority other) {
        return weight > other.weight;
    }

    /**
     * Returns the next level up, or empty for HIGH.
     */
    public Optional<Priority> next() {
        return switch (this) {
            case LOW -> Optional.of(NORMAL);
            case NORMAL -> Optional.of(HIGH);
            case HIGH -> Optional.empty();
        };
    }

    /**
     * Maps a numeric weight to a priority. Unrecognized values map to NORMAL.
     */
    public static Priority fromInt(int value) {
        for (Priority priority : values()) {
            if (priority.weight == value) {
                return priority;
            }
        }
        return NORMAL;
    }

    /**
     * Maps a priority name (case-insensitive) to a priority.
     * Accepts the short forms and aliases clients commonly send;
     * anything unrecognized maps to NORMAL.
     */
    public static Priority fromString(String value) {
        if (value == null) {
            return NORMAL;
        }
        return switch (value.trim().toLowerCase()) {
            case "low", "l" -> LOW;
            case "high", "critical", "h", "c" -> HIGH;
            default -> NORMAL;
        };
    }
}
