package fr.lapetina.inference.scheduler.domain.scheduler;

/**
 * When the anti-starvation sweep runs.
 */
public enum SweepMode {
    /** On every release, before the next waiter is picked. */
    ON_RELEASE,
    /** On a fixed period, from a background thread. */
    PERIODIC,
    BOTH;

    public boolean sweepsOnRelease() {
        return this == ON_RELEASE || this == BOTH;
    }

    public boolean sweepsPeriodically() {
        return this == PERIODIC || this == BOTH;
    }

    /**
     * Parses a configuration value ("on-release", "periodic", "both"), case-insensitive.
     */
    public static SweepMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return BOTH;
        }
        return switch (value.trim().toLowerCase().replace('-', '_')) {
            case "on_release", "eager" -> ON_RELEASE;
            case "periodic" -> PERIODIC;
            case "both" -> BOTH;
            default -> throw new IllegalArgumentException("Unknown sweep mode: " + value);
        };
    }
}
