package fr.lapetina.inference.scheduler.infrastructure.capacity;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded in-flight counter for one backend. Lock-free via CAS.
 */
final class SlotCounter {

    private final int maxSlots;
    private final AtomicInteger inFlight = new AtomicInteger(0);

    SlotCounter(int maxSlots) {
        this.maxSlots = maxSlots;
    }

    int getMaxSlots() {
        return maxSlots;
    }

    int getInFlight() {
        return inFlight.get();
    }

    int getFree() {
        return Math.max(0, maxSlots - inFlight.get());
    }

    /**
     * @return true if a slot was taken, false if at capacity
     */
    boolean tryAcquire() {
        while (true) {
            int current = inFlight.get();
            if (current >= maxSlots) {
                return false;
            }
            if (inFlight.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /**
     * Gives a slot back, clamping at zero.
     *
     * @return false if nothing was outstanding
     */
    boolean release() {
        while (true) {
            int current = inFlight.get();
            if (current <= 0) {
                return false;
            }
            if (inFlight.compareAndSet(current, current - 1)) {
                return true;
            }
        }
    }
}
