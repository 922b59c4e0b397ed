package com.arcdispatch.coordinator;

import com.arcdispatch.AppLogger;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.ToIntFunction;

/**
 * Per-provider admission gate. Each provider id owns a fair semaphore, so waiters are admitted
 * in arrival order and different providers never wait on each other. Model ids play no part.
 */
public class ProviderSlotCoordinator {

    public static final int DEFAULT_PERMITS = 1;

    private final Map<String, Slot> slots = new ConcurrentHashMap<>();
    private final ToIntFunction<String> permitsForProvider;
    private final AppLogger logger = AppLogger.get();

    public ProviderSlotCoordinator() {
        this(providerId -> DEFAULT_PERMITS);
    }

    /**
     * @param permitsForProvider permit count per provider id; values below 1 are treated as 1
     */
    public ProviderSlotCoordinator(ToIntFunction<String> permitsForProvider) {
        this.permitsForProvider = permitsForProvider;
    }

    /**
     * Block until a permit for {@code providerId} is free. If interrupted while waiting nothing
     * is held and the interrupt is rethrown.
     */
    public SlotTicket admit(String providerId) throws InterruptedException {
        Slot slot = slotFor(providerId);
        try {
            slot.semaphore.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }
        slot.inFlight.incrementAndGet();
        return new SlotTicket(this, slot.providerId);
    }

    /**
     * Idempotent; releasing the same ticket twice frees one permit.
     */
    public void release(SlotTicket ticket) {
        if (ticket != null) {
            ticket.close();
        }
    }

    void releaseSlot(String providerId) {
        Slot slot = slots.get(providerId);
        if (slot == null) {
            logger.warn("[ProviderSlotCoordinator] Release for unknown provider " + providerId);
            return;
        }
        slot.inFlight.decrementAndGet();
        slot.semaphore.release();
    }

    public int getInFlight(String providerId) {
        Slot slot = slots.get(normalize(providerId));
        return slot == null ? 0 : slot.inFlight.get();
    }

    public int getWaiting(String providerId) {
        Slot slot = slots.get(normalize(providerId));
        return slot == null ? 0 : slot.semaphore.getQueueLength();
    }

    public int getAvailablePermits(String providerId) {
        Slot slot = slots.get(normalize(providerId));
        return slot == null ? resolvePermits(normalize(providerId)) : slot.semaphore.availablePermits();
    }

    public int getPermits(String providerId) {
        Slot slot = slots.get(normalize(providerId));
        return slot == null ? resolvePermits(normalize(providerId)) : slot.permits;
    }

    private Slot slotFor(String providerId) {
        if (providerId == null || providerId.isBlank()) {
            throw new IllegalArgumentException("providerId is required");
        }
        String key = normalize(providerId);
        return slots.computeIfAbsent(key, k -> new Slot(k, resolvePermits(k)));
    }

    private int resolvePermits(String key) {
        return Math.max(1, permitsForProvider.applyAsInt(key));
    }

    private static String normalize(String providerId) {
        return providerId == null ? "" : providerId.trim().toLowerCase(Locale.ROOT);
    }

    private static final class Slot {
        final String providerId;
        final int permits;
        final Semaphore semaphore;
        final AtomicInteger inFlight = new AtomicInteger();

        Slot(String providerId, int permits) {
            this.providerId = providerId;
            this.permits = permits;
            this.semaphore = new Semaphore(permits, true);
        }
    }
}
