package com.arcdispatch.coordinator;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Proof of admission for one provider slot. Closing it frees the permit exactly once.
 */
public final class SlotTicket implements AutoCloseable {

    private final ProviderSlotCoordinator owner;
    private final String providerId;
    private final long admittedAt;
    private final AtomicBoolean released = new AtomicBoolean(false);

    SlotTicket(ProviderSlotCoordinator owner, String providerId) {
        this.owner = owner;
        this.providerId = providerId;
        this.admittedAt = System.currentTimeMillis();
    }

    public String getProviderId() {
        return providerId;
    }

    public long getAdmittedAt() {
        return admittedAt;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            owner.releaseSlot(providerId);
        }
    }
}
