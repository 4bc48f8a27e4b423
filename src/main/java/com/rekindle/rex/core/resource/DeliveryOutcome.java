package com.rekindle.rex.core.resource;

/**
 * Delivery feedback reported by the channel adapters for a sending domain.
 * <p>
 * {@code signal} is the reputation value the outcome pulls towards; {@code weight} scales how
 * hard it pulls.
 */
public enum DeliveryOutcome {
    DELIVERED(1.0, 1.0),
    SOFT_BOUNCE(0.5, 1.0),
    HARD_BOUNCE(0.0, 1.0),
    COMPLAINT(0.0, 3.0);

    private final double signal;
    private final double weight;

    DeliveryOutcome(double signal, double weight) {
        this.signal = signal;
        this.weight = weight;
    }

    public double signal() {
        return signal;
    }

    public double weight() {
        return weight;
    }
}
