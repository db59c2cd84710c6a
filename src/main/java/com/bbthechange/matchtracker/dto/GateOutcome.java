package com.bbthechange.matchtracker.dto;

/**
 * Counts from one NotificationGate pass over an event.
 *
 * @param notified        matches marked notified in this pass
 * @param withheld        results held back by the completeness gate
 * @param deliveryPending complete results left unmarked because a group did not acknowledge
 */
public record GateOutcome(int notified, int withheld, int deliveryPending) {

    public static GateOutcome empty() {
        return new GateOutcome(0, 0, 0);
    }
}
