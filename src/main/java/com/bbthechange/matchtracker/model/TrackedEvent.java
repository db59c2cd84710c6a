package com.bbthechange.matchtracker.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * All subscriptions for one event folded into a single view.
 * Dates come from the most recently updated subscription.
 */
@Data
@AllArgsConstructor
public class TrackedEvent {

    private String eventId;
    private String title;
    private String startDate;
    private String endDate;
    private Set<String> groupIds;

    public static TrackedEvent fromSubscriptions(List<Subscription> subscriptions) {
        if (subscriptions == null || subscriptions.isEmpty()) {
            throw new IllegalArgumentException("At least one subscription is required");
        }
        Subscription latest = subscriptions.stream()
                .max(Comparator.comparing(Subscription::getUpdatedAt,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .orElseThrow();

        Set<String> groups = new TreeSet<>();
        for (Subscription subscription : subscriptions) {
            groups.add(subscription.getGroupId());
        }
        return new TrackedEvent(latest.getEventId(), latest.getTitle(),
                latest.getStartDate(), latest.getEndDate(), groups);
    }
}
