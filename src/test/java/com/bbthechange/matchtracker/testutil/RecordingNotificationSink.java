package com.bbthechange.matchtracker.testutil;

import com.bbthechange.matchtracker.dto.NotificationPayload;
import com.bbthechange.matchtracker.model.NotificationCategory;
import com.bbthechange.matchtracker.service.NotificationSink;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Sink that records deliveries. Groups added with {@link #failFor(String)} reject deliveries.
 */
public class RecordingNotificationSink implements NotificationSink {

    public record Delivery(String groupId, NotificationPayload payload) {
    }

    private final List<Delivery> deliveries = new ArrayList<>();
    private final Set<String> failingGroups = new HashSet<>();

    @Override
    public boolean deliver(String groupId, NotificationPayload payload) {
        if (failingGroups.contains(groupId)) {
            return false;
        }
        deliveries.add(new Delivery(groupId, payload));
        return true;
    }

    public void failFor(String groupId) {
        failingGroups.add(groupId);
    }

    public void recover(String groupId) {
        failingGroups.remove(groupId);
    }

    public List<Delivery> getDeliveries() {
        return deliveries;
    }

    public List<Delivery> deliveriesOf(NotificationCategory category) {
        return deliveries.stream()
                .filter(delivery -> delivery.payload().getCategory() == category)
                .toList();
    }
}
