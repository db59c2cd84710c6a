package com.bbthechange.matchtracker.repository;

import com.bbthechange.matchtracker.model.Subscription;

import java.util.List;
import java.util.Optional;

/**
 * Durable store of group subscriptions to events.
 */
public interface SubscriptionRepository {

    /**
     * Create or wholly replace the subscription of a group to an event.
     */
    Subscription save(Subscription subscription);

    Optional<Subscription> find(String groupId, String eventId);

    /**
     * Delete a subscription.
     *
     * @return true if a subscription existed
     */
    boolean delete(String groupId, String eventId);

    List<Subscription> findByEventId(String eventId);

    List<Subscription> findAll();
}
